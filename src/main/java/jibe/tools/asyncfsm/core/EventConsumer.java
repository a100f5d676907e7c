package jibe.tools.asyncfsm.core;

import com.google.common.base.Optional;
import com.google.common.util.concurrent.AbstractExecutionThreadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static java.util.Objects.requireNonNull;

/**
 * Single consumer of an {@link EventChannel}: takes events one by one on its own thread and hands each to a
 * {@link Receiver} until the channel is closed. A consumer serves one run; it cannot be restarted.
 * <p>
 * Anything the receiver throws ends the loop and leaves the service {@link State#FAILED}.
 */
final class EventConsumer<E> extends AbstractExecutionThreadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventConsumer.class);

    private final String name;
    private final EventChannel<E> channel;
    private final ThreadFactory threadFactory;
    private final Receiver<E> receiver;
    private volatile Thread consumerThread;

    EventConsumer(String name, EventChannel<E> channel, ThreadFactory threadFactory, Receiver<E> receiver) {
        this.name = requireNonNull(name);
        this.channel = requireNonNull(channel);
        this.threadFactory = requireNonNull(threadFactory);
        this.receiver = requireNonNull(receiver);
        addListener(new Listener() {
            @Override
            public void terminated(State from) {
                LOGGER.info("{}: event consumer stopped", EventConsumer.this.name);
            }

            @Override
            public void failed(State from, Throwable failure) {
                LOGGER.error("{}: event consumer died while {}", EventConsumer.this.name, from, failure);
            }
        }, directExecutor());
    }

    EventChannel<E> getChannel() {
        return channel;
    }

    boolean isConsumerThread() {
        return Thread.currentThread() == consumerThread;
    }

    /**
     * Guava renames the running thread to this name, so it is the name the thread factory gave it.
     */
    @Override
    protected String serviceName() {
        Thread thread = consumerThread;
        return thread != null ? thread.getName() : name + "-consumer";
    }

    @Override
    protected Executor executor() {
        return new Executor() {
            @Override
            public void execute(Runnable command) {
                Thread thread = threadFactory.newThread(command);
                consumerThread = thread;
                thread.start();
            }
        };
    }

    @Override
    protected void startUp() {
        LOGGER.info("{}: starting event consumer", name);
    }

    @Override
    protected void run() throws Exception {
        while (isRunning()) {
            Optional<E> event = channel.receive();
            if (!event.isPresent()) {
                LOGGER.debug("{}: channel closed, leaving main-loop", name);
                return;
            }
            LOGGER.debug("{}: event {} received", name, event.get());
            receiver.onReceive(event.get());
        }
        LOGGER.debug("{}: leaving main-loop", name);
    }

    @Override
    protected void triggerShutdown() {
        LOGGER.debug("{}: triggerShutdown", name);
        channel.close();
    }

    /**
     *
     */
    interface Receiver<E> {
        void onReceive(E event) throws Exception;
    }
}
