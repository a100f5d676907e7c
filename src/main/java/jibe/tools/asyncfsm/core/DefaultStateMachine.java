package jibe.tools.asyncfsm.core;

import com.google.common.base.Optional;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jibe.tools.asyncfsm.api.Action;
import jibe.tools.asyncfsm.api.Controller;
import jibe.tools.asyncfsm.api.EventHandler;
import jibe.tools.asyncfsm.api.ExceptionCallback;
import jibe.tools.asyncfsm.api.StateMachine;
import jibe.tools.asyncfsm.api.TransitionCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Asynchronous {@link StateMachine} driven by one {@link EventConsumer} per run.
 * <p>
 * For every event received, the consumer looks up a transition for the current state, runs its handlers in
 * order, fires the transition callback, moves the current state and then either stops (failure or
 * {@link Action#FINISH}) or forwards the next event triggered through the {@link Controller}. A failing handler
 * stops the remaining handlers and suppresses the transition callback, but the state still moves to the
 * transition's target.
 */
public class DefaultStateMachine<S, E, SE, C> implements StateMachine<S, E, SE, C> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultStateMachine.class);

    private final String name;
    private final S initialState;
    private final TransitionTable<S, E, SE, C> transitionTable;
    private final TransitionCallback<S, E, SE, C> onTransition;
    private final ExceptionCallback<S, E, C> onException;
    private final Configuration configuration;

    private final AtomicReference<S> currentState = new AtomicReference<>();
    private final AtomicBoolean failed = new AtomicBoolean();
    private final BlockingQueue<E> pending = new LinkedBlockingQueue<>();
    private final Controller<E> controller;
    private final Object lifecycleLock = new Object();

    private volatile C context;
    private volatile EventConsumer<E> consumer;

    public DefaultStateMachine(String name, S initialState, TransitionTable<S, E, SE, C> transitionTable,
                               TransitionCallback<S, E, SE, C> onTransition, ExceptionCallback<S, E, C> onException,
                               Configuration configuration) {
        this.name = requireNonNull(name);
        this.initialState = requireNonNull(initialState);
        this.transitionTable = requireNonNull(transitionTable);
        this.onTransition = requireNonNull(onTransition);
        this.onException = requireNonNull(onException);
        this.configuration = DefaultConfiguration.defaults(name).merge(configuration);
        this.controller = new DefaultController<>(name, pending);
        this.currentState.set(initialState);
        this.consumer = newConsumer(new EventChannel<E>());
    }

    public static ConfigurationBuilder configurationBuilder() {
        return new ConfigurationBuilder();
    }

    /**
     * Default transition callback: logs the side effect.
     */
    public static <S, E, SE, C> TransitionCallback<S, E, SE, C> loggingTransitionCallback(final String name) {
        return new TransitionCallback<S, E, SE, C>() {
            @Override
            public void onTransition(S from, E event, S to, SE effect, C context) {
                LOGGER.info("{}: {} -[{}]-> {} with side effect {}", name, from, event, to, effect);
            }
        };
    }

    /**
     * Default exception callback: logs the failure.
     */
    public static <S, E, C> ExceptionCallback<S, E, C> loggingExceptionCallback(final String name) {
        return new ExceptionCallback<S, E, C>() {
            @Override
            public void onException(C context, S state, E event, Exception failure) {
                LOGGER.error("State machine {} failed in state {} on event {} with no exception handlers",
                        name, state, event, failure);
            }
        };
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public S getInitialState() {
        return initialState;
    }

    @Override
    public S getCurrentState() {
        return currentState.get();
    }

    public TransitionTable<S, E, SE, C> getTransitionTable() {
        return transitionTable;
    }

    @Override
    public Configuration getConfiguration() {
        return configuration;
    }

    @Override
    public void start(E event, C context) {
        requireNonNull(event, "event");
        requireNonNull(context, "context");
        checkNotConsumerThread("start");
        synchronized (lifecycleLock) {
            EventConsumer<E> current = consumer;
            checkState(!current.getChannel().isClosed(),
                    "event channel of %s is closed, use reset to run it again", name);
            checkState(current.state() == Service.State.NEW, "%s is already started (%s)", name, current.state());

            LOGGER.info("{}: starting on event {}", name, event);
            this.context = context;
            failed.set(false);
            pending.clear();
            current.startAsync().awaitRunning();
            current.getChannel().send(event);
        }
    }

    @Override
    public void finish() {
        checkNotConsumerThread("finish");
        synchronized (lifecycleLock) {
            LOGGER.info("{}: finishing machine", name);
            EventConsumer<E> current = consumer;
            current.getChannel().close();
            current.stopAsync();
            try {
                current.awaitTerminated(configuration.getStopTimeoutMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new IllegalStateException("event consumer of " + name + " did not stop within "
                        + configuration.getStopTimeoutMillis() + " ms", e);
            } catch (IllegalStateException e) {
                LOGGER.warn("{}: event consumer had already failed", name, current.failureCause());
            }
            currentState.set(initialState);
        }
    }

    @Override
    public void reset(E event, C context) {
        checkNotConsumerThread("reset");
        synchronized (lifecycleLock) {
            finish();
            LOGGER.info("{}: resetting state machine", name);
            consumer = newConsumer(new EventChannel<E>());
            start(event, context);
        }
    }

    @Override
    public boolean isRunning() {
        return consumer.isRunning();
    }

    @Override
    public boolean awaitStop(long timeout, TimeUnit unit) {
        EventConsumer<E> current = consumer;
        if (current.state() == Service.State.NEW) {
            return true;
        }
        try {
            current.awaitTerminated(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (IllegalStateException e) {
            // FAILED is a stopped consumer as well
            return true;
        }
    }

    @Override
    public Optional<Throwable> getConsumerFailure() {
        EventConsumer<E> current = consumer;
        if (current.state() == Service.State.FAILED) {
            return Optional.of(current.failureCause());
        }
        return Optional.absent();
    }

    private EventConsumer<E> newConsumer(final EventChannel<E> channel) {
        return new EventConsumer<>(name, channel, configuration.getThreadFactory(), new EventConsumer.Receiver<E>() {
            @Override
            public void onReceive(E event) {
                fire(channel, event);
            }
        });
    }

    private void fire(EventChannel<E> channel, E event) {
        S from = currentState.get();
        Optional<Transition<S, E, SE, C>> found = transitionTable.lookup(from, event);
        if (!found.isPresent()) {
            LOGGER.warn("{}: no transition found for state {} on event {}", name, from, event);
            return;
        }
        Transition<S, E, SE, C> transition = found.get();
        LOGGER.debug("{}: event {} fired, running {} handler(s)", name, event, transition.getHandlers().size());

        C runContext = context;
        for (EventHandler<S, E, C> handler : transition.getHandlers()) {
            LOGGER.debug("{}: start handler {}", name, handler);
            Optional<Exception> failure = handler.execute(controller, runContext, from, event);
            if (failure.isPresent()) {
                failed.set(true);
                onException.onException(runContext, from, event, failure.get());
                break;
            }
            LOGGER.debug("{}: finished handler {}", name, handler);
        }

        if (!failed.get() && transition.getEffect().isPresent()) {
            SE effect = transition.getEffect().get();
            LOGGER.debug("{}: triggering side effect {}", name, effect);
            onTransition.onTransition(from, event, transition.getTo(), effect, runContext);
        }

        LOGGER.debug("{}: transiting {} -> {}", name, from, transition.getTo());
        currentState.set(transition.getTo());

        if (failed.get() || transition.getAction() == Action.FINISH) {
            LOGGER.info("{}: run ended in {} ({})", name, transition.getTo(), failed.get() ? "failed" : "finished");
            channel.close();
            return;
        }
        E next = pending.poll();
        if (next != null) {
            LOGGER.debug("{}: sending event {}", name, next);
            if (!channel.trySend(next)) {
                LOGGER.debug("{}: channel closed, event {} not sent", name, next);
            }
        }
    }

    /**
     * Must run before taking the lifecycle lock: a consumer blocked on the lock would keep another thread's
     * {@link #finish()} waiting for it to stop.
     */
    private void checkNotConsumerThread(String operation) {
        checkState(!consumer.isConsumerThread(), "%s cannot be called from the event consumer of %s", operation, name);
    }

    @SuppressWarnings("unused")
    public static class ConfigurationBuilder {
        private final DefaultConfiguration configuration = new DefaultConfiguration();

        public ConfigurationBuilder threadFactory(ThreadFactory threadFactory) {
            configuration.setThreadFactory(threadFactory);
            return this;
        }

        public ConfigurationBuilder stopTimeoutMillis(long millis) {
            configuration.setStopTimeoutMillis(millis);
            return this;
        }

        public Configuration build() {
            return configuration;
        }
    }

    /**
     * Values left unset are {@code null} and keep the defaults when merged.
     */
    public static class DefaultConfiguration implements Configuration {
        private ThreadFactory threadFactory;
        private Long stopTimeoutMillis;

        private DefaultConfiguration() {
        }

        static DefaultConfiguration defaults(String machineName) {
            DefaultConfiguration defaults = new DefaultConfiguration();
            defaults.threadFactory = new ThreadFactoryBuilder()
                    .setNameFormat(machineName.replace("%", "%%") + "-consumer-%d")
                    .setDaemon(true)
                    .build();
            defaults.stopTimeoutMillis = 5000L;
            return defaults;
        }

        public DefaultConfiguration merge(Configuration configuration) {
            if (configuration == null) {
                return this;
            }
            ThreadFactory threadFactory = configuration.getThreadFactory();
            if (threadFactory != null) {
                setThreadFactory(threadFactory);
            }
            Long stopTimeoutMillis = configuration.getStopTimeoutMillis();
            if (stopTimeoutMillis != null) {
                setStopTimeoutMillis(stopTimeoutMillis);
            }
            return this;
        }

        @Override
        public ThreadFactory getThreadFactory() {
            return threadFactory;
        }

        public void setThreadFactory(ThreadFactory threadFactory) {
            this.threadFactory = requireNonNull(threadFactory);
        }

        @Override
        public Long getStopTimeoutMillis() {
            return stopTimeoutMillis;
        }

        public void setStopTimeoutMillis(long stopTimeoutMillis) {
            checkArgument(stopTimeoutMillis > 0, "timeouts must be a positive number > 0");
            this.stopTimeoutMillis = stopTimeoutMillis;
        }
    }
}
