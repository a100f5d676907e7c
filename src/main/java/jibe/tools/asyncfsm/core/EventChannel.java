package jibe.tools.asyncfsm.core;

import com.google.common.base.Optional;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Unbounded hand-off between senders and the single consumer of a run. Closing enqueues a stop marker, so
 * events sent before {@link #close()} are still received, and every receive after the marker reports closed.
 * A closed channel cannot be reopened.
 */
final class EventChannel<E> {
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    void send(E event) {
        requireNonNull(event, "event");
        if (closed.get()) {
            throw new IllegalStateException("channel is closed");
        }
        queue.add(event);
    }

    /**
     * Like {@link #send(Object)}, but reports a closed channel instead of throwing. An event that races with
     * {@link #close()} may land behind the stop marker and is then never received.
     */
    boolean trySend(E event) {
        requireNonNull(event, "event");
        if (closed.get()) {
            return false;
        }
        queue.add(event);
        return true;
    }

    /**
     * Blocks until an event or the stop marker arrives.
     *
     * @return absent once the channel is closed
     */
    @SuppressWarnings("unchecked")
    Optional<E> receive() throws InterruptedException {
        Object received = queue.take();
        if (ServiceEvent.STOP == received) {
            queue.add(ServiceEvent.STOP);
            return Optional.absent();
        }
        return Optional.of((E) received);
    }

    /**
     * @return {@code false} if the channel was already closed
     */
    boolean close() {
        if (closed.compareAndSet(false, true)) {
            queue.add(ServiceEvent.STOP);
            return true;
        }
        return false;
    }

    boolean isClosed() {
        return closed.get();
    }

    private enum ServiceEvent {
        STOP
    }
}
