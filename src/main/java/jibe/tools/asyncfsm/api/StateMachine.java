package jibe.tools.asyncfsm.api;

import com.google.common.base.Optional;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * An asynchronous finite state machine. Events are processed one at a time by a single consumer thread;
 * handler code may enqueue follow-up events through its {@link Controller}, and those are delivered only
 * after the current transition has completed.
 * <p>
 * The context handed to {@link #start(Object, Object)} is owned by the consumer thread for the duration of
 * the run. Mutating it from any other thread while the machine is running is not supported.
 *
 * @param <S>  state type
 * @param <E>  event type
 * @param <SE> side effect type
 * @param <C>  context type
 */
public interface StateMachine<S, E, SE, C> {
    String getName();

    S getInitialState();

    /**
     * Current state of the machine. Safe to read from any thread at any time.
     */
    S getCurrentState();

    /**
     * Installs {@code context}, launches the consumer thread and sends {@code event} to it. Returns as soon as
     * the event has been handed over; completion is observed through the callbacks, {@link #getCurrentState()}
     * or {@link #awaitStop(long, TimeUnit)}.
     *
     * @throws IllegalStateException if a run is already active, or the previous run closed the event channel
     *                               (use {@link #reset(Object, Object)})
     */
    void start(E event, C context);

    /**
     * Closes the event channel, stops the consumer and moves the machine back to its initial state. The
     * closed channel is kept, so running the machine again takes {@link #reset(Object, Object)}.
     *
     * @throws IllegalStateException if the consumer does not stop within the configured stop timeout
     */
    void finish();

    /**
     * {@link #finish()}, then replaces the event channel and consumer and starts a fresh run.
     */
    void reset(E event, C context);

    boolean isRunning();

    /**
     * Waits for the consumer of the current run to stop. Returns at once if no run was started.
     *
     * @return {@code false} if the timeout elapsed first
     */
    boolean awaitStop(long timeout, TimeUnit unit);

    /**
     * The failure that escaped a handler's {@code error} or {@code exception}, or one of the machine callbacks,
     * and killed the current consumer, if any.
     */
    Optional<Throwable> getConsumerFailure();

    Configuration getConfiguration();

    interface Configuration {
        ThreadFactory getThreadFactory();

        Long getStopTimeoutMillis();
    }
}
