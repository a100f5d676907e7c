package jibe.tools.asyncfsm.api;

import com.google.common.base.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Transition-time logic bound to a transition. The machine runs it as:
 * <ol>
 * <li>{@link #validate} decides whether the event may be handled; it must not have side effects.</li>
 * <li>{@link #handle} runs only on {@link Result#VALID}. It may change the context, trigger follow-up events
 * and throw.</li>
 * <li>{@link #error} runs only on {@link Result#INVALID}. A rejection is not a failure of the transition.</li>
 * <li>{@link #exception} runs only when {@code validate} or {@code handle} threw. An
 * {@link InterruptedException} counts as a failure; the interrupt flag of the thread is restored first.</li>
 * </ol>
 * {@code error} and {@code exception} must not throw. If they do, the failure is not handled by the machine:
 * it escapes the consumer thread and ends the run.
 */
public abstract class EventHandler<S, E, C> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventHandler.class);

    public abstract Result validate(Controller<E> controller, C context, S state, E event);

    public abstract void handle(Controller<E> controller, C context, S state, E event) throws Exception;

    public abstract void error(Controller<E> controller, C context, S state, E event);

    public abstract void exception(Controller<E> controller, C context, S state, E event, Exception failure);

    /**
     * Runs this handler once.
     *
     * @return the failure raised by {@code validate} or {@code handle}, after it has been passed to
     * {@link #exception}; absent if the handler completed or was rejected
     */
    public final Optional<Exception> execute(Controller<E> controller, C context, S state, E event) {
        final Result result;
        try {
            result = requireNonNull(validate(controller, context, state, event), "validate returned null");
            switch (result) {
            case VALID:
                handle(controller, context, state, event);
                break;
            case INVALID:
                break;
            default:
                throw new IllegalStateException("unknown result: " + result);
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            LOGGER.debug("{} failed in state {} on event {}", this, state, event, e);
            exception(controller, context, state, event, e);
            return Optional.of(e);
        }

        if (result == Result.INVALID) {
            LOGGER.debug("{} rejected event {} in state {}", this, event, state);
            error(controller, context, state, event);
        }
        return Optional.absent();
    }

    /**
     * Wraps a bare {@code handle} function. The resulting handler always validates, and treats any call to
     * {@code error} or {@code exception} as a programming error: both throw {@link IllegalStateException},
     * which escapes the consumer.
     */
    public static <S, E, C> EventHandler<S, E, C> of(final Handle<S, E, C> handle) {
        requireNonNull(handle);
        return new EventHandler<S, E, C>() {
            @Override
            public Result validate(Controller<E> controller, C context, S state, E event) {
                return Result.VALID;
            }

            @Override
            public void handle(Controller<E> controller, C context, S state, E event) throws Exception {
                handle.handle(controller, context, state, event);
            }

            @Override
            public void error(Controller<E> controller, C context, S state, E event) {
                throw new IllegalStateException("This event handler should not fail!");
            }

            @Override
            public void exception(Controller<E> controller, C context, S state, E event, Exception failure) {
                throw new IllegalStateException("This event handler should not throw nor handle exception!", failure);
            }

            @Override
            public String toString() {
                return "EventHandler[" + handle + "]";
            }
        };
    }

    public enum Result {
        VALID,
        INVALID
    }

    /**
     *
     */
    public interface Handle<S, E, C> {
        void handle(Controller<E> controller, C context, S state, E event) throws Exception;
    }
}
