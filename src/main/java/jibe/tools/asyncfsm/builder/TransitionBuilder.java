package jibe.tools.asyncfsm.builder;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import jibe.tools.asyncfsm.api.Action;
import jibe.tools.asyncfsm.api.EventHandler;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Collects the handlers of one transition and closes it with a target state.
 */
public final class TransitionBuilder<S, E, SE, C> {
    private final StateMachineBuilder<S, E, SE, C> parent;
    private final ImmutableSet<S> from;
    private final ImmutableSet<S> exceptions;
    private final ImmutableSet<E> on;
    private final ImmutableList.Builder<EventHandler<S, E, C>> handlers = ImmutableList.builder();
    private boolean closed;

    TransitionBuilder(StateMachineBuilder<S, E, SE, C> parent, ImmutableSet<S> from, ImmutableSet<S> exceptions,
                      ImmutableSet<E> on) {
        this.parent = parent;
        this.from = from;
        this.exceptions = exceptions;
        this.on = on;
    }

    /**
     * Adds {@code handler}; handlers run one after the other in the order they were added.
     */
    public TransitionBuilder<S, E, SE, C> execute(EventHandler<S, E, C> handler) {
        checkState(!closed, "transition on %s is already closed", on);
        handlers.add(requireNonNull(handler));
        return this;
    }

    /**
     * Adds a handle-only handler, see {@link EventHandler#of(EventHandler.Handle)}.
     */
    public TransitionBuilder<S, E, SE, C> execute(EventHandler.Handle<S, E, C> handle) {
        return execute(EventHandler.of(handle));
    }

    public StateMachineBuilder<S, E, SE, C> goTo(S to) {
        return close(to, Optional.<SE>absent(), Action.NONE);
    }

    public StateMachineBuilder<S, E, SE, C> goTo(S to, SE effect) {
        return close(to, Optional.of(effect), Action.NONE);
    }

    /**
     * Like {@link #goTo(Object)}, but the run ends once the machine is in {@code to}.
     */
    public StateMachineBuilder<S, E, SE, C> finishOn(S to) {
        return close(to, Optional.<SE>absent(), Action.FINISH);
    }

    public StateMachineBuilder<S, E, SE, C> finishOn(S to, SE effect) {
        return close(to, Optional.of(effect), Action.FINISH);
    }

    private StateMachineBuilder<S, E, SE, C> close(S to, Optional<SE> effect, Action action) {
        checkState(!closed, "transition on %s is already closed", on);
        closed = true;
        return parent.add(from, exceptions, on, handlers.build(), to, effect, action);
    }
}
