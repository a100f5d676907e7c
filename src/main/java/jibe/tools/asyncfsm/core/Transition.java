package jibe.tools.asyncfsm.core;

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import jibe.tools.asyncfsm.api.Action;
import jibe.tools.asyncfsm.api.EventHandler;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * One configured rule of a {@link TransitionTable}. Immutable.
 */
public final class Transition<S, E, SE, C> {
    private final ImmutableSet<S> exceptions;
    private final ImmutableSet<E> on;
    private final ImmutableList<EventHandler<S, E, C>> handlers;
    private final S to;
    private final Optional<SE> effect;
    private final Action action;

    public Transition(Iterable<? extends S> exceptions, Iterable<? extends E> on,
                      Iterable<? extends EventHandler<S, E, C>> handlers, S to, Optional<SE> effect, Action action) {
        this.exceptions = ImmutableSet.copyOf(exceptions);
        this.on = ImmutableSet.copyOf(on);
        checkArgument(!this.on.isEmpty(), "a transition needs at least one event");
        this.handlers = ImmutableList.copyOf(handlers);
        this.to = requireNonNull(to, "target state");
        this.effect = requireNonNull(effect);
        this.action = requireNonNull(action);
    }

    /**
     * States a wildcard transition does not apply to. Always empty for state-bound transitions.
     */
    public ImmutableSet<S> getExceptions() {
        return exceptions;
    }

    public ImmutableSet<E> getOn() {
        return on;
    }

    public ImmutableList<EventHandler<S, E, C>> getHandlers() {
        return handlers;
    }

    public S getTo() {
        return to;
    }

    public Optional<SE> getEffect() {
        return effect;
    }

    public Action getAction() {
        return action;
    }

    boolean accepts(E event) {
        return on.contains(event);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("on", on)
                .add("to", to)
                .add("effect", effect.orNull())
                .add("action", action)
                .add("handlers", handlers.size())
                .add("exceptions", exceptions)
                .toString();
    }
}
