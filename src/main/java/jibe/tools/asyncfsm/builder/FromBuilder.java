package jibe.tools.asyncfsm.builder;

import com.google.common.collect.ImmutableSet;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 *
 */
public final class FromBuilder<S, E, SE, C> {
    private final StateMachineBuilder<S, E, SE, C> parent;
    private final ImmutableSet<S> from;
    private final ImmutableSet<S> exceptions;

    FromBuilder(StateMachineBuilder<S, E, SE, C> parent, ImmutableSet<S> from, ImmutableSet<S> exceptions) {
        this.parent = parent;
        this.from = from;
        this.exceptions = exceptions;
    }

    /**
     * The transition fires on any of {@code events}.
     */
    @SafeVarargs
    public final TransitionBuilder<S, E, SE, C> on(E... events) {
        return on(Arrays.asList(events));
    }

    public TransitionBuilder<S, E, SE, C> on(Iterable<? extends E> events) {
        ImmutableSet<E> on = ImmutableSet.copyOf(events);
        checkArgument(!on.isEmpty(), "at least one event is required");
        return new TransitionBuilder<>(parent, from, exceptions, on);
    }
}
