package jibe.tools.asyncfsm.builder;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import jibe.tools.asyncfsm.api.Action;
import jibe.tools.asyncfsm.api.ConfigurationException;
import jibe.tools.asyncfsm.api.EventHandler;
import jibe.tools.asyncfsm.api.ExceptionCallback;
import jibe.tools.asyncfsm.api.StateMachine;
import jibe.tools.asyncfsm.api.TransitionCallback;
import jibe.tools.asyncfsm.core.DefaultStateMachine;
import jibe.tools.asyncfsm.core.TransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Fluent construction of a {@link StateMachine}:
 * <pre>
 * StateMachine&lt;State, Event, Effect, Order&gt; machine = StateMachineBuilder
 *         .&lt;State, Event, Effect, Order&gt;newBuilder("orders", State.NEW)
 *         .from(State.NEW).on(Event.PAY).execute(charge).goTo(State.PAID, Effect.CHARGED)
 *         .from(State.PAID).on(Event.SHIP).finishOn(State.SHIPPED, Effect.SHIPPED)
 *         .fromAll(State.SHIPPED).on(Event.CANCEL).finishOn(State.CANCELLED)
 *         .onTransition(callback)
 *         .build();
 * </pre>
 * Transitions are consulted in the order they were added.
 */
public final class StateMachineBuilder<S, E, SE, C> {
    private static final Logger LOGGER = LoggerFactory.getLogger(StateMachineBuilder.class);

    private final String name;
    private final S initialState;
    private final TransitionTable.Builder<S, E, SE, C> table;
    private TransitionCallback<S, E, SE, C> onTransition;
    private ExceptionCallback<S, E, C> onException;
    private StateMachine.Configuration configuration;
    private boolean built;

    private StateMachineBuilder(String name, S initialState) {
        this.name = requireNonNull(name, "name");
        this.initialState = requireNonNull(initialState, "initialState");
        this.table = TransitionTable.builder(name);
    }

    public static <S, E, SE, C> StateMachineBuilder<S, E, SE, C> newBuilder(String name, S initialState) {
        return new StateMachineBuilder<>(name, initialState);
    }

    /**
     * Starts a transition bound to each of {@code states}.
     */
    @SafeVarargs
    public final FromBuilder<S, E, SE, C> from(S... states) {
        return from(Arrays.asList(states));
    }

    public FromBuilder<S, E, SE, C> from(Iterable<? extends S> states) {
        ImmutableSet<S> from = ImmutableSet.copyOf(states);
        checkArgument(!from.isEmpty(), "at least one source state is required, use fromAll for wildcards");
        return new FromBuilder<>(this, from, ImmutableSet.<S>of());
    }

    /**
     * Starts a wildcard transition, applicable in every state except {@code exceptStates}.
     */
    @SafeVarargs
    public final FromBuilder<S, E, SE, C> fromAll(S... exceptStates) {
        return fromAll(Arrays.asList(exceptStates));
    }

    public FromBuilder<S, E, SE, C> fromAll(Iterable<? extends S> exceptStates) {
        return new FromBuilder<>(this, ImmutableSet.<S>of(), ImmutableSet.copyOf(exceptStates));
    }

    /**
     * Called after a successful transition that carries a side effect. Defaults to logging it.
     */
    public StateMachineBuilder<S, E, SE, C> onTransition(TransitionCallback<S, E, SE, C> onTransition) {
        this.onTransition = requireNonNull(onTransition);
        return this;
    }

    /**
     * Called when a handler fails. Defaults to logging the failure.
     */
    public StateMachineBuilder<S, E, SE, C> onException(ExceptionCallback<S, E, C> onException) {
        this.onException = requireNonNull(onException);
        return this;
    }

    public StateMachineBuilder<S, E, SE, C> configuration(StateMachine.Configuration configuration) {
        this.configuration = requireNonNull(configuration);
        return this;
    }

    /**
     * @throws ConfigurationException if no transition was added, or none of them finishes the machine
     */
    public StateMachine<S, E, SE, C> build() {
        checkState(!built, "%s is already built", name);
        TransitionTable<S, E, SE, C> transitionTable = table.build();
        built = true;
        LOGGER.debug("{}: built {}", name, transitionTable);
        return new DefaultStateMachine<>(name, initialState, transitionTable,
                onTransition != null ? onTransition : DefaultStateMachine.<S, E, SE, C>loggingTransitionCallback(name),
                onException != null ? onException : DefaultStateMachine.<S, E, C>loggingExceptionCallback(name),
                configuration);
    }

    StateMachineBuilder<S, E, SE, C> add(ImmutableSet<S> from, ImmutableSet<S> exceptions, ImmutableSet<E> on,
                                         ImmutableList<EventHandler<S, E, C>> handlers, S to, Optional<SE> effect,
                                         Action action) {
        checkState(!built, "%s is already built", name);
        table.addTransitions(from, exceptions, on, handlers, to, effect, action);
        return this;
    }
}
