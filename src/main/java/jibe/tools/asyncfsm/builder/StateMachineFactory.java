package jibe.tools.asyncfsm.builder;

import jibe.tools.asyncfsm.api.ConfigurationException;
import jibe.tools.asyncfsm.api.StateMachine;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 *
 */
public class StateMachineFactory {
    private StateMachineFactory() {
    }

    public static StateMachineFactory newInstance() {
        return new StateMachineFactory();
    }

    /**
     * Lets {@code configure} add the transitions and callbacks, then builds the machine.
     *
     * @throws ConfigurationException if the configured transitions are rejected
     */
    public <S, E, SE, C> StateMachine<S, E, SE, C> newStateMachine(
            String name, S initialState, Consumer<? super StateMachineBuilder<S, E, SE, C>> configure) {
        StateMachineBuilder<S, E, SE, C> builder = StateMachineBuilder.newBuilder(name, initialState);
        requireNonNull(configure).accept(builder);
        return builder.build();
    }

    public <S, E, SE, C> StateMachine<S, E, SE, C> newStateMachine(
            String name, S initialState, final StateMachine.Configuration configuration,
            final Consumer<? super StateMachineBuilder<S, E, SE, C>> configure) {
        requireNonNull(configure);
        return this.<S, E, SE, C>newStateMachine(name, initialState, new Consumer<StateMachineBuilder<S, E, SE, C>>() {
            @Override
            public void accept(StateMachineBuilder<S, E, SE, C> builder) {
                builder.configuration(configuration);
                configure.accept(builder);
            }
        });
    }
}
