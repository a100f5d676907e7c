package jibe.tools.asyncfsm.core;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import jibe.tools.asyncfsm.api.Action;
import jibe.tools.asyncfsm.api.ConfigurationException;
import jibe.tools.asyncfsm.api.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Transitions keyed by source state. The absent key holds wildcard transitions, which apply to every state
 * not listed in their exceptions.
 * <p>
 * Lookup first scans the current state's own list and then the wildcard list; in both the first transition
 * accepting the event wins.
 */
public final class TransitionTable<S, E, SE, C> {
    private final ImmutableListMultimap<Optional<S>, Transition<S, E, SE, C>> transitions;

    private TransitionTable(ListMultimap<Optional<S>, Transition<S, E, SE, C>> transitions) {
        this.transitions = ImmutableListMultimap.copyOf(transitions);
    }

    public static <S, E, SE, C> Builder<S, E, SE, C> builder(String machineName) {
        return new Builder<>(machineName);
    }

    public Optional<Transition<S, E, SE, C>> lookup(S current, E event) {
        for (Transition<S, E, SE, C> transition : transitions.get(Optional.of(current))) {
            if (transition.accepts(event)) {
                return Optional.of(transition);
            }
        }
        for (Transition<S, E, SE, C> transition : transitions.get(Optional.<S>absent())) {
            if (transition.accepts(event) && !transition.getExceptions().contains(current)) {
                return Optional.of(transition);
            }
        }
        return Optional.absent();
    }

    public ImmutableList<Transition<S, E, SE, C>> transitionsFrom(S state) {
        return transitions.get(Optional.of(state));
    }

    public ImmutableList<Transition<S, E, SE, C>> wildcardTransitions() {
        return transitions.get(Optional.<S>absent());
    }

    public int size() {
        return transitions.size();
    }

    @Override
    public String toString() {
        return "TransitionTable" + transitions;
    }

    /**
     *
     */
    public static final class Builder<S, E, SE, C> {
        private static final Logger LOGGER = LoggerFactory.getLogger(Builder.class);

        private final String machineName;
        private final ListMultimap<Optional<S>, Transition<S, E, SE, C>> transitions =
                MultimapBuilder.linkedHashKeys().arrayListValues().build();
        private boolean built;

        private Builder(String machineName) {
            this.machineName = requireNonNull(machineName);
        }

        /**
         * Appends one transition to the list of every state in {@code fromStates}. An empty {@code fromStates}
         * appends a single wildcard transition that skips the states in {@code exceptions}; for state-bound
         * transitions {@code exceptions} is ignored.
         */
        public Builder<S, E, SE, C> addTransitions(Iterable<? extends S> fromStates, Iterable<? extends S> exceptions,
                                                   Iterable<? extends E> events,
                                                   Iterable<? extends EventHandler<S, E, C>> handlers,
                                                   S to, Optional<SE> effect, Action action) {
            checkState(!built, "transition table of %s is already built", machineName);
            ImmutableSet<S> from = ImmutableSet.copyOf(fromStates);
            if (from.isEmpty()) {
                Transition<S, E, SE, C> transition = new Transition<>(exceptions, events, handlers, to, effect, action);
                transitions.put(Optional.<S>absent(), transition);
                LOGGER.debug("{}: added wildcard {}", machineName, transition);
            } else {
                Transition<S, E, SE, C> transition =
                        new Transition<>(ImmutableSet.<S>of(), events, handlers, to, effect, action);
                for (S state : from) {
                    transitions.put(Optional.of(state), transition);
                    LOGGER.debug("{}: added {} from {}", machineName, transition, state);
                }
            }
            return this;
        }

        /**
         * @throws ConfigurationException if the table is empty or no transition finishes the machine
         */
        public TransitionTable<S, E, SE, C> build() {
            checkState(!built, "transition table of %s is already built", machineName);
            if (transitions.isEmpty()) {
                throw new ConfigurationException(ConfigurationException.Reason.EMPTY_TABLE, machineName);
            }
            boolean finishes = false;
            for (Transition<S, E, SE, C> transition : transitions.values()) {
                if (transition.getAction() == Action.FINISH) {
                    finishes = true;
                    break;
                }
            }
            if (!finishes) {
                throw new ConfigurationException(ConfigurationException.Reason.NO_FINISH_TRANSITION, machineName);
            }
            built = true;
            return new TransitionTable<>(transitions);
        }
    }
}
