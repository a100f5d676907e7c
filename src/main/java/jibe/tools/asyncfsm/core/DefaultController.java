package jibe.tools.asyncfsm.core;

import jibe.tools.asyncfsm.api.Controller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;

import static java.util.Objects.requireNonNull;

/**
 * Appends triggered events to the machine's pending queue. The consumer moves them into the channel one at a
 * time, after each completed transition.
 */
final class DefaultController<E> implements Controller<E> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultController.class);

    private final String machineName;
    private final Queue<E> pending;

    DefaultController(String machineName, Queue<E> pending) {
        this.machineName = machineName;
        this.pending = requireNonNull(pending);
    }

    @Override
    public void trigger(E event) {
        requireNonNull(event, "event");
        LOGGER.debug("{}: enqueuing event {}", machineName, event);
        pending.add(event);
    }
}
