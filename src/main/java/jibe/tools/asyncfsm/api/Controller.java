package jibe.tools.asyncfsm.api;

/**
 * The only handle on the machine that handler code gets.
 */
public interface Controller<E> {
    /**
     * Queues {@code event} for processing after the current transition. Never blocks and never runs a
     * transition itself.
     */
    void trigger(E event);
}
