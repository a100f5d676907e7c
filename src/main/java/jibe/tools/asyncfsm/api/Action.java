package jibe.tools.asyncfsm.api;

/**
 * What the machine does once a transition has completed.
 */
public enum Action {
    /**
     * Keep running and forward the next queued event.
     */
    NONE,
    /**
     * Stop the consumer; the run is over.
     */
    FINISH
}
