package jibe.tools.asyncfsm.api;

/**
 * Receives the failure of a handler's {@code handle} (or {@code validate}) once the handler's own
 * {@link EventHandler#exception} has run. {@code state} is the state the machine was in when the event arrived.
 */
public interface ExceptionCallback<S, E, C> {
    void onException(C context, S state, E event, Exception failure);
}
