package jibe.tools.asyncfsm.api;

/**
 *
 */
public interface TransitionCallback<S, E, SE, C> {
    void onTransition(S from, E event, S to, SE effect, C context);
}
