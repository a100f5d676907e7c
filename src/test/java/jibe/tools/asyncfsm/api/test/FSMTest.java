package jibe.tools.asyncfsm.api.test;

import com.google.common.collect.ImmutableList;
import com.jayway.awaitility.Awaitility;
import com.jayway.awaitility.Duration;
import com.jayway.awaitility.core.ConditionTimeoutException;
import jibe.tools.asyncfsm.api.ExceptionCallback;
import jibe.tools.asyncfsm.api.StateMachine;
import jibe.tools.asyncfsm.api.TransitionCallback;
import jibe.tools.asyncfsm.api.test.model.Context;
import jibe.tools.asyncfsm.api.test.model.Event;
import jibe.tools.asyncfsm.api.test.model.SideEffect;
import jibe.tools.asyncfsm.api.test.model.State;
import jibe.tools.asyncfsm.api.test.model.TracingHandler;
import jibe.tools.asyncfsm.builder.StateMachineBuilder;
import jibe.tools.asyncfsm.core.DefaultStateMachine;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static jibe.tools.asyncfsm.api.test.model.Event.COMPLETE;
import static jibe.tools.asyncfsm.api.test.model.Event.PING;
import static jibe.tools.asyncfsm.api.test.model.Event.START;
import static jibe.tools.asyncfsm.api.test.model.SideEffect.E1;
import static jibe.tools.asyncfsm.api.test.model.SideEffect.E2;
import static jibe.tools.asyncfsm.api.test.model.SideEffect.PINGED;
import static jibe.tools.asyncfsm.api.test.model.State.FINAL;
import static jibe.tools.asyncfsm.api.test.model.State.INITIAL;
import static jibe.tools.asyncfsm.api.test.model.State.MID;

/**
 * Runs machines end to end on their consumer thread.
 */
public class FSMTest {
    private static final Logger LOGGER = LoggerFactory.getLogger(FSMTest.class);

    private static final TransitionCallback<State, Event, SideEffect, Context> TRACE_TRANSITION =
            (from, event, to, effect, context) -> context.trace("transition:" + from + "-" + event + "->" + to + ":" + effect);
    private static final ExceptionCallback<State, Event, Context> TRACE_EXCEPTION =
            (context, state, event, failure) -> context.trace("onException:" + state + ":" + event + ":" + failure.getMessage());

    private final List<StateMachine<?, ?, ?, ?>> machines = new ArrayList<>();

    @After
    public void after() {
        for (StateMachine<?, ?, ?, ?> machine : machines) {
            if (machine.isRunning()) {
                machine.finish();
            }
        }
    }

    @Test
    public void runsBothTransitionsInOrderThenStops() {
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("two-step")
                .from(INITIAL).on(START).execute(TracingHandler.triggering("h1", COMPLETE)).goTo(MID, E1)
                .from(MID).on(COMPLETE).execute(TracingHandler.valid("h2")).finishOn(FINAL, E2)
                .build());
        Context context = new Context("run");

        machine.start(START, context);

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(ImmutableList.of(
                "h1:handle:INITIAL:START",
                "transition:INITIAL-START->MID:E1",
                "h2:handle:MID:COMPLETE",
                "transition:MID-COMPLETE->FINAL:E2"), context.getTrace());
        Assert.assertEquals(FINAL, machine.getCurrentState());
        Assert.assertFalse(machine.isRunning());
        Assert.assertFalse(machine.getConsumerFailure().isPresent());
    }

    @Test
    public void handlerFailureSuppressesSideEffectButStillMovesState() {
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("failing-step")
                .from(INITIAL).on(START).execute(TracingHandler.triggering("h1", COMPLETE)).goTo(MID, E1)
                .from(MID).on(COMPLETE).execute(TracingHandler.failing("h2", new IllegalStateException("boom")))
                .finishOn(FINAL, E2)
                .build());
        Context context = new Context("run");

        machine.start(START, context);

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(ImmutableList.of(
                "h1:handle:INITIAL:START",
                "transition:INITIAL-START->MID:E1",
                "h2:handle:MID:COMPLETE",
                "h2:exception:IllegalStateException",
                "onException:MID:COMPLETE:boom"), context.getTrace());
        Assert.assertEquals(FINAL, machine.getCurrentState());
        Assert.assertFalse(machine.getConsumerFailure().isPresent());
    }

    @Test
    public void failingHandlerShortCircuitsTheTransitionAndStopsTheMachine() {
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("short-circuit")
                .from(INITIAL).on(START).execute(TracingHandler.triggering("h1", COMPLETE)).goTo(MID, E1)
                .from(MID).on(COMPLETE)
                .execute((controller, context, state, event) -> {
                    context.trace("a");
                    controller.trigger(PING);
                })
                .execute(TracingHandler.failing("b", new IOException("io")))
                .execute(TracingHandler.valid("c"))
                .goTo(FINAL, E2)
                .from(FINAL).on(PING).goTo(MID, PINGED)
                .from(FINAL).on(START).finishOn(FINAL)
                .build());
        Context context = new Context("run");

        machine.start(START, context);

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(ImmutableList.of(
                "h1:handle:INITIAL:START",
                "transition:INITIAL-START->MID:E1",
                "a",
                "b:handle:MID:COMPLETE",
                "b:exception:IOException",
                "onException:MID:COMPLETE:io"), context.getTrace());
        // not a finishing transition, the failure alone stopped the run
        Assert.assertEquals(FINAL, machine.getCurrentState());
        Assert.assertFalse(machine.isRunning());
    }

    @Test
    public void rejectedHandlerDoesNotFailTheTransition() {
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("rejecting")
                .from(INITIAL).on(START)
                .execute(TracingHandler.invalid("v"))
                .execute(TracingHandler.valid("w"))
                .finishOn(FINAL, E1)
                .build());
        Context context = new Context("run");

        machine.start(START, context);

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(ImmutableList.of(
                "v:error",
                "w:handle:INITIAL:START",
                "transition:INITIAL-START->FINAL:E1"), context.getTrace());
    }

    @Test
    public void transitionWithoutEffectSkipsCallback() {
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("no-effect")
                .from(INITIAL).on(START).execute(TracingHandler.triggering("h1", COMPLETE)).goTo(MID)
                .from(MID).on(COMPLETE).finishOn(FINAL, E2)
                .build());
        Context context = new Context("run");

        machine.start(START, context);

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(ImmutableList.of(
                "h1:handle:INITIAL:START",
                "transition:MID-COMPLETE->FINAL:E2"), context.getTrace());
    }

    @Test
    public void eventWithoutTransitionIsDropped() {
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("dropping")
                .from(INITIAL).on(START).execute(TracingHandler.triggering("h1", PING)).goTo(MID, E1)
                .from(MID).on(COMPLETE).finishOn(FINAL, E2)
                .build());
        Context context = new Context("run");

        machine.start(START, context);

        Assert.assertTrue(awaitCurrentState(machine, MID));
        Assert.assertTrue(machine.isRunning());
        Assert.assertFalse(machine.awaitStop(200, TimeUnit.MILLISECONDS));
        Assert.assertEquals(MID, machine.getCurrentState());
        Assert.assertEquals(ImmutableList.of(
                "h1:handle:INITIAL:START",
                "transition:INITIAL-START->MID:E1"), context.getTrace());

        machine.finish();
        Assert.assertFalse(machine.isRunning());
        Assert.assertEquals(INITIAL, machine.getCurrentState());
    }

    @Test
    public void finishMovesBackToInitialState() {
        StateMachine<State, Event, SideEffect, Context> machine = track(twoStepMachine("finishing"));

        machine.start(START, new Context("run"));
        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(FINAL, machine.getCurrentState());

        machine.finish();
        Assert.assertEquals(INITIAL, machine.getCurrentState());
    }

    @Test
    public void resetRunsIndependentlyOfThePreviousRun() {
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("resettable")
                .from(INITIAL).on(START)
                .execute((controller, context, state, event) -> {
                    context.trace("h1");
                    controller.trigger(COMPLETE);
                    controller.trigger(PING);
                })
                .goTo(MID, E1)
                .from(MID).on(COMPLETE).finishOn(FINAL, E2)
                .from(MID).on(PING).goTo(MID, PINGED)
                .build());
        List<String> expected = ImmutableList.of(
                "h1",
                "transition:INITIAL-START->MID:E1",
                "transition:MID-COMPLETE->FINAL:E2");

        Context first = new Context("first");
        machine.start(START, first);
        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(expected, first.getTrace());

        // PING is still queued from the first run and must not leak into the second one
        Context second = new Context("second");
        machine.reset(START, second);
        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));

        Assert.assertEquals(expected, second.getTrace());
        Assert.assertEquals(expected, first.getTrace());
        Assert.assertEquals(FINAL, machine.getCurrentState());
    }

    @Test
    public void startAfterCompletedRunRequiresReset() {
        StateMachine<State, Event, SideEffect, Context> machine = track(twoStepMachine("restart"));

        machine.start(START, new Context("first"));
        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        try {
            machine.start(START, new Context("second"));
            Assert.fail("started on a closed channel");
        } catch (IllegalStateException e) {
            LOGGER.debug("expected", e);
        }

        Context third = new Context("third");
        machine.reset(START, third);
        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(3, third.getTrace().size());
    }

    @Test
    public void startWhileRunningIsRejected() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("busy")
                .from(INITIAL).on(START)
                .execute((controller, context, state, event) -> release.await())
                .goTo(MID, E1)
                .from(MID).on(COMPLETE).finishOn(FINAL)
                .build());
        Context context = new Context("run");

        machine.start(START, context);
        try {
            machine.start(START, new Context("intruder"));
            Assert.fail("second start accepted");
        } catch (IllegalStateException e) {
            LOGGER.debug("expected", e);
        } finally {
            release.countDown();
        }

        Assert.assertTrue(awaitCurrentState(machine, MID));
        Assert.assertEquals(ImmutableList.of("transition:INITIAL-START->MID:E1"), context.getTrace());
    }

    @Test
    public void failureEscapingAHandlerKillsTheConsumerUntilReset() {
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("escalating")
                .from(INITIAL).on(START)
                .execute((controller, context, state, event) -> {
                    if (context.getName().equals("broken")) {
                        throw new IllegalArgumentException("bad input");
                    }
                })
                .goTo(MID, E1)
                .from(MID).on(COMPLETE).finishOn(FINAL, E2)
                .build());
        Context broken = new Context("broken");

        machine.start(START, broken);

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertFalse(machine.isRunning());
        Assert.assertTrue(machine.getConsumerFailure().isPresent());
        Throwable failure = machine.getConsumerFailure().get();
        Assert.assertTrue(failure instanceof IllegalStateException);
        Assert.assertTrue(failure.getCause() instanceof IllegalArgumentException);
        // neither the exception callback nor the state move happened
        Assert.assertTrue(broken.getTrace().isEmpty());
        Assert.assertEquals(INITIAL, machine.getCurrentState());

        Context fine = new Context("fine");
        machine.reset(START, fine);
        Assert.assertTrue(awaitCurrentState(machine, MID));
        Assert.assertFalse(machine.getConsumerFailure().isPresent());
        Assert.assertEquals(ImmutableList.of("transition:INITIAL-START->MID:E1"), fine.getTrace());
    }

    @Test
    public void lifecycleCallsFromTheConsumerThreadAreRejected() {
        final AtomicReference<StateMachine<State, Event, SideEffect, Context>> self = new AtomicReference<>();
        StateMachine<State, Event, SideEffect, Context> machine = track(StateMachineBuilder
                .<State, Event, SideEffect, Context>newBuilder("reentrant", INITIAL)
                .from(INITIAL).on(START).finishOn(FINAL, E1)
                .onTransition((from, event, to, effect, context) -> self.get().finish())
                .build());
        self.set(machine);

        machine.start(START, new Context("run"));

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertTrue(machine.getConsumerFailure().get() instanceof IllegalStateException);
    }

    @Test
    public void consumerCallingFinishDuringOutsideFinishFailsFast() throws Exception {
        final AtomicReference<StateMachine<State, Event, SideEffect, Context>> self = new AtomicReference<>();
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("racing-finish")
                .from(INITIAL).on(START)
                .execute((controller, context, state, event) -> {
                    Thread.sleep(300);
                    try {
                        self.get().finish();
                    } catch (IllegalStateException e) {
                        context.trace("finish rejected");
                    }
                })
                .goTo(MID, E1)
                .from(MID).on(COMPLETE).finishOn(FINAL)
                .configuration(DefaultStateMachine.configurationBuilder().stopTimeoutMillis(2000).build())
                .build());
        self.set(machine);
        Context context = new Context("run");

        machine.start(START, context);
        Thread.sleep(50);
        long started = System.nanoTime();
        machine.finish();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        Assert.assertTrue("finish took " + elapsedMillis + " ms", elapsedMillis < 2000);
        Assert.assertFalse(machine.isRunning());
        Assert.assertFalse(machine.getConsumerFailure().isPresent());
        Assert.assertEquals(INITIAL, machine.getCurrentState());
        Assert.assertEquals(ImmutableList.of("finish rejected", "transition:INITIAL-START->MID:E1"),
                context.getTrace());
    }

    @Test
    public void eventsTriggeredFromManyThreadsAreAllDelivered() {
        final int pings = 8;
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("concurrent-trigger")
                .from(INITIAL).on(START)
                .execute((controller, context, state, event) -> {
                    List<Thread> threads = new ArrayList<>();
                    for (int i = 0; i < pings; i++) {
                        Thread thread = new Thread(() -> controller.trigger(PING), "pinger-" + i);
                        threads.add(thread);
                        thread.start();
                    }
                    for (Thread thread : threads) {
                        thread.join();
                    }
                    controller.trigger(COMPLETE);
                })
                .goTo(MID, E1)
                .from(MID).on(PING).goTo(MID, PINGED)
                .from(MID).on(COMPLETE).finishOn(FINAL, E2)
                .build());
        Context context = new Context("run");

        machine.start(START, context);

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        List<String> trace = context.getTrace();
        Assert.assertEquals(pings + 2, trace.size());
        Assert.assertEquals("transition:INITIAL-START->MID:E1", trace.get(0));
        for (int i = 1; i <= pings; i++) {
            Assert.assertEquals("transition:MID-PING->MID:PINGED", trace.get(i));
        }
        Assert.assertEquals("transition:MID-COMPLETE->FINAL:E2", trace.get(pings + 1));
        Assert.assertEquals(FINAL, machine.getCurrentState());
    }

    @Test
    public void consumerThreadKeepsTheFactoryName() {
        StateMachine<State, Event, SideEffect, Context> machine = track(newBuilder("named")
                .from(INITIAL).on(START)
                .execute((controller, context, state, event) -> context.trace(Thread.currentThread().getName()))
                .finishOn(FINAL)
                .build());
        Context context = new Context("run");

        machine.start(START, context);

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(ImmutableList.of("named-consumer-0"), context.getTrace());
    }

    @Test
    public void defaultCallbacksOnlyLog() {
        StateMachine<State, Event, SideEffect, Context> machine = track(StateMachineBuilder
                .<State, Event, SideEffect, Context>newBuilder("defaults", INITIAL)
                .from(INITIAL).on(START).execute(TracingHandler.triggering("h1", COMPLETE)).goTo(MID, E1)
                .from(MID).on(COMPLETE).execute(TracingHandler.failing("h2", new IOException("io"))).finishOn(FINAL, E2)
                .build());
        Context context = new Context("run");

        machine.start(START, context);

        Assert.assertTrue(machine.awaitStop(5, TimeUnit.SECONDS));
        Assert.assertEquals(ImmutableList.of(
                "h1:handle:INITIAL:START",
                "h2:handle:MID:COMPLETE",
                "h2:exception:IOException"), context.getTrace());
        Assert.assertEquals(FINAL, machine.getCurrentState());
    }

    private StateMachineBuilder<State, Event, SideEffect, Context> newBuilder(String name) {
        return StateMachineBuilder.<State, Event, SideEffect, Context>newBuilder(name, INITIAL)
                .onTransition(TRACE_TRANSITION)
                .onException(TRACE_EXCEPTION);
    }

    private StateMachine<State, Event, SideEffect, Context> twoStepMachine(String name) {
        return newBuilder(name)
                .from(INITIAL).on(START).execute(TracingHandler.triggering("h1", COMPLETE)).goTo(MID, E1)
                .from(MID).on(COMPLETE).finishOn(FINAL, E2)
                .build();
    }

    private <T extends StateMachine<?, ?, ?, ?>> T track(T machine) {
        machines.add(machine);
        return machine;
    }

    private boolean awaitCurrentState(final StateMachine<State, ?, ?, ?> machine, final State state) {
        try {
            Awaitility.await().atMost(Duration.FIVE_SECONDS).until(new Callable<Boolean>() {
                @Override
                public Boolean call() throws Exception {
                    boolean equals = machine.getCurrentState() == state;
                    if (!equals) {
                        LOGGER.debug("not yet...");
                    }
                    return equals;
                }
            });
        } catch (ConditionTimeoutException e) {
            return false;
        }
        return true;
    }
}
