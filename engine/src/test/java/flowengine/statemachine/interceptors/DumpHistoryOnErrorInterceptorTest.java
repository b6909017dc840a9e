package flowengine.statemachine.interceptors;

import flowengine.statemachine.ActionExecutor;
import flowengine.statemachine.Checkpoint;
import flowengine.statemachine.Event;
import flowengine.statemachine.FlowContinuation;
import flowengine.statemachine.FlowError;
import flowengine.statemachine.FlowFiber;
import flowengine.statemachine.FlowFrame;
import flowengine.statemachine.RunId;
import flowengine.statemachine.StateMachineState;
import flowengine.statemachine.TransitionExecutor;
import flowengine.statemachine.TransitionOutcome;
import flowengine.statemachine.TransitionResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

final class DumpHistoryOnErrorInterceptorTest {
    private static final ActionExecutor NO_ACTIONS = (fiber, action, tx) -> { };
    private static final TransitionExecutor PASS_THROUGH = (fiber, previous, event, transition, actionExecutor) ->
            new TransitionOutcome(transition.continuation(), transition.newState());

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final List<Dump> dumps = Collections.synchronizedList(new ArrayList<>());
    private final DumpHistoryOnErrorInterceptor interceptor = new DumpHistoryOnErrorInterceptor(
            PASS_THROUGH, (runId, history) -> dumps.add(new Dump(runId, history)), Runnable::run, clock);

    @Test
    void dumpsTheWholeHistoryOnceWhenARunBecomesErrored() {
        RunId id = RunId.createRandom();
        StateMachineState s0 = clean("start");
        StateMachineState s1 = clean("one");
        StateMachineState s2 = clean("two");
        StateMachineState errored = erroredFrom(s2);

        TransitionDiagnosticRecord t1 = step(id, s0, s1, Event.PROCEED);
        TransitionDiagnosticRecord t2 = step(id, s1, s2, Event.PROCEED);
        assertThat(dumps).isEmpty();
        TransitionDiagnosticRecord t3 = step(id, s2, errored, Event.PROCEED);

        assertThat(dumps).hasSize(1);
        Dump dump = dumps.get(0);
        assertThat(dump.runId()).isEqualTo(id);
        assertThat(dump.history()).containsExactly(t1, t2, t3);
        assertThat(dump.history()).extracting(TransitionDiagnosticRecord::timestamp).containsOnly(clock.instant());
    }

    @Test
    void furtherErroredTransitionsDoNotDumpAgain() {
        RunId id = RunId.createRandom();
        StateMachineState s0 = clean("start");
        StateMachineState errored = erroredFrom(s0);

        step(id, s0, errored, Event.PROCEED);
        step(id, errored, errored, Event.RETRY_FROM_CHECKPOINT);

        assertThat(dumps).hasSize(1);
        assertThat(interceptor.history(id)).hasSize(2);
    }

    @Test
    void removalDropsTheHistory() {
        RunId id = RunId.createRandom();
        StateMachineState s0 = clean("start");
        StateMachineState errored = erroredFrom(s0);
        step(id, s0, errored, Event.PROCEED);
        assertThat(interceptor.trackedRunCount()).isEqualTo(1);

        execute(id, errored, errored.markRemoved(), Event.KILL, FlowContinuation.REMOVE);

        assertThat(interceptor.history(id)).isEmpty();
        assertThat(interceptor.trackedRunCount()).isZero();
        assertThat(dumps).hasSize(1);
    }

    @Test
    void cleanRunThatFinishesIsNeverDumped() {
        RunId id = RunId.createRandom();
        StateMachineState s0 = clean("start");

        step(id, s0, clean("one"), Event.PROCEED);
        execute(id, clean("one"), clean("one").markRemoved(), Event.PROCEED, FlowContinuation.REMOVE);

        assertThat(dumps).isEmpty();
        assertThat(interceptor.trackedRunCount()).isZero();
    }

    @Test
    void concurrentRunsKeepSeparateOrderedHistories() throws Exception {
        RunId a = RunId.createRandom();
        RunId b = RunId.createRandom();
        int steps = 200;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> runA = pool.submit(() -> runSteps(a, steps, go));
            Future<?> runB = pool.submit(() -> runSteps(b, steps, go));
            go.countDown();
            runA.get(10, TimeUnit.SECONDS);
            runB.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        for (RunId id : List.of(a, b)) {
            List<TransitionDiagnosticRecord> history = interceptor.history(id);
            assertThat(history).hasSize(steps);
            assertThat(history).allSatisfy(record -> assertThat(record.runId()).isEqualTo(id));
            for (int i = 0; i < steps; i++) {
                assertThat(history.get(i).nextState().checkpoint().frame().stage()).isEqualTo("stage-" + i);
            }
        }
        assertThat(interceptor.trackedRunCount()).isEqualTo(2);
    }

    @Test
    void failingSinkDoesNotFailTheTransition() {
        DiagnosticLogSink sink = mock(DiagnosticLogSink.class);
        doThrow(new IllegalStateException("log backend down")).when(sink).dump(any(), anyList());
        DumpHistoryOnErrorInterceptor failing = new DumpHistoryOnErrorInterceptor(PASS_THROUGH, sink);
        RunId id = RunId.createRandom();
        StateMachineState s0 = clean("start");
        StateMachineState errored = erroredFrom(s0);

        TransitionOutcome outcome = failing.executeTransition(fiber(id), s0, Event.PROCEED,
                new TransitionResult(errored, List.of(), new FlowContinuation.Suspend("errored")), NO_ACTIONS);

        assertThat(outcome.nextState()).isSameAs(errored);
        verify(sink).dump(any(), anyList());
    }

    @Test
    void recordRendersOnOneLine() {
        RunId id = RunId.createRandom();
        TransitionDiagnosticRecord record = step(id, clean("start"),
                erroredFrom(clean("start")), new Event.Error(FlowError.of("line one\nline two")));

        assertThat(record.toString()).doesNotContain("\n").contains(id.toString());
    }

    private void runSteps(RunId id, int steps, CountDownLatch go) {
        try {
            go.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        StateMachineState previous = clean("start");
        for (int i = 0; i < steps; i++) {
            StateMachineState next = clean("stage-" + i);
            step(id, previous, next, Event.PROCEED);
            previous = next;
        }
    }

    private TransitionDiagnosticRecord step(RunId id, StateMachineState previous, StateMachineState next, Event event) {
        FlowContinuation continuation = next.checkpoint().errorState().errored()
                ? new FlowContinuation.Suspend("errored")
                : FlowContinuation.CONTINUE;
        execute(id, previous, next, event, continuation);
        List<TransitionDiagnosticRecord> history = interceptor.history(id);
        return history.get(history.size() - 1);
    }

    private void execute(RunId id, StateMachineState previous, StateMachineState next, Event event,
                         FlowContinuation continuation) {
        interceptor.executeTransition(fiber(id), previous, event,
                new TransitionResult(next, List.of(), continuation), NO_ACTIONS);
    }

    private static FlowFiber fiber(RunId id) {
        return () -> id;
    }

    private static StateMachineState clean(String stage) {
        return StateMachineState.of(Checkpoint.create("flow", null).withFrame(new FlowFrame(stage, null), null));
    }

    private static StateMachineState erroredFrom(StateMachineState state) {
        Checkpoint checkpoint = state.checkpoint();
        return state.withCheckpoint(checkpoint.withErrorState(
                checkpoint.errorState().addErrors(List.of(FlowError.of("boom")))));
    }

    private record Dump(RunId runId, List<TransitionDiagnosticRecord> history) {
    }
}
