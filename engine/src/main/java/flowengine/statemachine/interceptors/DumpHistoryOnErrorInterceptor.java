package flowengine.statemachine.interceptors;

import flowengine.statemachine.ActionExecutor;
import flowengine.statemachine.Event;
import flowengine.statemachine.FlowContinuation;
import flowengine.statemachine.FlowFiber;
import flowengine.statemachine.RunId;
import flowengine.statemachine.StateMachineState;
import flowengine.statemachine.TransitionExecutor;
import flowengine.statemachine.TransitionOutcome;
import flowengine.statemachine.TransitionResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records a trace of every run's transitions. When a run becomes errored the whole trace is handed
 * to the {@link DiagnosticLogSink}; when it is removed the trace is dropped.
 */
public final class DumpHistoryOnErrorInterceptor implements TransitionExecutor {
    private static final Logger log = LoggerFactory.getLogger(DumpHistoryOnErrorInterceptor.class);

    private final TransitionExecutor delegate;
    private final DiagnosticLogSink sink;
    private final Executor dumpExecutor;
    private final Clock clock;
    private final ConcurrentHashMap<RunId, List<TransitionDiagnosticRecord>> records = new ConcurrentHashMap<>();

    public DumpHistoryOnErrorInterceptor(TransitionExecutor delegate, DiagnosticLogSink sink) {
        this(delegate, sink, Runnable::run, Clock.systemUTC());
    }

    public DumpHistoryOnErrorInterceptor(TransitionExecutor delegate, DiagnosticLogSink sink,
                                         Executor dumpExecutor, Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.dumpExecutor = Objects.requireNonNull(dumpExecutor, "dumpExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public TransitionOutcome executeTransition(
            FlowFiber fiber,
            StateMachineState previousState,
            Event event,
            TransitionResult transition,
            ActionExecutor actionExecutor) {
        TransitionOutcome outcome = delegate.executeTransition(fiber, previousState, event, transition, actionExecutor);
        RunId id = fiber.id();
        TransitionDiagnosticRecord record = new TransitionDiagnosticRecord(
                clock.instant(), id, previousState, outcome.nextState(), event, transition, outcome.continuation());
        List<TransitionDiagnosticRecord> history = records.compute(id, (ignored, existing) -> {
            List<TransitionDiagnosticRecord> list = existing == null ? new ArrayList<>() : existing;
            list.add(record);
            return list;
        });

        boolean wasErrored = previousState.checkpoint().errorState().errored();
        if (!wasErrored && outcome.nextState().checkpoint().errorState().errored()) {
            // Only this run's worker appends to its list, so the copy is a consistent prefix.
            dump(id, List.copyOf(history));
        }

        if (outcome.continuation() instanceof FlowContinuation.Remove) {
            records.remove(id);
        }
        return outcome;
    }

    public List<TransitionDiagnosticRecord> history(RunId id) {
        List<TransitionDiagnosticRecord> history = records.get(id);
        return history == null ? List.of() : List.copyOf(history);
    }

    public int trackedRunCount() {
        return records.size();
    }

    private void dump(RunId id, List<TransitionDiagnosticRecord> history) {
        try {
            dumpExecutor.execute(() -> {
                try {
                    sink.dump(id, history);
                } catch (RuntimeException e) {
                    log.warn("Could not dump transition history of flow {}", id, e);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Could not schedule transition history dump of flow {}", id, e);
        }
    }
}
