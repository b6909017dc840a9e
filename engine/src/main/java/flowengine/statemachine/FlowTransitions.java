package flowengine.statemachine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The transition function. Decides, from a run's state and an event, the next state, the actions
 * that produce it and the continuation. Performs no I/O; the only code it runs is the flow's own.
 *
 * <p>An errored run keeps the frame of its last clean checkpoint and only the in-memory error
 * state changes, so the stored checkpoint is always the one to resume from.
 */
public final class FlowTransitions {
    private static final Logger log = LoggerFactory.getLogger(FlowTransitions.class);

    private final Map<String, Flow> flows;
    private final ErroredRunPolicy erroredRunPolicy;

    public FlowTransitions(Collection<? extends Flow> flows, ErroredRunPolicy erroredRunPolicy) {
        Map<String, Flow> byName = new LinkedHashMap<>();
        for (Flow flow : flows) {
            Flow previous = byName.put(flow.name(), flow);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate flow name: " + flow.name());
            }
        }
        this.flows = Map.copyOf(byName);
        this.erroredRunPolicy = Objects.requireNonNull(erroredRunPolicy, "erroredRunPolicy");
    }

    public boolean knows(String flowName) {
        return flows.containsKey(flowName);
    }

    public ErroredRunPolicy erroredRunPolicy() {
        return erroredRunPolicy;
    }

    public TransitionResult transition(RunId id, StateMachineState previous, Event event) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(event, "event");
        if (previous.removed()) {
            return ignore(previous);
        }
        if (event instanceof Event.Kill) {
            return new TransitionResult(
                    previous.markRemoved(),
                    List.of(new Action.RemoveCheckpoint(id),
                            new Action.SignalFlowResult(id, null, FlowError.of("Flow " + id + " was killed"))),
                    FlowContinuation.REMOVE);
        }
        if (event instanceof Event.Error error) {
            return errored(id, previous, error.error());
        }
        Checkpoint checkpoint = previous.checkpoint();
        if (checkpoint.errorState().errored()) {
            return erroredRunTransition(id, previous, event);
        }
        if (event instanceof Event.Start start) {
            return invoke(id, previous, flow -> flow.start(start.input()));
        }
        if (event instanceof Event.Proceed) {
            if (checkpoint.waitingOn() != null) {
                return ignore(previous);
            }
            return invoke(id, previous, flow -> flow.resume(checkpoint.frame(), null));
        }
        if (event instanceof Event.ExternalEventReceived received) {
            if (!isWaitingOn(checkpoint, WaitingOn.Kind.EXTERNAL_EVENT, received.key())) {
                log.debug("Flow {} is not waiting for event {}", id, received.key());
                return ignore(previous);
            }
            return invoke(id, previous, flow -> flow.resume(checkpoint.frame(), received.payload()));
        }
        if (event instanceof Event.RecordAvailable available) {
            if (!isWaitingOn(checkpoint, WaitingOn.Kind.RECORD, available.key())) {
                log.debug("Flow {} is not waiting for record {}", id, available.key());
                return ignore(previous);
            }
            return invoke(id, previous, flow -> flow.resume(checkpoint.frame(), available.value()));
        }
        if (event instanceof Event.Restored) {
            return resumeFromCheckpoint(id, previous);
        }
        if (event instanceof Event.RetryFromCheckpoint) {
            return ignore(previous);
        }
        throw new IllegalArgumentException("Unknown event type: " + event.getClass().getName());
    }

    private TransitionResult erroredRunTransition(RunId id, StateMachineState previous, Event event) {
        if (event instanceof Event.RetryFromCheckpoint) {
            // Errored -> Clean is only allowed when configured; HOLD keeps the run parked as errored.
            if (erroredRunPolicy == ErroredRunPolicy.RETRY_FROM_CHECKPOINT) {
                Checkpoint cleaned = previous.checkpoint().withErrorState(ErrorState.CLEAN);
                return resumeFromCheckpoint(id, previous.withCheckpoint(cleaned));
            }
            log.info("Flow {} is errored and the {} policy does not allow a retry", id, erroredRunPolicy);
        }
        return new TransitionResult(previous, List.of(), new FlowContinuation.Suspend("errored"));
    }

    private TransitionResult resumeFromCheckpoint(RunId id, StateMachineState state) {
        WaitingOn waitingOn = state.checkpoint().waitingOn();
        if (waitingOn == null) {
            return new TransitionResult(state, List.of(), FlowContinuation.CONTINUE);
        }
        return new TransitionResult(state, List.of(awaitAction(id, waitingOn)), suspendOn(waitingOn));
    }

    private TransitionResult invoke(RunId id, StateMachineState previous, FlowCall call) {
        Flow flow = flows.get(previous.checkpoint().flowName());
        if (flow == null) {
            return errored(id, previous, FlowError.of("No flow registered as " + previous.checkpoint().flowName()));
        }
        FlowStep step;
        try {
            step = call.invoke(flow);
        } catch (Exception e) {
            return errored(id, previous, FlowError.from(e));
        }
        if (step == null) {
            return errored(id, previous, FlowError.of("Flow " + flow.name() + " returned no step"));
        }
        return apply(id, previous, step);
    }

    private TransitionResult apply(RunId id, StateMachineState previous, FlowStep step) {
        Checkpoint checkpoint = previous.checkpoint();
        List<Action> actions = new ArrayList<>(step.records());
        switch (step.kind()) {
            case NEXT -> {
                Checkpoint next = checkpoint.withFrame(step.frame(), null);
                actions.add(new Action.PersistCheckpoint(id, next));
                return new TransitionResult(previous.withCheckpoint(next), actions, FlowContinuation.CONTINUE);
            }
            case AWAIT_EVENT, AWAIT_RECORD -> {
                WaitingOn waitingOn = step.kind() == FlowStep.Kind.AWAIT_EVENT
                        ? WaitingOn.externalEvent(step.waitKey())
                        : WaitingOn.record(step.waitKey());
                Checkpoint next = checkpoint.withFrame(step.frame(), waitingOn);
                actions.add(new Action.PersistCheckpoint(id, next));
                actions.add(awaitAction(id, waitingOn));
                return new TransitionResult(previous.withCheckpoint(next), actions, suspendOn(waitingOn));
            }
            case FINISH -> {
                actions.add(new Action.RemoveCheckpoint(id));
                actions.add(new Action.SignalFlowResult(id, step.result(), null));
                return new TransitionResult(previous.markRemoved(), actions, FlowContinuation.REMOVE);
            }
            case FAIL -> {
                return errored(id, previous, FlowError.of(step.failure()));
            }
            default -> throw new IllegalStateException("Unhandled step kind: " + step.kind());
        }
    }

    private static TransitionResult errored(RunId id, StateMachineState previous, FlowError error) {
        Checkpoint checkpoint = previous.checkpoint();
        Checkpoint errored = checkpoint.withErrorState(checkpoint.errorState().addErrors(List.of(error)));
        return new TransitionResult(
                previous.withCheckpoint(errored),
                List.of(new Action.RecordError(id, error)),
                new FlowContinuation.Suspend("errored"));
    }

    private static TransitionResult ignore(StateMachineState previous) {
        return new TransitionResult(previous, List.of(), FlowContinuation.ABORT);
    }

    private static boolean isWaitingOn(Checkpoint checkpoint, WaitingOn.Kind kind, String key) {
        WaitingOn waitingOn = checkpoint.waitingOn();
        return waitingOn != null && waitingOn.kind() == kind && waitingOn.key().equals(key);
    }

    private static Action awaitAction(RunId id, WaitingOn waitingOn) {
        return waitingOn.kind() == WaitingOn.Kind.EXTERNAL_EVENT
                ? new Action.AwaitExternalEvent(id, waitingOn.key())
                : new Action.AwaitRecord(id, waitingOn.key());
    }

    private static FlowContinuation suspendOn(WaitingOn waitingOn) {
        return new FlowContinuation.Suspend("waiting for " + waitingOn.kind() + " " + waitingOn.key());
    }

    @FunctionalInterface
    private interface FlowCall {
        FlowStep invoke(Flow flow) throws Exception;
    }
}
