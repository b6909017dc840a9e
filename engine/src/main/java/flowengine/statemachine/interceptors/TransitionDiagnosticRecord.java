package flowengine.statemachine.interceptors;

import flowengine.statemachine.Action;
import flowengine.statemachine.Event;
import flowengine.statemachine.FlowContinuation;
import flowengine.statemachine.RunId;
import flowengine.statemachine.StateMachineState;
import flowengine.statemachine.TransitionResult;

import java.time.Instant;
import java.util.stream.Collectors;

public record TransitionDiagnosticRecord(
        Instant timestamp,
        RunId runId,
        StateMachineState previousState,
        StateMachineState nextState,
        Event event,
        TransitionResult transition,
        FlowContinuation continuation) {

    @Override
    public String toString() {
        String actions = transition.actions().stream()
                .map(Action::getClass)
                .map(Class::getSimpleName)
                .collect(Collectors.joining(",", "[", "]"));
        String line = "Transition(" + timestamp + ") flow=" + runId
                + " event=" + event
                + " previous={" + previousState.summary() + "}"
                + " next={" + nextState.summary() + "}"
                + " actions=" + actions
                + " continuation=" + continuation;
        return line.replace('\n', ' ').replace('\r', ' ');
    }
}
