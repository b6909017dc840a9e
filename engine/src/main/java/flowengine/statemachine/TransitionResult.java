package flowengine.statemachine;

import java.util.List;
import java.util.Objects;

public record TransitionResult(StateMachineState newState, List<Action> actions, FlowContinuation continuation) {
    public TransitionResult {
        Objects.requireNonNull(newState, "newState");
        actions = List.copyOf(Objects.requireNonNull(actions, "actions"));
        Objects.requireNonNull(continuation, "continuation");
    }
}
