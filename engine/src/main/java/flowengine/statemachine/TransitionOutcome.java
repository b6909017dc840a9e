package flowengine.statemachine;

import java.util.Objects;

public record TransitionOutcome(FlowContinuation continuation, StateMachineState nextState) {
    public TransitionOutcome {
        Objects.requireNonNull(continuation, "continuation");
        Objects.requireNonNull(nextState, "nextState");
    }
}
