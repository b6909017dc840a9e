package flowengine.statemachine;

import java.util.Objects;

public record StateMachineState(Checkpoint checkpoint, boolean removed) {
    public StateMachineState {
        Objects.requireNonNull(checkpoint, "checkpoint");
    }

    public static StateMachineState of(Checkpoint checkpoint) {
        return new StateMachineState(checkpoint, false);
    }

    public StateMachineState withCheckpoint(Checkpoint newCheckpoint) {
        return new StateMachineState(newCheckpoint, removed);
    }

    public StateMachineState markRemoved() {
        return new StateMachineState(checkpoint, true);
    }

    public String summary() {
        return "stage=" + checkpoint.frame().stage()
                + " waitingOn=" + checkpoint.waitingOn()
                + " suspends=" + checkpoint.numberOfSuspends()
                + " errored=" + checkpoint.errorState().errored()
                + (removed ? " removed" : "");
    }
}
