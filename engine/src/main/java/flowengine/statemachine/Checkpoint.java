package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public record Checkpoint(
        String flowName,
        FlowFrame frame,
        WaitingOn waitingOn,
        int numberOfSuspends,
        ErrorState errorState) {

    public static final String START_STAGE = "start";

    public Checkpoint {
        Objects.requireNonNull(flowName, "flowName");
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(errorState, "errorState");
    }

    public static Checkpoint create(String flowName, JsonNode input) {
        return new Checkpoint(flowName, new FlowFrame(START_STAGE, input), null, 0, ErrorState.CLEAN);
    }

    public Checkpoint withFrame(FlowFrame newFrame, WaitingOn newWaitingOn) {
        int suspends = newWaitingOn == null ? numberOfSuspends : numberOfSuspends + 1;
        return new Checkpoint(flowName, newFrame, newWaitingOn, suspends, errorState);
    }

    public Checkpoint withErrorState(ErrorState newErrorState) {
        return new Checkpoint(flowName, frame, waitingOn, numberOfSuspends, newErrorState);
    }
}
