package flowengine.statemachine;

import flowengine.FlowEngineException;

public class FlowKilledException extends FlowEngineException {
    private final FlowError error;

    public FlowKilledException(FlowError error) {
        super(error.message());
        this.error = error;
    }

    public FlowError error() {
        return error;
    }
}
