package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A workflow written as an explicit state machine. Every call returns the next {@link FlowStep};
 * whatever the flow needs later must travel in the step's stage data, because that is all that
 * survives a restart.
 */
public interface Flow {
    String name();

    FlowStep start(JsonNode input) throws Exception;

    /**
     * @param frame   the stage the run suspended or continued in
     * @param payload the external event payload or awaited record, {@code null} after a plain continue
     */
    FlowStep resume(FlowFrame frame, JsonNode payload) throws Exception;
}
