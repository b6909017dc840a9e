package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

public record FlowFrame(String stage, JsonNode data) {
    public FlowFrame {
        Objects.requireNonNull(stage, "stage");
        data = data == null ? NullNode.getInstance() : data;
    }
}
