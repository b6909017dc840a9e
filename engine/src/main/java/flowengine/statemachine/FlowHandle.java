package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

public record FlowHandle(RunId id, CompletableFuture<JsonNode> result) {
}
