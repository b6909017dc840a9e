package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Callbacks the {@link ActionExecutorImpl} uses to hand runs back to the scheduler. All of them are
 * invoked after the transaction that requested them has committed.
 */
public interface FlowScheduler {
    void parkOnExternalEvent(RunId id, String eventKey);

    /**
     * The run waits for {@code record}. The scheduler owns the future from here on and cancels it
     * when the run stops waiting for it.
     */
    void parkOnRecord(RunId id, String recordKey, CompletableFuture<JsonNode> record);

    void deliver(RunId id, Event event);

    void flowFinished(RunId id, JsonNode result, FlowError error);
}
