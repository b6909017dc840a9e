package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A side effect requested by a transition. Actions are executed by an {@link ActionExecutor} and
 * never decided by it.
 */
public interface Action {
    /**
     * Whether the action touches storage. A transition whose actions all return {@code false} runs
     * without a database transaction.
     */
    default boolean transactional() {
        return true;
    }

    record PersistCheckpoint(RunId id, Checkpoint checkpoint) implements Action {
        public PersistCheckpoint {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(checkpoint, "checkpoint");
        }
    }

    record RemoveCheckpoint(RunId id) implements Action {
        public RemoveCheckpoint {
            Objects.requireNonNull(id, "id");
        }
    }

    record AddRecord(String key, JsonNode value) implements Action {
        public AddRecord {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    record AwaitExternalEvent(RunId id, String key) implements Action {
        public AwaitExternalEvent {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(key, "key");
        }
    }

    record AwaitRecord(RunId id, String key) implements Action {
        public AwaitRecord {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(key, "key");
        }
    }

    record RecordError(RunId id, FlowError error) implements Action {
        public RecordError {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean transactional() {
            return false;
        }
    }

    /** Completes the run's result future; {@code error} is set when the run was killed. */
    record SignalFlowResult(RunId id, JsonNode result, FlowError error) implements Action {
        public SignalFlowResult {
            Objects.requireNonNull(id, "id");
        }
    }
}
