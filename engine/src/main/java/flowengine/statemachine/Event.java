package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public interface Event {
    Proceed PROCEED = new Proceed();
    Restored RESTORED = new Restored();
    RetryFromCheckpoint RETRY_FROM_CHECKPOINT = new RetryFromCheckpoint();
    Kill KILL = new Kill();

    record Start(JsonNode input) implements Event {
    }

    record Proceed() implements Event {
    }

    record ExternalEventReceived(String key, JsonNode payload) implements Event {
        public ExternalEventReceived {
            Objects.requireNonNull(key, "key");
        }
    }

    record RecordAvailable(String key, JsonNode value) implements Event {
        public RecordAvailable {
            Objects.requireNonNull(key, "key");
        }
    }

    record Error(FlowError error) implements Event {
        public Error {
            Objects.requireNonNull(error, "error");
        }
    }

    record Restored() implements Event {
    }

    record RetryFromCheckpoint() implements Event {
    }

    record Kill() implements Event {
    }
}
