package flowengine.statemachine;

import java.util.Objects;

public interface FlowContinuation {
    Continue CONTINUE = new Continue();
    Abort ABORT = new Abort();
    Remove REMOVE = new Remove();

    record Continue() implements FlowContinuation {
    }

    record Suspend(String reason) implements FlowContinuation {
        public Suspend {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record Abort() implements FlowContinuation {
    }

    record Remove() implements FlowContinuation {
    }
}
