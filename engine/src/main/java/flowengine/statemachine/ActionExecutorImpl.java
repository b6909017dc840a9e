package flowengine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;
import flowengine.persistence.CheckpointStorage;
import flowengine.persistence.DatabaseTransaction;
import flowengine.persistence.RecordStorage;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ActionExecutorImpl implements ActionExecutor {
    private static final Logger log = LoggerFactory.getLogger(ActionExecutorImpl.class);

    private final CheckpointStorage checkpointStorage;
    private final RecordStorage recordStorage;
    private final FlowScheduler scheduler;

    public ActionExecutorImpl(CheckpointStorage checkpointStorage, RecordStorage recordStorage, FlowScheduler scheduler) {
        this.checkpointStorage = Objects.requireNonNull(checkpointStorage, "checkpointStorage");
        this.recordStorage = Objects.requireNonNull(recordStorage, "recordStorage");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public void executeAction(FlowFiber fiber, Action action, DatabaseTransaction transaction) {
        if (action instanceof Action.PersistCheckpoint persist) {
            checkpointStorage.addCheckpoint(transaction, persist.id(), persist.checkpoint());
        } else if (action instanceof Action.RemoveCheckpoint remove) {
            if (!checkpointStorage.removeCheckpoint(transaction, remove.id())) {
                log.debug("Flow {} had no checkpoint to remove", remove.id());
            }
        } else if (action instanceof Action.AddRecord add) {
            if (!recordStorage.addRecord(transaction, add.key(), add.value())) {
                log.debug("Record {} already stored, keeping the existing value", add.key());
            }
        } else if (action instanceof Action.AwaitExternalEvent await) {
            transaction.onCommit(() -> scheduler.parkOnExternalEvent(await.id(), await.key()));
        } else if (action instanceof Action.AwaitRecord await) {
            CompletableFuture<JsonNode> record = recordStorage.awaitRecord(transaction, await.key());
            transaction.onRollback(() -> record.cancel(false));
            transaction.onCommit(() -> scheduler.parkOnRecord(await.id(), await.key(), record));
        } else if (action instanceof Action.RecordError recordError) {
            FlowError error = recordError.error();
            log.warn("Flow {} errored with {} (error id {}): {}",
                    recordError.id(), error.exceptionType(), error.errorId(), error.message());
        } else if (action instanceof Action.SignalFlowResult signal) {
            transaction.onCommit(() -> scheduler.flowFinished(signal.id(), signal.result(), signal.error()));
        } else {
            throw new IllegalArgumentException("Unsupported action for flow " + fiber.id() + ": " + action);
        }
    }
}
