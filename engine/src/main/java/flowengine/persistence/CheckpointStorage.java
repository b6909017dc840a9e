package flowengine.persistence;

import flowengine.statemachine.Checkpoint;
import flowengine.statemachine.RunId;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Durable map from run to its latest checkpoint.
 */
public interface CheckpointStorage {
    /**
     * Writes the checkpoint for {@code id}, replacing any earlier one.
     */
    void addCheckpoint(DatabaseTransaction transaction, RunId id, Checkpoint checkpoint);

    /**
     * @return {@code true} if a checkpoint was removed, {@code false} if there was none
     */
    boolean removeCheckpoint(DatabaseTransaction transaction, RunId id);

    Optional<Checkpoint> getCheckpoint(DatabaseTransaction transaction, RunId id);

    /**
     * Streams every checkpoint visible to {@code transaction}. The stream reads lazily from a fresh
     * cursor on every call and should be closed by the caller.
     */
    Stream<Map.Entry<RunId, Checkpoint>> getAllCheckpoints(DatabaseTransaction transaction);
}
