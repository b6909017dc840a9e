package flowengine.persistence;

import flowengine.serialization.JsonCodec;
import flowengine.statemachine.Checkpoint;
import flowengine.statemachine.RunId;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

public final class DBCheckpointStorage implements CheckpointStorage {
    static final String TABLE = "flow_checkpoints";

    private final JsonCodec codec;
    private final ReentrantLock lock = new ReentrantLock();

    public DBCheckpointStorage(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public static DBCheckpointStorage create(Database database, JsonCodec codec) {
        DBCheckpointStorage storage = new DBCheckpointStorage(codec);
        database.transaction(tx -> {
            storage.initialize(tx);
            return null;
        });
        return storage;
    }

    public void initialize(DatabaseTransaction transaction) {
        try (Statement statement = transaction.connection().createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS flow_checkpoints (
                        run_id TEXT NOT NULL PRIMARY KEY,
                        checkpoint_value BLOB NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    ) WITHOUT ROWID
                    """);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not create table " + TABLE, e);
        }
    }

    @Override
    public void addCheckpoint(DatabaseTransaction transaction, RunId id, Checkpoint checkpoint) {
        Objects.requireNonNull(id, "id");
        byte[] bytes = codec.serialize(Objects.requireNonNull(checkpoint, "checkpoint"));
        lock.lock();
        try (PreparedStatement statement = transaction.connection().prepareStatement("""
                INSERT INTO flow_checkpoints (run_id, checkpoint_value, updated_at_ms)
                VALUES (?, ?, ?)
                ON CONFLICT(run_id) DO UPDATE SET
                    checkpoint_value = excluded.checkpoint_value,
                    updated_at_ms = excluded.updated_at_ms
                """)) {
            statement.setString(1, id.uuid().toString());
            statement.setBytes(2, bytes);
            statement.setLong(3, System.currentTimeMillis());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not write checkpoint for flow " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeCheckpoint(DatabaseTransaction transaction, RunId id) {
        Objects.requireNonNull(id, "id");
        lock.lock();
        try (PreparedStatement statement = transaction.connection().prepareStatement("""
                DELETE FROM flow_checkpoints
                WHERE run_id = ?
                """)) {
            statement.setString(1, id.uuid().toString());
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not remove checkpoint for flow " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Checkpoint> getCheckpoint(DatabaseTransaction transaction, RunId id) {
        Objects.requireNonNull(id, "id");
        lock.lock();
        try (PreparedStatement statement = transaction.connection().prepareStatement("""
                SELECT checkpoint_value
                FROM flow_checkpoints
                WHERE run_id = ?
                """)) {
            statement.setString(1, id.uuid().toString());
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(codec.deserialize(rs.getBytes("checkpoint_value"), Checkpoint.class));
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not read checkpoint for flow " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Stream<Map.Entry<RunId, Checkpoint>> getAllCheckpoints(DatabaseTransaction transaction) {
        lock.lock();
        try {
            PreparedStatement statement = transaction.connection().prepareStatement("""
                    SELECT run_id, checkpoint_value
                    FROM flow_checkpoints
                    ORDER BY run_id
                    """);
            return Cursors.stream(transaction, statement, rs -> Map.entry(
                    RunId.parse(rs.getString("run_id")),
                    codec.deserialize(rs.getBytes("checkpoint_value"), Checkpoint.class)), TABLE);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not enumerate checkpoints", e);
        } finally {
            lock.unlock();
        }
    }
}
