package flowengine.persistence;

import com.fasterxml.jackson.databind.node.ObjectNode;
import flowengine.serialization.DeserializationException;
import flowengine.serialization.JsonCodec;
import flowengine.statemachine.Checkpoint;
import flowengine.statemachine.ErrorState;
import flowengine.statemachine.FlowError;
import flowengine.statemachine.FlowFrame;
import flowengine.statemachine.RunId;
import flowengine.statemachine.WaitingOn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class DBCheckpointStorageTest {
    private static final AtomicInteger COUNTER = new AtomicInteger();

    @TempDir
    Path tempDir;

    private final JsonCodec codec = new JsonCodec();
    private Database database;
    private DBCheckpointStorage checkpointStorage;

    @BeforeEach
    void setUp() {
        database = new Database(tempDir.resolve("checkpoints.db"));
        newCheckpointStorage();
    }

    @Test
    void addNewCheckpoint() {
        RunId id = RunId.createRandom();
        Checkpoint checkpoint = newCheckpoint();
        database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, id, checkpoint);
            return null;
        });
        assertThat(checkpoints()).containsExactly(checkpoint);
        restart();
        assertThat(checkpoints()).containsExactly(checkpoint);
    }

    @Test
    void addingTwiceKeepsOnlyTheLatestCheckpoint() {
        RunId id = RunId.createRandom();
        Checkpoint first = newCheckpoint();
        Checkpoint second = newCheckpoint();
        database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, id, first);
            return null;
        });
        database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, id, second);
            return null;
        });
        assertThat(checkpoints()).containsExactly(second);
    }

    @Test
    void removeCheckpoint() {
        RunId id = RunId.createRandom();
        database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, id, newCheckpoint());
            return null;
        });
        boolean removed = database.transaction(tx -> checkpointStorage.removeCheckpoint(tx, id));
        assertThat(removed).isTrue();
        assertThat(checkpoints()).isEmpty();
        assertThat(storedCheckpoint(id)).isEmpty();
        restart();
        assertThat(checkpoints()).isEmpty();
    }

    @Test
    void removingAnAbsentCheckpointIsANoOp() {
        RunId id = RunId.createRandom();
        boolean removed = database.transaction(tx -> checkpointStorage.removeCheckpoint(tx, id));
        assertThat(removed).isFalse();
        boolean removedAgain = database.transaction(tx -> checkpointStorage.removeCheckpoint(tx, id));
        assertThat(removedAgain).isFalse();
        assertThat(checkpoints()).isEmpty();
    }

    @Test
    void addAndRemoveCheckpointInSingleCommit() {
        RunId id = RunId.createRandom();
        RunId id2 = RunId.createRandom();
        Checkpoint checkpoint = newCheckpoint();
        Checkpoint checkpoint2 = newCheckpoint();
        database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, id, checkpoint);
            checkpointStorage.addCheckpoint(tx, id2, checkpoint2);
            checkpointStorage.removeCheckpoint(tx, id);
            return null;
        });
        assertThat(checkpoints()).containsExactly(checkpoint2);
        restart();
        assertThat(checkpoints()).containsExactly(checkpoint2);
    }

    @Test
    void addTwoCheckpointsThenRemoveFirstOne() {
        RunId id = RunId.createRandom();
        Checkpoint firstCheckpoint = newCheckpoint();
        database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, id, firstCheckpoint);
            return null;
        });
        RunId id2 = RunId.createRandom();
        Checkpoint secondCheckpoint = newCheckpoint();
        database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, id2, secondCheckpoint);
            return null;
        });
        database.transaction(tx -> checkpointStorage.removeCheckpoint(tx, id));
        assertThat(checkpoints()).containsExactly(secondCheckpoint);
        restart();
        assertThat(checkpoints()).containsExactly(secondCheckpoint);
    }

    @Test
    void addCheckpointAndThenRemoveAfterRestart() {
        RunId id = RunId.createRandom();
        Checkpoint originalCheckpoint = newCheckpoint();
        database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, id, originalCheckpoint);
            return null;
        });
        restart();
        List<Checkpoint> reconstructed = checkpoints();
        assertThat(reconstructed).hasSize(1);
        assertThat(reconstructed.get(0)).isEqualTo(originalCheckpoint).isNotSameAs(originalCheckpoint);
        database.transaction(tx -> checkpointStorage.removeCheckpoint(tx, id));
        assertThat(checkpoints()).isEmpty();
    }

    @Test
    void erroredSuspendedCheckpointRoundTrips() {
        RunId id = RunId.createRandom();
        Checkpoint checkpoint = newCheckpoint()
                .withFrame(new FlowFrame("waiting", codec.mapper().createObjectNode().put("attempt", 2)),
                        WaitingOn.externalEvent("reply-1"))
                .withErrorState(new ErrorState.Errored(List.of(new FlowError(7L, "java.io.IOException", "reset"))));
        database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, id, checkpoint);
            return null;
        });
        restart();
        Checkpoint loaded = database.transaction(tx -> checkpointStorage.getCheckpoint(tx, id)).orElseThrow();
        assertThat(loaded).isEqualTo(checkpoint).isNotSameAs(checkpoint);
        assertThat(loaded.errorState().errored()).isTrue();
        assertThat(loaded.numberOfSuspends()).isEqualTo(1);
    }

    @Test
    void writesAreVisibleInTheSameTransactionButNotToOthersUntilCommit() throws Exception {
        RunId id = RunId.createRandom();
        Checkpoint checkpoint = newCheckpoint();
        try (DatabaseTransaction tx = database.begin()) {
            checkpointStorage.addCheckpoint(tx, id, checkpoint);
            assertThat(checkpointStorage.getCheckpoint(tx, id)).contains(checkpoint);
            assertThat(committedRowCount()).isZero();
            tx.commit();
        }
        assertThat(committedRowCount()).isEqualTo(1);
    }

    @Test
    void closingAnUncommittedTransactionDiscardsItsWrites() {
        RunId id = RunId.createRandom();
        try (DatabaseTransaction tx = database.begin()) {
            checkpointStorage.addCheckpoint(tx, id, newCheckpoint());
        }
        assertThat(checkpoints()).isEmpty();
    }

    @Test
    void enumerationIsLazyAndRestartablePerCall() {
        for (int i = 0; i < 5; i++) {
            RunId id = RunId.createRandom();
            Checkpoint checkpoint = newCheckpoint();
            database.transaction(tx -> {
                checkpointStorage.addCheckpoint(tx, id, checkpoint);
                return null;
            });
        }
        database.transaction(tx -> {
            try (Stream<Map.Entry<RunId, Checkpoint>> first = checkpointStorage.getAllCheckpoints(tx)) {
                assertThat(first.limit(2).count()).isEqualTo(2);
            }
            try (Stream<Map.Entry<RunId, Checkpoint>> second = checkpointStorage.getAllCheckpoints(tx)) {
                assertThat(second.count()).isEqualTo(5);
            }
            return null;
        });
    }

    @Test
    void corruptBytesFailWithDeserializationErrorAndRollBack() {
        RunId corrupt = RunId.createRandom();
        insertRaw(corrupt, "not a checkpoint".getBytes(StandardCharsets.UTF_8));
        RunId other = RunId.createRandom();

        assertThatThrownBy(() -> database.transaction(tx -> {
            checkpointStorage.addCheckpoint(tx, other, newCheckpoint());
            return checkpointStorage.getCheckpoint(tx, corrupt);
        })).isInstanceOf(DeserializationException.class);
        assertThatThrownBy(this::checkpoints).isInstanceOf(DeserializationException.class);

        database.transaction(tx -> checkpointStorage.removeCheckpoint(tx, corrupt));
        assertThat(storedCheckpoint(other)).isEmpty();
        assertThat(checkpoints()).isEmpty();
    }

    @Test
    void unreachableStorageFailsWithStorageUnavailable() throws Exception {
        Path notADirectory = Files.writeString(tempDir.resolve("plain-file"), "x");
        Database unreachable = new Database(notADirectory.resolve("checkpoints.db"));

        assertThatThrownBy(() -> DBCheckpointStorage.create(unreachable, codec))
                .isInstanceOf(StorageUnavailableException.class);
    }

    private Optional<Checkpoint> storedCheckpoint(RunId id) {
        return database.transaction(tx -> checkpointStorage.getCheckpoint(tx, id));
    }

    private List<Checkpoint> checkpoints() {
        return database.transaction(tx -> {
            try (Stream<Map.Entry<RunId, Checkpoint>> all = checkpointStorage.getAllCheckpoints(tx)) {
                return all.map(Map.Entry::getValue).collect(Collectors.toList());
            }
        });
    }

    private void restart() {
        database = new Database(tempDir.resolve("checkpoints.db"));
        newCheckpointStorage();
    }

    private void newCheckpointStorage() {
        checkpointStorage = DBCheckpointStorage.create(database, codec);
    }

    private Checkpoint newCheckpoint() {
        ObjectNode input = codec.mapper().createObjectNode()
                .put("sequence", COUNTER.incrementAndGet())
                .put("payload", "test");
        return Checkpoint.create("test-flow", input);
    }

    private void insertRaw(RunId id, byte[] bytes) {
        database.transaction(tx -> {
            try (PreparedStatement statement = tx.connection().prepareStatement(
                    "INSERT INTO flow_checkpoints (run_id, checkpoint_value, updated_at_ms) VALUES (?, ?, 0)")) {
                statement.setString(1, id.uuid().toString());
                statement.setBytes(2, bytes);
                statement.executeUpdate();
            } catch (SQLException e) {
                throw new IllegalStateException(e);
            }
            return null;
        });
    }

    private int committedRowCount() throws SQLException {
        try (Connection connection = DriverManager.getConnection(database.jdbcUrl());
             PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM flow_checkpoints");
             ResultSet rs = statement.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
