package flowengine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import flowengine.serialization.JsonCodec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Immutable records produced by flows, keyed by a business key or by their content hash.
 */
public final class RecordStorage {
    static final String TABLE = "flow_records";

    private final JsonCodec codec;
    private final AppendOnlyRecordStore<String, JsonNode> store;

    public RecordStorage(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.store = new AppendOnlyRecordStore<>(new AppendOnlyPersistentMap<String, JsonNode>(
                TABLE, Function.identity(), Function.identity(), JsonNode.class, codec, JsonNode::deepCopy));
    }

    public static RecordStorage create(Database database, JsonCodec codec) {
        RecordStorage storage = new RecordStorage(codec);
        database.transaction(tx -> {
            storage.store.initialize(tx);
            return null;
        });
        return storage;
    }

    public boolean addRecord(DatabaseTransaction transaction, String key, JsonNode value) {
        return store.addIfAbsent(transaction, key, value);
    }

    /**
     * Stores {@code value} under its content hash.
     *
     * @return the key the value is stored under
     */
    public String addContentAddressed(DatabaseTransaction transaction, JsonNode value) {
        String key = ContentHash.of(codec, value);
        store.addIfAbsent(transaction, key, value);
        return key;
    }

    public Optional<JsonNode> getRecord(DatabaseTransaction transaction, String key) {
        return store.get(transaction, key);
    }

    public DataFeed<List<JsonNode>, JsonNode> track(DatabaseTransaction transaction) {
        return store.track(transaction);
    }

    public CompletableFuture<JsonNode> awaitRecord(DatabaseTransaction transaction, String key) {
        return store.awaitKey(transaction, key);
    }

    public FeedSubscription<JsonNode> updates() {
        return store.updates();
    }

    public int subscriberCount() {
        return store.subscriberCount();
    }
}
