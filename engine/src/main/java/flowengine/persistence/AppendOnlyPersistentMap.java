package flowengine.persistence;

import flowengine.serialization.JsonCodec;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * A table whose rows are written once and never updated, fronted by a cache of committed values.
 *
 * <p>Values enter the cache only from after-commit hooks, so a value from a transaction that
 * later rolls back is never served to anyone else. For mutable value types the {@code copier}
 * keeps the cache independent of the instances callers hold.
 */
public final class AppendOnlyPersistentMap<K, V> {
    private static final Pattern TABLE_NAME = Pattern.compile("^[a-z][a-z0-9_]{0,62}$");

    private final String table;
    private final Function<K, String> toKeyString;
    private final Function<String, K> fromKeyString;
    private final Class<V> valueType;
    private final JsonCodec codec;
    private final UnaryOperator<V> copier;
    private final ConcurrentHashMap<K, V> cache = new ConcurrentHashMap<>();

    public AppendOnlyPersistentMap(String table,
                                   Function<K, String> toKeyString,
                                   Function<String, K> fromKeyString,
                                   Class<V> valueType,
                                   JsonCodec codec) {
        this(table, toKeyString, fromKeyString, valueType, codec, UnaryOperator.identity());
    }

    public AppendOnlyPersistentMap(String table,
                                   Function<K, String> toKeyString,
                                   Function<String, K> fromKeyString,
                                   Class<V> valueType,
                                   JsonCodec codec,
                                   UnaryOperator<V> copier) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        this.table = table;
        this.toKeyString = Objects.requireNonNull(toKeyString, "toKeyString");
        this.fromKeyString = Objects.requireNonNull(fromKeyString, "fromKeyString");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    public V copyOf(V value) {
        return copier.apply(value);
    }

    public String table() {
        return table;
    }

    public void initialize(DatabaseTransaction transaction) {
        try (Statement statement = transaction.connection().createStatement()) {
            statement.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "record_key TEXT NOT NULL PRIMARY KEY, "
                    + "record_value BLOB NOT NULL, "
                    + "created_at_ms INTEGER NOT NULL"
                    + ") WITHOUT ROWID");
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not create table " + table, e);
        }
    }

    /**
     * Inserts the value unless the key is already present, in which case nothing changes.
     *
     * @return {@code true} if this call created the row
     */
    public boolean addWithDuplicatesAllowed(DatabaseTransaction transaction, K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (cache.containsKey(key)) {
            return false;
        }
        byte[] bytes = codec.serialize(value);
        int changed;
        try (PreparedStatement statement = transaction.connection().prepareStatement(
                "INSERT INTO " + table + " (record_key, record_value, created_at_ms) VALUES (?, ?, ?) "
                        + "ON CONFLICT(record_key) DO NOTHING")) {
            statement.setString(1, toKeyString.apply(key));
            statement.setBytes(2, bytes);
            statement.setLong(3, System.currentTimeMillis());
            changed = statement.executeUpdate();
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not insert " + key + " into " + table, e);
        }
        if (changed == 0) {
            return false;
        }
        V stored = copier.apply(value);
        transaction.onCommit(() -> cache.putIfAbsent(key, stored));
        return true;
    }

    public Optional<V> get(DatabaseTransaction transaction, K key) {
        Objects.requireNonNull(key, "key");
        V cached = cache.get(key);
        if (cached != null) {
            return Optional.of(copier.apply(cached));
        }
        try (PreparedStatement statement = transaction.connection().prepareStatement(
                "SELECT record_value FROM " + table + " WHERE record_key = ?")) {
            statement.setString(1, toKeyString.apply(key));
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                V value = codec.deserialize(rs.getBytes("record_value"), valueType);
                transaction.onCommit(() -> cache.putIfAbsent(key, value));
                return Optional.of(copier.apply(value));
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not read " + key + " from " + table, e);
        }
    }

    public Stream<Map.Entry<K, V>> allPersisted(DatabaseTransaction transaction) {
        try {
            PreparedStatement statement = transaction.connection().prepareStatement(
                    "SELECT record_key, record_value FROM " + table + " ORDER BY created_at_ms, record_key");
            return Cursors.stream(transaction, statement, rs -> Map.entry(
                    fromKeyString.apply(rs.getString("record_key")),
                    codec.deserialize(rs.getBytes("record_value"), valueType)), table);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Could not enumerate " + table, e);
        }
    }

    public boolean isCached(K key) {
        return cache.containsKey(key);
    }

    public void invalidateCache() {
        cache.clear();
    }
}
