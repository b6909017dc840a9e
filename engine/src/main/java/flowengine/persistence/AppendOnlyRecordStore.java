package flowengine.persistence;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only keyed store with a live feed of new values.
 *
 * <p>A value is published exactly once, after the transaction that inserted it commits. A
 * transaction that rolls back publishes nothing.
 */
public final class AppendOnlyRecordStore<K, V> {
    private final AppendOnlyPersistentMap<K, V> map;
    private final UpdatesPublisher<Map.Entry<K, V>> updatesPublisher = new UpdatesPublisher<>();
    private final ReentrantLock lock = new ReentrantLock();

    public AppendOnlyRecordStore(AppendOnlyPersistentMap<K, V> map) {
        this.map = Objects.requireNonNull(map, "map");
    }

    public void initialize(DatabaseTransaction transaction) {
        map.initialize(transaction);
    }

    /**
     * @return {@code true} if the value was inserted, {@code false} if the key already existed, in
     * which case the stored value is left as it was
     */
    public boolean addIfAbsent(DatabaseTransaction transaction, K key, V value) {
        lock.lock();
        try {
            boolean inserted = map.addWithDuplicatesAllowed(transaction, key, value);
            if (inserted) {
                V published = map.copyOf(value);
                transaction.onCommit(() -> updatesPublisher.publish(Map.entry(key, published)));
            }
            return inserted;
        } finally {
            lock.unlock();
        }
    }

    public Optional<V> get(DatabaseTransaction transaction, K key) {
        lock.lock();
        try {
            return map.get(transaction, key);
        } finally {
            lock.unlock();
        }
    }

    public Stream<Map.Entry<K, V>> allPersisted(DatabaseTransaction transaction) {
        lock.lock();
        try {
            return map.allPersisted(transaction);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Everything visible to {@code transaction} now, plus every value inserted afterwards. A value
     * already in the snapshot is never repeated on the feed.
     */
    public DataFeed<List<V>, V> track(DatabaseTransaction transaction) {
        lock.lock();
        try {
            List<Map.Entry<K, V>> current;
            try (Stream<Map.Entry<K, V>> persisted = map.allPersisted(transaction)) {
                current = persisted.collect(Collectors.toList());
            }
            Set<K> snapshotKeys = current.stream().map(Map.Entry::getKey).collect(Collectors.toSet());
            FeedSubscription<V> updates = updatesPublisher.subscribe(
                    entry -> !snapshotKeys.contains(entry.getKey()),
                    entry -> map.copyOf(entry.getValue()));
            List<V> snapshot = current.stream().map(Map.Entry::getValue).collect(Collectors.toList());
            return new DataFeed<>(snapshot, updates);
        } finally {
            lock.unlock();
        }
    }

    public FeedSubscription<V> updates() {
        return updatesPublisher.subscribe(entry -> true, entry -> map.copyOf(entry.getValue()));
    }

    /**
     * Completes with the value stored under {@code key}: immediately if it is already visible to
     * {@code transaction}, otherwise once, when the inserting transaction commits.
     */
    public CompletableFuture<V> awaitKey(DatabaseTransaction transaction, K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            CompletableFuture<V> future = new CompletableFuture<>();
            FeedSubscription<V> subscription = updatesPublisher.subscribe(
                    entry -> entry.getKey().equals(key),
                    entry -> map.copyOf(entry.getValue()));
            Optional<V> existing;
            try {
                existing = map.get(transaction, key);
            } catch (RuntimeException e) {
                subscription.close();
                throw e;
            }
            if (existing.isPresent()) {
                subscription.close();
                return CompletableFuture.completedFuture(existing.get());
            }
            subscription.subscribe(value -> {
                subscription.close();
                future.complete(value);
            });
            // Cancelling the future detaches it from the feed.
            future.whenComplete((value, failure) -> subscription.close());
            return future;
        } finally {
            lock.unlock();
        }
    }

    public int subscriberCount() {
        return updatesPublisher.subscriberCount();
    }
}
