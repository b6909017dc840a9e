package flowengine.persistence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One subscriber's view of an {@link UpdatesPublisher}. Values arriving before a consumer is
 * attached are queued and replayed, in order, when {@link #subscribe(Consumer)} is called.
 */
public final class FeedSubscription<T> implements AutoCloseable {
    private final Deque<T> buffer = new ArrayDeque<>();
    private Consumer<? super T> consumer;
    private Runnable unsubscribe;
    private boolean closed;

    FeedSubscription() {
    }

    synchronized void onClose(Runnable action) {
        this.unsubscribe = action;
    }

    synchronized void deliver(T value) {
        if (closed) {
            return;
        }
        if (consumer != null) {
            consumer.accept(value);
        } else {
            buffer.addLast(value);
            notifyAll();
        }
    }

    /**
     * Attaches the consumer, first replaying everything buffered so far.
     */
    public synchronized void subscribe(Consumer<? super T> newConsumer) {
        Objects.requireNonNull(newConsumer, "consumer");
        if (consumer != null) {
            throw new IllegalStateException("Feed already has a consumer");
        }
        while (!buffer.isEmpty() && !closed) {
            newConsumer.accept(buffer.pollFirst());
        }
        consumer = newConsumer;
    }

    /**
     * Takes the next buffered value, waiting up to {@code timeout}. Only meaningful while no
     * consumer is attached.
     *
     * @return the value, or {@code null} on timeout
     */
    public synchronized T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (buffer.isEmpty() && !closed) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return buffer.pollFirst();
    }

    public synchronized List<T> drainBuffered() {
        List<T> drained = new ArrayList<>(buffer);
        buffer.clear();
        return drained;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        Runnable action;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            buffer.clear();
            notifyAll();
            action = unsubscribe;
        }
        if (action != null) {
            action.run();
        }
    }
}
