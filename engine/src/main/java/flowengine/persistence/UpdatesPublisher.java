package flowengine.persistence;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

public final class UpdatesPublisher<E> {
    private final List<Consumer<E>> sinks = new CopyOnWriteArrayList<>();

    public void publish(E event) {
        Objects.requireNonNull(event, "event");
        for (Consumer<E> sink : sinks) {
            sink.accept(event);
        }
    }

    public <T> FeedSubscription<T> subscribe(Predicate<? super E> filter, Function<? super E, ? extends T> mapper) {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(mapper, "mapper");
        FeedSubscription<T> subscription = new FeedSubscription<>();
        Consumer<E> sink = event -> {
            if (filter.test(event)) {
                subscription.deliver(mapper.apply(event));
            }
        };
        subscription.onClose(() -> sinks.remove(sink));
        sinks.add(sink);
        return subscription;
    }

    public int subscriberCount() {
        return sinks.size();
    }
}
