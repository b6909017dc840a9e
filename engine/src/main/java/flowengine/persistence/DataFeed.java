package flowengine.persistence;

import java.util.Objects;

public record DataFeed<S, U>(S snapshot, FeedSubscription<U> updates) {
    public DataFeed {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(updates, "updates");
    }
}
