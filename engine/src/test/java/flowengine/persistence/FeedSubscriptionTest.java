package flowengine.persistence;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class FeedSubscriptionTest {

    @Test
    void valuesPublishedBeforeSubscribingAreReplayedInOrder() {
        UpdatesPublisher<String> publisher = new UpdatesPublisher<>();
        FeedSubscription<String> subscription = publisher.subscribe(value -> true, value -> value);

        publisher.publish("one");
        publisher.publish("two");
        List<String> received = new ArrayList<>();
        subscription.subscribe(received::add);
        publisher.publish("three");

        assertThat(received).containsExactly("one", "two", "three");
    }

    @Test
    void eachSubscriberHasItsOwnQueue() {
        UpdatesPublisher<Integer> publisher = new UpdatesPublisher<>();
        FeedSubscription<Integer> all = publisher.subscribe(value -> true, value -> value);
        FeedSubscription<String> even = publisher.subscribe(value -> value % 2 == 0, value -> "#" + value);

        for (int i = 1; i <= 4; i++) {
            publisher.publish(i);
        }

        assertThat(all.drainBuffered()).containsExactly(1, 2, 3, 4);
        assertThat(even.drainBuffered()).containsExactly("#2", "#4");
    }

    @Test
    void pollWaitsForAPublishedValue() throws Exception {
        UpdatesPublisher<String> publisher = new UpdatesPublisher<>();
        FeedSubscription<String> subscription = publisher.subscribe(value -> true, value -> value);
        CountDownLatch started = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            started.countDown();
            publisher.publish("late");
        });
        producer.start();
        started.await();

        assertThat(subscription.poll(5, TimeUnit.SECONDS)).isEqualTo("late");
        assertThat(subscription.poll(10, TimeUnit.MILLISECONDS)).isNull();
        producer.join();
    }

    @Test
    void closedSubscriptionIsDetached() {
        UpdatesPublisher<String> publisher = new UpdatesPublisher<>();
        FeedSubscription<String> subscription = publisher.subscribe(value -> true, value -> value);
        subscription.close();
        publisher.publish("ignored");

        assertThat(subscription.isClosed()).isTrue();
        assertThat(subscription.drainBuffered()).isEmpty();
        assertThat(publisher.subscriberCount()).isZero();
    }

    @Test
    void onlyOneConsumerMayAttach() {
        UpdatesPublisher<String> publisher = new UpdatesPublisher<>();
        FeedSubscription<String> subscription = publisher.subscribe(value -> true, value -> value);
        subscription.subscribe(value -> { });

        assertThatThrownBy(() -> subscription.subscribe(value -> { }))
                .isInstanceOf(IllegalStateException.class);
    }
}
