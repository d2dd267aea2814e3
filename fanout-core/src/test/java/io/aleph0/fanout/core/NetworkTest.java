package io.aleph0.fanout.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import io.aleph0.fanout.core.build.NetworkBuilder;

public class NetworkTest {
  @Test
  void givenWidgetsAndGearsNetwork_whenPublish_thenOnlyMatchingSubscribersReceive() {
    // Arrange
    NetworkBuilder<String, String> builder = NetworkBuilder.newNetwork();
    Subscriber<String, String> s1 = builder.addSubscriber("widgets");
    Subscriber<String, String> s2 = builder.addSubscriber("widgets", "gears");
    Publisher<String, String> publisher = builder.build();

    // Act & Assert
    publisher.publish("widgets", "sprocket");
    assertThat(s1.fetch()).containsExactly(new Message<>("widgets", "sprocket"));
    assertThat(s2.fetch()).containsExactly(new Message<>("widgets", "sprocket"));

    publisher.publish("gears", "cog");
    assertThat(s1.fetch()).isEmpty();
    assertThat(s2.fetch()).containsExactly(new Message<>("gears", "cog"));
  }

  @Test
  void givenSinglePublisher_whenPublishTwice_thenFetchedInOrder() {
    // Arrange
    NetworkBuilder<String, String> builder = NetworkBuilder.newNetwork();
    Subscriber<String, String> subscriber = builder.addSubscriber("widgets");
    Publisher<String, String> publisher = builder.build();

    // Act
    publisher.publish("widgets", "a");
    publisher.publish("widgets", "b");

    // Assert
    assertThat(subscriber.fetch()).containsExactly(new Message<>("widgets", "a"),
        new Message<>("widgets", "b"));
  }

  @Test
  void givenTopicWithoutSubscribers_whenPublish_thenNothingHappens() {
    // Arrange
    NetworkBuilder<String, String> builder = NetworkBuilder.newNetwork();
    Subscriber<String, String> subscriber = builder.addSubscriber("widgets");
    Publisher<String, String> publisher = builder.build();

    // Act & Assert
    assertThatCode(() -> publisher.publish("nobody", "listening")).doesNotThrowAnyException();
    assertThat(subscriber.fetch()).isEmpty();
  }

  @Test
  void givenNetworkWithoutSubscribers_whenPublish_thenNothingHappens() {
    Publisher<String, String> publisher = NetworkBuilder.<String, String>newNetwork().build();

    assertThatCode(() -> publisher.publish("widgets", "sprocket")).doesNotThrowAnyException();
    assertThat(publisher.topics()).isEmpty();
  }

  @Test
  void givenTopicListedTwice_whenPublish_thenDeliveredTwice() {
    // Arrange
    NetworkBuilder<String, String> builder = NetworkBuilder.newNetwork();
    Subscriber<String, String> subscriber = builder.addSubscriber("widgets", "widgets");
    Publisher<String, String> publisher = builder.build();

    // Act
    publisher.publish("widgets", "sprocket");

    // Assert
    assertThat(subscriber.fetch()).containsExactly(new Message<>("widgets", "sprocket"),
        new Message<>("widgets", "sprocket"));
  }

  @Test
  void givenClosedSubscriber_whenPublish_thenOtherSubscribersStillReceive() {
    // Arrange
    NetworkBuilder<String, String> builder = NetworkBuilder.newNetwork();
    Subscriber<String, String> gone = builder.addSubscriber("widgets");
    Subscriber<String, String> present = builder.addSubscriber("widgets");
    Publisher<String, String> publisher = builder.build();
    gone.close();

    // Act & Assert
    assertThatCode(() -> publisher.publish("widgets", "sprocket")).doesNotThrowAnyException();
    assertThat(present.fetch()).containsExactly(new Message<>("widgets", "sprocket"));
    assertThat(gone.fetch()).isEmpty();
    assertThat(publisher.checkMetrics().failed()).isEqualTo(1);
  }

  @Test
  @Timeout(30)
  void givenSubscriberDroppedWithoutClose_whenCollected_thenPublishesToItFail() throws Exception {
    // Arrange
    NetworkBuilder<String, String> builder = NetworkBuilder.newNetwork();
    WeakReference<Subscriber<String, String>> dropped = addUnreachableSubscriber(builder);
    Subscriber<String, String> kept = builder.addSubscriber("widgets");
    Publisher<String, String> publisher = builder.build();

    // Act
    while (dropped.get() != null) {
      System.gc();
      Thread.sleep(10);
    }
    // The mailbox is closed asynchronously after collection
    while (publisher.checkMetrics().failed() == 0) {
      publisher.publish("widgets", "sprocket");
      Thread.sleep(10);
    }

    // Assert
    Publisher.Metrics metrics = publisher.checkMetrics();
    assertThat(metrics.failed()).isGreaterThan(0);
    assertThat(kept.fetch()).hasSize((int) metrics.published());
  }

  private static WeakReference<Subscriber<String, String>> addUnreachableSubscriber(
      NetworkBuilder<String, String> builder) {
    return new WeakReference<>(builder.addSubscriber("widgets"));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 8})
  @Timeout(30)
  void givenPublisherCopiesOnManyThreads_whenPublishConcurrently_thenEverySubscriberGetsEverything(
      int threads) throws Exception {
    // Arrange
    final int perThread = 500;
    NetworkBuilder<String, Integer> builder = NetworkBuilder.newNetwork();
    Subscriber<String, Integer> first = builder.addSubscriber("numbers");
    Subscriber<String, Integer> second = builder.addSubscriber("numbers", "other");
    Publisher<String, Integer> publisher = builder.build();

    CountDownLatch start = new CountDownLatch(1);
    List<Thread> publishers = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      final int offset = t * perThread;
      final Publisher<String, Integer> copy = publisher.copy();
      publishers.add(new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int i = 0; i < perThread; i++)
          copy.publish("numbers", offset + i);
      }));
    }

    // Act
    publishers.forEach(Thread::start);
    start.countDown();
    for (Thread thread : publishers)
      thread.join();

    // Assert
    for (Subscriber<String, Integer> subscriber : List.of(first, second)) {
      List<Message<String, Integer>> received = subscriber.fetch();
      assertThat(received).hasSize(threads * perThread);

      // Each publisher's messages arrive in the order it sent them
      int[] next = new int[threads];
      for (Message<String, Integer> message : received) {
        int thread = message.content() / perThread;
        assertThat(message.content() % perThread).isEqualTo(next[thread]);
        next[thread] = next[thread] + 1;
      }
    }
  }
}
