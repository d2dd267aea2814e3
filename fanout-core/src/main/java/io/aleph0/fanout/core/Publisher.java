/*-
 * =================================LICENSE_START==================================
 * fanout-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * ==================================LICENSE_END===================================
 */
package io.aleph0.fanout.core;

import static java.util.Objects.requireNonNull;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.fanout.core.build.NetworkBuilder;
import io.aleph0.fanout.core.registry.Registry;
import io.aleph0.fanout.core.transport.Channel;

/**
 * Sends messages to the subscribers of a network. Created by {@link NetworkBuilder#build()}. To add
 * more publishers, hand out {@link #copy() copies}. All topic filtering happens in the publishing
 * thread, and publishing never blocks.
 *
 * <p>
 * Instances are safe for concurrent use.
 *
 * @param <TopicT> the topic type
 * @param <ContentT> the content type
 */
public class Publisher<TopicT, ContentT> implements Measureable<Publisher.Metrics> {
  private static final Logger LOGGER = LoggerFactory.getLogger(Publisher.class);

  public static record Metrics(
      /**
       * The number of calls to publish.
       */
      long published,

      /**
       * The number of published messages whose topic had no subscribers.
       */
      long unrouted,

      /**
       * The number of messages accepted by subscriber mailboxes.
       */
      long delivered,

      /**
       * The number of messages subscriber mailboxes refused.
       */
      long failed) {
    public Metrics {
      if (published < 0)
        throw new IllegalArgumentException("published must be at least zero");
      if (unrouted < 0)
        throw new IllegalArgumentException("unrouted must be at least zero");
      if (delivered < 0)
        throw new IllegalArgumentException("delivered must be at least zero");
      if (failed < 0)
        throw new IllegalArgumentException("failed must be at least zero");
    }
  }

  private final AtomicLong published = new AtomicLong(0);
  private final AtomicLong unrouted = new AtomicLong(0);
  private final AtomicLong delivered = new AtomicLong(0);
  private final AtomicLong failed = new AtomicLong(0);

  private final Registry<TopicT, Message<TopicT, ContentT>> registry;
  private final ContentCopier<ContentT> copier;

  public Publisher(Registry<TopicT, Message<TopicT, ContentT>> registry,
      ContentCopier<ContentT> copier) {
    this.registry = requireNonNull(registry, "registry");
    this.copier = requireNonNull(copier, "copier");
    if (!registry.isFrozen())
      throw new IllegalArgumentException("registry must be frozen");
  }

  /**
   * Sends a message to every subscriber of the given topic, in the order they subscribed. Each
   * subscriber receives its own copy of the content. Publishing to a topic without subscribers has
   * no effect. A subscriber that no longer accepts messages is skipped without affecting the
   * others.
   *
   * @param topic the topic
   * @param content the content
   */
  public void publish(TopicT topic, ContentT content) {
    requireNonNull(topic, "topic");
    requireNonNull(content, "content");

    published.incrementAndGet();

    final List<Channel<Message<TopicT, ContentT>>> outbox = registry.lookup(topic);
    if (outbox.isEmpty()) {
      unrouted.incrementAndGet();
      LOGGER.atDebug().addKeyValue("topic", topic).log("unrouted");
      return;
    }

    for (Channel<Message<TopicT, ContentT>> subscriber : outbox) {
      boolean accepted;
      try {
        accepted = subscriber.tryPublish(new Message<>(topic, copier.copy(content)));
      } catch (RuntimeException e) {
        LOGGER.atDebug().addKeyValue("topic", topic).setCause(e).log("delivery failed");
        accepted = false;
      }
      if (accepted) {
        delivered.incrementAndGet();
      } else {
        failed.incrementAndGet();
        LOGGER.atDebug().addKeyValue("topic", topic).log("dropped");
      }
    }
  }

  /**
   * Returns a new publisher for the same network. The copy shares this publisher's subscriptions
   * and keeps its own metrics.
   */
  public Publisher<TopicT, ContentT> copy() {
    return new Publisher<>(registry, copier);
  }

  /**
   * @return the topics that have at least one subscriber
   */
  public Set<TopicT> topics() {
    return registry.topics();
  }

  @Override
  public Metrics checkMetrics() {
    return new Metrics(published.get(), unrouted.get(), delivered.get(), failed.get());
  }

  @Override
  public Metrics flushMetrics() {
    final Metrics result = checkMetrics();
    published.set(0L);
    unrouted.set(0L);
    delivered.set(0L);
    failed.set(0L);
    return result;
  }
}
