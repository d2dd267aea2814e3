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
package io.aleph0.fanout.core.build;

import static java.util.Objects.requireNonNull;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.fanout.core.ContentCopier;
import io.aleph0.fanout.core.Message;
import io.aleph0.fanout.core.Publisher;
import io.aleph0.fanout.core.Subscriber;
import io.aleph0.fanout.core.registry.Registry;
import io.aleph0.fanout.core.transport.Mailbox;
import io.aleph0.fanout.core.transport.mailbox.DefaultMailbox;

/**
 * Assembles a network. Subscribers are added first, each with the complete list of topics it will
 * ever receive; {@link #build()} then ends setup and returns the first {@link Publisher}. A builder
 * can be built only once, and accepts no changes afterwards.
 *
 * @param <TopicT> the topic type
 * @param <ContentT> the content type
 */
public class NetworkBuilder<TopicT, ContentT> {
  private static final Logger LOGGER = LoggerFactory.getLogger(NetworkBuilder.class);

  public static <TopicT, ContentT> NetworkBuilder<TopicT, ContentT> newNetwork() {
    return new NetworkBuilder<>();
  }

  private MailboxBuilder<Message<TopicT, ContentT>> mailbox = DefaultMailbox.builder();
  private ContentCopier<ContentT> copier = ContentCopier.identity();

  /**
   * The setup registry. Released by {@link #build()}, after which the builder is spent.
   */
  private Registry<TopicT, Message<TopicT, ContentT>> registry = Registry.empty();

  private int subscribers = 0;

  public NetworkBuilder<TopicT, ContentT> setMailbox(
      MailboxBuilder<Message<TopicT, ContentT>> mailbox) {
    requireNonNull(mailbox, "mailbox");
    checkConfigurable();
    this.mailbox = mailbox;
    return this;
  }

  public NetworkBuilder<TopicT, ContentT> setContentCopier(ContentCopier<ContentT> copier) {
    requireNonNull(copier, "copier");
    checkConfigurable();
    this.copier = copier;
    return this;
  }

  /**
   * Adds a subscriber to the network with the complete list of topics it expects to receive. The
   * list cannot be changed later. A topic listed twice is subscribed twice, so the subscriber
   * receives each message on that topic twice.
   *
   * @param topics the topics, possibly empty
   * @return the new subscriber
   * @throws IllegalStateException if the network has already been built
   */
  public Subscriber<TopicT, ContentT> addSubscriber(Collection<TopicT> topics) {
    requireNonNull(topics, "topics");
    checkNotBuilt();

    final List<TopicT> subscription = List.copyOf(topics);

    final Mailbox<Message<TopicT, ContentT>> inbox = mailbox.build();
    for (TopicT topic : subscription)
      registry.register(topic, inbox.channel());
    subscribers = subscribers + 1;

    LOGGER.atDebug().addKeyValue("subscriber", subscribers).addKeyValue("topics", subscription)
        .log("addSubscriber");

    return new Subscriber<>(subscription, inbox);
  }

  @SafeVarargs
  public final Subscriber<TopicT, ContentT> addSubscriber(TopicT... topics) {
    requireNonNull(topics, "topics");
    return addSubscriber(Arrays.asList(topics));
  }

  /**
   * Finishes network setup and returns a publisher for the network. No more subscribers can be
   * added after this.
   *
   * @return the publisher
   * @throws IllegalStateException if the network has already been built
   */
  public Publisher<TopicT, ContentT> build() {
    checkNotBuilt();

    final Registry<TopicT, Message<TopicT, ContentT>> frozen = registry.freeze();
    registry = null;

    LOGGER.atInfo().addKeyValue("subscribers", subscribers)
        .addKeyValue("topics", frozen.topics().size()).log("built network");

    return new Publisher<>(frozen, copier);
  }

  private void checkNotBuilt() {
    if (registry == null)
      throw new IllegalStateException("built");
  }

  private void checkConfigurable() {
    checkNotBuilt();
    if (subscribers > 0)
      throw new IllegalStateException("subscribers already added");
  }
}
