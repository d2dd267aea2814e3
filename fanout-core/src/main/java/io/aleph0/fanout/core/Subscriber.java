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

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import java.lang.ref.Cleaner;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import io.aleph0.fanout.core.build.NetworkBuilder;
import io.aleph0.fanout.core.transport.Mailbox;

/**
 * Receives the messages published to the topics it declared when it was added to the network.
 * Created by {@link NetworkBuilder#addSubscriber(Collection)}. A subscriber is meant to be used by
 * one consuming thread.
 *
 * <p>
 * A subscriber that becomes unreachable without being closed has its mailbox closed once it is
 * collected, so publishers stop queueing messages for it.
 *
 * @param <TopicT> the topic type
 * @param <ContentT> the content type
 */
public class Subscriber<TopicT, ContentT>
    implements Measureable<Mailbox.Metrics>, AutoCloseable {
  private static final Cleaner CLEANER = Cleaner.create();

  private final List<TopicT> topics;
  private final Mailbox<Message<TopicT, ContentT>> inbox;
  private final Cleaner.Cleanable cleanable;

  public Subscriber(List<TopicT> topics, Mailbox<Message<TopicT, ContentT>> inbox) {
    this.topics = unmodifiableList(new ArrayList<>(requireNonNull(topics, "topics")));
    this.inbox = requireNonNull(inbox, "inbox");
    // Must capture only the mailbox, or the subscriber never becomes unreachable.
    this.cleanable = CLEANER.register(this, inbox::close);
  }

  /**
   * Removes and returns every pending message, in arrival order. Never waits for messages to
   * arrive; returns an empty list if none are pending.
   */
  public List<Message<TopicT, ContentT>> fetch() {
    return inbox.drain();
  }

  /**
   * Like {@link #fetch()}, but appends the pending messages to the given collection.
   *
   * @return the number of messages added
   */
  public int fetchTo(Collection<? super Message<TopicT, ContentT>> messages) {
    return inbox.drainTo(messages);
  }

  /**
   * @return the topics this subscriber registered for, as given at registration
   */
  public List<TopicT> topics() {
    return topics;
  }

  /**
   * Stops accepting messages. Pending messages are discarded, and later deliveries to this
   * subscriber are silently dropped by publishers. The subscriber stays registered.
   */
  @Override
  public void close() {
    cleanable.clean();
  }

  public boolean isClosed() {
    return inbox.isClosed();
  }

  @Override
  public Mailbox.Metrics checkMetrics() {
    return inbox.checkMetrics();
  }

  @Override
  public Mailbox.Metrics flushMetrics() {
    return inbox.flushMetrics();
  }
}
