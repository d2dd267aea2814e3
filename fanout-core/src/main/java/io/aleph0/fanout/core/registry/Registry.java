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
package io.aleph0.fanout.core.registry;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import io.aleph0.fanout.core.transport.Channel;

/**
 * Maps each topic to the channels of the mailboxes subscribed to it, in registration order. A
 * registry starts out mutable during network setup and is {@link #freeze() frozen} into an
 * immutable copy that publishers share.
 *
 * @param <TopicT> the topic type
 * @param <T> the message type carried by the channels
 */
public final class Registry<TopicT, T> {
  public static <TopicT, T> Registry<TopicT, T> empty() {
    return new Registry<>(new LinkedHashMap<>(), false);
  }

  private final Map<TopicT, List<Channel<T>>> subscriptions;
  private final boolean frozen;

  private Registry(Map<TopicT, List<Channel<T>>> subscriptions, boolean frozen) {
    this.subscriptions = subscriptions;
    this.frozen = frozen;
  }

  /**
   * Appends the channel to the topic's subscription list, creating the list if this is the first
   * subscription to the topic. Registering the same channel twice under one topic is allowed and
   * results in two deliveries per message.
   *
   * @throws UnsupportedOperationException if this registry is frozen
   */
  public void register(TopicT topic, Channel<T> channel) {
    requireNonNull(topic, "topic");
    requireNonNull(channel, "channel");
    if (frozen)
      throw new UnsupportedOperationException("frozen");
    subscriptions.computeIfAbsent(topic, k -> new ArrayList<>()).add(channel);
  }

  /**
   * Returns an immutable copy of this registry. Later registrations against this registry are not
   * visible in the copy.
   */
  public Registry<TopicT, T> freeze() {
    if (frozen)
      return this;
    final Map<TopicT, List<Channel<T>>> copy = new LinkedHashMap<>();
    for (Map.Entry<TopicT, List<Channel<T>>> e : subscriptions.entrySet())
      copy.put(e.getKey(), unmodifiableList(new ArrayList<>(e.getValue())));
    return new Registry<>(unmodifiableMap(copy), true);
  }

  public boolean isFrozen() {
    return frozen;
  }

  /**
   * @return the channels subscribed to the topic in registration order, or an empty list if there
   *         are none
   */
  public List<Channel<T>> lookup(TopicT topic) {
    requireNonNull(topic, "topic");
    final List<Channel<T>> result = subscriptions.get(topic);
    if (result == null)
      return List.of();
    return frozen ? result : unmodifiableList(result);
  }

  public Set<TopicT> topics() {
    return unmodifiableSet(subscriptions.keySet());
  }

  public int subscriptions(TopicT topic) {
    return lookup(topic).size();
  }
}
