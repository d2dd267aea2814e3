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
package io.aleph0.fanout.core.transport;

import java.util.Collection;
import java.util.List;
import io.aleph0.fanout.core.Measureable;

/**
 * An ordered, single-consumer, multi-producer message queue. Producers reach the mailbox through
 * its {@link #channel() channel}; the consumer drains it directly.
 *
 * @param <T> the message type
 */
public interface Mailbox<T> extends Measureable<Mailbox.Metrics>, AutoCloseable {
  public static record Metrics(
      /**
       * The number of messages that are currently in the mailbox.
       */
      long pending,

      /**
       * The number of messages that have been enqueued.
       */
      long produced,

      /**
       * The number of messages the mailbox refused, because it was closed or full.
       */
      long rejected,

      /**
       * The number of messages that have been consumed from the mailbox.
       */
      long consumed) {
    public Metrics {
      if (pending < 0)
        throw new IllegalArgumentException("pending must be at least zero");
      if (produced < 0)
        throw new IllegalArgumentException("produced must be at least zero");
      if (rejected < 0)
        throw new IllegalArgumentException("rejected must be at least zero");
      if (consumed < 0)
        throw new IllegalArgumentException("consumed must be at least zero");
    }
  }

  /**
   * Returns the producing side of this mailbox. Every call returns the same channel.
   */
  public Channel<T> channel();

  /**
   * Attempts to receive a message from the mailbox. This method will return immediately, even if
   * there are no messages available. Returns {@code null} if the mailbox is empty or closed.
   * 
   * @return the oldest message in the mailbox, or {@code null} if there is none
   */
  public T tryReceive();

  /**
   * Removes and returns every message in the mailbox at the moment of the call, oldest first. This
   * method never waits for messages to arrive. Messages enqueued after the snapshot is taken stay
   * in the mailbox for the next call.
   * 
   * @return the drained messages, possibly empty
   */
  public List<T> drain();

  /**
   * Like {@link #drain()}, but appends the messages to the given collection.
   * 
   * @param collection the collection to receive the messages
   * @return the number of messages added
   */
  public int drainTo(Collection<? super T> collection);

  public boolean isClosed();

  /**
   * Closes the consuming side. Pending messages are discarded and the {@link #channel() channel}
   * rejects every message from now on. Closing an already-closed mailbox has no effect.
   */
  @Override
  public void close();
}
