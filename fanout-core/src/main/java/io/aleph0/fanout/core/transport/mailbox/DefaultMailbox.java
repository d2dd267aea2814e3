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
package io.aleph0.fanout.core.transport.mailbox;

import static java.util.Objects.requireNonNull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.fanout.core.build.MailboxBuilder;
import io.aleph0.fanout.core.transport.Channel;
import io.aleph0.fanout.core.transport.Mailbox;

public class DefaultMailbox<T> implements Mailbox<T> {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultMailbox.class);

  public static final int UNBOUNDED = Integer.MAX_VALUE;

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  public static class Builder<T> implements MailboxBuilder<T> {
    private int capacity = UNBOUNDED;

    /**
     * Bounds the mailbox. A full mailbox rejects new messages instead of blocking the publisher.
     * 
     * @param capacity the maximum number of pending messages
     * @return this builder
     */
    public Builder<T> setCapacity(int capacity) {
      if (capacity < 1)
        throw new IllegalArgumentException("capacity must be at least one");
      this.capacity = capacity;
      return this;
    }

    @Override
    public Mailbox<T> build() {
      return new DefaultMailbox<>(capacity);
    }
  }

  private final ArrayDeque<T> queue = new ArrayDeque<>();

  private final int capacity;

  /**
   * Lock for synchronizing access to the deque.
   */
  private final ReentrantLock lock = new ReentrantLock();

  private boolean closed = false;

  private final AtomicLong produced = new AtomicLong(0);

  private final AtomicLong rejected = new AtomicLong(0);

  private final AtomicLong consumed = new AtomicLong(0);

  private final Channel<T> channel = new Channel<>() {
    @Override
    public boolean tryPublish(T message) {
      requireNonNull(message, "message");

      boolean result;

      lock.lock();
      try {
        if (!closed && queue.size() < capacity)
          result = queue.offer(message);
        else
          result = false;
      } finally {
        lock.unlock();
      }

      if (result)
        produced.incrementAndGet();
      else
        rejected.incrementAndGet();

      LOGGER.atDebug().addKeyValue("result", result).log("tryPublish");

      return result;
    }
  };

  public DefaultMailbox() {
    this(UNBOUNDED);
  }

  public DefaultMailbox(int capacity) {
    if (capacity < 1)
      throw new IllegalArgumentException("capacity must be at least one");
    this.capacity = capacity;
  }

  @Override
  public Channel<T> channel() {
    return channel;
  }

  @Override
  public T tryReceive() {
    T result;

    lock.lock();
    try {
      result = queue.poll();
    } finally {
      lock.unlock();
    }

    if (result != null)
      consumed.incrementAndGet();

    LOGGER.atDebug().addKeyValue("result", result).log("tryReceive");

    return result;
  }

  @Override
  public List<T> drain() {
    final List<T> result = new ArrayList<>();
    drainTo(result);
    return result;
  }

  /**
   * Messages are taken out of the mailbox under the lock and handed to the collection outside it.
   * If the collection throws, the messages it did not accept are put back at the head of the
   * mailbox, ahead of anything published in the meantime, and the exception propagates.
   */
  @Override
  public int drainTo(Collection<? super T> collection) {
    requireNonNull(collection, "collection");

    final List<T> drained;
    lock.lock();
    try {
      drained = new ArrayList<>(queue);
      queue.clear();
    } finally {
      lock.unlock();
    }

    int count = 0;
    try {
      for (T message : drained) {
        collection.add(message);
        count = count + 1;
      }
    } finally {
      if (count < drained.size())
        restore(drained.subList(count, drained.size()));
      consumed.addAndGet(count);
    }

    LOGGER.atDebug().addKeyValue("count", count).log("drain");

    return count;
  }

  private void restore(List<T> messages) {
    lock.lock();
    try {
      // Restored messages may briefly exceed the capacity of a bounded mailbox.
      if (closed == false) {
        for (int i = messages.size() - 1; i >= 0; i--)
          queue.addFirst(messages.get(i));
      }
    } finally {
      lock.unlock();
    }

    LOGGER.atDebug().addKeyValue("restored", messages.size()).log("drain interrupted");
  }

  @Override
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    int discarded = 0;

    lock.lock();
    try {
      if (closed == false) {
        closed = true;
        discarded = queue.size();
        queue.clear();
      }
    } finally {
      lock.unlock();
    }

    LOGGER.atDebug().addKeyValue("discarded", discarded).log("close");
  }

  @Override
  public Mailbox.Metrics checkMetrics() {
    final long pending;
    lock.lock();
    try {
      pending = queue.size();
    } finally {
      lock.unlock();
    }
    final long produced = this.produced.get();
    final long rejected = this.rejected.get();
    final long consumed = this.consumed.get();
    return new Mailbox.Metrics(pending, produced, rejected, consumed);
  }

  @Override
  public Mailbox.Metrics flushMetrics() {
    final Mailbox.Metrics metrics = checkMetrics();
    this.produced.set(0);
    this.rejected.set(0);
    this.consumed.set(0);
    return metrics;
  }
}
