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

/**
 * The producing side of a {@link Mailbox}. A channel may be shared by any number of publishing
 * threads.
 *
 * @param <T> the message type
 */
public interface Channel<T> {
  /**
   * Attempts to enqueue the message. This method never blocks. Returns {@code false} if the
   * mailbox will not accept the message, either because its consumer has closed it or because it
   * is bounded and full. Callers must not treat {@code false} as an error condition.
   * 
   * @param message the message to enqueue
   * @return {@code true} if the message was enqueued, {@code false} otherwise
   * @throws NullPointerException if message is {@code null}
   */
  public boolean tryPublish(T message);
}
