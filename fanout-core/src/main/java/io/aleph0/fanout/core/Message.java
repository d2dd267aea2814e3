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

/**
 * A delivered message: the topic it was published under and the subscriber's own copy of the
 * content.
 *
 * @param <TopicT> the topic type
 * @param <ContentT> the content type
 */
public record Message<TopicT, ContentT>(TopicT topic, ContentT content) {
  public Message {
    requireNonNull(topic, "topic");
    requireNonNull(content, "content");
  }
}
