// This file is part of OpenDash.
// Copyright (C) 2026  The OpenDash Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.opendash.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * One message of a streamed search.
 *
 * @since 1.0
 */
public class StreamMessage {
  private final StreamMessageType type;
  private final String raw_type;
  private final JsonNode content;

  /**
   * Default ctor.
   * @param raw_type The wire type.
   * @param content The content, may be null.
   */
  public StreamMessage(final String raw_type, final JsonNode content) {
    this.raw_type = raw_type;
    type = StreamMessageType.fromName(raw_type);
    this.content = content == null ? NullNode.getInstance() : content;
  }

  /**
   * @param type The type.
   * @param content The content.
   * @return A message.
   */
  public static StreamMessage of(final StreamMessageType type,
                                 final JsonNode content) {
    return new StreamMessage(type.getName(), content);
  }

  /**
   * Reads a {@code {"type": ..., "content": ...}} frame.
   * @param frame The parsed frame.
   * @return A message, its type null if unknown.
   */
  public static StreamMessage fromNode(final JsonNode frame) {
    return new StreamMessage(frame.path("type").asText(null),
        frame.get("content"));
  }

  /** @return The type, null if the wire type is unknown. */
  public StreamMessageType getType() {
    return type;
  }

  public String getRawType() {
    return raw_type;
  }

  /** @return The content, a NullNode when absent. */
  public JsonNode getContent() {
    return content;
  }

  @Override
  public String toString() {
    return "type=" + raw_type + ", content=" + content;
  }
}
