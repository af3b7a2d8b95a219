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

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.Maps;

/**
 * The types of message a streamed search delivers.
 *
 * @since 1.0
 */
public enum StreamMessageType {
  /** Only the response envelope. */
  SEARCH_RESPONSE_METADATA("search_response_metadata"),
  /** Only rows, to merge per the stored envelope. */
  SEARCH_RESPONSE_HITS("search_response_hits"),
  /** Rows and envelope together. */
  SEARCH_RESPONSE("search_response"),
  /** Terminal failure. */
  ERROR("error"),
  /** Terminal success. */
  END("end"),
  /** Completion percentage. */
  EVENT_PROGRESS("event_progress");

  private static final Map<String, StreamMessageType> BY_NAME = Maps.newHashMap();
  static {
    for (final StreamMessageType type : values()) {
      BY_NAME.put(type.name, type);
    }
  }

  private final String name;

  private StreamMessageType(final String name) {
    this.name = name;
  }

  /** @return The wire name. */
  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * @param name A wire name.
   * @return The type or null if the name is unknown.
   */
  @JsonCreator
  public static StreamMessageType fromName(final String name) {
    return name == null ? null : BY_NAME.get(name);
  }
}
