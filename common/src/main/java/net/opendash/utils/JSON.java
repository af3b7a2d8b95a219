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
package net.opendash.utils;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;

/**
 * Shared Jackson mapper and helpers. The mapper is thread safe once
 * configured so it's shared by everything that reads or writes JSON.
 *
 * @since 1.0
 */
public final class JSON {

  /** The shared mapper. */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    jsonMapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    jsonMapper.configure(
        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Deserializes a JSON formatted string to a specific class type.
   * @param json The string to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data was null or parsing
   * failed
   */
  public static final <T> T parseToObject(final String json,
                                          final Class<T> pojo) {
    if (Strings.isNullOrEmpty(json)) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return jsonMapper.readValue(json, pojo);
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }

  /**
   * Deserializes a JSON formatted string to a specific generic type.
   * @param json The string to deserialize
   * @param type A type reference for the result
   * @return An object of the given type
   * @throws IllegalArgumentException if the data was null or parsing
   * failed
   */
  public static final <T> T parseToObject(final String json,
                                          final TypeReference<T> type) {
    if (Strings.isNullOrEmpty(json)) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (type == null) {
      throw new IllegalArgumentException("Missing type reference");
    }
    try {
      return jsonMapper.readValue(json, type);
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }

  /**
   * Parses a string into a tree.
   * @param json The string to parse.
   * @return A JsonNode
   * @throws IllegalArgumentException if the data was null or parsing
   * failed
   */
  public static final JsonNode parseToNode(final String json) {
    if (Strings.isNullOrEmpty(json)) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    try {
      return jsonMapper.readTree(json);
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }

  /**
   * Serializes the given object to a JSON string
   * @param object The object to serialize
   * @return A JSON formatted string
   * @throws IllegalArgumentException if the object was null
   * @throws IllegalStateException if the object could not be serialized
   */
  public static final String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return jsonMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * Converts the object into a tree.
   * @param object The object to convert, may be null.
   * @return A JsonNode, a NullNode if the object was null.
   */
  public static final JsonNode toNode(final Object object) {
    return jsonMapper.valueToTree(object);
  }

  /** @return The shared mapper. Do not reconfigure it. */
  public static final ObjectMapper getMapper() {
    return jsonMapper;
  }
}
