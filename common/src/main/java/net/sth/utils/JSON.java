// This file is part of STH.
// Copyright (C) 2024  The STH Authors.
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
package net.sth.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson mapper and serialization helpers. The mapper is thread safe
 * once configured so a single instance is used everywhere.
 */
public final class JSON {

  private static final ObjectMapper jsonMapper = new ObjectMapper();

  private JSON() {
    // static helpers only
  }

  /** @return The shared mapper. */
  public static ObjectMapper getMapper() {
    return jsonMapper;
  }

  /** @return A new, empty object node. */
  public static ObjectNode newObject() {
    return jsonMapper.createObjectNode();
  }

  /** @return A new, empty array node. */
  public static ArrayNode newArray() {
    return jsonMapper.createArrayNode();
  }

  /**
   * Converts the POJO into a tree.
   * @param object A non-null object to convert.
   * @return The tree representation.
   * @throws IllegalArgumentException if the object was null or could not be
   * converted.
   */
  public static JsonNode toTree(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object cannot be null.");
    }
    return jsonMapper.valueToTree(object);
  }

  /**
   * Serializes the given object to a JSON string.
   * @param object A non-null object to serialize.
   * @return The JSON string.
   * @throws IllegalArgumentException if the object was null or serialization
   * failed.
   */
  public static String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object cannot be null.");
    }
    try {
      return jsonMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize: " + object, e);
    }
  }
}
