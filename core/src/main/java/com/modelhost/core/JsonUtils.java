/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.modelhost.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides JSON serialization and deserialization utilities shared
 * by the request pipeline and the session store.
 */
public final class JsonUtils {

  /** Error code used when a request body is not valid JSON. */
  public static final String INVALID_JSON = "INVALID_JSON";

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws ModelHostException
   *             if serialization fails
   */
  public static String toJson(Object value) throws ModelHostException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new ModelHostException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts a JsonNode to the specified type.
   *
   * @param node
   *            the JsonNode
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the converted object
   * @throws ModelHostException
   *             if conversion fails
   */
  public static <T> T fromJsonNode(JsonNode node, Class<T> clazz) throws ModelHostException {
    try {
      return objectMapper.treeToValue(node, clazz);
    } catch (JsonProcessingException e) {
      throw new ModelHostException("Failed to convert JsonNode: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws ModelHostException
   *             with error code {@link #INVALID_JSON} if parsing fails
   */
  public static JsonNode parseJson(String json) throws ModelHostException {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ModelHostException("JSON decode error: " + e.getOriginalMessage(), e, INVALID_JSON, null);
    }
  }

  /**
   * Sets a value inside an object node at a dotted path such as
   * {@code metadata.session_id}, creating intermediate objects as needed. An
   * intermediate value that is not an object is replaced.
   *
   * @param root
   *            the object to modify
   * @param dottedPath
   *            the target path
   * @param value
   *            the value to set
   * @return the modified root
   */
  public static ObjectNode setPath(ObjectNode root, String dottedPath, JsonNode value) {
    if (dottedPath == null || dottedPath.isEmpty()) {
      throw new IllegalArgumentException("path must not be empty");
    }
    String[] segments = dottedPath.split("\\.");
    ObjectNode current = root;
    for (int i = 0; i < segments.length - 1; i++) {
      JsonNode child = current.get(segments[i]);
      if (child instanceof ObjectNode) {
        current = (ObjectNode) child;
      } else {
        current = current.putObject(segments[i]);
      }
    }
    current.set(segments[segments.length - 1], value);
    return root;
  }
}
