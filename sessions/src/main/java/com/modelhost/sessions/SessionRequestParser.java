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

package com.modelhost.sessions;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Recognizes session control messages embedded in request bodies.
 *
 * <p>
 * A control message is a JSON object whose only field is
 * {@code requestType}, set to {@code NEW_SESSION} or {@code CLOSE}. Anything
 * else without that field is an ordinary inference request.
 */
public final class SessionRequestParser {

  public static final String REQUEST_TYPE_FIELD = "requestType";

  private SessionRequestParser() {
    // Utility class
  }

  /**
   * Returns true if the body is an object carrying the request type field.
   *
   * @param body
   *            the request body, may be null
   * @return true if the field is present
   */
  public static boolean hasRequestType(JsonNode body) {
    return body != null && body.isObject() && body.has(REQUEST_TYPE_FIELD);
  }

  /**
   * Parses the control message of a body.
   *
   * @param body
   *            the request body, may be null
   * @return the request type, or null for an ordinary request
   * @throws SessionException
   *             with reason {@code MALFORMED_REQUEST} if the field is present
   *             but not a recognized value or not the only field
   */
  public static SessionRequestType parse(JsonNode body) {
    if (!hasRequestType(body)) {
      return null;
    }
    if (body.size() != 1) {
      throw malformed("session requests must contain only the " + REQUEST_TYPE_FIELD + " field");
    }
    JsonNode value = body.get(REQUEST_TYPE_FIELD);
    SessionRequestType type = value.isTextual() ? SessionRequestType.fromValue(value.asText()) : null;
    if (type == null) {
      throw malformed("invalid " + REQUEST_TYPE_FIELD + ": " + value);
    }
    return type;
  }

  private static SessionException malformed(String message) {
    return new SessionException(SessionException.Reason.MALFORMED_REQUEST, message);
  }
}
