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

import com.modelhost.core.InvocationRequest;

/**
 * Reserved HTTP headers of the session protocol.
 */
public final class SessionHeaders {

  /** Carries the session id on ordinary and close requests. */
  public static final String SESSION_ID = "X-Amzn-SageMaker-Session-Id";

  /** Returned on create: {@code "<uuid>; Expires=<unix-timestamp>"}. */
  public static final String NEW_SESSION_ID = "X-Amzn-SageMaker-New-Session-Id";

  /** Returned on close with the id of the closed session. */
  public static final String CLOSED_SESSION_ID = "X-Amzn-SageMaker-Closed-Session-Id";

  private static final String EXPIRES_PREFIX = "Expires=";

  private SessionHeaders() {
    // Utility class
  }

  /**
   * Reads the session id header of a request.
   *
   * @param request
   *            the request
   * @return the trimmed header value, or null if absent
   */
  public static String getSessionId(InvocationRequest request) {
    String value = request.getHeader(SESSION_ID);
    return value != null ? value.trim() : null;
  }

  /**
   * Formats the value of the new-session header.
   *
   * @param session
   *            the created session
   * @return the header value
   */
  public static String formatNewSessionId(Session session) {
    return session.getId() + "; " + EXPIRES_PREFIX + session.getExpiration().getEpochSecond();
  }

  /**
   * Parses a new-session header value.
   *
   * @param value
   *            the header value
   * @return the parsed value
   * @throws IllegalArgumentException
   *             if the value is not {@code "<id>; Expires=<seconds>"}
   */
  public static NewSessionId parseNewSessionId(String value) {
    if (value == null) {
      throw new IllegalArgumentException("new session header is missing");
    }
    String[] parts = value.split(";", 2);
    String expires = parts.length == 2 ? parts[1].trim() : "";
    if (parts[0].trim().isEmpty() || !expires.startsWith(EXPIRES_PREFIX)) {
      throw new IllegalArgumentException("malformed new session header: " + value);
    }
    try {
      return new NewSessionId(parts[0].trim(), Long.parseLong(expires.substring(EXPIRES_PREFIX.length())));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("malformed expiration in new session header: " + value, e);
    }
  }

  /**
   * The parts of a new-session header.
   */
  public static final class NewSessionId {
    private final String sessionId;
    private final long expires;

    NewSessionId(String sessionId, long expires) {
      this.sessionId = sessionId;
      this.expires = expires;
    }

    public String getSessionId() {
      return sessionId;
    }

    /** Expiration in seconds since the epoch. */
    public long getExpires() {
      return expires;
    }
  }
}
