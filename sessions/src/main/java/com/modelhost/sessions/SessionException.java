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

import com.modelhost.core.ModelHostException;

/**
 * SessionException is raised by the session subsystem. Its {@link Reason} is
 * exposed as the error code so that the HTTP layer can pick a status code
 * without knowing about sessions.
 */
public class SessionException extends ModelHostException {

  /**
   * Why a session operation failed.
   */
  public enum Reason {
    /** Unusable TTL or storage location at construction time. */
    CONFIGURATION,
    /** An argument such as a session id or key was empty or unsafe. */
    INVALID_ARGUMENT,
    /** The referenced session is not live. */
    NOT_FOUND,
    /** The body violates the session request format. */
    MALFORMED_REQUEST,
    /** Session input was sent while stateful sessions are turned off. */
    SESSIONS_DISABLED,
    /** Creating or closing a session failed for an unexpected reason. */
    FAILED_DEPENDENCY
  }

  private final Reason reason;

  /**
   * Creates a new SessionException.
   *
   * @param reason
   *            the failure reason
   * @param message
   *            the error message
   */
  public SessionException(Reason reason, String message) {
    this(reason, message, null, null);
  }

  /**
   * Creates a new SessionException with a cause and details.
   *
   * @param reason
   *            the failure reason
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause, may be null
   * @param details
   *            additional details such as the session id, may be null
   */
  public SessionException(Reason reason, String message, Throwable cause, Object details) {
    super(message, cause, reason.name(), details);
    this.reason = reason;
  }

  /**
   * Returns the failure reason.
   *
   * @return the reason
   */
  public Reason getReason() {
    return reason;
  }

  static SessionException notFound(String sessionId) {
    return new SessionException(Reason.NOT_FOUND, "session not found: " + sessionId, null, sessionId);
  }

  static SessionException expired(String sessionId) {
    return new SessionException(Reason.NOT_FOUND, "session expired: " + sessionId, null, sessionId);
  }

  static SessionException invalidArgument(String message) {
    return new SessionException(Reason.INVALID_ARGUMENT, message);
  }

  static SessionException configuration(String message) {
    return new SessionException(Reason.CONFIGURATION, message);
  }
}
