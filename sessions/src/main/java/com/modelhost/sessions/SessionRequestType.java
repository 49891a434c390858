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

/**
 * Control messages recognized in the {@code requestType} body field.
 */
public enum SessionRequestType {
  /** Create a new session. */
  NEW_SESSION,
  /** Close the session named by the session header. */
  CLOSE;

  /**
   * Looks up a request type by its wire value.
   *
   * @param value
   *            the wire value, case-sensitive
   * @return the request type, or null if the value is not recognized
   */
  public static SessionRequestType fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (SessionRequestType type : values()) {
      if (type.name().equals(value)) {
        return type;
      }
    }
    return null;
  }
}
