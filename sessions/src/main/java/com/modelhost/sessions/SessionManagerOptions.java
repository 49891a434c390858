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

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Options for configuring stateful sessions.
 *
 * <p>
 * Defaults are read from the process environment:
 * <ul>
 * <li>{@code OPTION_ENABLE_STATEFUL_SESSIONS} - {@code true} to turn sessions
 * on (default off)</li>
 * <li>{@code OPTION_SESSIONS_PATH} - explicit storage root</li>
 * <li>{@code OPTION_SESSIONS_EXPIRATION} - session TTL in seconds (default
 * 1200)</li>
 * <li>{@code OPTION_SESSION_ID_PATH} - dotted body path that receives the
 * session id on ordinary requests</li>
 * </ul>
 */
public class SessionManagerOptions {

  public static final String ENV_PREFIX = "OPTION_";
  public static final String ENABLE_STATEFUL_SESSIONS = ENV_PREFIX + "ENABLE_STATEFUL_SESSIONS";
  public static final String SESSIONS_PATH = ENV_PREFIX + "SESSIONS_PATH";
  public static final String SESSIONS_EXPIRATION = ENV_PREFIX + "SESSIONS_EXPIRATION";
  public static final String SESSION_ID_PATH = ENV_PREFIX + "SESSION_ID_PATH";

  /** Default session TTL. */
  public static final Duration DEFAULT_EXPIRATION = Duration.ofSeconds(1200);

  /** Memory-backed mount tried before the temp directory. */
  public static final String DEFAULT_FAST_STORAGE_ROOT = "/dev/shm";

  private final boolean enabled;
  private final String storagePath;
  private final Duration expiration;
  private final String fastStorageRoot;
  private final String tempRoot;
  private final Clock clock;
  private final String sessionIdTargetPath;

  private SessionManagerOptions(Builder builder) {
    this.enabled = builder.enabled;
    this.storagePath = builder.storagePath;
    this.expiration = builder.expiration;
    this.fastStorageRoot = builder.fastStorageRoot;
    this.tempRoot = builder.tempRoot;
    this.clock = builder.clock;
    this.sessionIdTargetPath = builder.sessionIdTargetPath;
  }

  /**
   * Creates a new builder seeded from the process environment.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return builder(System.getenv());
  }

  /**
   * Creates a new builder seeded from the given environment map.
   *
   * @param env
   *            the environment variables
   * @return a new builder
   * @throws SessionException
   *             with reason {@code CONFIGURATION} if the TTL is not a positive
   *             integer
   */
  public static Builder builder(Map<String, String> env) {
    return new Builder(env);
  }

  /**
   * Reads options from the given environment map.
   *
   * @param env
   *            the environment variables
   * @return the options
   */
  public static SessionManagerOptions fromEnvironment(Map<String, String> env) {
    return builder(env).build();
  }

  /**
   * Returns true if stateful sessions are turned on.
   *
   * @return true if enabled
   */
  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Gets the explicitly configured storage root.
   *
   * @return the path, or null to select one automatically
   */
  public String getStoragePath() {
    return storagePath;
  }

  /**
   * Gets the TTL applied to new sessions.
   *
   * @return the expiration
   */
  public Duration getExpiration() {
    return expiration;
  }

  /**
   * Gets the memory-backed mount tried when no storage path is configured.
   *
   * @return the mount point, or null to skip it
   */
  public String getFastStorageRoot() {
    return fastStorageRoot;
  }

  /**
   * Gets the temp directory used as the last resort.
   *
   * @return the temp directory
   */
  public String getTempRoot() {
    return tempRoot;
  }

  /**
   * Gets the clock used for expiration.
   *
   * @return the clock
   */
  public Clock getClock() {
    return clock;
  }

  /**
   * Gets the dotted body path that receives the session id.
   *
   * @return the path, or null to leave request bodies untouched
   */
  public String getSessionIdTargetPath() {
    return sessionIdTargetPath;
  }

  /**
   * Builder for SessionManagerOptions.
   */
  public static class Builder {
    private boolean enabled;
    private String storagePath;
    private Duration expiration;
    private String fastStorageRoot = DEFAULT_FAST_STORAGE_ROOT;
    private String tempRoot = System.getProperty("java.io.tmpdir");
    private Clock clock = Clock.systemUTC();
    private String sessionIdTargetPath;

    private Builder(Map<String, String> env) {
      this.enabled = Boolean.parseBoolean(trimToNull(env.get(ENABLE_STATEFUL_SESSIONS)));
      this.storagePath = trimToNull(env.get(SESSIONS_PATH));
      this.expiration = parseExpiration(trimToNull(env.get(SESSIONS_EXPIRATION)));
      this.sessionIdTargetPath = trimToNull(env.get(SESSION_ID_PATH));
    }

    private static Duration parseExpiration(String value) {
      if (value == null) {
        return DEFAULT_EXPIRATION;
      }
      try {
        return Duration.ofSeconds(Long.parseLong(value));
      } catch (NumberFormatException e) {
        throw new SessionException(SessionException.Reason.CONFIGURATION,
            SESSIONS_EXPIRATION + " must be a whole number of seconds, got '" + value + "'", e, value);
      }
    }

    private static String trimToNull(String value) {
      if (value == null || value.trim().isEmpty()) {
        return null;
      }
      return value.trim();
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder storagePath(String storagePath) {
      this.storagePath = storagePath;
      return this;
    }

    public Builder expiration(Duration expiration) {
      this.expiration = expiration;
      return this;
    }

    public Builder fastStorageRoot(String fastStorageRoot) {
      this.fastStorageRoot = fastStorageRoot;
      return this;
    }

    public Builder tempRoot(String tempRoot) {
      this.tempRoot = tempRoot;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder sessionIdTargetPath(String sessionIdTargetPath) {
      this.sessionIdTargetPath = sessionIdTargetPath;
      return this;
    }

    public SessionManagerOptions build() {
      return new SessionManagerOptions(this);
    }
  }
}
