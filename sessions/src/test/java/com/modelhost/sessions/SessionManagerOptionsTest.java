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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for SessionManagerOptions.
 */
class SessionManagerOptionsTest {

  @Test
  void testDefaults() {
    SessionManagerOptions options = SessionManagerOptions.fromEnvironment(Map.of());

    assertFalse(options.isEnabled());
    assertNull(options.getStoragePath());
    assertEquals(SessionManagerOptions.DEFAULT_EXPIRATION, options.getExpiration());
    assertEquals(Duration.ofSeconds(1200), options.getExpiration());
    assertEquals(SessionManagerOptions.DEFAULT_FAST_STORAGE_ROOT, options.getFastStorageRoot());
    assertEquals(System.getProperty("java.io.tmpdir"), options.getTempRoot());
    assertNotNull(options.getClock());
  }

  @Test
  void testReadsEnvironment() {
    SessionManagerOptions options = SessionManagerOptions.fromEnvironment(Map.of(
        "OPTION_ENABLE_STATEFUL_SESSIONS", "true",
        "OPTION_SESSIONS_PATH", " /data/sessions ",
        "OPTION_SESSIONS_EXPIRATION", "300"));

    assertTrue(options.isEnabled());
    assertEquals("/data/sessions", options.getStoragePath());
    assertEquals(Duration.ofSeconds(300), options.getExpiration());
  }

  @Test
  void testEnableFlagIsCaseInsensitive() {
    assertTrue(SessionManagerOptions.fromEnvironment(Map.of("OPTION_ENABLE_STATEFUL_SESSIONS", "TRUE")).isEnabled());
    assertFalse(SessionManagerOptions.fromEnvironment(Map.of("OPTION_ENABLE_STATEFUL_SESSIONS", "yes")).isEnabled());
  }

  @Test
  void testBlankValuesUseDefaults() {
    SessionManagerOptions options = SessionManagerOptions.fromEnvironment(Map.of(
        "OPTION_SESSIONS_PATH", "  ",
        "OPTION_SESSIONS_EXPIRATION", ""));

    assertNull(options.getStoragePath());
    assertEquals(SessionManagerOptions.DEFAULT_EXPIRATION, options.getExpiration());
  }

  @Test
  void testReadsSessionIdTargetPath() {
    SessionManagerOptions options = SessionManagerOptions
        .fromEnvironment(Map.of(SessionManagerOptions.SESSION_ID_PATH, " metadata.session_id "));

    assertEquals("metadata.session_id", options.getSessionIdTargetPath());
    assertNull(SessionManagerOptions.fromEnvironment(Map.of()).getSessionIdTargetPath());
  }

  @Test
  void testNonNumericExpirationFails() {
    SessionException e = assertThrows(SessionException.class,
        () -> SessionManagerOptions.fromEnvironment(Map.of("OPTION_SESSIONS_EXPIRATION", "twenty")));

    assertEquals(SessionException.Reason.CONFIGURATION, e.getReason());
    assertInstanceOf(NumberFormatException.class, e.getCause());
  }

  @Test
  void testBuilderOverridesEnvironment() {
    SessionManagerOptions options = SessionManagerOptions.builder(Map.of("OPTION_SESSIONS_EXPIRATION", "300"))
        .enabled(true)
        .expiration(Duration.ofMinutes(1))
        .build();

    assertTrue(options.isEnabled());
    assertEquals(Duration.ofMinutes(1), options.getExpiration());
  }
}
