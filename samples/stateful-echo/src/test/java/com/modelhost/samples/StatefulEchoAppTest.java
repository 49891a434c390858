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

package com.modelhost.samples;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelhost.core.InvocationContext;
import com.modelhost.core.InvocationRequest;
import com.modelhost.core.InvocationResponse;
import com.modelhost.core.JsonUtils;
import com.modelhost.sessions.Session;
import com.modelhost.sessions.SessionInterceptor;
import com.modelhost.sessions.SessionManager;
import com.modelhost.sessions.SessionManagerOptions;

/**
 * Unit tests for StatefulEchoApp.
 */
class StatefulEchoAppTest {

  @TempDir
  Path tempDir;

  private final StatefulEchoApp.EchoHandler handler = new StatefulEchoApp.EchoHandler();

  private static InvocationRequest request(String json) {
    return InvocationRequest.builder().body(JsonUtils.parseJson(json)).build();
  }

  private static JsonNode body(InvocationResponse response) {
    return JsonUtils.parseJson(response.getBodyAsString());
  }

  @Test
  void testEchoWithoutSession() {
    JsonNode out = body(handler.handle(new InvocationContext(), request("{\"prompt\":\"hi\"}")));

    assertEquals("hi", out.get("echo").get("prompt").asText());
    assertFalse(out.has("turns"));
  }

  @Test
  void testEchoCountsTurnsInSession() {
    SessionManager manager = new SessionManager(
        SessionManagerOptions.builder(Map.of()).storagePath(tempDir.toString()).build());
    Session session = manager.createSession();
    InvocationContext context = new InvocationContext().withAttribute(SessionInterceptor.SESSION_ATTRIBUTE, session);

    handler.handle(context, request("{\"prompt\":\"first\"}"));
    JsonNode out = body(handler.handle(context, request("{\"prompt\":\"second\"}")));

    assertEquals(2, out.get("turns").asInt());
    assertEquals(session.getId(), out.get("session_id").asText());
    assertEquals("first", out.get("previous").get("prompt").asText());
  }

  @Test
  void testResolvePort() {
    assertEquals(8080, StatefulEchoApp.resolvePort(Map.of()));
    assertEquals(9000, StatefulEchoApp.resolvePort(Map.of(StatefulEchoApp.PORT_ENV, " 9000 ")));
  }
}
