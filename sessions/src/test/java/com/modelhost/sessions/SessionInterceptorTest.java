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
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelhost.core.InvocationContext;
import com.modelhost.core.InvocationRequest;
import com.modelhost.core.InvocationResponse;
import com.modelhost.core.JsonUtils;
import com.modelhost.core.middleware.MiddlewareNext;

/**
 * Unit tests for SessionInterceptor.
 */
@ExtendWith(MockitoExtension.class)
class SessionInterceptorTest {

  private static final Duration TTL = Duration.ofMinutes(20);

  @TempDir
  Path tempDir;

  @Mock
  SessionManager mockManager;

  private MutableClock clock;
  private SessionManager manager;
  private SessionInterceptor interceptor;
  private List<InvocationRequest> handled;
  private List<Session> handledSessions;
  private MiddlewareNext<InvocationRequest, InvocationResponse> handler;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    manager = new SessionManager(SessionManagerOptions.builder(Map.of())
        .storagePath(tempDir.toString())
        .expiration(TTL)
        .clock(clock)
        .build());
    interceptor = new SessionInterceptor(manager);
    handled = new ArrayList<>();
    handledSessions = new ArrayList<>();
    handler = (request, context) -> {
      handled.add(request);
      handledSessions.add(SessionInterceptor.currentSession(context));
      return InvocationResponse.json(Map.of("ok", true));
    };
  }

  private static InvocationRequest request(String json) {
    return InvocationRequest.builder().body(JsonUtils.parseJson(json)).build();
  }

  private static InvocationRequest request(String json, String sessionId) {
    return InvocationRequest.builder()
        .body(JsonUtils.parseJson(json))
        .header(SessionHeaders.SESSION_ID, sessionId)
        .build();
  }

  private InvocationResponse invoke(SessionInterceptor target, InvocationRequest request) {
    return target.handle(request, new InvocationContext(), handler);
  }

  private String createSession() {
    InvocationResponse response = invoke(interceptor, request("{\"requestType\":\"NEW_SESSION\"}"));
    return SessionHeaders.parseNewSessionId(response.getHeader(SessionHeaders.NEW_SESSION_ID)).getSessionId();
  }

  @Test
  void testNewSession() {
    InvocationResponse response = invoke(interceptor, request("{\"requestType\":\"NEW_SESSION\"}"));

    assertEquals(200, response.getStatusCode());
    String header = response.getHeader(SessionHeaders.NEW_SESSION_ID);
    assertNotNull(header);
    SessionHeaders.NewSessionId parsed = SessionHeaders.parseNewSessionId(header);
    assertEquals(36, parsed.getSessionId().length());
    assertEquals(clock.instant().plus(TTL).getEpochSecond(), parsed.getExpires());
    assertTrue(response.getBodyAsString().contains(parsed.getSessionId()));
    assertTrue(handled.isEmpty());
    assertEquals(1, manager.getSessionCount());
  }

  @Test
  void testNewSessionIgnoresSessionHeader() {
    InvocationResponse response = invoke(interceptor, request("{\"requestType\":\"NEW_SESSION\"}", "unknown"));

    assertNotNull(response.getHeader(SessionHeaders.NEW_SESSION_ID));
  }

  @Test
  void testNewSessionWithExtraFieldIsRejected() {
    SessionException e = assertThrows(SessionException.class,
        () -> invoke(interceptor, request("{\"requestType\":\"NEW_SESSION\",\"extra\":1}")));

    assertEquals(SessionException.Reason.MALFORMED_REQUEST, e.getReason());
    assertEquals(0, manager.getSessionCount());
    assertTrue(handled.isEmpty());
  }

  @Test
  void testOrdinaryRequestPassesThrough() {
    InvocationRequest request = request("{\"prompt\":\"hi\"}");

    InvocationResponse response = invoke(interceptor, request);

    assertEquals(200, response.getStatusCode());
    assertEquals(1, handled.size());
    assertSame(request, handled.get(0));
    assertNull(handledSessions.get(0));
  }

  @Test
  void testOrdinaryRequestWithSessionGetsSession() {
    String sessionId = createSession();

    invoke(interceptor, request("{\"prompt\":\"hi\"}", sessionId));

    assertEquals(1, handled.size());
    assertEquals(sessionId, handledSessions.get(0).getId());
  }

  @Test
  void testSentinelSessionHeaderIsIgnored() {
    invoke(interceptor, request("{\"prompt\":\"hi\"}", SessionManager.NEW_SESSION_SENTINEL));

    assertEquals(1, handled.size());
    assertNull(handledSessions.get(0));
  }

  @Test
  void testUnknownSessionRejectedBeforeHandler() {
    SessionException e = assertThrows(SessionException.class,
        () -> invoke(interceptor, request("{\"prompt\":\"hi\"}", "unknown")));

    assertEquals(SessionException.Reason.NOT_FOUND, e.getReason());
    assertTrue(handled.isEmpty());
  }

  @Test
  void testExpiredSessionRejected() {
    String sessionId = createSession();
    clock.advance(TTL);

    SessionException e = assertThrows(SessionException.class,
        () -> invoke(interceptor, request("{\"prompt\":\"hi\"}", sessionId)));

    assertEquals(SessionException.Reason.NOT_FOUND, e.getReason());
    assertTrue(e.getMessage().contains("expired"));
    assertFalse(Files.exists(tempDir.resolve(sessionId)));
    assertTrue(handled.isEmpty());
  }

  @Test
  void testCloseSession() {
    String sessionId = createSession();

    InvocationResponse response = invoke(interceptor, request("{\"requestType\":\"CLOSE\"}", sessionId));

    assertEquals(200, response.getStatusCode());
    assertEquals(sessionId, response.getHeader(SessionHeaders.CLOSED_SESSION_ID));
    assertEquals(0, manager.getSessionCount());
    assertFalse(Files.exists(tempDir.resolve(sessionId)));
    assertTrue(handled.isEmpty());

    SessionException e = assertThrows(SessionException.class,
        () -> invoke(interceptor, request("{\"prompt\":\"hi\"}", sessionId)));
    assertEquals(SessionException.Reason.NOT_FOUND, e.getReason());
  }

  @Test
  void testCloseWithoutHeaderFails() {
    SessionException e = assertThrows(SessionException.class,
        () -> invoke(interceptor, request("{\"requestType\":\"CLOSE\"}")));

    assertEquals(SessionException.Reason.INVALID_ARGUMENT, e.getReason());
  }

  @Test
  void testCloseUnknownSessionFails() {
    SessionException e = assertThrows(SessionException.class,
        () -> invoke(interceptor, request("{\"requestType\":\"CLOSE\"}", "unknown")));

    assertEquals(SessionException.Reason.NOT_FOUND, e.getReason());
  }

  @Test
  void testSessionIdInjection() {
    SessionInterceptor injecting = new SessionInterceptor(manager, "metadata.session_id");
    String sessionId = createSession();
    InvocationRequest original = request("{\"prompt\":\"hi\",\"metadata\":{\"user\":\"u1\"}}", sessionId);

    invoke(injecting, original);

    JsonNode body = handled.get(0).getBody();
    assertEquals(sessionId, body.get("metadata").get("session_id").asText());
    assertEquals("u1", body.get("metadata").get("user").asText());
    assertFalse(original.getBody().get("metadata").has("session_id"));
  }

  @Test
  void testInjectionSkipsNonObjectBodies() {
    SessionInterceptor injecting = new SessionInterceptor(manager, "session_id");
    String sessionId = createSession();

    invoke(injecting, request("[1,2,3]", sessionId));

    assertTrue(handled.get(0).getBody().isArray());
  }

  @Test
  void testDisabledRejectsSessionInput() {
    SessionInterceptor disabled = new SessionInterceptor(null);
    assertFalse(disabled.isEnabled());

    SessionException create = assertThrows(SessionException.class,
        () -> invoke(disabled, request("{\"requestType\":\"NEW_SESSION\"}")));
    SessionException header = assertThrows(SessionException.class,
        () -> invoke(disabled, request("{\"prompt\":\"hi\"}", "abc")));

    assertEquals(SessionException.Reason.SESSIONS_DISABLED, create.getReason());
    assertEquals(SessionException.Reason.SESSIONS_DISABLED, header.getReason());
    assertTrue(handled.isEmpty());
  }

  @Test
  void testDisabledPassesOrdinaryRequests() {
    invoke(new SessionInterceptor(null), request("{\"prompt\":\"hi\"}"));

    assertEquals(1, handled.size());
  }

  @Test
  void testCreateFailureIsFailedDependency() {
    when(mockManager.createSession()).thenThrow(new IllegalStateException("disk full"));

    SessionException e = assertThrows(SessionException.class,
        () -> invoke(new SessionInterceptor(mockManager), request("{\"requestType\":\"NEW_SESSION\"}")));

    assertEquals(SessionException.Reason.FAILED_DEPENDENCY, e.getReason());
    assertTrue(e.getMessage().startsWith("Failed to create session"));
    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test
  void testCloseFailureIsFailedDependency() {
    Session session = new Session("abc", tempDir, Instant.MAX);
    when(mockManager.getSession("abc")).thenReturn(session);
    doThrow(new IllegalStateException("session directory does not exist")).when(mockManager).closeSession(anyString());

    SessionException e = assertThrows(SessionException.class,
        () -> invoke(new SessionInterceptor(mockManager), request("{\"requestType\":\"CLOSE\"}", "abc")));

    assertEquals(SessionException.Reason.FAILED_DEPENDENCY, e.getReason());
    assertTrue(e.getMessage().startsWith("Failed to close session"));
  }

  @Test
  void testManagerSessionExceptionsPropagate() {
    when(mockManager.createSession()).thenThrow(new SessionException(SessionException.Reason.CONFIGURATION, "boom"));

    SessionException e = assertThrows(SessionException.class,
        () -> invoke(new SessionInterceptor(mockManager), request("{\"requestType\":\"NEW_SESSION\"}")));

    assertEquals(SessionException.Reason.CONFIGURATION, e.getReason());
    verify(mockManager, never()).closeSession(anyString());
  }
}
