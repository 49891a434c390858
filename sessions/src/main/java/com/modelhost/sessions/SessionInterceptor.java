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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.modelhost.core.InvocationContext;
import com.modelhost.core.InvocationRequest;
import com.modelhost.core.InvocationResponse;
import com.modelhost.core.JsonUtils;
import com.modelhost.core.middleware.Middleware;
import com.modelhost.core.middleware.MiddlewareNext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SessionInterceptor handles the session protocol in front of an inference
 * handler.
 *
 * <p>
 * Control messages ({@code {"requestType": "NEW_SESSION"}} and
 * {@code {"requestType": "CLOSE"}}) are answered here and never reach the
 * handler. Ordinary requests that carry a session header are validated
 * against the {@link SessionManager}; the resolved {@link Session} is placed
 * on the {@link InvocationContext} and can be read with
 * {@link #currentSession(InvocationContext)}.
 *
 * <p>
 * A null manager means stateful sessions are disabled; any session input is
 * then rejected.
 */
public class SessionInterceptor implements Middleware<InvocationRequest, InvocationResponse> {

  private static final Logger logger = LoggerFactory.getLogger(SessionInterceptor.class);

  /** Context attribute holding the validated session. */
  public static final String SESSION_ATTRIBUTE = "modelhost.session";

  private final SessionManager sessionManager;
  private final String sessionIdTargetPath;

  /**
   * Creates an interceptor without session id injection.
   *
   * @param sessionManager
   *            the manager, or null when sessions are disabled
   */
  public SessionInterceptor(SessionManager sessionManager) {
    this(sessionManager, null);
  }

  /**
   * Creates an interceptor.
   *
   * @param sessionManager
   *            the manager, or null when sessions are disabled
   * @param sessionIdTargetPath
   *            dotted path in the request body that receives the session id,
   *            or null to leave bodies untouched
   */
  public SessionInterceptor(SessionManager sessionManager, String sessionIdTargetPath) {
    this.sessionManager = sessionManager;
    this.sessionIdTargetPath = sessionIdTargetPath != null && !sessionIdTargetPath.isEmpty()
        ? sessionIdTargetPath
        : null;
  }

  /**
   * Returns the session validated for the current request.
   *
   * @param context
   *            the invocation context
   * @return the session, or null if the request has none
   */
  public static Session currentSession(InvocationContext context) {
    return context != null ? context.getAttribute(SESSION_ATTRIBUTE, Session.class) : null;
  }

  /**
   * Returns true if a session manager is configured.
   *
   * @return false when stateful sessions are disabled
   */
  public boolean isEnabled() {
    return sessionManager != null;
  }

  @Override
  public InvocationResponse handle(InvocationRequest request, InvocationContext context,
      MiddlewareNext<InvocationRequest, InvocationResponse> next) {
    String sessionId = SessionHeaders.getSessionId(request);

    if (sessionManager == null) {
      if (SessionRequestParser.hasRequestType(request.getBody()) || sessionId != null) {
        throw new SessionException(SessionException.Reason.SESSIONS_DISABLED,
            "stateful sessions are not enabled; set " + SessionManagerOptions.ENABLE_STATEFUL_SESSIONS
                + "=true to use them");
      }
      return next.apply(request, context);
    }

    SessionRequestType requestType = SessionRequestParser.parse(request.getBody());
    if (requestType == SessionRequestType.NEW_SESSION) {
      return createSession();
    }
    if (requestType == SessionRequestType.CLOSE) {
      return closeSession(sessionId);
    }

    Session session = validateSession(sessionId);
    if (session == null) {
      return next.apply(request, context);
    }
    logger.debug("Request bound to session {}", session.getId());
    return next.apply(injectSessionId(request, session.getId()), context.withAttribute(SESSION_ATTRIBUTE, session));
  }

  private Session validateSession(String sessionId) {
    Session session = sessionManager.getSession(sessionId);
    if (session == null && sessionId != null && !sessionId.isEmpty()
        && !SessionManager.NEW_SESSION_SENTINEL.equals(sessionId)) {
      throw SessionException.expired(sessionId);
    }
    return session;
  }

  private InvocationResponse createSession() {
    Session session;
    try {
      session = sessionManager.createSession();
    } catch (SessionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SessionException(SessionException.Reason.FAILED_DEPENDENCY,
          "Failed to create session: " + e.getMessage(), e, null);
    }
    logger.info("Session {} created on request", session.getId());
    return InvocationResponse.builder()
        .header(InvocationResponse.CONTENT_TYPE, InvocationResponse.TEXT_PLAIN)
        .header(SessionHeaders.NEW_SESSION_ID, SessionHeaders.formatNewSessionId(session))
        .body("Successfully created session: " + session.getId())
        .build();
  }

  private InvocationResponse closeSession(String sessionId) {
    if (sessionId == null || sessionId.isEmpty()) {
      throw SessionException.invalidArgument("Session ID is required in request headers to close a session");
    }
    validateSession(sessionId);
    try {
      sessionManager.closeSession(sessionId);
    } catch (SessionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SessionException(SessionException.Reason.FAILED_DEPENDENCY,
          "Failed to close session: " + e.getMessage(), e, sessionId);
    }
    logger.info("Session {} closed on request", sessionId);
    return InvocationResponse.builder()
        .header(InvocationResponse.CONTENT_TYPE, InvocationResponse.TEXT_PLAIN)
        .header(SessionHeaders.CLOSED_SESSION_ID, sessionId)
        .body("Successfully closed session: " + sessionId)
        .build();
  }

  private InvocationRequest injectSessionId(InvocationRequest request, String sessionId) {
    JsonNode body = request.getBody();
    if (sessionIdTargetPath == null || body == null || !body.isObject()) {
      return request;
    }
    ObjectNode copy = ((ObjectNode) body).deepCopy();
    return request.withBody(JsonUtils.setPath(copy, sessionIdTargetPath, TextNode.valueOf(sessionId)));
  }
}
