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

package com.modelhost.plugins.jetty;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.ContextHandler;
import org.eclipse.jetty.server.handler.ContextHandlerCollection;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelhost.core.InvocationContext;
import com.modelhost.core.InvocationRequest;
import com.modelhost.core.InvocationResponse;
import com.modelhost.core.JsonUtils;
import com.modelhost.core.ModelHostException;
import com.modelhost.core.ServerPlugin;
import com.modelhost.core.middleware.CommonMiddleware;
import com.modelhost.core.middleware.MiddlewareChain;
import com.modelhost.sessions.SessionException;
import com.modelhost.sessions.SessionInterceptor;

/**
 * JettyPlugin serves an inference handler over HTTP.
 *
 * <p>
 * {@code POST /invocations} runs the request through the session interceptor
 * and any configured middleware before it reaches the handler;
 * {@code GET /ping} answers health checks. Errors carrying a
 * {@link ModelHostException} error code are mapped to 400, 424 or 500.
 *
 * <p>
 * Example usage:
 *
 * <pre>{@code
 * JettyPlugin jetty = new JettyPlugin(JettyPluginOptions.builder()
 * 		.port(8080)
 * 		.sessionManager(SessionManager.fromOptions(SessionManagerOptions.builder().build()))
 * 		.invocationHandler((context, request) -> InvocationResponse.json(request.getBody()))
 * 		.build());
 *
 * // Start and block
 * jetty.start();
 * }</pre>
 */
public class JettyPlugin implements ServerPlugin {

  private static final Logger logger = LoggerFactory.getLogger(JettyPlugin.class);

  private final JettyPluginOptions options;
  private final SessionInterceptor sessionInterceptor;
  private final MiddlewareChain<InvocationRequest, InvocationResponse> chain;
  private Server server;
  private ServerConnector connector;

  /**
   * Creates a JettyPlugin with the specified options.
   *
   * @param options
   *            the plugin options
   */
  public JettyPlugin(JettyPluginOptions options) {
    this.options = options;
    this.sessionInterceptor = new SessionInterceptor(options.getSessionManager(), options.getSessionIdTargetPath());
    this.chain = MiddlewareChain.of(CommonMiddleware.timing(
        millis -> logger.debug("Invocation completed in {}ms", millis)));
    if (options.isRequestLogging()) {
      chain.use(CommonMiddleware.logging("invocations"));
    }
    chain.use(sessionInterceptor);
    chain.useAll(options.getMiddleware());
  }

  @Override
  public String getName() {
    return "jetty";
  }

  /**
   * Starts the Jetty server and blocks until it is stopped.
   *
   * @throws Exception
   *             if the server cannot be started or if interrupted while waiting
   */
  @Override
  public void start() throws Exception {
    startAsync();
    server.join();
  }

  /**
   * Starts the Jetty server without blocking.
   *
   * @throws Exception
   *             if the server cannot be started
   */
  @Override
  public void startAsync() throws Exception {
    if (server != null) {
      return;
    }

    if (options.getInvocationHandler() == null) {
      throw new ModelHostException("Invocation handler not set. Configure one with JettyPluginOptions.Builder.invocationHandler().");
    }

    server = new Server();

    connector = new ServerConnector(server);
    connector.setPort(options.getPort());
    connector.setHost(options.getHost());
    server.addConnector(connector);

    ContextHandlerCollection handlers = new ContextHandlerCollection();

    ContextHandler invocationsHandler = new ContextHandler(options.getInvocationsPath());
    invocationsHandler.setAllowNullPathInContext(true);
    invocationsHandler.setHandler(new InvocationsHandler());
    handlers.addHandler(invocationsHandler);

    ContextHandler pingHandler = new ContextHandler(options.getPingPath());
    pingHandler.setAllowNullPathInContext(true);
    pingHandler.setHandler(new PingHandler());
    handlers.addHandler(pingHandler);

    server.setHandler(handlers);
    try {
      server.start();
    } catch (Exception e) {
      server = null;
      connector = null;
      throw e;
    }

    logger.info("Jetty server started on {}:{} (stateful sessions {}, {} middleware)", options.getHost(), getPort(),
        sessionInterceptor.isEnabled() ? "enabled" : "disabled", chain.size());
  }

  /**
   * Stops the Jetty server.
   *
   * @throws Exception
   *             if the server cannot be stopped
   */
  @Override
  public void stop() throws Exception {
    if (server != null) {
      server.stop();
      server = null;
      connector = null;
      logger.info("Jetty server stopped");
    }
  }

  /**
   * Returns the port the server is listening on.
   *
   * @return the bound port while running, otherwise the configured port
   */
  @Override
  public int getPort() {
    if (connector != null && connector.getLocalPort() > 0) {
      return connector.getLocalPort();
    }
    return options.getPort();
  }

  /**
   * Returns true if requests may use stateful sessions.
   *
   * @return true when a session manager is configured
   */
  public boolean isSessionsEnabled() {
    return sessionInterceptor.isEnabled();
  }

  @Override
  public boolean isRunning() {
    return server != null && server.isRunning();
  }

  /**
   * Runs one request through the middleware chain and the handler.
   */
  InvocationResponse invoke(InvocationRequest request) {
    return chain.execute(request, new InvocationContext(),
        (context, req) -> options.getInvocationHandler().handle(context, req));
  }

  /**
   * Maps an error code to an HTTP status.
   */
  static int statusFor(String errorCode) {
    if (errorCode == null) {
      return 500;
    }
    if (JsonUtils.INVALID_JSON.equals(errorCode)) {
      return 400;
    }
    try {
      switch (SessionException.Reason.valueOf(errorCode)) {
        case INVALID_ARGUMENT:
        case NOT_FOUND:
        case MALFORMED_REQUEST:
        case SESSIONS_DISABLED:
          return 400;
        case FAILED_DEPENDENCY:
          return 424;
        default:
          return 500;
      }
    } catch (IllegalArgumentException e) {
      logger.debug("Unmapped error code {}", errorCode);
      return 500;
    }
  }

  private static void writeJson(Response response, int status, Object value, Callback callback) {
    response.setStatus(status);
    response.getHeaders().put(InvocationResponse.CONTENT_TYPE, InvocationResponse.APPLICATION_JSON);
    String json = JsonUtils.toJson(value);
    response.write(true, ByteBuffer.wrap(json.getBytes(StandardCharsets.UTF_8)), callback);
  }

  private static void writeError(Response response, int status, String code, String message, Callback callback) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", code);
    error.put("message", message != null ? message : "Unknown error");
    writeJson(response, status, error, callback);
  }

  /**
   * Handler for the health endpoint.
   */
  private static class PingHandler extends Handler.Abstract {
    @Override
    public boolean handle(Request request, Response response, Callback callback) throws Exception {
      writeJson(response, 200, Map.of("status", "ok"), callback);
      return true;
    }
  }

  /**
   * Handler for the inference endpoint.
   */
  private class InvocationsHandler extends Handler.Abstract {
    @Override
    public boolean handle(Request request, Response response, Callback callback) throws Exception {
      if (!"POST".equals(request.getMethod())) {
        response.getHeaders().put("Allow", "POST");
        writeError(response, 405, "METHOD_NOT_ALLOWED", "Method not allowed", callback);
        return true;
      }

      InvocationResponse result;
      try {
        result = invoke(readRequest(request));
      } catch (ModelHostException e) {
        int status = statusFor(e.getErrorCode());
        if (status >= 500 || status == 424) {
          logger.error("Invocation failed with {}", status, e);
        } else {
          logger.warn("Invocation rejected with {}: {}", status, e.getMessage());
        }
        writeError(response, status, e.getErrorCode() != null ? e.getErrorCode() : "INTERNAL", e.getMessage(),
            callback);
        return true;
      } catch (RuntimeException e) {
        logger.error("Error handling invocation", e);
        writeError(response, 500, "INTERNAL", e.getMessage(), callback);
        return true;
      }

      response.setStatus(result.getStatusCode());
      for (Map.Entry<String, String> header : result.getHeaders().entrySet()) {
        response.getHeaders().put(header.getKey(), header.getValue());
      }
      response.write(true, ByteBuffer.wrap(result.getBody()), callback);
      return true;
    }

    private InvocationRequest readRequest(Request request) throws IOException {
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      Request.asInputStream(request).transferTo(baos);
      String body = baos.toString(StandardCharsets.UTF_8);

      JsonNode json = body.isBlank() ? null : JsonUtils.parseJson(body);

      InvocationRequest.Builder builder = InvocationRequest.builder().body(json);
      for (HttpField field : request.getHeaders()) {
        builder.header(field.getName(), field.getValue());
      }
      return builder.build();
    }
  }
}
