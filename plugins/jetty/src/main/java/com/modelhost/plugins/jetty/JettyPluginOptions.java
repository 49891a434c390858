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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.modelhost.core.InvocationHandler;
import com.modelhost.core.InvocationRequest;
import com.modelhost.core.InvocationResponse;
import com.modelhost.core.middleware.Middleware;
import com.modelhost.sessions.SessionManager;

/**
 * Options for configuring the Jetty plugin.
 */
public class JettyPluginOptions {

  private final int port;
  private final String host;
  private final String invocationsPath;
  private final String pingPath;
  private final InvocationHandler invocationHandler;
  private final SessionManager sessionManager;
  private final String sessionIdTargetPath;
  private final boolean requestLogging;
  private final List<Middleware<InvocationRequest, InvocationResponse>> middleware;

  private JettyPluginOptions(Builder builder) {
    this.port = builder.port;
    this.host = builder.host;
    this.invocationsPath = builder.invocationsPath;
    this.pingPath = builder.pingPath;
    this.invocationHandler = builder.invocationHandler;
    this.sessionManager = builder.sessionManager;
    this.sessionIdTargetPath = builder.sessionIdTargetPath;
    this.requestLogging = builder.requestLogging;
    this.middleware = Collections.unmodifiableList(new ArrayList<>(builder.middleware));
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Gets the HTTP port. Zero binds an ephemeral port.
   *
   * @return the port
   */
  public int getPort() {
    return port;
  }

  /**
   * Gets the host to bind to.
   *
   * @return the host
   */
  public String getHost() {
    return host;
  }

  /**
   * Gets the path of the inference endpoint.
   *
   * @return the invocations path
   */
  public String getInvocationsPath() {
    return invocationsPath;
  }

  /**
   * Gets the path of the health endpoint.
   *
   * @return the ping path
   */
  public String getPingPath() {
    return pingPath;
  }

  public InvocationHandler getInvocationHandler() {
    return invocationHandler;
  }

  /**
   * Gets the session manager.
   *
   * @return the manager, or null when stateful sessions are disabled
   */
  public SessionManager getSessionManager() {
    return sessionManager;
  }

  public String getSessionIdTargetPath() {
    return sessionIdTargetPath;
  }

  public boolean isRequestLogging() {
    return requestLogging;
  }

  /**
   * Gets the middleware that runs after the session interceptor.
   *
   * @return the middleware list
   */
  public List<Middleware<InvocationRequest, InvocationResponse>> getMiddleware() {
    return middleware;
  }

  /**
   * Builder for JettyPluginOptions.
   */
  public static class Builder {
    private int port = 8080;
    private String host = "0.0.0.0";
    private String invocationsPath = "/invocations";
    private String pingPath = "/ping";
    private InvocationHandler invocationHandler;
    private SessionManager sessionManager;
    private String sessionIdTargetPath;
    private boolean requestLogging;
    private final List<Middleware<InvocationRequest, InvocationResponse>> middleware = new ArrayList<>();

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder invocationsPath(String invocationsPath) {
      this.invocationsPath = invocationsPath;
      return this;
    }

    public Builder pingPath(String pingPath) {
      this.pingPath = pingPath;
      return this;
    }

    public Builder invocationHandler(InvocationHandler invocationHandler) {
      this.invocationHandler = invocationHandler;
      return this;
    }

    public Builder sessionManager(SessionManager sessionManager) {
      this.sessionManager = sessionManager;
      return this;
    }

    public Builder sessionIdTargetPath(String sessionIdTargetPath) {
      this.sessionIdTargetPath = sessionIdTargetPath;
      return this;
    }

    public Builder requestLogging(boolean requestLogging) {
      this.requestLogging = requestLogging;
      return this;
    }

    public Builder middleware(Middleware<InvocationRequest, InvocationResponse> middleware) {
      this.middleware.add(middleware);
      return this;
    }

    public JettyPluginOptions build() {
      return new JettyPluginOptions(this);
    }
  }
}
