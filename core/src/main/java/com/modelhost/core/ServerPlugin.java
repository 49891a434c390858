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

package com.modelhost.core;

/**
 * ServerPlugin is the seam for components that deliver invocations over a
 * network transport.
 *
 * <p>
 * Example usage:
 *
 * <pre>{@code
 * JettyPlugin jetty = new JettyPlugin(
 * 		JettyPluginOptions.builder().port(8080).invocationHandler(handler).sessionManager(manager).build());
 *
 * // Start the server and block
 * jetty.start();
 * }</pre>
 */
public interface ServerPlugin {

  /**
   * Returns the plugin name.
   *
   * @return the name
   */
  String getName();

  /**
   * Starts the server and blocks until it is stopped.
   *
   * @throws Exception
   *             if the server cannot be started or if interrupted while waiting
   */
  void start() throws Exception;

  /**
   * Starts the server and returns once it is accepting connections.
   *
   * @throws Exception
   *             if the server cannot be started
   */
  void startAsync() throws Exception;

  /**
   * Stops the server.
   *
   * @throws Exception
   *             if the server cannot be stopped
   */
  void stop() throws Exception;

  /**
   * Returns the port the server is listening on.
   *
   * @return the server port
   */
  int getPort();

  /**
   * Returns true if the server is currently running.
   *
   * @return true if running, false otherwise
   */
  boolean isRunning();
}
