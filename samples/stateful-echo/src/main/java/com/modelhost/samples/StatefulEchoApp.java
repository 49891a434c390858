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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelhost.core.InvocationContext;
import com.modelhost.core.InvocationHandler;
import com.modelhost.core.InvocationRequest;
import com.modelhost.core.InvocationResponse;
import com.modelhost.core.JsonUtils;
import com.modelhost.plugins.jetty.JettyPlugin;
import com.modelhost.plugins.jetty.JettyPluginOptions;
import com.modelhost.sessions.Session;
import com.modelhost.sessions.SessionInterceptor;
import com.modelhost.sessions.SessionManager;
import com.modelhost.sessions.SessionManagerOptions;

/**
 * Stateful echo endpoint.
 *
 * <p>
 * This sample demonstrates:
 * <ul>
 * <li>Configuring stateful sessions from the environment</li>
 * <li>Creating and closing sessions with {@code requestType} messages</li>
 * <li>Keeping per-session state in an inference handler</li>
 * </ul>
 *
 * <p>
 * To run:
 * <ol>
 * <li>Set OPTION_ENABLE_STATEFUL_SESSIONS=true</li>
 * <li>Run: mvn exec:java -pl samples/stateful-echo</li>
 * <li>Create a session: {@code curl -i -d '{"requestType":"NEW_SESSION"}' localhost:8080/invocations}</li>
 * <li>Use it: {@code curl -H 'X-Amzn-SageMaker-Session-Id: <id>' -d '{"prompt":"hi"}' localhost:8080/invocations}</li>
 * </ol>
 */
public class StatefulEchoApp {

  private static final Logger logger = LoggerFactory.getLogger(StatefulEchoApp.class);

  static final String PORT_ENV = "SAGEMAKER_BIND_TO_PORT";

  /**
   * Echoes the request body. Inside a session it also counts the turns and
   * remembers the previous body.
   */
  public static class EchoHandler implements InvocationHandler {

    @Override
    public InvocationResponse handle(InvocationContext context, InvocationRequest request) {
      ObjectNode out = JsonUtils.getObjectMapper().createObjectNode();
      out.set("echo", request.getBody());

      Session session = SessionInterceptor.currentSession(context);
      if (session != null) {
        int turns = session.get("turns", Integer.class, 0) + 1;
        out.put("session_id", session.getId());
        out.put("turns", turns);
        out.set("previous", session.get("previous"));
        session.put("turns", turns);
        session.put("previous", request.getBody());
      }
      return InvocationResponse.json(out);
    }
  }

  static int resolvePort(Map<String, String> env) {
    String value = env.get(PORT_ENV);
    if (value == null || value.trim().isEmpty()) {
      return 8080;
    }
    return Integer.parseInt(value.trim());
  }

  public static void main(String[] args) throws Exception {
    Map<String, String> env = System.getenv();
    SessionManagerOptions sessionOptions = SessionManagerOptions.builder(env).build();
    SessionManager sessionManager = SessionManager.fromOptions(sessionOptions);

    JettyPlugin jetty = new JettyPlugin(JettyPluginOptions.builder()
        .port(resolvePort(env))
        .sessionManager(sessionManager)
        .sessionIdTargetPath(sessionOptions.getSessionIdTargetPath())
        .requestLogging(true)
        .invocationHandler(new EchoHandler())
        .build());

    if (sessionManager != null) {
      logger.info("Sessions stored in {}", sessionManager.getStorageRoot());
    }
    jetty.start();
  }
}
