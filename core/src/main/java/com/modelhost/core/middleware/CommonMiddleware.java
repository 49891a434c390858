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

package com.modelhost.core.middleware;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelhost.core.ModelHostException;

/**
 * CommonMiddleware provides factory methods for commonly used middleware.
 */
public final class CommonMiddleware {

  private static final Logger logger = LoggerFactory.getLogger(CommonMiddleware.class);

  private CommonMiddleware() {
    // Utility class
  }

  /**
   * Creates a middleware that logs each request, its outcome and its latency.
   *
   * @param name
   *            the name to use in log messages
   * @param <I>
   *            request type
   * @param <O>
   *            response type
   * @return a logging middleware
   */
  public static <I, O> Middleware<I, O> logging(String name) {
    return logging(name, logger);
  }

  /**
   * Creates a logging middleware that writes to the given logger.
   *
   * @param name
   *            the name to use in log messages
   * @param customLogger
   *            the logger to use
   * @param <I>
   *            request type
   * @param <O>
   *            response type
   * @return a logging middleware
   */
  public static <I, O> Middleware<I, O> logging(String name, Logger customLogger) {
    return (request, context, next) -> {
      customLogger.info("[{}] Request: {}", name, request);
      Instant start = Instant.now();
      try {
        O result = next.apply(request, context);
        Duration duration = Duration.between(start, Instant.now());
        customLogger.info("[{}] Response ({}ms): {}", name, duration.toMillis(), result);
        return result;
      } catch (ModelHostException e) {
        Duration duration = Duration.between(start, Instant.now());
        customLogger.warn("[{}] Error ({}ms): {}", name, duration.toMillis(), e.getMessage());
        throw e;
      }
    };
  }

  /**
   * Creates a timing middleware that reports how long the rest of the chain
   * took, whether or not it succeeded.
   *
   * @param callback
   *            callback to receive the duration in milliseconds
   * @param <I>
   *            request type
   * @param <O>
   *            response type
   * @return a timing middleware
   */
  public static <I, O> Middleware<I, O> timing(Consumer<Long> callback) {
    return (request, context, next) -> {
      Instant start = Instant.now();
      try {
        return next.apply(request, context);
      } finally {
        Duration duration = Duration.between(start, Instant.now());
        callback.accept(duration.toMillis());
      }
    };
  }
}
