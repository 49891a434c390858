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

import com.modelhost.core.InvocationContext;
import com.modelhost.core.ModelHostException;

/**
 * Middleware intercepts a request on its way to the invocation handler. It
 * may inspect or replace the request, publish values on the context,
 * short-circuit with its own response, or post-process the response.
 *
 * @param <I>
 *            the request type
 * @param <O>
 *            the response type
 */
@FunctionalInterface
public interface Middleware<I, O> {

  /**
   * Processes the request through this middleware.
   *
   * @param request
   *            the input request
   * @param context
   *            the invocation context
   * @param next
   *            the next function in the middleware chain
   * @return the output response
   * @throws ModelHostException
   *             if processing fails
   */
  O handle(I request, InvocationContext context, MiddlewareNext<I, O> next) throws ModelHostException;
}
