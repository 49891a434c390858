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
 * MiddlewareNext calls the remainder of the chain.
 *
 * @param <I>
 *            the request type
 * @param <O>
 *            the response type
 */
@FunctionalInterface
public interface MiddlewareNext<I, O> {

  /**
   * Calls the next middleware in the chain or the final handler.
   *
   * @param request
   *            the request (may be replaced by the calling middleware)
   * @param context
   *            the context (may be replaced by the calling middleware)
   * @return the output response
   * @throws ModelHostException
   *             if processing fails
   */
  O apply(I request, InvocationContext context) throws ModelHostException;
}
