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

/**
 * Middleware support for the invocation pipeline.
 *
 * <p>
 * A {@link com.modelhost.core.middleware.MiddlewareChain} runs each
 * {@link com.modelhost.core.middleware.Middleware} in order before the final
 * {@link com.modelhost.core.InvocationHandler}. Middleware can short-circuit
 * the chain by returning a response without calling
 * {@link com.modelhost.core.middleware.MiddlewareNext#apply}; the session
 * protocol interceptor does this for session-management requests.
 *
 * <pre>{@code
 * MiddlewareChain<InvocationRequest, InvocationResponse> chain = MiddlewareChain
 * 		.of(CommonMiddleware.logging("invocations"), new SessionInterceptor(sessionManager));
 *
 * InvocationResponse response = chain.execute(request, new InvocationContext(), handler::handle);
 * }</pre>
 */
package com.modelhost.core.middleware;
