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

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

import com.modelhost.core.InvocationContext;
import com.modelhost.core.ModelHostException;

/**
 * MiddlewareChain runs an ordered list of middleware in front of a final
 * handler. The first middleware added sees the request first and the response
 * last.
 *
 * @param <I>
 *            the request type
 * @param <O>
 *            the response type
 */
public class MiddlewareChain<I, O> {

  private final List<Middleware<I, O>> middlewareList;

  /**
   * Creates a new, empty MiddlewareChain.
   */
  public MiddlewareChain() {
    this.middlewareList = new ArrayList<>();
  }

  /**
   * Creates a new MiddlewareChain with the given middleware.
   *
   * @param middlewareList
   *            the initial list of middleware
   */
  public MiddlewareChain(List<Middleware<I, O>> middlewareList) {
    this.middlewareList = new ArrayList<>(middlewareList);
  }

  /**
   * Adds a middleware to the end of the chain.
   *
   * @param middleware
   *            the middleware to add
   * @return this chain for fluent chaining
   */
  public MiddlewareChain<I, O> use(Middleware<I, O> middleware) {
    if (middleware != null) {
      middlewareList.add(middleware);
    }
    return this;
  }

  /**
   * Adds multiple middleware to the end of the chain.
   *
   * @param middlewareList
   *            the middleware to add
   * @return this chain for fluent chaining
   */
  public MiddlewareChain<I, O> useAll(List<Middleware<I, O>> middlewareList) {
    if (middlewareList != null) {
      this.middlewareList.addAll(middlewareList);
    }
    return this;
  }

  /**
   * Returns the number of middleware in the chain.
   *
   * @return the middleware count
   */
  public int size() {
    return middlewareList.size();
  }

  /**
   * Executes the chain.
   *
   * @param request
   *            the input request
   * @param context
   *            the invocation context
   * @param finalAction
   *            the handler to run after all middleware
   * @return the output response
   * @throws ModelHostException
   *             if execution fails
   */
  public O execute(I request, InvocationContext context, BiFunction<InvocationContext, I, O> finalAction)
      throws ModelHostException {
    return dispatch(0, request, context, finalAction);
  }

  private O dispatch(int index, I request, InvocationContext context,
      BiFunction<InvocationContext, I, O> finalAction) throws ModelHostException {
    if (index >= middlewareList.size()) {
      return finalAction.apply(context, request);
    }

    Middleware<I, O> currentMiddleware = middlewareList.get(index);

    MiddlewareNext<I, O> next = (modifiedRequest, modifiedContext) -> dispatch(index + 1,
        modifiedRequest != null ? modifiedRequest : request,
        modifiedContext != null ? modifiedContext : context, finalAction);

    return currentMiddleware.handle(request, context, next);
  }

  /**
   * Creates a new MiddlewareChain with the specified middleware.
   *
   * @param middleware
   *            the middleware to include
   * @param <I>
   *            request type
   * @param <O>
   *            response type
   * @return a new MiddlewareChain
   */
  @SafeVarargs
  public static <I, O> MiddlewareChain<I, O> of(Middleware<I, O>... middleware) {
    MiddlewareChain<I, O> chain = new MiddlewareChain<>();
    for (Middleware<I, O> m : middleware) {
      chain.use(m);
    }
    return chain;
  }
}
