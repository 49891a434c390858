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
 * InvocationHandler performs the actual inference for an ordinary request,
 * after every middleware has run.
 */
@FunctionalInterface
public interface InvocationHandler {

  /**
   * Handles an inference request.
   *
   * @param context
   *            the invocation context, carrying values published by middleware
   * @param request
   *            the request
   * @return the response
   * @throws ModelHostException
   *             if the request cannot be served
   */
  InvocationResponse handle(InvocationContext context, InvocationRequest request) throws ModelHostException;
}
