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
 * Stateful sessions for an otherwise stateless inference endpoint.
 *
 * <p>
 * {@link com.modelhost.sessions.SessionManager} owns the on-disk sessions,
 * {@link com.modelhost.sessions.Session} stores named JSON values one file
 * per key, and {@link com.modelhost.sessions.SessionInterceptor} speaks the
 * create/close protocol in front of the inference handler.
 */
package com.modelhost.sessions;
