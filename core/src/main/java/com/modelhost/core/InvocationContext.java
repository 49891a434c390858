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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * InvocationContext carries request-scoped state through the middleware
 * chain. It is immutable; middleware that wants to publish a value to the
 * handlers downstream creates a copy with {@link #withAttribute}.
 */
public class InvocationContext {

  private final Map<String, Object> attributes;

  /**
   * Creates an empty context.
   */
  public InvocationContext() {
    this(Collections.emptyMap());
  }

  private InvocationContext(Map<String, Object> attributes) {
    this.attributes = Collections.unmodifiableMap(attributes);
  }

  /**
   * Returns an attribute cast to the requested type.
   *
   * @param name
   *            the attribute name
   * @param type
   *            the expected type
   * @param <T>
   *            the attribute type
   * @return the attribute, or null if absent or of another type
   */
  public <T> T getAttribute(String name, Class<T> type) {
    Object value = attributes.get(name);
    return type.isInstance(value) ? type.cast(value) : null;
  }

  /**
   * Returns true if the attribute is set.
   *
   * @param name
   *            the attribute name
   * @return true if present
   */
  public boolean hasAttribute(String name) {
    return attributes.containsKey(name);
  }

  /**
   * Creates a new context with an additional attribute.
   *
   * @param name
   *            the attribute name
   * @param value
   *            the attribute value; null removes the attribute
   * @return a new InvocationContext
   */
  public InvocationContext withAttribute(String name, Object value) {
    Map<String, Object> copy = new HashMap<>(attributes);
    if (value == null) {
      copy.remove(name);
    } else {
      copy.put(name, value);
    }
    return new InvocationContext(copy);
  }
}
