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
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * InvocationRequest is the parsed form of an inbound inference request: the
 * JSON body plus the request headers. Header names are matched
 * case-insensitively.
 */
public class InvocationRequest {

  private final JsonNode body;
  private final Map<String, String> headers;

  private InvocationRequest(Builder builder) {
    this.body = builder.body;
    TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    copy.putAll(builder.headers);
    this.headers = Collections.unmodifiableMap(copy);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the parsed request body.
   *
   * @return the body, or null if the request had no body
   */
  public JsonNode getBody() {
    return body;
  }

  /**
   * Returns all request headers.
   *
   * @return an unmodifiable, case-insensitive header map
   */
  public Map<String, String> getHeaders() {
    return headers;
  }

  /**
   * Returns a single header value.
   *
   * @param name
   *            the header name, in any case
   * @return the value, or null if the header is absent
   */
  public String getHeader(String name) {
    return headers.get(name);
  }

  /**
   * Returns a copy of this request with a different body.
   *
   * @param body
   *            the new body
   * @return a new request with the same headers
   */
  public InvocationRequest withBody(JsonNode body) {
    return builder().body(body).headers(headers).build();
  }

  @Override
  public String toString() {
    return "InvocationRequest{headers=" + headers.keySet() + ", body=" + body + "}";
  }

  /**
   * Builder for InvocationRequest.
   */
  public static class Builder {
    private JsonNode body;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public Builder body(JsonNode body) {
      this.body = body;
      return this;
    }

    public Builder header(String name, String value) {
      this.headers.put(name, value);
      return this;
    }

    public Builder headers(Map<String, String> headers) {
      if (headers != null) {
        this.headers.putAll(headers);
      }
      return this;
    }

    public InvocationRequest build() {
      return new InvocationRequest(this);
    }
  }
}
