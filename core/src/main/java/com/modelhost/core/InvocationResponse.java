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

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * InvocationResponse is what the request pipeline hands back to the HTTP
 * layer: a status code, response headers and raw body bytes.
 */
public class InvocationResponse {

  public static final String CONTENT_TYPE = "Content-Type";
  public static final String APPLICATION_JSON = "application/json";
  public static final String TEXT_PLAIN = "text/plain; charset=utf-8";

  private final int statusCode;
  private final Map<String, String> headers;
  private final byte[] body;

  private InvocationResponse(Builder builder) {
    this.statusCode = builder.statusCode;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    this.body = builder.body != null ? builder.body : new byte[0];
  }

  /**
   * Creates a new builder with status 200.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a 200 response with a JSON body.
   *
   * @param value
   *            the object to serialize
   * @return the response
   */
  public static InvocationResponse json(Object value) {
    return builder().header(CONTENT_TYPE, APPLICATION_JSON).body(JsonUtils.toJson(value)).build();
  }

  /**
   * Creates a 200 response with a plain text body.
   *
   * @param text
   *            the body text
   * @return the response
   */
  public static InvocationResponse text(String text) {
    return builder().header(CONTENT_TYPE, TEXT_PLAIN).body(text).build();
  }

  public int getStatusCode() {
    return statusCode;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  /**
   * Returns a single header value, matching the name case-insensitively.
   *
   * @param name
   *            the header name
   * @return the value, or null if absent
   */
  public String getHeader(String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  public byte[] getBody() {
    return body.clone();
  }

  /**
   * Returns the body decoded as UTF-8.
   *
   * @return the body text
   */
  public String getBodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /**
   * Returns a builder pre-populated with this response.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return builder().statusCode(statusCode).headers(headers).body(body);
  }

  @Override
  public String toString() {
    return "InvocationResponse{statusCode=" + statusCode + ", headers=" + headers + ", bodyLength=" + body.length
        + "}";
  }

  /**
   * Builder for InvocationResponse.
   */
  public static class Builder {
    private int statusCode = 200;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private byte[] body;

    public Builder statusCode(int statusCode) {
      this.statusCode = statusCode;
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

    public Builder body(byte[] body) {
      this.body = body != null ? body.clone() : null;
      return this;
    }

    public Builder body(String body) {
      this.body = body != null ? body.getBytes(StandardCharsets.UTF_8) : null;
      return this;
    }

    public InvocationResponse build() {
      return new InvocationResponse(this);
    }
  }
}
