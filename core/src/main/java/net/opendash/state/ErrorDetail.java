// This file is part of OpenDash.
// Copyright (C) 2026  The OpenDash Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.opendash.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.opendash.exceptions.QueryExecutionException;
import net.opendash.exceptions.RemoteQueryExecutionException;

/**
 * The last error surfaced for a panel: a message, cut to
 * {@link #MAX_MESSAGE_LENGTH} characters, and a code which is usually an
 * HTTP status. The factories apply the field precedence of each query
 * language's back end.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = ErrorDetail.Builder.class)
public class ErrorDetail {
  /** Longer messages are cut and suffixed with {@link #ELLIPSIS}. */
  public static final int MAX_MESSAGE_LENGTH = 300;
  public static final String ELLIPSIS = " ...";

  /** No error. */
  public static final ErrorDetail EMPTY = new ErrorDetail("", "");

  private final String message;
  private final String code;

  protected ErrorDetail(final String message, final String code) {
    this.message = Strings.nullToEmpty(message);
    this.code = Strings.nullToEmpty(code);
  }

  /**
   * @param message The message, truncated if too long.
   * @param code The code, may be null.
   * @return An error detail.
   */
  public static ErrorDetail of(final String message, final String code) {
    return new ErrorDetail(truncate(message), code);
  }

  /**
   * Extracts an error from a failed SQL search. The message comes from
   * the body's {@code error_detail}, then its {@code message}, then the
   * exception message, then the body's {@code error}. For streamed
   * searches the code comes from the body's {@code code} before the
   * status, otherwise the status wins.
   *
   * @param t The failure.
   * @param streaming Whether the search was streamed over a push socket
   * or HTTP stream.
   * @return A non-null error detail.
   */
  public static ErrorDetail fromSql(final Throwable t, final boolean streaming) {
    final JsonNode body = body(t);
    String message = text(body, "error_detail");
    if (Strings.isNullOrEmpty(message)) {
      message = text(body, "message");
    }
    if (Strings.isNullOrEmpty(message)) {
      message = t.getMessage();
    }
    if (Strings.isNullOrEmpty(message)) {
      message = text(body, "error");
    }

    final String status = status(t);
    final String body_code = text(body, "code");
    final String code;
    if (streaming) {
      code = !Strings.isNullOrEmpty(body_code) ? body_code : status;
    } else {
      code = !Strings.isNullOrEmpty(status) ? status : body_code;
    }
    return of(message, code);
  }

  /**
   * Extracts an error from a failed PromQL range query. The message is
   * the body's {@code error} or else the exception message, the code is
   * the status or else the body's {@code code}.
   * @param t The failure.
   * @return A non-null error detail.
   */
  public static ErrorDetail fromPromql(final Throwable t) {
    final JsonNode body = body(t);
    String message = text(body, "error");
    if (Strings.isNullOrEmpty(message)) {
      message = t.getMessage();
    }
    final String status = status(t);
    return of(message, !Strings.isNullOrEmpty(status) ?
        status : text(body, "code"));
  }

  /**
   * Extracts an error from the content of a streamed error message. The
   * message is the content's {@code message}, {@code error} or
   * {@code error_detail}, the first non-empty one winning.
   * @param content The message content, may be null.
   * @return A non-null error detail.
   */
  public static ErrorDetail fromStreamError(final JsonNode content) {
    String message = text(content, "message");
    if (Strings.isNullOrEmpty(message)) {
      message = text(content, "error");
    }
    if (Strings.isNullOrEmpty(message)) {
      message = text(content, "error_detail");
    }
    String code = text(content, "code");
    if (Strings.isNullOrEmpty(code)) {
      code = text(content, "status");
    }
    return of(message, code);
  }

  /**
   * Cuts messages longer than {@link #MAX_MESSAGE_LENGTH}.
   * @param message The message, may be null.
   * @return The message or the first 300 characters and an ellipsis.
   */
  public static String truncate(final String message) {
    if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
      return message;
    }
    return message.substring(0, MAX_MESSAGE_LENGTH) + ELLIPSIS;
  }

  public String getMessage() {
    return message;
  }

  public String getCode() {
    return code;
  }

  /** @return True if there's no message. */
  @JsonIgnore
  public boolean isEmpty() {
    return message.isEmpty();
  }

  private static JsonNode body(final Throwable t) {
    if (t instanceof RemoteQueryExecutionException) {
      return ((RemoteQueryExecutionException) t).getBody();
    }
    return null;
  }

  private static String status(final Throwable t) {
    if (t instanceof QueryExecutionException &&
        ((QueryExecutionException) t).getStatusCode() > 0) {
      return Integer.toString(((QueryExecutionException) t).getStatusCode());
    }
    return null;
  }

  private static String text(final JsonNode node, final String field) {
    if (node == null || !node.hasNonNull(field)) {
      return null;
    }
    final JsonNode value = node.get(field);
    return value.isValueNode() ? value.asText() : value.toString();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ErrorDetail other = (ErrorDetail) o;
    return Objects.equal(message, other.message)
        && Objects.equal(code, other.code);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(message, code);
  }

  @Override
  public String toString() {
    return "message=" + message + ", code=" + code;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String message;
    @JsonProperty
    private String code;

    public Builder setMessage(final String message) {
      this.message = message;
      return this;
    }

    public Builder setCode(final String code) {
      this.code = code;
      return this;
    }

    public ErrorDetail build() {
      return new ErrorDetail(message, code);
    }
  }
}
