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
package net.opendash.exceptions;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An exception that occurred when calling a remote service such as the
 * search back end. Carries the parsed response body, when there was one,
 * so callers can pull out the back end's own error fields.
 *
 * @since 1.0
 */
public class RemoteQueryExecutionException extends QueryExecutionException {
  private static final long serialVersionUID = 2141836297711150934L;

  /** A description of the remote service that threw the exception. */
  private final String remote_endpoint;

  /** The parsed response body, may be null. */
  private final JsonNode body;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this.
   * @param status_code An optional status code reflecting the error state.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code) {
    this(msg, remote_endpoint, status_code, (JsonNode) null);
  }

  /**
   * Ctor with the parsed response body.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this.
   * @param status_code An optional status code reflecting the error state.
   * @param body The parsed body of the response, may be null.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code,
                                       final JsonNode body) {
    super(msg, status_code);
    this.remote_endpoint = remote_endpoint;
    this.body = body;
  }

  /**
   * Ctor wrapping a transport level exception.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this.
   * @param status_code An optional status code reflecting the error state.
   * @param e The original exception that caused this to be thrown.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code,
                                       final Throwable e) {
    super(msg, status_code, e);
    this.remote_endpoint = remote_endpoint;
    body = null;
  }

  /** @return A description of the remote endpoint that threw this. */
  public String getRemoteEndpoint() {
    return remote_endpoint;
  }

  /** @return The parsed body of the response, may be null. */
  public JsonNode getBody() {
    return body;
  }
}
