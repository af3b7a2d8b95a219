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

import java.util.Collections;
import java.util.List;

/**
 * Thrown by any stage of a panel load to bubble an error up to the
 * loader, which turns it into the panel's error detail.
 *
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = -8190312648271562203L;

  /** The index of the panel query this pertains to or -1 if the error
   * applies to the whole panel. */
  protected final int order;

  /** A status code associated with the exception, usually HTTP. */
  protected final int status_code;

  /** An optional list of exceptions thrown. */
  protected final List<Throwable> exceptions;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, -1);
  }

  /**
   * Ctor that sets the query index for the exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order The query index or -1.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final int order) {
    super(msg);
    this.status_code = status_code;
    this.order = order;
    exceptions = null;
  }

  /**
   * Ctor setting a message, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param e The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final Throwable e) {
    this(msg, status_code, -1, e);
  }

  /**
   * Ctor setting a message, query index, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order The query index or -1.
   * @param e The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final int order,
                                 final Throwable e) {
    super(msg, e);
    this.status_code = status_code;
    this.order = order;
    exceptions = null;
  }

  /**
   * Ctor that takes a list of exceptions that triggered this, e.g. from
   * a fan out of queries.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param exceptions An optional list of exceptions. May be null or empty.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final List<Throwable> exceptions) {
    super(msg);
    this.status_code = status_code;
    order = -1;
    this.exceptions = exceptions;
  }

  /** @return The query index or -1 if it applies to the panel. */
  public int getOrder() {
    return order;
  }

  /** @return An optional status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }

  /** @return A list of exceptions that triggered this or an empty list. */
  public List<Throwable> getExceptions() {
    return exceptions == null ? Collections.<Throwable>emptyList() :
      Collections.<Throwable>unmodifiableList(exceptions);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass())
        .append(": ")
        .append(getMessage());
    if (exceptions != null) {
      buf.append(" subExceptions[");
      for (int i = 0; i < exceptions.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(exceptions.get(i).toString());
      }
      buf.append("]");
    }
    return buf.toString();
  }
}
