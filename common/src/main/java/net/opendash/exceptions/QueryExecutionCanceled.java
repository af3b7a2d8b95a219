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

/**
 * The value a load cycle, a transport call or a wait resolves with when
 * it was cancelled, either because a newer cycle started, the user hit
 * cancel or the panel was torn down. Never shown to the user.
 *
 * @since 1.0
 */
public class QueryExecutionCanceled extends QueryExecutionException {
  private static final long serialVersionUID = 4419562378126043019L;

  /**
   * Default ctor.
   * @param msg A non-null message describing why.
   */
  public QueryExecutionCanceled(final String msg) {
    this(msg, 400, -1);
  }

  /**
   * Ctor with a status code and query index.
   * @param msg A non-null message describing why.
   * @param status_code An optional status code.
   * @param order The query index or -1.
   */
  public QueryExecutionCanceled(final String msg,
                                final int status_code,
                                final int order) {
    super(msg, status_code, order);
  }
}
