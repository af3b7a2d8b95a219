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
package net.opendash.transpile;

import java.util.List;

import net.opendash.variables.DynamicFilter;

/**
 * Query text helpers used to apply ad hoc filters. Implementations are
 * free to use a real parser, the transpiler only relies on these three
 * operations.
 *
 * @since 1.0
 */
public interface QueryRewriter {

  /**
   * Adds a label matcher to every vector selector of a PromQL query.
   * @param query The non-null query.
   * @param name The label name.
   * @param value The label value.
   * @param operator The matcher operator, e.g. "=", "!=", "=~" or "!~".
   * @return The rewritten query.
   */
  public String addLabelToPromQl(final String query,
                                 final String name,
                                 final String value,
                                 final String operator);

  /**
   * Finds the stream (table) a SQL query reads from.
   * @param query The non-null query.
   * @return The stream name or null if it could not be determined.
   */
  public String getStreamFromQuery(final String query);

  /**
   * Adds the filters as predicates to the SQL query's WHERE clause.
   * @param query The non-null query.
   * @param filters A non-null, possibly empty list of complete filters.
   * @return The rewritten query.
   */
  public String addLabelsToSql(final String query,
                               final List<DynamicFilter> filters);
}
