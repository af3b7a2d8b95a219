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
package net.opendash.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.stumbleupon.async.Deferred;

/**
 * The back end search service. Failures resolve the deferreds with a
 * {@link net.opendash.exceptions.QueryExecutionException}, usually a
 * {@link net.opendash.exceptions.RemoteQueryExecutionException} carrying
 * the error body.
 *
 * @since 1.0
 */
public interface SearchService {

  /**
   * Asks the back end how to split a search into sub-ranges.
   * @param request The search with the full range.
   * @return A deferred resolving to the plan.
   */
  public Deferred<PartitionResponse> partition(final SearchRequest request);

  /**
   * Runs one search.
   * @param request The search, usually over a single partition.
   * @return A deferred resolving to the rows and envelope.
   */
  public Deferred<SearchResponse> search(final SearchRequest request);

  /**
   * Runs a PromQL range query.
   * @param request The query.
   * @return A deferred resolving to the {@code data} object of the
   * response, holding {@code resultType} and {@code result}.
   */
  public Deferred<JsonNode> metricsQueryRange(
      final MetricsQueryRequest request);
}
