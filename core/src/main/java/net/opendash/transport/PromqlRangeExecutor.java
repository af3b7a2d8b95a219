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
package net.opendash.transport;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.opendash.core.LoadCycle;
import net.opendash.exceptions.QueryExecutionCanceled;
import net.opendash.search.MetricsQueryRequest;
import net.opendash.search.SearchService;
import net.opendash.search.TraceIds;
import net.opendash.state.ErrorDetail;
import net.opendash.state.LoadState;
import net.opendash.utils.Exceptions;

/**
 * Runs every PromQL query of a panel at once as a direct range query.
 * A failing query records its error and yields a null result without
 * affecting its siblings.
 *
 * @since 1.0
 */
public class PromqlRangeExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      PromqlRangeExecutor.class);

  private final SearchService search;

  /**
   * Default ctor.
   * @param search A non-null search service.
   */
  public PromqlRangeExecutor(final SearchService search) {
    if (search == null) {
      throw new IllegalArgumentException("Search service cannot be null.");
    }
    this.search = search;
  }

  /**
   * Starts all of the queries.
   * @param requests The queries, in slot order.
   * @param step The step, may be null for the back end's default.
   * @param cycle The governing cycle.
   * @param context The loader's context.
   * @return A deferred resolving once every query settled with the
   * {@code data} object of each response, null for failed ones.
   */
  public Deferred<List<JsonNode>> execute(final List<TransportRequest> requests,
                                          final String step,
                                          final LoadCycle cycle,
                                          final TransportContext context) {
    final LoadState state = context.state();
    final List<Deferred<JsonNode>> deferreds =
        Lists.newArrayListWithExpectedSize(requests.size());
    // once per fan-out, a failure sticks until the next run
    state.clearErrorDetail();

    for (final TransportRequest request : requests) {
      final String trace_id = TraceIds.newTraceId();
      state.addTraceId(trace_id);

      class SuccessCB implements Callback<JsonNode, JsonNode> {
        @Override
        public JsonNode call(final JsonNode data) throws Exception {
          state.removeTraceId(trace_id);
          return data;
        }
      }

      class ErrorCB implements Callback<JsonNode, Exception> {
        @Override
        public JsonNode call(final Exception e) throws Exception {
          state.removeTraceId(trace_id);
          final Throwable cause = Exceptions.unwrap(e);
          if (cause instanceof QueryExecutionCanceled) {
            return null;
          }
          LOG.warn("PromQL query for slot " + request.getSlot()
              + " failed", cause);
          state.setErrorDetail(ErrorDetail.fromPromql(cause));
          return null;
        }
      }

      final Deferred<JsonNode> deferred;
      try {
        deferred = search.metricsQueryRange(MetricsQueryRequest.newBuilder()
            .setQuery(request.getQuery())
            .setStartTime(request.getRange().getStartTime())
            .setEndTime(request.getRange().getEndTime())
            .setStep(Strings.isNullOrEmpty(step) ? "0" : step)
            .setOrgId(context.orgId())
            .setTraceId(trace_id)
            .build());
      } catch (RuntimeException e) {
        deferreds.add(Deferred.<JsonNode>fromError(e)
            .addCallbacks(new SuccessCB(), new ErrorCB()));
        continue;
      }
      deferreds.add(cycle.guard(deferred)
          .addCallbacks(new SuccessCB(), new ErrorCB()));
    }

    class GroupCB implements Callback<List<JsonNode>, ArrayList<JsonNode>> {
      @Override
      public List<JsonNode> call(final ArrayList<JsonNode> results)
          throws Exception {
        if (LOG.isDebugEnabled()) {
          LOG.debug("All " + results.size() + " PromQL queries settled");
        }
        return results;
      }
    }

    return Deferred.groupInOrder(deferreds).addCallback(new GroupCB());
  }
}
