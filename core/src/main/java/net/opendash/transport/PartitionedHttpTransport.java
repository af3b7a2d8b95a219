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

import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.opendash.configuration.Configuration;
import net.opendash.core.LoadCycle;
import net.opendash.exceptions.QueryExecutionCanceled;
import net.opendash.exceptions.QueryExecutionException;
import net.opendash.search.PartitionResponse;
import net.opendash.search.SearchRequest;
import net.opendash.search.SearchResponse;
import net.opendash.search.SearchService;
import net.opendash.search.TraceIds;
import net.opendash.state.ErrorDetail;
import net.opendash.state.LoadState;
import net.opendash.state.ResultMetaData;
import net.opendash.utils.Exceptions;

/**
 * Runs a query as a partition plan followed by one search per partition,
 * newest partition first. Each search's rows are merged into the slot
 * and the state is saved to the cache after each one.
 * <p>
 * When the plan carries a {@code max_query_range} budget in hours, each
 * partition's span, discounted by the share served from the result
 * cache, is taken off the budget. Once the budget is overdrawn before
 * the last partition, the slot is flagged partial with an explanatory
 * message and no more partitions are searched.
 *
 * @since 1.0
 */
public class PartitionedHttpTransport implements TransportStrategy {
  private static final Logger LOG = LoggerFactory.getLogger(
      PartitionedHttpTransport.class);

  public static final String RANGE_DIVISOR_KEY =
      "dashboard.partition.range_divisor";

  private final SearchService search;
  private final Configuration config;

  /**
   * Default ctor.
   * @param search A non-null search service.
   * @param config A non-null config.
   */
  public PartitionedHttpTransport(final SearchService search,
                                  final Configuration config) {
    if (search == null) {
      throw new IllegalArgumentException("Search service cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.search = search;
    this.config = config;
    if (!config.hasProperty(RANGE_DIVISOR_KEY)) {
      config.register(RANGE_DIVISOR_KEY, 3600000000L, false,
          "Divides a partition's timestamp span into hours for the "
          + "max_query_range budget. Partitions are in microseconds.");
    }
  }

  @Override
  public String name() {
    return "PartitionedHttp";
  }

  @Override
  public Deferred<TransportOutcome> execute(final TransportRequest request,
                                            final LoadCycle cycle,
                                            final TransportContext context) {
    final LoadState state = context.state();
    final String plan_trace_id = TraceIds.newTraceId();
    state.addTraceId(plan_trace_id);
    state.resetProgress();

    final SearchRequest plan_request = SearchRequest.newBuilder()
        .setSql(request.getQuery())
        .setVrlFunction(request.getVrlFunction())
        .setStartTime(request.getRange().getStartTime())
        .setEndTime(request.getRange().getEndTime())
        .setStreamingOutput(true)
        .setOrgId(context.orgId())
        .setStreamType(request.getStreamType())
        .setTraceId(plan_trace_id)
        .setDashboardId(context.identity().getDashboardId())
        .setFolderId(context.identity().getFolderId())
        .build();

    /** Walks the partitions from the last one down. */
    class PartitionLoop implements Callback<Deferred<TransportOutcome>,
        PartitionResponse> {
      private PartitionResponse plan;
      private List<long[]> partitions;
      private double remaining_range;
      private int index;

      @Override
      public Deferred<TransportOutcome> call(final PartitionResponse plan)
          throws Exception {
        state.removeTraceId(plan_trace_id);
        if (cycle.isCancelled()) {
          state.setPartialData(true);
          context.saveToCache();
          return Deferred.fromResult(TransportOutcome.CANCELLED);
        }
        this.plan = plan;
        partitions = plan.getPartitions();
        remaining_range = plan.getMaxQueryRange();
        index = partitions.size() - 1;
        state.setProgress(partitions.size(), 0);
        state.setData(request.getSlot(), null);
        state.setResultMetaData(request.getSlot(), null);
        if (LOG.isDebugEnabled()) {
          LOG.debug("Running " + partitions.size() + " partitions for slot "
              + request.getSlot() + " with plan " + plan);
        }
        return next();
      }

      Deferred<TransportOutcome> next() {
        if (index < 0) {
          context.saveToCache();
          return Deferred.fromResult(TransportOutcome.COMPLETED);
        }
        if (cycle.isCancelled()) {
          return Deferred.fromResult(TransportOutcome.CANCELLED);
        }
        state.setLoading(true);
        final long[] partition = partitions.get(index);
        final String trace_id = TraceIds.newTraceId();
        state.addTraceId(trace_id);
        final SearchRequest search_request = SearchRequest.newBuilder(
              plan_request)
            .setStartTime(partition[0])
            .setEndTime(partition[1])
            .setHistogramInterval(plan.getHistogramInterval())
            .setStreamingOutput(plan.isStreamingAggs())
            .setStreamingId(plan.getStreamingId())
            .setTraceId(trace_id)
            .build();

        class SearchCB implements Callback<Deferred<TransportOutcome>,
            SearchResponse> {
          @Override
          public Deferred<TransportOutcome> call(final SearchResponse response)
              throws Exception {
            state.removeTraceId(trace_id);
            if (cycle.isCancelled()) {
              return Deferred.fromResult(TransportOutcome.CANCELLED);
            }
            state.completeStep();
            state.clearErrorDetail();

            final ResultMetaData meta = response.getMeta();
            if (!Strings.isNullOrEmpty(meta.getFunctionError()) &&
                !meta.isPartial()) {
              throw new QueryExecutionException("Function error: "
                  + meta.getFunctionError(), 0, request.getSlot());
            }

            context.accumulator().mergePartition(request.getSlot(),
                response.getHits(), meta, plan.isStreamingAggs(),
                plan.getOrderBy());

            if (meta.isPartial()) {
              context.accumulator().markPartial(request.getSlot(),
                  request.getRange().getEndTime());
              context.saveToCache();
              return Deferred.fromResult(TransportOutcome.PARTIAL);
            }

            if (plan.getMaxQueryRange() != 0) {
              final double hours = (double) (partition[1] - partition[0])
                  / config.getLong(RANGE_DIVISOR_KEY);
              final double cache_ratio = meta.getResultCacheRatio() == null ?
                  0 : meta.getResultCacheRatio();
              remaining_range -= hours * ((100 - cache_ratio) / 100);
              if (remaining_range < 0 && index != 0) {
                context.accumulator().markRangeRestricted(request.getSlot(),
                    plan.getMaxQueryRange(), partition[0],
                    request.getRange().getEndTime());
                context.saveToCache();
                return Deferred.fromResult(TransportOutcome.PARTIAL);
              }
            }

            context.saveToCache();
            index--;
            return next();
          }
        }

        return cycle.guard(search.search(search_request))
            .addCallbackDeferring(new SearchCB());
      }
    }

    class DoneCB implements Callback<TransportOutcome, TransportOutcome> {
      @Override
      public TransportOutcome call(final TransportOutcome outcome)
          throws Exception {
        if (outcome != TransportOutcome.CANCELLED) {
          state.setLoading(false);
        }
        return outcome;
      }
    }

    class ErrorCB implements Callback<TransportOutcome, Exception> {
      @Override
      public TransportOutcome call(final Exception e) throws Exception {
        state.removeTraceId(plan_trace_id);
        final Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof QueryExecutionCanceled || cycle.isCancelled()) {
          return TransportOutcome.CANCELLED;
        }
        LOG.warn("Query for slot " + request.getSlot() + " failed", cause);
        state.setErrorDetail(ErrorDetail.fromSql(cause, false));
        state.setLoading(false);
        return TransportOutcome.FAILED;
      }
    }

    return cycle.guard(search.partition(plan_request))
        .addCallbackDeferring(new PartitionLoop())
        .addCallbacks(new DoneCB(), new ErrorCB());
  }

  @Override
  public void cancelTraceIds(final Collection<String> trace_ids,
                             final String org_id) {
    // in-flight HTTP calls are dropped by the cycle guard
    if (LOG.isDebugEnabled()) {
      LOG.debug("Dropping " + trace_ids.size() + " in-flight searches");
    }
  }
}
