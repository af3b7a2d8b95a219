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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import net.opendash.utils.JSON;

/**
 * Applies backend responses to a {@link LoadState}. Every transport goes
 * through here so the merge rules for a slot's rows and envelope live in
 * one place:
 * <ul>
 * <li>streaming aggregation responses replace the slot's rows,</li>
 * <li>otherwise rows are appended or prepended depending on the order the
 * back end returns partitions in.</li>
 * </ul>
 * For piecemeal streamed hits the order and aggregation flag come from
 * the envelope already stored for the slot, not the request.
 *
 * @since 1.0
 */
public class ResultAccumulator {
  private static final Logger LOG = LoggerFactory.getLogger(
      ResultAccumulator.class);

  public static final String ORDER_ASC = "asc";
  public static final String ORDER_DESC = "desc";

  public static final String RANGE_RESTRICTION_MESSAGE =
      "Query duration is modified due to query range restriction of %d hours";

  private final LoadState state;

  /**
   * Default ctor.
   * @param state A non-null state to mutate.
   */
  public ResultAccumulator(final LoadState state) {
    if (state == null) {
      throw new IllegalArgumentException("State cannot be null.");
    }
    this.state = state;
  }

  /** @return The state mutated. */
  public LoadState state() {
    return state;
  }

  /**
   * Merges the result of one partition search. A {@code desc} ordered
   * query appends as partitions are walked newest first, anything else
   * prepends.
   *
   * @param slot The destination slot.
   * @param hits The rows returned, null is treated as empty.
   * @param meta The response envelope, stored as a copy.
   * @param streaming_aggs Whether the plan asked for server side
   * aggregation, in which case rows are replaced.
   * @param order_by The plan's order.
   */
  public void mergePartition(final int slot,
                             final ArrayNode hits,
                             final ResultMetaData meta,
                             final boolean streaming_aggs,
                             final String order_by) {
    synchronized (state) {
      state.clearErrorDetail();
      mergeRows(slot, hits, streaming_aggs, !ORDER_DESC.equalsIgnoreCase(
          order_by));
      state.setResultMetaData(slot, meta == null ?
          new ResultMetaData() : meta.copy());
    }
  }

  /**
   * Flags a slot as cut short because the plan's query range budget ran
   * out.
   * @param slot The slot.
   * @param max_query_range_hours The budget, for the message.
   * @param new_start_time The first timestamp actually covered.
   * @param new_end_time The requested end.
   */
  public void markRangeRestricted(final int slot,
                                  final long max_query_range_hours,
                                  final long new_start_time,
                                  final long new_end_time) {
    synchronized (state) {
      final ResultMetaData meta = state.resultMetaDataAt(slot);
      meta.setIsPartial(true);
      meta.setFunctionError(String.format(RANGE_RESTRICTION_MESSAGE,
          max_query_range_hours));
      meta.setNewStartTime(new_start_time);
      meta.setNewEndTime(new_end_time);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Slot " + slot + " restricted to " + max_query_range_hours
          + " hours starting at " + new_start_time);
    }
  }

  /**
   * Records where a partial response ended.
   * @param slot The slot.
   * @param new_end_time The requested end.
   */
  public void markPartial(final int slot, final long new_end_time) {
    synchronized (state) {
      state.resultMetaDataAt(slot).setNewEndTime(new_end_time);
    }
  }

  /**
   * Handles a metadata-only streamed message. The slot's envelope becomes
   * the content merged with its {@code results} object.
   * @param slot The slot.
   * @param content The message content.
   */
  public void applyStreamMetadata(final int slot, final JsonNode content) {
    final JsonNode top;
    if (content != null && content.isObject()) {
      top = ((ObjectNode) content).deepCopy().without("results");
    } else {
      top = null;
    }
    final ResultMetaData meta = ResultMetaData.merge(top,
        content == null ? null : content.get("results"));
    synchronized (state) {
      state.setResultMetaData(slot, meta);
    }
  }

  /**
   * Handles a hits-only streamed message using the order and aggregation
   * flag of the envelope stored for the slot.
   * @param slot The slot.
   * @param content The message content.
   */
  public void applyStreamHits(final int slot, final JsonNode content) {
    synchronized (state) {
      state.clearErrorDetail();
      final ResultMetaData meta = state.resultMetaDataAt(slot);
      mergeRows(slot, hits(content), meta.isStreamingAggs(),
          ORDER_ASC.equalsIgnoreCase(meta.getOrderBy()));
    }
  }

  /**
   * Handles a full streamed response: rows are merged and the envelope
   * replaced by the content's {@code results}.
   * @param slot The slot.
   * @param content The message content.
   */
  public void applyStreamResponse(final int slot, final JsonNode content) {
    final JsonNode results = content == null ? null : content.get("results");
    final boolean streaming_aggs = content != null &&
        content.path("streaming_aggs").asBoolean(false);
    final String order_by = results == null ?
        null : results.path("order_by").asText(null);
    synchronized (state) {
      state.clearErrorDetail();
      mergeRows(slot, hits(content), streaming_aggs,
          ORDER_ASC.equalsIgnoreCase(order_by));
      state.setResultMetaData(slot, ResultMetaData.fromNode(results));
      if (state.dataAt(slot).size() > 0 && !state.isLoading()) {
        state.setPartialData(false);
      }
    }
  }

  /**
   * Progress reported mid stream. Data stays partial until the end.
   * @param content The content holding {@code percent}.
   */
  public void applyStreamProgress(final JsonNode content) {
    synchronized (state) {
      state.setProgressPercentage(content == null ?
          0 : content.path("percent").asInt(0));
      state.setPartialData(true);
    }
  }

  /** The stream finished cleanly. */
  public void applyStreamEnd() {
    synchronized (state) {
      state.setLoading(false);
      state.setProgress(0, 0);
      state.setProgressPercentage(100);
      state.setOperationCancelled(false);
      state.setPartialData(false);
    }
  }

  /**
   * The stream failed.
   * @param error The error to surface.
   */
  public void applyStreamError(final ErrorDetail error) {
    synchronized (state) {
      state.setLoading(false);
      state.resetProgress();
      state.setOperationCancelled(false);
      state.setErrorDetail(error);
    }
  }

  /**
   * Adds rows to a slot.
   * @param slot The slot.
   * @param hits The rows, null for none.
   * @param replace Whether to replace instead of merging.
   * @param prepend Whether to put the rows before the existing ones.
   */
  void mergeRows(final int slot,
                 final ArrayNode hits,
                 final boolean replace,
                 final boolean prepend) {
    final ArrayNode incoming = hits == null ?
        JSON.getMapper().createArrayNode() : hits.deepCopy();
    if (replace) {
      state.setData(slot, incoming);
      return;
    }
    final ArrayNode existing = state.dataAt(slot);
    if (prepend) {
      incoming.addAll(existing);
      state.setData(slot, incoming);
    } else {
      existing.addAll(incoming);
    }
  }

  private static ArrayNode hits(final JsonNode content) {
    if (content == null) {
      return null;
    }
    final JsonNode hits = content.path("results").path("hits");
    return hits.isArray() ? (ArrayNode) hits : null;
  }
}
