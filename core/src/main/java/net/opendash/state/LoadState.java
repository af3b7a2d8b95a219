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

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.opendash.utils.JSON;

/**
 * The single, mutable result state of one panel. Only the panel's loader
 * and the transport callbacks it registers call the mutators; everyone
 * else reads through {@link LoadStateView}. Mutators don't notify on
 * their own, the owner calls {@link #publish()} once a batch of changes
 * is consistent.
 * <p>
 * {@code data} and {@code resultMetaData} are kept the same length so a
 * slot index always addresses both.
 *
 * @since 1.0
 */
public class LoadState implements LoadStateView {
  private static final Logger LOG = LoggerFactory.getLogger(LoadState.class);

  private final List<ArrayNode> data = Lists.newArrayList();
  private final List<ResultMetaData> result_meta_data = Lists.newArrayList();
  private final List<QueryMetadata> queries = Lists.newArrayList();
  private List<Annotation> annotations = Collections.emptyList();
  private boolean loading;
  private int loading_total;
  private int loading_completed;
  private int loading_progress_percentage;
  private boolean is_partial_data;
  private boolean is_operation_cancelled;
  private ErrorDetail error_detail = ErrorDetail.EMPTY;
  private final Set<String> trace_ids = Sets.newLinkedHashSet();
  private boolean cached_data_differs;
  private Long last_triggered_at;

  private final List<LoadStateListener> listeners =
      new CopyOnWriteArrayList<LoadStateListener>();

  /**
   * Empties the results and clears the loading and cancel flags. Used when
   * a panel has nothing to execute.
   */
  public synchronized void reset() {
    clearResults();
    loading = false;
    is_operation_cancelled = false;
    resetProgress();
  }

  /** Drops all rows, envelopes, provenance and annotations. */
  public synchronized void clearResults() {
    data.clear();
    result_meta_data.clear();
    queries.clear();
    annotations = Collections.emptyList();
  }

  public synchronized void setLoading(final boolean loading) {
    this.loading = loading;
  }

  /** Zeroes the progress counters and percentage. */
  public synchronized void resetProgress() {
    loading_total = 0;
    loading_completed = 0;
    loading_progress_percentage = 0;
  }

  /**
   * Sets both counters and recomputes the percentage.
   * @param total The number of steps.
   * @param completed The number finished.
   */
  public synchronized void setProgress(final int total, final int completed) {
    loading_total = total;
    loading_completed = completed;
    loading_progress_percentage = percentage(completed, total);
  }

  /** Marks one more step done and recomputes the percentage. */
  public synchronized void completeStep() {
    loading_completed++;
    loading_progress_percentage = percentage(loading_completed, loading_total);
  }

  public synchronized void setProgressPercentage(final int percentage) {
    loading_progress_percentage = Math.max(0, Math.min(100, percentage));
  }

  public synchronized void setPartialData(final boolean partial) {
    is_partial_data = partial;
  }

  public synchronized void setOperationCancelled(final boolean cancelled) {
    is_operation_cancelled = cancelled;
  }

  public synchronized void setErrorDetail(final ErrorDetail error_detail) {
    this.error_detail = error_detail == null ?
        ErrorDetail.EMPTY : error_detail;
  }

  public synchronized void clearErrorDetail() {
    error_detail = ErrorDetail.EMPTY;
  }

  public synchronized void setCachedDataDiffers(final boolean differs) {
    cached_data_differs = differs;
  }

  public synchronized void setLastTriggeredAt(final long timestamp) {
    last_triggered_at = timestamp;
  }

  /**
   * Tracks an in-flight backend request.
   * @param trace_id The request's trace id.
   */
  public synchronized void addTraceId(final String trace_id) {
    trace_ids.add(trace_id);
  }

  /**
   * Stops tracking a request that settled.
   * @param trace_id The trace id, ignored if unknown.
   */
  public synchronized void removeTraceId(final String trace_id) {
    trace_ids.remove(trace_id);
  }

  public synchronized void clearTraceIds() {
    trace_ids.clear();
  }

  /**
   * Grows the slot lists so the index is addressable, filling with empty
   * rows and envelopes.
   * @param slot The slot index, zero or greater.
   */
  public synchronized void ensureSlot(final int slot) {
    if (slot < 0) {
      throw new IllegalArgumentException("Slot cannot be negative: " + slot);
    }
    while (data.size() <= slot) {
      data.add(JSON.getMapper().createArrayNode());
    }
    while (result_meta_data.size() <= slot) {
      result_meta_data.add(new ResultMetaData());
    }
  }

  /**
   * The live rows of a slot, created if missing. Mutations through the
   * returned node are mutations of this state.
   * @param slot The slot index.
   * @return The non-null rows.
   */
  public synchronized ArrayNode dataAt(final int slot) {
    ensureSlot(slot);
    return data.get(slot);
  }

  public synchronized void setData(final int slot, final ArrayNode rows) {
    ensureSlot(slot);
    data.set(slot, rows == null ? JSON.getMapper().createArrayNode() : rows);
  }

  /**
   * Replaces every slot at once, resizing the envelopes to match.
   * @param rows The rows per slot, nulls become empty arrays.
   */
  public synchronized void replaceData(final List<ArrayNode> rows) {
    data.clear();
    result_meta_data.clear();
    if (rows != null) {
      for (final ArrayNode slot : rows) {
        data.add(slot == null ? JSON.getMapper().createArrayNode() : slot);
        result_meta_data.add(new ResultMetaData());
      }
    }
  }

  /**
   * The live envelope of a slot, created if missing.
   * @param slot The slot index.
   * @return The non-null envelope.
   */
  public synchronized ResultMetaData resultMetaDataAt(final int slot) {
    ensureSlot(slot);
    return result_meta_data.get(slot);
  }

  public synchronized void setResultMetaData(final int slot,
                                             final ResultMetaData meta) {
    ensureSlot(slot);
    result_meta_data.set(slot, meta == null ? new ResultMetaData() : meta);
  }

  /**
   * Records the provenance of a slot. Slots are filled in order so the
   * index may be at most the current count.
   * @param slot The slot index.
   * @param metadata The provenance.
   * @throws IllegalArgumentException if the index would leave a gap.
   */
  public synchronized void setQueryMetadata(final int slot,
                                            final QueryMetadata metadata) {
    if (slot < 0 || slot > queries.size()) {
      throw new IllegalArgumentException("Query metadata slot " + slot
          + " out of range, have " + queries.size());
    }
    if (slot == queries.size()) {
      queries.add(metadata);
    } else {
      queries.set(slot, metadata);
    }
  }

  /**
   * Replaces every provenance entry at once.
   * @param metadata The entries, may be null to clear.
   */
  public synchronized void replaceQueryMetadata(
      final List<QueryMetadata> metadata) {
    queries.clear();
    if (metadata != null) {
      queries.addAll(metadata);
    }
  }

  public synchronized void setAnnotations(final List<Annotation> annotations) {
    this.annotations = annotations == null ?
        Collections.<Annotation>emptyList() :
          ImmutableList.copyOf(annotations);
  }

  /** @return The number of addressable slots. */
  public synchronized int slots() {
    return data.size();
  }

  @Override
  public synchronized List<ArrayNode> getData() {
    return LoadStateSnapshot.copyData(data);
  }

  @Override
  public synchronized List<ResultMetaData> getResultMetaData() {
    return LoadStateSnapshot.copyMeta(result_meta_data);
  }

  @Override
  public synchronized List<QueryMetadata> getQueries() {
    return Collections.unmodifiableList(Lists.newArrayList(queries));
  }

  @Override
  public synchronized List<Annotation> getAnnotations() {
    return annotations;
  }

  @Override
  public synchronized boolean isLoading() {
    return loading;
  }

  @Override
  public synchronized int getLoadingTotal() {
    return loading_total;
  }

  @Override
  public synchronized int getLoadingCompleted() {
    return loading_completed;
  }

  @Override
  public synchronized int getLoadingProgressPercentage() {
    return loading_progress_percentage;
  }

  @Override
  public synchronized boolean isPartialData() {
    return is_partial_data;
  }

  @Override
  public synchronized boolean isOperationCancelled() {
    return is_operation_cancelled;
  }

  @Override
  public synchronized ErrorDetail getErrorDetail() {
    return error_detail;
  }

  @Override
  public synchronized Set<String> getSearchRequestTraceIds() {
    return ImmutableSet.copyOf(trace_ids);
  }

  @Override
  public synchronized boolean isCachedDataDifferWithCurrentTimeRange() {
    return cached_data_differs;
  }

  @Override
  public synchronized Long getLastTriggeredAt() {
    return last_triggered_at;
  }

  @Override
  public synchronized LoadStateSnapshot snapshot() {
    return LoadStateSnapshot.newBuilder()
        .setData(data)
        .setResultMetaData(result_meta_data)
        .setQueries(queries)
        .setAnnotations(annotations)
        .setLoading(loading)
        .setLoadingTotal(loading_total)
        .setLoadingCompleted(loading_completed)
        .setLoadingProgressPercentage(loading_progress_percentage)
        .setPartialData(is_partial_data)
        .setOperationCancelled(is_operation_cancelled)
        .setErrorDetail(error_detail)
        .setSearchRequestTraceIds(trace_ids)
        .setCachedDataDifferWithCurrentTimeRange(cached_data_differs)
        .setLastTriggeredAt(last_triggered_at)
        .build();
  }

  /**
   * Copies everything but the in-flight trace ids from the snapshot into
   * this state. Trace ids belong to requests of the process that took the
   * snapshot and can't be cancelled from here.
   * @param snapshot A non-null snapshot.
   */
  public synchronized void restore(final LoadStateSnapshot snapshot) {
    if (snapshot == null) {
      throw new IllegalArgumentException("Snapshot cannot be null.");
    }
    data.clear();
    data.addAll(snapshot.getData());
    result_meta_data.clear();
    result_meta_data.addAll(snapshot.getResultMetaData());
    while (result_meta_data.size() < data.size()) {
      result_meta_data.add(new ResultMetaData());
    }
    queries.clear();
    queries.addAll(snapshot.getQueries());
    annotations = snapshot.getAnnotations();
    loading = snapshot.isLoading();
    loading_total = snapshot.getLoadingTotal();
    loading_completed = snapshot.getLoadingCompleted();
    loading_progress_percentage = snapshot.getLoadingProgressPercentage();
    is_partial_data = snapshot.isPartialData();
    is_operation_cancelled = snapshot.isOperationCancelled();
    error_detail = snapshot.getErrorDetail();
    cached_data_differs = snapshot.isCachedDataDifferWithCurrentTimeRange();
    last_triggered_at = snapshot.getLastTriggeredAt();
  }

  /**
   * Sends a snapshot to every listener. A throwing listener is logged and
   * doesn't stop the others.
   */
  public void publish() {
    if (listeners.isEmpty()) {
      return;
    }
    final LoadStateSnapshot snapshot = snapshot();
    for (final LoadStateListener listener : listeners) {
      try {
        listener.onStateChanged(snapshot);
      } catch (Throwable t) {
        LOG.error("Failed to notify state listener: " + listener, t);
      }
    }
  }

  @Override
  public void subscribe(final LoadStateListener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("Listener cannot be null.");
    }
    listeners.add(listener);
  }

  @Override
  public void unsubscribe(final LoadStateListener listener) {
    listeners.remove(listener);
  }

  @Override
  public synchronized String toString() {
    return snapshot().toString();
  }

  private static int percentage(final int completed, final int total) {
    if (total <= 0) {
      return 0;
    }
    return (int) Math.min(100, Math.round((double) completed / total * 100));
  }
}
