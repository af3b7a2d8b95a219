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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * An immutable, JSON serializable copy of a {@link LoadState}. This is
 * what the panel cache persists and what listeners receive. Rows and
 * envelopes are deep copied in and out so no caller can reach back into
 * the live state.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = LoadStateSnapshot.Builder.class)
public class LoadStateSnapshot {
  private final List<ArrayNode> data;
  private final List<ResultMetaData> result_meta_data;
  private final List<QueryMetadata> queries;
  private final List<Annotation> annotations;
  private final boolean loading;
  private final int loading_total;
  private final int loading_completed;
  private final int loading_progress_percentage;
  private final boolean is_partial_data;
  private final boolean is_operation_cancelled;
  private final ErrorDetail error_detail;
  private final Set<String> search_request_trace_ids;
  private final boolean cached_data_differs;
  private final Long last_triggered_at;

  protected LoadStateSnapshot(final Builder builder) {
    data = copyData(builder.data);
    result_meta_data = copyMeta(builder.resultMetaData);
    queries = builder.queries == null ?
        Collections.<QueryMetadata>emptyList() :
          Collections.unmodifiableList(Lists.newArrayList(builder.queries));
    annotations = builder.annotations == null ?
        Collections.<Annotation>emptyList() :
          ImmutableList.copyOf(builder.annotations);
    loading = builder.loading;
    loading_total = builder.loadingTotal;
    loading_completed = builder.loadingCompleted;
    loading_progress_percentage = builder.loadingProgressPercentage;
    is_partial_data = builder.partialData;
    is_operation_cancelled = builder.operationCancelled;
    error_detail = builder.errorDetail == null ?
        ErrorDetail.EMPTY : builder.errorDetail;
    search_request_trace_ids = builder.searchRequestTraceIds == null ?
        Collections.<String>emptySet() :
          ImmutableSet.copyOf(builder.searchRequestTraceIds);
    cached_data_differs = builder.cachedDataDifferWithCurrentTimeRange;
    last_triggered_at = builder.lastTriggeredAt;
  }

  /** @return A deep copy of the rows per slot. */
  public List<ArrayNode> getData() {
    return copyData(data);
  }

  /** @return Copies of the envelopes per slot. */
  public List<ResultMetaData> getResultMetaData() {
    return copyMeta(result_meta_data);
  }

  public List<QueryMetadata> getQueries() {
    return queries;
  }

  public List<Annotation> getAnnotations() {
    return annotations;
  }

  public boolean isLoading() {
    return loading;
  }

  public int getLoadingTotal() {
    return loading_total;
  }

  public int getLoadingCompleted() {
    return loading_completed;
  }

  public int getLoadingProgressPercentage() {
    return loading_progress_percentage;
  }

  public boolean isPartialData() {
    return is_partial_data;
  }

  public boolean isOperationCancelled() {
    return is_operation_cancelled;
  }

  public ErrorDetail getErrorDetail() {
    return error_detail;
  }

  public Set<String> getSearchRequestTraceIds() {
    return search_request_trace_ids;
  }

  public boolean isCachedDataDifferWithCurrentTimeRange() {
    return cached_data_differs;
  }

  public Long getLastTriggeredAt() {
    return last_triggered_at;
  }

  /** @return True if there are no result slots. */
  public boolean hasNoData() {
    return data.isEmpty();
  }

  static List<ArrayNode> copyData(final List<ArrayNode> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyList();
    }
    final List<ArrayNode> copy = Lists.newArrayListWithCapacity(source.size());
    for (final ArrayNode rows : source) {
      copy.add(rows == null ? null : rows.deepCopy());
    }
    return Collections.unmodifiableList(copy);
  }

  static List<ResultMetaData> copyMeta(final List<ResultMetaData> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyList();
    }
    final List<ResultMetaData> copy =
        Lists.newArrayListWithCapacity(source.size());
    for (final ResultMetaData meta : source) {
      copy.add(meta == null ? null : meta.copy());
    }
    return Collections.unmodifiableList(copy);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final LoadStateSnapshot other = (LoadStateSnapshot) o;
    return Objects.equal(data, other.data)
        && Objects.equal(result_meta_data, other.result_meta_data)
        && Objects.equal(queries, other.queries)
        && Objects.equal(annotations, other.annotations)
        && loading == other.loading
        && loading_total == other.loading_total
        && loading_completed == other.loading_completed
        && loading_progress_percentage == other.loading_progress_percentage
        && is_partial_data == other.is_partial_data
        && is_operation_cancelled == other.is_operation_cancelled
        && Objects.equal(error_detail, other.error_detail)
        && Objects.equal(search_request_trace_ids,
            other.search_request_trace_ids)
        && cached_data_differs == other.cached_data_differs
        && Objects.equal(last_triggered_at, other.last_triggered_at);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(data, result_meta_data, queries, annotations,
        loading, loading_total, loading_completed,
        loading_progress_percentage, is_partial_data, is_operation_cancelled,
        error_detail, search_request_trace_ids, cached_data_differs,
        last_triggered_at);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("slots=")
        .append(data.size())
        .append(", loading=")
        .append(loading)
        .append(", progress=")
        .append(loading_progress_percentage)
        .append(", partial=")
        .append(is_partial_data)
        .append(", cancelled=")
        .append(is_operation_cancelled)
        .append(", error=")
        .append(error_detail)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private List<ArrayNode> data;
    @JsonProperty
    private List<ResultMetaData> resultMetaData;
    @JsonProperty
    private List<QueryMetadata> queries;
    @JsonProperty
    private List<Annotation> annotations;
    @JsonProperty
    private boolean loading;
    @JsonProperty
    private int loadingTotal;
    @JsonProperty
    private int loadingCompleted;
    @JsonProperty
    private int loadingProgressPercentage;
    @JsonProperty
    private boolean partialData;
    @JsonProperty
    private boolean operationCancelled;
    @JsonProperty
    private ErrorDetail errorDetail;
    @JsonProperty
    private Set<String> searchRequestTraceIds;
    @JsonProperty
    private boolean cachedDataDifferWithCurrentTimeRange;
    @JsonProperty
    private Long lastTriggeredAt;

    public Builder setData(final List<ArrayNode> data) {
      this.data = data;
      return this;
    }

    public Builder setResultMetaData(final List<ResultMetaData> meta) {
      resultMetaData = meta;
      return this;
    }

    public Builder setQueries(final List<QueryMetadata> queries) {
      this.queries = queries;
      return this;
    }

    public Builder setAnnotations(final List<Annotation> annotations) {
      this.annotations = annotations;
      return this;
    }

    public Builder setLoading(final boolean loading) {
      this.loading = loading;
      return this;
    }

    public Builder setLoadingTotal(final int loading_total) {
      loadingTotal = loading_total;
      return this;
    }

    public Builder setLoadingCompleted(final int loading_completed) {
      loadingCompleted = loading_completed;
      return this;
    }

    public Builder setLoadingProgressPercentage(final int percentage) {
      loadingProgressPercentage = percentage;
      return this;
    }

    public Builder setPartialData(final boolean partial_data) {
      partialData = partial_data;
      return this;
    }

    public Builder setOperationCancelled(final boolean cancelled) {
      operationCancelled = cancelled;
      return this;
    }

    public Builder setErrorDetail(final ErrorDetail error_detail) {
      errorDetail = error_detail;
      return this;
    }

    public Builder setSearchRequestTraceIds(final Set<String> trace_ids) {
      searchRequestTraceIds = trace_ids;
      return this;
    }

    public Builder setCachedDataDifferWithCurrentTimeRange(
        final boolean differs) {
      cachedDataDifferWithCurrentTimeRange = differs;
      return this;
    }

    public Builder setLastTriggeredAt(final Long last_triggered_at) {
      lastTriggeredAt = last_triggered_at;
      return this;
    }

    public LoadStateSnapshot build() {
      return new LoadStateSnapshot(this);
    }
  }
}
