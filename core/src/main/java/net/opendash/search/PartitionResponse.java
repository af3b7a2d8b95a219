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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.collect.Lists;

/**
 * The back end's plan for a search: the sub-ranges to query, the order
 * rows come back in and the knobs that apply to every sub-range search.
 * Partitions are always held sorted by start time, oldest first.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = PartitionResponse.Builder.class)
public class PartitionResponse {
  private final List<long[]> partitions;
  private final String order_by;
  private final Long histogram_interval;
  private final long max_query_range;
  private final boolean streaming_aggs;
  private final String streaming_id;

  protected PartitionResponse(final Builder builder) {
    final List<long[]> sorted = Lists.newArrayList();
    if (builder.partitions != null) {
      for (final long[] partition : builder.partitions) {
        if (partition == null || partition.length < 2) {
          throw new IllegalArgumentException("Partitions must have a start "
              + "and an end.");
        }
        sorted.add(partition);
      }
    }
    Collections.sort(sorted, (a, b) -> Long.compare(a[0], b[0]));
    partitions = Collections.unmodifiableList(sorted);
    order_by = builder.orderBy == null ? "asc" : builder.orderBy;
    histogram_interval = builder.histogramInterval;
    max_query_range = builder.maxQueryRange;
    streaming_aggs = builder.streamingAggs;
    streaming_id = builder.streamingId;
  }

  /** @return The [start, end] sub-ranges in microseconds, oldest first. */
  public List<long[]> getPartitions() {
    return partitions;
  }

  /** @return "asc" or "desc", defaults to "asc". */
  public String getOrderBy() {
    return order_by;
  }

  public Long getHistogramInterval() {
    return histogram_interval;
  }

  /** @return The range budget in hours, 0 for none. */
  public long getMaxQueryRange() {
    return max_query_range;
  }

  public boolean isStreamingAggs() {
    return streaming_aggs;
  }

  public String getStreamingId() {
    return streaming_id;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("partitions=")
        .append(partitions.size())
        .append(", orderBy=")
        .append(order_by)
        .append(", maxQueryRange=")
        .append(max_query_range)
        .append(", streamingAggs=")
        .append(streaming_aggs)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private List<long[]> partitions;
    @JsonProperty("order_by")
    private String orderBy;
    @JsonProperty("histogram_interval")
    private Long histogramInterval;
    @JsonProperty("max_query_range")
    private long maxQueryRange;
    @JsonProperty("streaming_aggs")
    private boolean streamingAggs;
    @JsonProperty("streaming_id")
    private String streamingId;

    public Builder setPartitions(final List<long[]> partitions) {
      this.partitions = partitions;
      return this;
    }

    public Builder addPartition(final long start, final long end) {
      if (partitions == null) {
        partitions = Lists.newArrayList();
      }
      partitions.add(new long[] { start, end });
      return this;
    }

    public Builder setOrderBy(final String order_by) {
      orderBy = order_by;
      return this;
    }

    public Builder setHistogramInterval(final Long histogram_interval) {
      histogramInterval = histogram_interval;
      return this;
    }

    public Builder setMaxQueryRange(final long max_query_range) {
      maxQueryRange = max_query_range;
      return this;
    }

    public Builder setStreamingAggs(final boolean streaming_aggs) {
      streamingAggs = streaming_aggs;
      return this;
    }

    public Builder setStreamingId(final String streaming_id) {
      streamingId = streaming_id;
      return this;
    }

    public PartitionResponse build() {
      return new PartitionResponse(this);
    }
  }
}
