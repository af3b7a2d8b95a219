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

import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Objects;
import com.google.common.collect.Maps;

import net.opendash.utils.JSON;

/**
 * The response envelope of one query slot: ordering, partial flag, cache
 * ratio, function errors and continuation cursors. Fields the back end
 * adds that aren't modelled here are kept in {@link #getOther()} so the
 * envelope survives a cache round trip intact.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(value = { "hits" }, ignoreUnknown = true)
public class ResultMetaData {
  private String order_by;
  private Boolean is_partial;
  private String function_error;
  private Double result_cache_ratio;
  private Boolean streaming_aggs;
  private Long new_start_time;
  private Long new_end_time;
  private Long histogram_interval;
  private Long took;
  private Long total;
  private Long scan_size;
  private final Map<String, JsonNode> other = Maps.newTreeMap();

  /**
   * Builds an envelope from a JSON object, ignoring any hits.
   * @param node A JSON object, null returns an empty envelope.
   * @return A non-null envelope.
   * @throws IllegalArgumentException if the node could not be mapped.
   */
  public static ResultMetaData fromNode(final JsonNode node) {
    if (node == null || !node.isObject()) {
      return new ResultMetaData();
    }
    try {
      return JSON.getMapper().treeToValue(node, ResultMetaData.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to parse result metadata: "
          + node, e);
    }
  }

  /**
   * Merges the fields of the given objects, later objects winning, then
   * builds an envelope.
   * @param nodes JSON objects, nulls are skipped.
   * @return A non-null envelope.
   */
  public static ResultMetaData merge(final JsonNode... nodes) {
    final ObjectNode merged = JSON.getMapper().createObjectNode();
    for (final JsonNode node : nodes) {
      if (node == null || !node.isObject()) {
        continue;
      }
      final Iterator<Entry<String, JsonNode>> it = node.fields();
      while (it.hasNext()) {
        final Entry<String, JsonNode> field = it.next();
        merged.set(field.getKey(), field.getValue());
      }
    }
    return fromNode(merged);
  }

  /** @return A deep copy through the JSON tree. */
  public ResultMetaData copy() {
    return fromNode(toNode());
  }

  /** @return The envelope as a JSON object. */
  public JsonNode toNode() {
    return JSON.toNode(this);
  }

  @JsonProperty("order_by")
  public String getOrderBy() {
    return order_by;
  }

  @JsonProperty("order_by")
  public void setOrderBy(final String order_by) {
    this.order_by = order_by;
  }

  @JsonProperty("is_partial")
  public Boolean getIsPartial() {
    return is_partial;
  }

  @JsonProperty("is_partial")
  public void setIsPartial(final Boolean is_partial) {
    this.is_partial = is_partial;
  }

  /** @return True only if the partial flag is present and true. */
  @JsonIgnore
  public boolean isPartial() {
    return is_partial != null && is_partial;
  }

  @JsonProperty("function_error")
  public String getFunctionError() {
    return function_error;
  }

  @JsonProperty("function_error")
  public void setFunctionError(final String function_error) {
    this.function_error = function_error;
  }

  /** @return The share of the range served from the result cache, 0 to
   * 100, may be null. */
  @JsonProperty("result_cache_ratio")
  public Double getResultCacheRatio() {
    return result_cache_ratio;
  }

  @JsonProperty("result_cache_ratio")
  public void setResultCacheRatio(final Double result_cache_ratio) {
    this.result_cache_ratio = result_cache_ratio;
  }

  @JsonProperty("streaming_aggs")
  public Boolean getStreamingAggs() {
    return streaming_aggs;
  }

  @JsonProperty("streaming_aggs")
  public void setStreamingAggs(final Boolean streaming_aggs) {
    this.streaming_aggs = streaming_aggs;
  }

  /** @return True only if the streaming aggregation flag is set. */
  @JsonIgnore
  public boolean isStreamingAggs() {
    return streaming_aggs != null && streaming_aggs;
  }

  @JsonProperty("new_start_time")
  public Long getNewStartTime() {
    return new_start_time;
  }

  @JsonProperty("new_start_time")
  public void setNewStartTime(final Long new_start_time) {
    this.new_start_time = new_start_time;
  }

  @JsonProperty("new_end_time")
  public Long getNewEndTime() {
    return new_end_time;
  }

  @JsonProperty("new_end_time")
  public void setNewEndTime(final Long new_end_time) {
    this.new_end_time = new_end_time;
  }

  @JsonProperty("histogram_interval")
  public Long getHistogramInterval() {
    return histogram_interval;
  }

  @JsonProperty("histogram_interval")
  public void setHistogramInterval(final Long histogram_interval) {
    this.histogram_interval = histogram_interval;
  }

  @JsonProperty("took")
  public Long getTook() {
    return took;
  }

  @JsonProperty("took")
  public void setTook(final Long took) {
    this.took = took;
  }

  @JsonProperty("total")
  public Long getTotal() {
    return total;
  }

  @JsonProperty("total")
  public void setTotal(final Long total) {
    this.total = total;
  }

  @JsonProperty("scan_size")
  public Long getScanSize() {
    return scan_size;
  }

  @JsonProperty("scan_size")
  public void setScanSize(final Long scan_size) {
    this.scan_size = scan_size;
  }

  /** @return Fields not modelled explicitly. */
  @JsonAnyGetter
  public Map<String, JsonNode> getOther() {
    return other;
  }

  @JsonAnySetter
  public void setOther(final String key, final JsonNode value) {
    other.put(key, value);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ResultMetaData meta = (ResultMetaData) o;
    return Objects.equal(order_by, meta.order_by)
        && Objects.equal(is_partial, meta.is_partial)
        && Objects.equal(function_error, meta.function_error)
        && Objects.equal(result_cache_ratio, meta.result_cache_ratio)
        && Objects.equal(streaming_aggs, meta.streaming_aggs)
        && Objects.equal(new_start_time, meta.new_start_time)
        && Objects.equal(new_end_time, meta.new_end_time)
        && Objects.equal(histogram_interval, meta.histogram_interval)
        && Objects.equal(took, meta.took)
        && Objects.equal(total, meta.total)
        && Objects.equal(scan_size, meta.scan_size)
        && Objects.equal(other, meta.other);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(order_by, is_partial, function_error,
        result_cache_ratio, streaming_aggs, new_start_time, new_end_time);
  }

  @Override
  public String toString() {
    return toNode().toString();
  }
}
