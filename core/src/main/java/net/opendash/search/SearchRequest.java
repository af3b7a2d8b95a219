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

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;

/**
 * A SQL search against the back end, used for partition planning and
 * for each partition's search. The body fields serialize to the search
 * API's query object, the routing fields (org, stream type, trace id and
 * so on) are carried alongside and aren't serialized.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
public class SearchRequest {
  public static final String SQL_MODE = "full";
  public static final String DEFAULT_SEARCH_TYPE = "dashboards";

  private final String sql;
  private final String query_fn;
  private final long start_time;
  private final long end_time;
  private final Long histogram_interval;
  private final boolean streaming_output;
  private final String streaming_id;

  private final String org_id;
  private final String stream_type;
  private final String search_type;
  private final String trace_id;
  private final String dashboard_id;
  private final String folder_id;

  protected SearchRequest(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.sql)) {
      throw new IllegalArgumentException("SQL cannot be null or empty.");
    }
    if (builder.end_time < builder.start_time) {
      throw new IllegalArgumentException("End time " + builder.end_time
          + " cannot be before the start time " + builder.start_time);
    }
    sql = builder.sql;
    query_fn = builder.encoded_function != null ?
        builder.encoded_function : encodeFunction(builder.vrl_function);
    start_time = builder.start_time;
    end_time = builder.end_time;
    histogram_interval = builder.histogram_interval;
    streaming_output = builder.streaming_output;
    streaming_id = builder.streaming_id;
    org_id = builder.org_id;
    stream_type = builder.stream_type;
    search_type = Strings.isNullOrEmpty(builder.search_type) ?
        DEFAULT_SEARCH_TYPE : builder.search_type;
    trace_id = builder.trace_id;
    dashboard_id = builder.dashboard_id;
    folder_id = builder.folder_id;
  }

  /**
   * The post-processing function travels url-safe base64 encoded.
   * @param function The raw function, may be null.
   * @return The encoded function or null if there wasn't one.
   */
  static String encodeFunction(final String function) {
    if (Strings.isNullOrEmpty(function) || function.trim().isEmpty()) {
      return null;
    }
    return BaseEncoding.base64Url().encode(
        function.trim().getBytes(StandardCharsets.UTF_8));
  }

  @JsonProperty("sql")
  public String getSql() {
    return sql;
  }

  @JsonProperty("query_fn")
  public String getQueryFn() {
    return query_fn;
  }

  @JsonProperty("sql_mode")
  public String getSqlMode() {
    return SQL_MODE;
  }

  @JsonProperty("start_time")
  public long getStartTime() {
    return start_time;
  }

  @JsonProperty("end_time")
  public long getEndTime() {
    return end_time;
  }

  /** @return Always -1, the search returns everything in range. */
  @JsonProperty("size")
  public int getSize() {
    return -1;
  }

  @JsonProperty("histogram_interval")
  public Long getHistogramInterval() {
    return histogram_interval;
  }

  @JsonProperty("streaming_output")
  public boolean isStreamingOutput() {
    return streaming_output;
  }

  @JsonProperty("streaming_id")
  public String getStreamingId() {
    return streaming_id;
  }

  @JsonIgnore
  public String getOrgId() {
    return org_id;
  }

  @JsonIgnore
  public String getStreamType() {
    return stream_type;
  }

  @JsonIgnore
  public String getSearchType() {
    return search_type;
  }

  @JsonIgnore
  public String getTraceId() {
    return trace_id;
  }

  @JsonIgnore
  public String getDashboardId() {
    return dashboard_id;
  }

  @JsonIgnore
  public String getFolderId() {
    return folder_id;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("sql=")
        .append(sql)
        .append(", startTime=")
        .append(start_time)
        .append(", endTime=")
        .append(end_time)
        .append(", traceId=")
        .append(trace_id)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * @param request A request to copy.
   * @return A builder with every field of the request, the function
   * excepted as only its encoded form is kept.
   */
  public static Builder newBuilder(final SearchRequest request) {
    final Builder builder = new Builder()
        .setSql(request.sql)
        .setStartTime(request.start_time)
        .setEndTime(request.end_time)
        .setHistogramInterval(request.histogram_interval)
        .setStreamingOutput(request.streaming_output)
        .setStreamingId(request.streaming_id)
        .setOrgId(request.org_id)
        .setStreamType(request.stream_type)
        .setSearchType(request.search_type)
        .setTraceId(request.trace_id)
        .setDashboardId(request.dashboard_id)
        .setFolderId(request.folder_id);
    builder.encoded_function = request.query_fn;
    return builder;
  }

  public static final class Builder {
    private String sql;
    private String vrl_function;
    private String encoded_function;
    private long start_time;
    private long end_time;
    private Long histogram_interval;
    private boolean streaming_output;
    private String streaming_id;
    private String org_id;
    private String stream_type;
    private String search_type;
    private String trace_id;
    private String dashboard_id;
    private String folder_id;

    public Builder setSql(final String sql) {
      this.sql = sql;
      return this;
    }

    public Builder setVrlFunction(final String vrl_function) {
      this.vrl_function = vrl_function;
      encoded_function = null;
      return this;
    }

    public Builder setStartTime(final long start_time) {
      this.start_time = start_time;
      return this;
    }

    public Builder setEndTime(final long end_time) {
      this.end_time = end_time;
      return this;
    }

    public Builder setHistogramInterval(final Long histogram_interval) {
      this.histogram_interval = histogram_interval;
      return this;
    }

    public Builder setStreamingOutput(final boolean streaming_output) {
      this.streaming_output = streaming_output;
      return this;
    }

    public Builder setStreamingId(final String streaming_id) {
      this.streaming_id = streaming_id;
      return this;
    }

    public Builder setOrgId(final String org_id) {
      this.org_id = org_id;
      return this;
    }

    public Builder setStreamType(final String stream_type) {
      this.stream_type = stream_type;
      return this;
    }

    public Builder setSearchType(final String search_type) {
      this.search_type = search_type;
      return this;
    }

    public Builder setTraceId(final String trace_id) {
      this.trace_id = trace_id;
      return this;
    }

    public Builder setDashboardId(final String dashboard_id) {
      this.dashboard_id = dashboard_id;
      return this;
    }

    public Builder setFolderId(final String folder_id) {
      this.folder_id = folder_id;
      return this;
    }

    public SearchRequest build() {
      return new SearchRequest(this);
    }
  }
}
