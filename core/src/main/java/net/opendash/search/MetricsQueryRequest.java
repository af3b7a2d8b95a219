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

import com.google.common.base.Strings;

/**
 * A PromQL range query.
 *
 * @since 1.0
 */
public class MetricsQueryRequest {
  private final String query;
  private final long start_time;
  private final long end_time;
  private final String step;
  private final String org_id;
  private final String trace_id;

  protected MetricsQueryRequest(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.query)) {
      throw new IllegalArgumentException("Query cannot be null or empty.");
    }
    query = builder.query;
    start_time = builder.start_time;
    end_time = builder.end_time;
    step = Strings.isNullOrEmpty(builder.step) ? "0" : builder.step;
    org_id = builder.org_id;
    trace_id = builder.trace_id;
  }

  public String getQuery() {
    return query;
  }

  /** @return The start in microseconds. */
  public long getStartTime() {
    return start_time;
  }

  /** @return The end in microseconds. */
  public long getEndTime() {
    return end_time;
  }

  /** @return The step, "0" to let the back end pick. */
  public String getStep() {
    return step;
  }

  public String getOrgId() {
    return org_id;
  }

  public String getTraceId() {
    return trace_id;
  }

  @Override
  public String toString() {
    return "query=" + query + ", startTime=" + start_time + ", endTime="
        + end_time + ", step=" + step;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private String query;
    private long start_time;
    private long end_time;
    private String step;
    private String org_id;
    private String trace_id;

    public Builder setQuery(final String query) {
      this.query = query;
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

    public Builder setStep(final String step) {
      this.step = step;
      return this;
    }

    public Builder setOrgId(final String org_id) {
      this.org_id = org_id;
      return this;
    }

    public Builder setTraceId(final String trace_id) {
      this.trace_id = trace_id;
      return this;
    }

    public MetricsQueryRequest build() {
      return new MetricsQueryRequest(this);
    }
  }
}
