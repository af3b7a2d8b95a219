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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import net.opendash.transpile.Substitution;

/**
 * Provenance of one executed query slot: the raw and transpiled text,
 * the effective range, the substitutions applied and, for time shifted
 * runs, the offset.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = QueryMetadata.Builder.class)
public class QueryMetadata {
  private final String original_query;
  private final String query;
  private final long start_time;
  private final long end_time;
  private final String query_type;
  private final List<Substitution> variables;
  private final long time_shift_seconds;
  private final String time_shift_period;

  protected QueryMetadata(final Builder builder) {
    original_query = builder.originalQuery;
    query = builder.query;
    start_time = builder.startTime;
    end_time = builder.endTime;
    query_type = builder.queryType;
    variables = builder.variables == null ?
        Collections.<Substitution>emptyList() :
          ImmutableList.copyOf(builder.variables);
    time_shift_seconds = builder.timeShiftSeconds;
    time_shift_period = builder.timeShiftPeriod == null ?
        "" : builder.timeShiftPeriod;
  }

  public String getOriginalQuery() {
    return original_query;
  }

  public String getQuery() {
    return query;
  }

  /** @return The effective start in microseconds. */
  public long getStartTime() {
    return start_time;
  }

  /** @return The effective end in microseconds. */
  public long getEndTime() {
    return end_time;
  }

  public String getQueryType() {
    return query_type;
  }

  /** @return The substitutions applied, never null. */
  public List<Substitution> getVariables() {
    return variables;
  }

  /** @return How far back the range was shifted, 0 for the primary run. */
  public long getTimeShiftSeconds() {
    return time_shift_seconds;
  }

  /** @return The configured offset, e.g. "1d", empty for the primary run. */
  public String getTimeShiftPeriod() {
    return time_shift_period;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final QueryMetadata other = (QueryMetadata) o;
    return Objects.equal(original_query, other.original_query)
        && Objects.equal(query, other.query)
        && start_time == other.start_time
        && end_time == other.end_time
        && Objects.equal(query_type, other.query_type)
        && Objects.equal(variables, other.variables)
        && time_shift_seconds == other.time_shift_seconds
        && Objects.equal(time_shift_period, other.time_shift_period);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(original_query, query, start_time, end_time,
        query_type, variables, time_shift_seconds, time_shift_period);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("query=")
        .append(query)
        .append(", startTime=")
        .append(start_time)
        .append(", endTime=")
        .append(end_time)
        .append(", timeShift=")
        .append(time_shift_period)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String originalQuery;
    @JsonProperty
    private String query;
    @JsonProperty
    private long startTime;
    @JsonProperty
    private long endTime;
    @JsonProperty
    private String queryType;
    @JsonProperty
    private List<Substitution> variables;
    @JsonProperty
    private long timeShiftSeconds;
    @JsonProperty
    private String timeShiftPeriod;

    public Builder setOriginalQuery(final String original_query) {
      originalQuery = original_query;
      return this;
    }

    public Builder setQuery(final String query) {
      this.query = query;
      return this;
    }

    public Builder setStartTime(final long start_time) {
      startTime = start_time;
      return this;
    }

    public Builder setEndTime(final long end_time) {
      endTime = end_time;
      return this;
    }

    public Builder setQueryType(final String query_type) {
      queryType = query_type;
      return this;
    }

    public Builder setVariables(final List<Substitution> variables) {
      this.variables = variables;
      return this;
    }

    public Builder setTimeShiftSeconds(final long time_shift_seconds) {
      timeShiftSeconds = time_shift_seconds;
      return this;
    }

    public Builder setTimeShiftPeriod(final String time_shift_period) {
      timeShiftPeriod = time_shift_period;
      return this;
    }

    public QueryMetadata build() {
      return new QueryMetadata(this);
    }
  }
}
