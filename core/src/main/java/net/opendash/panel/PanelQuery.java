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
package net.opendash.panel;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * One query of a panel: the raw text with variable placeholders, an
 * optional post-processing function, the stream type it reads and the
 * time shift offsets to run alongside the requested range.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = PanelQuery.Builder.class)
public class PanelQuery {
  /** The raw query text. */
  private final String query;

  /** An optional post-processing function. */
  private final String vrl_function_query;

  /** The stream type, e.g. "logs". */
  private final String stream_type;

  /** Offsets like "1d" or "1M", empty when not shifted. */
  private final List<String> time_shift;

  protected PanelQuery(final Builder builder) {
    query = builder.query;
    vrl_function_query = builder.vrlFunctionQuery;
    stream_type = builder.streamType;
    time_shift = builder.timeShift == null ?
        Collections.<String>emptyList() :
          ImmutableList.copyOf(builder.timeShift);
  }

  /** @return The raw query text, may be null. */
  public String getQuery() {
    return query;
  }

  /** @return The post-processing function, may be null. */
  public String getVrlFunctionQuery() {
    return vrl_function_query;
  }

  /** @return The stream type, may be null. */
  public String getStreamType() {
    return stream_type;
  }

  /** @return The time shift offsets, never null. */
  public List<String> getTimeShift() {
    return time_shift;
  }

  /** @return Whether or not there's any non-blank query text. */
  @JsonIgnore
  public boolean isExecutable() {
    return !Strings.isNullOrEmpty(query) && !query.trim().isEmpty();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final PanelQuery other = (PanelQuery) o;
    return Objects.equal(query, other.query)
        && Objects.equal(vrl_function_query, other.vrl_function_query)
        && Objects.equal(stream_type, other.stream_type)
        && Objects.equal(time_shift, other.time_shift);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(query, vrl_function_query, stream_type,
        time_shift);
  }

  @Override
  public String toString() {
    return "query=" + query + ", streamType=" + stream_type
        + ", timeShift=" + time_shift;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String query;
    @JsonProperty
    private String vrlFunctionQuery;
    @JsonProperty
    private String streamType;
    @JsonProperty
    private List<String> timeShift;

    public Builder setQuery(final String query) {
      this.query = query;
      return this;
    }

    public Builder setVrlFunctionQuery(final String vrl_function_query) {
      vrlFunctionQuery = vrl_function_query;
      return this;
    }

    public Builder setStreamType(final String stream_type) {
      streamType = stream_type;
      return this;
    }

    public Builder setTimeShift(final List<String> time_shift) {
      timeShift = time_shift;
      return this;
    }

    public PanelQuery build() {
      return new PanelQuery(this);
    }
  }
}
