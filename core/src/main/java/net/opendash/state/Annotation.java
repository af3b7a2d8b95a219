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

/**
 * An annotation event drawn over time series panels.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = Annotation.Builder.class)
public class Annotation {
  private final String id;
  private final long start_time;
  private final long end_time;
  private final String title;
  private final String text;
  private final List<String> tags;

  protected Annotation(final Builder builder) {
    id = builder.id;
    start_time = builder.startTime;
    end_time = builder.endTime;
    title = builder.title;
    text = builder.text;
    tags = builder.tags == null ? Collections.<String>emptyList() :
      ImmutableList.copyOf(builder.tags);
  }

  public String getId() {
    return id;
  }

  public long getStartTime() {
    return start_time;
  }

  public long getEndTime() {
    return end_time;
  }

  public String getTitle() {
    return title;
  }

  public String getText() {
    return text;
  }

  public List<String> getTags() {
    return tags;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Annotation other = (Annotation) o;
    return Objects.equal(id, other.id)
        && start_time == other.start_time
        && end_time == other.end_time
        && Objects.equal(title, other.title)
        && Objects.equal(text, other.text)
        && Objects.equal(tags, other.tags);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, start_time, end_time, title, text, tags);
  }

  @Override
  public String toString() {
    return "id=" + id + ", startTime=" + start_time + ", endTime="
        + end_time + ", title=" + title;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String id;
    @JsonProperty
    private long startTime;
    @JsonProperty
    private long endTime;
    @JsonProperty
    private String title;
    @JsonProperty
    private String text;
    @JsonProperty
    private List<String> tags;

    public Builder setId(final String id) {
      this.id = id;
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

    public Builder setTitle(final String title) {
      this.title = title;
      return this;
    }

    public Builder setText(final String text) {
      this.text = text;
      return this;
    }

    public Builder setTags(final List<String> tags) {
      this.tags = tags;
      return this;
    }

    public Annotation build() {
      return new Annotation(this);
    }
  }
}
