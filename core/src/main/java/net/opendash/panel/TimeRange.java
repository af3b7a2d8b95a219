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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;

import net.opendash.core.Const;

/**
 * An absolute time range with both ends in epoch microseconds, the unit
 * the search back end plans partitions in. The end is exclusive.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = TimeRange.Builder.class)
public class TimeRange {
  /** The start in epoch microseconds. */
  private final long start_time;

  /** The end in epoch microseconds. */
  private final long end_time;

  protected TimeRange(final Builder builder) {
    if (builder.endTime < builder.startTime) {
      throw new IllegalArgumentException("End time " + builder.endTime
          + " cannot be before the start time " + builder.startTime);
    }
    start_time = builder.startTime;
    end_time = builder.endTime;
  }

  /**
   * Shortcut for the builder.
   * @param start_time The start in epoch microseconds.
   * @param end_time The end in epoch microseconds.
   * @return A time range.
   * @throws IllegalArgumentException if end was before start.
   */
  public static TimeRange of(final long start_time, final long end_time) {
    return newBuilder()
        .setStartTime(start_time)
        .setEndTime(end_time)
        .build();
  }

  /** @return The start in epoch microseconds. */
  public long getStartTime() {
    return start_time;
  }

  /** @return The end in epoch microseconds. */
  public long getEndTime() {
    return end_time;
  }

  /** @return The width of the range in microseconds. */
  @JsonIgnore
  public long duration() {
    return end_time - start_time;
  }

  /**
   * Moves both ends of the range back by the given number of seconds.
   * @param seconds The offset, zero returns this range.
   * @return A shifted range.
   */
  public TimeRange shiftBack(final long seconds) {
    if (seconds == 0) {
      return this;
    }
    final long delta = seconds * Const.MICROS_PER_SECOND;
    return of(start_time - delta, end_time - delta);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return start_time == other.start_time && end_time == other.end_time;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(start_time, end_time);
  }

  @Override
  public String toString() {
    return "[" + start_time + ", " + end_time + ")";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private long startTime;
    @JsonProperty
    private long endTime;

    public Builder setStartTime(final long start_time) {
      startTime = start_time;
      return this;
    }

    public Builder setEndTime(final long end_time) {
      endTime = end_time;
      return this;
    }

    public TimeRange build() {
      return new TimeRange(this);
    }
  }
}
