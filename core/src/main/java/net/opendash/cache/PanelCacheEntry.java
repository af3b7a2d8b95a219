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
package net.opendash.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import net.opendash.panel.TimeRange;
import net.opendash.state.LoadStateSnapshot;

/**
 * What a {@link PanelCacheStore} keeps per panel: the fingerprint the
 * state was saved under, the state and the range it was queried for.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = PanelCacheEntry.Builder.class)
public class PanelCacheEntry {
  private final CacheFingerprint key;
  private final LoadStateSnapshot value;
  private final TimeRange cache_time_range;

  protected PanelCacheEntry(final Builder builder) {
    key = builder.key;
    value = builder.value;
    cache_time_range = builder.cacheTimeRange;
  }

  public CacheFingerprint getKey() {
    return key;
  }

  public LoadStateSnapshot getValue() {
    return value;
  }

  public TimeRange getCacheTimeRange() {
    return cache_time_range;
  }

  @Override
  public String toString() {
    return "key=" + key + ", range=" + cache_time_range;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private CacheFingerprint key;
    @JsonProperty
    private LoadStateSnapshot value;
    @JsonProperty
    private TimeRange cacheTimeRange;

    public Builder setKey(final CacheFingerprint key) {
      this.key = key;
      return this;
    }

    public Builder setValue(final LoadStateSnapshot value) {
      this.value = value;
      return this;
    }

    public Builder setCacheTimeRange(final TimeRange cache_time_range) {
      cacheTimeRange = cache_time_range;
      return this;
    }

    public PanelCacheEntry build() {
      return new PanelCacheEntry(this);
    }
  }
}
