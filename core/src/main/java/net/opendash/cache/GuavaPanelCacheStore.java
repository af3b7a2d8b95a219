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

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.stumbleupon.async.Deferred;

import net.opendash.configuration.Configuration;
import net.opendash.panel.PanelIdentity;
import net.opendash.panel.TimeRange;
import net.opendash.state.LoadStateSnapshot;
import net.opendash.utils.JSON;

/**
 * An in-memory {@link PanelCacheStore} on a Guava {@link Cache}, bounded
 * by entry count and expiring entries a fixed time after they were
 * written. Entries are kept as JSON so every read returns a fresh copy.
 *
 * @since 1.0
 */
public class GuavaPanelCacheStore implements PanelCacheStore {
  private static final Logger LOG = LoggerFactory.getLogger(
      GuavaPanelCacheStore.class);

  public static final String TTL_KEY = "dashboard.cache.ttl.ms";
  public static final String MAX_ENTRIES_KEY = "dashboard.cache.max_entries";

  private final Cache<String, String> cache;

  /**
   * Default ctor.
   * @param config A non-null config to register and read settings from.
   */
  public GuavaPanelCacheStore(final Configuration config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (!config.hasProperty(TTL_KEY)) {
      config.register(TTL_KEY, 3600000L, false,
          "How long, in milliseconds, a panel's cached state is kept after "
          + "it was written.");
    }
    if (!config.hasProperty(MAX_ENTRIES_KEY)) {
      config.register(MAX_ENTRIES_KEY, 1024, false,
          "The maximum number of panel states kept in memory.");
    }
    cache = CacheBuilder.newBuilder()
        .maximumSize(config.getInt(MAX_ENTRIES_KEY))
        .expireAfterWrite(config.getLong(TTL_KEY), TimeUnit.MILLISECONDS)
        .build();
  }

  @Override
  public Deferred<PanelCacheEntry> get(final PanelIdentity identity) {
    final String json = cache.getIfPresent(key(identity));
    if (Strings.isNullOrEmpty(json)) {
      return Deferred.fromResult(null);
    }
    try {
      return Deferred.fromResult(
          JSON.parseToObject(json, PanelCacheEntry.class));
    } catch (IllegalArgumentException e) {
      LOG.warn("Dropping unreadable cache entry for panel " + identity, e);
      cache.invalidate(key(identity));
      return Deferred.fromResult(null);
    }
  }

  @Override
  public Deferred<Object> put(final PanelIdentity identity,
                              final CacheFingerprint key,
                              final LoadStateSnapshot value,
                              final TimeRange range) {
    try {
      cache.put(key(identity), JSON.serializeToString(
          PanelCacheEntry.newBuilder()
            .setKey(key)
            .setValue(value)
            .setCacheTimeRange(range)
            .build()));
      return Deferred.fromResult(null);
    } catch (RuntimeException e) {
      return Deferred.fromError(e);
    }
  }

  /** @return The number of entries held. */
  public long size() {
    return cache.size();
  }

  @VisibleForTesting
  static String key(final PanelIdentity identity) {
    return Strings.nullToEmpty(identity.getFolderId()) + "/"
        + Strings.nullToEmpty(identity.getDashboardId()) + "/"
        + identity.getPanelId();
  }
}
