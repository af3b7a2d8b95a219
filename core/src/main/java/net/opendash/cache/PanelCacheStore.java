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

import com.stumbleupon.async.Deferred;

import net.opendash.panel.PanelIdentity;
import net.opendash.panel.TimeRange;
import net.opendash.state.LoadStateSnapshot;

/**
 * A key/value store for the last state of each panel. Implementations
 * may expire entries and should return copies so callers can't mutate
 * what's stored.
 *
 * @since 1.0
 */
public interface PanelCacheStore {

  /**
   * Fetches the entry for a panel.
   * @param identity The non-null panel identity.
   * @return A deferred resolving to the entry or null if there isn't one.
   */
  public Deferred<PanelCacheEntry> get(final PanelIdentity identity);

  /**
   * Stores the state of a panel, replacing any previous entry.
   * @param identity The non-null panel identity.
   * @param key The fingerprint the state is valid for.
   * @param value The state.
   * @param range The range that was requested.
   * @return A deferred resolving to null once written or to an exception.
   */
  public Deferred<Object> put(final PanelIdentity identity,
                              final CacheFingerprint key,
                              final LoadStateSnapshot value,
                              final TimeRange range);
}
