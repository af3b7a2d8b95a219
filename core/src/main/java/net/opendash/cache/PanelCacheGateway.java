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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.opendash.panel.PanelIdentity;
import net.opendash.panel.TimeRange;
import net.opendash.state.LoadState;

/**
 * Saves and restores one panel's {@link LoadState} through a
 * {@link PanelCacheStore}. A cached state is applied only when it was
 * saved under an equal fingerprint. A difference in the requested range's
 * duration doesn't block the restore, it only raises the staleness flag.
 *
 * @since 1.0
 */
public class PanelCacheGateway {
  private static final Logger LOG = LoggerFactory.getLogger(
      PanelCacheGateway.class);

  private final PanelCacheStore store;
  private final PanelIdentity identity;

  /**
   * Default ctor.
   * @param store A non-null store.
   * @param identity The non-null identity of the panel.
   */
  public PanelCacheGateway(final PanelCacheStore store,
                           final PanelIdentity identity) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (identity == null) {
      throw new IllegalArgumentException("Identity cannot be null.");
    }
    this.store = store;
    this.identity = identity;
  }

  /**
   * Attempts to restore the state saved for the panel.
   * @param state The state to overwrite on a hit.
   * @param fingerprint The fingerprint of the current request.
   * @param range The currently requested range.
   * @return A deferred resolving to true if the state was restored, false
   * on a miss, a mismatch or a store failure.
   */
  public Deferred<Boolean> restore(final LoadState state,
                                   final CacheFingerprint fingerprint,
                                   final TimeRange range) {
    class RestoreCB implements Callback<Boolean, PanelCacheEntry> {
      @Override
      public Boolean call(final PanelCacheEntry entry) throws Exception {
        if (entry == null || entry.getValue() == null) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("No cached state for panel " + identity);
          }
          return false;
        }
        if (!fingerprint.equals(entry.getKey())) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Cached state for panel " + identity + " was saved "
                + "under " + entry.getKey() + ", current is " + fingerprint);
          }
          return false;
        }
        state.restore(entry.getValue());
        final TimeRange cached = entry.getCacheTimeRange();
        state.setCachedDataDiffers(cached == null || range == null ||
            cached.duration() != range.duration());
        if (LOG.isDebugEnabled()) {
          LOG.debug("Restored panel " + identity + " from cache");
        }
        return true;
      }
    }

    class ErrorCB implements Callback<Boolean, Exception> {
      @Override
      public Boolean call(final Exception e) throws Exception {
        LOG.warn("Failed to read the cache for panel " + identity, e);
        return false;
      }
    }

    try {
      return store.get(identity).addCallbacks(new RestoreCB(), new ErrorCB());
    } catch (Exception e) {
      LOG.warn("Failed to read the cache for panel " + identity, e);
      return Deferred.fromResult(false);
    }
  }

  /**
   * Persists the current state in the background. Failures are logged.
   * @param state The state to save.
   * @param fingerprint The fingerprint of the current request.
   * @param range The currently requested range.
   */
  public void save(final LoadState state,
                   final CacheFingerprint fingerprint,
                   final TimeRange range) {
    class ErrorCB implements Callback<Object, Exception> {
      @Override
      public Object call(final Exception e) throws Exception {
        LOG.warn("Failed to write the cache for panel " + identity, e);
        return null;
      }
    }

    try {
      store.put(identity, fingerprint, state.snapshot(), range)
          .addErrback(new ErrorCB());
    } catch (Exception e) {
      LOG.warn("Failed to write the cache for panel " + identity, e);
    }
  }

  /** @return The panel identity. */
  public PanelIdentity identity() {
    return identity;
  }
}
