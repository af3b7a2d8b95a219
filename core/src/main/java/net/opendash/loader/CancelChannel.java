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
package net.opendash.loader;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The out of band "cancel current query" signal of a dashboard. Every
 * panel loader of the dashboard listens on the same channel and stops
 * its running cycle when a cancel is requested.
 *
 * @since 1.0
 */
public class CancelChannel {
  private static final Logger LOG = LoggerFactory.getLogger(
      CancelChannel.class);

  /** Notified when a cancel is requested. */
  public interface CancelListener {
    public void onCancelRequested();
  }

  private final List<CancelListener> listeners =
      new CopyOnWriteArrayList<CancelListener>();

  /**
   * @param listener A non-null listener to add.
   */
  public void subscribe(final CancelListener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("Listener cannot be null.");
    }
    listeners.add(listener);
  }

  /**
   * @param listener The listener to remove.
   */
  public void unsubscribe(final CancelListener listener) {
    listeners.remove(listener);
  }

  /** Asks every listener to cancel. A throwing listener is logged. */
  public void requestCancel() {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Cancel requested for " + listeners.size() + " panels");
    }
    for (final CancelListener listener : listeners) {
      try {
        listener.onCancelRequested();
      } catch (Throwable t) {
        LOG.error("Failed to cancel via listener: " + listener, t);
      }
    }
  }

  /** @return The number of listeners. */
  public int listeners() {
    return listeners.size();
  }
}
