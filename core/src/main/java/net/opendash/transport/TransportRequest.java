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
package net.opendash.transport;

import net.opendash.panel.PanelQuery;
import net.opendash.panel.TimeRange;

/**
 * One logical query for a transport to run: the final text, the panel
 * query it came from, the effective range and the slot to write to.
 *
 * @since 1.0
 */
public class TransportRequest {
  private final String query;
  private final PanelQuery panel_query;
  private final TimeRange range;
  private final int slot;

  /**
   * Default ctor.
   * @param query The transpiled text.
   * @param panel_query The panel query, for its function and stream type.
   * @param range The effective, possibly shifted, range.
   * @param slot The destination slot.
   */
  public TransportRequest(final String query,
                          final PanelQuery panel_query,
                          final TimeRange range,
                          final int slot) {
    if (range == null) {
      throw new IllegalArgumentException("Range cannot be null.");
    }
    if (slot < 0) {
      throw new IllegalArgumentException("Slot cannot be negative.");
    }
    this.query = query;
    this.panel_query = panel_query;
    this.range = range;
    this.slot = slot;
  }

  public String getQuery() {
    return query;
  }

  public PanelQuery getPanelQuery() {
    return panel_query;
  }

  public TimeRange getRange() {
    return range;
  }

  public int getSlot() {
    return slot;
  }

  /** @return The post-processing function, may be null. */
  public String getVrlFunction() {
    return panel_query == null ? null : panel_query.getVrlFunctionQuery();
  }

  /** @return The stream type, may be null. */
  public String getStreamType() {
    return panel_query == null ? null : panel_query.getStreamType();
  }

  @Override
  public String toString() {
    return "slot=" + slot + ", range=" + range + ", query=" + query;
  }
}
