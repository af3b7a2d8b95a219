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
package net.opendash.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import net.opendash.utils.JSON;

/**
 * A search request for the push-socket and HTTP stream transports, keyed
 * by the search's trace id. The destination slot stays local.
 *
 * @since 1.0
 */
public class StreamRequest {
  private final SearchRequest search;
  private final int slot;
  private final boolean use_cache;

  /**
   * Default ctor.
   * @param search A non-null search carrying the trace id and routing.
   * @param slot The slot results are written to.
   * @param use_cache Whether the back end may serve from its result cache.
   */
  public StreamRequest(final SearchRequest search,
                       final int slot,
                       final boolean use_cache) {
    if (search == null) {
      throw new IllegalArgumentException("Search cannot be null.");
    }
    this.search = search;
    this.slot = slot;
    this.use_cache = use_cache;
  }

  public SearchRequest getSearch() {
    return search;
  }

  public String getTraceId() {
    return search.getTraceId();
  }

  public int getSlot() {
    return slot;
  }

  public boolean isUseCache() {
    return use_cache;
  }

  /** @return The {@code search} frame to send. */
  public JsonNode toNode() {
    final ObjectNode frame = JSON.getMapper().createObjectNode();
    frame.put("type", "search");
    final ObjectNode content = frame.putObject("content");
    content.put("trace_id", search.getTraceId());
    content.putObject("payload").set("query", JSON.toNode(search));
    content.put("stream_type", search.getStreamType());
    content.put("search_type", search.getSearchType());
    content.put("org_id", search.getOrgId());
    content.put("use_cache", use_cache);
    content.put("dashboard_id", search.getDashboardId());
    content.put("folder_id", search.getFolderId());
    return frame;
  }

  @Override
  public String toString() {
    return "slot=" + slot + ", search=" + search;
  }
}
