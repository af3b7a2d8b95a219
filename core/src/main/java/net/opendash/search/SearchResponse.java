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
import com.fasterxml.jackson.databind.node.ArrayNode;

import net.opendash.state.ResultMetaData;
import net.opendash.utils.JSON;

/**
 * The result of one search: the rows and the envelope that came with
 * them.
 *
 * @since 1.0
 */
public class SearchResponse {
  private final ArrayNode hits;
  private final ResultMetaData meta;

  /**
   * Default ctor.
   * @param hits The rows, null for none.
   * @param meta The envelope, null for an empty one.
   */
  public SearchResponse(final ArrayNode hits, final ResultMetaData meta) {
    this.hits = hits == null ? JSON.getMapper().createArrayNode() : hits;
    this.meta = meta == null ? new ResultMetaData() : meta;
  }

  /**
   * Splits a search API response body.
   * @param body The parsed body.
   * @return A non-null response.
   */
  public static SearchResponse fromNode(final JsonNode body) {
    final JsonNode hits = body == null ? null : body.get("hits");
    return new SearchResponse(hits != null && hits.isArray() ?
        (ArrayNode) hits : null, ResultMetaData.fromNode(body));
  }

  /** @return The rows, never null. */
  public ArrayNode getHits() {
    return hits;
  }

  /** @return The envelope without the rows, never null. */
  public ResultMetaData getMeta() {
    return meta;
  }

  @Override
  public String toString() {
    return "hits=" + hits.size() + ", meta=" + meta;
  }
}
