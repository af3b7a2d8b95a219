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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;

public class TestStreamRequest {

  @Test
  public void toNode() throws Exception {
    final SearchRequest search = SearchRequest.newBuilder()
        .setSql("SELECT * FROM logs")
        .setStartTime(1000)
        .setEndTime(2000)
        .setOrgId("default")
        .setStreamType("logs")
        .setTraceId("abc")
        .setDashboardId("d1")
        .setFolderId("f1")
        .build();
    final StreamRequest request = new StreamRequest(search, 2, true);
    assertEquals("abc", request.getTraceId());
    assertEquals(2, request.getSlot());
    assertTrue(request.isUseCache());

    final JsonNode frame = request.toNode();
    assertEquals("search", frame.get("type").asText());
    final JsonNode content = frame.get("content");
    assertEquals("abc", content.get("trace_id").asText());
    assertEquals("logs", content.get("stream_type").asText());
    assertEquals("dashboards", content.get("search_type").asText());
    assertEquals("default", content.get("org_id").asText());
    assertTrue(content.get("use_cache").asBoolean());
    assertEquals("d1", content.get("dashboard_id").asText());
    assertEquals("f1", content.get("folder_id").asText());
    final JsonNode query = content.get("payload").get("query");
    assertEquals("SELECT * FROM logs", query.get("sql").asText());
    assertEquals(1000, query.get("start_time").asLong());
    assertFalse(query.has("trace_id"));
  }

  @Test
  public void ctorNullSearch() throws Exception {
    try {
      new StreamRequest(null, 0, true);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
