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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.opendash.utils.JSON;

public class TestStreamMessage {

  @Test
  public void typeNames() throws Exception {
    for (final StreamMessageType type : StreamMessageType.values()) {
      assertSame(type, StreamMessageType.fromName(type.getName()));
    }
    assertEquals("search_response_hits",
        StreamMessageType.SEARCH_RESPONSE_HITS.getName());
    assertEquals("event_progress", StreamMessageType.EVENT_PROGRESS.getName());
    assertNull(StreamMessageType.fromName("cancel_response"));
    assertNull(StreamMessageType.fromName(null));
  }

  @Test
  public void fromNode() throws Exception {
    StreamMessage message = StreamMessage.fromNode(JSON.parseToNode(
        "{\"type\":\"search_response_hits\",\"content\":{\"results\":"
        + "{\"hits\":[]}}}"));
    assertSame(StreamMessageType.SEARCH_RESPONSE_HITS, message.getType());
    assertEquals("search_response_hits", message.getRawType());
    assertTrue(message.getContent().has("results"));

    message = StreamMessage.fromNode(JSON.parseToNode("{\"type\":\"end\"}"));
    assertSame(StreamMessageType.END, message.getType());
    assertTrue(message.getContent().isNull());

    message = StreamMessage.fromNode(JSON.parseToNode("{\"content\":{}}"));
    assertNull(message.getType());
    assertNull(message.getRawType());
  }

  @Test
  public void of() throws Exception {
    final StreamMessage message = StreamMessage.of(StreamMessageType.ERROR,
        JSON.parseToNode("{\"message\":\"boom\"}"));
    assertEquals("error", message.getRawType());
    assertEquals("boom", message.getContent().get("message").asText());
  }
}
