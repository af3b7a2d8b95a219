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
package net.opendash.state;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import net.opendash.utils.JSON;

public class TestResultAccumulator {

  private LoadState state;
  private ResultAccumulator accumulator;

  @Before
  public void before() throws Exception {
    state = new LoadState();
    accumulator = new ResultAccumulator(state);
  }

  @Test
  public void mergePartitionDescAppends() throws Exception {
    accumulator.mergePartition(0, hits("[{\"a\":3},{\"a\":2}]"),
        meta("{\"took\":5}"), false, "desc");
    accumulator.mergePartition(0, hits("[{\"a\":1}]"),
        meta("{\"took\":7}"), false, "desc");

    assertEquals("[{\"a\":3},{\"a\":2},{\"a\":1}]",
        state.dataAt(0).toString());
    assertEquals(7, (long) state.resultMetaDataAt(0).getTook());
  }

  @Test
  public void mergePartitionAscPrepends() throws Exception {
    accumulator.mergePartition(0, hits("[{\"a\":3}]"), null, false, "asc");
    accumulator.mergePartition(0, hits("[{\"a\":1},{\"a\":2}]"), null, false,
        "asc");
    assertEquals("[{\"a\":1},{\"a\":2},{\"a\":3}]",
        state.dataAt(0).toString());
  }

  @Test
  public void mergePartitionStreamingAggsReplaces() throws Exception {
    accumulator.mergePartition(1, hits("[{\"count\":3}]"), null, true,
        "desc");
    accumulator.mergePartition(1, hits("[{\"count\":5}]"), null, true,
        "desc");
    assertEquals("[{\"count\":5}]", state.dataAt(1).toString());
    assertEquals(2, state.slots());
    assertEquals(0, state.dataAt(0).size());
  }

  @Test
  public void mergePartitionClearsError() throws Exception {
    state.setErrorDetail(ErrorDetail.of("Boo!", "500"));
    accumulator.mergePartition(0, null, null, false, "desc");
    assertTrue(state.getErrorDetail().isEmpty());
    assertEquals(0, state.dataAt(0).size());
  }

  @Test
  public void mergePartitionCopiesInput() throws Exception {
    final ArrayNode rows = hits("[{\"a\":1}]");
    final ResultMetaData meta = meta("{\"took\":1}");
    accumulator.mergePartition(0, rows, meta, false, "desc");
    rows.removeAll();
    meta.setTook(99L);
    assertEquals(1, state.dataAt(0).size());
    assertEquals(1, (long) state.resultMetaDataAt(0).getTook());
  }

  @Test
  public void markRangeRestricted() throws Exception {
    accumulator.mergePartition(0, hits("[{\"a\":1}]"), null, false, "desc");
    accumulator.markRangeRestricted(0, 2, 1000L, 5000L);

    final ResultMetaData meta = state.resultMetaDataAt(0);
    assertTrue(meta.isPartial());
    assertEquals("Query duration is modified due to query range restriction "
        + "of 2 hours", meta.getFunctionError());
    assertEquals(1000L, (long) meta.getNewStartTime());
    assertEquals(5000L, (long) meta.getNewEndTime());
  }

  @Test
  public void markPartial() throws Exception {
    accumulator.markPartial(0, 5000L);
    assertEquals(5000L, (long) state.resultMetaDataAt(0).getNewEndTime());
    assertNull(state.resultMetaDataAt(0).getNewStartTime());
  }

  @Test
  public void applyStreamMetadata() throws Exception {
    accumulator.applyStreamMetadata(0, node("{\"trace_id\":\"abc\","
        + "\"results\":{\"order_by\":\"asc\",\"streaming_aggs\":true,"
        + "\"total\":10,\"hits\":[{\"a\":1}]}}"));

    final ResultMetaData meta = state.resultMetaDataAt(0);
    assertEquals("asc", meta.getOrderBy());
    assertTrue(meta.isStreamingAggs());
    assertEquals(10L, (long) meta.getTotal());
    assertEquals("abc", meta.getOther().get("trace_id").asText());
    assertFalse(meta.getOther().containsKey("hits"));
    assertFalse(meta.getOther().containsKey("results"));
    assertEquals(0, state.dataAt(0).size());
  }

  @Test
  public void applyStreamHitsUsesStoredEnvelope() throws Exception {
    accumulator.applyStreamMetadata(0, node(
        "{\"results\":{\"order_by\":\"asc\"}}"));
    accumulator.applyStreamHits(0, node("{\"results\":{\"hits\":[{\"a\":2}]}}"));
    accumulator.applyStreamHits(0, node("{\"results\":{\"hits\":[{\"a\":1}]}}"));
    assertEquals("[{\"a\":1},{\"a\":2}]", state.dataAt(0).toString());
  }

  @Test
  public void applyStreamHitsDescAppendsEachTime() throws Exception {
    accumulator.applyStreamMetadata(0, node(
        "{\"results\":{\"order_by\":\"desc\"}}"));
    final JsonNode content = node("{\"results\":{\"hits\":[{\"a\":1}]}}");
    accumulator.applyStreamHits(0, content);
    accumulator.applyStreamHits(0, content);
    assertEquals("[{\"a\":1},{\"a\":1}]", state.dataAt(0).toString());
  }

  @Test
  public void applyStreamHitsStreamingAggsIdempotent() throws Exception {
    accumulator.applyStreamMetadata(0, node(
        "{\"results\":{\"streaming_aggs\":true}}"));
    final JsonNode content = node("{\"results\":{\"hits\":[{\"count\":4}]}}");
    accumulator.applyStreamHits(0, content);
    final String once = state.dataAt(0).toString();
    accumulator.applyStreamHits(0, content);
    assertEquals(once, state.dataAt(0).toString());
    assertEquals("[{\"count\":4}]", once);
  }

  @Test
  public void applyStreamResponse() throws Exception {
    state.setPartialData(true);
    accumulator.applyStreamResponse(0, node("{\"streaming_aggs\":false,"
        + "\"results\":{\"order_by\":\"desc\",\"took\":3,"
        + "\"hits\":[{\"a\":1}]}}"));
    assertEquals("[{\"a\":1}]", state.dataAt(0).toString());
    assertEquals(3L, (long) state.resultMetaDataAt(0).getTook());
    assertFalse(state.isPartialData());
  }

  @Test
  public void applyStreamResponseWhileLoadingKeepsPartial() throws Exception {
    state.setPartialData(true);
    state.setLoading(true);
    accumulator.applyStreamResponse(0, node(
        "{\"results\":{\"hits\":[{\"a\":1}]}}"));
    assertTrue(state.isPartialData());
  }

  @Test
  public void applyStreamProgressAndEnd() throws Exception {
    state.setLoading(true);
    state.setOperationCancelled(true);
    accumulator.applyStreamProgress(node("{\"percent\":40}"));
    assertEquals(40, state.getLoadingProgressPercentage());
    assertTrue(state.isPartialData());

    accumulator.applyStreamEnd();
    assertFalse(state.isLoading());
    assertEquals(100, state.getLoadingProgressPercentage());
    assertFalse(state.isPartialData());
    assertFalse(state.isOperationCancelled());
  }

  @Test
  public void applyStreamError() throws Exception {
    state.setLoading(true);
    state.setProgress(4, 2);
    accumulator.applyStreamError(ErrorDetail.of("Boo!", "500"));
    assertFalse(state.isLoading());
    assertEquals(0, state.getLoadingProgressPercentage());
    assertEquals("Boo!", state.getErrorDetail().getMessage());
  }

  private static ArrayNode hits(final String json) {
    return (ArrayNode) JSON.parseToNode(json);
  }

  private static ResultMetaData meta(final String json) {
    return ResultMetaData.fromNode(JSON.parseToNode(json));
  }

  private static JsonNode node(final String json) {
    return JSON.parseToNode(json);
  }
}
