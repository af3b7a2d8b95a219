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
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Lists;

import net.opendash.utils.JSON;

public class TestLoadState {

  @Test
  public void slotsStayAligned() throws Exception {
    final LoadState state = new LoadState();
    state.ensureSlot(2);
    assertEquals(3, state.slots());
    assertEquals(3, state.getData().size());
    assertEquals(3, state.getResultMetaData().size());

    state.setData(4, null);
    assertEquals(5, state.getData().size());
    assertEquals(5, state.getResultMetaData().size());

    try {
      state.ensureSlot(-1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void replaceData() throws Exception {
    final LoadState state = new LoadState();
    state.ensureSlot(5);
    final List<ArrayNode> rows = Lists.newArrayList();
    rows.add((ArrayNode) JSON.parseToNode("[1,2]"));
    rows.add(null);
    state.replaceData(rows);
    assertEquals(2, state.slots());
    assertEquals(2, state.getResultMetaData().size());
    assertEquals(0, state.dataAt(1).size());
  }

  @Test
  public void progress() throws Exception {
    final LoadState state = new LoadState();
    state.setProgress(3, 0);
    assertEquals(0, state.getLoadingProgressPercentage());
    state.completeStep();
    assertEquals(1, state.getLoadingCompleted());
    assertEquals(33, state.getLoadingProgressPercentage());
    state.completeStep();
    state.completeStep();
    assertEquals(100, state.getLoadingProgressPercentage());

    state.setProgressPercentage(250);
    assertEquals(100, state.getLoadingProgressPercentage());
    state.setProgressPercentage(-3);
    assertEquals(0, state.getLoadingProgressPercentage());

    state.setProgress(0, 0);
    assertEquals(0, state.getLoadingProgressPercentage());
  }

  @Test
  public void setQueryMetadata() throws Exception {
    final LoadState state = new LoadState();
    state.setQueryMetadata(0, query("a"));
    state.setQueryMetadata(1, query("b"));
    state.setQueryMetadata(0, query("c"));
    assertEquals(2, state.getQueries().size());
    assertEquals("c", state.getQueries().get(0).getQuery());

    try {
      state.setQueryMetadata(3, query("d"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void readersGetCopies() throws Exception {
    final LoadState state = new LoadState();
    state.setData(0, (ArrayNode) JSON.parseToNode("[{\"a\":1}]"));
    ((ObjectNode) state.getData().get(0).get(0)).put("a", 42);
    assertEquals(1, state.dataAt(0).get(0).get("a").asInt());

    state.resultMetaDataAt(0).setTook(5L);
    state.getResultMetaData().get(0).setTook(99L);
    assertEquals(5L, (long) state.resultMetaDataAt(0).getTook());
  }

  @Test
  public void traceIds() throws Exception {
    final LoadState state = new LoadState();
    state.addTraceId("t1");
    state.addTraceId("t2");
    state.removeTraceId("t1");
    state.removeTraceId("nope");
    assertEquals(1, state.getSearchRequestTraceIds().size());
    assertTrue(state.getSearchRequestTraceIds().contains("t2"));
    state.clearTraceIds();
    assertTrue(state.getSearchRequestTraceIds().isEmpty());
  }

  @Test
  public void reset() throws Exception {
    final LoadState state = new LoadState();
    state.setData(1, (ArrayNode) JSON.parseToNode("[1]"));
    state.setQueryMetadata(0, query("a"));
    state.setLoading(true);
    state.setOperationCancelled(true);
    state.setProgress(2, 1);
    state.reset();

    assertTrue(state.snapshot().hasNoData());
    assertTrue(state.getQueries().isEmpty());
    assertFalse(state.isLoading());
    assertFalse(state.isOperationCancelled());
    assertEquals(0, state.getLoadingTotal());
  }

  @Test
  public void snapshotRoundTrip() throws Exception {
    final LoadState state = new LoadState();
    state.setData(0, (ArrayNode) JSON.parseToNode("[{\"a\":1}]"));
    state.setData(1, (ArrayNode) JSON.parseToNode("[{\"b\":2}]"));
    state.resultMetaDataAt(1).setOrderBy("desc");
    state.resultMetaDataAt(1).setOther("trace_id",
        JSON.parseToNode("\"xyz\""));
    state.setQueryMetadata(0, query("a"));
    state.setAnnotations(Lists.newArrayList(Annotation.newBuilder()
        .setId("1")
        .setStartTime(1000)
        .setEndTime(2000)
        .setTitle("deploy")
        .build()));
    state.setProgress(2, 2);
    state.setPartialData(true);
    state.setErrorDetail(ErrorDetail.of("Boo!", "500"));
    state.setCachedDataDiffers(true);
    state.setLastTriggeredAt(1700000000000L);
    state.addTraceId("t1");

    final LoadStateSnapshot snapshot = state.snapshot();
    final String json = JSON.serializeToString(snapshot);
    final LoadStateSnapshot parsed = JSON.parseToObject(json,
        LoadStateSnapshot.class);
    assertEquals(snapshot, parsed);

    final LoadState restored = new LoadState();
    restored.addTraceId("local");
    restored.restore(parsed);
    assertEquals(state.getData(), restored.getData());
    assertEquals(state.getResultMetaData(), restored.getResultMetaData());
    assertEquals(state.getQueries(), restored.getQueries());
    assertEquals(state.getAnnotations(), restored.getAnnotations());
    assertEquals(100, restored.getLoadingProgressPercentage());
    assertTrue(restored.isPartialData());
    assertEquals("Boo!", restored.getErrorDetail().getMessage());
    assertTrue(restored.isCachedDataDifferWithCurrentTimeRange());
    assertEquals(1700000000000L, (long) restored.getLastTriggeredAt());
    // trace ids are never restored
    assertEquals(1, restored.getSearchRequestTraceIds().size());
    assertTrue(restored.getSearchRequestTraceIds().contains("local"));
  }

  @Test
  public void restoreIsolatesSnapshot() throws Exception {
    final LoadState state = new LoadState();
    state.setData(0, (ArrayNode) JSON.parseToNode("[{\"a\":1}]"));
    final LoadStateSnapshot snapshot = state.snapshot();
    final LoadState restored = new LoadState();
    restored.restore(snapshot);
    restored.dataAt(0).add(2);
    assertEquals(1, snapshot.getData().get(0).size());
    assertNotSame(snapshot.getData().get(0), restored.dataAt(0));
  }

  @Test
  public void publish() throws Exception {
    final LoadState state = new LoadState();
    final List<LoadStateSnapshot> received = Lists.newArrayList();
    state.subscribe(new LoadStateListener() {
      @Override
      public void onStateChanged(final LoadStateSnapshot snapshot) {
        throw new IllegalStateException("Boo!");
      }
    });
    final LoadStateListener listener = new LoadStateListener() {
      @Override
      public void onStateChanged(final LoadStateSnapshot snapshot) {
        received.add(snapshot);
      }
    };
    state.subscribe(listener);

    state.setLoading(true);
    state.publish();
    assertEquals(1, received.size());
    assertTrue(received.get(0).isLoading());

    state.unsubscribe(listener);
    state.publish();
    assertEquals(1, received.size());
  }

  private static QueryMetadata query(final String query) {
    return QueryMetadata.newBuilder()
        .setOriginalQuery(query)
        .setQuery(query)
        .setStartTime(0)
        .setEndTime(1000)
        .setQueryType("sql")
        .build();
  }
}
