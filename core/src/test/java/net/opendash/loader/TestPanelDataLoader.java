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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import net.opendash.core.MockRuntime;
import net.opendash.exceptions.RemoteQueryExecutionException;
import net.opendash.panel.PanelIdentity;
import net.opendash.panel.PanelQuery;
import net.opendash.panel.PanelSchema;
import net.opendash.panel.TimeRange;
import net.opendash.search.AnnotationService;
import net.opendash.search.MetricsQueryRequest;
import net.opendash.search.PartitionResponse;
import net.opendash.search.PushSocketClient;
import net.opendash.search.SearchRequest;
import net.opendash.search.SearchResponse;
import net.opendash.search.StreamRequest;
import net.opendash.state.Annotation;
import net.opendash.state.QueryMetadata;
import net.opendash.state.ResultMetaData;
import net.opendash.transport.TransportSelector;
import net.opendash.variables.Variable;
import net.opendash.variables.VariableSource;

public class TestPanelDataLoader {
  private static final long HOUR = 3600000000L;
  private static final TimeRange RANGE = TimeRange.of(2 * HOUR, 3 * HOUR);

  private MockRuntime runtime;
  private PanelIdentity identity;
  private PanelSchema sql;

  @Before
  public void before() throws Exception {
    runtime = new MockRuntime();
    identity = PanelIdentity.newBuilder()
        .setPanelId("panel_1")
        .setDashboardId("dash_1")
        .setFolderId("default")
        .build();
    sql = schema("table", "SELECT * FROM logs");
    plan();
    respond();
  }

  @Test
  public void ctor() throws Exception {
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    assertEquals(LoaderState.IDLE, loader.getLoaderState());
    assertSame(identity, loader.getIdentity());
    assertEquals(50, runtime.config.getLong(PanelDataLoader.DEBOUNCE_KEY));
    assertNull(loader.currentCycle());

    try {
      new PanelDataLoader(null, identity, sql, RANGE, null, null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new PanelDataLoader(runtime, null, sql, RANGE, null, null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void startTwice() throws Exception {
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    loader.start();
    try {
      loader.start();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }

  @Test
  public void noQuery() throws Exception {
    final PanelDataLoader loader = loader(schema("table", "  "), RANGE,
        null, null, null);
    assertEquals(LoaderState.COMPLETED, loader.start().join());
    assertEquals(LoaderState.COMPLETED, loader.getLoaderState());
    assertEquals(0, runtime.timer.pending());
    assertTrue(loader.getState().getData().isEmpty());
    assertFalse(loader.getState().isLoading());
    verify(runtime.search, never()).partition(any(SearchRequest.class));
  }

  @Test
  public void noSchema() throws Exception {
    final PanelDataLoader loader = loader(null, RANGE, null, null, null);
    assertEquals(LoaderState.COMPLETED, loader.start().join());
    verify(runtime.search, never()).partition(any(SearchRequest.class));
  }

  @Test
  public void sqlRun() throws Exception {
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    assertEquals(LoaderState.DEBOUNCING, loader.getLoaderState());
    assertEquals(1, runtime.timer.pending());
    assertEquals(50, runtime.timer.last_delay);

    assertEquals(1, runtime.timer.runAll());
    assertEquals(LoaderState.COMPLETED, deferred.join());
    assertEquals(LoaderState.COMPLETED, loader.getLoaderState());

    final ArgumentCaptor<SearchRequest> captor =
        ArgumentCaptor.forClass(SearchRequest.class);
    verify(runtime.search, times(1)).partition(captor.capture());
    assertEquals("SELECT * FROM logs", captor.getValue().getSql());
    assertEquals(2 * HOUR, captor.getValue().getStartTime());
    assertEquals(3 * HOUR, captor.getValue().getEndTime());
    verify(runtime.search, times(1)).search(any(SearchRequest.class));

    final List<ArrayNode> data = loader.getState().getData();
    assertEquals(1, data.size());
    assertEquals(1, data.get(0).size());
    assertEquals(2 * HOUR, data.get(0).get(0).get("start").asLong());
    final QueryMetadata meta = loader.getState().getQueries().get(0);
    assertEquals("SELECT * FROM logs", meta.getOriginalQuery());
    assertEquals("SELECT * FROM logs", meta.getQuery());
    assertEquals("", meta.getTimeShiftPeriod());
    assertFalse(loader.getState().isLoading());
    assertFalse(loader.getState().isPartialData());
    assertTrue(loader.getState().getErrorDetail().isEmpty());
    assertNotNull(loader.getState().getLastTriggeredAt());
    assertTrue(loader.getState().getSearchRequestTraceIds().isEmpty());
    assertEquals(1, runtime.cache_store.size());
  }

  @Test
  public void sqlRunFailed() throws Exception {
    when(runtime.search.partition(any(SearchRequest.class))).thenReturn(
        Deferred.<PartitionResponse>fromError(
            new RemoteQueryExecutionException("bad sql", "search", 400)));
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();

    assertEquals(LoaderState.FAILED, deferred.join());
    assertEquals(LoaderState.FAILED, loader.getLoaderState());
    assertFalse(loader.getState().getErrorDetail().isEmpty());
    assertFalse(loader.getState().isLoading());
    verify(runtime.search, never()).search(any(SearchRequest.class));
  }

  @Test
  public void noTimeRange() throws Exception {
    final PanelDataLoader loader = loader(sql, null, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, deferred.join());
    verify(runtime.search, never()).partition(any(SearchRequest.class));
  }

  @Test
  public void timeShifts() throws Exception {
    final PanelSchema shifted = PanelSchema.newBuilder()
        .setType("table")
        .addQuery(PanelQuery.newBuilder()
            .setQuery("SELECT * FROM logs")
            .setTimeShift(Lists.newArrayList("1h"))
            .build())
        .build();
    final PanelDataLoader loader = loader(shifted, RANGE, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, deferred.join());

    verify(runtime.search, times(2)).partition(any(SearchRequest.class));
    final List<ArrayNode> data = loader.getState().getData();
    assertEquals(2, data.size());
    assertEquals(2 * HOUR, data.get(0).get(0).get("start").asLong());
    assertEquals(HOUR, data.get(1).get(0).get("start").asLong());

    final List<QueryMetadata> queries = loader.getState().getQueries();
    assertEquals(2, queries.size());
    assertEquals(0, queries.get(0).getTimeShiftSeconds());
    assertEquals("1h", queries.get(1).getTimeShiftPeriod());
    assertEquals(3600, queries.get(1).getTimeShiftSeconds());
    assertEquals(HOUR, queries.get(1).getStartTime());
    assertEquals(2 * HOUR, queries.get(1).getEndTime());
  }

  @Test
  public void multipleQueriesRunInOrder() throws Exception {
    final PanelSchema panel = PanelSchema.newBuilder()
        .setType("table")
        .addQuery(PanelQuery.newBuilder().setQuery("SELECT a FROM logs")
            .build())
        .addQuery(PanelQuery.newBuilder().setQuery("SELECT b FROM logs")
            .build())
        .build();
    final PanelDataLoader loader = loader(panel, RANGE, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, deferred.join());

    final ArgumentCaptor<SearchRequest> captor =
        ArgumentCaptor.forClass(SearchRequest.class);
    verify(runtime.search, times(2)).partition(captor.capture());
    assertEquals("SELECT a FROM logs", captor.getAllValues().get(0).getSql());
    assertEquals("SELECT b FROM logs", captor.getAllValues().get(1).getSql());
    assertEquals(2, loader.getState().getData().size());
  }

  @Test
  public void cacheRestoredOnFirstCycle() throws Exception {
    final PanelDataLoader first = loader(sql, RANGE, null, null, null);
    first.start();
    runtime.timer.runAll();
    first.close();

    final PanelDataLoader second = loader(sql, RANGE, null, null, null);
    final Deferred<LoaderState> deferred = second.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, deferred.join());

    // only the first loader searched
    verify(runtime.search, times(1)).partition(any(SearchRequest.class));
    assertEquals(1, second.getState().getData().size());
    assertEquals(2 * HOUR,
        second.getState().getData().get(0).get(0).get("start").asLong());
    assertFalse(second.getState().isLoading());
    assertFalse(second.getState().isCachedDataDifferWithCurrentTimeRange());

    // later cycles go to the back end
    second.loadData();
    runtime.timer.runAll();
    verify(runtime.search, times(2)).partition(any(SearchRequest.class));
  }

  @Test
  public void cacheMissOnDifferentQuery() throws Exception {
    final PanelDataLoader first = loader(sql, RANGE, null, null, null);
    first.start();
    runtime.timer.runAll();

    final PanelDataLoader second = loader(
        schema("table", "SELECT count(*) FROM logs"), RANGE, null, null, null);
    second.start();
    runtime.timer.runAll();
    verify(runtime.search, times(2)).partition(any(SearchRequest.class));
  }

  @Test
  public void awaitVariables() throws Exception {
    final FakeVariables variables = new FakeVariables();
    variables.variables = Lists.newArrayList(variable("v", null, true));
    final PanelDataLoader loader = loader(
        schema("table", "SELECT * FROM logs WHERE k=$v"), RANGE,
        variables, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    assertEquals(1, variables.listeners.size());
    runtime.timer.runAll();
    assertEquals(LoaderState.AWAITING_VARIABLES, loader.getLoaderState());
    verify(runtime.search, never()).partition(any(SearchRequest.class));

    // unrelated change while still loading
    variables.update(Lists.newArrayList(variable("v", null, true),
        variable("other", "1", false)));
    assertEquals(LoaderState.AWAITING_VARIABLES, loader.getLoaderState());

    variables.update(Lists.newArrayList(variable("v", "x", false)));
    assertEquals(LoaderState.COMPLETED, deferred.join());
    assertEquals(0, runtime.timer.pending());

    final ArgumentCaptor<SearchRequest> captor =
        ArgumentCaptor.forClass(SearchRequest.class);
    verify(runtime.search, times(1)).partition(captor.capture());
    assertEquals("SELECT * FROM logs WHERE k=x", captor.getValue().getSql());
    assertEquals("SELECT * FROM logs WHERE k=$v",
        loader.getState().getQueries().get(0).getOriginalQuery());
    assertEquals(1,
        loader.getState().getQueries().get(0).getVariables().size());
  }

  @Test
  public void variableChangeReloads() throws Exception {
    final FakeVariables variables = new FakeVariables();
    variables.variables = Lists.newArrayList(variable("v", "x", false));
    final PanelDataLoader loader = loader(
        schema("table", "SELECT * FROM logs WHERE k=$v"), RANGE,
        variables, null, null);
    loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, loader.getLoaderState());

    // same values, nothing to do
    variables.update(Lists.newArrayList(variable("v", "x", false),
        variable("unreferenced", "1", false)));
    assertEquals(0, runtime.timer.pending());

    variables.update(Lists.newArrayList(variable("v", "y", false)));
    assertEquals(1, runtime.timer.pending());
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, loader.getLoaderState());

    final ArgumentCaptor<SearchRequest> captor =
        ArgumentCaptor.forClass(SearchRequest.class);
    verify(runtime.search, times(2)).partition(captor.capture());
    assertEquals("SELECT * FROM logs WHERE k=y", captor.getValue().getSql());
  }

  @Test
  public void emptyVariableSkipsLoad() throws Exception {
    final FakeVariables variables = new FakeVariables();
    variables.variables = Lists.newArrayList(variable("v", "", false));
    final PanelDataLoader loader = loader(
        schema("table", "SELECT * FROM logs WHERE k=$v"), RANGE,
        variables, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, deferred.join());
    assertFalse(loader.getState().isLoading());
    verify(runtime.search, never()).partition(any(SearchRequest.class));
  }

  @Test
  public void awaitVisibility() throws Exception {
    final FakeVisibility visibility = new FakeVisibility();
    final PanelDataLoader loader = loader(sql, RANGE, null, visibility, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.AWAITING_VISIBILITY, loader.getLoaderState());
    verify(runtime.search, never()).partition(any(SearchRequest.class));

    visibility.change(false);
    assertEquals(LoaderState.AWAITING_VISIBILITY, loader.getLoaderState());

    visibility.change(true);
    assertEquals(LoaderState.COMPLETED, deferred.join());
    verify(runtime.search, times(1)).partition(any(SearchRequest.class));
  }

  @Test
  public void forceLoadSkipsVisibility() throws Exception {
    final FakeVisibility visibility = new FakeVisibility();
    final PanelDataLoader loader = loader(sql, RANGE, null, visibility, null);
    final Deferred<LoaderState> first = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.AWAITING_VISIBILITY, loader.getLoaderState());

    loader.setForceLoad(true);
    assertEquals(LoaderState.CANCELLED, first.join());
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, loader.getLoaderState());
    verify(runtime.search, times(1)).partition(any(SearchRequest.class));

    // the stale wait is gone
    visibility.change(true);
    verify(runtime.search, times(1)).partition(any(SearchRequest.class));
  }

  @Test
  public void newTriggerCancelsPrevious() throws Exception {
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    final Deferred<LoaderState> first = loader.start();
    final Deferred<LoaderState> second = loader.loadData();
    assertEquals(LoaderState.CANCELLED, first.join());
    assertEquals(1, runtime.timer.pending());

    assertEquals(1, runtime.timer.runAll());
    assertEquals(LoaderState.COMPLETED, second.join());
    verify(runtime.search, times(1)).partition(any(SearchRequest.class));
  }

  @Test
  public void setters() throws Exception {
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    // not started
    loader.setTimeRange(TimeRange.of(0, HOUR));
    assertEquals(0, runtime.timer.pending());

    loader.start();
    runtime.timer.runAll();
    loader.setPanelSchema(schema("table", "SELECT * FROM logs"));
    loader.setTimeRange(TimeRange.of(0, HOUR));
    loader.setForceLoad(false);
    loader.setWidth(500);
    assertEquals(0, runtime.timer.pending());

    loader.setTimeRange(RANGE);
    assertEquals(1, runtime.timer.pending());
    loader.setPanelSchema(schema("table", "SELECT a FROM logs"));
    assertEquals(1, runtime.timer.pending());
    runtime.timer.runAll();

    final ArgumentCaptor<SearchRequest> captor =
        ArgumentCaptor.forClass(SearchRequest.class);
    verify(runtime.search, times(2)).partition(captor.capture());
    assertEquals("SELECT a FROM logs", captor.getValue().getSql());
    assertEquals(2 * HOUR, captor.getValue().getStartTime());

    try {
      loader.setPanelSchema(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      loader.setTimeRange(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void cancelQuery() throws Exception {
    when(runtime.search.search(any(SearchRequest.class)))
      .thenReturn(new Deferred<SearchResponse>());
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.EXECUTING, loader.getLoaderState());
    assertTrue(loader.getState().isLoading());
    assertEquals(1, loader.getState().getSearchRequestTraceIds().size());

    loader.cancelQuery();
    assertEquals(LoaderState.CANCELLED, deferred.join());
    assertEquals(LoaderState.CANCELLED, loader.getLoaderState());
    assertFalse(loader.getState().isLoading());
    assertTrue(loader.getState().isOperationCancelled());
    assertTrue(loader.getState().isPartialData());
    assertTrue(loader.getState().getSearchRequestTraceIds().isEmpty());
    assertTrue(loader.currentCycle().isCancelled());
  }

  @Test
  public void cancelQueryBeforeStart() throws Exception {
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    loader.cancelQuery();
    assertFalse(loader.getState().isOperationCancelled());
  }

  @Test
  public void cancelChannel() throws Exception {
    when(runtime.search.search(any(SearchRequest.class)))
      .thenReturn(new Deferred<SearchResponse>());
    final CancelChannel channel = new CancelChannel();
    final PanelDataLoader loader = loader(sql, RANGE, null, null, channel);
    final Deferred<LoaderState> deferred = loader.start();
    assertEquals(1, channel.listeners());
    runtime.timer.runAll();

    channel.requestCancel();
    assertEquals(LoaderState.CANCELLED, deferred.join());
    assertTrue(loader.getState().isOperationCancelled());

    // the next load clears the cancelled flag
    respond();
    final Deferred<LoaderState> next = loader.loadData();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, next.join());
    assertFalse(loader.getState().isOperationCancelled());
  }

  @Test
  public void cancelTargetsPushSocket() throws Exception {
    final PushSocketClient client = mock(PushSocketClient.class);
    runtime.push_socket = client;
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    runtime.config.override(TransportSelector.PUSH_SOCKET_KEY, true);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();

    final ArgumentCaptor<StreamRequest> captor =
        ArgumentCaptor.forClass(StreamRequest.class);
    verify(client).register(captor.capture(),
        any(PushSocketClient.PushSocketHandler.class));
    final String trace_id = captor.getValue().getTraceId();
    assertTrue(loader.getState().getSearchRequestTraceIds()
        .contains(trace_id));

    loader.cancelQuery();
    assertEquals(LoaderState.CANCELLED, deferred.join());
    verify(client).cancelByTraceId(trace_id, "default");
    verify(runtime.search, never()).partition(any(SearchRequest.class));
  }

  @Test
  public void close() throws Exception {
    when(runtime.search.search(any(SearchRequest.class)))
      .thenReturn(new Deferred<SearchResponse>());
    final FakeVariables variables = new FakeVariables();
    final FakeVisibility visibility = new FakeVisibility();
    visibility.visible = true;
    final CancelChannel channel = new CancelChannel();
    final PanelDataLoader loader = loader(sql, RANGE, variables, visibility,
        channel);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();

    loader.close();
    assertEquals(LoaderState.CANCELLED, deferred.join());
    assertTrue(loader.getState().isPartialData());
    assertFalse(loader.getState().isOperationCancelled());
    assertTrue(variables.listeners.isEmpty());
    assertTrue(visibility.listeners.isEmpty());
    assertEquals(0, channel.listeners());

    assertEquals(LoaderState.CANCELLED, loader.loadData().join());
    loader.close();
    try {
      loader.start();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }

  @Test
  public void promql() throws Exception {
    when(runtime.search.metricsQueryRange(any(MetricsQueryRequest.class)))
      .thenReturn(Deferred.fromResult(promqlData("matrix")),
          Deferred.fromResult(promqlData("vector")));
    final PanelSchema panel = PanelSchema.newBuilder()
        .setType("table")
        .setQueryType("promql")
        .setStepValue("15s")
        .addQuery(PanelQuery.newBuilder().setQuery("up").build())
        .addQuery(PanelQuery.newBuilder().setQuery("rate(x[5m])").build())
        .build();
    final PanelDataLoader loader = loader(panel, RANGE, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, deferred.join());

    final ArgumentCaptor<MetricsQueryRequest> captor =
        ArgumentCaptor.forClass(MetricsQueryRequest.class);
    verify(runtime.search, times(2)).metricsQueryRange(captor.capture());
    assertEquals("up", captor.getAllValues().get(0).getQuery());
    assertEquals("15s", captor.getAllValues().get(0).getStep());
    verify(runtime.search, never()).partition(any(SearchRequest.class));

    final List<ArrayNode> data = loader.getState().getData();
    assertEquals(2, data.size());
    assertEquals(1, data.get(0).size());
    final List<ResultMetaData> metas = loader.getState().getResultMetaData();
    assertEquals("matrix", metas.get(0).getOther().get("result_type")
        .asText());
    assertEquals("vector", metas.get(1).getOther().get("result_type")
        .asText());
    assertEquals("promql", loader.getState().getQueries().get(1)
        .getQueryType());
    assertFalse(loader.getState().isLoading());
    assertEquals(100, loader.getState().getLoadingProgressPercentage());

    // a fully loaded panel isn't flagged partial on teardown
    loader.close();
    assertFalse(loader.getState().isPartialData());
  }

  @Test
  public void promqlFailed() throws Exception {
    when(runtime.search.metricsQueryRange(any(MetricsQueryRequest.class)))
      .thenReturn(Deferred.fromResult(promqlData("matrix")),
          Deferred.<JsonNode>fromError(new RemoteQueryExecutionException(
              "bad query", "promql", 422)));
    final PanelSchema panel = PanelSchema.newBuilder()
        .setQueryType("promql")
        .addQuery(PanelQuery.newBuilder().setQuery("up").build())
        .addQuery(PanelQuery.newBuilder().setQuery("up{").build())
        .build();
    final PanelDataLoader loader = loader(panel, RANGE, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();

    assertEquals(LoaderState.FAILED, deferred.join());
    assertFalse(loader.getState().getErrorDetail().isEmpty());
    assertEquals(1, loader.getState().getData().get(0).size());
    // failed slots are left empty
    assertEquals(0, loader.getState().getData().get(1).size());
  }

  @Test
  public void annotations() throws Exception {
    final AnnotationService service = mock(AnnotationService.class);
    runtime.annotations = service;
    final Annotation annotation = Annotation.newBuilder()
        .setId("a1")
        .setStartTime(2 * HOUR)
        .setEndTime(2 * HOUR)
        .setTitle("deploy")
        .build();
    when(service.fetch(anyString(), any(PanelIdentity.class),
        any(TimeRange.class)))
      .thenReturn(Deferred.fromResult((List<Annotation>)
          Lists.newArrayList(annotation)));

    final PanelDataLoader loader = loader(schema("line", "SELECT * FROM logs"),
        RANGE, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, deferred.join());
    verify(service).fetch("default", identity, RANGE);
    assertEquals(1, loader.getState().getAnnotations().size());
    assertEquals("deploy", loader.getState().getAnnotations().get(0)
        .getTitle());
  }

  @Test
  public void annotationsNotNeeded() throws Exception {
    final AnnotationService service = mock(AnnotationService.class);
    runtime.annotations = service;
    final PanelDataLoader loader = loader(sql, RANGE, null, null, null);
    loader.start();
    runtime.timer.runAll();
    verify(service, never()).fetch(anyString(), any(PanelIdentity.class),
        any(TimeRange.class));
  }

  @Test
  public void annotationsFailed() throws Exception {
    final AnnotationService service = mock(AnnotationService.class);
    runtime.annotations = service;
    when(service.fetch(anyString(), any(PanelIdentity.class),
        any(TimeRange.class)))
      .thenReturn(Deferred.<List<Annotation>>fromError(
          new IllegalStateException("boom")));

    final PanelDataLoader loader = loader(schema("line", "SELECT * FROM logs"),
        RANGE, null, null, null);
    final Deferred<LoaderState> deferred = loader.start();
    runtime.timer.runAll();
    assertEquals(LoaderState.COMPLETED, deferred.join());
    assertTrue(loader.getState().getAnnotations().isEmpty());
  }

  private PanelDataLoader loader(final PanelSchema schema,
                                 final TimeRange range,
                                 final VariableSource variables,
                                 final VisibilitySignal visibility,
                                 final CancelChannel channel) {
    return new PanelDataLoader(runtime, identity, schema, range, variables,
        visibility, channel);
  }

  private static PanelSchema schema(final String type, final String query) {
    return PanelSchema.newBuilder()
        .setType(type)
        .addQuery(PanelQuery.newBuilder()
            .setQuery(query)
            .setStreamType("logs")
            .build())
        .build();
  }

  private static Variable variable(final String name,
                                   final String value,
                                   final boolean loading) {
    return Variable.newBuilder()
        .setName(name)
        .setType("query_values")
        .setValue(value)
        .setLoading(loading)
        .build();
  }

  private static JsonNode promqlData(final String type) {
    final ObjectNode data = JsonNodeFactory.instance.objectNode();
    data.put("resultType", type);
    final ObjectNode series = data.putArray("result").addObject();
    series.putObject("metric").put("__name__", "up");
    series.putArray("values").addArray().add(1).add("1");
    return data;
  }

  /** A plan with a single partition covering the requested range. */
  private void plan() {
    when(runtime.search.partition(any(SearchRequest.class))).thenAnswer(
        new Answer<Deferred<PartitionResponse>>() {
      @Override
      public Deferred<PartitionResponse> answer(
          final InvocationOnMock invocation) throws Throwable {
        final SearchRequest request = invocation.getArgument(0);
        return Deferred.fromResult(PartitionResponse.newBuilder()
            .addPartition(request.getStartTime(), request.getEndTime())
            .build());
      }
    });
  }

  /** Answers each search with one row holding the partition start. */
  private void respond() {
    when(runtime.search.search(any(SearchRequest.class))).thenAnswer(
        new Answer<Deferred<SearchResponse>>() {
      @Override
      public Deferred<SearchResponse> answer(final InvocationOnMock invocation)
          throws Throwable {
        final SearchRequest request = invocation.getArgument(0);
        final ArrayNode hits = JsonNodeFactory.instance.arrayNode();
        hits.addObject().put("start", request.getStartTime());
        return Deferred.fromResult(
            new SearchResponse(hits, new ResultMetaData()));
      }
    });
  }

  static final class FakeVariables implements VariableSource {
    final List<VariableListener> listeners = Lists.newArrayList();
    List<Variable> variables = Lists.newArrayList();

    @Override
    public List<Variable> getVariables() {
      return variables;
    }

    @Override
    public void subscribe(final VariableListener listener) {
      listeners.add(listener);
    }

    @Override
    public void unsubscribe(final VariableListener listener) {
      listeners.remove(listener);
    }

    void update(final List<Variable> variables) {
      this.variables = variables;
      for (final VariableListener listener : Lists.newArrayList(listeners)) {
        listener.onVariablesChanged(variables);
      }
    }
  }

  static final class FakeVisibility implements VisibilitySignal {
    final List<VisibilityListener> listeners = Lists.newArrayList();
    boolean visible;

    @Override
    public boolean isVisible() {
      return visible;
    }

    @Override
    public void subscribe(final VisibilityListener listener) {
      listeners.add(listener);
    }

    @Override
    public void unsubscribe(final VisibilityListener listener) {
      listeners.remove(listener);
    }

    void change(final boolean visible) {
      this.visible = visible;
      for (final VisibilityListener listener : Lists.newArrayList(listeners)) {
        listener.onVisibilityChanged(visible);
      }
    }
  }
}
