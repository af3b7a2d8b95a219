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

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;
import net.opendash.cache.CacheFingerprint;
import net.opendash.cache.PanelCacheGateway;
import net.opendash.core.DashboardRuntime;
import net.opendash.core.LoadCycle;
import net.opendash.exceptions.QueryExecutionCanceled;
import net.opendash.panel.PanelIdentity;
import net.opendash.panel.PanelQuery;
import net.opendash.panel.PanelSchema;
import net.opendash.panel.TimeRange;
import net.opendash.state.Annotation;
import net.opendash.state.ErrorDetail;
import net.opendash.state.LoadState;
import net.opendash.state.LoadStateView;
import net.opendash.state.QueryMetadata;
import net.opendash.state.ResultAccumulator;
import net.opendash.state.ResultMetaData;
import net.opendash.transpile.QueryTranspiler;
import net.opendash.transpile.TranspiledQuery;
import net.opendash.transport.HttpStreamTransport;
import net.opendash.transport.PartitionedHttpTransport;
import net.opendash.transport.PromqlRangeExecutor;
import net.opendash.transport.PushSocketTransport;
import net.opendash.transport.TransportContext;
import net.opendash.transport.TransportOutcome;
import net.opendash.transport.TransportRequest;
import net.opendash.transport.TransportSelector;
import net.opendash.transport.TransportStrategy;
import net.opendash.utils.DateTime;
import net.opendash.utils.Exceptions;
import net.opendash.variables.Variable;
import net.opendash.variables.VariableDependencyTracker;
import net.opendash.variables.VariableSnapshot;
import net.opendash.variables.VariableSource;

/**
 * Drives the loading of one panel. Every trigger (a schema, range or
 * force flag change, a relevant variable change, a stream reset or an
 * explicit {@link #loadData()}) starts a new {@link LoadCycle} that
 * cancels the previous one, then goes through these steps:
 * <ol>
 * <li>Debounce, so bursts of changes run once.</li>
 * <li>Wait for the panel to be visible, unless the load is forced.</li>
 * <li>Wait for the variables the queries reference to resolve.</li>
 * <li>On the very first cycle, try to restore the panel from cache.</li>
 * <li>Run the queries: PromQL all at once, SQL one after the other
 * through the configured transport, with a slot per time shift.</li>
 * </ol>
 * Every wait and network call observes the cycle so a superseded cycle
 * stops writing to the state as soon as it's cancelled.
 * <p>
 * Consumers read the state through {@link #getState()} and subscribe
 * to it for change notifications.
 *
 * @since 1.0
 */
public class PanelDataLoader {
  private static final Logger LOG = LoggerFactory.getLogger(
      PanelDataLoader.class);

  public static final String DEBOUNCE_KEY = "dashboard.loader.debounce.ms";

  private final DashboardRuntime runtime;
  private final PanelIdentity identity;
  private final VariableSource variable_source;
  private final VisibilitySignal visibility;
  private final CancelChannel cancel_channel;

  private final LoadState state;
  private final ResultAccumulator accumulator;
  private final PanelCacheGateway cache;
  private final QueryTranspiler transpiler;
  private final VariableDependencyTracker tracker;
  private final TransportSelector selector;
  private final PromqlRangeExecutor promql;
  private final Context context;
  private final AtomicLong cycle_ids;

  private final VariableSource.VariableListener variable_listener;
  private final VisibilitySignal.VisibilityListener visibility_listener;
  private final CancelChannel.CancelListener cancel_listener;

  private volatile PanelSchema schema;
  private volatile TimeRange range;
  private volatile boolean force_load;
  private volatile Integer width_px;

  /** The fields below are guarded by this. */
  private LoadCycle cycle;
  private LoaderState loader_state;
  private int run_count;
  private boolean started;
  private boolean closed;
  private VariableSnapshot last_variables;
  private Deferred<Object> visibility_wait;
  private Deferred<Object> variable_wait;
  private CacheFingerprint fingerprint;
  private TimeRange cycle_range;
  private TransportStrategy active_strategy;

  /**
   * Default ctor. Nothing runs until {@link #start()}.
   * @param runtime The non-null runtime.
   * @param identity The non-null identity of the panel.
   * @param schema The panel definition, may be null if not known yet.
   * @param range The requested range, may be null if not known yet.
   * @param variable_source The dashboard's variables, may be null if the
   * dashboard has none.
   * @param visibility The visibility signal, null to treat the panel as
   * always visible.
   * @param cancel_channel The dashboard's cancel channel, may be null.
   */
  public PanelDataLoader(final DashboardRuntime runtime,
                         final PanelIdentity identity,
                         final PanelSchema schema,
                         final TimeRange range,
                         final VariableSource variable_source,
                         final VisibilitySignal visibility,
                         final CancelChannel cancel_channel) {
    if (runtime == null) {
      throw new IllegalArgumentException("Runtime cannot be null.");
    }
    if (identity == null) {
      throw new IllegalArgumentException("Identity cannot be null.");
    }
    this.runtime = runtime;
    this.identity = identity;
    this.schema = schema;
    this.range = range;
    this.variable_source = variable_source;
    this.visibility = visibility;
    this.cancel_channel = cancel_channel;

    if (!runtime.getConfig().hasProperty(DEBOUNCE_KEY)) {
      runtime.getConfig().register(DEBOUNCE_KEY, 50L, true,
          "How long in milliseconds to wait after a trigger before "
          + "loading, so that bursts of changes load once.");
    }

    state = new LoadState();
    accumulator = new ResultAccumulator(state);
    cache = new PanelCacheGateway(runtime.getCacheStore(), identity);
    transpiler = new QueryTranspiler(runtime.getConfig(),
        runtime.getQueryRewriter());
    tracker = new VariableDependencyTracker();
    selector = new TransportSelector(runtime.getConfig(),
        new PartitionedHttpTransport(runtime.getSearchService(),
            runtime.getConfig()),
        runtime.getPushSocketClient() == null ? null :
          new PushSocketTransport(runtime.getPushSocketClient(),
              runtime.getConfig()),
        runtime.getHttpStreamClient() == null ? null :
          new HttpStreamTransport(runtime.getHttpStreamClient(),
              runtime.getConfig()));
    promql = new PromqlRangeExecutor(runtime.getSearchService());
    context = new Context();
    cycle_ids = new AtomicLong();
    loader_state = LoaderState.IDLE;

    variable_listener = new VariableSource.VariableListener() {
      @Override
      public void onVariablesChanged(final List<Variable> variables) {
        handleVariables(variables);
      }
    };
    visibility_listener = new VisibilitySignal.VisibilityListener() {
      @Override
      public void onVisibilityChanged(final boolean visible) {
        handleVisibility(visible);
      }
    };
    cancel_listener = new CancelChannel.CancelListener() {
      @Override
      public void onCancelRequested() {
        cancelQuery();
      }
    };
  }

  /**
   * Subscribes to the collaborators and runs the first load.
   * @return The deferred of the first cycle.
   * @throws IllegalStateException if already started or closed.
   */
  public Deferred<LoaderState> start() {
    synchronized (this) {
      if (started || closed) {
        throw new IllegalStateException("Loader for panel " + identity
            + " was already started.");
      }
      started = true;
      if (schema != null) {
        last_variables = tracker.snapshot(schema, variables());
      }
    }
    if (variable_source != null) {
      variable_source.subscribe(variable_listener);
    }
    if (visibility != null) {
      visibility.subscribe(visibility_listener);
    }
    if (cancel_channel != null) {
      cancel_channel.subscribe(cancel_listener);
    }
    return loadData();
  }

  /**
   * Updates the panel definition, reloading if it changed.
   * @param schema The non-null definition.
   */
  public void setPanelSchema(final PanelSchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    if (schema.equals(this.schema)) {
      return;
    }
    this.schema = schema;
    trigger();
  }

  /**
   * Updates the requested range, reloading if it changed.
   * @param range The non-null range.
   */
  public void setTimeRange(final TimeRange range) {
    if (range == null) {
      throw new IllegalArgumentException("Range cannot be null.");
    }
    if (range.equals(this.range)) {
      return;
    }
    this.range = range;
    trigger();
  }

  /**
   * Sets the force reload flag, reloading if it changed. A forced load
   * skips the visibility wait.
   * @param force_load The flag.
   */
  public void setForceLoad(final boolean force_load) {
    if (this.force_load == force_load) {
      return;
    }
    this.force_load = force_load;
    trigger();
  }

  /**
   * Sets the rendered width used for the interval variables. Doesn't
   * reload.
   * @param width_px The width in pixels or null if unknown.
   */
  public void setWidth(final Integer width_px) {
    this.width_px = width_px;
  }

  /**
   * Starts a new load cycle, cancelling the one in flight.
   * @return A deferred resolving with the terminal state of the cycle.
   * Never resolves with an exception.
   */
  public Deferred<LoaderState> loadData() {
    final LoadCycle current;
    final LoadCycle previous;
    synchronized (this) {
      if (closed) {
        return Deferred.fromResult(LoaderState.CANCELLED);
      }
      previous = cycle;
      current = new LoadCycle(cycle_ids.incrementAndGet());
      cycle = current;
      fingerprint = null;
      cycle_range = null;
      if (run_count > 0 && !state.isOperationCancelled()) {
        state.setPartialData(false);
      }
    }
    if (previous != null) {
      previous.cancel();
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Starting load cycle " + current.id() + " for panel "
          + identity);
    }

    state.resetProgress();
    final PanelSchema panel = schema;
    if (panel == null || !panel.hasExecutableQuery()) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Panel " + identity + " has no query to execute");
      }
      state.reset();
      state.publish();
      transition(current, LoaderState.COMPLETED);
      return Deferred.fromResult(LoaderState.COMPLETED);
    }
    transition(current, LoaderState.DEBOUNCING);

    class VisibilityCB implements Callback<Deferred<Object>, Object> {
      @Override
      public Deferred<Object> call(final Object ignored) throws Exception {
        state.setLastTriggeredAt(DateTime.currentTimeMillis());
        transition(current, LoaderState.AWAITING_VISIBILITY);
        return current.guard(awaitVisibility(current));
      }
    }

    class VariablesCB implements Callback<Deferred<Object>, Object> {
      @Override
      public Deferred<Object> call(final Object ignored) throws Exception {
        transition(current, LoaderState.AWAITING_VARIABLES);
        return current.guard(awaitVariables(current, panel));
      }
    }

    class ExecuteCB implements Callback<Deferred<LoaderState>, Object> {
      @Override
      public Deferred<LoaderState> call(final Object ignored)
          throws Exception {
        current.checkCancelled();
        transition(current, LoaderState.EXECUTING);
        return execute(current, panel);
      }
    }

    class ErrorCB implements Callback<LoaderState, Exception> {
      @Override
      public LoaderState call(final Exception e) throws Exception {
        final Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof QueryExecutionCanceled || current.isCancelled()) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Load cycle " + current.id() + " for panel "
                + identity + " was cancelled");
          }
          return LoaderState.CANCELLED;
        }
        LOG.error("Failed to load panel " + identity, cause);
        state.setLoading(false);
        state.setOperationCancelled(false);
        state.setErrorDetail(ErrorDetail.fromSql(cause, false));
        state.publish();
        return LoaderState.FAILED;
      }
    }

    class DoneCB implements Callback<LoaderState, LoaderState> {
      @Override
      public LoaderState call(final LoaderState outcome) throws Exception {
        transition(current, outcome);
        return outcome;
      }
    }

    return current.guard(debounce(current))
        .addCallbackDeferring(new VisibilityCB())
        .addCallbackDeferring(new VariablesCB())
        .addCallbackDeferring(new ExecuteCB())
        .addErrback(new ErrorCB())
        .addCallback(new DoneCB());
  }

  /**
   * Stops the running cycle on the user's request: data is flagged
   * partial and cancelled, in flight searches are cancelled at the back
   * end and the state is saved.
   */
  public void cancelQuery() {
    final LoadCycle current;
    final TransportStrategy strategy;
    synchronized (this) {
      current = cycle;
      strategy = active_strategy;
    }
    if (current == null) {
      return;
    }
    LOG.info("Cancelling load cycle " + current.id() + " of panel "
        + identity + " on request");
    state.setLoading(false);
    state.setOperationCancelled(true);
    state.setPartialData(true);
    cancelTraceIds(strategy);
    current.cancel();
    context.saveToCache();
  }

  /**
   * Tears the loader down: cancels the running cycle and its searches and
   * unsubscribes from every collaborator. Data still loading is flagged
   * partial.
   */
  public void close() {
    final LoadCycle current;
    final TransportStrategy strategy;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      current = cycle;
      strategy = active_strategy;
      visibility_wait = null;
      variable_wait = null;
    }
    if (current != null) {
      if ((state.isLoading() || state.getLoadingProgressPercentage() < 100) &&
          !state.isOperationCancelled()) {
        state.setPartialData(true);
      }
      cancelTraceIds(strategy);
      current.cancel();
    }
    if (variable_source != null) {
      variable_source.unsubscribe(variable_listener);
    }
    if (visibility != null) {
      visibility.unsubscribe(visibility_listener);
    }
    if (cancel_channel != null) {
      cancel_channel.unsubscribe(cancel_listener);
    }
    state.publish();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Closed loader for panel " + identity);
    }
  }

  /** @return The read only state of the panel. */
  public LoadStateView getState() {
    return state;
  }

  /** @return Where the current cycle is. */
  public synchronized LoaderState getLoaderState() {
    return loader_state;
  }

  /** @return The panel's identity. */
  public PanelIdentity getIdentity() {
    return identity;
  }

  @VisibleForTesting
  synchronized LoadCycle currentCycle() {
    return cycle;
  }

  @VisibleForTesting
  TransportContext context() {
    return context;
  }

  /**
   * Runs the restore attempt on the first cycle, then the queries.
   * @param current The cycle.
   * @param panel The definition captured when the cycle started.
   * @return The deferred outcome.
   */
  private Deferred<LoaderState> execute(final LoadCycle current,
                                        final PanelSchema panel) {
    final TimeRange requested = range;
    final VariableSnapshot variables = tracker.snapshot(panel, variables());
    final CacheFingerprint key = CacheFingerprint.of(panel, variables,
        force_load, identity);
    final boolean first_run;
    synchronized (this) {
      current.checkCancelled();
      fingerprint = key;
      cycle_range = requested;
      first_run = run_count == 0;
    }
    if (!first_run) {
      return run(current, panel, requested, variables);
    }

    class RestoreCB implements Callback<Deferred<LoaderState>, Boolean> {
      @Override
      public Deferred<LoaderState> call(final Boolean restored)
          throws Exception {
        current.checkCancelled();
        if (restored) {
          synchronized (PanelDataLoader.this) {
            run_count++;
          }
          state.setLoading(false);
          state.setOperationCancelled(false);
          state.publish();
          return Deferred.fromResult(LoaderState.COMPLETED);
        }
        return run(current, panel, requested, variables);
      }
    }

    return current.guard(cache.restore(state, key, requested))
        .addCallbackDeferring(new RestoreCB());
  }

  /**
   * Runs the queries over the network.
   * @param current The cycle.
   * @param panel The definition.
   * @param requested The requested range.
   * @param variables The resolved variables.
   * @return The deferred outcome.
   */
  private Deferred<LoaderState> run(final LoadCycle current,
                                    final PanelSchema panel,
                                    final TimeRange requested,
                                    final VariableSnapshot variables) {
    if (requested == null) {
      LOG.warn("No time range for panel " + identity + ", not loading.");
      state.setLoading(false);
      state.publish();
      return Deferred.fromResult(LoaderState.COMPLETED);
    }
    if (tracker.hasEmptyValue(variables)) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Skipping panel " + identity + " as a variable it "
            + "references is empty: " + variables);
      }
      state.setLoading(false);
      state.publish();
      return Deferred.fromResult(LoaderState.COMPLETED);
    }

    synchronized (this) {
      run_count++;
      last_variables = variables;
    }
    state.setLoading(true);
    state.setCachedDataDiffers(false);
    state.clearErrorDetail();
    state.publish();

    final Deferred<List<Annotation>> annotations =
        fetchAnnotations(panel, requested);
    final Deferred<LoaderState> data = panel.isPromql() ?
        runPromql(current, panel, requested, variables) :
        runSql(current, panel, requested, variables);

    class AnnotationsCB implements Callback<Deferred<LoaderState>,
        LoaderState> {
      @Override
      public Deferred<LoaderState> call(final LoaderState outcome)
          throws Exception {
        if (outcome == LoaderState.CANCELLED) {
          return Deferred.fromResult(outcome);
        }

        class SetCB implements Callback<LoaderState, List<Annotation>> {
          @Override
          public LoaderState call(final List<Annotation> list)
              throws Exception {
            if (current.isCancelled()) {
              return LoaderState.CANCELLED;
            }
            state.setAnnotations(list);
            context.saveToCache();
            return outcome;
          }
        }

        return annotations.addCallback(new SetCB());
      }
    }

    return data.addCallbackDeferring(new AnnotationsCB());
  }

  /**
   * Runs the PromQL queries at once, one slot each.
   */
  private Deferred<LoaderState> runPromql(final LoadCycle current,
                                          final PanelSchema panel,
                                          final TimeRange requested,
                                          final VariableSnapshot variables) {
    final List<PanelQuery> queries = panel.getQueries();
    final List<TransportRequest> requests =
        Lists.newArrayListWithExpectedSize(queries.size());
    final List<QueryMetadata> metadata =
        Lists.newArrayListWithExpectedSize(queries.size());
    for (int i = 0; i < queries.size(); i++) {
      final PanelQuery query = queries.get(i);
      final TranspiledQuery transpiled = transpiler.transpile(
          query.getQuery(), requested, width_px, panel.getQueryType(),
          variables);
      requests.add(new TransportRequest(transpiled.getQuery(), query,
          requested, i));
      metadata.add(queryMetadata(panel, query, transpiled, requested, 0,
          null));
    }

    class ResultsCB implements Callback<LoaderState, List<JsonNode>> {
      @Override
      public LoaderState call(final List<JsonNode> results) throws Exception {
        if (current.isCancelled()) {
          return LoaderState.CANCELLED;
        }
        boolean failed = false;
        final List<ArrayNode> rows =
            Lists.newArrayListWithExpectedSize(results.size());
        final List<ResultMetaData> metas =
            Lists.newArrayListWithExpectedSize(results.size());
        for (final JsonNode result : results) {
          final ResultMetaData meta = new ResultMetaData();
          if (result == null) {
            failed = true;
            rows.add(null);
          } else {
            final JsonNode series = result.get("result");
            rows.add(series != null && series.isArray() ?
                (ArrayNode) series : null);
            if (result.has("resultType")) {
              meta.setOther("result_type", result.get("resultType"));
            }
          }
          metas.add(meta);
        }
        synchronized (state) {
          state.replaceData(rows);
          for (int i = 0; i < metas.size(); i++) {
            state.setResultMetaData(i, metas.get(i));
          }
          state.replaceQueryMetadata(metadata);
          state.setLoading(false);
          if (!failed) {
            state.setProgressPercentage(100);
          }
        }
        context.saveToCache();
        return failed ? LoaderState.FAILED : LoaderState.COMPLETED;
      }
    }

    return promql.execute(requests, panel.getStepValue(), current, context)
        .addCallback(new ResultsCB());
  }

  /**
   * Runs the SQL queries one after the other through the configured
   * transport. Each query gets a slot for the unshifted range followed by
   * one per time shift.
   */
  private Deferred<LoaderState> runSql(final LoadCycle current,
                                       final PanelSchema panel,
                                       final TimeRange requested,
                                       final VariableSnapshot variables) {
    state.clearResults();
    state.setOperationCancelled(false);

    final List<TransportRequest> requests = Lists.newArrayList();
    int slot = 0;
    for (final PanelQuery query : panel.getQueries()) {
      final List<String> offsets = Lists.newArrayList((String) null);
      offsets.addAll(query.getTimeShift());
      for (final String offset : offsets) {
        final long seconds = offset == null ? 0 :
            DateTime.offsetToSeconds(offset, requested.getEndTime() / 1000);
        final TimeRange shifted = requested.shiftBack(seconds);
        final TranspiledQuery transpiled = transpiler.transpile(
            query.getQuery(), shifted, width_px, panel.getQueryType(),
            variables);
        state.setQueryMetadata(slot, queryMetadata(panel, query, transpiled,
            shifted, seconds, offset));
        state.ensureSlot(slot);
        requests.add(new TransportRequest(transpiled.getQuery(), query,
            shifted, slot++));
      }
    }
    state.publish();

    final TransportStrategy strategy = selector.select();
    synchronized (this) {
      active_strategy = strategy;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Running " + requests.size() + " queries for panel "
          + identity + " via " + strategy.name());
    }

    /** Runs the next query once the previous one settled. */
    class QueryLoop implements Callback<Deferred<LoaderState>,
        TransportOutcome> {
      private int index = -1;
      private boolean failed;

      @Override
      public Deferred<LoaderState> call(final TransportOutcome outcome)
          throws Exception {
        if (index >= 0) {
          if (outcome == TransportOutcome.CANCELLED || current.isCancelled()) {
            return Deferred.fromResult(LoaderState.CANCELLED);
          }
          if (outcome == TransportOutcome.FAILED) {
            failed = true;
          }
          context.saveToCache();
        }
        index++;
        if (index >= requests.size()) {
          state.setLoading(false);
          context.saveToCache();
          return Deferred.fromResult(failed ?
              LoaderState.FAILED : LoaderState.COMPLETED);
        }
        state.setLoading(true);
        return strategy.execute(requests.get(index), current, context)
            .addCallbackDeferring(this);
      }
    }

    return Deferred.fromResult((TransportOutcome) null)
        .addCallbackDeferring(new QueryLoop());
  }

  private QueryMetadata queryMetadata(final PanelSchema panel,
                                      final PanelQuery query,
                                      final TranspiledQuery transpiled,
                                      final TimeRange effective,
                                      final long shift_seconds,
                                      final String shift_period) {
    return QueryMetadata.newBuilder()
        .setOriginalQuery(query.getQuery())
        .setQuery(transpiled.getQuery())
        .setStartTime(effective.getStartTime())
        .setEndTime(effective.getEndTime())
        .setQueryType(panel.getQueryType())
        .setVariables(transpiled.getSubstitutions())
        .setTimeShiftSeconds(shift_seconds)
        .setTimeShiftPeriod(shift_period == null ? "" : shift_period)
        .build();
  }

  /**
   * Fetches annotations for panel types that draw them. Failures are
   * logged and yield an empty list.
   */
  private Deferred<List<Annotation>> fetchAnnotations(final PanelSchema panel,
                                                      final TimeRange requested) {
    if (!panel.requiresAnnotations() ||
        runtime.getAnnotationService() == null) {
      return Deferred.fromResult(Collections.<Annotation>emptyList());
    }

    class ErrorCB implements Callback<List<Annotation>, Exception> {
      @Override
      public List<Annotation> call(final Exception e) throws Exception {
        LOG.warn("Failed to fetch annotations for panel " + identity, e);
        return Collections.emptyList();
      }
    }

    try {
      return runtime.getAnnotationService()
          .fetch(runtime.getOrgIdentifier(), identity, requested)
          .addErrback(new ErrorCB());
    } catch (Exception e) {
      LOG.warn("Failed to fetch annotations for panel " + identity, e);
      return Deferred.fromResult(Collections.<Annotation>emptyList());
    }
  }

  /**
   * Starts the debounce timer. Cancelling the cycle cancels the timer.
   */
  private Deferred<Object> debounce(final LoadCycle current) {
    final Deferred<Object> deferred = new Deferred<Object>();
    final Timeout timeout = runtime.getTimer().newTimeout(new TimerTask() {
      @Override
      public void run(final Timeout ignored) throws Exception {
        deferred.callback(null);
      }
    }, runtime.getConfig().getLong(DEBOUNCE_KEY), TimeUnit.MILLISECONDS);
    current.onCancel(new LoadCycle.CancelHook() {
      @Override
      public void onCancel() {
        timeout.cancel();
      }
    });
    return deferred;
  }

  /**
   * Resolves right away if the load is forced or the panel is visible,
   * otherwise once the panel becomes visible.
   */
  private Deferred<Object> awaitVisibility(final LoadCycle current) {
    if (force_load || visibility == null || visibility.isVisible()) {
      return Deferred.fromResult(null);
    }
    final Deferred<Object> wait = new Deferred<Object>();
    synchronized (this) {
      visibility_wait = wait;
    }
    current.onCancel(new LoadCycle.CancelHook() {
      @Override
      public void onCancel() {
        synchronized (PanelDataLoader.this) {
          if (visibility_wait == wait) {
            visibility_wait = null;
          }
        }
      }
    });
    // the panel may have become visible in the meantime
    if (visibility.isVisible()) {
      handleVisibility(true);
    }
    return wait;
  }

  /**
   * Resolves right away if every variable the panel needs is resolved,
   * otherwise on the first variable change after which they are.
   */
  private Deferred<Object> awaitVariables(final LoadCycle current,
                                          final PanelSchema panel) {
    final Deferred<Object> wait;
    synchronized (this) {
      if (tracker.isResolved(tracker.snapshot(panel, variables()))) {
        return Deferred.fromResult(null);
      }
      wait = new Deferred<Object>();
      variable_wait = wait;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Panel " + identity + " is waiting on variables");
    }
    current.onCancel(new LoadCycle.CancelHook() {
      @Override
      public void onCancel() {
        synchronized (PanelDataLoader.this) {
          if (variable_wait == wait) {
            variable_wait = null;
          }
        }
      }
    });
    return wait;
  }

  private void handleVisibility(final boolean visible) {
    if (!visible) {
      return;
    }
    final Deferred<Object> wait;
    synchronized (this) {
      wait = visibility_wait;
      visibility_wait = null;
    }
    if (wait != null) {
      wait.callback(null);
    }
  }

  /**
   * Resolves a pending variable wait once everything resolved, otherwise
   * reloads if the values the panel depends on changed.
   */
  private void handleVariables(final List<Variable> variables) {
    final PanelSchema panel = schema;
    if (panel == null) {
      return;
    }
    final VariableSnapshot snapshot = tracker.snapshot(panel, variables);
    final Deferred<Object> wait;
    boolean reload = false;
    synchronized (this) {
      if (closed) {
        return;
      }
      if (variable_wait != null) {
        if (!tracker.isResolved(snapshot)) {
          return;
        }
        wait = variable_wait;
        variable_wait = null;
      } else {
        wait = null;
        if (tracker.changed(last_variables, snapshot)) {
          last_variables = snapshot;
          reload = true;
        }
      }
    }
    if (wait != null) {
      wait.callback(null);
    } else if (reload) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Variables of panel " + identity + " changed, reloading");
      }
      loadData();
    }
  }

  private void cancelTraceIds(final TransportStrategy strategy) {
    final Set<String> trace_ids = state.getSearchRequestTraceIds();
    if (trace_ids.isEmpty()) {
      return;
    }
    if (strategy != null) {
      try {
        strategy.cancelTraceIds(trace_ids, runtime.getOrgIdentifier());
      } catch (RuntimeException e) {
        LOG.warn("Failed to cancel searches " + trace_ids + " of panel "
            + identity, e);
      }
    }
    state.clearTraceIds();
  }

  private synchronized void transition(final LoadCycle current,
                                       final LoaderState next) {
    if (current != cycle) {
      return;
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Panel " + identity + " cycle " + current.id() + ": "
          + loader_state + " -> " + next);
    }
    loader_state = next;
  }

  private void trigger() {
    final boolean run;
    synchronized (this) {
      run = started && !closed;
    }
    if (run) {
      loadData();
    }
  }

  private List<Variable> variables() {
    return variable_source == null ?
        Collections.<Variable>emptyList() : variable_source.getVariables();
  }

  /** The view of this loader handed to the transports. */
  private class Context implements TransportContext {
    @Override
    public LoadState state() {
      return state;
    }

    @Override
    public ResultAccumulator accumulator() {
      return accumulator;
    }

    @Override
    public void saveToCache() {
      final CacheFingerprint key;
      final TimeRange saved_range;
      synchronized (PanelDataLoader.this) {
        key = fingerprint;
        saved_range = cycle_range;
      }
      state.publish();
      if (key == null) {
        return;
      }
      cache.save(state, key, saved_range);
    }

    @Override
    public void reload() {
      loadData();
    }

    @Override
    public String orgId() {
      return runtime.getOrgIdentifier();
    }

    @Override
    public PanelIdentity identity() {
      return identity;
    }
  }

  @Override
  public String toString() {
    return "identity=" + identity + ", state=" + getLoaderState();
  }
}
