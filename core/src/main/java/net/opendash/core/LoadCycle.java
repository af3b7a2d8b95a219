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
package net.opendash.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.opendash.exceptions.QueryExecutionCanceled;

/**
 * The cancellation token of one load cycle. A panel's loader creates a
 * new cycle for every trigger and cancels the previous one. Every wait
 * and network call of the cycle either checks {@link #isCancelled()} or
 * is wrapped with {@link #guard(Deferred)} so it unwinds as soon as the
 * cycle is cancelled.
 *
 * @since 1.0
 */
public class LoadCycle {
  private static final Logger LOG = LoggerFactory.getLogger(LoadCycle.class);

  /** Something to run when the cycle is cancelled. */
  public interface CancelHook {
    public void onCancel();
  }

  private final long id;
  private final AtomicBoolean cancelled;
  private final List<CancelHook> hooks;

  /**
   * Default ctor.
   * @param id A sequence number for logging.
   */
  public LoadCycle(final long id) {
    this.id = id;
    cancelled = new AtomicBoolean();
    hooks = new CopyOnWriteArrayList<CancelHook>();
  }

  /** @return The sequence number. */
  public long id() {
    return id;
  }

  /** @return Whether or not the cycle was cancelled. */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Cancels the cycle and runs the hooks. Only the first call has any
   * effect.
   * @return True if this call cancelled the cycle.
   */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Cancelling load cycle " + id);
    }
    for (final CancelHook hook : hooks) {
      try {
        hook.onCancel();
      } catch (Throwable t) {
        LOG.error("Failed to run cancel hook for cycle " + id, t);
      }
    }
    hooks.clear();
    return true;
  }

  /**
   * Registers a hook. If the cycle was already cancelled the hook runs
   * right away.
   * @param hook A non-null hook.
   */
  public void onCancel(final CancelHook hook) {
    hooks.add(hook);
    if (cancelled.get() && hooks.remove(hook)) {
      hook.onCancel();
    }
  }

  /**
   * Removes a hook that's no longer needed.
   * @param hook The hook.
   */
  public void removeHook(final CancelHook hook) {
    hooks.remove(hook);
  }

  /**
   * @throws QueryExecutionCanceled if the cycle was cancelled.
   */
  public void checkCancelled() {
    if (cancelled.get()) {
      throw new QueryExecutionCanceled("Load cycle " + id + " was cancelled");
    }
  }

  /**
   * Wraps a pending call so that the returned deferred resolves with a
   * {@link QueryExecutionCanceled} as soon as the cycle is cancelled. A
   * result arriving after that is dropped.
   * @param deferred The pending call.
   * @return A deferred resolving with the call's result or the
   * cancellation, whichever comes first.
   */
  public <T> Deferred<T> guard(final Deferred<T> deferred) {
    final Deferred<T> guarded = new Deferred<T>();
    final AtomicBoolean done = new AtomicBoolean();

    final CancelHook hook = new CancelHook() {
      @Override
      public void onCancel() {
        if (done.compareAndSet(false, true)) {
          guarded.callback(new QueryExecutionCanceled(
              "Load cycle " + id + " was cancelled"));
        }
      }
    };

    class Completer {
      void complete(final Object result) {
        if (done.compareAndSet(false, true)) {
          removeHook(hook);
          guarded.callback(result);
        } else if (LOG.isDebugEnabled()) {
          LOG.debug("Dropping a result that arrived after cycle " + id
              + " was cancelled");
        }
      }
    }
    final Completer completer = new Completer();

    class ResultCB implements Callback<Object, T> {
      @Override
      public Object call(final T result) throws Exception {
        completer.complete(result);
        return null;
      }
    }

    class ErrorCB implements Callback<Object, Exception> {
      @Override
      public Object call(final Exception e) throws Exception {
        completer.complete(e);
        return null;
      }
    }

    onCancel(hook);
    deferred.addCallbacks(new ResultCB(), new ErrorCB());
    return guarded;
  }

  @Override
  public String toString() {
    return "id=" + id + ", cancelled=" + cancelled.get();
  }
}
