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

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.stumbleupon.async.Deferred;

import net.opendash.core.LoadCycle;
import net.opendash.search.StreamMessage;
import net.opendash.search.StreamMessageType;
import net.opendash.state.ErrorDetail;
import net.opendash.state.LoadState;
import net.opendash.state.ResultAccumulator;

/**
 * One streamed search for one slot. Routes each message into the
 * accumulator and resolves its deferred exactly once, on the terminal
 * message, a failure, the stream closing or the cycle being cancelled.
 * Messages arriving after that are dropped.
 *
 * @since 1.0
 */
abstract class StreamSession {
  private static final Logger LOG = LoggerFactory.getLogger(
      StreamSession.class);

  public static final String UNKNOWN_ERROR =
      "Unknown error in search response";

  protected final TransportRequest request;
  protected final LoadCycle cycle;
  protected final TransportContext context;
  protected final String trace_id;

  private final Deferred<TransportOutcome> deferred;
  private final AtomicBoolean settled;
  private final LoadCycle.CancelHook hook;

  /**
   * Default ctor. Registers a cancel hook on the cycle that releases the
   * stream and resolves with {@link TransportOutcome#CANCELLED}.
   * @param request The request.
   * @param cycle The governing cycle.
   * @param context The loader's context.
   * @param trace_id The trace id of the search.
   */
  StreamSession(final TransportRequest request,
                final LoadCycle cycle,
                final TransportContext context,
                final String trace_id) {
    this.request = request;
    this.cycle = cycle;
    this.context = context;
    this.trace_id = trace_id;
    deferred = new Deferred<TransportOutcome>();
    settled = new AtomicBoolean();
    hook = new LoadCycle.CancelHook() {
      @Override
      public void onCancel() {
        settle(TransportOutcome.CANCELLED);
      }
    };
  }

  /** Drops the collaborator's listeners for this search. */
  abstract void release();

  /** @return The deferred resolved once the stream is done. */
  Deferred<TransportOutcome> deferred() {
    return deferred;
  }

  /** Attaches to the cycle. Must be called before the stream opens. */
  void attach() {
    cycle.onCancel(hook);
  }

  /** @return Whether or not the session already resolved. */
  boolean isSettled() {
    return settled.get();
  }

  /**
   * Resolves the session if it wasn't already. Releases listeners and
   * stops tracking the trace id.
   * @param outcome The outcome.
   * @return True if this call resolved the session.
   */
  boolean settle(final TransportOutcome outcome) {
    if (!settled.compareAndSet(false, true)) {
      return false;
    }
    cycle.removeHook(hook);
    context.state().removeTraceId(trace_id);
    try {
      release();
    } catch (RuntimeException e) {
      LOG.warn("Failed to release stream " + trace_id, e);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Stream " + trace_id + " for slot " + request.getSlot()
          + " finished with " + outcome);
    }
    deferred.callback(outcome);
    return true;
  }

  /**
   * Applies one streamed message.
   * @param message The message.
   */
  void handle(final StreamMessage message) {
    if (settled.get()) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Dropping message " + message.getRawType()
            + " for finished stream " + trace_id);
      }
      return;
    }
    final LoadState state = context.state();
    final ResultAccumulator accumulator = context.accumulator();
    final int slot = request.getSlot();
    final JsonNode content = message.getContent();
    try {
      final StreamMessageType type = message.getType();
      if (type == null) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Ignoring unknown message type " + message.getRawType()
              + " on stream " + trace_id);
        }
        return;
      }
      switch (type) {
      case SEARCH_RESPONSE_METADATA:
        accumulator.applyStreamMetadata(slot, content);
        state.publish();
        break;
      case SEARCH_RESPONSE_HITS:
        accumulator.applyStreamHits(slot, content);
        state.publish();
        break;
      case SEARCH_RESPONSE:
        accumulator.applyStreamResponse(slot, content);
        state.publish();
        break;
      case EVENT_PROGRESS:
        accumulator.applyStreamProgress(content);
        context.saveToCache();
        break;
      case END:
        accumulator.applyStreamEnd();
        context.saveToCache();
        settle(TransportOutcome.COMPLETED);
        break;
      case ERROR:
        fail(content);
        break;
      default:
        throw new IllegalStateException("Unhandled message type " + type);
      }
    } catch (RuntimeException e) {
      LOG.error("Failed to apply message " + message.getRawType()
          + " on stream " + trace_id, e);
      state.setLoading(false);
      state.setErrorDetail(ErrorDetail.of(UNKNOWN_ERROR, ""));
      state.publish();
      settle(TransportOutcome.FAILED);
    }
  }

  /**
   * Records a terminal error from the back end.
   * @param content The error content.
   */
  void fail(final JsonNode content) {
    if (settled.get()) {
      return;
    }
    final ErrorDetail error = ErrorDetail.fromStreamError(content);
    LOG.warn("Stream " + trace_id + " for slot " + request.getSlot()
        + " failed: " + error);
    context.accumulator().applyStreamError(error);
    context.state().publish();
    settle(TransportOutcome.FAILED);
  }

  /** The stream was re-established, persist and start over. */
  void reset() {
    context.saveToCache();
    settle(TransportOutcome.CANCELLED);
    context.reload();
  }
}
