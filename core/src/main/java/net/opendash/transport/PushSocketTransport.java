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

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;
import com.stumbleupon.async.Deferred;

import net.opendash.configuration.Configuration;
import net.opendash.core.LoadCycle;
import net.opendash.search.PushSocketClient;
import net.opendash.search.StreamMessage;
import net.opendash.search.StreamRequest;
import net.opendash.search.TraceIds;
import net.opendash.state.ErrorDetail;
import net.opendash.state.LoadState;

/**
 * Runs each query as one search over the shared push socket. The search
 * frame goes out once the socket reports it is open, unless the user
 * cancelled in the meantime. Results stream back as typed messages.
 *
 * @since 1.0
 */
public class PushSocketTransport extends AbstractStreamingTransport {
  private static final Logger LOG = LoggerFactory.getLogger(
      PushSocketTransport.class);

  /** Close codes treated as a dropped connection. */
  public static final Set<Integer> ABNORMAL_CLOSE_CODES =
      ImmutableSet.of(1001, 1006, 1010, 1011, 1012, 1013);

  public static final String CONNECTION_TERMINATED =
      "WebSocket connection terminated unexpectedly. Please check your "
      + "network and try again";

  private final PushSocketClient client;

  /**
   * Default ctor.
   * @param client A non-null socket client.
   * @param config A non-null config.
   */
  public PushSocketTransport(final PushSocketClient client,
                             final Configuration config) {
    super(config);
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.client = client;
  }

  @Override
  public String name() {
    return "PushSocket";
  }

  @Override
  public Deferred<TransportOutcome> execute(final TransportRequest request,
                                            final LoadCycle cycle,
                                            final TransportContext context) {
    final LoadState state = context.state();
    final String trace_id = TraceIds.newTraceId();
    final StreamRequest stream_request = buildRequest(request, context,
        trace_id);
    state.addTraceId(trace_id);

    final StreamSession session = new StreamSession(request, cycle, context,
        trace_id) {
      @Override
      void release() {
        client.release(trace_id);
      }
    };

    class Handler implements PushSocketClient.PushSocketHandler {
      @Override
      public void onOpen() {
        if (session.isSettled()) {
          return;
        }
        if (cycle.isCancelled() || state.isOperationCancelled()) {
          state.setOperationCancelled(false);
          session.settle(TransportOutcome.CANCELLED);
          return;
        }
        if (LOG.isDebugEnabled()) {
          LOG.debug("Sending search " + trace_id + " for slot "
              + request.getSlot());
        }
        client.send(stream_request);
      }

      @Override
      public void onMessage(final StreamMessage message) {
        session.handle(message);
      }

      @Override
      public void onError(final JsonNode content) {
        session.fail(content);
      }

      @Override
      public void onClose(final int code) {
        state.removeTraceId(trace_id);
        if (session.isSettled()) {
          return;
        }
        final boolean abnormal = ABNORMAL_CLOSE_CODES.contains(code);
        if (abnormal) {
          LOG.warn("Push socket closed with code " + code + " during search "
              + trace_id);
          state.setErrorDetail(ErrorDetail.of(CONNECTION_TERMINATED,
              Integer.toString(code)));
        }
        state.setLoading(false);
        state.setOperationCancelled(false);
        state.setPartialData(false);
        context.saveToCache();
        session.settle(abnormal ?
            TransportOutcome.FAILED : TransportOutcome.COMPLETED);
      }

      @Override
      public void onReset() {
        if (session.isSettled()) {
          return;
        }
        session.reset();
      }
    }

    session.attach();
    if (session.isSettled()) {
      return session.deferred();
    }
    state.resetProgress();
    state.setLoading(true);
    try {
      client.register(stream_request, new Handler());
    } catch (RuntimeException e) {
      LOG.error("Failed to register search " + trace_id, e);
      state.setLoading(false);
      state.setOperationCancelled(false);
      state.setErrorDetail(ErrorDetail.fromSql(e, true));
      session.settle(TransportOutcome.FAILED);
    }
    return session.deferred();
  }

  @Override
  protected void cancelTraceId(final String trace_id, final String org_id) {
    client.cancelByTraceId(trace_id, org_id);
  }
}
