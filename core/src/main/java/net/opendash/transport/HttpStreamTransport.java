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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.stumbleupon.async.Deferred;

import net.opendash.configuration.Configuration;
import net.opendash.core.LoadCycle;
import net.opendash.search.HttpStreamClient;
import net.opendash.search.StreamMessage;
import net.opendash.search.StreamRequest;
import net.opendash.search.TraceIds;
import net.opendash.state.ErrorDetail;
import net.opendash.state.LoadState;

/**
 * Runs each query as one search whose results arrive on a single long
 * lived HTTP response body. Message handling is shared with the push
 * socket.
 *
 * @since 1.0
 */
public class HttpStreamTransport extends AbstractStreamingTransport {
  private static final Logger LOG = LoggerFactory.getLogger(
      HttpStreamTransport.class);

  private final HttpStreamClient client;

  /**
   * Default ctor.
   * @param client A non-null stream client.
   * @param config A non-null config.
   */
  public HttpStreamTransport(final HttpStreamClient client,
                             final Configuration config) {
    super(config);
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.client = client;
  }

  @Override
  public String name() {
    return "HttpStream";
  }

  @Override
  public Deferred<TransportOutcome> execute(final TransportRequest request,
                                            final LoadCycle cycle,
                                            final TransportContext context) {
    final LoadState state = context.state();
    if (cycle.isCancelled()) {
      state.setPartialData(true);
      context.saveToCache();
      return Deferred.fromResult(TransportOutcome.CANCELLED);
    }

    final String trace_id = TraceIds.newTraceId();
    final StreamRequest stream_request = buildRequest(request, context,
        trace_id);
    state.addTraceId(trace_id);

    // the client drops the body once the handler stops reading so there
    // is nothing to release here
    final StreamSession session = new StreamSession(request, cycle, context,
        trace_id) {
      @Override
      void release() { }
    };

    class Handler implements HttpStreamClient.HttpStreamHandler {
      @Override
      public void onData(final StreamMessage message) {
        session.handle(message);
      }

      @Override
      public void onError(final JsonNode content) {
        session.fail(content);
      }

      @Override
      public void onComplete() {
        state.removeTraceId(trace_id);
        if (session.isSettled()) {
          return;
        }
        state.setLoading(false);
        state.setOperationCancelled(false);
        state.setPartialData(false);
        context.saveToCache();
        session.settle(TransportOutcome.COMPLETED);
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
    state.resetProgress();
    state.setLoading(true);
    try {
      client.open(stream_request, new Handler());
    } catch (RuntimeException e) {
      LOG.error("Failed to open stream " + trace_id, e);
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
