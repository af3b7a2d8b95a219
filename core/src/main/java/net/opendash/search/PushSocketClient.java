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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A bidirectional, multiplexed search connection. Each search registers
 * a {@link PushSocketHandler} under its trace id and sends its request
 * once the handler's {@code onOpen} fires.
 *
 * @since 1.0
 */
public interface PushSocketClient {

  /**
   * Registers the handler for a search, opening the socket if needed.
   * {@link PushSocketHandler#onOpen()} is called once the socket can take
   * the request, possibly before this returns.
   * @param request The request, keyed by its trace id.
   * @param handler The non-null handler.
   */
  public void register(final StreamRequest request,
                       final PushSocketHandler handler);

  /**
   * Sends the search frame.
   * @param request The request.
   */
  public void send(final StreamRequest request);

  /**
   * Asks the back end to stop the search.
   * @param trace_id The search's trace id.
   * @param org_id The organization.
   */
  public void cancelByTraceId(final String trace_id, final String org_id);

  /**
   * Drops the handler registered for the trace id.
   * @param trace_id The search's trace id.
   */
  public void release(final String trace_id);

  /**
   * Callbacks for one search over the socket.
   */
  public interface PushSocketHandler {

    /** The socket is ready for the request. */
    public void onOpen();

    /**
     * A message for the search arrived.
     * @param message The message.
     */
    public void onMessage(final StreamMessage message);

    /**
     * The socket failed for this search.
     * @param content The error content.
     */
    public void onError(final JsonNode content);

    /**
     * The socket closed.
     * @param code The close code.
     */
    public void onClose(final int code);

    /** The socket was re-established and the search must start over. */
    public void onReset();
  }
}
