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
 * A one-way streamed search over a long lived HTTP response.
 *
 * @since 1.0
 */
public interface HttpStreamClient {

  /**
   * Opens the stream for the search.
   * @param request The request, keyed by its trace id.
   * @param handler The non-null handler.
   */
  public void open(final StreamRequest request,
                   final HttpStreamHandler handler);

  /**
   * Asks the back end to stop the search.
   * @param trace_id The search's trace id.
   * @param org_id The organization.
   */
  public void cancelByTraceId(final String trace_id, final String org_id);

  /**
   * Callbacks for one streamed search.
   */
  public interface HttpStreamHandler {

    /**
     * A message for the search arrived.
     * @param message The message.
     */
    public void onData(final StreamMessage message);

    /**
     * The stream failed.
     * @param content The error content.
     */
    public void onError(final JsonNode content);

    /** The stream ended. */
    public void onComplete();

    /** The stream must be restarted from scratch. */
    public void onReset();
  }
}
