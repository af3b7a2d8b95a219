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

import java.util.Collection;

import net.opendash.configuration.Configuration;
import net.opendash.search.SearchRequest;
import net.opendash.search.StreamRequest;

/**
 * Shared plumbing of the transports that stream a single search per
 * query: building the request frame and cancelling by trace id.
 *
 * @since 1.0
 */
public abstract class AbstractStreamingTransport implements TransportStrategy {
  public static final String USE_CACHE_KEY = "dashboard.search.use_cache";

  protected final Configuration config;

  /**
   * Default ctor.
   * @param config A non-null config.
   */
  protected AbstractStreamingTransport(final Configuration config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.config = config;
    if (!config.hasProperty(USE_CACHE_KEY)) {
      config.register(USE_CACHE_KEY, true, true,
          "Whether or not streamed searches may be served from the "
          + "back end's result cache.");
    }
  }

  /**
   * Asks the collaborator to stop one search.
   * @param trace_id The trace id.
   * @param org_id The organization.
   */
  protected abstract void cancelTraceId(final String trace_id,
                                        final String org_id);

  @Override
  public void cancelTraceIds(final Collection<String> trace_ids,
                             final String org_id) {
    for (final String trace_id : trace_ids) {
      cancelTraceId(trace_id, org_id);
    }
  }

  /**
   * Builds the frame for a streamed search.
   * @param request The transport request.
   * @param context The loader's context.
   * @param trace_id The new trace id.
   * @return The stream request.
   */
  protected StreamRequest buildRequest(final TransportRequest request,
                                       final TransportContext context,
                                       final String trace_id) {
    final SearchRequest search = SearchRequest.newBuilder()
        .setSql(request.getQuery())
        .setVrlFunction(request.getVrlFunction())
        .setStartTime(request.getRange().getStartTime())
        .setEndTime(request.getRange().getEndTime())
        .setOrgId(context.orgId())
        .setStreamType(request.getStreamType())
        .setTraceId(trace_id)
        .setDashboardId(context.identity().getDashboardId())
        .setFolderId(context.identity().getFolderId())
        .build();
    return new StreamRequest(search, request.getSlot(),
        config.getBoolean(USE_CACHE_KEY));
  }
}
