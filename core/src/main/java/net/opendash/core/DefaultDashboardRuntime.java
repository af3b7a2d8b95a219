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

import java.io.Closeable;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.stumbleupon.async.Deferred;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timer;
import net.opendash.cache.GuavaPanelCacheStore;
import net.opendash.cache.PanelCacheStore;
import net.opendash.configuration.Configuration;
import net.opendash.search.AnnotationService;
import net.opendash.search.HttpStreamClient;
import net.opendash.search.PushSocketClient;
import net.opendash.search.SearchService;
import net.opendash.transpile.QueryRewriter;
import net.opendash.transpile.SimpleQueryRewriter;

/**
 * The default runtime. Only the search service and organization are
 * required, the timer, cache store and rewriter fall back to in-process
 * implementations.
 *
 * @since 1.0
 */
public class DefaultDashboardRuntime implements DashboardRuntime {
  private static final Logger LOG = LoggerFactory.getLogger(
      DefaultDashboardRuntime.class);

  private final Configuration config;
  private final Timer timer;
  private final boolean owns_timer;
  private final SearchService search_service;
  private final PushSocketClient push_socket_client;
  private final HttpStreamClient http_stream_client;
  private final PanelCacheStore cache_store;
  private final AnnotationService annotation_service;
  private final QueryRewriter query_rewriter;
  private final String org_identifier;

  protected DefaultDashboardRuntime(final Builder builder) {
    if (builder.search_service == null) {
      throw new IllegalArgumentException("Search service cannot be null.");
    }
    if (Strings.isNullOrEmpty(builder.org_identifier)) {
      throw new IllegalArgumentException("Org identifier cannot be null "
          + "or empty.");
    }
    config = builder.config == null ? new Configuration() : builder.config;
    if (builder.timer == null) {
      timer = new HashedWheelTimer();
      owns_timer = true;
    } else {
      timer = builder.timer;
      owns_timer = false;
    }
    search_service = builder.search_service;
    push_socket_client = builder.push_socket_client;
    http_stream_client = builder.http_stream_client;
    cache_store = builder.cache_store == null ?
        new GuavaPanelCacheStore(config) : builder.cache_store;
    annotation_service = builder.annotation_service;
    query_rewriter = builder.query_rewriter == null ?
        new SimpleQueryRewriter() : builder.query_rewriter;
    org_identifier = builder.org_identifier;
  }

  @Override
  public Configuration getConfig() {
    return config;
  }

  @Override
  public Timer getTimer() {
    return timer;
  }

  @Override
  public SearchService getSearchService() {
    return search_service;
  }

  @Override
  public PushSocketClient getPushSocketClient() {
    return push_socket_client;
  }

  @Override
  public HttpStreamClient getHttpStreamClient() {
    return http_stream_client;
  }

  @Override
  public PanelCacheStore getCacheStore() {
    return cache_store;
  }

  @Override
  public AnnotationService getAnnotationService() {
    return annotation_service;
  }

  @Override
  public QueryRewriter getQueryRewriter() {
    return query_rewriter;
  }

  @Override
  public String getOrgIdentifier() {
    return org_identifier;
  }

  /**
   * Stops the timer if this runtime created it and closes any closeable
   * collaborators.
   * @return A deferred resolving to null once done.
   */
  public Deferred<Object> shutdown() {
    if (owns_timer) {
      timer.stop();
    }
    close(search_service);
    close(push_socket_client);
    close(http_stream_client);
    close(annotation_service);
    LOG.info("Dashboard runtime for org " + org_identifier + " shut down.");
    return Deferred.fromResult(null);
  }

  private void close(final Object collaborator) {
    if (!(collaborator instanceof Closeable)) {
      return;
    }
    try {
      ((Closeable) collaborator).close();
    } catch (IOException e) {
      LOG.warn("Failed to close " + collaborator, e);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private Configuration config;
    private Timer timer;
    private SearchService search_service;
    private PushSocketClient push_socket_client;
    private HttpStreamClient http_stream_client;
    private PanelCacheStore cache_store;
    private AnnotationService annotation_service;
    private QueryRewriter query_rewriter;
    private String org_identifier;

    public Builder setConfig(final Configuration config) {
      this.config = config;
      return this;
    }

    public Builder setTimer(final Timer timer) {
      this.timer = timer;
      return this;
    }

    public Builder setSearchService(final SearchService search_service) {
      this.search_service = search_service;
      return this;
    }

    public Builder setPushSocketClient(
        final PushSocketClient push_socket_client) {
      this.push_socket_client = push_socket_client;
      return this;
    }

    public Builder setHttpStreamClient(
        final HttpStreamClient http_stream_client) {
      this.http_stream_client = http_stream_client;
      return this;
    }

    public Builder setCacheStore(final PanelCacheStore cache_store) {
      this.cache_store = cache_store;
      return this;
    }

    public Builder setAnnotationService(
        final AnnotationService annotation_service) {
      this.annotation_service = annotation_service;
      return this;
    }

    public Builder setQueryRewriter(final QueryRewriter query_rewriter) {
      this.query_rewriter = query_rewriter;
      return this;
    }

    public Builder setOrgIdentifier(final String org_identifier) {
      this.org_identifier = org_identifier;
      return this;
    }

    public DefaultDashboardRuntime build() {
      return new DefaultDashboardRuntime(this);
    }
  }
}
