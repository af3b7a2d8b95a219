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

import io.netty.util.Timer;
import net.opendash.cache.PanelCacheStore;
import net.opendash.configuration.Configuration;
import net.opendash.search.AnnotationService;
import net.opendash.search.HttpStreamClient;
import net.opendash.search.PushSocketClient;
import net.opendash.search.SearchService;
import net.opendash.transpile.QueryRewriter;

/**
 * The shared collaborators every panel loader of a dashboard works with.
 * One runtime is created per dashboard session and handed to each
 * panel's loader.
 *
 * @since 1.0
 */
public interface DashboardRuntime {

  /** @return The non-null configuration. */
  public Configuration getConfig();

  /** @return The timer used for debouncing loads. */
  public Timer getTimer();

  /** @return The non-null search service. */
  public SearchService getSearchService();

  /** @return The push socket client or null if the deployment has none. */
  public PushSocketClient getPushSocketClient();

  /** @return The HTTP stream client or null if the deployment has none. */
  public HttpStreamClient getHttpStreamClient();

  /** @return The non-null panel cache store. */
  public PanelCacheStore getCacheStore();

  /** @return The annotation service or null if annotations are disabled. */
  public AnnotationService getAnnotationService();

  /** @return The non-null query rewriter for ad hoc filters. */
  public QueryRewriter getQueryRewriter();

  /** @return The identifier of the organization queries run under. */
  public String getOrgIdentifier();
}
