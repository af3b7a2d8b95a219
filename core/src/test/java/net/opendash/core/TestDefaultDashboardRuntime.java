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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.withSettings;

import java.io.Closeable;
import java.io.IOException;

import org.junit.Before;
import org.junit.Test;

import io.netty.util.Timer;
import net.opendash.cache.GuavaPanelCacheStore;
import net.opendash.cache.PanelCacheStore;
import net.opendash.configuration.UnitTestConfiguration;
import net.opendash.search.PushSocketClient;
import net.opendash.search.SearchService;
import net.opendash.transpile.SimpleQueryRewriter;

public class TestDefaultDashboardRuntime {
  private UnitTestConfiguration config;
  private Timer timer;
  private SearchService search;

  @Before
  public void before() throws Exception {
    config = UnitTestConfiguration.getConfiguration();
    timer = mock(Timer.class);
    search = mock(SearchService.class);
  }

  @Test
  public void builder() throws Exception {
    final PanelCacheStore store = mock(PanelCacheStore.class);
    final DefaultDashboardRuntime runtime = DefaultDashboardRuntime.newBuilder()
        .setConfig(config)
        .setTimer(timer)
        .setSearchService(search)
        .setCacheStore(store)
        .setOrgIdentifier("default")
        .build();
    assertSame(config, runtime.getConfig());
    assertSame(timer, runtime.getTimer());
    assertSame(search, runtime.getSearchService());
    assertSame(store, runtime.getCacheStore());
    assertEquals("default", runtime.getOrgIdentifier());
    assertNull(runtime.getPushSocketClient());
    assertNull(runtime.getHttpStreamClient());
    assertNull(runtime.getAnnotationService());
    assertTrue(runtime.getQueryRewriter() instanceof SimpleQueryRewriter);
  }

  @Test
  public void builderDefaults() throws Exception {
    final DefaultDashboardRuntime runtime = DefaultDashboardRuntime.newBuilder()
        .setConfig(config)
        .setTimer(timer)
        .setSearchService(search)
        .setOrgIdentifier("default")
        .build();
    assertTrue(runtime.getCacheStore() instanceof GuavaPanelCacheStore);
  }

  @Test
  public void builderErrors() throws Exception {
    try {
      DefaultDashboardRuntime.newBuilder()
          .setConfig(config)
          .setTimer(timer)
          .setOrgIdentifier("default")
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DefaultDashboardRuntime.newBuilder()
          .setConfig(config)
          .setTimer(timer)
          .setSearchService(search)
          .setOrgIdentifier("")
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void shutdown() throws Exception {
    final SearchService closeable = mock(SearchService.class,
        withSettings().extraInterfaces(Closeable.class));
    final PushSocketClient socket = mock(PushSocketClient.class,
        withSettings().extraInterfaces(Closeable.class));
    doThrow(new IOException("boom")).when((Closeable) socket).close();
    final DefaultDashboardRuntime runtime = DefaultDashboardRuntime.newBuilder()
        .setConfig(config)
        .setTimer(timer)
        .setSearchService(closeable)
        .setPushSocketClient(socket)
        .setOrgIdentifier("default")
        .build();

    assertNull(runtime.shutdown().join());
    verify((Closeable) closeable).close();
    verify((Closeable) socket).close();
    // the timer was handed in so it's not ours to stop
    verify(timer, never()).stop();
  }
}
