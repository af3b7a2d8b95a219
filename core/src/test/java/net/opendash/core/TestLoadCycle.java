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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.stumbleupon.async.Deferred;

import net.opendash.exceptions.QueryExecutionCanceled;

public class TestLoadCycle {

  @Test
  public void cancelRunsHooksOnce() throws Exception {
    final AtomicInteger runs = new AtomicInteger();
    final LoadCycle cycle = new LoadCycle(1);
    cycle.onCancel(new LoadCycle.CancelHook() {
      @Override
      public void onCancel() {
        runs.incrementAndGet();
      }
    });
    assertFalse(cycle.isCancelled());

    assertTrue(cycle.cancel());
    assertFalse(cycle.cancel());
    assertTrue(cycle.isCancelled());
    assertEquals(1, runs.get());
  }

  @Test
  public void onCancelAfterCancelRunsImmediately() throws Exception {
    final AtomicInteger runs = new AtomicInteger();
    final LoadCycle cycle = new LoadCycle(1);
    cycle.cancel();
    cycle.onCancel(new LoadCycle.CancelHook() {
      @Override
      public void onCancel() {
        runs.incrementAndGet();
      }
    });
    assertEquals(1, runs.get());
  }

  @Test
  public void removedHookDoesNotRun() throws Exception {
    final AtomicInteger runs = new AtomicInteger();
    final LoadCycle cycle = new LoadCycle(1);
    final LoadCycle.CancelHook hook = new LoadCycle.CancelHook() {
      @Override
      public void onCancel() {
        runs.incrementAndGet();
      }
    };
    cycle.onCancel(hook);
    cycle.removeHook(hook);
    cycle.cancel();
    assertEquals(0, runs.get());
  }

  @Test
  public void throwingHookDoesNotStopOthers() throws Exception {
    final AtomicInteger runs = new AtomicInteger();
    final LoadCycle cycle = new LoadCycle(1);
    cycle.onCancel(new LoadCycle.CancelHook() {
      @Override
      public void onCancel() {
        throw new IllegalStateException("Boo!");
      }
    });
    cycle.onCancel(new LoadCycle.CancelHook() {
      @Override
      public void onCancel() {
        runs.incrementAndGet();
      }
    });
    cycle.cancel();
    assertEquals(1, runs.get());
  }

  @Test
  public void checkCancelled() throws Exception {
    final LoadCycle cycle = new LoadCycle(42);
    cycle.checkCancelled();
    cycle.cancel();
    try {
      cycle.checkCancelled();
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
  }

  @Test
  public void guardPassesResult() throws Exception {
    final LoadCycle cycle = new LoadCycle(1);
    final Deferred<String> pending = new Deferred<String>();
    final Deferred<String> guarded = cycle.guard(pending);
    pending.callback("hello");
    assertEquals("hello", guarded.join(1000));
  }

  @Test
  public void guardPassesError() throws Exception {
    final LoadCycle cycle = new LoadCycle(1);
    final Deferred<String> guarded = cycle.guard(
        Deferred.<String>fromError(new IllegalStateException("Boo!")));
    try {
      guarded.join(1000);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) {
      assertEquals("Boo!", e.getMessage());
    }
  }

  @Test
  public void guardCancelled() throws Exception {
    final LoadCycle cycle = new LoadCycle(1);
    final Deferred<String> pending = new Deferred<String>();
    final Deferred<String> guarded = cycle.guard(pending);
    cycle.cancel();
    try {
      guarded.join(1000);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }

    // a late result is dropped
    pending.callback("late");
  }

  @Test
  public void guardAlreadyCancelled() throws Exception {
    final LoadCycle cycle = new LoadCycle(1);
    cycle.cancel();
    final Deferred<String> guarded = cycle.guard(Deferred.fromResult("hi"));
    try {
      guarded.join(1000);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
  }
}
