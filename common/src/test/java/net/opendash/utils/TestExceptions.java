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
package net.opendash.utils;

import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.ArrayList;

import org.junit.Test;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.DeferredGroupException;

import net.opendash.exceptions.QueryExecutionException;

public class TestExceptions {

  @Test
  public void unwrapPlain() throws Exception {
    final QueryExecutionException e = new QueryExecutionException("Boo!", 500);
    assertSame(e, Exceptions.unwrap(e));
  }

  @Test
  public void unwrapGroup() throws Exception {
    final QueryExecutionException e = new QueryExecutionException("Boo!", 500);
    final ArrayList<Deferred<Object>> deferreds = Lists.newArrayList();
    deferreds.add(Deferred.fromResult(null));
    deferreds.add(Deferred.<Object>fromError(e));
    try {
      Deferred.group(deferreds).join(1000);
      fail("Expected DeferredGroupException");
    } catch (DeferredGroupException dge) {
      assertSame(e, Exceptions.unwrap(dge));
      assertSame(e, Exceptions.getCause(dge));
    }
  }
}
