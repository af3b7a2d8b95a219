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

import com.stumbleupon.async.DeferredGroupException;

/**
 * Utility methods for dealing with exceptions from Deferred chains.
 * @since 1.0
 */
public class Exceptions {

  /**
   * Iterates through the causes of a deferred group exception looking for
   * the first exception that isn't itself a group.
   * @param e A DeferredGroupException to parse
   * @return The root cause of the exception if found.
   */
  public static Throwable getCause(final DeferredGroupException e) {
    Throwable ex = e;
    while (ex.getClass().equals(DeferredGroupException.class)) {
      if (ex.getCause() == null) {
        break;
      } else {
        ex = ex.getCause();
      }
    }
    return ex;
  }

  /**
   * Unwraps group exceptions if the throwable is one.
   * @param t A non-null throwable.
   * @return The throwable or the root of a group.
   */
  public static Throwable unwrap(final Throwable t) {
    if (t instanceof DeferredGroupException) {
      return getCause((DeferredGroupException) t);
    }
    return t;
  }
}
