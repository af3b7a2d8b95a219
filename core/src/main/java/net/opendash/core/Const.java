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

import java.nio.charset.Charset;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/** Constants used in various places.  */
public final class Const {

  /** Used for query text, fingerprints and request bodies. */
  public static final Charset UTF8_CHARSET = Charset.forName("UTF8");

  /** Panel types that render annotations and so need them fetched. */
  public static final Set<String> ANNOTATION_PANEL_TYPES = ImmutableSet.of(
      "area", "area-stacked", "bar", "h-bar", "line", "scatter", "stacked",
      "h-stacked");

  /** Query type for PromQL panels. */
  public static final String PROMQL = "promql";

  /** Query type for SQL panels. */
  public static final String SQL = "sql";

  /** The variable type of global ad hoc filters. */
  public static final String DYNAMIC_FILTERS_TYPE = "dynamic_filters";

  /** Microseconds in a second, the back end works in microseconds. */
  public static final long MICROS_PER_SECOND = 1000000L;

  /**
   * Returns the hash function to use for fingerprints. Don't use it for
   * anything secure.
   * @return A non-null hash function.
   */
  public static final HashFunction HASH_FUNCTION() {
    return Hashing.murmur3_128();
  }

  private Const() {
    // not instantiable
  }
}
