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
package net.opendash.transpile;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The executable query text and the substitutions that produced it.
 *
 * @since 1.0
 */
public class TranspiledQuery {
  private final String query;
  private final List<Substitution> substitutions;

  public TranspiledQuery(final String query,
                         final List<Substitution> substitutions) {
    this.query = query;
    this.substitutions = ImmutableList.copyOf(substitutions);
  }

  /** @return The final query text. */
  public String getQuery() {
    return query;
  }

  /** @return Substitutions in the order they were applied. */
  public List<Substitution> getSubstitutions() {
    return substitutions;
  }

  @Override
  public String toString() {
    return query + " " + substitutions;
  }
}
