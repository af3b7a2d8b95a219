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
package net.opendash.variables;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * The variables a panel depends on at one point in time, split into the
 * dependent variables referenced by the query text and the flattened
 * global ad hoc filters. A variable lands in at most one of the two.
 *
 * @since 1.0
 */
public class VariableSnapshot {
  /** An empty snapshot with nothing loading. */
  public static final VariableSnapshot EMPTY = new VariableSnapshot(
      Collections.<Variable>emptyList(),
      Collections.<DynamicFilter>emptyList(), false);

  private final List<Variable> dependent;
  private final List<DynamicFilter> dynamic;
  private final boolean dynamic_loading;

  /**
   * Default ctor.
   * @param dependent The dependent variables in declaration order.
   * @param dynamic The flattened, complete ad hoc filters.
   * @param dynamic_loading Whether any dynamic filter variable is still
   * resolving.
   */
  public VariableSnapshot(final List<Variable> dependent,
                          final List<DynamicFilter> dynamic,
                          final boolean dynamic_loading) {
    this.dependent = ImmutableList.copyOf(dependent);
    this.dynamic = ImmutableList.copyOf(dynamic);
    this.dynamic_loading = dynamic_loading;
  }

  /** @return The variables referenced by the query text. */
  public List<Variable> getDependent() {
    return dependent;
  }

  /** @return The ad hoc filters. */
  public List<DynamicFilter> getDynamic() {
    return dynamic;
  }

  /** @return Whether any dynamic filter variable is still resolving. */
  @JsonIgnore
  public boolean isDynamicLoading() {
    return dynamic_loading;
  }

  /**
   * @param name A name to look for.
   * @return The dependent variable with that name or null.
   */
  public Variable getDependent(final String name) {
    for (final Variable variable : dependent) {
      if (variable.getName().equals(name)) {
        return variable;
      }
    }
    return null;
  }

  /**
   * @param name A name to look for.
   * @return The first ad hoc filter on that name or null.
   */
  public DynamicFilter getDynamic(final String name) {
    for (final DynamicFilter filter : dynamic) {
      if (Objects.equal(filter.getName(), name)) {
        return filter;
      }
    }
    return null;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final VariableSnapshot other = (VariableSnapshot) o;
    return Objects.equal(dependent, other.dependent)
        && Objects.equal(dynamic, other.dynamic)
        && dynamic_loading == other.dynamic_loading;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(dependent, dynamic, dynamic_loading);
  }

  @Override
  public String toString() {
    return "dependent=" + dependent + ", dynamic=" + dynamic;
  }
}
