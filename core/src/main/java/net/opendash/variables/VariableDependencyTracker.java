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
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.opendash.panel.PanelQuery;
import net.opendash.panel.PanelSchema;

/**
 * Works out which variables a panel's queries reference and decides
 * whether a change in the variable list warrants a reload.
 * <p>
 * A variable is dependent when its name appears in a query as
 * {@code $name}, {@code ${name}} or {@code ${name:modifier}} with one of
 * the modifiers {@code csv}, {@code pipe}, {@code doublequote} or
 * {@code singlequote}. Dynamic filter variables are never dependent;
 * their complete filters always apply.
 *
 * @since 1.0
 */
public class VariableDependencyTracker {
  private static final Logger LOG = LoggerFactory.getLogger(
      VariableDependencyTracker.class);

  /**
   * Returns the non dynamic variables referenced by at least one query.
   * @param schema A non-null panel.
   * @param variables The current variables, may be null.
   * @return A non-null list in variable order.
   */
  public List<Variable> dependentVariables(final PanelSchema schema,
                                           final List<Variable> variables) {
    if (variables == null || variables.isEmpty()) {
      return Collections.emptyList();
    }
    final List<Variable> dependent = Lists.newArrayList();
    for (final Variable variable : variables) {
      if (variable.isDynamicFilter()) {
        continue;
      }
      final Pattern pattern = placeholderPattern(variable.getName());
      for (final PanelQuery query : schema.getQueries()) {
        if (!Strings.isNullOrEmpty(query.getQuery()) &&
            pattern.matcher(query.getQuery()).find()) {
          dependent.add(variable);
          break;
        }
      }
    }
    return dependent;
  }

  /**
   * Flattens the filters of all dynamic filter variables, keeping those
   * with a non-empty name, operator and value.
   * @param variables The current variables, may be null.
   * @return A non-null list.
   */
  public List<DynamicFilter> dynamicVariables(final List<Variable> variables) {
    if (variables == null || variables.isEmpty()) {
      return Collections.emptyList();
    }
    final List<DynamicFilter> filters = Lists.newArrayList();
    for (final Variable variable : variables) {
      if (!variable.isDynamicFilter()) {
        continue;
      }
      for (final DynamicFilter filter : variable.getFilters()) {
        if (filter != null && filter.isComplete()) {
          filters.add(filter);
        }
      }
    }
    return filters;
  }

  /**
   * Captures the dependent and dynamic variables for the panel.
   * @param schema A non-null panel.
   * @param variables The current variables, may be null.
   * @return A non-null snapshot.
   */
  public VariableSnapshot snapshot(final PanelSchema schema,
                                   final List<Variable> variables) {
    boolean dynamic_loading = false;
    if (variables != null) {
      for (final Variable variable : variables) {
        if (variable.isDynamicFilter() && variable.isResolving()) {
          dynamic_loading = true;
          break;
        }
      }
    }
    return new VariableSnapshot(dependentVariables(schema, variables),
        dynamicVariables(variables), dynamic_loading);
  }

  /**
   * Whether a load can proceed: no dynamic filter variable and no
   * dependent variable is still loading or waiting on a parent.
   * @param snapshot A non-null snapshot.
   * @return True if everything the panel needs is resolved.
   */
  public boolean isResolved(final VariableSnapshot snapshot) {
    if (snapshot.isDynamicLoading()) {
      return false;
    }
    for (final Variable variable : snapshot.getDependent()) {
      if (variable.isResolving()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Whether a resolved dependent variable has a degenerate value, in which
   * case the panel shows no data instead of issuing a query.
   * @param snapshot A non-null snapshot.
   * @return True if any dependent variable is null, empty or an empty list.
   */
  public boolean hasEmptyValue(final VariableSnapshot snapshot) {
    for (final Variable variable : snapshot.getDependent()) {
      if (variable.isEmptyValue()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Decides whether moving from the old snapshot to the new one justifies
   * a reload. Returns false while anything relevant is still loading.
   * Otherwise any added or removed variable, or any variable whose value
   * (or operator, for ad hoc filters) differs, is a change.
   *
   * @param previous The last snapshot acted on, null if there was none.
   * @param current The new snapshot.
   * @return True if the panel should reload.
   */
  public boolean changed(final VariableSnapshot previous,
                         final VariableSnapshot current) {
    if (current.isDynamicLoading()) {
      return false;
    }
    for (final Variable variable : current.getDependent()) {
      if (variable.isEmptyValue() && variable.isResolving()) {
        return false;
      }
    }

    final VariableSnapshot old = previous == null ?
        VariableSnapshot.EMPTY : previous;
    if (old.getDependent().size() != current.getDependent().size() ||
        old.getDynamic().size() != current.getDynamic().size()) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Variable count changed from " + old + " to " + current);
      }
      return true;
    }

    for (final Variable variable : current.getDependent()) {
      if (!dependentUnchanged(old.getDependent(variable.getName()),
          variable)) {
        return true;
      }
    }

    for (final DynamicFilter filter : current.getDynamic()) {
      final DynamicFilter extant = old.getDynamic(filter.getName());
      if (extant == null ||
          Strings.isNullOrEmpty(extant.getValue()) ||
          !Objects.equal(extant.getValue(), filter.getValue()) ||
          !Objects.equal(extant.getOperator(), filter.getOperator())) {
        return true;
      }
    }
    return false;
  }

  /**
   * @param name The variable name.
   * @return A pattern finding any supported placeholder for the name.
   */
  static Pattern placeholderPattern(final String name) {
    return Pattern.compile("\\$\\{?" + Pattern.quote(name)
        + "(?::(csv|pipe|doublequote|singlequote))?\\}?");
  }

  private static boolean dependentUnchanged(final Variable old,
                                            final Variable current) {
    if (old == null) {
      return false;
    }
    if (current.isMultiSelect()) {
      return sorted(old).equals(sorted(current));
    }
    if (old.isEmptyValue()) {
      return false;
    }
    return Objects.equal(old.getValue(), current.getValue()) &&
           Objects.equal(old.getValues(), current.getValues());
  }

  private static List<String> sorted(final Variable variable) {
    final List<String> values = Lists.newArrayList();
    if (variable.getValues() != null) {
      for (final String value : variable.getValues()) {
        values.add(Strings.nullToEmpty(value));
      }
    } else if (variable.getValue() != null) {
      values.add(variable.getValue());
    }
    Collections.sort(values);
    return values;
  }
}
