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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.opendash.panel.PanelQuery;
import net.opendash.panel.PanelSchema;

public class TestVariableDependencyTracker {
  private final VariableDependencyTracker tracker =
      new VariableDependencyTracker();

  @Test
  public void dependentVariables() throws Exception {
    final PanelSchema schema = panel(
        "SELECT * FROM logs WHERE a=$a AND b IN (${b:csv}) AND c='${c}'");
    final List<Variable> dependent = tracker.dependentVariables(schema,
        Lists.newArrayList(scalar("a", "1"), scalar("b", "2"),
            scalar("c", "3"), scalar("d", "4"), filters()));
    assertEquals(3, dependent.size());
    assertEquals("a", dependent.get(0).getName());
    assertEquals("b", dependent.get(1).getName());
    assertEquals("c", dependent.get(2).getName());
  }

  @Test
  public void dependentVariablesModifiers() throws Exception {
    for (final String modifier : new String[] {
        "csv", "pipe", "doublequote", "singlequote" }) {
      assertEquals(1, tracker.dependentVariables(
          panel("SELECT ${v:" + modifier + "}"),
          Lists.newArrayList(scalar("v", "1"))).size());
    }
    assertTrue(tracker.dependentVariables(panel("SELECT 1"),
        Lists.newArrayList(scalar("v", "1"))).isEmpty());
    assertTrue(tracker.dependentVariables(panel("SELECT 1"), null).isEmpty());
  }

  @Test
  public void dynamicVariables() throws Exception {
    final List<DynamicFilter> dynamic = tracker.dynamicVariables(
        Lists.newArrayList(scalar("a", "1"), filters()));
    assertEquals(1, dynamic.size());
    assertEquals("env", dynamic.get(0).getName());
  }

  @Test
  public void isResolved() throws Exception {
    final PanelSchema schema = panel("SELECT * FROM logs WHERE k=$v");
    assertTrue(tracker.isResolved(tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "x")))));
    assertFalse(tracker.isResolved(tracker.snapshot(schema,
        Lists.newArrayList(Variable.newBuilder(scalar("v", null))
            .setLoading(true)
            .build()))));
    assertFalse(tracker.isResolved(tracker.snapshot(schema,
        Lists.newArrayList(Variable.newBuilder(scalar("v", null))
            .setVariableLoadingPending(true)
            .build()))));
    // an unreferenced variable loading doesn't block
    assertTrue(tracker.isResolved(tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "x"),
            Variable.newBuilder(scalar("other", null))
              .setLoading(true)
              .build()))));
    // dynamic filters loading always block
    assertFalse(tracker.isResolved(tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "x"),
            Variable.newBuilder(filters()).setLoading(true).build()))));
  }

  @Test
  public void hasEmptyValue() throws Exception {
    final PanelSchema schema = panel("SELECT * FROM logs WHERE k IN ($v)");
    assertTrue(tracker.hasEmptyValue(tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "")))));
    assertTrue(tracker.hasEmptyValue(tracker.snapshot(schema,
        Lists.newArrayList(array("v")))));
    assertFalse(tracker.hasEmptyValue(tracker.snapshot(schema,
        Lists.newArrayList(array("v", "a")))));
  }

  @Test
  public void changedScalar() throws Exception {
    final PanelSchema schema = panel("SELECT * FROM logs WHERE k=$v");
    final VariableSnapshot x = tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "x")));
    final VariableSnapshot y = tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "y")));
    assertFalse(tracker.changed(x, x));
    assertTrue(tracker.changed(x, y));
    assertTrue(tracker.changed(null, x));
    assertFalse(tracker.changed(null, VariableSnapshot.EMPTY));
  }

  @Test
  public void changedIgnoresUnreferencedVariables() throws Exception {
    final PanelSchema schema = panel("SELECT * FROM logs WHERE k=$v");
    final VariableSnapshot before = tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "x"), scalar("other", "1")));
    final VariableSnapshot after = tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "x"), scalar("other", "2")));
    assertFalse(tracker.changed(before, after));
  }

  @Test
  public void changedMultiSelectOrderInsensitive() throws Exception {
    final PanelSchema schema = panel("SELECT * FROM logs WHERE k IN ($v)");
    final VariableSnapshot before = tracker.snapshot(schema,
        Lists.newArrayList(Variable.newBuilder(array("v", "a", "b"))
            .setMultiSelect(true)
            .build()));
    final VariableSnapshot reordered = tracker.snapshot(schema,
        Lists.newArrayList(Variable.newBuilder(array("v", "b", "a"))
            .setMultiSelect(true)
            .build()));
    final VariableSnapshot added = tracker.snapshot(schema,
        Lists.newArrayList(Variable.newBuilder(array("v", "b", "a", "c"))
            .setMultiSelect(true)
            .build()));
    assertFalse(tracker.changed(before, reordered));
    assertTrue(tracker.changed(before, added));
  }

  @Test
  public void changedWhileLoading() throws Exception {
    final PanelSchema schema = panel("SELECT * FROM logs WHERE k=$v");
    final VariableSnapshot before = tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "x")));
    final VariableSnapshot loading = tracker.snapshot(schema,
        Lists.newArrayList(Variable.newBuilder(scalar("v", null))
            .setLoading(true)
            .build()));
    assertFalse(tracker.changed(before, loading));

    final VariableSnapshot dynamic_loading = tracker.snapshot(schema,
        Lists.newArrayList(scalar("v", "y"),
            Variable.newBuilder(filters()).setLoading(true).build()));
    assertFalse(tracker.changed(before, dynamic_loading));
  }

  @Test
  public void changedDynamicFilters() throws Exception {
    final PanelSchema schema = panel("SELECT * FROM logs");
    final VariableSnapshot prod = tracker.snapshot(schema,
        Lists.newArrayList(filters("env", "=", "prod")));
    final VariableSnapshot dev = tracker.snapshot(schema,
        Lists.newArrayList(filters("env", "=", "dev")));
    final VariableSnapshot not_prod = tracker.snapshot(schema,
        Lists.newArrayList(filters("env", "!=", "prod")));
    final VariableSnapshot incomplete = tracker.snapshot(schema,
        Lists.newArrayList(filters("env", "=", "")));
    assertFalse(tracker.changed(prod, prod));
    assertTrue(tracker.changed(prod, dev));
    assertTrue(tracker.changed(prod, not_prod));
    assertTrue(tracker.changed(prod, incomplete));
    assertTrue(tracker.changed(incomplete, prod));
  }

  private static PanelSchema panel(final String query) {
    return PanelSchema.newBuilder()
        .addQuery(PanelQuery.newBuilder().setQuery(query).build())
        .build();
  }

  static Variable scalar(final String name, final String value) {
    return Variable.newBuilder()
        .setName(name)
        .setType("query_values")
        .setValue(value)
        .build();
  }

  static Variable array(final String name, final String... values) {
    return Variable.newBuilder()
        .setName(name)
        .setType("custom")
        .setValues(Lists.newArrayList(values))
        .build();
  }

  static Variable filters() {
    return filters("env", "=", "prod");
  }

  static Variable filters(final String name,
                          final String operator,
                          final String value) {
    return Variable.newBuilder()
        .setName("Dynamic filters")
        .setType("dynamic_filters")
        .setFilters(Lists.newArrayList(DynamicFilter.of(name, operator,
            value)))
        .build();
  }
}
