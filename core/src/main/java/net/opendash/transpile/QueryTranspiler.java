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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import net.opendash.configuration.Configuration;
import net.opendash.core.Const;
import net.opendash.panel.TimeRange;
import net.opendash.transpile.IntervalFormatter.Interval;
import net.opendash.variables.DynamicFilter;
import net.opendash.variables.Variable;
import net.opendash.variables.VariableSnapshot;

/**
 * Turns raw panel query text into executable text by substituting, in
 * order:
 * <ol>
 * <li>the fixed variables {@code __interval_ms}, {@code __interval} and
 * {@code __rate_interval} derived from the range and panel width,</li>
 * <li>the dependent dashboard variables, and</li>
 * <li>the global ad hoc filters, injected as PromQL label matchers or SQL
 * predicates.</li>
 * </ol>
 * Every substitution that matched a placeholder is recorded as a
 * {@link Substitution}. Placeholders that never appear are skipped
 * silently.
 *
 * @since 1.0
 */
public class QueryTranspiler {
  private static final Logger LOG = LoggerFactory.getLogger(
      QueryTranspiler.class);

  public static final String SCRAPE_INTERVAL_KEY =
      "dashboard.transpiler.scrape_interval.seconds";
  public static final String DEFAULT_WIDTH_KEY =
      "dashboard.transpiler.default_width.px";

  public static final String INTERVAL_MS = "__interval_ms";
  public static final String INTERVAL = "__interval";
  public static final String RATE_INTERVAL = "__rate_interval";

  private final Configuration config;
  private final QueryRewriter rewriter;

  /**
   * Default ctor.
   * @param config A non-null config to register and read settings from.
   * @param rewriter A non-null rewriter for ad hoc filters.
   */
  public QueryTranspiler(final Configuration config,
                         final QueryRewriter rewriter) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (rewriter == null) {
      throw new IllegalArgumentException("Rewriter cannot be null.");
    }
    this.config = config;
    this.rewriter = rewriter;
    if (!config.hasProperty(SCRAPE_INTERVAL_KEY)) {
      config.register(SCRAPE_INTERVAL_KEY, 15, true,
          "The metrics scrape interval in seconds used to compute "
          + "__rate_interval.");
    }
    if (!config.hasProperty(DEFAULT_WIDTH_KEY)) {
      config.register(DEFAULT_WIDTH_KEY, 1000, false,
          "The panel width in pixels assumed when the real width is "
          + "unknown.");
    }
  }

  /**
   * Runs all three substitution stages.
   * @param query The raw query text.
   * @param range The range the query runs over.
   * @param width_px The rendered width or null if unknown.
   * @param query_type The query language, "sql" or "promql".
   * @param variables The variables to apply.
   * @return The transpiled query.
   */
  public TranspiledQuery transpile(final String query,
                                   final TimeRange range,
                                   final Integer width_px,
                                   final String query_type,
                                   final VariableSnapshot variables) {
    final List<Substitution> substitutions = Lists.newArrayList();
    String text = query == null ? "" : query;
    text = applyFixedVariables(text, range, width_px, substitutions);
    text = applyDependentVariables(text, query_type, variables.getDependent(),
        substitutions);
    text = applyDynamicVariables(text, query_type, variables.getDynamic(),
        substitutions);
    if (LOG.isTraceEnabled()) {
      LOG.trace("Transpiled [" + query + "] to [" + text + "]");
    }
    return new TranspiledQuery(text, substitutions);
  }

  /**
   * Substitutes the interval variables.
   * @param query The query text.
   * @param range The range.
   * @param width_px The width, null for the configured default.
   * @param substitutions The list to record into.
   * @return The new text.
   */
  String applyFixedVariables(final String query,
                             final TimeRange range,
                             final Integer width_px,
                             final List<Substitution> substitutions) {
    final int width = width_px == null || width_px <= 0 ?
        config.getInt(DEFAULT_WIDTH_KEY) : width_px;
    final int scrape_interval = config.getInt(SCRAPE_INTERVAL_KEY);

    final double raw_seconds = (double) range.duration() / width
        / Const.MICROS_PER_SECOND;
    final Interval interval = IntervalFormatter.formatInterval(raw_seconds);
    final double rate_seconds = Math.max(
        interval.toSeconds() + scrape_interval, 4 * scrape_interval);

    String text = query;
    text = replaceFixed(text, INTERVAL_MS, interval.toMillis() + "ms",
        substitutions);
    text = replaceFixed(text, INTERVAL, interval.toString(), substitutions);
    text = replaceFixed(text, RATE_INTERVAL,
        IntervalFormatter.formatRateInterval(rate_seconds), substitutions);
    return text;
  }

  /**
   * Substitutes dependent variables. Array variables recognize six
   * placeholder forms, scalars two.
   * @param query The query text.
   * @param query_type The query language.
   * @param variables The dependent variables.
   * @param substitutions The list to record into.
   * @return The new text.
   */
  String applyDependentVariables(final String query,
                                 final String query_type,
                                 final List<Variable> variables,
                                 final List<Substitution> substitutions) {
    String text = query;
    final boolean sql = Const.SQL.equals(query_type);
    for (final Variable variable : variables) {
      final String name = variable.getName();
      if (variable.isArray()) {
        final List<String> values = variable.getValues();
        final String single_quoted = singleQuoted(values,
            variable.isEscapeSingleQuotes());
        final String piped = Joiner.on("|").useForNull("").join(values);
        final String[][] forms = new String[][] {
          { "${" + name + ":csv}", Joiner.on(",").useForNull("").join(values) },
          { "${" + name + ":pipe}", piped },
          { "${" + name + ":doublequote}", doubleQuoted(values) },
          { "${" + name + ":singlequote}", single_quoted },
          { "${" + name + "}", sql ? single_quoted : piped },
          { "$" + name, sql ? single_quoted : piped },
        };
        for (final String[] form : forms) {
          if (text.contains(form[0])) {
            substitutions.add(Substitution.newBuilder()
                .setType(SubstitutionType.VARIABLE)
                .setName(name)
                .setValue(TextNode.valueOf(form[1]))
                .build());
            text = text.replace(form[0], form[1]);
          }
        }
      } else {
        final String raw = variable.getValue();
        final String value = raw == null ? "" :
          (variable.isEscapeSingleQuotes() ? escapeSingleQuotes(raw) : raw);
        final String bracketed = "${" + name + "}";
        final String bare = "$" + name;
        if (text.contains(bracketed) || text.contains(bare)) {
          substitutions.add(Substitution.newBuilder()
              .setType(SubstitutionType.VARIABLE)
              .setName(name)
              .setValue(raw == null ? JsonNodeFactory.instance.nullNode() :
                TextNode.valueOf(raw))
              .build());
        }
        text = text.replace(bracketed, value);
        text = text.replace(bare, value);
      }
    }
    return text;
  }

  /**
   * Injects the ad hoc filters. PromQL gets one label matcher per filter,
   * SQL gets all filters as predicates once the stream is known.
   * @param query The query text.
   * @param query_type The query language.
   * @param filters The complete ad hoc filters.
   * @param substitutions The list to record into.
   * @return The new text.
   */
  String applyDynamicVariables(final String query,
                               final String query_type,
                               final List<DynamicFilter> filters,
                               final List<Substitution> substitutions) {
    if (filters == null || filters.isEmpty()) {
      return query;
    }
    String text = query;
    if (Const.PROMQL.equals(query_type)) {
      for (final DynamicFilter filter : filters) {
        substitutions.add(dynamicSubstitution(filter));
        text = rewriter.addLabelToPromQl(text, filter.getName(),
            filter.getValue(), filter.getOperator());
      }
    } else if (Const.SQL.equals(query_type)) {
      final String stream = rewriter.getStreamFromQuery(text);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Applying " + filters.size() + " ad hoc filters to stream "
            + stream);
      }
      for (final DynamicFilter filter : filters) {
        substitutions.add(dynamicSubstitution(filter));
      }
      text = rewriter.addLabelsToSql(text, filters);
    }
    return text;
  }

  private static String replaceFixed(final String query,
                                     final String name,
                                     final String value,
                                     final List<Substitution> substitutions) {
    final String bare = "$" + name;
    final String bracketed = "${" + name + "}";
    if (!query.contains(bare) && !query.contains(bracketed)) {
      return query;
    }
    substitutions.add(Substitution.newBuilder()
        .setType(SubstitutionType.FIXED)
        .setName(name)
        .setValue(TextNode.valueOf(value))
        .build());
    return query.replace(bracketed, value).replace(bare, value);
  }

  private static Substitution dynamicSubstitution(final DynamicFilter filter) {
    return Substitution.newBuilder()
        .setType(SubstitutionType.DYNAMIC_VARIABLE)
        .setName(filter.getName())
        .setValue(TextNode.valueOf(filter.getValue()))
        .setOperator(filter.getOperator())
        .build();
  }

  static String singleQuoted(final List<String> values, final boolean escape) {
    if (values.isEmpty()) {
      return "''";
    }
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        buf.append(",");
      }
      final String value = values.get(i) == null ? "" : values.get(i);
      buf.append("'")
         .append(escape ? escapeSingleQuotes(value) : value)
         .append("'");
    }
    return buf.toString();
  }

  static String doubleQuoted(final List<String> values) {
    if (values.isEmpty()) {
      return "\"\"";
    }
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        buf.append(",");
      }
      buf.append("\"")
         .append(values.get(i) == null ? "" : values.get(i))
         .append("\"");
    }
    return buf.toString();
  }

  static String escapeSingleQuotes(final String value) {
    return value.replace("'", "''");
  }
}
