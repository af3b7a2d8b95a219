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
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.opendash.variables.DynamicFilter;

/**
 * A lexical {@link QueryRewriter}. It understands enough of PromQL and SQL
 * to skip string literals, range selectors, grouping clauses and nested
 * parentheses but is not a full parser.
 *
 * @since 1.0
 */
public class SimpleQueryRewriter implements QueryRewriter {

  /** Finds the first stream after FROM, quoted or not. */
  private static final Pattern FROM_PATTERN = Pattern.compile(
      "(?i)\\bfrom\\s+(?:\"([^\"]+)\"|'([^']+)'|`([^`]+)`|([\\w.\\-]+))");

  /** Plain identifiers that don't need quoting in SQL. */
  private static final Pattern SQL_IDENTIFIER = Pattern.compile(
      "[A-Za-z_][A-Za-z0-9_]*");

  /** PromQL keywords followed by a label list in parentheses. */
  private static final Set<String> GROUPING_KEYWORDS = ImmutableSet.of(
      "by", "without", "on", "ignoring", "group_left", "group_right");

  /** PromQL keywords that are never metric names. */
  private static final Set<String> PROMQL_KEYWORDS = ImmutableSet.of(
      "and", "or", "unless", "offset", "bool", "inf", "nan");

  /** Top level SQL keywords that end a WHERE clause. */
  private static final Set<String> CLAUSE_END_KEYWORDS = ImmutableSet.of(
      "group", "having", "order", "limit", "union", "window", "qualify");

  @Override
  public String addLabelToPromQl(final String query,
                                 final String name,
                                 final String value,
                                 final String operator) {
    final String matcher = name + operator + "\""
        + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    final StringBuilder buf = new StringBuilder(query.length() + 32);
    final int length = query.length();
    boolean grouping = false;
    int i = 0;
    while (i < length) {
      final char c = query.charAt(i);
      if (Character.isWhitespace(c)) {
        buf.append(c);
        i++;
        continue;
      }
      if (c == '(' && grouping) {
        final int close = matchingClose(query, i, '(', ')');
        buf.append(query, i, close + 1);
        i = close + 1;
        grouping = false;
        continue;
      }
      grouping = false;
      if (c == '"' || c == '\'' || c == '`') {
        final int end = skipString(query, i);
        buf.append(query, i, end);
        i = end;
      } else if (c == '[') {
        final int close = query.indexOf(']', i);
        final int end = close < 0 ? length : close + 1;
        buf.append(query, i, end);
        i = end;
      } else if (c == '{') {
        final int close = matchingClose(query, i, '{', '}');
        buf.append(injectMatcher(query.substring(i, close + 1), matcher));
        i = close + 1;
      } else if (Character.isDigit(c)) {
        int end = i;
        while (end < length &&
            (Character.isLetterOrDigit(query.charAt(end)) ||
             query.charAt(end) == '.')) {
          end++;
        }
        buf.append(query, i, end);
        i = end;
      } else if (isIdentifierStart(c)) {
        int end = i;
        while (end < length && isIdentifierPart(query.charAt(end))) {
          end++;
        }
        final String identifier = query.substring(i, end);
        buf.append(identifier);
        i = end;
        final String lower = identifier.toLowerCase(Locale.ROOT);
        if (GROUPING_KEYWORDS.contains(lower)) {
          grouping = true;
          continue;
        }
        if (PROMQL_KEYWORDS.contains(lower)) {
          continue;
        }
        int next = i;
        while (next < length && Character.isWhitespace(query.charAt(next))) {
          next++;
        }
        if (next < length && query.charAt(next) == '(') {
          // function call
          continue;
        }
        if (isGroupingKeywordAt(query, next)) {
          // aggregation with a leading modifier, e.g. sum by (job) (...)
          continue;
        }
        if (next < length && query.charAt(next) == '{') {
          final int close = matchingClose(query, next, '{', '}');
          buf.append(query, i, next);
          buf.append(injectMatcher(query.substring(next, close + 1), matcher));
          i = close + 1;
        } else {
          buf.append('{').append(matcher).append('}');
        }
      } else {
        buf.append(c);
        i++;
      }
    }
    return buf.toString();
  }

  @Override
  public String getStreamFromQuery(final String query) {
    final Matcher matcher = FROM_PATTERN.matcher(query);
    if (!matcher.find()) {
      return null;
    }
    for (int i = 1; i <= matcher.groupCount(); i++) {
      if (matcher.group(i) != null) {
        return matcher.group(i);
      }
    }
    return null;
  }

  @Override
  public String addLabelsToSql(final String query,
                               final List<DynamicFilter> filters) {
    if (filters == null || filters.isEmpty()) {
      return query;
    }
    final List<String> predicates = Lists.newArrayListWithCapacity(
        filters.size());
    for (final DynamicFilter filter : filters) {
      predicates.add(predicate(filter));
    }
    final String conditions = Joiner.on(" AND ").join(predicates);

    String sql = query.trim();
    if (sql.endsWith(";")) {
      sql = sql.substring(0, sql.length() - 1).trim();
    }
    final List<int[]> words = topLevelWords(sql);
    int from_idx = -1;
    int where_idx = -1;
    int where_end = -1;
    int clause_end = sql.length();
    for (final int[] word : words) {
      final String token = sql.substring(word[0], word[1])
          .toLowerCase(Locale.ROOT);
      if (from_idx < 0) {
        if (token.equals("from")) {
          from_idx = word[0];
        }
        continue;
      }
      if (where_idx < 0 && token.equals("where")) {
        where_idx = word[0];
        where_end = word[1];
        continue;
      }
      if (CLAUSE_END_KEYWORDS.contains(token)) {
        clause_end = word[0];
        break;
      }
    }

    final String tail = clause_end < sql.length() ?
        " " + sql.substring(clause_end) : "";
    if (where_idx >= 0) {
      final String existing = sql.substring(where_end, clause_end).trim();
      return sql.substring(0, where_idx) + "WHERE (" + existing + ") AND "
          + conditions + tail;
    }
    return sql.substring(0, clause_end).trim() + " WHERE " + conditions + tail;
  }

  /**
   * Renders a filter as a SQL predicate.
   * @param filter A complete filter.
   * @return The predicate text.
   */
  static String predicate(final DynamicFilter filter) {
    final String name = SQL_IDENTIFIER.matcher(filter.getName()).matches() ?
        filter.getName() : "\"" + filter.getName().replace("\"", "\"\"") + "\"";
    final String operator = filter.getOperator().trim();
    final String upper = operator.toUpperCase(Locale.ROOT);
    if (upper.equals("IN") || upper.equals("NOT IN")) {
      final List<String> literals = Lists.newArrayList();
      for (final String part : filter.getValue().split(",")) {
        literals.add(literal(part.trim()));
      }
      return name + " " + upper + " (" + Joiner.on(",").join(literals) + ")";
    }
    if (upper.equals("LIKE") || upper.equals("NOT LIKE")) {
      return name + " " + upper + " " + literal(filter.getValue());
    }
    return name + " " + operator + " " + literal(filter.getValue());
  }

  private static String literal(final String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  /**
   * Finds word tokens outside of strings and parentheses.
   * @return A list of [start, end) offsets.
   */
  private static List<int[]> topLevelWords(final String sql) {
    final List<int[]> words = Lists.newArrayList();
    final int length = sql.length();
    int depth = 0;
    int i = 0;
    while (i < length) {
      final char c = sql.charAt(i);
      if (c == '\'' || c == '"' || c == '`') {
        i = skipString(sql, i);
      } else if (c == '(') {
        depth++;
        i++;
      } else if (c == ')') {
        depth = Math.max(0, depth - 1);
        i++;
      } else if (Character.isLetter(c) || c == '_') {
        int end = i;
        while (end < length &&
            (Character.isLetterOrDigit(sql.charAt(end)) ||
             sql.charAt(end) == '_')) {
          end++;
        }
        if (depth == 0) {
          words.add(new int[] { i, end });
        }
        i = end;
      } else {
        i++;
      }
    }
    return words;
  }

  /**
   * Adds the matcher to a brace delimited label list.
   * @param braces The text from '{' to '}' inclusive.
   * @param matcher The matcher to add.
   * @return The new label list.
   */
  private static String injectMatcher(final String braces,
                                      final String matcher) {
    String inner = braces.substring(1, braces.length() - 1).trim();
    if (inner.endsWith(",")) {
      inner = inner.substring(0, inner.length() - 1).trim();
    }
    if (inner.isEmpty()) {
      return "{" + matcher + "}";
    }
    return "{" + inner + "," + matcher + "}";
  }

  /**
   * @return The index just past the string literal starting at the given
   * quote, or the end of the text if unterminated.
   */
  private static int skipString(final String text, final int start) {
    final char quote = text.charAt(start);
    int i = start + 1;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (c == '\\' && quote != '`') {
        i += 2;
        continue;
      }
      if (c == quote) {
        return i + 1;
      }
      i++;
    }
    return text.length();
  }

  /**
   * @return The index of the closing character matching the opener at
   * the start, or the last index if unbalanced.
   */
  private static int matchingClose(final String text,
                                   final int start,
                                   final char open,
                                   final char close) {
    int depth = 0;
    int i = start;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (c == '"' || c == '\'' || c == '`') {
        i = skipString(text, i);
        continue;
      }
      if (c == open) {
        depth++;
      } else if (c == close) {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
      i++;
    }
    return text.length() - 1;
  }

  /**
   * @return True if one of the grouping keywords starts at the index.
   */
  private static boolean isGroupingKeywordAt(final String text,
                                             final int start) {
    int end = start;
    while (end < text.length() && isIdentifierPart(text.charAt(end))) {
      end++;
    }
    return end > start && GROUPING_KEYWORDS.contains(
        text.substring(start, end).toLowerCase(Locale.ROOT));
  }

  private static boolean isIdentifierStart(final char c) {
    return Character.isLetter(c) || c == '_' || c == ':';
  }

  private static boolean isIdentifierPart(final char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == ':';
  }
}
