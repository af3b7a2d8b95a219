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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.opendash.core.Const;

/**
 * A named dashboard variable as reported by the variable resolution
 * subsystem. A variable holds either a single {@link #getValue()}, a
 * list of {@link #getValues()} or, for the {@link Const#DYNAMIC_FILTERS_TYPE}
 * type, a list of {@link #getFilters()}.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
public class Variable {
  private final String name;
  private final String type;
  private final String value;
  private final List<String> values;
  private final List<DynamicFilter> filters;
  private final boolean multi_select;
  private final boolean escape_single_quotes;
  private final boolean is_loading;
  private final boolean is_variable_loading_pending;

  protected Variable(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    name = builder.name;
    type = builder.type;
    value = builder.value;
    values = builder.values == null ? null :
      Collections.unmodifiableList(builder.values);
    filters = builder.filters == null ?
        Collections.<DynamicFilter>emptyList() :
          ImmutableList.copyOf(builder.filters);
    multi_select = builder.multi_select;
    escape_single_quotes = builder.escape_single_quotes;
    is_loading = builder.is_loading;
    is_variable_loading_pending = builder.is_variable_loading_pending;
  }

  public String getName() {
    return name;
  }

  /** @return The variable type, e.g. "query_values" or "dynamic_filters". */
  public String getType() {
    return type;
  }

  /** @return The scalar value, may be null. */
  public String getValue() {
    return value;
  }

  /** @return The list value for array variables, null for scalars. */
  public List<String> getValues() {
    return values;
  }

  /** @return The ad hoc filters of a dynamic filter variable. */
  @JsonIgnore
  public List<DynamicFilter> getFilters() {
    return filters;
  }

  public boolean isMultiSelect() {
    return multi_select;
  }

  public boolean isEscapeSingleQuotes() {
    return escape_single_quotes;
  }

  /** @return True while the variable's values are being fetched. */
  @JsonIgnore
  public boolean isLoading() {
    return is_loading;
  }

  /** @return True while the variable waits on a parent variable. */
  @JsonIgnore
  public boolean isVariableLoadingPending() {
    return is_variable_loading_pending;
  }

  /** @return True if either loading flag is set. */
  @JsonIgnore
  public boolean isResolving() {
    return is_loading || is_variable_loading_pending;
  }

  /** @return True if this holds global ad hoc filters. */
  @JsonIgnore
  public boolean isDynamicFilter() {
    return Const.DYNAMIC_FILTERS_TYPE.equals(type);
  }

  /** @return True if this is an array valued variable. */
  @JsonIgnore
  public boolean isArray() {
    return values != null;
  }

  /** @return True if the value is null, empty or an empty list. */
  @JsonIgnore
  public boolean isEmptyValue() {
    if (values != null) {
      return values.isEmpty();
    }
    return Strings.isNullOrEmpty(value);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Variable other = (Variable) o;
    return Objects.equal(name, other.name)
        && Objects.equal(type, other.type)
        && Objects.equal(value, other.value)
        && Objects.equal(values, other.values)
        && Objects.equal(filters, other.filters)
        && multi_select == other.multi_select
        && escape_single_quotes == other.escape_single_quotes
        && is_loading == other.is_loading
        && is_variable_loading_pending == other.is_variable_loading_pending;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, type, value, values, filters);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("name=")
        .append(name)
        .append(", type=")
        .append(type)
        .append(", value=")
        .append(values != null ? values : value)
        .append(", loading=")
        .append(isResolving())
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Clones a variable into a new builder, handy for flipping the loading
   * flags or the value.
   * @param variable A non-null variable.
   * @return A populated builder.
   */
  public static Builder newBuilder(final Variable variable) {
    final Builder builder = new Builder()
        .setName(variable.name)
        .setType(variable.type)
        .setValue(variable.value)
        .setValues(variable.values)
        .setFilters(variable.filters)
        .setEscapeSingleQuotes(variable.escape_single_quotes)
        .setLoading(variable.is_loading)
        .setVariableLoadingPending(variable.is_variable_loading_pending)
        .setMultiSelect(variable.multi_select);
    return builder;
  }

  public static final class Builder {
    private String name;
    private String type;
    private String value;
    private List<String> values;
    private List<DynamicFilter> filters;
    private boolean multi_select;
    private boolean escape_single_quotes;
    private boolean is_loading;
    private boolean is_variable_loading_pending;

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setType(final String type) {
      this.type = type;
      return this;
    }

    /** Sets a scalar value. */
    public Builder setValue(final String value) {
      this.value = value;
      return this;
    }

    /** Sets a list value, marking the variable as an array. */
    public Builder setValues(final List<String> values) {
      this.values = values;
      return this;
    }

    public Builder setFilters(final List<DynamicFilter> filters) {
      this.filters = filters;
      return this;
    }

    public Builder setMultiSelect(final boolean multi_select) {
      this.multi_select = multi_select;
      return this;
    }

    public Builder setEscapeSingleQuotes(final boolean escape_single_quotes) {
      this.escape_single_quotes = escape_single_quotes;
      return this;
    }

    public Builder setLoading(final boolean is_loading) {
      this.is_loading = is_loading;
      return this;
    }

    public Builder setVariableLoadingPending(final boolean pending) {
      is_variable_loading_pending = pending;
      return this;
    }

    public Variable build() {
      return new Variable(this);
    }
  }
}
