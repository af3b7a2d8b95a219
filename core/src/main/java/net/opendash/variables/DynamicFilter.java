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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

/**
 * A global ad hoc filter predicate, e.g. {@code k8s_namespace = prod},
 * applied to every query of every panel regardless of the query text.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = DynamicFilter.Builder.class)
public class DynamicFilter {
  private final String name;
  private final String operator;
  private final String value;

  protected DynamicFilter(final Builder builder) {
    name = builder.name;
    operator = builder.operator;
    value = builder.value;
  }

  public static DynamicFilter of(final String name,
                                 final String operator,
                                 final String value) {
    return newBuilder()
        .setName(name)
        .setOperator(operator)
        .setValue(value)
        .build();
  }

  /** @return The field or label name. */
  public String getName() {
    return name;
  }

  /** @return The comparison operator, e.g. "=" or "!=". */
  public String getOperator() {
    return operator;
  }

  public String getValue() {
    return value;
  }

  /** @return True if name, operator and value are all non-empty. */
  public boolean isComplete() {
    return !Strings.isNullOrEmpty(name) &&
           !Strings.isNullOrEmpty(operator) &&
           !Strings.isNullOrEmpty(value);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final DynamicFilter other = (DynamicFilter) o;
    return Objects.equal(name, other.name)
        && Objects.equal(operator, other.operator)
        && Objects.equal(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, operator, value);
  }

  @Override
  public String toString() {
    return name + " " + operator + " " + value;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String name;
    @JsonProperty
    private String operator;
    @JsonProperty
    private String value;

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setOperator(final String operator) {
      this.operator = operator;
      return this;
    }

    public Builder setValue(final String value) {
      this.value = value;
      return this;
    }

    public DynamicFilter build() {
      return new DynamicFilter(this);
    }
  }
}
