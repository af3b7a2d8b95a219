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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;

/**
 * Provenance for one placeholder actually replaced in a query. The value
 * is a string for fixed and scalar variables and may be a list for array
 * variables so it's kept as a tree.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = Substitution.Builder.class)
public class Substitution {
  private final SubstitutionType type;
  private final String name;
  private final JsonNode value;
  private final String operator;

  protected Substitution(final Builder builder) {
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    type = builder.type;
    name = builder.name;
    value = builder.value;
    operator = builder.operator;
  }

  public SubstitutionType getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  /** @return The substituted value, may be a null node. */
  public JsonNode getValue() {
    return value;
  }

  /** @return The operator for ad hoc filters, null otherwise. */
  public String getOperator() {
    return operator;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Substitution other = (Substitution) o;
    return type == other.type
        && Objects.equal(name, other.name)
        && Objects.equal(value, other.value)
        && Objects.equal(operator, other.operator);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, name, value, operator);
  }

  @Override
  public String toString() {
    return type.getName() + ":" + name + "=" + value
        + (operator == null ? "" : " op=" + operator);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private SubstitutionType type;
    @JsonProperty
    private String name;
    @JsonProperty
    private JsonNode value;
    @JsonProperty
    private String operator;

    public Builder setType(final SubstitutionType type) {
      this.type = type;
      return this;
    }

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setValue(final JsonNode value) {
      this.value = value;
      return this;
    }

    public Builder setOperator(final String operator) {
      this.operator = operator;
      return this;
    }

    public Substitution build() {
      return new Substitution(this);
    }
  }
}
