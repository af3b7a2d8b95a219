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
package net.opendash.configuration;

import com.google.common.base.Strings;

/**
 * The registration for a configuration key: its type, default value,
 * whether it may change at runtime and a description for operators.
 *
 * @since 1.0
 */
public class ConfigurationEntrySchema {

  /** The key. */
  private final String key;

  /** The Java type values are converted to. */
  private final Class<?> type;

  /** The default, may be null when nullable. */
  protected Object default_value;

  /** Whether or not runtime overrides are accepted. */
  private final boolean dynamic;

  /** Whether or not the value may be null. */
  private final boolean nullable;

  /** A useful description. */
  private final String description;

  /** The class that registered the key. */
  private final String source;

  protected ConfigurationEntrySchema(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (Strings.isNullOrEmpty(builder.description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    if (builder.default_value == null &&
        !builder.nullable &&
        builder.type.isPrimitive()) {
      throw new IllegalArgumentException("Primitive type " + builder.type
          + " requires a default value for key: " + builder.key);
    }
    key = builder.key;
    type = builder.type;
    default_value = builder.default_value;
    dynamic = builder.dynamic;
    nullable = builder.nullable;
    description = builder.description;
    source = builder.source;
  }

  /** @return The key. */
  public String getKey() {
    return key;
  }

  /** @return The type values are converted to. */
  public Class<?> getType() {
    return type;
  }

  /** @return The default value, may be null. */
  public Object getDefaultValue() {
    return default_value;
  }

  /** @return Whether or not runtime overrides are accepted. */
  public boolean isDynamic() {
    return dynamic;
  }

  /** @return Whether or not a null value is allowed. */
  public boolean isNullable() {
    return nullable;
  }

  /** @return The description. */
  public String getDescription() {
    return description;
  }

  /** @return The registering source, may be null. */
  public String getSource() {
    return source;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("key=")
        .append(key)
        .append(", type=")
        .append(type)
        .append(", dynamic=")
        .append(dynamic)
        .append(", nullable=")
        .append(nullable)
        .append(", source=")
        .append(source)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String key;
    private Class<?> type;
    private Object default_value;
    private boolean dynamic;
    private boolean nullable;
    private String description;
    private String source;

    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }

    public Builder setType(final Class<?> type) {
      this.type = type;
      return this;
    }

    public Builder setDefaultValue(final Object default_value) {
      this.default_value = default_value;
      return this;
    }

    public Builder isDynamic() {
      dynamic = true;
      return this;
    }

    public Builder isNullable() {
      nullable = true;
      return this;
    }

    public Builder setDescription(final String description) {
      this.description = description;
      return this;
    }

    public Builder setSource(final String source) {
      this.source = source;
      return this;
    }

    public ConfigurationEntrySchema build() {
      return new ConfigurationEntrySchema(this);
    }
  }
}
