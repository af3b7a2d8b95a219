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

import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Sets;

/**
 * A package private container in the main config map holding the
 * schema, the value loaded from a provider, a runtime override and the
 * bound callbacks for a key.
 *
 * @since 1.0
 */
@SuppressWarnings("rawtypes")
class ConfigurationEntry {
  private static final Logger LOG = LoggerFactory.getLogger(
      ConfigurationEntry.class);

  /** The schema. */
  private final ConfigurationEntrySchema schema;

  /** A value found in the properties file or system properties. */
  private volatile Object provider_value;

  /** Whether or not the provider had a value. */
  private volatile boolean has_provider_value;

  /** A runtime override. */
  private volatile Object override;

  /** Whether or not an override was set. */
  private volatile boolean has_override;

  /** A set of callbacks, lazily initialized. */
  private Set<ConfigurationCallback> callbacks;

  /**
   * Package private ctor.
   * @param schema A non-null schema.
   */
  protected ConfigurationEntry(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    this.schema = schema;
  }

  /**
   * Determines the value to respond with based on the override, the
   * provider value and the schema default, in that order.
   * @return A value, may be null.
   */
  public Object getValue() {
    if (has_override) {
      return override;
    }
    if (has_provider_value) {
      return provider_value;
    }
    return schema.getDefaultValue();
  }

  /**
   * Sets the value loaded from a provider. Converted to the schema type.
   * @param value The raw value, may be null.
   */
  void setProviderValue(final Object value) {
    provider_value = convert(value);
    has_provider_value = true;
  }

  /**
   * Sets the runtime override and fires callbacks if the flattened value
   * changed.
   * @param value The value to set, may be null if nullable.
   * @return True if the value changed, false if it was the same.
   * @throws ConfigurationException if the value could not be converted.
   */
  @SuppressWarnings("unchecked")
  boolean setOverride(final Object value) {
    final Object converted = convert(value);
    final Object previous = getValue();
    override = converted;
    has_override = true;
    if (Objects.equals(previous, converted)) {
      return false;
    }
    if (callbacks != null) {
      for (final ConfigurationCallback cb : callbacks) {
        try {
          cb.update(schema.getKey(), converted);
        } catch (Throwable t) {
          LOG.error("Failed to execute config callback: " + cb, t);
        }
      }
    }
    return true;
  }

  /**
   * Adds the callback and calls it immediately with the current value.
   * @param callback A non-null callback.
   */
  @SuppressWarnings("unchecked")
  public void addCallback(final ConfigurationCallback callback) {
    if (callback == null) {
      throw new IllegalArgumentException("Callback cannot be null.");
    }

    if (callbacks == null) {
      synchronized(this) {
        if (callbacks == null) {
          callbacks = Sets.newConcurrentHashSet();
        }
      }
    }

    try {
      callback.update(schema.getKey(), getValue());
    } catch (Throwable t) {
      LOG.error("Failed to execute config callback: " + callback, t);
    }

    callbacks.add(callback);
  }

  /**
   * Converts the value to the schema type via Jackson.
   * @param value The value to convert.
   * @return The converted value.
   * @throws ConfigurationException if the value was null for a
   * non-nullable key or could not be converted.
   */
  private Object convert(final Object value) {
    if (value == null) {
      if (!schema.isNullable()) {
        throw new ConfigurationException("Null is not allowed for key: "
            + schema.getKey());
      }
      return null;
    }
    if (value.getClass().equals(schema.getType())) {
      return value;
    }
    if ((schema.getType() == boolean.class ||
         schema.getType() == Boolean.class) &&
        value instanceof String) {
      return Configuration.parseBoolean((String) value);
    }
    try {
      return Configuration.OBJECT_MAPPER.convertValue(value,
          schema.getType());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unable to convert value [" + value
          + "] to " + schema.getType() + " for key: " + schema.getKey(), e);
    }
  }

  @VisibleForTesting
  ConfigurationEntrySchema schema() {
    return schema;
  }

  @VisibleForTesting
  Set<ConfigurationCallback> callbacks() {
    return callbacks;
  }
}
