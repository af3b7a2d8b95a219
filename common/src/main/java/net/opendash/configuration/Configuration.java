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

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;

/**
 * A configuration that flattens values from a few sources into a single
 * key to value map. Keys must be registered with a
 * {@link ConfigurationEntrySchema} before they can be read or overridden
 * so that the type, default and description are known.
 * <p>
 * Sources, from least to most significant:
 * <ol>
 * <li>The schema default.</li>
 * <li>The {@link #PROPERTIES_FILE} on the class path.</li>
 * <li>JVM system properties.</li>
 * <li>Runtime overrides via {@link #addOverride(String, Object)}, only
 * accepted for keys registered as dynamic.</li>
 * </ol>
 * <p>
 * For dynamic keys, a callback can be registered with
 * {@link #bind(String, ConfigurationCallback)}. It's called immediately
 * with the current value and then any time the flattened value changes.
 *
 * @since 1.0
 */
public class Configuration {
  private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);

  /**
   * Jackson de/serializer shared in order to use the converter for
   * handling type conversion.
   */
  protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  static {
    OBJECT_MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    OBJECT_MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
  }

  /** The class path resource loaded at construction if present. */
  public static final String PROPERTIES_FILE = "opendash.properties";

  /** The main configuration. Everything works off this.*/
  protected final Map<String, ConfigurationEntry> merged_config;

  /** Raw values from the file and system properties, keyed on name. */
  protected final Map<String, String> provider_values;

  /**
   * Default ctor that loads the {@link #PROPERTIES_FILE} from the class
   * path, when present, and the system properties.
   * @throws ConfigurationException if the file was present but could not
   * be read.
   */
  public Configuration() {
    this(loadProviderValues());
  }

  /**
   * Ctor with a fixed set of provider values.
   * @param provider_values A non-null, possibly empty map.
   */
  protected Configuration(final Map<String, String> provider_values) {
    if (provider_values == null) {
      throw new IllegalArgumentException("Provider values cannot be null.");
    }
    this.provider_values = provider_values;
    merged_config = Maps.newConcurrentMap();
  }

  /**
   * Registers a schema and loads any value the providers have for it.
   *
   * @param schema A non-null schema.
   * @throws IllegalArgumentException if the schema was null.
   * @throws ConfigurationException if the key was already registered or
   * the provider value could not be converted.
   */
  public void register(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    final ConfigurationEntry entry = new ConfigurationEntry(schema);
    final ConfigurationEntry extant =
        merged_config.putIfAbsent(schema.getKey(), entry);
    if (extant != null) {
      throw new ConfigurationException("[" + schema.getKey()
          + "] Failed to set the schema as another source ["
          + extant.schema().getSource() + "] already registered it before ["
          + schema.getSource() + "]");
    }
    if (provider_values.containsKey(schema.getKey())) {
      entry.setProviderValue(provider_values.get(schema.getKey()));
      if (LOG.isDebugEnabled()) {
        LOG.debug("Loaded provider value for key: " + schema.getKey());
      }
    }
  }

  /**
   * Registers a nullable string key.
   *
   * @param key A non-null and non-empty key.
   * @param default_value A default value, may be null.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final String default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(key, String.class, default_value, is_dynamic, true, description);
  }

  /**
   * Registers an integer key.
   * @see #register(String, String, boolean, String)
   */
  public void register(final String key,
                       final int default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(key, int.class, default_value, is_dynamic, false, description);
  }

  /**
   * Registers a long key.
   * @see #register(String, String, boolean, String)
   */
  public void register(final String key,
                       final long default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(key, long.class, default_value, is_dynamic, false, description);
  }

  /**
   * Registers a boolean key.
   * @see #register(String, String, boolean, String)
   */
  public void register(final String key,
                       final boolean default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(key, boolean.class, default_value, is_dynamic, false,
        description);
  }

  private void register(final String key,
                        final Class<?> type,
                        final Object default_value,
                        final boolean is_dynamic,
                        final boolean is_nullable,
                        final String description) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    final ConfigurationEntrySchema.Builder builder =
        ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setType(type)
        .setDefaultValue(default_value)
        .setSource(callerClassName())
        .setDescription(description);
    if (is_dynamic) {
      builder.isDynamic();
    }
    if (is_nullable) {
      builder.isNullable();
    }
    register(builder.build());
  }

  /**
   * Sets a runtime override for a dynamic key. Bound callbacks are
   * executed if the flattened value changed.
   *
   * @param key A non-null and non-empty key.
   * @param value The value to set.
   * @return True if the value changed, false if it was the same.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered, was
   * not dynamic or the value could not be converted.
   */
  public boolean addOverride(final String key, final Object value) {
    final ConfigurationEntry entry = getEntry(key);
    if (!entry.schema().isDynamic()) {
      throw new ConfigurationException("Key [" + key + "] is not dynamic "
          + "and cannot be overridden at runtime.");
    }
    return entry.setOverride(value);
  }

  /**
   * Attaches the given callback to the key so that the caller can
   * receive updates any time the flattened value has changed. Note that
   * callback processing order is indeterminate.
   *
   * @param key A non-null and non-empty config key entry.
   * @param callback A non-null callback.
   * @throws IllegalArgumentException if the key was null or empty or the
   * callback was null.
   * @throws ConfigurationException if the key did not exist.
   */
  public void bind(final String key,
                   final ConfigurationCallback<?> callback) {
    if (callback == null) {
      throw new IllegalArgumentException("Callback cannot be null.");
    }
    getEntry(key).addCallback(callback);
  }

  /**
   * Returns the given config value converted to the given type.
   *
   * @param key The non-null and non-empty config key entry.
   * @param type A non-null class to cast to.
   * @return The value found, may be null if set to null for non-primitive
   * types.
   * @throws ConfigurationException if the key was not registered or a
   * null was found for a primitive type.
   */
  @SuppressWarnings("unchecked")
  public <T> T getTyped(final String key, final Class<?> type) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    final Object value = getEntry(key).getValue();
    if (value == null) {
      if (type.isPrimitive()) {
        throw new ConfigurationException("Cannot cast null to a "
            + "primitive type: " + type);
      }
      return null;
    }
    if (!value.getClass().equals(type)) {
      return (T) OBJECT_MAPPER.convertValue(value, type);
    }
    return (T) value;
  }

  /**
   * @param key The non-null and non-empty config key entry.
   * @return A String if the entry had a value, null if it was set to null.
   * @throws ConfigurationException if the key did not exist.
   */
  public String getString(final String key) {
    return getTyped(key, String.class);
  }

  /**
   * @param key A non-null and non-empty key.
   * @return An integer value.
   * @throws ConfigurationException if the key did not exist.
   */
  public int getInt(final String key) {
    return (int) getTyped(key, int.class);
  }

  /**
   * @param key A non-null and non-empty key.
   * @return A long integer value.
   * @throws ConfigurationException if the key did not exist.
   */
  public long getLong(final String key) {
    return (long) getTyped(key, long.class);
  }

  /**
   * Checks to see if the value of the key is true or false. Nulls count
   * as false and only the values in the set [true, 1, yes] count as
   * true (cast to lower case in string form).
   *
   * @param key A non-null and non-empty key.
   * @return A boolean value.
   * @throws ConfigurationException if the key did not exist.
   */
  public boolean getBoolean(final String key) {
    final Object value = getEntry(key).getValue();
    if (value == null) {
      return false;
    }
    return parseBoolean(value.toString());
  }

  /**
   * Determines if the given key has been registered.
   *
   * @param key A non-null and no-empty key.
   * @return True if the key was registered, false if not and calls
   * to read methods would throw an exception.
   * @throws IllegalArgumentException if the key was null or empty.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return merged_config.containsKey(key);
  }

  /**
   * Parses the string as [true, 1, yes] for true, anything else false.
   * @param value The value to parse, may be null.
   * @return The parsed value.
   */
  static boolean parseBoolean(final String value) {
    if (Strings.isNullOrEmpty(value)) {
      return false;
    }
    final String bool = value.toLowerCase().trim();
    return bool.equals("true") ||
           bool.equals("1") ||
           bool.equals("yes");
  }

  protected ConfigurationEntry getEntry(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ConfigurationEntry entry = merged_config.get(key);
    if (entry == null) {
      throw new ConfigurationException("No registration found for key: "
          + key);
    }
    return entry;
  }

  /**
   * Loads the class path properties file then lays the system properties
   * over it.
   * @return A non-null map.
   * @throws ConfigurationException if the file could not be read.
   */
  private static Map<String, String> loadProviderValues() {
    final Map<String, String> values = Maps.newHashMap();
    final ClassLoader loader = Configuration.class.getClassLoader();
    try (final InputStream stream = loader == null ? null :
        loader.getResourceAsStream(PROPERTIES_FILE)) {
      if (stream != null) {
        final Properties properties = new Properties();
        properties.load(stream);
        for (final String name : properties.stringPropertyNames()) {
          values.put(name, properties.getProperty(name));
        }
        LOG.info("Loaded " + values.size() + " settings from "
            + PROPERTIES_FILE);
      }
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read " + PROPERTIES_FILE, e);
    }
    final Properties system = System.getProperties();
    for (final String name : system.stringPropertyNames()) {
      values.put(name, system.getProperty(name));
    }
    return values;
  }

  /** @return The name of the class that called one of the register
   * helpers. */
  private static String callerClassName() {
    final StackTraceElement[] trace = Thread.currentThread().getStackTrace();
    for (int i = 1; i < trace.length; i++) {
      if (!trace[i].getClassName().equals(Configuration.class.getName()) &&
          !trace[i].getClassName().equals(Thread.class.getName())) {
        return trace[i].getClassName();
      }
    }
    return Configuration.class.getName();
  }
}
