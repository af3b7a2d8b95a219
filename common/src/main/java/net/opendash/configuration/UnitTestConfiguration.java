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

import java.util.Map;

import com.google.common.collect.Maps;

/**
 * A helper for use with Unit Testing Configuration consumers. Neither
 * the properties file nor the system properties are consulted, only the
 * map given.
 *
 * @since 1.0
 */
public class UnitTestConfiguration extends Configuration {

  protected UnitTestConfiguration(final Map<String, String> settings) {
    super(settings);
  }

  /** @return A config with no provider values. */
  public static UnitTestConfiguration getConfiguration() {
    return new UnitTestConfiguration(Maps.<String, String>newHashMap());
  }

  /**
   * Returns a config that resolves registered keys against the given
   * map. The map is read at registration time.
   *
   * @param settings A non-null map of key values to load.
   * @return A non-null config.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, String> settings) {
    return new UnitTestConfiguration(settings);
  }

  /**
   * Allows a UnitTest to inject a value into the config regardless of
   * the dynamic flag. It still requires that a config key be registered.
   * Callbacks fire when the value changes.
   *
   * @param key A non-null and non-empty key.
   * @param value A value to inject.
   * @throws ConfigurationException if the key wasn't registered or the
   * value could not be converted.
   */
  public void override(final String key, final Object value) {
    getEntry(key).setOverride(value);
  }
}
