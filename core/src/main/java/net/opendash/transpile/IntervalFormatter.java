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

/**
 * Rounds raw query intervals to human friendly steps and formats them
 * with a unit suffix, e.g. 23,400ms rounds to 20s.
 *
 * @since 1.0
 */
public final class IntervalFormatter {

  /** Units from largest to smallest with their size in milliseconds. */
  private static final String[] UNITS = { "y", "w", "d", "h", "m", "s", "ms" };
  private static final long[] UNIT_MS = {
      365L * 86400000L, 7L * 86400000L, 86400000L, 3600000L, 60000L, 1000L, 1L
  };

  /** An interval expressed as an integer count of a unit. */
  public static class Interval {
    private final long value;
    private final String unit;
    private final long millis;

    Interval(final long value, final String unit, final long millis) {
      this.value = value;
      this.unit = unit;
      this.millis = millis;
    }

    /** @return The count of units. */
    public long getValue() {
      return value;
    }

    /** @return The unit suffix, one of y, w, d, h, m, s or ms. */
    public String getUnit() {
      return unit;
    }

    /** @return The interval in milliseconds. */
    public long toMillis() {
      return millis;
    }

    /** @return The interval in seconds, possibly fractional. */
    public double toSeconds() {
      return millis / 1000.0;
    }

    @Override
    public String toString() {
      return value + unit;
    }
  }

  /**
   * Rounds an interval to the nearest friendly step.
   * @param interval_ms The raw interval in milliseconds.
   * @return The rounded interval in milliseconds, at least 1.
   */
  public static long roundInterval(final long interval_ms) {
    if (interval_ms < 10) return 1;
    if (interval_ms < 15) return 10;
    if (interval_ms < 35) return 20;
    if (interval_ms < 75) return 50;
    if (interval_ms < 150) return 100;
    if (interval_ms < 350) return 200;
    if (interval_ms < 750) return 500;
    if (interval_ms < 1500) return 1000;
    if (interval_ms < 3500) return 2000;
    if (interval_ms < 7500) return 5000;
    if (interval_ms < 12500) return 10000;
    if (interval_ms < 17500) return 15000;
    if (interval_ms < 25000) return 20000;
    if (interval_ms < 45000) return 30000;
    if (interval_ms < 90000) return 60000;
    if (interval_ms < 210000) return 120000;
    if (interval_ms < 450000) return 300000;
    if (interval_ms < 750000) return 600000;
    if (interval_ms < 1050000) return 900000;
    if (interval_ms < 1500000) return 1200000;
    if (interval_ms < 2700000) return 1800000;
    if (interval_ms < 5400000) return 3600000;
    if (interval_ms < 9000000) return 7200000;
    if (interval_ms < 16200000) return 10800000;
    if (interval_ms < 32400000) return 21600000;
    if (interval_ms < 86400000) return 43200000;
    if (interval_ms < 604800000) return 86400000;
    if (interval_ms < 1814400000) return 604800000;
    if (interval_ms < 3628800000L) return 2592000000L;
    return 31536000000L;
  }

  /**
   * Rounds the raw interval and expresses it in the largest unit that
   * divides it evenly.
   * @param seconds The raw interval in seconds.
   * @return A non-null interval.
   */
  public static Interval formatInterval(final double seconds) {
    final long rounded = roundInterval(Math.round(seconds * 1000));
    for (int i = 0; i < UNITS.length; i++) {
      if (rounded % UNIT_MS[i] == 0) {
        return new Interval(rounded / UNIT_MS[i], UNITS[i], rounded);
      }
    }
    // unreachable as ms always divides
    return new Interval(rounded, "ms", rounded);
  }

  /**
   * Formats a rate window as a compound duration, e.g. 75 seconds is
   * "1m15s" and 3600 is "1h".
   * @param seconds The window in seconds, rounded to whole seconds.
   * @return A non-null and non-empty string.
   */
  public static String formatRateInterval(final double seconds) {
    long remaining = Math.round(seconds);
    if (remaining <= 0) {
      return "0s";
    }
    final StringBuilder buf = new StringBuilder();
    final long days = remaining / 86400;
    remaining %= 86400;
    final long hours = remaining / 3600;
    remaining %= 3600;
    final long minutes = remaining / 60;
    remaining %= 60;
    if (days > 0) {
      buf.append(days).append("d");
    }
    if (hours > 0) {
      buf.append(hours).append("h");
    }
    if (minutes > 0) {
      buf.append(minutes).append("m");
    }
    if (remaining > 0) {
      buf.append(remaining).append("s");
    }
    return buf.toString();
  }

  private IntervalFormatter() {
    // static helpers
  }
}
