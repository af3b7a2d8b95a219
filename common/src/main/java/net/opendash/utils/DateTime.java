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
package net.opendash.utils;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import com.google.common.base.Strings;

/**
 * Utility functions for parsing durations and offsets and for reading
 * the clock in a way tests can swap out.
 *
 * @since 1.0
 */
public class DateTime {

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li>
   * <li>{@code n}: month (30 days)</li>
   * <li>{@code y}: years (365 days)</li></ul>
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of milliseconds.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static final long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    long interval;
    long multiplier;
    int unit = 0;
    while (Character.isDigit(duration.charAt(unit))) {
      unit++;
      if (unit >= duration.length()) {
        throw new IllegalArgumentException("Invalid duration, must have an "
            + "integer and unit: " + duration);
      }
    }
    try {
      interval = Long.parseLong(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): "
          + duration);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: "
          + duration);
    }
    final String suffix = duration.substring(unit).toLowerCase();
    switch (suffix) {
      case "ms": return interval;
      case "s": multiplier = 1; break;
      case "m": multiplier = 60; break;
      case "h": multiplier = 3600; break;
      case "d": multiplier = 3600 * 24; break;
      case "w": multiplier = 3600 * 24 * 7; break;
      case "n": multiplier = 3600 * 24 * 30; break;
      case "y": multiplier = 3600 * 24 * 365; break;
      default: throw new IllegalArgumentException("Invalid duration (suffix): "
          + duration);
    }
    multiplier *= 1000;
    if ((double) interval * multiplier > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE ms: "
          + duration);
    }
    return interval * multiplier;
  }

  /**
   * Converts a time shift offset such as "15m", "1d", "1M" or "2y" into
   * a number of seconds to subtract from the given end timestamp. Months
   * ({@code M}) and years ({@code y}) are calendar aware in UTC, e.g. one
   * month before March 31st is the last day of February. Other units
   * follow {@link #parseDuration(String)}.
   *
   * @param offset A non-null and non-empty offset.
   * @param end_ms The end of the range the offset applies to in epoch ms.
   * @return The offset in seconds, always positive.
   * @throws IllegalArgumentException if the offset was malformed.
   */
  public static long offsetToSeconds(final String offset, final long end_ms) {
    if (Strings.isNullOrEmpty(offset)) {
      throw new IllegalArgumentException("Offset cannot be null or empty.");
    }
    final String trimmed = offset.trim();
    final char suffix = trimmed.charAt(trimmed.length() - 1);
    if (suffix == 'M' || suffix == 'y' || suffix == 'Y') {
      final long amount;
      try {
        amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid offset (number): "
            + offset);
      }
      if (amount <= 0) {
        throw new IllegalArgumentException("Zero or negative offset: "
            + offset);
      }
      final ZonedDateTime end = Instant.ofEpochMilli(end_ms)
          .atZone(ZoneOffset.UTC);
      final ZonedDateTime shifted = suffix == 'M' ?
          end.minusMonths(amount) : end.minusYears(amount);
      return (end_ms - shifted.toInstant().toEpochMilli()) / 1000;
    }
    return parseDuration(trimmed) / 1000;
  }

  /**
   * Pass through to {@link System#currentTimeMillis()} for use in classes
   * to make unit testing easier.
   * @return The current epoch time in milliseconds
   */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  /**
   * Pass through to {@link System#nanoTime()} for use in classes to
   * make unit testing easier.
   * @return The current JVM nano time.
   */
  public static long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp
   * @param start The start timestamp
   * @return The value in milliseconds
   * @throws IllegalArgumentException if end is less than start
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }
}
