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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import net.opendash.transpile.IntervalFormatter.Interval;

public class TestIntervalFormatter {

  @Test
  public void roundInterval() throws Exception {
    assertEquals(1, IntervalFormatter.roundInterval(0));
    assertEquals(1, IntervalFormatter.roundInterval(9));
    assertEquals(10, IntervalFormatter.roundInterval(10));
    assertEquals(5000, IntervalFormatter.roundInterval(3600));
    assertEquals(20000, IntervalFormatter.roundInterval(23400));
    assertEquals(3600000, IntervalFormatter.roundInterval(4000000));
    assertEquals(604800000, IntervalFormatter.roundInterval(1000000000));
    assertEquals(31536000000L,
        IntervalFormatter.roundInterval(Long.MAX_VALUE));
  }

  @Test
  public void formatInterval() throws Exception {
    Interval interval = IntervalFormatter.formatInterval(23.4);
    assertEquals("20s", interval.toString());
    assertEquals(20, interval.getValue());
    assertEquals("s", interval.getUnit());
    assertEquals(20000, interval.toMillis());
    assertEquals(20.0, interval.toSeconds(), 0.0001);

    assertEquals("1ms", IntervalFormatter.formatInterval(0.003).toString());
    assertEquals("200ms", IntervalFormatter.formatInterval(0.25).toString());
    assertEquals("2m", IntervalFormatter.formatInterval(90).toString());
    assertEquals("1h", IntervalFormatter.formatInterval(4000).toString());
    assertEquals("1w",
        IntervalFormatter.formatInterval(86400 * 10).toString());
    assertEquals("30d",
        IntervalFormatter.formatInterval(86400 * 30).toString());
    assertEquals("1y",
        IntervalFormatter.formatInterval(86400 * 365 * 2).toString());
  }

  @Test
  public void formatRateInterval() throws Exception {
    assertEquals("1m15s", IntervalFormatter.formatRateInterval(75));
    assertEquals("1h", IntervalFormatter.formatRateInterval(3600));
    assertEquals("1d1h1m1s", IntervalFormatter.formatRateInterval(90061));
    assertEquals("1m", IntervalFormatter.formatRateInterval(60.4));
    assertEquals("0s", IntervalFormatter.formatRateInterval(0));
    assertEquals("0s", IntervalFormatter.formatRateInterval(-5));
  }
}
