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
package net.opendash.search;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates W3C trace context identifiers for backend requests.
 *
 * @since 1.0
 */
public final class TraceIds {
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private TraceIds() { }

  /** @return A random 32 character lower case hex trace id. */
  public static String newTraceId() {
    return randomHex(32);
  }

  /** @return A random 16 character lower case hex span id. */
  public static String newSpanId() {
    return randomHex(16);
  }

  /**
   * @param trace_id A trace id.
   * @return A sampled {@code traceparent} header value with a new span.
   */
  public static String traceparent(final String trace_id) {
    return "00-" + trace_id + "-" + newSpanId() + "-01";
  }

  private static String randomHex(final int length) {
    final ThreadLocalRandom random = ThreadLocalRandom.current();
    final char[] chars = new char[length];
    for (int i = 0; i < length; i++) {
      chars[i] = HEX[random.nextInt(16)];
    }
    // all zeros is an invalid id
    if (new String(chars).replace("0", "").isEmpty()) {
      chars[length - 1] = '1';
    }
    return new String(chars);
  }
}
