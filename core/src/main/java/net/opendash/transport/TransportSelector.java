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
package net.opendash.transport;

import net.opendash.configuration.Configuration;

/**
 * Picks the transport for a load cycle from the configuration: the HTTP
 * stream if enabled, else the push-socket if enabled, else partitioned
 * HTTP. A streaming transport whose client isn't wired falls through to
 * the next one.
 *
 * @since 1.0
 */
public class TransportSelector {
  public static final String HTTP_STREAM_KEY =
      "dashboard.transport.http_stream.enable";
  public static final String PUSH_SOCKET_KEY =
      "dashboard.transport.push_socket.enable";

  /** The transports in priority order. */
  public static enum Kind {
    HTTP_STREAM,
    PUSH_SOCKET,
    PARTITIONED;
  }

  private final Configuration config;
  private final TransportStrategy partitioned;
  private final TransportStrategy push_socket;
  private final TransportStrategy http_stream;

  /**
   * Default ctor.
   * @param config A non-null config.
   * @param partitioned The non-null partitioned HTTP transport.
   * @param push_socket The push-socket transport, null if not available.
   * @param http_stream The HTTP stream transport, null if not available.
   */
  public TransportSelector(final Configuration config,
                           final TransportStrategy partitioned,
                           final TransportStrategy push_socket,
                           final TransportStrategy http_stream) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (partitioned == null) {
      throw new IllegalArgumentException("The partitioned transport is "
          + "required.");
    }
    this.config = config;
    this.partitioned = partitioned;
    this.push_socket = push_socket;
    this.http_stream = http_stream;
    if (!config.hasProperty(HTTP_STREAM_KEY)) {
      config.register(HTTP_STREAM_KEY, false, true,
          "Whether to run SQL queries over a streamed HTTP response.");
    }
    if (!config.hasProperty(PUSH_SOCKET_KEY)) {
      config.register(PUSH_SOCKET_KEY, false, true,
          "Whether to run SQL queries over the push-socket when HTTP "
          + "streaming is off.");
    }
  }

  /**
   * @param http_stream_enabled Whether HTTP streaming is enabled.
   * @param push_socket_enabled Whether the push-socket is enabled.
   * @return The kind to use.
   */
  public static Kind choose(final boolean http_stream_enabled,
                            final boolean push_socket_enabled) {
    if (http_stream_enabled) {
      return Kind.HTTP_STREAM;
    }
    if (push_socket_enabled) {
      return Kind.PUSH_SOCKET;
    }
    return Kind.PARTITIONED;
  }

  /** @return The kind for the current configuration and wiring. */
  public Kind kind() {
    return choose(
        http_stream != null && config.getBoolean(HTTP_STREAM_KEY),
        push_socket != null && config.getBoolean(PUSH_SOCKET_KEY));
  }

  /** @return The transport for the current configuration. */
  public TransportStrategy select() {
    switch (kind()) {
    case HTTP_STREAM:
      return http_stream;
    case PUSH_SOCKET:
      return push_socket;
    default:
      return partitioned;
    }
  }
}
