/*
 * Copyright 2015-2020 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.rpcx.transport.netty;

import io.netty.channel.unix.DomainSocketAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/** Utilities for turning the textual addresses of rpcx transports into {@link SocketAddress}es. */
public final class Addresses {

  /** The transport name whose addresses are filesystem paths of Unix domain sockets. */
  public static final String UNIX = "unix";

  private Addresses() {}

  /**
   * Returns the socket address to dial for {@code address} on {@code network}. Unix networks map to
   * a {@link DomainSocketAddress}; every other network expects {@code host:port}.
   *
   * @param network the transport name
   * @param address the address to parse
   * @return an unresolved socket address
   * @throws IllegalArgumentException if {@code address} is malformed
   * @throws NullPointerException if {@code network} or {@code address} is {@code null}
   */
  public static SocketAddress resolve(String network, String address) {
    Objects.requireNonNull(network, "network must not be null");
    Objects.requireNonNull(address, "address must not be null");

    if (network.startsWith(UNIX)) {
      if (address.isEmpty()) {
        throw new IllegalArgumentException("missing path in address");
      }
      return new DomainSocketAddress(address);
    }
    return hostAndPort(address);
  }

  /**
   * Splits {@code host:port}, accepting bracketed IPv6 hosts such as {@code [::1]:8972}. An empty
   * host means the local system.
   *
   * @param address the address to parse
   * @return an unresolved {@link InetSocketAddress}
   * @throws IllegalArgumentException if the port is missing or invalid
   */
  public static InetSocketAddress hostAndPort(String address) {
    Objects.requireNonNull(address, "address must not be null");

    int colon = address.lastIndexOf(':');
    if (colon < 0) {
      throw new IllegalArgumentException("missing port in address " + address);
    }

    String host = address.substring(0, colon);
    if (host.startsWith("[")) {
      if (!host.endsWith("]")) {
        throw new IllegalArgumentException("missing ']' in address " + address);
      }
      host = host.substring(1, host.length() - 1);
    } else if (host.indexOf(':') >= 0) {
      throw new IllegalArgumentException("too many colons in address " + address);
    }
    if (host.isEmpty()) {
      host = "localhost";
    }

    int port;
    try {
      port = Integer.parseInt(address.substring(colon + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid port in address " + address, e);
    }
    if (port < 0 || port > 0xFFFF) {
      throw new IllegalArgumentException("invalid port in address " + address);
    }

    return InetSocketAddress.createUnresolved(host, port);
  }
}
