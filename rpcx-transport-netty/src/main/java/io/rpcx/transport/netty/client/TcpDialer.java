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

package io.rpcx.transport.netty.client;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.rpcx.exceptions.DialException;
import io.rpcx.transport.ConnectOptions;
import io.rpcx.transport.netty.Addresses;
import java.net.SocketAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.tcp.TcpClient;

/** Dials the stream sockets shared by {@link DirectConnector} and {@link HttpTunnelConnector}. */
final class TcpDialer {

  private static final Logger logger = LoggerFactory.getLogger(TcpDialer.class);

  private TcpDialer() {}

  /**
   * Dials {@code address} with the connect timeout and TLS configuration of {@code options}.
   * Failures, including a malformed address, are signalled as {@link DialException}.
   */
  static Mono<Connection> dial(
      TcpClient client, ConnectOptions options, String network, String address) {
    return Mono.defer(
            () -> {
              SocketAddress remote = Addresses.resolve(network, address);
              TcpClient configured =
                  client
                      .remoteAddress(() -> remote)
                      .option(
                          ChannelOption.CONNECT_TIMEOUT_MILLIS,
                          (int) Math.min(Integer.MAX_VALUE, options.connectTimeout().toMillis()));

              SslContext tls = options.tlsConfig();
              if (tls != null) {
                configured = configured.secure(spec -> spec.sslContext(tls));
              }
              return configured.connect().<Connection>map(c -> c);
            })
        .onErrorMap(
            e -> !(e instanceof DialException),
            e -> {
              logger.warn("failed to dial server {} {}", network, address, e);
              return new DialException(network, address, e);
            });
  }
}
