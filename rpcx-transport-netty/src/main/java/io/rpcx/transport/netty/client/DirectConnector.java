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

import io.rpcx.DuplexConnection;
import io.rpcx.exceptions.DialException;
import io.rpcx.transport.ClientContext;
import io.rpcx.transport.Connector;
import io.rpcx.transport.netty.TcpDuplexConnection;
import java.util.Objects;
import reactor.core.publisher.Mono;
import reactor.netty.tcp.TcpClient;
import reactor.util.annotation.Nullable;

/**
 * An implementation of {@link Connector} that dials a plain or TLS stream socket. The network
 * name selects the address family: {@code unix} addresses are socket paths, every other network
 * expects {@code host:port}.
 *
 * <p>This is also the connector used for transport names nothing else claims.
 */
public final class DirectConnector implements Connector {

  private final TcpClient client;

  private DirectConnector(TcpClient client) {
    this.client = client;
  }

  /**
   * Creates a new instance
   *
   * @return a new instance
   */
  public static DirectConnector create() {
    return create(TcpClient.create());
  }

  /**
   * Creates a new instance
   *
   * @param client the {@link TcpClient} to dial with; its remote address is replaced on every dial
   * @return a new instance
   * @throws NullPointerException if {@code client} is {@code null}
   */
  public static DirectConnector create(TcpClient client) {
    Objects.requireNonNull(client, "client must not be null");

    return new DirectConnector(client);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Fails with {@link DialException} if the socket cannot be established within {@link
   * io.rpcx.transport.ConnectOptions#connectTimeout()}.
   */
  @Override
  public Mono<DuplexConnection> connect(
      @Nullable ClientContext context, String network, String address) {
    if (context == null) {
      return Mono.error(new IllegalArgumentException("empty client"));
    }

    return TcpDialer.dial(client, context.options(), network, address)
        .map(TcpDuplexConnection::create);
  }
}
