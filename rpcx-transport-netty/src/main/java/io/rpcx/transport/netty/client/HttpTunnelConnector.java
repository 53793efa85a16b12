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

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.rpcx.DuplexConnection;
import io.rpcx.exceptions.DialException;
import io.rpcx.exceptions.TunnelNegotiationException;
import io.rpcx.transport.ClientContext;
import io.rpcx.transport.ConnectOptions;
import io.rpcx.transport.Connector;
import io.rpcx.transport.netty.TcpDuplexConnection;
import io.rpcx.transport.netty.TunnelHandshakeHandler;
import java.io.EOFException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.tcp.TcpClient;
import reactor.util.annotation.Nullable;

/**
 * An implementation of {@link Connector} that reaches an rpcx server through its HTTP endpoint.
 * It dials TCP, sends {@code CONNECT <rpcPath> HTTP/1.0} and hands over the raw socket once the
 * server answers {@value TunnelHandshakeHandler#CONNECTED}.
 */
public final class HttpTunnelConnector implements Connector {

  /** The operation reported by {@link TunnelNegotiationException#op()}. */
  public static final String OP = "dial-http";

  private static final Logger logger = LoggerFactory.getLogger(HttpTunnelConnector.class);

  private static final String TCP = "tcp";

  private final TcpClient client;

  private HttpTunnelConnector(TcpClient client) {
    this.client = client;
  }

  /**
   * Creates a new instance
   *
   * @return a new instance
   */
  public static HttpTunnelConnector create() {
    return create(TcpClient.create());
  }

  /**
   * Creates a new instance
   *
   * @param client the {@link TcpClient} to dial with
   * @return a new instance
   * @throws NullPointerException if {@code client} is {@code null}
   */
  public static HttpTunnelConnector create(TcpClient client) {
    Objects.requireNonNull(client, "client must not be null");

    return new HttpTunnelConnector(client);
  }

  /**
   * {@inheritDoc}
   *
   * <p>The socket is always dialled over TCP whatever {@code network} says. A dial failure is a
   * {@link DialException}; a failed negotiation closes the socket and is a {@link
   * TunnelNegotiationException}.
   */
  @Override
  public Mono<DuplexConnection> connect(
      @Nullable ClientContext context, String network, String address) {
    if (context == null) {
      return Mono.error(new IllegalArgumentException("empty client"));
    }

    ConnectOptions options = context.options();
    String path = options.rpcPathOrDefault();

    return TcpDialer.dial(client, options, TCP, address)
        .flatMap(connection -> negotiate(connection, path, network, address));
  }

  private Mono<DuplexConnection> negotiate(
      Connection connection, String path, String network, String address) {
    return Mono.<DuplexConnection>create(
            sink -> {
              Channel channel = connection.channel();
              if (!channel.isActive()) {
                sink.error(new EOFException("connection closed before the tunnel was requested"));
                return;
              }

              TunnelHandshakeHandler handler =
                  new TunnelHandshakeHandler(path, channel.newPromise());
              handler
                  .handshakeFuture()
                  .addListener(
                      (ChannelFutureListener)
                          future -> {
                            if (future.isSuccess()) {
                              sink.success(TcpDuplexConnection.create(connection));
                            } else {
                              sink.error(future.cause());
                            }
                          });
              sink.onCancel(
                  () -> {
                    if (!handler.handshakeFuture().isDone()) {
                      connection.dispose();
                    }
                  });
              connection.addHandlerFirst(TunnelHandshakeHandler.NAME, handler);
            })
        .onErrorMap(
            e -> {
              connection.dispose();
              logger.error("failed to open HTTP tunnel to {} {}", network, address, e);
              return new TunnelNegotiationException(OP, network, address, e);
            });
  }
}
