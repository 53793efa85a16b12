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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelConfig;
import io.netty.channel.ChannelOption;
import io.netty.channel.epoll.EpollChannelOption;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioChannelOption;
import io.netty.handler.ssl.SslHandler;
import io.rpcx.DuplexConnection;
import io.rpcx.KeepAliveCapable;
import io.rpcx.internal.BaseDuplexConnection;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import jdk.net.ExtendedSocketOptions;
import reactor.core.publisher.Flux;
import reactor.netty.Connection;

/**
 * An implementation of {@link DuplexConnection} over a stream socket: plain TCP, TLS or a unix
 * domain socket. Only plain TCP connections are {@link KeepAliveCapable}.
 */
public class TcpDuplexConnection extends BaseDuplexConnection {

  final Connection connection;

  TcpDuplexConnection(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection must not be null");

    connection.onDispose(this::terminate);
    connection
        .outbound()
        .send(sender.asFlux())
        .then()
        .doFinally(__ -> connection.dispose())
        .subscribe();
  }

  /**
   * Wraps a connected {@link Connection}.
   *
   * @param connection the {@link Connection} to wrap
   * @return a {@link KeepAliveCapable} connection for plain TCP sockets, a plain one otherwise
   */
  public static TcpDuplexConnection create(Connection connection) {
    Objects.requireNonNull(connection, "connection must not be null");
    Channel channel = connection.channel();
    if (channel instanceof SocketChannel && channel.pipeline().get(SslHandler.class) == null) {
      return new KeepAlive(connection);
    }
    return new TcpDuplexConnection(connection);
  }

  @Override
  public ByteBufAllocator alloc() {
    return connection.channel().alloc();
  }

  @Override
  public SocketAddress localAddress() {
    return connection.channel().localAddress();
  }

  @Override
  public SocketAddress remoteAddress() {
    return connection.channel().remoteAddress();
  }

  @Override
  protected void doOnClose() {
    connection.dispose();
    terminate();
  }

  @Override
  protected Flux<ByteBuf> doReceive() {
    return connection.inbound().receive().retain();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + "connection=" + connection + '}';
  }

  static final class KeepAlive extends TcpDuplexConnection implements KeepAliveCapable {

    KeepAlive(Connection connection) {
      super(connection);
    }

    @Override
    public boolean keepAlive(Duration period) {
      Channel channel = connection.channel();
      ChannelConfig config = channel.config();
      int seconds = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, period.getSeconds()));

      boolean applied = config.setOption(ChannelOption.SO_KEEPALIVE, true);
      if (channel instanceof EpollSocketChannel) {
        applied &= config.setOption(EpollChannelOption.TCP_KEEPIDLE, seconds);
        applied &= config.setOption(EpollChannelOption.TCP_KEEPINTVL, seconds);
      } else {
        applied &=
            config.setOption(NioChannelOption.of(ExtendedSocketOptions.TCP_KEEPIDLE), seconds);
        applied &=
            config.setOption(NioChannelOption.of(ExtendedSocketOptions.TCP_KEEPINTERVAL), seconds);
      }
      return applied;
    }
  }
}
