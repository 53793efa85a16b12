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
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.ssl.SslContext;
import io.rpcx.DuplexConnection;
import io.rpcx.transport.ClientContext;
import io.rpcx.transport.ConnectOptions;
import io.rpcx.transport.Connector;
import io.rpcx.transport.netty.WebsocketDuplexConnection;
import java.util.Objects;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;
import reactor.util.annotation.Nullable;

/**
 * An implementation of {@link Connector} that connects over a WebSocket to {@code
 * ws://<address><rpcPath>}, or {@code wss://} when the network is {@value #WSS}. Errors of the
 * WebSocket dial are signalled unchanged.
 */
public final class WebsocketConnector implements Connector {

  public static final String WS = "ws";

  public static final String WSS = "wss";

  static final int MAX_FRAME_PAYLOAD_LENGTH = 0xFFFFFF;

  private final HttpClient client;

  private WebsocketConnector(HttpClient client) {
    this.client = client;
  }

  /**
   * Creates a new instance
   *
   * @return a new instance
   */
  public static WebsocketConnector create() {
    return create(HttpClient.create());
  }

  /**
   * Creates a new instance
   *
   * @param client the {@link HttpClient} to use
   * @return a new instance
   * @throws NullPointerException if {@code client} is {@code null}
   */
  public static WebsocketConnector create(HttpClient client) {
    Objects.requireNonNull(client, "client must not be null");

    return new WebsocketConnector(client);
  }

  @Override
  public Mono<DuplexConnection> connect(
      @Nullable ClientContext context, String network, String address) {
    if (context == null) {
      return Mono.error(new IllegalArgumentException("empty client"));
    }

    ConnectOptions options = context.options();
    boolean secure = WSS.equals(network);
    String url = url(secure, address, options.rpcPathOrDefault());
    String origin = origin(secure, address);

    return Mono.defer(
        () -> {
          HttpClient configured =
              client
                  .headers(headers -> headers.set(HttpHeaderNames.ORIGIN, origin))
                  .option(
                      ChannelOption.CONNECT_TIMEOUT_MILLIS,
                      (int) Math.min(Integer.MAX_VALUE, options.connectTimeout().toMillis()));

          SslContext tls = options.tlsConfig();
          if (secure && tls != null) {
            configured = configured.secure(spec -> spec.sslContext(tls));
          }

          return configured
              .websocket(
                  WebsocketClientSpec.builder()
                      .maxFramePayloadLength(MAX_FRAME_PAYLOAD_LENGTH)
                      .build())
              .uri(url)
              .connect()
              .map(WebsocketDuplexConnection::new);
        });
  }

  static String url(boolean secure, String address, String path) {
    return (secure ? "wss://" : "ws://") + address + path;
  }

  static String origin(boolean secure, String address) {
    return (secure ? "https://" : "http://") + address;
  }
}
