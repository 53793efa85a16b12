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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.TooLongFrameException;
import java.io.EOFException;
import java.net.ProtocolException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

final class TunnelHandshakeHandlerTest {

  private EmbeddedChannel channel;
  private ChannelPromise handshake;

  @BeforeEach
  void setUp() {
    channel = new EmbeddedChannel();
    handshake = channel.newPromise();
    channel
        .pipeline()
        .addLast(TunnelHandshakeHandler.NAME, new TunnelHandshakeHandler("/_rpcx_", handshake));
  }

  @DisplayName("writes the CONNECT request when added")
  @Test
  void writesRequest() {
    ByteBuf request = channel.readOutbound();

    assertThat(text(request)).isEqualTo("CONNECT /_rpcx_ HTTP/1.0\r\n\r\n");
  }

  @DisplayName("removes itself and forwards the bytes after the response head")
  @Test
  void connected() {
    channel.writeInbound(ascii("HTTP/1.0 200 Connected to rpcx\r\n\r\nleftover"));

    assertThat(handshake.isSuccess()).isTrue();
    assertThat(channel.pipeline().get(TunnelHandshakeHandler.NAME)).isNull();
    assertThat(text(channel.readInbound())).isEqualTo("leftover");
    assertThat(channel.isOpen()).isTrue();
  }

  @DisplayName("waits for a response head split across reads")
  @Test
  void splitResponse() {
    channel.writeInbound(ascii("HTTP/1.0 200 Conn"));
    assertThat(handshake.isDone()).isFalse();

    channel.writeInbound(ascii("ected to rpcx\r\n"));
    assertThat(handshake.isDone()).isFalse();

    channel.writeInbound(ascii("\r\n"));
    assertThat(handshake.isSuccess()).isTrue();
    assertThat((Object) channel.readInbound()).isNull();
  }

  @DisplayName("accepts bare line feeds and response headers")
  @Test
  void bareLineFeeds() {
    channel.writeInbound(ascii("HTTP/1.1 200 Connected to rpcx\nServer: rpcx\n\nx"));

    assertThat(handshake.isSuccess()).isTrue();
    assertThat(text(channel.readInbound())).isEqualTo("x");
  }

  @DisplayName("fails and closes on any other status")
  @Test
  void unexpectedStatus() {
    channel.writeInbound(ascii("HTTP/1.0 403 Forbidden\r\n\r\n"));

    assertThat(handshake.isDone()).isTrue();
    assertThat(handshake.cause())
        .isInstanceOf(ProtocolException.class)
        .hasMessage("unexpected HTTP response: 403 Forbidden");
    assertThat(channel.isOpen()).isFalse();
  }

  @DisplayName("fails on a reason phrase differing from the expected one")
  @Test
  void wrongReason() {
    channel.writeInbound(ascii("HTTP/1.0 200 OK\r\n\r\n"));

    assertThat(handshake.cause()).hasMessage("unexpected HTTP response: 200 OK");
  }

  @DisplayName("fails on a malformed status line")
  @Test
  void malformed() {
    channel.writeInbound(ascii("SSH-2.0-OpenSSH\r\n\r\n"));

    assertThat(handshake.cause())
        .isInstanceOf(ProtocolException.class)
        .hasMessageStartingWith("malformed HTTP response");
    assertThat(channel.isOpen()).isFalse();
  }

  @DisplayName("fails when the response head exceeds the limit")
  @Test
  void tooLong() {
    byte[] junk = new byte[TunnelHandshakeHandler.MAX_HEAD_LENGTH + 1];
    Arrays.fill(junk, (byte) 'a');
    channel.writeInbound(Unpooled.wrappedBuffer(junk));

    assertThat(handshake.cause()).isInstanceOf(TooLongFrameException.class);
    assertThat(channel.isOpen()).isFalse();
  }

  @DisplayName("fails when the connection closes before the response")
  @Test
  void prematureClose() {
    channel.writeInbound(ascii("HTTP/1.0 200"));
    channel.close();

    assertThat(handshake.cause()).isInstanceOf(EOFException.class);
  }

  @DisplayName("parses the status of a response head")
  @Test
  void parseStatus() throws ProtocolException {
    assertThat(TunnelHandshakeHandler.parseStatus("HTTP/1.0 200 Connected to rpcx\r\n"))
        .isEqualTo("200 Connected to rpcx");
    assertThat(TunnelHandshakeHandler.parseStatus("HTTP/1.1  404 Not Found\r\n"))
        .isEqualTo("404 Not Found");
    assertThat(TunnelHandshakeHandler.parseStatus("HTTP/1.1 204")).isEqualTo("204");

    assertThatThrownBy(() -> TunnelHandshakeHandler.parseStatus("HTTP/x 200 OK"))
        .isInstanceOf(ProtocolException.class)
        .hasMessageStartingWith("malformed HTTP version");
    assertThatThrownBy(() -> TunnelHandshakeHandler.parseStatus("HTTP/1.0 20 OK"))
        .isInstanceOf(ProtocolException.class)
        .hasMessageStartingWith("malformed HTTP status code");
    assertThatThrownBy(() -> TunnelHandshakeHandler.parseStatus("HTTP/1.0 2x0 OK"))
        .isInstanceOf(ProtocolException.class);
  }

  private static ByteBuf ascii(String text) {
    return Unpooled.copiedBuffer(text, StandardCharsets.US_ASCII);
  }

  private static String text(ByteBuf buf) {
    try {
      return buf.toString(StandardCharsets.US_ASCII);
    } finally {
      buf.release();
    }
  }
}
