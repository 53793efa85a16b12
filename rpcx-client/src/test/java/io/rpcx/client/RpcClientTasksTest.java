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

package io.rpcx.client;

import static org.assertj.core.api.Assertions.assertThat;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.rpcx.DuplexConnection;
import io.rpcx.transport.ConnectOptions;
import io.rpcx.transport.local.LocalServer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

final class RpcClientTasksTest {

  private LocalServer server;
  private Sinks.One<DuplexConnection> accepted;
  private Sinks.Many<byte[]> received;

  @BeforeEach
  void startServer() {
    accepted = Sinks.one();
    received = Sinks.many().replay().all();
    server =
        LocalServer.bindEphemeral(
            connection -> {
              accepted.tryEmitValue(connection);
              connection
                  .receive()
                  .subscribe(
                      frame -> {
                        received.tryEmitNext(ByteBufUtil.getBytes(frame));
                        frame.release();
                      });
              return connection.onClose();
            });
  }

  @AfterEach
  void stopServer() {
    server.dispose();
  }

  @DisplayName("hands inbound bytes to the inbound handler")
  @Test
  void reader() {
    Sinks.Many<String> inbound = Sinks.many().replay().all();
    RpcClient client =
        RpcClient.builder()
            .inboundHandler(
                (connection, frame) -> {
                  inbound.tryEmitNext(frame.toString(StandardCharsets.UTF_8));
                  frame.release();
                })
            .build();

    client.connect("memu", server.name()).block(Duration.ofSeconds(5));
    accepted
        .asMono()
        .block(Duration.ofSeconds(5))
        .sendFrame(Unpooled.copiedBuffer("hello", StandardCharsets.UTF_8));

    inbound
        .asFlux()
        .as(StepVerifier::create)
        .expectNext("hello")
        .thenCancel()
        .verify(Duration.ofSeconds(5));
    client.dispose();
  }

  @DisplayName("a failing inbound handler closes the connection")
  @Test
  void readerFailure() {
    RpcClient client =
        RpcClient.builder()
            .inboundHandler(
                (connection, frame) -> {
                  frame.release();
                  throw new IllegalStateException("cannot decode");
                })
            .build();

    client.connect("memu", server.name()).block(Duration.ofSeconds(5));
    DuplexConnection serverSide = accepted.asMono().block(Duration.ofSeconds(5));
    serverSide.sendFrame(Unpooled.copiedBuffer("garbage", StandardCharsets.UTF_8));

    serverSide.onClose().as(StepVerifier::create).expectComplete().verify(Duration.ofSeconds(5));
    assertThat(client.isConnected()).isFalse();
  }

  @DisplayName("writes a heartbeat frame every interval")
  @Test
  void heartbeat() {
    RpcClient client =
        RpcClient.builder()
            .options(
                ConnectOptions.builder()
                    .heartbeat(true)
                    .heartbeatInterval(Duration.ofMillis(50))
                    .build())
            .build();

    client.connect("memu", server.name()).block(Duration.ofSeconds(5));

    received
        .asFlux()
        .take(2)
        .as(StepVerifier::create)
        .expectNextMatches(bytes -> Arrays.equals(bytes, new byte[4]))
        .expectNextMatches(bytes -> Arrays.equals(bytes, new byte[4]))
        .expectComplete()
        .verify(Duration.ofMillis(500));
    client.dispose();
  }

  @DisplayName("writes the frames of a custom heartbeat supplier")
  @Test
  void customHeartbeatFrames() {
    RpcClient client =
        RpcClient.builder()
            .options(
                ConnectOptions.builder()
                    .heartbeat(true)
                    .heartbeatInterval(Duration.ofMillis(20))
                    .build())
            .heartbeatFrames(allocator -> ByteBufUtil.writeUtf8(allocator, "beat"))
            .build();

    client.connect("memu", server.name()).block(Duration.ofSeconds(5));

    received
        .asFlux()
        .next()
        .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
        .as(StepVerifier::create)
        .expectNext("beat")
        .verifyComplete();
    client.dispose();
  }

  @DisplayName("writes no heartbeat when disabled")
  @Test
  void heartbeatDisabled() {
    RpcClient client =
        RpcClient.builder()
            .options(
                ConnectOptions.builder()
                    .heartbeat(false)
                    .heartbeatInterval(Duration.ofMillis(50))
                    .build())
            .build();

    client.connect("memu", server.name()).block(Duration.ofSeconds(5));

    received
        .asFlux()
        .as(StepVerifier::create)
        .expectSubscription()
        .expectNoEvent(Duration.ofMillis(200))
        .thenCancel()
        .verify();
    client.dispose();
  }

  @DisplayName("writes no heartbeat without an interval")
  @Test
  void heartbeatWithoutInterval() {
    RpcClient client =
        RpcClient.builder()
            .options(ConnectOptions.builder().heartbeat(true).build())
            .build();

    client.connect("memu", server.name()).block(Duration.ofSeconds(5));

    received
        .asFlux()
        .as(StepVerifier::create)
        .expectSubscription()
        .expectNoEvent(Duration.ofMillis(200))
        .thenCancel()
        .verify();
    client.dispose();
  }

  @DisplayName("stops the heartbeat once the connection closes")
  @Test
  void heartbeatStopsOnClose() {
    RpcClient client =
        RpcClient.builder()
            .options(
                ConnectOptions.builder()
                    .heartbeat(true)
                    .heartbeatInterval(Duration.ofMillis(20))
                    .build())
            .build();

    client.connect("memu", server.name()).block(Duration.ofSeconds(5));
    DuplexConnection connection = client.connection();
    received.asFlux().blockFirst(Duration.ofSeconds(5));

    connection.dispose();

    assertThat(client.connection()).isNull();
    assertThat(client.isConnected()).isFalse();
  }

  @DisplayName("closes the connection once the idle timeout passes")
  @Test
  void idleTimeout() {
    RpcClient client =
        RpcClient.builder()
            .options(ConnectOptions.builder().idleTimeout(Duration.ofMillis(100)).build())
            .build();

    client.connect("memu", server.name()).block(Duration.ofSeconds(5));
    DuplexConnection serverSide = accepted.asMono().block(Duration.ofSeconds(5));
    assertThat(client.isConnected()).isTrue();

    serverSide.onClose().as(StepVerifier::create).expectComplete().verify(Duration.ofSeconds(5));
    assertThat(client.isConnected()).isFalse();
  }

  @DisplayName("a very large idle timeout keeps the connection open")
  @Test
  void unboundedIdleTimeout() {
    RpcClient client =
        RpcClient.builder()
            .options(
                ConnectOptions.builder()
                    .idleTimeout(Duration.ofSeconds(Long.MAX_VALUE))
                    .build())
            .build();

    client.connect("memu", server.name()).as(StepVerifier::create).verifyComplete();
    DuplexConnection serverSide = accepted.asMono().block(Duration.ofSeconds(5));

    assertThat(client.isConnected()).isTrue();
    assertThat(serverSide.isDisposed()).isFalse();

    client.dispose();
    serverSide.onClose().as(StepVerifier::create).expectComplete().verify(Duration.ofSeconds(5));
  }

  @DisplayName("the default heartbeat frame is an empty length-prefixed frame")
  @Test
  void emptyFrame() {
    ByteBuf frame = HeartbeatFrameSupplier.EMPTY_FRAME.frame(ByteBufAllocator.DEFAULT);
    try {
      assertThat(ByteBufUtil.getBytes(frame)).containsExactly(new byte[4]);
    } finally {
      frame.release();
    }
  }

  @DisplayName("connecting to an unknown local server leaves the client unconnected")
  @Test
  void unknownServer() {
    RpcClient client = RpcClient.create();

    client
        .connect("memu", "no-such-server")
        .as(StepVerifier::create)
        .expectError()
        .verify(Duration.ofSeconds(5));
    assertThat(client.connection()).isNull();
  }

  @DisplayName("connect is lazy")
  @Test
  void lazy() {
    RpcClient client = RpcClient.create();

    Mono<Void> connect = client.connect("memu", server.name());

    assertThat(client.connection()).isNull();
    connect.block(Duration.ofSeconds(5));
    assertThat(client.isConnected()).isTrue();
    client.dispose();
  }
}
