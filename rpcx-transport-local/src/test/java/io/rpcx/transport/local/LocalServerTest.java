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

package io.rpcx.transport.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

import io.rpcx.DuplexConnection;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

final class LocalServerTest {

  @DisplayName("bind throws NullPointerException with null arguments")
  @Test
  void bindNulls() {
    assertThatNullPointerException()
        .isThrownBy(() -> LocalServer.bind(null, connection -> Mono.empty()))
        .withMessage("name must not be null");
    assertThatNullPointerException()
        .isThrownBy(() -> LocalServer.bind("unused", null))
        .withMessage("handler must not be null");
    assertThat(LocalServer.lookup("unused")).isNull();
  }

  @DisplayName("binds servers to distinct ephemeral names")
  @Test
  void ephemeral() {
    LocalServer first = LocalServer.bindEphemeral(connection -> Mono.empty());
    LocalServer second = LocalServer.bindEphemeral(connection -> Mono.empty());
    try {
      assertThat(first.name()).isNotEqualTo(second.name());
      assertThat(LocalServer.lookup(first.name())).isSameAs(first);
      assertThat(LocalServer.lookup(second.name())).isSameAs(second);
    } finally {
      first.dispose();
      second.dispose();
    }
  }

  @DisplayName("rejects a second server under the same name")
  @Test
  void duplicateName() {
    LocalServer server = LocalServer.bindEphemeral(connection -> Mono.empty());

    assertThatIllegalStateException()
        .isThrownBy(() -> LocalServer.bind(server.name(), connection -> Mono.empty()))
        .withMessage("name already registered: " + server.name());
    assertThat(LocalServer.lookup(server.name())).isSameAs(server);

    server.dispose();
  }

  @DisplayName("a disposed name can be bound again")
  @Test
  void rebind() {
    LocalServer server = LocalServer.bindEphemeral(connection -> Mono.empty());
    server.dispose();

    LocalServer again = LocalServer.bind(server.name(), connection -> Mono.empty());

    assertThat(LocalServer.lookup(server.name())).isSameAs(again);
    server.dispose();
    assertThat(LocalServer.lookup(server.name())).isSameAs(again);
    again.dispose();
  }

  @DisplayName("dispose unregisters the name and closes accepted connections")
  @Test
  void dispose() {
    Sinks.One<DuplexConnection> accepted = Sinks.one();
    LocalServer server =
        LocalServer.bindEphemeral(
            connection -> {
              accepted.tryEmitValue(connection);
              return Mono.never();
            });

    DuplexConnection client = LocalConnector.create().connect(null, "memu", server.name()).block();
    DuplexConnection serverSide = accepted.asMono().block(Duration.ofSeconds(5));
    assertThat(server.connectionCount()).isOne();

    server.dispose();

    assertThat(server.isDisposed()).isTrue();
    assertThat(LocalServer.lookup(server.name())).isNull();
    server.onClose().as(StepVerifier::create).verifyComplete();
    assertThat(serverSide.isDisposed()).isTrue();
    assertThat(client.isDisposed()).isTrue();
  }

  @DisplayName("forgets connections once they close")
  @Test
  void forgetsClosedConnections() {
    LocalServer server = LocalServer.bindEphemeral(connection -> Mono.never());

    DuplexConnection client = LocalConnector.create().connect(null, "memu", server.name()).block();
    assertThat(server.connectionCount()).isOne();

    client.dispose();

    assertThat(server.connectionCount()).isZero();
    server.dispose();
  }

  @DisplayName("closes the connection when the handler fails")
  @Test
  void handlerFailureClosesConnection() {
    LocalServer server =
        LocalServer.bindEphemeral(
            connection -> Mono.error(new IllegalStateException("handler failed")));

    DuplexConnection client = LocalConnector.create().connect(null, "memu", server.name()).block();

    client.onClose().as(StepVerifier::create).expectComplete().verify(Duration.ofSeconds(5));
    assertThat(server.connectionCount()).isZero();
    server.dispose();
  }
}
