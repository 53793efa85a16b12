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

package io.rpcx.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

import io.rpcx.DuplexConnection;
import io.rpcx.test.util.TestDuplexConnection;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

final class TransportRegistryTest {

  private static final Connector KCP = (client, network, address) -> Mono.empty();
  private static final Connector QUIC = (client, network, address) -> Mono.empty();

  @DisplayName("finds registered connectors")
  @Test
  void findRegistered() {
    TransportRegistry registry =
        TransportRegistry.builder().register("kcp", KCP).register("quic", QUIC).build();

    assertThat(registry.find("kcp")).containsSame(KCP);
    assertThat(registry.find("quic")).containsSame(QUIC);
    assertThat(registry.names()).containsExactly("kcp", "quic");
  }

  @DisplayName("signals absence of unknown names without failing")
  @Test
  void findUnknown() {
    TransportRegistry registry = TransportRegistry.builder().register("kcp", KCP).build();

    assertThat(registry.find("foo")).isEmpty();
    assertThat(TransportRegistry.empty().find("kcp")).isEmpty();
  }

  @DisplayName("later registrations replace earlier ones")
  @Test
  void replaceRegistration() {
    TransportRegistry registry =
        TransportRegistry.builder().register("kcp", KCP).register("kcp", QUIC).build();

    assertThat(registry.find("kcp")).containsSame(QUIC);
    assertThat(registry.names()).hasSize(1);
  }

  @DisplayName("built registries do not see registrations made afterwards")
  @Test
  void immutableOnceBuilt() {
    TransportRegistry.Builder builder = TransportRegistry.builder().register("kcp", KCP);
    TransportRegistry registry = builder.build();

    builder.register("quic", QUIC);

    assertThat(registry.find("quic")).isEmpty();
  }

  @DisplayName("discovers providers through the service loader")
  @Test
  void registerProviders() {
    TransportRegistry registry = TransportRegistry.fromProviders();

    assertThat(registry.find("test")).isPresent();

    registry
        .find("test")
        .get()
        .connect(null, "test", "anywhere")
        .as(StepVerifier::create)
        .assertNext(connection -> assertThat(connection).isInstanceOf(TestDuplexConnection.class))
        .verifyComplete();
  }

  @DisplayName("registers explicitly supplied providers")
  @Test
  void registerProviderList() {
    TransportProvider provider =
        new TransportProvider() {
          @Override
          public String name() {
            return "memu";
          }

          @Override
          public Connector connector() {
            return (client, network, address) ->
                Mono.<DuplexConnection>just(new TestDuplexConnection());
          }
        };

    TransportRegistry registry =
        TransportRegistry.builder().registerProviders(List.of(provider)).build();

    assertThat(registry.names()).containsExactly("memu");
  }

  @DisplayName("register throws NullPointerException with null arguments")
  @Test
  void registerNull() {
    assertThatNullPointerException()
        .isThrownBy(() -> TransportRegistry.builder().register(null, KCP))
        .withMessage("name must not be null");
    assertThatNullPointerException()
        .isThrownBy(() -> TransportRegistry.builder().register("kcp", null))
        .withMessage("connector must not be null");
  }

  @DisplayName("find throws NullPointerException with null name")
  @Test
  void findNull() {
    assertThatNullPointerException()
        .isThrownBy(() -> TransportRegistry.empty().find(null))
        .withMessage("name must not be null");
  }
}
