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

import io.netty.buffer.ByteBufAllocator;
import io.rpcx.DuplexConnection;
import io.rpcx.exceptions.DialException;
import io.rpcx.transport.ClientContext;
import io.rpcx.transport.Connector;
import java.util.Objects;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * An implementation of {@link Connector} that connects to a {@link LocalServer} in the same JVM.
 * The address is the server name; the client may be {@code null} since no options apply.
 */
public final class LocalConnector implements Connector {

  private final ByteBufAllocator allocator;

  private LocalConnector(ByteBufAllocator allocator) {
    this.allocator = allocator;
  }

  /**
   * Creates a new instance.
   *
   * @return a new instance
   */
  public static LocalConnector create() {
    return create(ByteBufAllocator.DEFAULT);
  }

  /**
   * Creates a new instance.
   *
   * @param allocator the allocator exposed by the connections
   * @return a new instance
   * @throws NullPointerException if {@code allocator} is {@code null}
   */
  public static LocalConnector create(ByteBufAllocator allocator) {
    Objects.requireNonNull(allocator, "allocator must not be null");

    return new LocalConnector(allocator);
  }

  @Override
  public Mono<DuplexConnection> connect(
      @Nullable ClientContext client, String network, String address) {
    return Mono.defer(
        () -> {
          LocalServer server = LocalServer.lookup(address);
          if (server == null) {
            return Mono.error(
                new DialException(
                    network,
                    address,
                    new IllegalArgumentException("Could not find server: " + address)));
          }

          LocalDuplexConnection[] pair = LocalDuplexConnection.pair(address, allocator);
          server.accept(pair[1]);

          return Mono.<DuplexConnection>just(pair[0]);
        });
  }
}
