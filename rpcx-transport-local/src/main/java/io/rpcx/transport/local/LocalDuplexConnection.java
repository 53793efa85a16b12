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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.rpcx.DuplexConnection;
import io.rpcx.internal.BaseDuplexConnection;
import java.net.SocketAddress;
import java.util.Objects;
import reactor.core.publisher.Flux;

/**
 * One end of an in-memory connection. Each end reads what the other end's {@link #sendFrame}
 * queued; closing either end closes both.
 */
final class LocalDuplexConnection extends BaseDuplexConnection {

  private final LocalSocketAddress address;
  private final ByteBufAllocator allocator;
  private final String side;

  private LocalDuplexConnection peer;

  private LocalDuplexConnection(String side, String name, ByteBufAllocator allocator) {
    this.side = side;
    this.address = new LocalSocketAddress(name);
    this.allocator = allocator;
  }

  /**
   * Creates two connections wired back to back.
   *
   * @param name the name of the server being connected to
   * @param allocator the allocator exposed by both ends
   * @return the client end at index 0 and the server end at index 1
   */
  static LocalDuplexConnection[] pair(String name, ByteBufAllocator allocator) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(allocator, "allocator must not be null");

    LocalDuplexConnection client = new LocalDuplexConnection("client", name, allocator);
    LocalDuplexConnection server = new LocalDuplexConnection("server", name, allocator);
    client.peer = server;
    server.peer = client;
    return new LocalDuplexConnection[] {client, server};
  }

  @Override
  protected Flux<ByteBuf> doReceive() {
    return peer.sender.asFlux();
  }

  @Override
  protected void doOnClose() {
    terminate();
    if (!peer.isDisposed()) {
      peer.dispose();
    }
  }

  @Override
  public ByteBufAllocator alloc() {
    return allocator;
  }

  @Override
  public SocketAddress localAddress() {
    return address;
  }

  @Override
  public SocketAddress remoteAddress() {
    return address;
  }

  @Override
  public String toString() {
    return "LocalDuplexConnection{" + "side='" + side + '\'' + ", address=" + address + '}';
  }
}
