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

package io.rpcx.test.util;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.UnpooledByteBufAllocator;
import io.rpcx.internal.BaseDuplexConnection;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** An in-memory {@link io.rpcx.DuplexConnection} recording what is sent to it. */
public class TestDuplexConnection extends BaseDuplexConnection {

  private final Sinks.Many<ByteBuf> received = Sinks.many().unicast().onBackpressureBuffer();
  private final BlockingQueue<ByteBuf> sent = new LinkedBlockingQueue<>();
  private final ByteBufAllocator allocator;

  public TestDuplexConnection() {
    this(UnpooledByteBufAllocator.DEFAULT);
  }

  public TestDuplexConnection(ByteBufAllocator allocator) {
    this.allocator = allocator;
    sender.asFlux().subscribe(sent::offer);
  }

  public void addToReceivedBuffer(ByteBuf... frames) {
    for (ByteBuf frame : frames) {
      received.tryEmitNext(frame);
    }
  }

  public BlockingQueue<ByteBuf> getSent() {
    return sent;
  }

  @Override
  protected Flux<ByteBuf> doReceive() {
    return received.asFlux();
  }

  @Override
  protected void doOnClose() {
    received.tryEmitComplete();
    terminate();
  }

  @Override
  public ByteBufAllocator alloc() {
    return allocator;
  }

  @Override
  public SocketAddress localAddress() {
    return InetSocketAddress.createUnresolved("localhost", 0);
  }

  @Override
  public SocketAddress remoteAddress() {
    return InetSocketAddress.createUnresolved("localhost", 0);
  }

  @Override
  public String toString() {
    return "TestDuplexConnection{" + "sent=" + sent.size() + '}';
  }
}
