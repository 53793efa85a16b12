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

package io.rpcx;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import java.net.SocketAddress;
import reactor.core.publisher.Flux;

/**
 * Represents an established duplex byte stream to a remote peer, regardless of the transport that
 * produced it.
 *
 * <p>Transports may additionally implement {@link KeepAliveCapable} and {@link DeadlineCapable}.
 * Callers must test for those capabilities rather than for concrete connection types.
 */
public interface DuplexConnection extends Closeable {

  /**
   * Delivers the given bytes to the underlying transport connection. This method is non-blocking
   * and can be safely executed from multiple threads. Ownership of {@code frame} passes to the
   * connection. This method does not provide any flow-control mechanism.
   *
   * @param frame the bytes to write
   */
  void sendFrame(ByteBuf frame);

  /**
   * Returns the stream of bytes received on this connection.
   *
   * <p><strong>Ownership</strong>
   *
   * <p>Each emitted {@link ByteBuf} is owned by the subscriber, which <em>MUST</em> release it.
   *
   * <p><strong>Termination</strong>
   *
   * <p>The returned {@code Flux} completes when the connection is closed and errors on an
   * unrecoverable read failure, including an expired {@link DeadlineCapable deadline}.
   *
   * <p><strong>Multiple Subscriptions</strong>
   *
   * <p>Only a single subscription is supported; the reader task of the owning client is the only
   * subscriber.
   *
   * @return Stream of received bytes.
   */
  Flux<ByteBuf> receive();

  /**
   * Returns the assigned {@link ByteBufAllocator}.
   *
   * @return the {@link ByteBufAllocator}
   */
  ByteBufAllocator alloc();

  /**
   * Return the local address that this connection is connected to. The returned {@link
   * SocketAddress} varies by transport type.
   *
   * @return the address
   */
  SocketAddress localAddress();

  /**
   * Return the remote address that this connection is connected to. The returned {@link
   * SocketAddress} varies by transport type.
   *
   * @return the address
   */
  SocketAddress remoteAddress();
}
