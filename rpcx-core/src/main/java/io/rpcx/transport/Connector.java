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

import io.rpcx.DuplexConnection;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Establishes a connection for one specific transport. Implementations are stateless; all
 * configuration comes from the {@link ClientContext}.
 */
@FunctionalInterface
public interface Connector {

  /**
   * Returns a {@code Mono}, every subscription to which dials a new {@link DuplexConnection}.
   *
   * <p>A dial failure is signalled through the returned {@code Mono}; connectors never retry.
   *
   * @param client the client dialling; connectors that need its options fail with {@link
   *     IllegalArgumentException} when it is {@code null}
   * @param network the transport name the caller asked for
   * @param address the transport specific address, e.g. {@code host:port}
   * @return a {@code Mono} emitting the established connection
   */
  Mono<DuplexConnection> connect(@Nullable ClientContext client, String network, String address);
}
