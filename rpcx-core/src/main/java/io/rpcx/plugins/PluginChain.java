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

package io.rpcx.plugins;

import io.rpcx.DuplexConnection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/** An ordered chain of {@link ConnectionInterceptor}s. */
public class PluginChain {

  private final List<ConnectionInterceptor> connectionInterceptors = new ArrayList<>();

  /** Add a {@link ConnectionInterceptor}. */
  public PluginChain forConnection(ConnectionInterceptor interceptor) {
    connectionInterceptors.add(Objects.requireNonNull(interceptor, "interceptor must not be null"));
    return this;
  }

  /**
   * Variant of {@link #forConnection(ConnectionInterceptor)} with access to the list of existing
   * registrations.
   */
  public PluginChain forConnections(Consumer<List<ConnectionInterceptor>> consumer) {
    consumer.accept(connectionInterceptors);
    return this;
  }

  public boolean isEmpty() {
    return connectionInterceptors.isEmpty();
  }

  public List<ConnectionInterceptor> getConnectionInterceptors() {
    return Collections.unmodifiableList(connectionInterceptors);
  }

  /**
   * Passes {@code connection} through every interceptor, in registration order. Whatever an
   * interceptor throws is propagated as is and stops the chain.
   *
   * @param connection the newly created connection
   * @return the connection to install
   */
  public DuplexConnection doConnectionCreated(DuplexConnection connection) {
    for (ConnectionInterceptor interceptor : connectionInterceptors) {
      connection =
          Objects.requireNonNull(
              interceptor.apply(connection), "interceptor returned a null connection");
    }
    return connection;
  }

  public PluginChain copy() {
    final PluginChain chain = new PluginChain();
    chain.connectionInterceptors.addAll(this.connectionInterceptors);
    return chain;
  }
}
