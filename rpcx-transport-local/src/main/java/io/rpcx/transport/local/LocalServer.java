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

import io.rpcx.Closeable;
import io.rpcx.DuplexConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.annotation.Nullable;

/**
 * A named in-memory endpoint that {@link LocalConnector} dials within the same JVM. A bound server
 * owns its name until it is disposed; disposing it closes every connection it accepted.
 *
 * <pre>{@code
 * LocalServer server = LocalServer.bind("echo", connection -> connection.onClose());
 * ...
 * server.dispose();
 * }</pre>
 */
public final class LocalServer implements Closeable {

  private static final Logger logger = LoggerFactory.getLogger(LocalServer.class);

  private static final Map<String, LocalServer> BOUND = new ConcurrentHashMap<>();

  private final String name;
  private final Function<DuplexConnection, Mono<Void>> handler;
  private final Set<DuplexConnection> connections = ConcurrentHashMap.newKeySet();
  private final Sinks.Empty<Void> closed = Sinks.empty();

  private volatile boolean stopped;

  private LocalServer(String name, Function<DuplexConnection, Mono<Void>> handler) {
    this.name = name;
    this.handler = handler;
  }

  /**
   * Binds a server to {@code name}.
   *
   * @param name the name clients dial
   * @param handler handles the server end of each accepted connection; the connection is closed
   *     if the returned {@code Mono} fails
   * @return the bound server
   * @throws IllegalStateException if another server is bound to {@code name}
   */
  public static LocalServer bind(String name, Function<DuplexConnection, Mono<Void>> handler) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(handler, "handler must not be null");

    LocalServer server = new LocalServer(name, handler);
    if (BOUND.putIfAbsent(name, server) != null) {
      throw new IllegalStateException("name already registered: " + name);
    }
    logger.debug("local server {} bound", name);
    return server;
  }

  /** Binds a server to a random name. */
  public static LocalServer bindEphemeral(Function<DuplexConnection, Mono<Void>> handler) {
    return bind(UUID.randomUUID().toString(), handler);
  }

  static @Nullable LocalServer lookup(String name) {
    return BOUND.get(name);
  }

  public String name() {
    return name;
  }

  int connectionCount() {
    return connections.size();
  }

  void accept(DuplexConnection connection) {
    connections.add(connection);
    connection.onClose().doFinally(__ -> connections.remove(connection)).subscribe();
    if (stopped) {
      connection.dispose();
      return;
    }

    handler
        .apply(connection)
        .subscribe(
            null,
            e -> {
              logger.warn("local server {} failed to handle {}", name, connection, e);
              connection.dispose();
            });
  }

  @Override
  public void dispose() {
    if (stopped || !BOUND.remove(name, this)) {
      return;
    }
    stopped = true;
    logger.debug("local server {} stopped", name);

    List<DuplexConnection> open = new ArrayList<>(connections);
    open.forEach(DuplexConnection::dispose);
    Flux.fromIterable(open)
        .flatMap(DuplexConnection::onClose)
        .then()
        .subscribe(null, closed::tryEmitError, closed::tryEmitEmpty);
  }

  @Override
  public boolean isDisposed() {
    return stopped;
  }

  @Override
  public Mono<Void> onClose() {
    return closed.asMono();
  }

  @Override
  public String toString() {
    return "LocalServer{" + "name='" + name + '\'' + ", connections=" + connections.size() + '}';
  }
}
