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

import io.rpcx.DeadlineCapable;
import io.rpcx.DuplexConnection;
import io.rpcx.KeepAliveCapable;
import io.rpcx.plugins.PluginChain;
import io.rpcx.transport.ClientContext;
import io.rpcx.transport.ConnectOptions;
import io.rpcx.transport.Connector;
import io.rpcx.transport.TransportRegistry;
import io.rpcx.transport.netty.client.DirectConnector;
import io.rpcx.transport.netty.client.HttpTunnelConnector;
import io.rpcx.transport.netty.client.WebsocketConnector;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

/**
 * An rpcx client's connection to a server. {@link #connect(String, String)} picks the {@link
 * Connector} for the transport name, applies the configured socket policy, runs the plugin chain
 * and installs the result, then starts reading and, if enabled, the heartbeat.
 *
 * <p>For a TCP connection using default settings:
 *
 * <pre>{@code
 * RpcClient client = RpcClient.create();
 * client.connect("tcp", "localhost:8972").block();
 * }</pre>
 *
 * <p>To customize settings before connecting:
 *
 * <pre>{@code
 * RpcClient client =
 *     RpcClient.builder()
 *         .options(ConnectOptions.builder().idleTimeout(Duration.ofMinutes(5)).build())
 *         .interceptors(chain -> chain.forConnection(connection -> connection))
 *         .build();
 * client.connect("http", "localhost:8972").block();
 * }</pre>
 *
 * <p>Transport names {@code http}, {@code ws} and {@code wss} always use the built-in HTTP tunnel
 * and WebSocket connectors. Any other name is looked up in the {@link TransportRegistry}; names
 * it does not know are dialled directly.
 */
public final class RpcClient implements ClientContext, Disposable {

  private static final Logger logger = LoggerFactory.getLogger(RpcClient.class);

  static final String HTTP = "http";

  private final ConnectOptions options;
  private final TransportRegistry transports;
  private final PluginChain plugins;
  private final InboundFrameHandler inboundHandler;
  private final HeartbeatFrameSupplier heartbeatFrames;

  private final Connector httpConnector;
  private final Connector websocketConnector;
  private final Connector directConnector;

  private final AtomicReference<DuplexConnection> connection = new AtomicReference<>();

  private volatile boolean disposed;

  private RpcClient(Builder builder) {
    this.options = builder.options;
    this.transports = builder.transports;
    this.plugins = builder.plugins.copy();
    this.inboundHandler = builder.inboundHandler;
    this.heartbeatFrames = builder.heartbeatFrames;
    this.httpConnector = builder.httpConnector;
    this.websocketConnector = builder.websocketConnector;
    this.directConnector = builder.directConnector;
  }

  /**
   * Creates a client with default options and the transports found on the class path.
   *
   * @return a new client
   */
  public static RpcClient create() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public ConnectOptions options() {
    return options;
  }

  /**
   * Returns the installed connection, or {@code null} if the client never connected or its
   * connection has closed since.
   */
  @Nullable
  public DuplexConnection connection() {
    return connection.get();
  }

  public boolean isConnected() {
    DuplexConnection current = connection.get();
    return current != null && !current.isDisposed();
  }

  /**
   * Connects to {@code address} over the transport named {@code network}, replacing the current
   * connection on success.
   *
   * <p>On failure the client is left as it was. Dial failures surface as {@link
   * io.rpcx.exceptions.DialException} or {@link io.rpcx.exceptions.TunnelNegotiationException},
   * WebSocket failures unchanged, and anything an interceptor throws unchanged; a rejected
   * connection is closed.
   *
   * @param network the transport name, e.g. {@code tcp}, {@code http}, {@code ws}
   * @param address the transport specific address, e.g. {@code host:port}
   * @return a {@code Mono} completing once the connection is installed and its tasks started
   */
  public Mono<Void> connect(String network, String address) {
    Objects.requireNonNull(network, "network must not be null");
    Objects.requireNonNull(address, "address must not be null");

    return Mono.defer(
        () -> {
          if (disposed) {
            return Mono.error(new IllegalStateException("client is disposed"));
          }
          return connectorFor(network)
              .connect(this, network, address)
              .flatMap(raw -> establish(raw, network, address));
        });
  }

  Connector connectorFor(String network) {
    switch (network) {
      case HTTP:
        return httpConnector;
      case WebsocketConnector.WS:
      case WebsocketConnector.WSS:
        return websocketConnector;
      default:
        Optional<Connector> registered = transports.find(network);
        if (registered.isPresent()) {
          return registered.get();
        }
        logger.debug("no transport registered for {}, dialling it directly", network);
        return directConnector;
    }
  }

  private Mono<Void> establish(DuplexConnection raw, String network, String address) {
    return Mono.defer(
        () -> {
          DuplexConnection established;
          try {
            enableKeepAlive(raw);
            applyIdleTimeout(raw);
            established = plugins.isEmpty() ? raw : plugins.doConnectionCreated(raw);
          } catch (Throwable t) {
            Exceptions.throwIfJvmFatal(t);
            logger.debug("connection to {} {} not established", network, address, t);
            raw.dispose();
            return Mono.error(t);
          }

          install(established);
          return Mono.empty();
        });
  }

  private void enableKeepAlive(DuplexConnection raw) {
    Duration period = options.tcpKeepAlivePeriod();
    if (!(raw instanceof KeepAliveCapable) || period.isZero()) {
      return;
    }
    try {
      if (!((KeepAliveCapable) raw).keepAlive(period)) {
        logger.debug("keep-alive options not fully applied on {}", raw);
      }
    } catch (RuntimeException e) {
      logger.debug("unable to enable keep-alive on {}", raw, e);
    }
  }

  private void applyIdleTimeout(DuplexConnection raw) {
    Duration idleTimeout = options.idleTimeout();
    if (!idleTimeout.isZero() && raw instanceof DeadlineCapable) {
      ((DeadlineCapable) raw).deadline(deadlineAfter(idleTimeout));
    }
  }

  static Instant deadlineAfter(Duration timeout) {
    Instant now = Instant.now();
    try {
      return now.plus(timeout);
    } catch (DateTimeException | ArithmeticException e) {
      return timeout.isNegative() ? Instant.MIN : Instant.MAX;
    }
  }

  private void install(DuplexConnection established) {
    DuplexConnection previous = connection.getAndSet(established);
    if (previous != null && previous != established) {
      previous.dispose();
    }

    Disposable.Composite tasks = Disposables.composite();
    established
        .onClose()
        .doFinally(
            __ -> {
              tasks.dispose();
              connection.compareAndSet(established, null);
              logger.debug("connection tasks of {} terminated", established);
            })
        .subscribe(null, e -> logger.debug("{} closed with error", established, e));

    tasks.add(startReader(established));
    if (options.isHeartbeatEnabled()) {
      tasks.add(startHeartbeat(established));
    }

    if (disposed) {
      established.dispose();
    }
  }

  private Disposable startReader(DuplexConnection established) {
    return established
        .receive()
        .subscribe(
            frame -> inboundHandler.handle(established, frame),
            e -> {
              logger.warn("failed to read from {}", established, e);
              established.dispose();
            });
  }

  private Disposable startHeartbeat(DuplexConnection established) {
    return Flux.interval(options.heartbeatInterval(), Schedulers.parallel())
        .subscribe(
            tick -> established.sendFrame(heartbeatFrames.frame(established.alloc())),
            e -> logger.debug("heartbeat of {} stopped", established, e));
  }

  /** Closes the installed connection; the client cannot connect again afterwards. */
  @Override
  public void dispose() {
    disposed = true;
    DuplexConnection current = connection.getAndSet(null);
    if (current != null) {
      current.dispose();
    }
  }

  @Override
  public boolean isDisposed() {
    return disposed;
  }

  @Override
  public String toString() {
    return "RpcClient{" + "options=" + options + ", transports=" + transports + '}';
  }

  public static final class Builder {

    private ConnectOptions options = ConnectOptions.defaults();
    private TransportRegistry transports;
    private final PluginChain plugins = new PluginChain();
    private InboundFrameHandler inboundHandler = InboundFrameHandler.RELEASE;
    private HeartbeatFrameSupplier heartbeatFrames = HeartbeatFrameSupplier.EMPTY_FRAME;

    private Connector httpConnector = HttpTunnelConnector.create();
    private Connector websocketConnector = WebsocketConnector.create();
    private Connector directConnector = DirectConnector.create();

    private Builder() {}

    public Builder options(ConnectOptions options) {
      this.options = Objects.requireNonNull(options, "options must not be null");
      return this;
    }

    /**
     * Sets the transports looked up for names other than {@code http}, {@code ws} and {@code
     * wss}. Defaults to {@link TransportRegistry#fromProviders()}.
     */
    public Builder transports(TransportRegistry transports) {
      this.transports = Objects.requireNonNull(transports, "transports must not be null");
      return this;
    }

    /**
     * Configure the connection interceptors, run in registration order on every new connection.
     *
     * @param configurer a configurer to customize the chain
     * @return the same instance for method chaining
     */
    public Builder interceptors(Consumer<PluginChain> configurer) {
      configurer.accept(plugins);
      return this;
    }

    public Builder inboundHandler(InboundFrameHandler inboundHandler) {
      this.inboundHandler =
          Objects.requireNonNull(inboundHandler, "inboundHandler must not be null");
      return this;
    }

    public Builder heartbeatFrames(HeartbeatFrameSupplier heartbeatFrames) {
      this.heartbeatFrames =
          Objects.requireNonNull(heartbeatFrames, "heartbeatFrames must not be null");
      return this;
    }

    Builder httpConnector(Connector httpConnector) {
      this.httpConnector = httpConnector;
      return this;
    }

    Builder websocketConnector(Connector websocketConnector) {
      this.websocketConnector = websocketConnector;
      return this;
    }

    Builder directConnector(Connector directConnector) {
      this.directConnector = directConnector;
      return this;
    }

    public RpcClient build() {
      if (transports == null) {
        transports = TransportRegistry.fromProviders();
      }
      return new RpcClient(this);
    }
  }
}
