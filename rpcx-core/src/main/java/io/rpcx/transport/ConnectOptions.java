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

import io.netty.handler.ssl.SslContext;
import java.time.Duration;
import java.util.Objects;
import reactor.util.annotation.Nullable;

/**
 * Immutable connection settings of a client. Use {@link #builder()} to customize the defaults:
 *
 * <ul>
 *   <li>{@code connectTimeout}: 1 second
 *   <li>{@code tcpKeepAlivePeriod}: 1 minute
 *   <li>{@code idleTimeout}: zero, no deadline
 *   <li>{@code heartbeat}: disabled, with a zero {@code heartbeatInterval}
 *   <li>{@code rpcPath}: {@value #DEFAULT_RPC_PATH}
 *   <li>{@code tlsConfig}: none
 * </ul>
 */
public final class ConnectOptions {

  /** The path requested by the HTTP tunnel and WebSocket transports when none is configured. */
  public static final String DEFAULT_RPC_PATH = "/_rpcx_";

  private static final ConnectOptions DEFAULT = builder().build();

  private final Duration connectTimeout;
  @Nullable private final SslContext tlsConfig;
  private final Duration tcpKeepAlivePeriod;
  private final Duration idleTimeout;
  private final boolean heartbeat;
  private final Duration heartbeatInterval;
  private final String rpcPath;

  private ConnectOptions(Builder builder) {
    this.connectTimeout = builder.connectTimeout;
    this.tlsConfig = builder.tlsConfig;
    this.tcpKeepAlivePeriod = builder.tcpKeepAlivePeriod;
    this.idleTimeout = builder.idleTimeout;
    this.heartbeat = builder.heartbeat;
    this.heartbeatInterval = builder.heartbeatInterval;
    this.rpcPath = builder.rpcPath;
  }

  public static ConnectOptions defaults() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized with the settings of this instance. */
  public Builder mutate() {
    return new Builder()
        .connectTimeout(connectTimeout)
        .tlsConfig(tlsConfig)
        .tcpKeepAlivePeriod(tcpKeepAlivePeriod)
        .idleTimeout(idleTimeout)
        .heartbeat(heartbeat)
        .heartbeatInterval(heartbeatInterval)
        .rpcPath(rpcPath);
  }

  /** Upper bound of the dial, for every transport. */
  public Duration connectTimeout() {
    return connectTimeout;
  }

  /** The TLS configuration; when present, every transport that supports it dials encrypted. */
  @Nullable
  public SslContext tlsConfig() {
    return tlsConfig;
  }

  /** TCP keep-alive probe period; zero disables keep-alive configuration. */
  public Duration tcpKeepAlivePeriod() {
    return tcpKeepAlivePeriod;
  }

  /** Time after connect at which the connection's deadline expires; zero disables it. */
  public Duration idleTimeout() {
    return idleTimeout;
  }

  public boolean heartbeat() {
    return heartbeat;
  }

  public Duration heartbeatInterval() {
    return heartbeatInterval;
  }

  /** The configured tunnel path, possibly empty. */
  public String rpcPath() {
    return rpcPath;
  }

  /**
   * Returns the configured tunnel path, or {@link #DEFAULT_RPC_PATH} when it is empty.
   *
   * @return the path to request
   */
  public String rpcPathOrDefault() {
    return rpcPath.isEmpty() ? DEFAULT_RPC_PATH : rpcPath;
  }

  /** Whether the heartbeat task should run: heartbeat enabled and a positive interval. */
  public boolean isHeartbeatEnabled() {
    return heartbeat && !heartbeatInterval.isNegative() && !heartbeatInterval.isZero();
  }

  @Override
  public String toString() {
    return "ConnectOptions{"
        + "connectTimeout="
        + connectTimeout
        + ", tls="
        + (tlsConfig != null)
        + ", tcpKeepAlivePeriod="
        + tcpKeepAlivePeriod
        + ", idleTimeout="
        + idleTimeout
        + ", heartbeat="
        + heartbeat
        + ", heartbeatInterval="
        + heartbeatInterval
        + ", rpcPath='"
        + rpcPath
        + '\''
        + '}';
  }

  public static final class Builder {

    private Duration connectTimeout = Duration.ofSeconds(1);
    @Nullable private SslContext tlsConfig;
    private Duration tcpKeepAlivePeriod = Duration.ofMinutes(1);
    private Duration idleTimeout = Duration.ZERO;
    private boolean heartbeat;
    private Duration heartbeatInterval = Duration.ZERO;
    private String rpcPath = DEFAULT_RPC_PATH;

    private Builder() {}

    public Builder connectTimeout(Duration connectTimeout) {
      Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
      if (connectTimeout.isNegative()) {
        throw new IllegalArgumentException("`connectTimeout` must not be negative");
      }
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder tlsConfig(@Nullable SslContext tlsConfig) {
      if (tlsConfig != null && !tlsConfig.isClient()) {
        throw new IllegalArgumentException("`tlsConfig` must be a client SslContext");
      }
      this.tlsConfig = tlsConfig;
      return this;
    }

    public Builder tcpKeepAlivePeriod(Duration tcpKeepAlivePeriod) {
      Objects.requireNonNull(tcpKeepAlivePeriod, "tcpKeepAlivePeriod must not be null");
      if (tcpKeepAlivePeriod.isNegative()) {
        throw new IllegalArgumentException("`tcpKeepAlivePeriod` must not be negative");
      }
      this.tcpKeepAlivePeriod = tcpKeepAlivePeriod;
      return this;
    }

    /**
     * Sets the idle timeout. Any non-zero value, negative included, sets a deadline right after
     * connecting; a negative one expires immediately.
     */
    public Builder idleTimeout(Duration idleTimeout) {
      this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout must not be null");
      return this;
    }

    public Builder heartbeat(boolean heartbeat) {
      this.heartbeat = heartbeat;
      return this;
    }

    /** Sets the heartbeat interval; the heartbeat task only runs when it is positive. */
    public Builder heartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval =
          Objects.requireNonNull(heartbeatInterval, "heartbeatInterval must not be null");
      return this;
    }

    /** Sets the tunnel path; an empty path means {@link #DEFAULT_RPC_PATH}. */
    public Builder rpcPath(String rpcPath) {
      this.rpcPath = Objects.requireNonNull(rpcPath, "rpcPath must not be null");
      return this;
    }

    public ConnectOptions build() {
      return new ConnectOptions(this);
    }
  }
}
