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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable mapping from transport name to {@link Connector}. Registrations happen once, while
 * building; lookups afterwards are lock-free reads.
 *
 * <pre>{@code
 * TransportRegistry registry =
 *     TransportRegistry.builder()
 *         .registerProviders()
 *         .register("kcp", kcpConnector)
 *         .build();
 * }</pre>
 */
public final class TransportRegistry {

  private static final Logger logger = LoggerFactory.getLogger(TransportRegistry.class);

  private static final TransportRegistry EMPTY = new TransportRegistry(Collections.emptyMap());

  private final Map<String, Connector> connectors;

  private TransportRegistry(Map<String, Connector> connectors) {
    this.connectors = connectors;
  }

  /**
   * Returns a registry without any entry.
   *
   * @return the empty registry
   */
  public static TransportRegistry empty() {
    return EMPTY;
  }

  /**
   * Returns a registry holding every {@link TransportProvider} found on the classpath.
   *
   * @return a new registry
   */
  public static TransportRegistry fromProviders() {
    return builder().registerProviders().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the connector registered under {@code name}, otherwise {@link Optional#empty()}. An
   * unknown name is not an error here; the caller decides what to fall back to.
   *
   * @param name the transport name
   * @return the registered connector, if any
   * @throws NullPointerException if {@code name} is {@code null}
   */
  public Optional<Connector> find(String name) {
    Objects.requireNonNull(name, "name must not be null");
    return Optional.ofNullable(connectors.get(name));
  }

  /**
   * Returns the registered transport names, in registration order.
   *
   * @return the transport names
   */
  public Set<String> names() {
    return connectors.keySet();
  }

  @Override
  public String toString() {
    return "TransportRegistry{" + "names=" + connectors.keySet() + '}';
  }

  public static final class Builder {

    private final Map<String, Connector> connectors = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Registers {@code connector} under {@code name}, replacing an earlier registration of the same
     * name.
     *
     * @param name the transport name
     * @param connector the connector dialling that transport
     * @return the same instance for method chaining
     * @throws NullPointerException if {@code name} or {@code connector} is {@code null}
     */
    public Builder register(String name, Connector connector) {
      Objects.requireNonNull(name, "name must not be null");
      Objects.requireNonNull(connector, "connector must not be null");
      Connector previous = connectors.put(name, connector);
      if (previous != null && previous != connector) {
        logger.debug("transport {} re-registered, replacing {}", name, previous);
      }
      return this;
    }

    /**
     * Registers the connector of the given provider under its name.
     *
     * @param provider the provider to register
     * @return the same instance for method chaining
     */
    public Builder register(TransportProvider provider) {
      Objects.requireNonNull(provider, "provider must not be null");
      return register(provider.name(), provider.connector());
    }

    /**
     * Registers every {@link TransportProvider} available through {@link ServiceLoader}.
     *
     * @return the same instance for method chaining
     */
    public Builder registerProviders() {
      return registerProviders(ServiceLoader.load(TransportProvider.class));
    }

    /**
     * Registers every provider of the given loader.
     *
     * @param providers the providers to register
     * @return the same instance for method chaining
     */
    public Builder registerProviders(Iterable<TransportProvider> providers) {
      Objects.requireNonNull(providers, "providers must not be null");
      providers.forEach(this::register);
      return this;
    }

    public TransportRegistry build() {
      if (connectors.isEmpty()) {
        return EMPTY;
      }
      return new TransportRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(connectors)));
    }
  }
}
