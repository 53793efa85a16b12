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

/**
 * A service-provider interface contributing a named {@link Connector} to a {@link
 * TransportRegistry}. Providers are discovered with {@link java.util.ServiceLoader} from {@code
 * META-INF/services/io.rpcx.transport.TransportProvider}.
 */
public interface TransportProvider {

  /**
   * Returns the transport name this provider registers, e.g. {@code kcp}.
   *
   * @return the transport name
   */
  String name();

  /**
   * Returns the connector dialling this transport.
   *
   * @return the connector
   */
  Connector connector();
}
