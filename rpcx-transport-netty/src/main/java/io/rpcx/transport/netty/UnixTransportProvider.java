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

package io.rpcx.transport.netty;

import io.rpcx.transport.Connector;
import io.rpcx.transport.TransportProvider;
import io.rpcx.transport.netty.client.DirectConnector;

/**
 * Registers the {@value Addresses#UNIX} transport, which dials Unix domain sockets. Dialling needs
 * a native Netty transport on the class path.
 */
public final class UnixTransportProvider implements TransportProvider {

  private final Connector connector = DirectConnector.create();

  @Override
  public String name() {
    return Addresses.UNIX;
  }

  @Override
  public Connector connector() {
    return connector;
  }
}
