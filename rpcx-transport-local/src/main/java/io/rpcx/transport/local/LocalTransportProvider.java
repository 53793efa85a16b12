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

import io.rpcx.transport.Connector;
import io.rpcx.transport.TransportProvider;

/** Registers the in-memory transport under {@value #NAME}. */
public final class LocalTransportProvider implements TransportProvider {

  public static final String NAME = "memu";

  private final Connector connector = LocalConnector.create();

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Connector connector() {
    return connector;
  }
}
