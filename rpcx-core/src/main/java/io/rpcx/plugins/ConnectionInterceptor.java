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
import java.util.function.Function;

/**
 * Hook invoked once for every newly created connection, before the client installs it. An
 * interceptor may return the given connection, a decorated replacement, or veto the connection by
 * throwing, e.g. a {@link io.rpcx.exceptions.ConnectionRejectedException}.
 */
@FunctionalInterface
public interface ConnectionInterceptor extends Function<DuplexConnection, DuplexConnection> {}
