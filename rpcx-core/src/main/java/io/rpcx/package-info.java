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

/**
 * Contains the contracts shared by every transport: {@link io.rpcx.DuplexConnection
 * DuplexConnection} for an established byte stream, and the optional capabilities {@link
 * io.rpcx.KeepAliveCapable KeepAliveCapable} and {@link io.rpcx.DeadlineCapable DeadlineCapable}.
 *
 * <p>To dial a connection see {@link io.rpcx.transport.Connector Connector} and {@link
 * io.rpcx.transport.TransportRegistry TransportRegistry} in {@link io.rpcx.transport}.
 */
@NonNullApi
package io.rpcx;

import reactor.util.annotation.NonNullApi;
