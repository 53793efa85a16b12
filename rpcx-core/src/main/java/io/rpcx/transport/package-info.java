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
 * Client side transport contracts: the {@link io.rpcx.transport.Connector Connector} function, the
 * {@link io.rpcx.transport.TransportRegistry TransportRegistry} resolving transport names, and the
 * {@link io.rpcx.transport.ConnectOptions ConnectOptions} every connector reads.
 */
@NonNullApi
package io.rpcx.transport;

import reactor.util.annotation.NonNullApi;
