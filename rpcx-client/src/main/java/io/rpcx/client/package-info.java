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
 * The rpcx client's connection lifecycle: choosing a {@link io.rpcx.transport.Connector
 * Connector} for a transport name, applying the post-connect policy and running the reader and
 * heartbeat tasks. Start with {@link io.rpcx.client.RpcClient#builder()}.
 */
@NonNullApi
package io.rpcx.client;

import reactor.util.annotation.NonNullApi;
