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

import io.netty.buffer.ByteBuf;
import io.netty.util.ReferenceCountUtil;
import io.rpcx.DuplexConnection;

/**
 * Consumes the bytes read from the active connection. This is where a message codec plugs in;
 * the handler owns each buffer it is given and must release it.
 */
@FunctionalInterface
public interface InboundFrameHandler {

  /** Releases every buffer without looking at it. */
  InboundFrameHandler RELEASE = (connection, frame) -> ReferenceCountUtil.safeRelease(frame);

  /**
   * Handles bytes read from {@code connection}. An exception thrown here stops reading and closes
   * the connection.
   *
   * @param connection the connection the bytes were read from
   * @param frame the bytes read, owned by the handler
   */
  void handle(DuplexConnection connection, ByteBuf frame);
}
