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
import io.netty.buffer.ByteBufAllocator;

/** Produces the frame written on every heartbeat tick. */
@FunctionalInterface
public interface HeartbeatFrameSupplier {

  /** An empty length-prefixed frame: four zero bytes. */
  HeartbeatFrameSupplier EMPTY_FRAME = allocator -> allocator.buffer(Integer.BYTES).writeInt(0);

  /**
   * Returns a new frame, ownership of which passes to the caller.
   *
   * @param allocator the allocator of the connection the frame is written to
   * @return the heartbeat frame
   */
  ByteBuf frame(ByteBufAllocator allocator);
}
