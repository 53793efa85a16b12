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

package io.rpcx;

import java.time.Instant;

/** A {@link DuplexConnection} that accepts an absolute I/O deadline. */
public interface DeadlineCapable {

  /**
   * Sets an absolute deadline, replacing any deadline set before. Once it passes, {@link
   * DuplexConnection#receive()} fails with {@link io.rpcx.exceptions.DeadlineExceededException}
   * and the connection is closed. A deadline that already passed fires immediately.
   *
   * @param deadline the point in time at which I/O on this connection times out
   */
  void deadline(Instant deadline);
}
