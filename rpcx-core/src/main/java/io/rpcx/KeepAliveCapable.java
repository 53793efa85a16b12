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

import java.time.Duration;

/** A {@link DuplexConnection} whose underlying socket supports TCP keep-alive probes. */
public interface KeepAliveCapable {

  /**
   * Enables keep-alive on the underlying socket and sets the probe period.
   *
   * @param period idle time before the first probe and the interval between probes
   * @return {@code true} if every socket option was applied
   */
  boolean keepAlive(Duration period);
}
