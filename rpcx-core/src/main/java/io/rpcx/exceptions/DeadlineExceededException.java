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

package io.rpcx.exceptions;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/** The deadline set through {@link io.rpcx.DeadlineCapable} passed before the connection closed. */
public final class DeadlineExceededException extends TimeoutException {

  private static final long serialVersionUID = -4401375457106651871L;

  private final Instant deadline;

  public DeadlineExceededException(Instant deadline) {
    super(
        "i/o deadline exceeded at "
            + Objects.requireNonNull(deadline, "deadline must not be null"));
    this.deadline = deadline;
  }

  public Instant deadline() {
    return deadline;
  }
}
