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

import java.util.Objects;

/**
 * The HTTP {@code CONNECT} exchange that opens an rpcx tunnel failed: the request could not be
 * written, the response was missing or malformed, or its status was not {@code 200 Connected to
 * rpcx}. The socket is closed before this exception is signalled.
 */
public final class TunnelNegotiationException extends TransportException {

  private static final long serialVersionUID = -1785412473000394214L;

  private final String op;

  private final String network;

  private final String address;

  /**
   * Constructs a new exception.
   *
   * @param op the name of the failed operation, e.g. {@code dial-http}
   * @param network the transport name that was dialled
   * @param address the address that was dialled
   * @param cause the cause of this exception
   */
  public TunnelNegotiationException(String op, String network, String address, Throwable cause) {
    super(
        Objects.requireNonNull(op, "op must not be null")
            + " "
            + Objects.requireNonNull(network, "network must not be null")
            + " "
            + Objects.requireNonNull(address, "address must not be null")
            + ": "
            + Objects.requireNonNull(cause, "cause must not be null").getMessage(),
        cause);
    this.op = op;
    this.network = network;
    this.address = address;
  }

  public String op() {
    return op;
  }

  public String network() {
    return network;
  }

  public String address() {
    return address;
  }
}
