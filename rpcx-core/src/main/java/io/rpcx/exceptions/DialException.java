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
 * The underlying dial failed: the connect timed out or was refused, the name did not resolve, or
 * the TLS handshake failed. Dial failures are never retried by the connectors.
 */
public final class DialException extends TransportException {

  private static final long serialVersionUID = 6250390384271402361L;

  private final String network;

  private final String address;

  /**
   * Constructs a new exception.
   *
   * @param network the transport name that was dialled
   * @param address the address that was dialled
   * @param cause the cause of this exception
   */
  public DialException(String network, String address, Throwable cause) {
    super(
        "failed to dial "
            + Objects.requireNonNull(network, "network must not be null")
            + " "
            + Objects.requireNonNull(address, "address must not be null")
            + ": "
            + cause,
        Objects.requireNonNull(cause, "cause must not be null"));
    this.network = network;
    this.address = address;
  }

  public String network() {
    return network;
  }

  public String address() {
    return address;
  }
}
