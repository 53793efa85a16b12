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

package io.rpcx.transport.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.http.HttpVersion;
import java.io.EOFException;
import java.net.ProtocolException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Performs the client side of the rpcx HTTP tunnel: writes {@code CONNECT <path> HTTP/1.0}, reads
 * the response head and, if its status is {@value #CONNECTED}, removes itself from the pipeline.
 * Bytes that arrived after the response head are passed on to the next handler, so the stream is
 * positioned exactly after the response.
 *
 * <p>Any other outcome fails {@link #handshakeFuture()} and closes the channel.
 */
public final class TunnelHandshakeHandler extends ByteToMessageDecoder {

  /** The name under which the handler is installed in the pipeline. */
  public static final String NAME = "rpcx.tunnelHandshake";

  /** The only status accepted from the server. */
  public static final String CONNECTED = "200 Connected to rpcx";

  /** The largest response head accepted, in bytes. */
  public static final int MAX_HEAD_LENGTH = 8192;

  private final String path;
  private final ChannelPromise handshakePromise;

  /**
   * Creates a new handler.
   *
   * @param path the path sent in the {@code CONNECT} request
   * @param handshakePromise completed when the tunnel is open or failed when negotiation fails
   */
  public TunnelHandshakeHandler(String path, ChannelPromise handshakePromise) {
    this.path = Objects.requireNonNull(path, "path must not be null");
    this.handshakePromise =
        Objects.requireNonNull(handshakePromise, "handshakePromise must not be null");
  }

  public ChannelPromise handshakeFuture() {
    return handshakePromise;
  }

  @Override
  public void handlerAdded(ChannelHandlerContext ctx) {
    ByteBuf request =
        ByteBufUtil.writeAscii(ctx.alloc(), "CONNECT " + path + " HTTP/1.0\r\n\r\n");
    ctx.writeAndFlush(request)
        .addListener(
            (ChannelFutureListener)
                future -> {
                  if (!future.isSuccess()) {
                    fail(ctx, future.cause());
                  }
                });
    // the inbound side does not read on its own until a subscriber asks
    ctx.read();
  }

  @Override
  protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
    if (handshakePromise.isDone()) {
      in.skipBytes(in.readableBytes());
      return;
    }

    int end = endOfHead(in);
    if (end < 0) {
      if (in.readableBytes() > MAX_HEAD_LENGTH) {
        fail(ctx, tooLong());
      }
      return;
    }
    if (end - in.readerIndex() > MAX_HEAD_LENGTH) {
      fail(ctx, tooLong());
      return;
    }

    String head =
        in.toString(in.readerIndex(), end - in.readerIndex(), StandardCharsets.ISO_8859_1);
    in.readerIndex(end);

    String status;
    try {
      status = parseStatus(head);
    } catch (ProtocolException e) {
      fail(ctx, e);
      return;
    }

    if (!CONNECTED.equals(status)) {
      fail(ctx, new ProtocolException("unexpected HTTP response: " + status));
      return;
    }

    if (handshakePromise.trySuccess()) {
      ctx.pipeline().remove(this);
    }
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    super.channelInactive(ctx);
    handshakePromise.tryFailure(
        new EOFException("connection closed before the tunnel response was read"));
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    fail(ctx, cause);
  }

  private void fail(ChannelHandlerContext ctx, Throwable cause) {
    if (handshakePromise.tryFailure(cause)) {
      ctx.close();
    }
  }

  private static TooLongFrameException tooLong() {
    return new TooLongFrameException(
        "HTTP response head is larger than " + MAX_HEAD_LENGTH + " bytes");
  }

  /** Returns the index just past the empty line ending the head, or -1 if it is incomplete. */
  static int endOfHead(ByteBuf in) {
    int writerIndex = in.writerIndex();
    for (int i = in.readerIndex(); i < writerIndex; i++) {
      if (in.getByte(i) != '\n') {
        continue;
      }
      if (i + 1 < writerIndex && in.getByte(i + 1) == '\n') {
        return i + 2;
      }
      if (i + 2 < writerIndex && in.getByte(i + 1) == '\r' && in.getByte(i + 2) == '\n') {
        return i + 3;
      }
    }
    return -1;
  }

  /**
   * Parses {@code HTTP/<major>.<minor> <code> <reason>} and returns {@code <code> <reason>}.
   *
   * @throws ProtocolException if the status line is malformed
   */
  static String parseStatus(String head) throws ProtocolException {
    int eol = head.indexOf('\n');
    String line = eol < 0 ? head : head.substring(0, eol);
    if (line.endsWith("\r")) {
      line = line.substring(0, line.length() - 1);
    }

    int space = line.indexOf(' ');
    if (space < 0 || !line.startsWith("HTTP/")) {
      throw new ProtocolException("malformed HTTP response: " + line);
    }

    String protocol = line.substring(0, space);
    try {
      HttpVersion.valueOf(protocol);
    } catch (IllegalArgumentException e) {
      throw new ProtocolException("malformed HTTP version: " + protocol);
    }

    String status = line.substring(space + 1);
    int start = 0;
    while (start < status.length() && status.charAt(start) == ' ') {
      start++;
    }
    status = status.substring(start);

    int codeEnd = status.indexOf(' ');
    String code = codeEnd < 0 ? status : status.substring(0, codeEnd);
    if (code.length() != 3) {
      throw new ProtocolException("malformed HTTP status code: " + code);
    }
    for (int i = 0; i < code.length(); i++) {
      if (!Character.isDigit(code.charAt(i))) {
        throw new ProtocolException("malformed HTTP status code: " + code);
      }
    }
    return status;
  }
}
