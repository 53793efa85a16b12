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

package io.rpcx.internal;

import io.netty.buffer.ByteBuf;
import io.netty.util.ReferenceCountUtil;
import io.rpcx.DeadlineCapable;
import io.rpcx.DuplexConnection;
import io.rpcx.exceptions.DeadlineExceededException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Scannable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Shared plumbing of the transport connections: a serialized outbound queue drained by the
 * transport, close notification, and the {@link DeadlineCapable deadline} timer.
 *
 * <p>Subclasses drain {@link #sender} into the wire, expose the wire's inbound bytes through
 * {@link #doReceive()}, and call {@link #terminate()} once the transport is closed.
 */
public abstract class BaseDuplexConnection implements DuplexConnection, DeadlineCapable {

  private static final Logger logger = LoggerFactory.getLogger(BaseDuplexConnection.class);

  protected final Sinks.Empty<Void> onClose = Sinks.empty();
  protected final Sinks.Many<ByteBuf> sender = Sinks.many().unicast().onBackpressureBuffer();

  private final Sinks.Empty<Void> deadlineExceeded = Sinks.empty();
  private final AtomicReference<Disposable> deadlineTask = new AtomicReference<>();
  private final AtomicReference<DeadlineExceededException> expired = new AtomicReference<>();
  private final Scheduler timer;

  public BaseDuplexConnection() {
    this(Schedulers.parallel());
  }

  public BaseDuplexConnection(Scheduler timer) {
    this.timer = timer;
  }

  @Override
  public void sendFrame(ByteBuf frame) {
    for (; ; ) {
      Sinks.EmitResult result = sender.tryEmitNext(frame);
      if (result == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
        // another writer is emitting right now
        Thread.onSpinWait();
        continue;
      }
      if (result.isFailure()) {
        ReferenceCountUtil.safeRelease(frame);
        logger.debug("dropped outbound frame on {}: {}", this, result);
      }
      return;
    }
  }

  @Override
  public final Flux<ByteBuf> receive() {
    return doReceive().mergeWith(deadlineExceeded.asMono().then(Mono.<ByteBuf>empty()));
  }

  /**
   * Returns the inbound bytes of the underlying transport.
   *
   * @return Stream of received bytes, owned by the subscriber.
   */
  protected abstract Flux<ByteBuf> doReceive();

  @Override
  public void deadline(Instant deadline) {
    long delay = delayMillis(Duration.between(Instant.now(), deadline));
    Disposable task;
    try {
      task = timer.schedule(() -> expire(deadline), delay, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.debug("unable to schedule deadline on {}", this, e);
      return;
    }

    Disposable previous = deadlineTask.getAndSet(task);
    if (previous != null) {
      previous.dispose();
    }
    if (isDisposed()) {
      task.dispose();
    }
  }

  static long delayMillis(Duration remaining) {
    if (remaining.isNegative()) {
      return 0L;
    }
    if (remaining.getSeconds() >= Long.MAX_VALUE / 1000) {
      return Long.MAX_VALUE;
    }
    return remaining.toMillis();
  }

  void expire(Instant deadline) {
    if (!isDisposed() && expired.compareAndSet(null, new DeadlineExceededException(deadline))) {
      logger.debug("deadline {} exceeded on {}", deadline, this);
      dispose();
    }
  }

  /** Closes the underlying transport. Implementations call {@link #terminate()} once closed. */
  protected abstract void doOnClose();

  /**
   * Completes the outbound queue, cancels any pending deadline and signals {@link #onClose()}. If
   * the connection is closing because its deadline passed, {@link #receive()} then fails with
   * {@link DeadlineExceededException}.
   */
  protected final void terminate() {
    Disposable task = deadlineTask.getAndSet(null);
    if (task != null) {
      task.dispose();
    }
    sender.tryEmitComplete();
    onClose.tryEmitEmpty();

    DeadlineExceededException cause = expired.get();
    if (cause != null) {
      deadlineExceeded.tryEmitError(cause);
    } else {
      deadlineExceeded.tryEmitEmpty();
    }
  }

  @Override
  public Mono<Void> onClose() {
    return onClose.asMono();
  }

  @Override
  public final void dispose() {
    doOnClose();
  }

  @Override
  @SuppressWarnings("ConstantConditions")
  public final boolean isDisposed() {
    return onClose.scan(Scannable.Attr.TERMINATED) || onClose.scan(Scannable.Attr.CANCELLED);
  }
}
