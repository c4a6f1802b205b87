/*
 * Copyright (c) 2010-2012  The SUAsync Authors.  All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *   - Redistributions of source code must retain the above copyright notice,
 *     this list of conditions and the following disclaimer.
 *   - Redistributions in binary form must reproduce the above copyright notice,
 *     this list of conditions and the following disclaimer in the documentation
 *     and/or other materials provided with the distribution.
 *   - Neither the name of the StumbleUpon nor the names of its contributors
 *     may be used to endorse or promote products derived from this software
 *     without specific prior written permission.
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED.  IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */
package com.stumbleupon.promise;

import java.lang.ref.Cleaner;
import java.lang.ref.Reference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The producing side of a single-assignment result.
 * <p>
 * A {@code Promise} is given its result exactly once, with either
 * {@link #setValue} or {@link #setException}, and hands out exactly one
 * {@link Future} to read it.  It's a linear capability: it can't be copied,
 * and {@link #move} transfers it to a new instance, leaving this one without
 * state (any further use throws a {@link FutureException} with
 * {@link FutureErrorCode#NO_STATE}).
 * <p>
 * Giving the promise its result runs the continuation attached by
 * {@link Future#then}, if any, synchronously on the calling thread.  Long
 * running continuations therefore delay the return of {@code setValue}.
 *
 * <h1>Abandoned promises</h1>
 * Closing a promise releases its state.  If no result was given to it yet,
 * the reading side is completed with a {@link FutureException} with
 * {@link FutureErrorCode#BROKEN_PROMISE}, which flows down any chain of
 * {@link Future#then} continuations.  A promise that becomes unreachable
 * without being closed gets the same treatment once the garbage collector
 * notices, from the cleaner thread.
 * <p>
 * Setting the system property {@code com.stumbleupon.promise.breakAbandoned}
 * to {@code false} instead discards the pending continuation without running
 * it and leaves readers blocked.
 * @param <T> The type of the value.
 */
public final class Promise<T> implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(Promise.class);

  /** Whether abandoned promises are broken, or just dropped.  */
  static final boolean BREAK_ABANDONED =
    Boolean.parseBoolean(System.getProperty("com.stumbleupon.promise.breakAbandoned",
                                            "true"));

  private static final Cleaner CLEANER = Cleaner.create();

  // The cleaner may run as soon as the promise is no longer reachable, which
  // can happen in the middle of one of its methods.  Methods handing the cell
  // to someone else fence `this' until they're done with it.

  /**
   * Owns the cell on behalf of the promise.
   * Registered with the cleaner, so it must not refer to the promise.
   */
  private static final class Owner<T> implements Runnable {
    volatile ResultCell<T> cell;
    volatile boolean closed;

    Owner(final ResultCell<T> cell) {
      this.cell = cell;
    }

    public void run() {
      final ResultCell<T> cell = this.cell;
      this.cell = null;
      if (cell == null) {
        return;  // Moved out.
      }
      if (!closed && !cell.isDone()) {
        LOG.warn("{} was garbage collected without being given a result", cell);
      }
      cell.abandon(BREAK_ABANDONED);
    }
  }

  private final Owner<T> owner;
  private final Cleaner.Cleanable cleanable;

  /** Constructor.  */
  public Promise() {
    this(new ResultCell<T>());
  }

  private Promise(final ResultCell<T> cell) {
    owner = new Owner<T>(cell);
    cleanable = CLEANER.register(this, owner);
  }

  /**
   * Returns the future reading the result of this promise.
   * Can only be called once.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * promise has no state, or {@link FutureErrorCode#FUTURE_ALREADY_RETRIEVED}
   * if the future was already handed out.
   */
  public Future<T> getFuture() {
    try {
      final ResultCell<T> cell = cell();
      cell.markRetrievedOrFail();
      return new Future<T>(cell);
    } finally {
      Reference.reachabilityFence(this);
    }
  }

  /**
   * Gives this promise its value.
   * @param value The value (can be {@code null}).
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * promise has no state, or {@link FutureErrorCode#PROMISE_ALREADY_SATISFIED}
   * if it was already given a result.
   */
  public void setValue(final T value) {
    try {
      cell().setValue(value);
    } finally {
      Reference.reachabilityFence(this);
    }
  }

  /**
   * Gives this promise an exception as its result.
   * @param error The exception readers will get.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * promise has no state, or {@link FutureErrorCode#PROMISE_ALREADY_SATISFIED}
   * if it was already given a result.
   */
  public void setException(final Exception error) {
    try {
      cell().setException(error);
    } finally {
      Reference.reachabilityFence(this);
    }
  }

  /** Returns {@code true} if this promise has state.  */
  public boolean valid() {
    return owner.cell != null;
  }

  /**
   * Transfers this promise to a new instance.
   * @return A promise with the state of {@code this}, which is left without
   * state.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * promise has no state.
   */
  public Promise<T> move() {
    try {
      final ResultCell<T> cell = cell();
      owner.cell = null;
      cleanable.clean();
      return new Promise<T>(cell);
    } finally {
      Reference.reachabilityFence(this);
    }
  }

  /**
   * Releases the state of this promise, see the class documentation.
   * Closing a promise more than once, or closing one without state, does
   * nothing.
   */
  public void close() {
    owner.closed = true;
    cleanable.clean();
  }

  private ResultCell<T> cell() {
    final ResultCell<T> cell = owner.cell;
    if (cell == null) {
      throw new FutureException(FutureErrorCode.NO_STATE);
    }
    return cell;
  }

  public String toString() {
    final ResultCell<T> cell = owner.cell;
    return "Promise(" + (cell == null ? "<no state>" : cell.toString()) + ')';
  }

}
