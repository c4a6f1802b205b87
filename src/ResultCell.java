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

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The state shared by a {@link Promise} and the {@link Future} or
 * {@link SharedFuture}s reading from it.
 * <p>
 * A cell holds exactly one outcome once completed: either a value (which
 * may be {@code null}) or an {@link Exception}.  It also holds at most one
 * continuation, which is invoked exactly once, by whichever thread does the
 * later of completing the cell and attaching the continuation.  The
 * continuation is never invoked while holding the lock of the cell.
 * <p>
 * The lock of a cell is the cell's own monitor.  It guards the outcome and
 * the continuation, and it's also what readers {@code wait()} on.
 * @param <T> The type of the value.
 */
final class ResultCell<T> {

  private static final Logger LOG = LoggerFactory.getLogger(ResultCell.class);

  /**
   * The FSM is as follows:
   * <pre>
   *   PENDING --> DONE
   * </pre>
   * DONE is terminal.
   */
  private static final int PENDING = 0;
  private static final int DONE = 1;

  /**
   * The current state of this cell.
   * Only ever written while holding the lock, but read without it as a fast
   * path.  Because it's volatile and written after {@link #value} and
   * {@link #error}, seeing DONE guarantees the outcome is visible.
   */
  private volatile int state = PENDING;

  /** Non-zero once a future was handed out.  */
  private volatile int retrieved;

  /** Helper for atomic CAS on {@link #retrieved}.  */
  @SuppressWarnings("rawtypes")
  private static final AtomicIntegerFieldUpdater<ResultCell> retrievedUpdater =
    AtomicIntegerFieldUpdater.newUpdater(ResultCell.class, "retrieved");

  /** The value, if completed with a value.  */
  private T value;

  /** The exception, if completed with an exception.  */
  private Exception error;

  /**
   * The continuation to invoke on completion.
   * Invariants:
   *   - If state is DONE, this is empty.
   *   - All accesses must be done while synchronizing on `this'.
   */
  private final UniqueFunction<Void, Void> continuation = UniqueFunction.empty();

  ResultCell() {
  }

  /**
   * Completes this cell with a value and runs the continuation, if any.
   * @param value The value.
   * @throws FutureException with {@link FutureErrorCode#PROMISE_ALREADY_SATISFIED}
   * if this cell was already completed.
   */
  void setValue(final T value) {
    final UniqueFunction<Void, Void> then;
    synchronized (this) {
      checkPending();
      this.value = value;
      then = complete();
    }
    runContinuation(then);
  }

  /**
   * Completes this cell with an exception and runs the continuation, if any.
   * @param error The exception readers will get.
   * @throws FutureException with {@link FutureErrorCode#PROMISE_ALREADY_SATISFIED}
   * if this cell was already completed.
   */
  void setException(final Exception error) {
    if (error == null) {
      throw new NullPointerException("null exception");
    }
    final UniqueFunction<Void, Void> then;
    synchronized (this) {
      checkPending();
      this.error = error;
      then = complete();
    }
    runContinuation(then);
  }

  /**
   * Attaches the continuation of this cell.
   * <p>
   * If this cell isn't completed yet, the continuation replaces any
   * previously attached one and will be invoked by the thread that completes
   * the cell.  Otherwise it is invoked immediately from this thread.
   * @param then The continuation.  It's moved out of, so it's left empty.
   */
  void setContinuation(final UniqueFunction<Void, Void> then) {
    final UniqueFunction<Void, Void> now;
    synchronized (this) {
      if (state != DONE) {
        continuation.assign(then);
        return;
      }
      now = then.move();
    }
    runContinuation(now);
  }

  /**
   * Discards the continuation without invoking it.
   * @return {@code true} if there was a continuation to discard.
   */
  boolean resetContinuation() {
    final UniqueFunction<Void, Void> discarded;
    synchronized (this) {
      discarded = continuation.move();
    }
    final boolean had = !discarded.isEmpty();
    if (had) {
      LOG.debug("Discarding {} of ResultCell@{}", discarded, super.hashCode());
    }
    discarded.close();
    return had;
  }

  /**
   * Releases a cell whose producer is gone.
   * @param breakPromise If {@code true} and the cell is still pending, it's
   * completed with a {@link FutureErrorCode#BROKEN_PROMISE} exception and the
   * continuation runs.  Otherwise the continuation is just discarded.
   */
  void abandon(final boolean breakPromise) {
    if (breakPromise) {
      final UniqueFunction<Void, Void> then;
      synchronized (this) {
        if (state == DONE) {
          return;
        }
        error = new FutureException(FutureErrorCode.BROKEN_PROMISE);
        then = complete();
      }
      LOG.debug("Broke the promise of {}", this);
      runContinuation(then);
    } else {
      resetContinuation();
    }
  }

  /**
   * Marks this cell as having handed out its future.
   * @throws FutureException with {@link FutureErrorCode#FUTURE_ALREADY_RETRIEVED}
   * if this was already done.
   */
  void markRetrievedOrFail() {
    if (!retrievedUpdater.compareAndSet(this, 0, 1)) {
      throw new FutureException(FutureErrorCode.FUTURE_ALREADY_RETRIEVED);
    }
  }

  /** Returns {@code true} if this cell was completed.  */
  boolean isDone() {
    return state == DONE;
  }

  /**
   * Waits until this cell is completed and returns its value.
   * @return The value.
   * @throws InterruptedException if this thread was interrupted while waiting.
   * @throws Exception the exception the cell was completed with, if any.
   */
  T get() throws InterruptedException, Exception {
    await();
    return result();
  }

  /**
   * Waits until this cell is completed and returns its value.
   * If this thread gets interrupted it keeps waiting and the interrupted
   * status is set again before returning.
   * @return The value.
   * @throws Exception the exception the cell was completed with, if any.
   */
  T getUninterruptibly() throws Exception {
    awaitUninterruptibly();
    return result();
  }

  /**
   * Blocks until this cell is completed.
   * @throws InterruptedException if this thread was interrupted while waiting.
   */
  void await() throws InterruptedException {
    if (state == DONE) {  // Fast path.
      return;
    }
    synchronized (this) {
      while (state != DONE) {
        super.wait();
      }
    }
  }

  /**
   * Blocks until this cell is completed.
   * If this thread gets interrupted it keeps waiting and the interrupted
   * status is set again before returning.
   */
  void awaitUninterruptibly() {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          await();
          return;
        } catch (InterruptedException e) {
          LOG.debug("While waiting on {}: interrupted", this);
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();  // Restore the interrupted status.
      }
    }
  }

  /**
   * Returns the outcome.  Must only be called once DONE.
   */
  private T result() throws Exception {
    if (error != null) {
      throw error;
    }
    return value;
  }

  private void checkPending() {
    if (state == DONE) {
      throw new FutureException(FutureErrorCode.PROMISE_ALREADY_SATISFIED);
    }
  }

  /**
   * Switches to DONE, wakes up readers and detaches the continuation.
   * Must be called while synchronizing on `this', after the outcome is set.
   * @return The continuation to run once the lock is released.
   */
  private UniqueFunction<Void, Void> complete() {
    state = DONE;
    super.notifyAll();
    return continuation.move();
  }

  /**
   * Runs a continuation.  Must be called without holding the lock, as the
   * continuation may touch this cell or chain further.
   */
  private static void runContinuation(final UniqueFunction<Void, Void> then) {
    if (then.isEmpty()) {
      return;
    }
    try {
      then.call(null);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("continuation " + then + " failed", e);
    } finally {
      then.close();
    }
  }

  public String toString() {
    final int state = this.state;  // volatile access before reading the outcome.
    final StringBuilder buf = new StringBuilder(64);
    buf.append("ResultCell@").append(super.hashCode())
      .append("(state=").append(state == DONE ? "DONE" : "PENDING");
    if (state == DONE) {
      if (error != null) {
        buf.append(", error=").append(error);
      } else {
        buf.append(", value=").append(value);
      }
    }
    buf.append(", continuation=");
    synchronized (this) {
      buf.append(continuation.isEmpty() ? "<none>" : continuation.toString());
    }
    buf.append(')');
    return buf.toString();
  }

}
