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

/**
 * The reading side of a single-assignment result, for any number of
 * readers.
 * <p>
 * A {@code SharedFuture} is obtained by consuming a {@link Future}, either
 * with {@link Future#share} or with {@link #SharedFuture(Future)}.  Unlike a
 * {@code Future}, reading the result doesn't consume it: every copy can
 * {@link #get} the same result, concurrently, any number of times.  A stored
 * exception is thrown again each time, it's not consumed either.
 * <p>
 * Copies are made with {@link #SharedFuture(SharedFuture)}; the instance
 * itself is immutable, so sharing the same instance between threads is fine
 * too.
 * @param <T> The type of the value.
 */
public final class SharedFuture<T> {

  private final ResultCell<T> cell;

  /** Creates a shared future without state.  */
  public SharedFuture() {
    this((ResultCell<T>) null);
  }

  /**
   * Converts a future, consuming it.
   * @param future The future to convert.  It's left without state.
   */
  public SharedFuture(final Future<T> future) {
    this(future.share().cell);
  }

  /**
   * Copy constructor.  The copy reads the same result as {@code other}.
   * @param other The shared future to copy.
   */
  public SharedFuture(final SharedFuture<T> other) {
    this(other.cell);
  }

  SharedFuture(final ResultCell<T> cell) {
    this.cell = cell;
  }

  /**
   * Waits for the result and returns it.
   * @return The value.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * shared future has no state.
   * @throws InterruptedException if this thread was interrupted while waiting.
   * @throws Exception if the result is an exception, this exception is thrown.
   */
  public T get() throws InterruptedException, Exception {
    return cell().get();
  }

  /**
   * Waits for the result and returns it.
   * <p>
   * If this thread gets interrupted while waiting, it keeps waiting anyway
   * and the interrupted status is set again before returning.
   * @return The value.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * shared future has no state.
   * @throws Exception if the result is an exception, this exception is thrown.
   */
  public T getUninterruptibly() throws Exception {
    return cell().getUninterruptibly();
  }

  /**
   * Blocks until the result is available.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * shared future has no state.
   * @throws InterruptedException if this thread was interrupted while waiting.
   */
  public void await() throws InterruptedException {
    cell().await();
  }

  /**
   * Blocks until the result is available.
   * Interrupts are deferred until the result is available.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * shared future has no state.
   */
  public void awaitUninterruptibly() {
    cell().awaitUninterruptibly();
  }

  /**
   * Returns {@code true} if the result is available.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * shared future has no state.
   */
  public boolean isReady() {
    return cell().isDone();
  }

  /** Returns {@code true} if this shared future has state.  */
  public boolean valid() {
    return cell != null;
  }

  private ResultCell<T> cell() {
    if (cell == null) {
      throw new FutureException(FutureErrorCode.NO_STATE);
    }
    return cell;
  }

  public String toString() {
    return "SharedFuture(" + (cell == null ? "<no state>" : cell.toString()) + ')';
  }

}
