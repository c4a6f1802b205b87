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

import java.util.concurrent.ExecutionException;

/**
 * The reading side of a single-assignment result, for a single reader.
 * <p>
 * A {@code Future} is obtained from {@link Promise#getFuture}.  It's a linear
 * capability: {@link #get}, {@link #share}, {@link #then} and {@link #move}
 * consume it, after which it has no state and {@link #valid} returns
 * {@code false}.  Use {@link #share} if more than one reader needs the
 * result.
 *
 * <h1>Continuations</h1>
 * {@link #then} attaches a {@link Callback} that's given this future once the
 * result is available, and returns a new future for whatever the callback
 * returns (or throws).  Chained continuations form a singly linked list of
 * cells:
 * <pre>
 *   Promise --&gt; cell1 --then(g)--&gt; cell2 --then(h)--&gt; cell3 &lt;-- Future
 * </pre>
 * The thread that runs a continuation is the thread that completes the
 * previous cell, or the thread calling {@code then} if the previous cell was
 * already completed.  This class doesn't create or manage any thread or
 * executor.
 *
 * <h1>Thread safety</h1>
 * A {@code Future} is meant to be used by one thread at a time.  Handing it
 * to another thread must be done through some form of safe publication.
 * @param <T> The type of the value.
 */
public final class Future<T> {

  private ResultCell<T> cell;

  /** Creates a future without state.  */
  public Future() {
  }

  Future(final ResultCell<T> cell) {
    this.cell = cell;
  }

  /**
   * Returns a future already completed with a value.
   * @param value The value.
   */
  public static <T> Future<T> fromValue(final T value) {
    final ResultCell<T> cell = new ResultCell<T>();
    cell.setValue(value);
    return new Future<T>(cell);
  }

  /**
   * Returns a future already completed with an exception.
   * @param error The exception {@link #get} will throw.
   */
  public static <T> Future<T> fromException(final Exception error) {
    final ResultCell<T> cell = new ResultCell<T>();
    cell.setException(error);
    return new Future<T>(cell);
  }

  /**
   * Waits for the result and returns it, consuming this future.
   * <p>
   * If this thread is interrupted while waiting, this future keeps its state
   * and can be used again.
   * @return The value.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * future has no state.
   * @throws InterruptedException if this thread was interrupted while waiting.
   * @throws Exception if the result is an exception, this exception is thrown.
   */
  public T get() throws InterruptedException, Exception {
    final ResultCell<T> cell = cell();
    cell.await();
    this.cell = null;
    return cell.get();
  }

  /**
   * Waits for the result and returns it, consuming this future.
   * <p>
   * If this thread gets interrupted while waiting, it keeps waiting anyway
   * and the interrupted status is set again before returning.
   * @return The value.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * future has no state.
   * @throws Exception if the result is an exception, this exception is thrown.
   */
  public T getUninterruptibly() throws Exception {
    final ResultCell<T> cell = cell();
    this.cell = null;
    return cell.getUninterruptibly();
  }

  /**
   * Blocks until the result is available, without consuming this future.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * future has no state.
   * @throws InterruptedException if this thread was interrupted while waiting.
   */
  public void await() throws InterruptedException {
    cell().await();
  }

  /**
   * Blocks until the result is available, without consuming this future.
   * Interrupts are deferred until the result is available.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * future has no state.
   */
  public void awaitUninterruptibly() {
    cell().awaitUninterruptibly();
  }

  /**
   * Returns {@code true} if the result is available, {@link #get} won't block.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * future has no state.
   */
  public boolean isReady() {
    return cell().isDone();
  }

  /** Returns {@code true} if this future has state.  */
  public boolean valid() {
    return cell != null;
  }

  /**
   * Converts this future into a {@link SharedFuture}, consuming it.
   * If this future has no state, neither does the shared future.
   */
  public SharedFuture<T> share() {
    final ResultCell<T> cell = this.cell;
    this.cell = null;
    return new SharedFuture<T>(cell);
  }

  /**
   * Transfers this future to a new instance.
   * @return A future with the state of {@code this}, which is left without
   * state.
   */
  public Future<T> move() {
    final ResultCell<T> cell = this.cell;
    this.cell = null;
    return new Future<T>(cell);
  }

  /**
   * Attaches a continuation, consuming this future.
   * <p>
   * Once the result of this future is available, {@code fn} is invoked with
   * a future holding that result (so {@code fn} can {@link #get} it without
   * blocking).  Whatever {@code fn} returns becomes the value of the future
   * returned here.  If {@code fn} throws, the exception becomes its result
   * instead, it doesn't propagate into the thread running the continuation.
   * An {@link Error} thrown by {@code fn} is stored wrapped in an
   * {@link ExecutionException}, then rethrown to the thread running the
   * continuation.
   * <p>
   * If the result is already available, {@code fn} is invoked from this
   * thread before this method returns.
   * @param fn The continuation.
   * @return A future for the result of {@code fn}.
   * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this
   * future has no state.
   */
  public <R> Future<R> then(final Callback<R, Future<T>> fn) {
    if (fn == null) {
      throw new NullPointerException("null callback");
    }
    final ResultCell<T> cell = cell();
    final Promise<R> promise = new Promise<R>();
    final Future<R> future = promise.getFuture();
    this.cell = null;
    cell.setContinuation(new UniqueFunction<Void, Void>(new Then<R, T>(cell, promise, fn)));
    return future;
  }

  /**
   * The continuation built by {@link #then}.
   * Holds the previous cell, the promise of the next one and the user's
   * callback.  That's 3 references, so it's stored inline.
   */
  private static final class Then<R, T> implements Callback<Void, Void> {
    private final ResultCell<T> cell;
    private final Promise<R> promise;
    private final Callback<R, Future<T>> fn;

    Then(final ResultCell<T> cell, final Promise<R> promise,
         final Callback<R, Future<T>> fn) {
      this.cell = cell;
      this.promise = promise;
      this.fn = fn;
    }

    public Void call(final Void unused) {
      final R result;
      try {
        result = fn.call(new Future<T>(cell));
      } catch (Exception e) {
        promise.setException(e);
        return null;
      } catch (Error e) {
        promise.setException(new ExecutionException(e));
        throw e;
      }
      promise.setValue(result);
      return null;
    }

    public String toString() {
      return "then " + fn;
    }
  }

  private ResultCell<T> cell() {
    final ResultCell<T> cell = this.cell;
    if (cell == null) {
      throw new FutureException(FutureErrorCode.NO_STATE);
    }
    return cell;
  }

  public String toString() {
    final ResultCell<T> cell = this.cell;
    return "Future(" + (cell == null ? "<no state>" : cell.toString()) + ')';
  }

}
