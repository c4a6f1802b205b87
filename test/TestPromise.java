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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

final class TestPromise {

  @Test
  void testGetFutureTwice() {
    final Promise<Integer> promise = new Promise<Integer>();
    promise.getFuture();
    assertThatThrownBy(promise::getFuture)
      .isInstanceOf(FutureException.class)
      .hasMessage("future_already_retrieved")
      .extracting("code").isEqualTo(FutureErrorCode.FUTURE_ALREADY_RETRIEVED);
  }

  @Test
  void testSetValueTwice() throws Exception {
    final Promise<Integer> promise = new Promise<Integer>();
    promise.setValue(42);

    assertThatThrownBy(() -> promise.setValue(43))
      .isInstanceOf(FutureException.class)
      .extracting("code").isEqualTo(FutureErrorCode.PROMISE_ALREADY_SATISFIED);
    assertThatThrownBy(() -> promise.setException(new RuntimeException()))
      .isInstanceOf(FutureException.class)
      .extracting("code").isEqualTo(FutureErrorCode.PROMISE_ALREADY_SATISFIED);
    assertThat(promise.getFuture().get()).isEqualTo(42);
  }

  @Test
  void testSetExceptionTwice() {
    final Promise<String> promise = new Promise<String>();
    final RuntimeException first = new RuntimeException("first");
    promise.setException(first);
    assertThatThrownBy(() -> promise.setValue("late"))
      .isInstanceOf(FutureException.class);
    assertThatThrownBy(promise.getFuture()::get).isSameAs(first);
  }

  @Test
  void testNullException() {
    final Promise<String> promise = new Promise<String>();
    assertThatThrownBy(() -> promise.setException(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void testMove() throws Exception {
    final Promise<Integer> promise = new Promise<Integer>();
    final Future<Integer> future = promise.getFuture();
    final Promise<Integer> moved = promise.move();

    assertThat(promise.valid()).isFalse();
    assertThat(moved.valid()).isTrue();
    assertThatThrownBy(() -> promise.setValue(1))
      .isInstanceOf(FutureException.class)
      .extracting("code").isEqualTo(FutureErrorCode.NO_STATE);
    assertThatThrownBy(promise::getFuture)
      .isInstanceOf(FutureException.class)
      .extracting("code").isEqualTo(FutureErrorCode.NO_STATE);
    assertThatThrownBy(() -> promise.setException(new RuntimeException()))
      .isInstanceOf(FutureException.class)
      .extracting("code").isEqualTo(FutureErrorCode.NO_STATE);
    assertThatThrownBy(promise::move).isInstanceOf(FutureException.class);

    // The move didn't break anything, the future still gets the value.
    assertThat(future.isReady()).isFalse();
    moved.setValue(7);
    assertThat(future.get()).isEqualTo(7);
  }

  @Test
  void testMovedPromiseStillRetrievesOnce() {
    final Promise<Integer> promise = new Promise<Integer>();
    promise.getFuture();
    final Promise<Integer> moved = promise.move();
    assertThatThrownBy(moved::getFuture)
      .isInstanceOf(FutureException.class)
      .extracting("code").isEqualTo(FutureErrorCode.FUTURE_ALREADY_RETRIEVED);
  }

  @Test
  void testCloseBreaksPromise() {
    final Future<Integer> future;
    try (final Promise<Integer> promise = new Promise<Integer>()) {
      future = promise.getFuture();
    }
    assertThat(future.isReady()).isTrue();
    assertThatThrownBy(future::get)
      .isInstanceOf(FutureException.class)
      .hasMessage("broken_promise")
      .extracting("code").isEqualTo(FutureErrorCode.BROKEN_PROMISE);
  }

  @Test
  void testCloseBreaksWholeChain() {
    final Promise<Integer> promise = new Promise<Integer>();
    final AtomicInteger reached = new AtomicInteger();
    final Future<Integer> last = promise.getFuture()
      .then(f -> f.get() + 1)
      .then(f -> {
        final int v = f.get();
        reached.incrementAndGet();
        return v + 1;
      });

    promise.close();
    assertThat(promise.valid()).isFalse();
    assertThat(reached).hasValue(0);
    assertThatThrownBy(last::get)
      .isInstanceOf(FutureException.class)
      .extracting("code").isEqualTo(FutureErrorCode.BROKEN_PROMISE);
  }

  /** Builds a chain whose promise is unreachable once this returns.  */
  private static Future<Integer> chainOnDroppedPromise() {
    return new Promise<Integer>().getFuture().then(f -> f.get() + 1);
  }

  @Test
  void testCollectedPromiseBreaksChain() throws Exception {
    final Future<Integer> last = chainOnDroppedPromise();
    for (int i = 0; i < 50 && !last.isReady(); i++) {
      System.gc();
      Thread.sleep(20);
    }
    assertThat(last.isReady()).isTrue();
    assertThatThrownBy(last::get)
      .isInstanceOf(FutureException.class)
      .extracting("code").isEqualTo(FutureErrorCode.BROKEN_PROMISE);
  }

  @Test
  void testCloseAfterValueKeepsValue() throws Exception {
    final Promise<Integer> promise = new Promise<Integer>();
    final Future<Integer> future = promise.getFuture();
    promise.setValue(11);
    promise.close();
    promise.close();  // Closing twice does nothing.

    assertThat(promise.valid()).isFalse();
    assertThat(future.get()).isEqualTo(11);
  }

  @Test
  void testCloseMovedOutPromise() throws Exception {
    final Promise<Integer> promise = new Promise<Integer>();
    final Future<Integer> future = promise.getFuture();
    final Promise<Integer> moved = promise.move();
    promise.close();

    assertThat(future.isReady()).isFalse();
    moved.setValue(2);
    assertThat(future.get()).isEqualTo(2);
  }

  @Test
  void testToString() {
    final Promise<Integer> promise = new Promise<Integer>();
    assertThat(promise.toString()).contains("state=PENDING");
    promise.close();
    assertThat(promise.toString()).isEqualTo("Promise(<no state>)");
  }

}
