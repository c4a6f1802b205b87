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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

final class TestSharedFuture {

  private final ExecutorService executor = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void testFutureShare() throws Exception {
    final Promise<Integer> promise = new Promise<Integer>();
    final Future<Integer> future = promise.getFuture();
    final SharedFuture<Integer> shared = future.share();

    assertThat(future.valid()).isFalse();
    assertThat(shared.valid()).isTrue();
    assertThat(shared.isReady()).isFalse();

    promise.setValue(42);
    assertThat(shared.get()).isEqualTo(42);
    assertThat(shared.get()).isEqualTo(42);  // Not consumed.

    final SharedFuture<Integer> copy = new SharedFuture<Integer>(shared);
    assertThat(copy.get()).isEqualTo(42);
    assertThat(shared.valid()).isTrue();
  }

  @Test
  void testSharedFutureCreationFromFuture() {
    final Promise<Integer> promise = new Promise<Integer>();
    final Future<Integer> future = promise.getFuture();
    final SharedFuture<Integer> shared = new SharedFuture<Integer>(future);
    assertThat(shared.valid()).isTrue();
    assertThat(future.valid()).isFalse();
  }

  @Test
  void testShareWithoutState() {
    final SharedFuture<Integer> shared = new Future<Integer>().share();
    assertThat(shared.valid()).isFalse();
    assertThatThrownBy(shared::get)
      .isInstanceOf(FutureException.class)
      .extracting("code").isEqualTo(FutureErrorCode.NO_STATE);
    assertThatThrownBy(shared::await).isInstanceOf(FutureException.class);
    assertThat(new SharedFuture<Integer>().valid()).isFalse();
  }

  @Test
  void testConcurrentGetFromCopies() throws Exception {
    final Promise<Integer> promise = new Promise<Integer>();
    final SharedFuture<Integer> ready = new SharedFuture<Integer>(promise.getFuture());
    final SharedFuture<Integer> copy1 = new SharedFuture<Integer>(ready);
    final SharedFuture<Integer> copy2 = new SharedFuture<Integer>(ready);

    final java.util.concurrent.Future<Integer> first = executor.submit(() -> copy1.get());
    final java.util.concurrent.Future<Integer> second = executor.submit(() -> copy2.get());

    promise.setValue(42);
    assertThat(first.get(10, TimeUnit.SECONDS)).isEqualTo(42);
    assertThat(second.get(10, TimeUnit.SECONDS)).isEqualTo(42);
  }

  @Test
  void testManyReadersOneLateWriter() throws Exception {
    final Promise<String> promise = new Promise<String>();
    final SharedFuture<String> shared = promise.getFuture().share();
    final int readers = 32;
    final CountDownLatch started = new CountDownLatch(readers);
    final List<java.util.concurrent.Future<String>> results =
      new ArrayList<java.util.concurrent.Future<String>>(readers);
    for (int i = 0; i < readers; i++) {
      final SharedFuture<String> mine = new SharedFuture<String>(shared);
      results.add(executor.submit(() -> {
        started.countDown();
        return mine.get();
      }));
    }
    started.await();
    Thread.sleep(20);  // Give the readers a chance to actually block.
    promise.setValue("done");

    for (final java.util.concurrent.Future<String> result : results) {
      assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo("done");
    }
  }

  @Test
  void testExceptionIsNotConsumed() {
    final Promise<Integer> promise = new Promise<Integer>();
    final SharedFuture<Integer> shared = promise.getFuture().share();
    final IllegalStateException error = new IllegalStateException("shared failure");
    promise.setException(error);

    assertThatThrownBy(shared::get).isSameAs(error);
    assertThatThrownBy(new SharedFuture<Integer>(shared)::get).isSameAs(error);
    assertThatThrownBy(shared::getUninterruptibly).isSameAs(error);
  }

  @Test
  void testAwaitUninterruptibly() throws Exception {
    final Promise<Integer> promise = new Promise<Integer>();
    final SharedFuture<Integer> shared = promise.getFuture().share();
    executor.submit(() -> {
      Thread.sleep(50);
      promise.setValue(3);
      return null;
    });
    Thread.currentThread().interrupt();
    shared.awaitUninterruptibly();
    assertThat(Thread.interrupted()).isTrue();
    assertThat(shared.isReady()).isTrue();
    assertThat(shared.get()).isEqualTo(3);
  }

}
