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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A move-only box around a {@link Callback}.
 * <p>
 * A {@code UniqueFunction} owns exactly one closure (or nothing, in which
 * case it's <em>empty</em>).  It can be invoked any number of times, the
 * closure isn't consumed by an invocation.  Ownership can only be
 * transferred, never shared: {@link #move}, {@link #assign} and
 * {@link #swap} all leave the source without the closure it used to hold.
 * Invoking an empty {@code UniqueFunction} throws a {@link BadCallException},
 * it never silently does nothing.
 *
 * <h1>Storage</h1>
 * Closures are stored in one of two ways, picked once per concrete closure
 * class:
 * <ul>
 *   <li><b>Tiny</b>: the closure's captures fit in {@link #TINY_CAPACITY}
 *       bytes.  The closure is held inline, no allocation is made.</li>
 *   <li><b>Big</b>: the closure is larger.  A single block is obtained from
 *       the {@link Allocator} when the closure is stored, and handed back to
 *       that same allocator exactly once, when the closure is destroyed.
 *       Moving a big closure transfers the block, it doesn't allocate.</li>
 * </ul>
 * The size of a closure is the sum of the sizes of its instance fields, that
 * is, of what it captured.  References count as 8 bytes, primitives count as
 * their JVM width.  A closure capturing a couple of references, such as the
 * continuations built by {@link Future#then}, is always tiny.
 * <p>
 * The choice is recorded as a dispatch table with three operations (invoke,
 * move and destroy) which is the only type information a
 * {@code UniqueFunction} carries.
 *
 * <h1>Thread safety</h1>
 * This class isn't thread-safe.  Whoever shares one between threads must
 * synchronize, as {@link ResultCell} does for its continuation.
 * @param <R> The return type of the closure.
 * @param <T> The argument type of the closure.
 */
public final class UniqueFunction<R, T> implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(UniqueFunction.class);

  /**
   * How many bytes of captures a closure can have and still be stored
   * inline.  Enough for 4 pointer-sized captures.
   */
  public static final int TINY_CAPACITY = 32;

  /** How many bytes we count for a reference field.  */
  private static final int REFERENCE_SIZE = 8;

  /**
   * Provides the blocks in which big closures are stored.
   */
  public interface Allocator {

    /** Allocates from the Java heap.  */
    public static final Allocator HEAP = new Allocator() {
      public Object[] allocate(final int slots) {
        return new Object[slots];
      }
      public void free(final Object[] block) {
        Arrays.fill(block, null);
      }
      public String toString() {
        return "heap";
      }
    };

    /**
     * Returns a new block.
     * @param slots How many references the block must be able to hold.
     */
    public Object[] allocate(int slots);

    /**
     * Takes back a block previously returned by {@link #allocate}.
     * Called exactly once per block.
     * @param block The block to free.
     */
    public void free(Object[] block);

  }

  /**
   * The storage of a {@code UniqueFunction}.
   * At most one of {@code tiny} and {@code big} is set at any time.
   */
  static final class Storage {
    /** The closure, when stored inline.  */
    Object tiny;
    /** The block holding the closure in its first slot, when stored big.  */
    Object[] big;
    /** Where {@code big} came from and must go back to.  */
    Allocator allocator;
  }

  /**
   * Dispatch table.  There is one instance per representation, selected
   * once when the closure is stored.
   */
  abstract static class Vtable {
    private final String name;

    Vtable(final String name) {
      this.name = name;
    }

    /** Invokes the closure held in {@code storage}.  */
    abstract Object invoke(Storage storage, Object arg) throws Exception;

    /** Moves the closure from {@code src} into {@code dst}, emptying {@code src}.  */
    abstract void move(Storage dst, Storage src);

    /** Releases the closure held in {@code storage}.  */
    abstract void destroy(Storage storage);

    public String toString() {
      return name;
    }
  }

  private static final Vtable EMPTY = new Vtable("empty") {
    Object invoke(final Storage storage, final Object arg) {
      throw new BadCallException("call to an empty UniqueFunction");
    }
    void move(final Storage dst, final Storage src) {
    }
    void destroy(final Storage storage) {
    }
  };

  @SuppressWarnings("unchecked")
  private static final Vtable TINY = new Vtable("tiny") {
    Object invoke(final Storage storage, final Object arg) throws Exception {
      return ((Callback<Object, Object>) storage.tiny).call(arg);
    }
    void move(final Storage dst, final Storage src) {
      dst.tiny = src.tiny;
      src.tiny = null;
    }
    void destroy(final Storage storage) {
      storage.tiny = null;
    }
  };

  @SuppressWarnings("unchecked")
  private static final Vtable BIG = new Vtable("big") {
    Object invoke(final Storage storage, final Object arg) throws Exception {
      return ((Callback<Object, Object>) storage.big[0]).call(arg);
    }
    void move(final Storage dst, final Storage src) {
      dst.big = src.big;
      dst.allocator = src.allocator;
      src.big = null;
      src.allocator = null;
    }
    void destroy(final Storage storage) {
      final Object[] block = storage.big;
      final Allocator allocator = storage.allocator;
      storage.big = null;
      storage.allocator = null;
      allocator.free(block);
    }
  };

  /** Representation of each concrete closure class.  */
  private static final ClassValue<Vtable> VTABLES = new ClassValue<Vtable>() {
    protected Vtable computeValue(final Class<?> type) {
      final int size = sizeOf(type);
      if (size <= TINY_CAPACITY) {
        return TINY;
      }
      LOG.debug("Closures of {} need {} bytes, they will be stored on the heap",
                type.getName(), size);
      return BIG;
    }
  };

  /**
   * Returns how many bytes the instance fields of a class take.
   * @param type The class of a closure.
   */
  static int sizeOf(final Class<?> type) {
    int size = 0;
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      for (final Field field : c.getDeclaredFields()) {
        if (!Modifier.isStatic(field.getModifiers())) {
          size += sizeOfField(field.getType());
        }
      }
    }
    return size;
  }

  private static int sizeOfField(final Class<?> type) {
    if (!type.isPrimitive()) {
      return REFERENCE_SIZE;
    } else if (type == long.class || type == double.class) {
      return 8;
    } else if (type == int.class || type == float.class) {
      return 4;
    } else if (type == short.class || type == char.class) {
      return 2;
    }
    return 1;  // byte or boolean.
  }

  private Vtable vtable;
  private final Storage storage = new Storage();

  /** Creates an empty {@code UniqueFunction}.  */
  public UniqueFunction() {
    vtable = EMPTY;
  }

  /**
   * Creates a {@code UniqueFunction} owning the given closure.
   * Big closures are allocated from the {@link Allocator#HEAP heap}.
   * @param closure The closure to own.  If {@code null}, the function is empty.
   */
  public UniqueFunction(final Callback<R, T> closure) {
    this(closure, Allocator.HEAP);
  }

  /**
   * Creates a {@code UniqueFunction} owning the given closure.
   * @param closure The closure to own.  If {@code null}, the function is empty.
   * @param allocator Where to allocate the closure if it isn't tiny.
   */
  public UniqueFunction(final Callback<R, T> closure, final Allocator allocator) {
    if (allocator == null) {
      throw new NullPointerException("null allocator");
    }
    if (closure == null) {
      vtable = EMPTY;
      return;
    }
    vtable = VTABLES.get(closure.getClass());
    if (vtable == TINY) {
      storage.tiny = closure;
    } else {
      final Object[] block = allocator.allocate(1);
      block[0] = closure;
      storage.big = block;
      storage.allocator = allocator;
    }
  }

  /** Returns a new empty {@code UniqueFunction}.  */
  public static <R, T> UniqueFunction<R, T> empty() {
    return new UniqueFunction<R, T>();
  }

  /**
   * Invokes the closure.
   * @param arg The argument to give to the closure.
   * @return What the closure returned.
   * @throws BadCallException if this function is empty.
   * @throws Exception whatever the closure throws.
   */
  @SuppressWarnings("unchecked")
  public R call(final T arg) throws Exception {
    return (R) vtable.invoke(storage, arg);
  }

  /**
   * Transfers the closure to a new {@code UniqueFunction}.
   * @return A function owning what {@code this} owned.  {@code this} is left
   * empty.
   */
  public UniqueFunction<R, T> move() {
    final UniqueFunction<R, T> dst = new UniqueFunction<R, T>();
    dst.vtable = vtable;
    vtable = EMPTY;
    dst.vtable.move(dst.storage, storage);
    return dst;
  }

  /**
   * Destroys the closure owned by {@code this} and takes the one of
   * {@code other}, which is left empty.
   * @param other The function to move from.
   * @return {@code this}.
   */
  public UniqueFunction<R, T> assign(final UniqueFunction<R, T> other) {
    if (this != other) {
      vtable.destroy(storage);
      vtable = other.vtable;
      other.vtable = EMPTY;
      vtable.move(storage, other.storage);
    }
    return this;
  }

  /**
   * Exchanges the closures of {@code this} and {@code other}.
   * @param other The function to swap with.
   */
  public void swap(final UniqueFunction<R, T> other) {
    if (this == other) {
      return;
    }
    final Storage tmp = new Storage();
    vtable.move(tmp, storage);
    other.vtable.move(storage, other.storage);
    vtable.move(other.storage, tmp);

    final Vtable vt = vtable;
    vtable = other.vtable;
    other.vtable = vt;
  }

  /** Destroys the closure, leaving this function empty.  */
  public void reset() {
    vtable.destroy(storage);
    vtable = EMPTY;
  }

  /**
   * Destroys the closure, leaving this function empty.
   * Closing an empty function does nothing.
   */
  public void close() {
    reset();
  }

  /** Returns {@code true} if this function holds no closure.  */
  public boolean isEmpty() {
    return vtable == EMPTY;
  }

  /** Returns {@code true} if the closure is held inline, without allocation.  */
  public boolean isInline() {
    return vtable == TINY;
  }

  /**
   * Two functions are equal if they're both empty, or if they're the same
   * instance.  In particular {@code f.equals(UniqueFunction.empty())} and
   * {@code UniqueFunction.empty().equals(f)} are both {@code true} iff
   * {@code f} is empty.
   */
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof UniqueFunction
      && isEmpty() && ((UniqueFunction<?, ?>) other).isEmpty();
  }

  public int hashCode() {
    return isEmpty() ? 0 : System.identityHashCode(this);
  }

  public String toString() {
    final Object closure = storage.big != null ? storage.big[0] : storage.tiny;
    if (closure == null) {
      return "UniqueFunction(" + vtable + ')';
    }
    return "UniqueFunction(" + vtable + ", " + closure + ')';
  }

}
