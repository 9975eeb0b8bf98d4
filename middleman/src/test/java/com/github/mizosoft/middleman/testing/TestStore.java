/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.middleman.testing;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.middleman.cache.Store;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Store} that records the operations it receives and can be told to fail them or to hold
 * deletions pending till released.
 */
public class TestStore implements Store {
  private final Map<String, Object> values = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> deleteCounts = new ConcurrentHashMap<>();
  private final Set<String> failingDeletes = ConcurrentHashMap.newKeySet();
  private final List<PendingDelete> pendingDeletes = new ArrayList<>();
  private volatile boolean holdDeletes;
  private volatile @Nullable Throwable getFailure;
  private volatile @Nullable Throwable setFailure;

  public TestStore() {}

  /** Puts the given value as is, bypassing any cache. */
  public void seed(String key, Object value) {
    values.put(key, value);
  }

  public @Nullable Object value(String key) {
    return values.get(key);
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  /** Returns the number of times {@link #del(String)} was called with the given key. */
  public int deleteCount(String key) {
    var count = deleteCounts.get(key);
    return count != null ? count.get() : 0;
  }

  public void failGets(@Nullable Throwable failure) {
    this.getFailure = failure;
  }

  public void failSets(@Nullable Throwable failure) {
    this.setFailure = failure;
  }

  /** Makes deletions of the given keys fail with an {@code IOException}. */
  public void failDeletesOf(String... keys) {
    failingDeletes.addAll(List.of(keys));
  }

  /** Makes deletions stay pending till {@link #releaseDeletes()} is called. */
  public void holdDeletes() {
    holdDeletes = true;
  }

  /** Completes all pending deletions, and stops holding later ones. */
  public void releaseDeletes() {
    List<PendingDelete> released;
    synchronized (pendingDeletes) {
      holdDeletes = false;
      released = List.copyOf(pendingDeletes);
      pendingDeletes.clear();
    }
    released.forEach(pending -> completeDelete(pending.key, pending.future));
  }

  public int pendingDeleteCount() {
    synchronized (pendingDeletes) {
      return pendingDeletes.size();
    }
  }

  @Override
  public CompletableFuture<Optional<Object>> get(String key) {
    requireNonNull(key);
    var failure = getFailure;
    if (failure != null) {
      return CompletableFuture.failedFuture(failure);
    }
    return CompletableFuture.completedFuture(Optional.ofNullable(values.get(key)));
  }

  @Override
  public CompletableFuture<Object> set(String key, Object value) {
    requireNonNull(key);
    requireNonNull(value);
    var failure = setFailure;
    if (failure != null) {
      return CompletableFuture.failedFuture(failure);
    }
    values.put(key, value);
    return CompletableFuture.completedFuture(value);
  }

  @Override
  public CompletableFuture<Boolean> del(String key) {
    requireNonNull(key);
    deleteCounts.computeIfAbsent(key, __ -> new AtomicInteger()).incrementAndGet();
    var future = new CompletableFuture<Boolean>();
    synchronized (pendingDeletes) {
      if (holdDeletes) {
        pendingDeletes.add(new PendingDelete(key, future));
        return future;
      }
    }
    completeDelete(key, future);
    return future;
  }

  private void completeDelete(String key, CompletableFuture<Boolean> future) {
    if (failingDeletes.contains(key)) {
      future.completeExceptionally(new IOException("couldn't delete " + key));
    } else {
      values.remove(key);
      future.complete(true);
    }
  }

  private static final class PendingDelete {
    final String key;
    final CompletableFuture<Boolean> future;

    PendingDelete(String key, CompletableFuture<Boolean> future) {
      this.key = key;
      this.future = future;
    }
  }
}
