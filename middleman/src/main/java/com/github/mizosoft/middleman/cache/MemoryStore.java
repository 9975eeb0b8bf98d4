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

package com.github.mizosoft.middleman.cache;

import static java.util.Objects.requireNonNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Store} implementation that keeps values in memory. Values are stored as is and operations
 * complete immediately. This is the default store of a {@link Cache}.
 */
public final class MemoryStore implements Store {
  private final Map<String, Object> values = new HashMap<>();

  public MemoryStore() {}

  @Override
  public CompletableFuture<Optional<Object>> get(String key) {
    requireNonNull(key);
    synchronized (values) {
      return CompletableFuture.completedFuture(Optional.ofNullable(values.get(key)));
    }
  }

  @Override
  public CompletableFuture<Object> set(String key, Object value) {
    requireNonNull(key);
    requireNonNull(value);
    synchronized (values) {
      values.put(key, value);
    }
    return CompletableFuture.completedFuture(value);
  }

  @Override
  public CompletableFuture<Boolean> del(String key) {
    requireNonNull(key);
    synchronized (values) {
      values.remove(key);
    }
    return CompletableFuture.completedFuture(true);
  }

  /** Returns the number of values in this store. */
  public int size() {
    synchronized (values) {
      return values.size();
    }
  }
}
