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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A repository of values each identified by a string key. A store is the source of truth of a
 * {@link Cache}, which only keeps an index of the keys it has seen. A store may be durable or
 * remote, and is free to serialize values the way it sees fit, provided that what it later
 * resolves is interpretable by the cache (see {@link Cache#get(String)}).
 *
 * <p>All operations are asynchronous. A store is expected to serialize operations on the same key,
 * but needn't provide any atomicity across keys. {@code Store} implementations must be safe for
 * concurrent use.
 */
public interface Store {

  /**
   * Retrieves the value associated with the given key. An empty optional is resolved if there's no
   * such value. A missing key is never a failure.
   */
  CompletableFuture<Optional<Object>> get(String key);

  /** Associates the given value with the given key, and resolves the value. */
  CompletableFuture<Object> set(String key, Object value);

  /**
   * Removes the value associated with the given key. The returned future resolves {@code true}
   * whether or not there was such a value.
   */
  CompletableFuture<Boolean> del(String key);
}
