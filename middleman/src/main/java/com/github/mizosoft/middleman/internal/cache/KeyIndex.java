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

package com.github.mizosoft.middleman.internal.cache;

import com.github.mizosoft.middleman.cache.KeyEntry;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;

/** An in-memory index of the keys known to a cache. Implementations are thread-safe. */
public interface KeyIndex {

  boolean contains(String key);

  /**
   * Indexes the given entry, replacing any entry previously indexed under the same key. Returns
   * the entries evicted to make room for the new one, in the order they were evicted, possibly
   * including the new entry itself if it alone exceeds the index's bound.
   */
  @CanIgnoreReturnValue
  List<KeyEntry> put(KeyEntry entry);

  /** Marks the given key as recently used, if indexed. */
  void touch(String key);

  /** Removes the given key from the index, without notifying of any eviction. */
  @CanIgnoreReturnValue
  boolean remove(String key);

  /** Returns a snapshot of the indexed keys. */
  List<String> keys();

  /** Returns the sum of the sizes of indexed entries. */
  long size();
}
