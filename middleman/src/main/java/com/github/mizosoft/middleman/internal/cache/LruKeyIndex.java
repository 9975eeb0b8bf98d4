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

import static com.github.mizosoft.middleman.internal.Validate.requirePositive;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.middleman.cache.KeyEntry;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link KeyIndex} bounded by the total size of its entries. Entries are kept in access order,
 * and are evicted in least-recently-used order whenever the total size exceeds the bound.
 */
public final class LruKeyIndex implements KeyIndex {
  private final long maxSize;

  @GuardedBy("this")
  private final Map<String, KeyEntry> entries = new LinkedHashMap<>(16, 0.75f, true);

  @GuardedBy("this")
  private long size;

  public LruKeyIndex(long maxSize) {
    this.maxSize = requirePositive(maxSize, "maxSize");
  }

  public long maxSize() {
    return maxSize;
  }

  @Override
  public synchronized boolean contains(String key) {
    return entries.containsKey(key);
  }

  @Override
  public synchronized List<KeyEntry> put(KeyEntry entry) {
    requireNonNull(entry);
    var replaced = entries.put(entry.key(), entry);
    if (replaced != null) {
      size -= replaced.size();
    }

    // size <= maxSize holds here, so comparing against the headroom can't overflow.
    long headroom = maxSize - size;
    if (entry.size() <= headroom) {
      size += entry.size();
      return List.of();
    }
    return evictExcessiveEntries(entry.size() - headroom);
  }

  @Override
  public synchronized void touch(String key) {
    entries.get(key); // Access order is updated on get.
  }

  @Override
  public synchronized boolean remove(String key) {
    var removed = entries.remove(key);
    if (removed != null) {
      size -= removed.size();
      return true;
    }
    return false;
  }

  @Override
  public synchronized List<String> keys() {
    return List.copyOf(entries.keySet());
  }

  @Override
  public synchronized long size() {
    return size;
  }

  /** Keeps evicting entries in LRU order till the given excess over maxSize is freed. */
  @GuardedBy("this")
  private List<KeyEntry> evictExcessiveEntries(long excess) {
    var evicted = new ArrayList<KeyEntry>();
    var iter = entries.values().iterator();
    while (excess > 0 && iter.hasNext()) {
      var eldest = iter.next();
      iter.remove();
      excess -= eldest.size();
      evicted.add(eldest);
    }
    size = maxSize + excess;
    return evicted;
  }
}
