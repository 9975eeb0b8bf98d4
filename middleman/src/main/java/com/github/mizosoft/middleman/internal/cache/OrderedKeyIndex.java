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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.middleman.cache.KeyEntry;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An unbounded {@link KeyIndex} that only remembers which keys exist, in insertion order. Sizes
 * aren't tracked and nothing is ever evicted.
 */
public final class OrderedKeyIndex implements KeyIndex {
  @GuardedBy("this")
  private final Set<String> keys = new LinkedHashSet<>();

  public OrderedKeyIndex() {}

  @Override
  public synchronized boolean contains(String key) {
    return keys.contains(key);
  }

  @Override
  public synchronized List<KeyEntry> put(KeyEntry entry) {
    keys.add(requireNonNull(entry).key());
    return List.of();
  }

  @Override
  public void touch(String key) {}

  @Override
  public synchronized boolean remove(String key) {
    return keys.remove(key);
  }

  @Override
  public synchronized List<String> keys() {
    return List.copyOf(keys);
  }

  @Override
  public long size() {
    return 0;
  }
}
