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

import static com.github.mizosoft.middleman.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.time.Instant;

/**
 * A record of a key known to a {@link Cache}, along with the size of its value and the time it was
 * indexed. Key entries only live in the cache's in-memory index and are never persisted.
 */
public final class KeyEntry {
  private final String key;
  private final long size;
  private final Instant created;

  public KeyEntry(String key, long size, Instant created) {
    requireArgument(size >= 0, "negative size: %d", size);
    this.key = requireNonNull(key);
    this.size = size;
    this.created = requireNonNull(created);
  }

  public String key() {
    return key;
  }

  /** Returns the size in bytes of the value this entry accounts for. */
  public long size() {
    return size;
  }

  public Instant created() {
    return created;
  }

  @Override
  public String toString() {
    return "KeyEntry[key=" + key + ", size=" + size + ", created=" + created + "]";
  }
}
