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

import com.github.mizosoft.middleman.internal.ObjectSizes;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A value persisted in a {@link Store} by a {@link Cache}, along with the key it was set under and
 * the time it was created. The value is opaque to the cache.
 */
public final class CacheEntry {
  private final String key;
  private final @Nullable Object value;
  private final Instant created;

  public CacheEntry(String key, @Nullable Object value, Instant created) {
    this.key = requireNonNull(key);
    this.value = value;
    this.created = requireNonNull(created);
  }

  public String key() {
    return key;
  }

  public @Nullable Object value() {
    return value;
  }

  public Instant created() {
    return created;
  }

  /** Returns the time elapsed since this entry was created, as perceived at {@code now}. */
  public Duration age(Instant now) {
    return Duration.between(created, now);
  }

  /**
   * Returns the best estimate of the value's size in bytes. A value implementing {@link Sized}
   * reports its own size, otherwise the size is estimated from the value's contents.
   */
  public long size() {
    return Math.max(0, ObjectSizes.estimate(value));
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof CacheEntry)) {
      return false;
    }
    var other = (CacheEntry) obj;
    return key.equals(other.key)
        && Objects.equals(value, other.value)
        && created.equals(other.created);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value, created);
  }

  @Override
  public String toString() {
    return "CacheEntry[key=" + key + ", value=" + value + ", created=" + created + "]";
  }
}
