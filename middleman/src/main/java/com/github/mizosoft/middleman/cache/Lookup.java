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

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The result of looking up a key in a {@link Cache}. A lookup distinguishes keys that were never
 * cached (or have been removed) from keys whose entry has outlived the cache's max age.
 */
public final class Lookup {
  private static final Lookup ABSENT = new Lookup(Status.ABSENT, null);
  private static final Lookup EXPIRED = new Lookup(Status.EXPIRED, null);

  /** The status of a lookup. */
  public enum Status {
    /** The store has no entry for the key. */
    ABSENT,

    /** The store has an entry for the key, but it's older than the cache's max age. */
    EXPIRED,

    /** The store has a fresh entry for the key. */
    HIT
  }

  private final Status status;
  private final @Nullable CacheEntry entry;

  private Lookup(Status status, @Nullable CacheEntry entry) {
    this.status = status;
    this.entry = entry;
  }

  public Status status() {
    return status;
  }

  /** Returns the entry if this is a {@link Status#HIT hit}. */
  public Optional<CacheEntry> entry() {
    return Optional.ofNullable(entry);
  }

  public boolean isHit() {
    return status == Status.HIT;
  }

  @Override
  public String toString() {
    return entry != null ? "Lookup[" + status + ", " + entry + "]" : "Lookup[" + status + "]";
  }

  public static Lookup absent() {
    return ABSENT;
  }

  public static Lookup expired() {
    return EXPIRED;
  }

  public static Lookup hit(CacheEntry entry) {
    return new Lookup(Status.HIT, requireNonNull(entry));
  }
}
