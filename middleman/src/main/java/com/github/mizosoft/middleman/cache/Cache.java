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
import static com.github.mizosoft.middleman.internal.Validate.requirePositive;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.middleman.internal.ByteSizes;
import com.github.mizosoft.middleman.internal.Utils;
import com.github.mizosoft.middleman.internal.cache.CacheJson;
import com.github.mizosoft.middleman.internal.cache.KeyIndex;
import com.github.mizosoft.middleman.internal.cache.LruKeyIndex;
import com.github.mizosoft.middleman.internal.cache.OrderedKeyIndex;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A cache of values bounded by age and optionally by size, sitting on top of a {@link Store}. The
 * store is the source of truth. The cache only keeps an in-memory index of the keys it has seen
 * through it, which it uses to evict least-recently-used entries when the total size of indexed
 * entries exceeds the cache's max size.
 *
 * <p>Entries older than the cache's max age are expired lazily, when looked up. There's no
 * background sweep.
 *
 * <p>Both evictions and explicit deletions remove values from the store. A key that is being
 * deleted is <em>protected</em> until the store deletion settles, so a concurrent eviction or
 * deletion of the same key never causes the store to see a second deletion.
 */
public final class Cache {
  private static final Logger logger = System.getLogger(Cache.class.getName());

  private static final long UNBOUNDED = Long.MAX_VALUE;

  private final Store store;
  private final KeyIndex index;
  private final boolean sizeEviction;
  private final long maxAgeMillis;
  private final long maxSize;
  private final Listener listener;
  private final Clock clock;
  private final Object lock = new Object();

  /** Store deletions in flight, keyed by the keys they protect. */
  @GuardedBy("lock")
  private final Map<String, CompletableFuture<Void>> pendingDeletes = new HashMap<>();

  private Cache(Builder builder) {
    this.store = builder.store != null ? builder.store : new MemoryStore();
    this.sizeEviction = builder.sizeEviction;
    this.maxAgeMillis = builder.maxAgeMillis;
    this.maxSize = builder.maxSize;
    this.index = sizeEviction ? new LruKeyIndex(maxSize) : new OrderedKeyIndex();
    this.listener = builder.listener != null ? builder.listener.guarded() : Listener.disabled();
    this.clock = builder.clock != null ? builder.clock : Utils.systemMillisUtc();
  }

  public Store store() {
    return store;
  }

  /** Returns the max age of entries, or an empty optional if entries never expire. */
  public Optional<Duration> maxAge() {
    return maxAgeMillis != UNBOUNDED
        ? Optional.of(Duration.ofMillis(maxAgeMillis))
        : Optional.empty();
  }

  /** Returns the max total size of indexed entries, or an empty optional if unbounded. */
  public Optional<Long> maxSize() {
    return sizeEviction && maxSize != UNBOUNDED ? Optional.of(maxSize) : Optional.empty();
  }

  /** Returns whether entries are evicted in LRU order when the max size is exceeded. */
  public boolean sizeEviction() {
    return sizeEviction;
  }

  /** Returns the total size of indexed entries, always {@code 0} if size eviction is disabled. */
  public long size() {
    return index.size();
  }

  /** Returns a snapshot of the keys currently indexed by this cache. */
  public List<String> keys() {
    return index.keys();
  }

  /**
   * Looks up the entry associated with the given key. The returned future completes with:
   *
   * <ul>
   *   <li>{@link Lookup#absent()} if the store has no value for the key.
   *   <li>{@link Lookup#expired()} if the store's entry is older than the max age. The key is
   *       dropped from the index but the store isn't touched.
   *   <li>{@link Lookup#hit(CacheEntry)} otherwise. The key is indexed if it wasn't already,
   *       which happens when the store is populated out of band.
   * </ul>
   *
   * <p>If the store resolves a value that can't be interpreted as a {@link CacheEntry}, the key is
   * dropped from the index, the listener is notified, and the returned future completes
   * exceptionally with a {@link StoreProtocolException}. Store failures are propagated as is.
   */
  public CompletableFuture<Lookup> get(String key) {
    requireNonNull(key);
    return Utils.invokeAsync(() -> store.get(key))
        .thenApply(stored -> lookup(key, stored != null ? stored.orElse(null) : null));
  }

  private Lookup lookup(String key, @Nullable Object stored) {
    if (stored == null) {
      index.remove(key);
      return Lookup.absent();
    }

    CacheEntry entry;
    try {
      entry = CacheJson.decodeEntry(stored);
    } catch (StoreProtocolException e) {
      index.remove(key);
      listener.onError(e);
      throw e;
    }

    var now = clock.instant();
    if (isExpired(entry, now)) {
      index.remove(key);
      return Lookup.expired();
    }

    if (index.contains(key)) {
      index.touch(key);
    } else {
      evict(index.put(new KeyEntry(key, CacheJson.sizeOf(entry), now)));
    }
    return Lookup.hit(entry);
  }

  private boolean isExpired(CacheEntry entry, Instant now) {
    var age = entry.age(now);
    return !age.isNegative() && age.compareTo(Duration.ofMillis(maxAgeMillis)) >= 0;
  }

  /**
   * Associates the given value with the given key, persisting a fresh {@link CacheEntry} in the
   * store. The key is indexed only after the store accepts the entry, which may trigger eviction
   * of least-recently-used entries. Store failures are propagated as is.
   */
  public CompletableFuture<CacheEntry> set(String key, Object value) {
    requireNonNull(key);
    requireNonNull(value);
    var entry = new CacheEntry(key, value, clock.instant());

    // A re-set shouldn't count the key's previous size.
    index.remove(key);
    return Utils.invokeAsync(() -> store.set(key, entry))
        .thenApply(
            __ -> {
              evict(index.put(new KeyEntry(key, entry.size(), entry.created())));
              return entry;
            });
  }

  /**
   * Removes the value associated with the given key from the store, then from the index. If the
   * store deletion fails, the key is kept in the index and the failure is propagated. If the key
   * is already being deleted, the returned future completes when that deletion completes.
   */
  public CompletableFuture<Void> del(String key) {
    requireNonNull(key);
    CompletableFuture<Void> deletion;
    synchronized (lock) {
      var pending = pendingDeletes.get(key);
      if (pending != null) {
        return pending.copy();
      }
      deletion = protect(key);
    }
    return delete(key, deletion, false);
  }

  /**
   * Removes all indexed keys. All keys are protected before any is deleted, and deletions run
   * concurrently. The returned future completes exceptionally if any deletion fails, in which case
   * keys whose deletion succeeded remain removed while keys whose deletion failed remain indexed.
   */
  public CompletableFuture<Void> clear() {
    var keys = index.keys();
    var deletions = new ArrayList<CompletableFuture<Void>>(keys.size());
    var owned = new HashMap<String, CompletableFuture<Void>>();
    synchronized (lock) {
      for (var key : keys) {
        var pending = pendingDeletes.get(key);
        if (pending != null) {
          deletions.add(pending.copy());
        } else {
          owned.put(key, protect(key));
        }
      }
    }
    owned.forEach((key, deletion) -> deletions.add(delete(key, deletion, false)));
    return CompletableFuture.allOf(deletions.toArray(CompletableFuture<?>[]::new));
  }

  /**
   * Returns whether the given key is protected from eviction. All keys are protected when size
   * eviction is disabled.
   */
  boolean isProtected(String key) {
    if (!sizeEviction) {
      return true;
    }
    synchronized (lock) {
      return pendingDeletes.containsKey(key);
    }
  }

  @GuardedBy("lock")
  private CompletableFuture<Void> protect(String key) {
    var deletion = new CompletableFuture<Void>();
    pendingDeletes.put(key, deletion);
    return deletion;
  }

  private void unprotect(String key, CompletableFuture<Void> deletion) {
    synchronized (lock) {
      pendingDeletes.remove(key, deletion);
    }
  }

  private void evict(List<KeyEntry> victims) {
    for (var victim : victims) {
      var key = victim.key();
      CompletableFuture<Void> deletion;
      synchronized (lock) {
        if (isProtected(key)) {
          continue; // Already being deleted.
        }
        deletion = protect(key);
      }
      delete(key, deletion, true);
    }
  }

  private CompletableFuture<Void> delete(
      String key, CompletableFuture<Void> deletion, boolean isEviction) {
    Utils.invokeAsync(() -> store.del(key))
        .whenComplete(
            (__, ex) -> {
              // Evicted keys are already out of the index.
              if (ex == null && !isEviction) {
                index.remove(key);
              }
              unprotect(key, deletion);
              if (ex == null) {
                deletion.complete(null);
                if (isEviction) {
                  listener.onDelete(key);
                }
              } else {
                var cause = Utils.getDeepCompletionCause(ex);
                deletion.completeExceptionally(cause);
                if (isEviction) {
                  logger.log(Level.WARNING, "Couldn't evict <" + key + "> from store", cause);
                  listener.onError(cause);
                }
              }
            });
    return deletion.copy();
  }

  @Override
  public String toString() {
    return "Cache[store="
        + store
        + ", maxAge="
        + maxAge().map(Duration::toString).orElse("unbounded")
        + ", maxSize="
        + maxSize().map(String::valueOf).orElse("unbounded")
        + ", sizeEviction="
        + sizeEviction
        + "]";
  }

  /** Returns a new {@code Cache.Builder}. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns a new {@code Cache} on a {@link MemoryStore} with no age or size bounds. */
  public static Cache create() {
    return newBuilder().build();
  }

  /** A listener to events that have no caller to be reported to. */
  public interface Listener {

    /** Called when an evicted key has been successfully deleted from the store. */
    default void onDelete(String key) {}

    /**
     * Called when the store fails to delete an evicted key, or when the store resolves a value
     * that isn't interpretable as a {@link CacheEntry}.
     */
    default void onError(Throwable exception) {}

    /** Returns a listener that logs and drops exceptions thrown by this listener. */
    default Listener guarded() {
      return new Listener() {
        @Override
        public void onDelete(String key) {
          try {
            Listener.this.onDelete(key);
          } catch (Throwable e) {
            logger.log(Level.WARNING, "Exception thrown by Listener::onDelete", e);
          }
        }

        @Override
        public void onError(Throwable exception) {
          try {
            Listener.this.onError(exception);
          } catch (Throwable e) {
            logger.log(Level.WARNING, "Exception thrown by Listener::onError", e);
          }
        }
      };
    }

    static Listener disabled() {
      return DisabledListener.INSTANCE;
    }
  }

  private enum DisabledListener implements Listener {
    INSTANCE
  }

  /** A builder of {@code Caches}. */
  public static final class Builder {
    long maxAgeMillis = UNBOUNDED;
    long maxSize = UNBOUNDED;
    boolean sizeEviction = true;
    @MonotonicNonNull Store store;
    @MonotonicNonNull Listener listener;
    @MonotonicNonNull Clock clock;

    Builder() {}

    /** Sets the age after which entries are considered expired. Entries never expire by default. */
    @CanIgnoreReturnValue
    public Builder maxAge(Duration maxAge) {
      requireNonNull(maxAge);
      requireArgument(
          !maxAge.isNegative() && !maxAge.isZero(), "non-positive maxAge: %s", maxAge);
      this.maxAgeMillis = maxAge.toMillis();
      return this;
    }

    /** Sets the max total size in bytes of entries. Entries are unbounded in size by default. */
    @CanIgnoreReturnValue
    public Builder maxSize(long maxSize) {
      this.maxSize = requirePositive(maxSize, "maxSize");
      return this;
    }

    /**
     * Sets the max total size of entries from a human-readable size like {@code "10mb"}, {@code
     * "1.5kb"} or {@code "512"}. Units are case-insensitive multiples of 1024 bytes.
     *
     * @throws IllegalArgumentException if the size can't be parsed
     */
    @CanIgnoreReturnValue
    public Builder maxSize(String maxSize) {
      return maxSize(ByteSizes.parse(maxSize));
    }

    /**
     * Sets whether least-recently-used entries are evicted when the max size is exceeded, which
     * is the default. When disabled, the cache only remembers which keys it has seen.
     */
    @CanIgnoreReturnValue
    public Builder sizeEviction(boolean sizeEviction) {
      this.sizeEviction = sizeEviction;
      return this;
    }

    /** Sets the store backing the cache. A {@link MemoryStore} is used by default. */
    @CanIgnoreReturnValue
    public Builder store(Store store) {
      this.store = requireNonNull(store);
      return this;
    }

    /** Sets the cache's {@code Listener}. */
    @CanIgnoreReturnValue
    public Builder listener(Listener listener) {
      this.listener = requireNonNull(listener);
      return this;
    }

    @CanIgnoreReturnValue
    Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    /** Creates a new {@code Cache}. */
    public Cache build() {
      return new Cache(this);
    }
  }
}
