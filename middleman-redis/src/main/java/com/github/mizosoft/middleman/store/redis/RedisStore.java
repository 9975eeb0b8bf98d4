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

package com.github.mizosoft.middleman.store.redis;

import static com.github.mizosoft.middleman.internal.Validate.requireArgument;
import static com.github.mizosoft.middleman.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.middleman.cache.CacheEntry;
import com.github.mizosoft.middleman.cache.Store;
import com.github.mizosoft.middleman.internal.cache.CacheJson;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.async.RedisAsyncCommands;
import java.io.Closeable;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Store} that persists values in Redis as JSON text. A {@link CacheEntry} is written as a
 * JSON object that a {@code Cache} decodes back when reading, so entries survive restarts and can
 * be shared among processes. Values that are already strings are written as is.
 */
public final class RedisStore implements Store, Closeable {
  private static final Logger logger = System.getLogger(RedisStore.class.getName());

  static final String DEFAULT_KEY_PREFIX = "middleman:";

  private final StatefulRedisConnection<String, String> connection;
  private final @Nullable RedisClient ownedClient;
  private final String keyPrefix;
  private final @Nullable Duration ttl;
  private final AtomicBoolean closed = new AtomicBoolean();

  private RedisStore(Builder builder) {
    if (builder.connection != null) {
      this.connection = builder.connection;
      this.ownedClient = null;
    } else {
      var client = RedisClient.create(requireNonNull(builder.redisUri));
      this.connection = client.connect();
      this.ownedClient = client;
    }
    this.keyPrefix = builder.keyPrefix;
    this.ttl = builder.ttl;
  }

  /** Returns the prefix prepended to each key before it's sent to Redis. */
  public String keyPrefix() {
    return keyPrefix;
  }

  /** Returns the expiry Redis applies to each written value, if any. */
  public Optional<Duration> ttl() {
    return Optional.ofNullable(ttl);
  }

  @Override
  public CompletableFuture<Optional<Object>> get(String key) {
    requireNonNull(key);
    requireOpen();
    return commands()
        .get(toRedisKey(key))
        .toCompletableFuture()
        .thenApply(Optional::ofNullable);
  }

  @Override
  public CompletableFuture<Object> set(String key, Object value) {
    requireNonNull(key);
    requireNonNull(value);
    requireOpen();
    var text = encode(value);
    var redisKey = toRedisKey(key);
    var future =
        ttl != null
            ? commands().set(redisKey, text, SetArgs.Builder.px(ttl.toMillis()))
            : commands().set(redisKey, text);
    return future.toCompletableFuture().thenApply(__ -> value);
  }

  @Override
  public CompletableFuture<Boolean> del(String key) {
    requireNonNull(key);
    requireOpen();
    return commands().del(toRedisKey(key)).toCompletableFuture().thenApply(__ -> true);
  }

  /**
   * Closes the connection to Redis if it was opened by this store. A connection passed to {@link
   * Builder#connection(StatefulRedisConnection)} is left open.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (ownedClient != null) {
      try {
        connection.close();
      } finally {
        ownedClient.shutdown();
      }
      logger.log(Level.DEBUG, "Closed owned Redis connection");
    }
  }

  @Override
  public String toString() {
    return "RedisStore[keyPrefix=" + keyPrefix + ", ttl=" + ttl + "]";
  }

  private RedisAsyncCommands<String, String> commands() {
    return connection.async();
  }

  private void requireOpen() {
    requireState(!closed.get(), "closed");
  }

  String toRedisKey(String key) {
    return keyPrefix + key;
  }

  static String encode(Object value) {
    if (value instanceof CacheEntry) {
      return CacheJson.encodeEntry((CacheEntry) value);
    } else if (value instanceof CharSequence) {
      return value.toString();
    } else {
      return CacheJson.write(value);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private @MonotonicNonNull RedisURI redisUri;
    private @MonotonicNonNull StatefulRedisConnection<String, String> connection;
    private String keyPrefix = DEFAULT_KEY_PREFIX;
    private @MonotonicNonNull Duration ttl;

    Builder() {}

    /** Connects to the standalone Redis server at the given URI. The store owns the connection. */
    @CanIgnoreReturnValue
    public Builder standalone(RedisURI redisUri) {
      requireState(connection == null, "a connection is already set");
      this.redisUri = requireNonNull(redisUri);
      return this;
    }

    /** Connects to the standalone Redis server at the given URI string. */
    @CanIgnoreReturnValue
    public Builder standalone(String redisUri) {
      return standalone(RedisURI.create(redisUri));
    }

    /** Uses the given connection. The store doesn't close it. */
    @CanIgnoreReturnValue
    public Builder connection(StatefulRedisConnection<String, String> connection) {
      requireState(redisUri == null, "a standalone URI is already set");
      this.connection = requireNonNull(connection);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder keyPrefix(String keyPrefix) {
      this.keyPrefix = requireNonNull(keyPrefix);
      return this;
    }

    /** Has Redis expire each written value after the given duration. */
    @CanIgnoreReturnValue
    public Builder ttl(Duration ttl) {
      requireNonNull(ttl);
      requireArgument(ttl.toMillis() > 0, "expected a positive ttl: %s", ttl);
      this.ttl = ttl;
      return this;
    }

    public RedisStore build() {
      requireState(
          redisUri != null || connection != null, "either a URI or a connection must be set");
      return new RedisStore(this);
    }
  }
}
