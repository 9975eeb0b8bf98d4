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

package com.github.mizosoft.middleman.internal;

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/** Miscellaneous utilities. */
public class Utils {
  private static final Clock SYSTEM_MILLIS_UTC = Clock.tickMillis(ZoneOffset.UTC);

  private Utils() {}

  public static Clock systemMillisUtc() {
    return SYSTEM_MILLIS_UTC;
  }

  /**
   * Invokes the given asynchronous operation, turning both a synchronously thrown exception and a
   * {@code null} future into an exceptionally completed future.
   */
  public static <T> CompletableFuture<T> invokeAsync(Supplier<CompletableFuture<T>> operation) {
    CompletableFuture<T> future;
    try {
      future = operation.get();
    } catch (Throwable t) {
      return CompletableFuture.failedFuture(t);
    }
    return future != null
        ? future
        : CompletableFuture.failedFuture(
            new NullPointerException("asynchronous operation returned a null future"));
  }

  public static Throwable getDeepCompletionCause(Throwable t) {
    var cause = t;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      var deeperCause = cause.getCause();
      if (deeperCause == null) {
        break;
      }
      cause = deeperCause;
    }
    return cause;
  }

  /**
   * Appends the given raw path (and query, if any) to the target URI, collapsing the slashes at
   * the junction.
   */
  public static URI joinPath(URI target, String rawPathAndQuery) {
    requireNonNull(target);
    requireNonNull(rawPathAndQuery);
    var base = target.toString();
    int end = base.length();
    while (end > 0 && base.charAt(end - 1) == '/') {
      end--;
    }
    int start = 0;
    while (start < rawPathAndQuery.length() && rawPathAndQuery.charAt(start) == '/') {
      start++;
    }
    return URI.create(base.substring(0, end) + "/" + rawPathAndQuery.substring(start));
  }
}
