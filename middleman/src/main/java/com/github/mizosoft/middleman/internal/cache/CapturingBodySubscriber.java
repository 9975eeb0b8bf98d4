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

import com.github.mizosoft.middleman.ServerExchange;
import com.github.mizosoft.middleman.internal.flow.Upstream;
import java.io.IOException;
import java.net.http.HttpResponse.BodySubscriber;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow.Subscription;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code BodySubscriber} that streams a backend's response body to the client of a {@link
 * ServerExchange} and, unless the response is bypassed, captures it into a {@link
 * ResponseCaptureBuffer} along the way. Chunks are requested one batch at a time, so the backend is
 * read no faster than the client is written to. Failing to write to the client cancels the upstream
 * and fails the body.
 */
public final class CapturingBodySubscriber implements BodySubscriber<Void> {
  private final ServerExchange exchange;
  private final @Nullable ResponseCaptureBuffer capture;
  private final Upstream upstream = new Upstream();
  private final CompletableFuture<Void> body = new CompletableFuture<>();

  /**
   * Creates a subscriber writing to the given exchange and capturing into the given buffer, which
   * is {@code null} if the body is not to be captured.
   */
  public CapturingBodySubscriber(
      ServerExchange exchange, @Nullable ResponseCaptureBuffer capture) {
    this.exchange = requireNonNull(exchange);
    this.capture = capture;
  }

  @Override
  public CompletionStage<Void> getBody() {
    return body;
  }

  @Override
  public void onSubscribe(Subscription subscription) {
    requireNonNull(subscription);
    if (upstream.setOrCancel(subscription)) {
      upstream.request(1);
    }
  }

  @Override
  public void onNext(List<ByteBuffer> buffers) {
    requireNonNull(buffers);
    if (upstream.isDisposed()) {
      return;
    }

    try {
      for (var buffer : buffers) {
        if (capture != null) {
          capture.write(buffer); // Captures a duplicate, so the write below doesn't consume it.
        }
        exchange.write(buffer);
      }
    } catch (IOException | RuntimeException e) {
      upstream.cancel();
      body.completeExceptionally(e);
      return;
    }
    upstream.request(1);
  }

  @Override
  public void onError(Throwable throwable) {
    requireNonNull(throwable);
    upstream.clear();
    body.completeExceptionally(throwable);
  }

  @Override
  public void onComplete() {
    upstream.clear();
    body.complete(null);
  }
}
