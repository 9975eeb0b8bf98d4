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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.mizosoft.middleman.testing.RecordingExchange;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow.Subscription;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CapturingBodySubscriberTest {
  @Test
  void streamsAndCaptures() throws IOException {
    var exchange = newExchangeWithHeadersSent();
    var capture = new ResponseCaptureBuffer();
    var subscriber = new CapturingBodySubscriber(exchange, capture);
    var subscription = new TestSubscription();
    subscriber.onSubscribe(subscription);
    assertEquals(1, subscription.requested.get());

    subscriber.onNext(List.of(UTF_8.encode("Pika"), UTF_8.encode("chu")));
    assertEquals(2, subscription.requested.get());
    subscriber.onNext(List.of(UTF_8.encode("!")));
    subscriber.onComplete();

    assertThat(subscriber.getBody().toCompletableFuture()).isCompleted();
    assertEquals("Pikachu!", exchange.bodyAsString());
    assertEquals("Pikachu!", capture.toString(UTF_8));
  }

  @Test
  void streamsWithoutCapturing() throws IOException {
    var exchange = newExchangeWithHeadersSent();
    var subscriber = new CapturingBodySubscriber(exchange, null);
    subscriber.onSubscribe(new TestSubscription());
    subscriber.onNext(List.of(UTF_8.encode("Pikachu")));
    subscriber.onComplete();
    assertEquals("Pikachu", exchange.bodyAsString());
  }

  @Test
  void upstreamFailure() throws IOException {
    var exchange = newExchangeWithHeadersSent();
    var subscriber = new CapturingBodySubscriber(exchange, new ResponseCaptureBuffer());
    subscriber.onSubscribe(new TestSubscription());
    subscriber.onError(new IOException("ouch"));
    assertThat(subscriber.getBody().toCompletableFuture())
        .failsWithin(5, SECONDS)
        .withThrowableOfType(ExecutionException.class)
        .withCauseInstanceOf(IOException.class);
  }

  @Test
  void clientWriteFailureCancelsUpstream() throws IOException {
    var exchange = newExchangeWithHeadersSent().failWrites();
    var subscriber = new CapturingBodySubscriber(exchange, new ResponseCaptureBuffer());
    var subscription = new TestSubscription();
    subscriber.onSubscribe(subscription);
    subscriber.onNext(List.of(UTF_8.encode("Pikachu")));
    assertTrue(subscription.cancelled.get());
    assertEquals(1, subscription.requested.get());
    assertThat(subscriber.getBody().toCompletableFuture())
        .failsWithin(5, SECONDS)
        .withThrowableOfType(ExecutionException.class)
        .withCauseInstanceOf(IOException.class);

    // Later signals are ignored.
    subscriber.onNext(List.of(ByteBuffer.allocate(1)));
    assertEquals(1, subscription.requested.get());
  }

  @Test
  void secondSubscriptionIsCancelled() {
    var subscriber = new CapturingBodySubscriber(new RecordingExchange("GET", "/"), null);
    subscriber.onSubscribe(new TestSubscription());
    var secondSubscription = new TestSubscription();
    subscriber.onSubscribe(secondSubscription);
    assertTrue(secondSubscription.cancelled.get());
    assertFalse(subscriber.getBody().toCompletableFuture().isDone());
  }

  private static RecordingExchange newExchangeWithHeadersSent() throws IOException {
    var exchange = new RecordingExchange("GET", "/");
    exchange.sendHeaders(200, Map.of(), -1);
    return exchange;
  }

  private static final class TestSubscription implements Subscription {
    final AtomicLong requested = new AtomicLong();
    final AtomicBoolean cancelled = new AtomicBoolean();

    TestSubscription() {}

    @Override
    public void request(long n) {
      requested.addAndGet(n);
    }

    @Override
    public void cancel() {
      cancelled.set(true);
    }
  }
}
