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

package com.github.mizosoft.middleman.internal.flow;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.concurrent.Flow.Subscription;

/** A one-use atomic reference to the subscription of a body being streamed through a proxy. */
public final class Upstream {
  private static final Subscription UNSET = new NoopSubscription();
  private static final Subscription DISPOSED = new NoopSubscription();

  private static final VarHandle SUBSCRIPTION;

  static {
    try {
      SUBSCRIPTION =
          MethodHandles.lookup().findVarHandle(Upstream.class, "subscription", Subscription.class);
    } catch (NoSuchFieldException | IllegalAccessException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  @SuppressWarnings("FieldMayBeFinal") // VarHandle indirection.
  private volatile Subscription subscription = UNSET;

  public Upstream() {}

  /** Returns {@code true} if this upstream was cancelled or cleared. */
  public boolean isDisposed() {
    return subscription == DISPOSED;
  }

  /** Sets the incoming subscription, or cancels it if one was already set. */
  public boolean setOrCancel(Subscription incoming) {
    if (!SUBSCRIPTION.compareAndSet(this, UNSET, incoming)) {
      incoming.cancel();
      return false;
    }
    return true;
  }

  /** Requests {@code n} items from upstream, if set and not disposed. */
  public void request(long n) {
    subscription.request(n);
  }

  /** Cancels the upstream if set. Later requests are ignored. */
  public void cancel() {
    ((Subscription) SUBSCRIPTION.getAndSet(this, DISPOSED)).cancel();
  }

  /** Loses the reference to upstream, for when it has terminated on its own. */
  public void clear() {
    subscription = DISPOSED;
  }

  private static final class NoopSubscription implements Subscription {
    NoopSubscription() {}

    @Override
    public void request(long n) {}

    @Override
    public void cancel() {}
  }
}
