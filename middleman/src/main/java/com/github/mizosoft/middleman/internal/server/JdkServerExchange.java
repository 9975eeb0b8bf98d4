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

package com.github.mizosoft.middleman.internal.server;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.middleman.ServerExchange;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;

/** A {@link ServerExchange} over the JDK's {@code com.sun.net.httpserver}. */
public final class JdkServerExchange implements ServerExchange {
  /** Headers the JDK server computes on its own from the given response length. */
  private static final Set<String> SERVER_MANAGED_HEADERS =
      Set.of("content-length", "transfer-encoding", "connection");

  private final HttpExchange exchange;
  private volatile boolean headersSent;
  private @MonotonicNonNull WritableByteChannel body;

  public JdkServerExchange(HttpExchange exchange) {
    this.exchange = requireNonNull(exchange);
  }

  @Override
  public String method() {
    return exchange.getRequestMethod();
  }

  @Override
  public URI requestUri() {
    return exchange.getRequestURI();
  }

  @Override
  public Map<String, List<String>> requestHeaders() {
    var headers = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
    exchange.getRequestHeaders().forEach((name, values) -> headers.put(name, List.copyOf(values)));
    return headers;
  }

  @Override
  public InputStream requestBody() {
    return exchange.getRequestBody();
  }

  @Override
  public synchronized void sendHeaders(
      int statusCode, Map<String, List<String>> headers, long contentLength) throws IOException {
    var responseHeaders = exchange.getResponseHeaders();
    headers.forEach(
        (name, values) -> {
          if (!SERVER_MANAGED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
            responseHeaders.put(name, List.copyOf(values));
          }
        });

    // The JDK server takes 0 for a chunked body and -1 for no body.
    long responseLength;
    if (contentLength < 0) {
      responseLength = 0;
    } else if (contentLength == 0) {
      responseLength = -1;
    } else {
      responseLength = contentLength;
    }
    headersSent = true;
    exchange.sendResponseHeaders(statusCode, responseLength);
    body = Channels.newChannel(exchange.getResponseBody());
  }

  @Override
  public boolean headersSent() {
    return headersSent;
  }

  @Override
  public synchronized void write(ByteBuffer chunk) throws IOException {
    var body = this.body;
    if (body == null) {
      throw new IOException("writing before headers are sent");
    }
    while (chunk.hasRemaining()) {
      body.write(chunk);
    }
  }

  @Override
  public void end() {
    exchange.close();
  }

  @Override
  public String toString() {
    return "JdkServerExchange[" + method() + " " + requestUri() + "]";
  }
}
