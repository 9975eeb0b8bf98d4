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

package com.github.mizosoft.middleman;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Responds to a request that couldn't be served, either because the cache or the backend failed.
 * The responder must send headers (if not already sent) and end the exchange.
 */
@FunctionalInterface
public interface ErrorResponder {

  void respond(ServerExchange exchange, Throwable error) throws IOException;

  /** Returns a responder that sends a {@code 500} with a plain text message. */
  static ErrorResponder internalServerError() {
    return (exchange, error) -> {
      if (!exchange.headersSent()) {
        var body = "Internal Server Error".getBytes(StandardCharsets.UTF_8);
        exchange.sendHeaders(500, Map.of("Content-Type", List.of("text/plain")), body.length);
        exchange.write(ByteBuffer.wrap(body));
      }
      exchange.end();
    };
  }
}
