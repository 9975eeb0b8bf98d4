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
import java.io.InputStream;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

/**
 * A request received by a server along with the means to respond to it. This is the seam between
 * {@link Middleman} and whatever HTTP server it's mounted on. Headers must be sent before the body
 * is written, and the exchange must be ended once the body is fully written.
 */
public interface ServerExchange {

  /** Returns the request method, as received. */
  String method();

  /** Returns the request URI, which typically carries only a path and a query. */
  URI requestUri();

  /** Returns the request headers. */
  Map<String, List<String>> requestHeaders();

  /** Returns a stream of the request body. */
  InputStream requestBody();

  /**
   * Sends the response status line and headers.
   *
   * @param contentLength the exact length of the body that is to follow, or {@code -1} if unknown
   */
  void sendHeaders(int statusCode, Map<String, List<String>> headers, long contentLength)
      throws IOException;

  /** Returns whether {@link #sendHeaders} has been called. */
  boolean headersSent();

  /** Writes the remaining content of the given chunk as part of the response body. */
  void write(ByteBuffer chunk) throws IOException;

  /** Completes the response. */
  void end() throws IOException;
}
