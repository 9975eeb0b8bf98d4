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

import static com.github.mizosoft.middleman.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A write-only accumulator of the body of a response being captured for caching. Written chunks are
 * retained by reference and are only copied when the buffer is {@link #toBytes() finalized}. Once
 * {@link #close() closed}, the buffer releases its chunks and can't be written to.
 */
public final class ResponseCaptureBuffer implements AutoCloseable {
  private static final byte[] EMPTY = new byte[0];

  @GuardedBy("this")
  private @Nullable List<ByteBuffer> chunks = new ArrayList<>();

  @GuardedBy("this")
  private long size;

  public ResponseCaptureBuffer() {}

  /**
   * Appends the remaining content of the given chunk. The chunk's position is not changed, and its
   * content must not be modified afterwards.
   *
   * @throws IllegalStateException if the buffer is closed
   */
  public synchronized void write(ByteBuffer chunk) {
    requireNonNull(chunk);
    var chunks = this.chunks;
    requireState(chunks != null, "writing to a closed buffer");
    if (chunk.hasRemaining()) {
      chunks.add(chunk.duplicate());
      size += chunk.remaining();
    }
  }

  /**
   * Appends the given bytes, which must not be modified afterwards.
   *
   * @throws IllegalStateException if the buffer is closed
   */
  public void write(byte[] chunk) {
    write(ByteBuffer.wrap(chunk));
  }

  /** Returns the number of bytes written so far. */
  public synchronized long size() {
    return size;
  }

  public synchronized boolean isClosed() {
    return chunks == null;
  }

  /**
   * Returns the concatenation of all written chunks, or an empty array if nothing was written.
   *
   * @throws IllegalStateException if the buffer is closed
   */
  public synchronized byte[] toBytes() {
    var chunks = this.chunks;
    requireState(chunks != null, "reading a closed buffer");
    if (chunks.isEmpty()) {
      return EMPTY;
    }
    requireState(size <= Integer.MAX_VALUE - 8, "buffer is too large: %d", size);
    var bytes = new byte[(int) size];
    int offset = 0;
    for (var chunk : chunks) {
      int length = chunk.remaining();
      chunk.duplicate().get(bytes, offset, length);
      offset += length;
    }
    return bytes;
  }

  /** Decodes the concatenation of all written chunks with the given charset. */
  public String toString(Charset charset) {
    return new String(toBytes(), charset);
  }

  /** Releases written chunks. Closing an already closed buffer has no effect. */
  @Override
  public synchronized void close() {
    chunks = null;
  }

  @Override
  public synchronized String toString() {
    return "ResponseCaptureBuffer[size=" + size + (chunks == null ? ", closed]" : "]");
  }
}
