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

import com.github.mizosoft.middleman.cache.Sized;
import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Estimates the size in bytes of arbitrary values. Characters take 2 bytes, numbers 8 and booleans
 * 4. Containers contribute the sizes of what they contain, including map keys. Values of other
 * types aren't accounted for.
 */
public final class ObjectSizes {
  static final long NUMBER_SIZE = 8;
  static final long BOOLEAN_SIZE = 4;
  static final long CHAR_SIZE = 2;

  private ObjectSizes() {}

  public static long estimate(@Nullable Object value) {
    if (value == null) {
      return 0;
    } else if (value instanceof Sized) {
      return ((Sized) value).size();
    } else if (value instanceof CharSequence) {
      return CHAR_SIZE * ((CharSequence) value).length();
    } else if (value instanceof Number) {
      return NUMBER_SIZE;
    } else if (value instanceof Boolean) {
      return BOOLEAN_SIZE;
    } else if (value instanceof Character) {
      return CHAR_SIZE;
    } else if (value instanceof byte[]) {
      return ((byte[]) value).length;
    } else if (value instanceof ByteBuffer) {
      return ((ByteBuffer) value).remaining();
    } else if (value instanceof Map<?, ?>) {
      long size = 0;
      for (var entry : ((Map<?, ?>) value).entrySet()) {
        size += estimate(entry.getKey()) + estimate(entry.getValue());
      }
      return size;
    } else if (value instanceof Collection<?>) {
      long size = 0;
      for (var element : (Collection<?>) value) {
        size += estimate(element);
      }
      return size;
    } else if (value instanceof Object[]) {
      long size = 0;
      for (var element : (Object[]) value) {
        size += estimate(element);
      }
      return size;
    }
    return 0;
  }
}
