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

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.github.mizosoft.middleman.cache.Sized;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ObjectSizesTest {
  @Test
  void scalars() {
    assertEquals(0, ObjectSizes.estimate(null));
    assertEquals(14, ObjectSizes.estimate("pikachu"));
    assertEquals(ObjectSizes.NUMBER_SIZE, ObjectSizes.estimate(1));
    assertEquals(ObjectSizes.NUMBER_SIZE, ObjectSizes.estimate(1.5));
    assertEquals(ObjectSizes.BOOLEAN_SIZE, ObjectSizes.estimate(true));
    assertEquals(ObjectSizes.CHAR_SIZE, ObjectSizes.estimate('p'));
  }

  @Test
  void bytes() {
    assertEquals(3, ObjectSizes.estimate(new byte[3]));
    assertEquals(2, ObjectSizes.estimate(ByteBuffer.allocate(4).position(2)));
  }

  @Test
  void containers() {
    assertEquals(2 * 8 + 4, ObjectSizes.estimate(List.of(1, 2, false)));
    assertEquals(2 + 8 + 2 + 4, ObjectSizes.estimate(Map.of("a", 1, "b", true)));
    assertEquals(8 + 8, ObjectSizes.estimate(new Object[] {1, List.of(2)}));
  }

  @Test
  void sizedValuesReportTheirOwnSize() {
    assertEquals(42, ObjectSizes.estimate((Sized) () -> 42));
  }

  @Test
  void unknownValues() {
    assertEquals(0, ObjectSizes.estimate(new Object()));
  }
}
