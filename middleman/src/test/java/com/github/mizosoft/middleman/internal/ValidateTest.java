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

import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ValidateTest {
  @Test
  void requireArgument() {
    Validate.requireArgument(true, "unused");
    assertThatIllegalArgumentException()
        .isThrownBy(() -> Validate.requireArgument(false, "bad %s: %d", "size", 1))
        .withMessage("bad size: 1");
  }

  @Test
  void requireState() {
    Validate.requireState(true, "unused");
    assertThatIllegalStateException()
        .isThrownBy(() -> Validate.requireState(false, "closed"))
        .withMessage("closed");
  }

  @Test
  void requirePositive() {
    assertEquals(1, Validate.requirePositive(1, "size"));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> Validate.requirePositive(0, "size"))
        .withMessage("non-positive size: 0");
  }
}
