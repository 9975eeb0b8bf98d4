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

package com.github.mizosoft.middleman.store.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import com.github.mizosoft.middleman.CachedResponse;
import com.github.mizosoft.middleman.cache.CacheEntry;
import com.github.mizosoft.middleman.internal.cache.CacheJson;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RedisStoreEncodingTest {
  @Test
  void stringsAreWrittenAsIs() {
    assertThat(RedisStore.encode("pikachu")).isEqualTo("pikachu");
  }

  @Test
  void entriesAreDecodableByCache() {
    var response =
        new CachedResponse(201, Map.of("X-Pokemon", List.of("Eevee")), new byte[] {1, 2});
    var entry = new CacheEntry("k", response, Instant.ofEpochMilli(42));
    var decoded = CacheJson.decodeEntry(RedisStore.encode(entry));
    assertThat(decoded.key()).isEqualTo("k");
    assertThat(decoded.created()).isEqualTo(Instant.ofEpochMilli(42));
    assertThat(CachedResponse.parse(decoded.value())).isEqualTo(response);
  }

  @Test
  void otherValuesAreWrittenAsJson() {
    assertThat(RedisStore.encode(List.of(1, 2))).isEqualTo("[1,2]");
    assertThat(RedisStore.encode(Map.of("a", true))).isEqualTo("{\"a\":true}");
  }

  @Test
  void builderRequiresConnectionOrUri() {
    assertThatIllegalStateException().isThrownBy(() -> RedisStore.newBuilder().build());
  }

  @Test
  void builderRejectsNonPositiveTtl() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> RedisStore.newBuilder().ttl(Duration.ZERO));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> RedisStore.newBuilder().ttl(Duration.ofSeconds(-1)));
  }
}
