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

package com.github.mizosoft.middleman.cache;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.mizosoft.middleman.cache.CacheTest.RecordingListener;
import com.github.mizosoft.middleman.testing.Logging;
import com.github.mizosoft.middleman.testing.MockClock;
import com.github.mizosoft.middleman.testing.TestStore;
import java.io.IOException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Size-based eviction and its interplay with explicit deletion. */
class CacheEvictionTest {
  // Each of these takes 8 bytes.
  private static final String POKEMON_1 = "pika";
  private static final String POKEMON_2 = "eeve";
  private static final String POKEMON_3 = "mewt";

  private TestStore store;
  private RecordingListener listener;
  private Cache cache;

  @BeforeAll
  static void disableLogging() {
    Logging.disable(Cache.class);
  }

  @BeforeEach
  void setUp() {
    store = new TestStore();
    listener = new RecordingListener();
    cache =
        Cache.newBuilder()
            .store(store)
            .listener(listener)
            .maxSize(20)
            .clock(new MockClock())
            .build();
  }

  @Test
  void evictsLeastRecentlySetEntry() {
    cache.set("a", POKEMON_1).join();
    cache.set("b", POKEMON_2).join();
    assertThat(listener.deleted).isEmpty();

    cache.set("c", POKEMON_3).join();
    assertThat(listener.deleted).containsExactly("a");
    assertThat(cache.keys()).containsExactly("b", "c");
    assertEquals(16, cache.size());
    assertFalse(store.contains("a"));
    assertThat(cache.get("a").join()).isEqualTo(Lookup.absent());
  }

  @Test
  void getTouchesEntries() {
    cache.set("a", POKEMON_1).join();
    cache.set("b", POKEMON_2).join();
    assertTrue(cache.get("a").join().isHit());

    cache.set("c", POKEMON_3).join();
    assertThat(listener.deleted).containsExactly("b");
    assertThat(cache.keys()).containsExactly("a", "c");
  }

  @Test
  void evictsInLruOrderTillUnderMaxSize() {
    cache.set("a", POKEMON_1).join();
    cache.set("b", POKEMON_2).join();
    cache.set("c", "pikachu!!").join(); // 18 bytes.
    assertThat(listener.deleted).containsExactly("a", "b");
    assertThat(cache.keys()).containsExactly("c");
    assertThat(cache.size()).isLessThanOrEqualTo(20);
  }

  @Test
  void oversizedEntryIsEvictedRightAway() {
    cache.set("a", POKEMON_1).join();
    cache.set("b", "pikachu, raichu").join(); // 30 bytes.
    assertThat(listener.deleted).containsExactly("a", "b");
    assertThat(cache.keys()).isEmpty();
    assertFalse(store.contains("b"));
  }

  @Test
  void hugeSizedValueIsEvictedWithoutOverflow() {
    cache.set("a", POKEMON_1).join();
    cache.set("b", (Sized) () -> Long.MAX_VALUE).join();
    assertThat(listener.deleted).containsExactly("a", "b");
    assertThat(cache.keys()).isEmpty();
    assertEquals(0, cache.size());

    cache.set("c", POKEMON_3).join();
    assertThat(cache.keys()).containsExactly("c");
    assertEquals(8, cache.size());
  }

  @Test
  void evictionFailure() {
    store.failDeletesOf("a");
    cache.set("a", POKEMON_1).join();
    cache.set("b", POKEMON_2).join();
    cache.set("c", POKEMON_3).join();

    assertThat(listener.deleted).isEmpty();
    assertThat(listener.errors).singleElement().isInstanceOf(IOException.class);

    // The index forgets the key even though the store still has it.
    assertThat(cache.keys()).containsExactly("b", "c");
    assertTrue(store.contains("a"));
    assertFalse(cache.isProtected("a"));
  }

  @Test
  void eachEvictionIsNotifiedOnce() {
    store.failDeletesOf("b");
    for (var key : new String[] {"a", "b", "c", "d", "e"}) {
      cache.set(key, POKEMON_1).join();
    }
    assertThat(listener.deleted).containsExactly("a", "c");
    assertThat(listener.errors).hasSize(1);
    assertEquals(1, store.deleteCount("a"));
    assertEquals(1, store.deleteCount("b"));
    assertEquals(1, store.deleteCount("c"));
  }

  @Test
  void evictionProtectsKeyTillStoreDeletionCompletes() {
    store.holdDeletes();
    cache.set("a", POKEMON_1).join();
    cache.set("b", POKEMON_2).join();
    cache.set("c", POKEMON_3).join();
    assertTrue(cache.isProtected("a"));
    assertThat(listener.deleted).isEmpty();

    store.releaseDeletes();
    assertFalse(cache.isProtected("a"));
    assertThat(listener.deleted).containsExactly("a");
  }

  @Test
  void evictionOfKeyBeingDeletedIsSkipped() {
    cache.set("a", POKEMON_1).join();
    cache.set("b", POKEMON_2).join();
    store.holdDeletes();
    var deletion = cache.del("a");

    cache.set("c", POKEMON_3).join(); // Makes "a" the victim.
    assertEquals(1, store.pendingDeleteCount());

    store.releaseDeletes();
    assertThat(deletion).succeedsWithin(5, SECONDS);
    assertEquals(1, store.deleteCount("a"));
    assertThat(listener.deleted).isEmpty();
    assertThat(listener.errors).isEmpty();
    assertFalse(cache.isProtected("a"));
  }

  @Test
  void deletionOfKeyBeingEvictedJoinsEviction() {
    store.holdDeletes();
    cache.set("a", POKEMON_1).join();
    cache.set("b", POKEMON_2).join();
    cache.set("c", POKEMON_3).join(); // Evicts "a".

    var deletion = cache.del("a");
    assertFalse(deletion.isDone());
    assertEquals(1, store.pendingDeleteCount());

    store.releaseDeletes();
    assertThat(deletion).succeedsWithin(5, SECONDS);
    assertEquals(1, store.deleteCount("a"));
    assertThat(listener.deleted).containsExactly("a");
  }

  @Test
  void clearDuringEvictionIssuesOneDeletionPerKey() {
    store.holdDeletes();
    cache.set("a", POKEMON_1).join();
    cache.set("b", POKEMON_2).join();
    cache.set("c", POKEMON_3).join(); // Evicts "a".

    var clearing = cache.clear();
    store.releaseDeletes();
    assertThat(clearing).succeedsWithin(5, SECONDS);
    for (var key : new String[] {"a", "b", "c"}) {
      assertEquals(1, store.deleteCount(key), key);
      assertFalse(store.contains(key), key);
    }
    assertThat(cache.keys()).isEmpty();
    assertThat(listener.deleted).containsExactly("a");
  }

  @Test
  void reSetAfterEvictionIsIndexedAgain() {
    cache.set("a", POKEMON_1).join();
    cache.set("b", POKEMON_2).join();
    cache.set("c", POKEMON_3).join();
    cache.set("a", POKEMON_1).join(); // Evicts "b".
    assertThat(cache.keys()).containsExactly("c", "a");
    assertThat(listener.deleted).containsExactly("a", "b");
    assertTrue(store.contains("a"));
  }
}
