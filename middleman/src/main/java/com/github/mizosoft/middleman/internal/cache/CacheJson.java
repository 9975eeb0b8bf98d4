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

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.mizosoft.middleman.CachedResponse;
import com.github.mizosoft.middleman.InvalidCachedResponseException;
import com.github.mizosoft.middleman.cache.CacheEntry;
import com.github.mizosoft.middleman.cache.StoreProtocolException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts cache entries to and from JSON text, for stores that persist values as text. A {@link
 * CachedResponse} value is written in its {@link CachedResponse#toWireForm() wire form}. Entries
 * read back from text carry the plain JSON representation of their values (maps, lists, strings,
 * numbers and booleans).
 */
public final class CacheJson {
  static final String KEY_FIELD = "key";
  static final String VALUE_FIELD = "value";
  static final String CREATED_FIELD = "created";

  private static final JsonMapper MAPPER = JsonMapper.builder().build();

  private CacheJson() {}

  /** Parses the given JSON text into plain maps, lists & scalars. */
  public static @Nullable Object parse(String json) throws JsonProcessingException {
    return MAPPER.readValue(requireNonNull(json), Object.class);
  }

  /** Writes the given value, which may contain {@code CachedResponses}, as JSON text. */
  public static String write(@Nullable Object value) {
    try {
      return MAPPER.writeValueAsString(toJsonValue(value));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Writes the given entry as a JSON object with {@code key}, {@code value} & {@code created}. */
  public static String encodeEntry(CacheEntry entry) {
    var fields = new LinkedHashMap<String, @Nullable Object>();
    fields.put(KEY_FIELD, entry.key());
    fields.put(VALUE_FIELD, toJsonValue(entry.value()));
    fields.put(CREATED_FIELD, entry.created().toEpochMilli());
    return write(fields);
  }

  /**
   * Interprets a value resolved by a store as a {@code CacheEntry}. Recognized forms are a {@code
   * CacheEntry} instance, a map with the fields written by {@link #encodeEntry(CacheEntry)}, or
   * the JSON text of such a map.
   *
   * @throws StoreProtocolException if the value has none of the recognized forms
   */
  public static CacheEntry decodeEntry(Object stored) {
    requireNonNull(stored);
    if (stored instanceof CacheEntry) {
      return (CacheEntry) stored;
    } else if (stored instanceof Map<?, ?>) {
      return decodeEntryFields((Map<?, ?>) stored);
    } else if (stored instanceof CharSequence) {
      Object parsed;
      try {
        parsed = parse(stored.toString());
      } catch (JsonProcessingException e) {
        throw new StoreProtocolException(
            "expected store to resolve a CacheEntry, got malformed JSON", e);
      }
      if (parsed instanceof Map<?, ?>) {
        return decodeEntryFields((Map<?, ?>) parsed);
      }
    }
    throw new StoreProtocolException(
        "expected store to resolve a CacheEntry, got: " + stored.getClass().getName());
  }

  /**
   * Returns the size of the given entry. A value in the wire form of a {@code CachedResponse}, as
   * read back from a text store, is sized as the response it was written from.
   */
  public static long sizeOf(CacheEntry entry) {
    var value = entry.value();
    if (value instanceof Map<?, ?>) {
      try {
        return CachedResponse.parse(value).size();
      } catch (InvalidCachedResponseException e) {
        return entry.size(); // Not a response.
      }
    }
    return entry.size();
  }

  private static CacheEntry decodeEntryFields(Map<?, ?> fields) {
    var key = fields.get(KEY_FIELD);
    var created = fields.get(CREATED_FIELD);
    if (!(key instanceof String)
        || !(created instanceof Number)
        || !fields.containsKey(VALUE_FIELD)) {
      throw new StoreProtocolException(
          "expected store to resolve a CacheEntry, got a map with fields: " + fields.keySet());
    }
    return new CacheEntry(
        (String) key,
        fields.get(VALUE_FIELD),
        Instant.ofEpochMilli(((Number) created).longValue()));
  }

  private static @Nullable Object toJsonValue(@Nullable Object value) {
    return value instanceof CachedResponse ? ((CachedResponse) value).toWireForm() : value;
  }
}
