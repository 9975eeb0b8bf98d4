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

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.mizosoft.middleman.cache.Sized;
import com.github.mizosoft.middleman.internal.ObjectSizes;
import com.github.mizosoft.middleman.internal.cache.CacheJson;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A response's status code, headers and body, captured for storage and later replay. The body is
 * always fully materialized.
 *
 * <p>A {@code CachedResponse} can be projected into a {@link #toWireForm() wire form} made of plain
 * maps, lists and scalars, which survives serialization through text formats like JSON. {@link
 * #parse(Object)} reconstructs a response from either form.
 */
public final class CachedResponse implements Sized {
  static final String STATUS_FIELD = "status";
  static final String HEADERS_FIELD = "headers";
  static final String BODY_FIELD = "body";
  static final String BUFFER_TYPE_FIELD = "type";
  static final String BUFFER_DATA_FIELD = "data";
  static final String BUFFER_TYPE = "Buffer";

  private static final int MIN_STATUS_CODE = 100;
  private static final int MAX_STATUS_CODE = 999;

  private final int statusCode;
  private final Map<String, List<String>> headers;
  private final byte[] body;

  public CachedResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {
    this.statusCode = statusCode;
    this.headers = copyHeaders(headers);
    this.body = body.clone();
  }

  public int statusCode() {
    return statusCode;
  }

  /** Returns an unmodifiable view of the headers, in the order they were received. */
  public Map<String, List<String>> headers() {
    return headers;
  }

  /** Returns the first value of the given header, matching its name case-insensitively. */
  public Optional<String> firstValue(String name) {
    requireNonNull(name);
    return headers.entrySet().stream()
        .filter(entry -> entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty())
        .map(entry -> entry.getValue().get(0))
        .findFirst();
  }

  /** Returns a copy of the body. */
  public byte[] body() {
    return body.clone();
  }

  /** Returns a readonly view of the body. */
  public ByteBuffer bodyBuffer() {
    return ByteBuffer.wrap(body).asReadOnlyBuffer();
  }

  /** Returns the estimated size of this response in bytes, dominated by the body's length. */
  @Override
  public long size() {
    return ObjectSizes.estimate(statusCode) + ObjectSizes.estimate(headers) + body.length;
  }

  /**
   * Returns a representation of this response made of plain maps, lists and scalars: {@code
   * {status, headers, body: {type: "Buffer", data: [...]}}}. Headers with a single value are
   * represented as a string, others as a list of strings. Body bytes are unsigned.
   */
  public Map<String, Object> toWireForm() {
    var wireHeaders = new LinkedHashMap<String, Object>();
    headers.forEach(
        (name, values) -> wireHeaders.put(name, values.size() == 1 ? values.get(0) : values));
    var data = new ArrayList<Integer>(body.length);
    for (byte b : body) {
      data.add(b & 0xff);
    }
    var wireBody = new LinkedHashMap<String, Object>();
    wireBody.put(BUFFER_TYPE_FIELD, BUFFER_TYPE);
    wireBody.put(BUFFER_DATA_FIELD, Collections.unmodifiableList(data));
    var wireForm = new LinkedHashMap<String, Object>();
    wireForm.put(STATUS_FIELD, statusCode);
    wireForm.put(HEADERS_FIELD, Collections.unmodifiableMap(wireHeaders));
    wireForm.put(BODY_FIELD, Collections.unmodifiableMap(wireBody));
    return Collections.unmodifiableMap(wireForm);
  }

  /** Returns the JSON text of this response's {@link #toWireForm() wire form}. */
  public String toJson() {
    return CacheJson.write(this);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof CachedResponse)) {
      return false;
    }
    var other = (CachedResponse) obj;
    return statusCode == other.statusCode
        && headers.equals(other.headers)
        && Arrays.equals(body, other.body);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * statusCode + headers.hashCode()) + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "CachedResponse[statusCode="
        + statusCode
        + ", headers="
        + headers
        + ", body=<"
        + body.length
        + " bytes>]";
  }

  /**
   * Reconstructs a response from a stored value. The value can be a {@code CachedResponse}, the
   * JSON text of a wire form, or a "CachedResponse-like" map having an integral {@code status} in
   * {@code [100, 999]}, a {@code headers} map, and a {@code body} that is either a byte array, a
   * list of unsigned byte values, or a map of the form {@code {type: "Buffer", data: [...]}}.
   *
   * @throws InvalidCachedResponseException if the value has none of the recognized forms
   */
  public static CachedResponse parse(@Nullable Object value) {
    if (value == null) {
      throw new InvalidCachedResponseException("not a CachedResponse-like value: null");
    } else if (value instanceof CachedResponse) {
      return (CachedResponse) value;
    } else if (value instanceof CharSequence) {
      return parseJson(value.toString());
    } else if (value instanceof Map<?, ?>) {
      return parseFields((Map<?, ?>) value);
    }
    throw new InvalidCachedResponseException(
        "not a CachedResponse-like value: " + value.getClass().getName());
  }

  /**
   * Reconstructs a response from JSON text.
   *
   * @throws InvalidCachedResponseException if the text is malformed or isn't a recognized form
   */
  public static CachedResponse parseJson(String json) {
    Object parsed;
    try {
      parsed = CacheJson.parse(json);
    } catch (JsonProcessingException e) {
      throw new InvalidCachedResponseException("malformed JSON", e);
    }
    if (!(parsed instanceof Map<?, ?>)) {
      throw new InvalidCachedResponseException("JSON text is not an object");
    }
    return parseFields((Map<?, ?>) parsed);
  }

  private static CachedResponse parseFields(Map<?, ?> fields) {
    var status = fields.get(STATUS_FIELD);
    var headers = fields.get(HEADERS_FIELD);
    var body = fields.get(BODY_FIELD);
    if (!(headers instanceof Map<?, ?>) || body == null) {
      throw new InvalidCachedResponseException("invalid CachedResponse");
    }
    var statusCode = integralValue(status, MIN_STATUS_CODE, MAX_STATUS_CODE);
    if (statusCode == null) {
      throw new InvalidCachedResponseException("invalid CachedResponse status: " + status);
    }
    return new CachedResponse(
        statusCode.intValue(), parseHeaders((Map<?, ?>) headers), parseBody(body));
  }

  private static Map<String, List<String>> parseHeaders(Map<?, ?> wireHeaders) {
    var headers = new LinkedHashMap<String, List<String>>();
    for (var entry : wireHeaders.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new InvalidCachedResponseException("invalid CachedResponse headers");
      }
      var value = entry.getValue();
      List<String> values;
      if (value instanceof String) {
        values = List.of((String) value);
      } else if (value instanceof List<?>) {
        var list = new ArrayList<String>();
        for (var element : (List<?>) value) {
          if (!(element instanceof String)) {
            throw new InvalidCachedResponseException("invalid CachedResponse headers");
          }
          list.add((String) element);
        }
        values = Collections.unmodifiableList(list);
      } else {
        throw new InvalidCachedResponseException("invalid CachedResponse headers");
      }
      headers.put((String) entry.getKey(), values);
    }
    return Collections.unmodifiableMap(headers);
  }

  private static byte[] parseBody(Object body) {
    if (body instanceof byte[]) {
      return ((byte[]) body).clone();
    } else if (body instanceof ByteBuffer) {
      var buffer = ((ByteBuffer) body).duplicate();
      var bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return bytes;
    } else if (body instanceof List<?>) {
      return toBytes((List<?>) body);
    } else if (body instanceof Map<?, ?>) {
      var buffer = (Map<?, ?>) body;
      var data = buffer.get(BUFFER_DATA_FIELD);
      if (!BUFFER_TYPE.equals(buffer.get(BUFFER_TYPE_FIELD)) || !(data instanceof List<?>)) {
        throw new InvalidCachedResponseException("invalid CachedResponse Buffer");
      }
      return toBytes((List<?>) data);
    }
    throw new InvalidCachedResponseException("invalid CachedResponse body");
  }

  private static byte[] toBytes(List<?> values) {
    var bytes = new byte[values.size()];
    int i = 0;
    for (var value : values) {
      var unsignedByte = integralValue(value, 0, 0xFF);
      if (unsignedByte == null) {
        throw new InvalidCachedResponseException("invalid CachedResponse body byte: " + value);
      }
      bytes[i++] = (byte) unsignedByte.intValue();
    }
    return bytes;
  }

  /**
   * Returns the value of the given number if it's integral and within {@code [min, max]}, or
   * {@code null} otherwise. Numbers are never rounded or truncated.
   */
  private static @Nullable Long integralValue(@Nullable Object value, long min, long max) {
    if (!(value instanceof Number)) {
      return null;
    }
    BigDecimal decimal;
    try {
      decimal = new BigDecimal(value.toString());
    } catch (NumberFormatException e) {
      return null; // NaN or infinite.
    }
    if (decimal.signum() != 0 && decimal.stripTrailingZeros().scale() > 0) {
      return null;
    }
    if (decimal.compareTo(BigDecimal.valueOf(min)) < 0
        || decimal.compareTo(BigDecimal.valueOf(max)) > 0) {
      return null;
    }
    return decimal.longValueExact();
  }

  private static Map<String, List<String>> copyHeaders(Map<String, List<String>> headers) {
    var copy = new LinkedHashMap<String, List<String>>();
    headers.forEach((name, values) -> copy.put(requireNonNull(name), List.copyOf(values)));
    return Collections.unmodifiableMap(copy);
  }
}
