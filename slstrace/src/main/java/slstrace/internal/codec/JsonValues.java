/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal.codec;

import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.Iterator;
import java.util.Map;
import slstrace.internal.Nullable;

import static slstrace.internal.codec.JsonEscaper.jsonEscape;
import static slstrace.internal.codec.JsonEscaper.jsonEscapedSizeInBytes;

/**
 * Writes plain Java values as JSON: tag values, AWS call parameters and similar data.
 *
 * <p>Supported values are null, character sequences, numbers, booleans, dates, enums, maps,
 * collections and object arrays. Anything else, or a structure nested deeper than {@value
 * #MAX_DEPTH}, raises {@link IllegalArgumentException} from {@link #sizeInBytes(Object)}, before
 * any bytes are written.
 */
public enum JsonValues implements WriteBuffer.Writer<Object> {
  INSTANCE;

  static final int MAX_DEPTH = 32;

  /** Returns the value as JSON text or throws {@link IllegalArgumentException}. */
  public static String toJson(@Nullable Object value) {
    return new String(JsonWriter.write(INSTANCE, value), JsonWriter.UTF_8);
  }

  /** Returns true if {@link #toJson(Object)} would succeed. */
  public static boolean isSerializable(@Nullable Object value) {
    try {
      INSTANCE.sizeInBytes(value);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /** Returns an ISO-8601 rendering of the date, as exported for DATE tags. */
  public static String isoString(Object date) {
    if (date instanceof Date) return ((Date) date).toInstant().toString();
    return date.toString();
  }

  @Override public int sizeInBytes(@Nullable Object value) {
    return sizeInBytes(value, 0);
  }

  @Override public void write(@Nullable Object value, WriteBuffer b) {
    write(value, b, 0);
  }

  static int sizeInBytes(@Nullable Object value, int depth) {
    if (depth > MAX_DEPTH) throw new IllegalArgumentException("nested deeper than " + MAX_DEPTH);
    if (value == null) return 4;
    if (value instanceof CharSequence) return quotedSizeInBytes((CharSequence) value);
    if (value instanceof Boolean) return ((Boolean) value) ? 4 : 5;
    if (isIntegral(value)) return WriteBuffer.asciiSizeInBytes(((Number) value).longValue());
    if (value instanceof Number) return numberString((Number) value).length();
    if (value instanceof Date || value instanceof Instant) return 2 + isoString(value).length();
    if (value instanceof Enum) return quotedSizeInBytes(((Enum<?>) value).name());
    if (value instanceof Character) return quotedSizeInBytes(value.toString());
    if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      int sizeInBytes = 2; // {}
      if (map.size() > 1) sizeInBytes += map.size() - 1; // comma to join entries
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        sizeInBytes += quotedSizeInBytes(String.valueOf(entry.getKey())) + 1; // colon
        sizeInBytes += sizeInBytes(entry.getValue(), depth + 1);
      }
      return sizeInBytes;
    }
    if (value instanceof Collection || value instanceof Object[]) {
      Iterator<?> i = iterator(value);
      int sizeInBytes = 2; // []
      int count = 0;
      while (i.hasNext()) {
        sizeInBytes += sizeInBytes(i.next(), depth + 1);
        count++;
      }
      if (count > 1) sizeInBytes += count - 1;
      return sizeInBytes;
    }
    throw new IllegalArgumentException(
      "cannot write " + value.getClass().getName() + " as json");
  }

  static void write(@Nullable Object value, WriteBuffer b, int depth) {
    if (value == null) {
      b.writeAscii("null");
    } else if (value instanceof CharSequence) {
      writeQuoted((CharSequence) value, b);
    } else if (value instanceof Boolean) {
      b.writeAscii(((Boolean) value) ? "true" : "false");
    } else if (isIntegral(value)) {
      b.writeAscii(((Number) value).longValue());
    } else if (value instanceof Number) {
      b.writeAscii(numberString((Number) value));
    } else if (value instanceof Date || value instanceof Instant) {
      b.writeByte('"');
      b.writeAscii(isoString(value));
      b.writeByte('"');
    } else if (value instanceof Enum) {
      writeQuoted(((Enum<?>) value).name(), b);
    } else if (value instanceof Character) {
      writeQuoted(value.toString(), b);
    } else if (value instanceof Map) {
      b.writeByte('{');
      boolean wroteField = false;
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        if (wroteField) b.writeByte(',');
        wroteField = true;
        writeQuoted(String.valueOf(entry.getKey()), b);
        b.writeByte(':');
        write(entry.getValue(), b, depth + 1);
      }
      b.writeByte('}');
    } else {
      b.writeByte('[');
      for (Iterator<?> i = iterator(value); i.hasNext(); ) {
        write(i.next(), b, depth + 1);
        if (i.hasNext()) b.writeByte(',');
      }
      b.writeByte(']');
    }
  }

  static boolean isIntegral(Object value) {
    return value instanceof Integer || value instanceof Long
      || value instanceof Short || value instanceof Byte;
  }

  /** Non-finite floating point numbers have no JSON literal, so they are written as null. */
  static String numberString(Number value) {
    if (value instanceof Double || value instanceof Float) {
      double d = value.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) return "null";
    }
    return value.toString();
  }

  static Iterator<?> iterator(Object value) {
    if (value instanceof Collection) return ((Collection<?>) value).iterator();
    return java.util.Arrays.asList((Object[]) value).iterator();
  }

  static int quotedSizeInBytes(CharSequence value) {
    return jsonEscapedSizeInBytes(value) + 2;
  }

  static void writeQuoted(CharSequence value, WriteBuffer b) {
    b.writeByte('"');
    jsonEscape(value, b);
    b.writeByte('"');
  }
}
