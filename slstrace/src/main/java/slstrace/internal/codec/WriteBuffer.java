/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal.codec;

/**
 * Fixed-size output for JSON records. There are no bounds checks: callers size the array with
 * {@link Writer#sizeInBytes} first, so an overrun is a bug in a writer.
 */
public final class WriteBuffer {
  /** Writes values of one type, after reporting exactly how many bytes that takes. */
  public interface Writer<T> {
    int sizeInBytes(T value);

    void write(T value, WriteBuffer buffer);
  }

  public static WriteBuffer wrap(byte[] bytes) {
    return new WriteBuffer(bytes);
  }

  final byte[] buf;
  int pos;

  WriteBuffer(byte[] buf) {
    this.buf = buf;
  }

  public void writeByte(int v) {
    buf[pos++] = (byte) v;
  }

  /** Writes text known to be ASCII, such as enum names and literals. */
  public void writeAscii(CharSequence v) {
    for (int i = 0, length = v.length(); i < length; i++) {
      writeByte(v.charAt(i));
    }
  }

  /** Writes the decimal form of the number. */
  public void writeAscii(long v) {
    if (v == Long.MIN_VALUE) {
      writeAscii("-9223372036854775808");
      return;
    }
    if (v < 0) {
      writeByte('-');
      v = -v;
    }
    int end = pos + asciiSizeInBytes(v);
    pos = end;
    do {
      buf[--end] = (byte) ('0' + (int) (v % 10));
      v /= 10;
    } while (v != 0);
  }

  /**
   * Encodes the characters in the range as UTF-8. An unpaired surrogate is written as {@code ?},
   * matching {@link #utf8SizeInBytes}.
   */
  public void writeUtf8(CharSequence string, int fromIndex, int toIndex) {
    for (int i = fromIndex; i < toIndex; i++) {
      char ch = string.charAt(i);
      if (ch < 0x80) {
        writeByte(ch);
      } else if (ch < 0x800) {
        writeByte(0xc0 | (ch >> 6));
        writeByte(0x80 | (ch & 0x3f));
      } else if (!Character.isSurrogate(ch)) {
        writeByte(0xe0 | (ch >> 12));
        writeByte(0x80 | ((ch >> 6) & 0x3f));
        writeByte(0x80 | (ch & 0x3f));
      } else if (isSurrogatePair(string, i, toIndex)) {
        int codePoint = Character.toCodePoint(ch, string.charAt(++i));
        writeByte(0xf0 | (codePoint >> 18));
        writeByte(0x80 | ((codePoint >> 12) & 0x3f));
        writeByte(0x80 | ((codePoint >> 6) & 0x3f));
        writeByte(0x80 | (codePoint & 0x3f));
      } else {
        writeByte('?');
      }
    }
  }

  /** Returns the length of the UTF-8 encoding, without encoding. */
  public static int utf8SizeInBytes(CharSequence string) {
    int sizeInBytes = 0;
    for (int i = 0, length = string.length(); i < length; i++) {
      char ch = string.charAt(i);
      if (ch < 0x80) {
        sizeInBytes++;
      } else if (ch < 0x800) {
        sizeInBytes += 2;
      } else if (!Character.isSurrogate(ch)) {
        sizeInBytes += 3;
      } else if (isSurrogatePair(string, i, length)) {
        sizeInBytes += 4;
        i++;
      } else {
        sizeInBytes++; // '?'
      }
    }
    return sizeInBytes;
  }

  /** Returns the length of the decimal form of the number, including any minus sign. */
  public static int asciiSizeInBytes(long v) {
    if (v == Long.MIN_VALUE) return 20;
    int sizeInBytes = v < 0 ? 2 : 1;
    for (v = Math.abs(v); v >= 10; v /= 10) {
      sizeInBytes++;
    }
    return sizeInBytes;
  }

  static boolean isSurrogatePair(CharSequence string, int i, int toIndex) {
    return Character.isHighSurrogate(string.charAt(i))
      && i + 1 < toIndex
      && Character.isLowSurrogate(string.charAt(i + 1));
  }
}
