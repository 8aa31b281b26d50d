/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal.codec;

import slstrace.CapturedEvent;

import static slstrace.internal.codec.JsonEscaper.jsonEscape;
import static slstrace.internal.codec.JsonEscaper.jsonEscapedSizeInBytes;
import static slstrace.internal.codec.JsonWriter.writeFieldBegin;

// @Immutable
public final class CapturedEventJsonWriter implements WriteBuffer.Writer<CapturedEvent> {
  @Override public int sizeInBytes(CapturedEvent value) {
    int sizeInBytes = 2; // {}
    sizeInBytes += 9 + value.kind().name().length(); // "kind":""
    sizeInBytes += 13 + jsonEscapedSizeInBytes(value.message()); // ,"message":""
    if (value.code() != null) {
      sizeInBytes += 10 + jsonEscapedSizeInBytes(value.code()); // ,"code":""
    }
    if (value.traceId() != null) sizeInBytes += 13 + value.traceId().length(); // ,"traceId":""
    if (value.spanId() != null) sizeInBytes += 12 + value.spanId().length(); // ,"spanId":""
    sizeInBytes += 8 + JsonValues.INSTANCE.sizeInBytes(value.tags()); // ,"tags":
    sizeInBytes += 13 + WriteBuffer.asciiSizeInBytes(value.timestamp()); // ,"timestamp":
    return sizeInBytes;
  }

  @Override public void write(CapturedEvent value, WriteBuffer b) {
    b.writeByte('{');
    boolean wroteField = writeFieldBegin(b, "kind", false);
    b.writeByte('"');
    b.writeAscii(value.kind().name());
    b.writeByte('"');
    writeFieldBegin(b, "message", wroteField);
    writeString(value.message(), b);
    if (value.code() != null) {
      writeFieldBegin(b, "code", wroteField);
      writeString(value.code(), b);
    }
    if (value.traceId() != null) {
      writeFieldBegin(b, "traceId", wroteField);
      writeString(value.traceId(), b);
    }
    if (value.spanId() != null) {
      writeFieldBegin(b, "spanId", wroteField);
      writeString(value.spanId(), b);
    }
    writeFieldBegin(b, "tags", wroteField);
    JsonValues.INSTANCE.write(value.tags(), b);
    writeFieldBegin(b, "timestamp", wroteField);
    b.writeAscii(value.timestamp());
    b.writeByte('}');
  }

  static void writeString(String value, WriteBuffer b) {
    b.writeByte('"');
    jsonEscape(value, b);
    b.writeByte('"');
  }
}
