/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.handler;

import java.util.List;
import slstrace.CapturedEvent;
import slstrace.internal.codec.CapturedEventJsonWriter;
import slstrace.internal.codec.JsonWriter;
import zipkin2.codec.BytesEncoder;
import zipkin2.codec.Encoding;

/**
 * Encodes captured events as JSON objects with the fields {@code kind}, {@code message},
 * {@code code}, {@code traceId}, {@code spanId}, {@code tags} and {@code timestamp}.
 */
public enum CapturedEventBytesEncoder implements BytesEncoder<CapturedEvent> {
  JSON {
    final CapturedEventJsonWriter writer = new CapturedEventJsonWriter();

    @Override public Encoding encoding() {
      return Encoding.JSON;
    }

    @Override public int sizeInBytes(CapturedEvent input) {
      return writer.sizeInBytes(input);
    }

    @Override public byte[] encode(CapturedEvent input) {
      return JsonWriter.write(writer, input);
    }

    @Override public byte[] encodeList(List<CapturedEvent> input) {
      return JsonWriter.writeList(writer, input);
    }
  };

  /** Serializes a list of events into a JSON array. */
  public abstract byte[] encodeList(List<CapturedEvent> input);
}
