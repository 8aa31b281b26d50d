/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import slstrace.TraceSpan;
import slstrace.internal.codec.JsonWriter;
import slstrace.internal.codec.TraceSpanJsonWriter;
import zipkin2.codec.BytesEncoder;
import zipkin2.codec.Encoding;

/**
 * Encodes a span with all of its descendants, as captured at the moment of encoding.
 *
 * <p>Field names are {@code name}, {@code traceId}, {@code spanId}, {@code parentId},
 * {@code startTime}, {@code endTime}, {@code input}, {@code inputTooLarge}, {@code output},
 * {@code outputTooLarge}, {@code tags} and {@code children}. Absent values are omitted.
 */
public enum TraceSpanBytesEncoder implements BytesEncoder<TraceSpan> {
  JSON {
    final TraceSpanJsonWriter writer = new TraceSpanJsonWriter();

    @Override public Encoding encoding() {
      return Encoding.JSON;
    }

    @Override public int sizeInBytes(TraceSpan input) {
      return writer.sizeInBytes(TraceSpanJsonWriter.record(input));
    }

    @Override public byte[] encode(TraceSpan input) {
      return JsonWriter.write(writer, TraceSpanJsonWriter.record(input));
    }

    @Override public byte[] encodeList(List<TraceSpan> input) {
      List<Map<String, Object>> records = new ArrayList<>(input.size());
      for (TraceSpan span : input) records.add(TraceSpanJsonWriter.record(span));
      return JsonWriter.writeList(writer, records);
    }
  };

  /** Serializes a list of spans into a JSON array. */
  public abstract byte[] encodeList(List<TraceSpan> input);
}
