/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal.codec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import slstrace.TraceSpan;

/**
 * Writes a span and its descendants as nested JSON objects.
 *
 * <p>Spans may change while they are written, for example when a child starts on another thread.
 * To keep size and content consistent, the tree is first copied to a record of plain values.
 */
// @Immutable
public final class TraceSpanJsonWriter implements WriteBuffer.Writer<Map<String, Object>> {
  /** Copies the span tree to field names and values in record order. */
  public static Map<String, Object> record(TraceSpan span) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("name", span.name());
    result.put("traceId", span.traceId());
    result.put("spanId", span.spanId());
    TraceSpan parent = span.parent();
    if (parent != null) result.put("parentId", parent.spanId());
    result.put("startTime", span.startTime());
    Long endTime = span.endTime();
    if (endTime != null) result.put("endTime", endTime);
    String input = span.input(), output = span.output();
    if (input != null) result.put("input", input);
    if (span.inputTooLarge()) result.put("inputTooLarge", true);
    if (output != null) result.put("output", output);
    if (span.outputTooLarge()) result.put("outputTooLarge", true);
    result.put("tags", span.tags().snapshot());
    if (parent == null) {
      Map<String, Object> customTags = span.customTags().snapshot();
      if (!customTags.isEmpty()) result.put("customTags", customTags);
    }
    List<Map<String, Object>> children = new ArrayList<>();
    for (TraceSpan child : span.children()) children.add(record(child));
    result.put("children", children);
    return result;
  }

  @Override public int sizeInBytes(Map<String, Object> record) {
    return JsonValues.INSTANCE.sizeInBytes(record);
  }

  @Override public void write(Map<String, Object> record, WriteBuffer b) {
    JsonValues.INSTANCE.write(record, b);
  }
}
