/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.handler;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import slstrace.TraceSpan;
import slstrace.internal.Nullable;
import slstrace.internal.codec.JsonValues;
import zipkin2.Endpoint;
import zipkin2.Span;
import zipkin2.reporter.Reporter;

/**
 * Converts each closed span to a Zipkin span and reports it, for example to an
 * {@code AsyncReporter} sending to a Zipkin server.
 *
 * <p>Timestamps become epoch microseconds. Tag values become strings: lists are written as JSON
 * arrays and dates in ISO-8601 format.
 */
public final class ZipkinSpanHandler extends SpanHandler {
  public static ZipkinSpanHandler create(Reporter<Span> spanReporter) {
    return newBuilder(spanReporter).build();
  }

  public static Builder newBuilder(Reporter<Span> spanReporter) {
    return new Builder(spanReporter);
  }

  public static final class Builder {
    final Reporter<Span> spanReporter;
    @Nullable String localServiceName;

    Builder(Reporter<Span> spanReporter) {
      if (spanReporter == null) throw new NullPointerException("spanReporter == null");
      this.spanReporter = spanReporter;
    }

    /** Service name of the local endpoint, such as the function name. Defaults to none. */
    public Builder localServiceName(String localServiceName) {
      if (localServiceName == null || localServiceName.isEmpty()) {
        throw new IllegalArgumentException(localServiceName + " is not a valid serviceName");
      }
      this.localServiceName = localServiceName;
      return this;
    }

    public ZipkinSpanHandler build() {
      return new ZipkinSpanHandler(this);
    }
  }

  final Reporter<Span> spanReporter;
  @Nullable final Endpoint localEndpoint;

  ZipkinSpanHandler(Builder builder) {
    this.spanReporter = builder.spanReporter;
    this.localEndpoint = builder.localServiceName != null
      ? Endpoint.newBuilder().serviceName(builder.localServiceName).build()
      : null;
  }

  @Override public boolean end(TraceSpan span) {
    spanReporter.report(convert(span));
    return true;
  }

  Span convert(TraceSpan span) {
    TraceSpan parent = span.parent();
    Span.Builder result = Span.newBuilder()
      .traceId(span.traceId())
      .parentId(parent != null ? parent.spanId() : null)
      .id(span.spanId())
      .name(span.name());

    long start = span.startTime() / 1000L;
    Long endTime = span.endTime();
    result.timestamp(start);
    if (endTime != null) result.duration(Math.max(endTime / 1000L - start, 1));
    if (localEndpoint != null) result.localEndpoint(localEndpoint);

    if (parent == null) { // span tags win over custom tags of the same name
      for (Map.Entry<String, Object> tag : span.customTags().snapshot().entrySet()) {
        result.putTag(tag.getKey(), tagValue(tag.getValue()));
      }
    }
    for (Map.Entry<String, Object> tag : span.tags().snapshot().entrySet()) {
      result.putTag(tag.getKey(), tagValue(tag.getValue()));
    }
    return result.build();
  }

  static String tagValue(Object value) {
    if (value instanceof String) return (String) value;
    if (value instanceof Date || value instanceof Instant) return JsonValues.isoString(value);
    if (value instanceof List) return JsonValues.toJson(value);
    return value.toString();
  }

  @Override public String toString() {
    return spanReporter.toString();
  }
}
