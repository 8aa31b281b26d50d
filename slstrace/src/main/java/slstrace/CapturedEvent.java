/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

import java.util.Map;
import slstrace.internal.Nullable;

/**
 * An error, warning or notice recorded out of band from the span tree.
 *
 * <p>An event refers to its related span by id only, so holding an event never keeps a span
 * alive.
 *
 * @see CapturedEvents
 * @see slstrace.handler.CapturedEventBytesEncoder
 */
public final class CapturedEvent {
  public enum Kind {
    ERROR,
    WARNING,
    NOTICE
  }

  final Kind kind;
  final String message;
  @Nullable final String code, traceId, spanId;
  final Map<String, Object> tags;
  final long timestamp;

  CapturedEvent(Kind kind, String message, @Nullable String code, @Nullable TraceSpan span,
    Map<String, Object> tags, long timestamp) {
    this.kind = kind;
    this.message = message;
    this.code = code;
    this.traceId = span != null ? span.traceId() : null;
    this.spanId = span != null ? span.spanId() : null;
    this.tags = tags;
    this.timestamp = timestamp;
  }

  public Kind kind() {
    return kind;
  }

  public String message() {
    return message;
  }

  /** Stable identifier of the condition, such as {@code INPUT_BODY_TOO_LARGE}. */
  @Nullable public String code() {
    return code;
  }

  /** Trace ID of the span this event is attributed to, if any. */
  @Nullable public String traceId() {
    return traceId;
  }

  /** ID of the span this event is attributed to, if any. */
  @Nullable public String spanId() {
    return spanId;
  }

  /** Read-only tags, such as {@code error.name} or {@code warning.type}. */
  public Map<String, Object> tags() {
    return tags;
  }

  /** Epoch nanoseconds, read from the same clock as span timestamps. */
  public long timestamp() {
    return timestamp;
  }

  @Override public String toString() {
    return "CapturedEvent{"
      + "kind=" + kind + ", "
      + "message=" + message + ", "
      + "code=" + code + ", "
      + "spanId=" + spanId + ", "
      + "tags=" + tags
      + "}";
  }
}
