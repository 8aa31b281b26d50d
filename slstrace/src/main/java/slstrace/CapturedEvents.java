/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

import java.util.Collections;
import java.util.Map;
import slstrace.internal.Nullable;
import slstrace.internal.Platform;
import slstrace.propagation.CurrentSpanContext;
import zipkin2.reporter.Reporter;

import static slstrace.internal.Throwables.propagateIfFatal;
import static slstrace.internal.Throwables.stackTraceString;

/**
 * Records errors, warnings and notices as {@link CapturedEvent}s, independently of the span tree.
 *
 * <p>Errors and warnings are attributed to the current span, if any. Nothing here throws: if the
 * event reporter fails, the event is logged instead.
 *
 * <p>Ex. to record an error the function recovered from:
 * <pre>{@code
 * } catch (TimeoutException e) {
 *   tracing.capturedEvents().captureError(e, Collections.singletonMap("retry", true));
 *   return fallback();
 * }
 * }</pre>
 */
public final class CapturedEvents {
  /** Drops events, used when neither a reporter nor stdout output is configured. */
  static final Reporter<CapturedEvent> NOOP_REPORTER = new Reporter<CapturedEvent>() {
    @Override public void report(CapturedEvent event) {
    }

    @Override public String toString() {
      return "NoopEventReporter{}";
    }
  };

  final Reporter<CapturedEvent> reporter;
  final Clock clock;
  final CurrentSpanContext currentSpanContext;

  CapturedEvents(Reporter<CapturedEvent> reporter, Clock clock,
    CurrentSpanContext currentSpanContext) {
    this.reporter = reporter;
    this.clock = clock;
    this.currentSpanContext = currentSpanContext;
  }

  /** Reports a fault inside tracing code, typed {@link ErrorType#INTERNAL}. */
  public void reportError(Throwable error) {
    reportError(error, ErrorType.INTERNAL);
  }

  public void reportError(Throwable error, ErrorType type) {
    reportError(error, Collections.<String, Object>emptyMap(), type);
  }

  /**
   * Emits an error event with the standard {@code error.*} tags plus the given ones.
   *
   * @param tags additional tags, validated like span tags
   */
  public void reportError(Throwable error, Map<String, ?> tags, ErrorType type) {
    if (error == null) error = new NullPointerException("error == null");
    if (type == null) type = ErrorType.INTERNAL;
    try {
      String message = messageOf(error);
      Tags eventTags = new Tags(this);
      if (tags != null) eventTags.update(tags);
      eventTags.set("error.name", error.getClass().getName());
      eventTags.set("error.message", message);
      eventTags.set("error.stacktrace", stackTraceString(error));
      eventTags.set("error.type", type.name());
      Platform.get().log("Reported {0} error", type, error);
      emit(CapturedEvent.Kind.ERROR, message, null, currentSpanContext.get(), eventTags);
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().warn("error capturing " + type + " error " + error.getClass().getName(), t);
    }
  }

  /** Reports a condition detected by tracing code, with warning type {@code SDK}. */
  public void reportWarning(String message, @Nullable String code) {
    reportWarning(message, code, Collections.<String, Object>emptyMap());
  }

  public void reportWarning(String message, @Nullable String code, Map<String, ?> tags) {
    warning(message, code, tags, "SDK");
  }

  /** Reports informational conditions, such as a body excluded for its size. */
  public void reportNotice(String message, @Nullable String code, @Nullable TraceSpan span) {
    if (message == null) message = "null";
    try {
      Tags eventTags = new Tags(this);
      eventTags.set("notice.message", message);
      emit(CapturedEvent.Kind.NOTICE, message, code, span, eventTags);
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().warn("error capturing notice " + code, t);
    }
  }

  /** Records an error that the function handled, typed {@link ErrorType#HANDLED}. */
  public void captureError(Throwable error, Map<String, ?> tags) {
    reportError(error, tags != null ? tags : Collections.<String, Object>emptyMap(),
      ErrorType.HANDLED);
  }

  /** Records a warning raised by the function, with warning type {@code USER}. */
  public void captureWarning(String message, Map<String, ?> tags) {
    warning(message, null, tags, "USER");
  }

  void warning(String message, @Nullable String code, @Nullable Map<String, ?> tags,
    String type) {
    if (message == null) message = "null";
    try {
      Tags eventTags = new Tags(this);
      if (tags != null) eventTags.update(tags);
      eventTags.set("warning.message", message);
      eventTags.set("warning.type", type);
      emit(CapturedEvent.Kind.WARNING, message, code, currentSpanContext.get(), eventTags);
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().warn("error capturing " + type + " warning " + code, t);
    }
  }

  void emit(CapturedEvent.Kind kind, String message, @Nullable String code,
    @Nullable TraceSpan span, Tags tags) {
    CapturedEvent event = null;
    try {
      event = new CapturedEvent(kind, message, code, span,
        Collections.unmodifiableMap(tags.snapshot()), clock.currentTimeNanoseconds());
      reporter.report(event);
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().warn("error reporting " + (event != null ? event : message), t);
    }
  }

  static String messageOf(Throwable error) {
    String message = error.getMessage();
    return message != null ? message : error.getClass().getName();
  }

  @Override public String toString() {
    return "CapturedEvents{reporter=" + reporter + "}";
  }
}
