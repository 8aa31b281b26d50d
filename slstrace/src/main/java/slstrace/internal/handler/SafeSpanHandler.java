/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal.handler;

import java.util.Arrays;
import slstrace.CapturedEvents;
import slstrace.TraceSpan;
import slstrace.handler.SpanHandler;

import static slstrace.internal.Throwables.propagateIfFatal;

/** Makes sure any exceptions caused by span handlers don't crash callers. */
public final class SafeSpanHandler extends SpanHandler {
  // Array ensures no iterators are created at runtime
  public static SpanHandler create(SpanHandler[] handlers, CapturedEvents capturedEvents) {
    if (handlers.length == 0) return SpanHandler.NOOP;
    return new SafeSpanHandler(handlers, capturedEvents);
  }

  final SpanHandler[] handlers;
  final CapturedEvents capturedEvents;

  SafeSpanHandler(SpanHandler[] handlers, CapturedEvents capturedEvents) {
    this.handlers = handlers;
    this.capturedEvents = capturedEvents;
  }

  @Override public boolean begin(TraceSpan span) {
    for (SpanHandler handler : handlers) {
      try {
        if (!handler.begin(span)) return false;
      } catch (Throwable t) {
        propagateIfFatal(t);
        capturedEvents.reportError(t); // user error in this handler shouldn't impact another
      }
    }
    return true;
  }

  @Override public boolean end(TraceSpan span) {
    for (SpanHandler handler : handlers) {
      try {
        if (!handler.end(span)) return false;
      } catch (Throwable t) {
        propagateIfFatal(t);
        capturedEvents.reportError(t);
      }
    }
    return true;
  }

  @Override public int hashCode() {
    return Arrays.hashCode(handlers);
  }

  @Override public boolean equals(Object obj) {
    if (!(obj instanceof SafeSpanHandler)) return false;
    return Arrays.equals(((SafeSpanHandler) obj).handlers, handlers);
  }

  @Override public String toString() {
    return Arrays.toString(handlers);
  }
}
