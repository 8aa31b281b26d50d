/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.handler;

import slstrace.TraceSpan;

/**
 * This tracks the lifecycle of spans, for example to export closed spans to Zipkin.
 *
 * <p>Handlers are invoked in the order they were {@link slstrace.Tracing.Builder#addSpanHandler
 * added}. Returning false from a hook skips the handlers after this one. Exceptions raised by a
 * handler are reported as internal errors and do not stop the remaining handlers.
 *
 * @see ZipkinSpanHandler
 */
public abstract class SpanHandler {
  /** Use to avoid comparing against null references. */
  public static final SpanHandler NOOP = new SpanHandler() {
    @Override public String toString() {
      return "NoopSpanHandler{}";
    }
  };

  /**
   * Called when a span starts. Its tags are those it was built with, and it is already a child of
   * its parent.
   *
   * @return true if subsequent handlers should be called
   */
  public boolean begin(TraceSpan span) {
    return true;
  }

  /**
   * Called once when a span closes. {@link TraceSpan#endTime()} is set and its tags are frozen.
   * Immediate descendants closed with it are passed here first.
   *
   * @return true if subsequent handlers should be called
   */
  public boolean end(TraceSpan span) {
    return true;
  }
}
