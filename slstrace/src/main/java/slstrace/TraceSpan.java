/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import slstrace.internal.Nullable;

/**
 * One unit of work in the trace of a function invocation, such as the invocation itself or an
 * AWS SDK call made while handling it.
 *
 * <p>Spans form a tree: a span is created with at most one parent, fixed for its lifetime, and
 * appended to that parent's children. A span is closed once. After that its end time, tags and
 * payloads no longer change. Misuse, such as closing twice, is reported as an
 * {@link ErrorType#USER} error and otherwise ignored.
 *
 * <p>Closing a span also closes its open children whose names match one of its
 * {@link Tracer.SpanBuilder#immediateDescendants(String...) immediate descendants}, using the same
 * end time.
 *
 * <p>Spans are created by {@link Tracer}. Child registration and closing are synchronized; other
 * writes are expected from a single owner.
 */
public final class TraceSpan {
  final Tracer tracer;
  final String name;
  @Nullable final TraceSpan parent;
  final List<String> immediateDescendants;
  final Tags tags;
  final Map<String, Object> baselineTags;
  final List<TraceSpan> children = new ArrayList<>();

  String traceId, spanId;
  long startTime;
  @Nullable Long endTime;
  @Nullable String input, output;
  boolean inputTooLarge, outputTooLarge;

  TraceSpan(Tracer tracer, String name, @Nullable TraceSpan parent, long startTime,
    Map<String, ?> initialTags, List<String> immediateDescendants) {
    this.tracer = tracer;
    this.name = name;
    this.parent = parent;
    this.startTime = startTime;
    this.immediateDescendants = immediateDescendants;
    this.tags = new Tags(tracer.capturedEvents);
    this.tags.update(initialTags);
    this.baselineTags = Collections.unmodifiableMap(tags.snapshot());
    this.traceId = parent != null ? parent.traceId() : tracer.nextTraceId();
    this.spanId = tracer.nextSpanId();
  }

  public String name() {
    return name;
  }

  /** 32 lower-hex characters, shared by all spans of a tree. */
  public synchronized String traceId() {
    return traceId;
  }

  /** 16 lower-hex characters. */
  public synchronized String spanId() {
    return spanId;
  }

  /** Epoch nanoseconds. */
  public synchronized long startTime() {
    return startTime;
  }

  /** Epoch nanoseconds, or null while the span is open. */
  @Nullable public synchronized Long endTime() {
    return endTime;
  }

  public synchronized boolean isClosed() {
    return endTime != null;
  }

  public Tags tags() {
    return tags;
  }

  /**
   * Tags of the function rather than of one span, shared by every span of the tracer and exported
   * with root spans.
   *
   * @see Tracing#customTags()
   */
  public Tags customTags() {
    return tracer.customTags;
  }

  @Nullable public synchronized String input() {
    return input;
  }

  @Nullable public synchronized String output() {
    return output;
  }

  /** True when the request body was not recorded because it exceeded the size limit. */
  public synchronized boolean inputTooLarge() {
    return inputTooLarge;
  }

  /** True when the response body was not recorded because it exceeded the size limit. */
  public synchronized boolean outputTooLarge() {
    return outputTooLarge;
  }

  /** Records the request body. Ignored and reported once the span is closed. */
  public void input(@Nullable String input) {
    synchronized (this) {
      if (endTime == null) {
        this.input = input;
        this.inputTooLarge = false;
        return;
      }
    }
    reportClosed("input");
  }

  /** Records the response body. Ignored and reported once the span is closed. */
  public void output(@Nullable String output) {
    synchronized (this) {
      if (endTime == null) {
        this.output = output;
        this.outputTooLarge = false;
        return;
      }
    }
    reportClosed("output");
  }

  /** Returns true if the input was not already marked too large. */
  boolean markInputTooLarge() {
    synchronized (this) {
      if (endTime == null) {
        boolean newlyMarked = !inputTooLarge;
        this.input = null;
        this.inputTooLarge = true;
        return newlyMarked;
      }
    }
    reportClosed("input");
    return false;
  }

  boolean markOutputTooLarge() {
    synchronized (this) {
      if (endTime == null) {
        boolean newlyMarked = !outputTooLarge;
        this.output = null;
        this.outputTooLarge = true;
        return newlyMarked;
      }
    }
    reportClosed("output");
    return false;
  }

  @Nullable public TraceSpan parent() {
    return parent;
  }

  /** Returns the children in creation order. */
  public synchronized List<TraceSpan> children() {
    return Collections.unmodifiableList(new ArrayList<>(children));
  }

  public TraceSpan root() {
    TraceSpan result = this;
    while (result.parent != null) result = result.parent;
    return result;
  }

  /** Returns this span followed by all of its descendants, depth first. */
  public List<TraceSpan> spans() {
    List<TraceSpan> result = new ArrayList<>();
    addSpans(this, result);
    return Collections.unmodifiableList(result);
  }

  static void addSpans(TraceSpan span, List<TraceSpan> result) {
    result.add(span);
    for (TraceSpan child : span.children()) addSpans(child, result);
  }

  /** Patterns of child names closed together with this span. */
  public List<String> immediateDescendants() {
    return immediateDescendants;
  }

  synchronized void addChild(TraceSpan child) {
    children.add(child);
  }

  /** Closes the span at the current time. */
  public void close() {
    close(tracer.clock.currentTimeNanoseconds());
  }

  /**
   * Closes the span at the given epoch nanoseconds. Closing twice, or with an end time before the
   * start time, is reported and leaves the span unchanged.
   */
  public void close(long endTime) {
    RuntimeException misuse = null;
    List<TraceSpan> toClose = new ArrayList<>();
    synchronized (this) {
      if (this.endTime != null) {
        misuse = new IllegalStateException("Span " + name + " is already closed");
      } else if (endTime < startTime) {
        misuse = new IllegalArgumentException(
          "Span " + name + " cannot end at " + endTime + ", before it started");
      } else {
        this.endTime = endTime;
        tags.freeze();
        for (TraceSpan child : children) {
          if (isImmediateDescendant(child.name) && !child.isClosed()) toClose.add(child);
        }
      }
    }
    if (misuse != null) {
      tracer.capturedEvents.reportError(misuse, ErrorType.USER);
      return;
    }
    for (TraceSpan child : toClose) child.close(endTime);
    tracer.end(this);
  }

  boolean isImmediateDescendant(String childName) {
    for (String pattern : immediateDescendants) {
      if (pattern.endsWith("*")) {
        if (childName.startsWith(pattern.substring(0, pattern.length() - 1))) return true;
      } else if (pattern.equals(childName)) {
        return true;
      }
    }
    return false;
  }

  /** Reopens a root span at the current time. */
  public void reset() {
    reset(tracer.clock.currentTimeNanoseconds());
  }

  /**
   * Recycles a root span for another invocation: restores the tags it was created with, discards
   * children and payloads, reopens it at the given start time and assigns new IDs.
   *
   * <p>Resetting a span that has a parent is reported and ignored.
   */
  public void reset(long startTime) {
    if (parent != null) {
      tracer.capturedEvents.reportError(
        new IllegalStateException("Cannot reset span " + name + " as it is not a root"),
        ErrorType.USER);
      return;
    }
    String traceId = tracer.nextTraceId(), spanId = tracer.nextSpanId();
    synchronized (this) {
      tags.reset(baselineTags);
      children.clear();
      input = output = null;
      inputTooLarge = outputTooLarge = false;
      endTime = null;
      this.startTime = startTime;
      this.traceId = traceId;
      this.spanId = spanId;
    }
  }

  void reportClosed(String field) {
    tracer.capturedEvents.reportError(
      new IllegalStateException("Cannot set " + field + " of closed span " + name),
      ErrorType.USER);
  }

  @Override public String toString() {
    return "TraceSpan{name=" + name + ", traceId=" + traceId() + ", spanId=" + spanId() + "}";
  }
}
