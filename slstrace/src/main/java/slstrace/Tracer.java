/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import slstrace.handler.SpanHandler;
import slstrace.internal.Nullable;
import slstrace.internal.Platform;
import slstrace.propagation.CurrentSpanContext;
import slstrace.propagation.CurrentSpanContext.Scope;

import static slstrace.internal.codec.HexCodec.toLowerHex;

/**
 * Creates {@link TraceSpan spans}.
 *
 * <p>Ex. a span around a downstream call
 * <pre>{@code
 * TraceSpan span = tracer.startSpan("svc.call");
 * try (Scope scope = tracer.withSpanInScope(span)) {
 *   return callDownstream();
 * } finally {
 *   span.close();
 * }
 * }</pre>
 *
 * @see Tracing#tracer()
 */
public final class Tracer {
  final Clock clock;
  final CapturedEvents capturedEvents;
  final CurrentSpanContext currentSpanContext;
  final SpanHandler spanHandler;
  final Platform platform = Platform.get();
  final Tags customTags;

  Tracer(Clock clock, CapturedEvents capturedEvents, CurrentSpanContext currentSpanContext,
    SpanHandler spanHandler) {
    this.clock = clock;
    this.capturedEvents = capturedEvents;
    this.currentSpanContext = currentSpanContext;
    this.spanHandler = spanHandler;
    this.customTags = new Tags(capturedEvents);
  }

  /**
   * Returns a builder of a span with the given name. Unless {@link SpanBuilder#parent(TraceSpan)}
   * is called, the parent is the {@link #currentSpan() current span}.
   */
  public SpanBuilder spanBuilder(String name) {
    return new SpanBuilder(name);
  }

  /** Starts a span whose parent is the current span, or a root span if there is none. */
  public TraceSpan startSpan(String name) {
    return spanBuilder(name).start();
  }

  /** Starts a span with the given parent, or a root span if the parent is null. */
  public TraceSpan startSpan(String name, @Nullable TraceSpan parent) {
    return spanBuilder(name).parent(parent).start();
  }

  /** Returns the span in scope on this thread, or null. */
  @Nullable public TraceSpan currentSpan() {
    return currentSpanContext.get();
  }

  /**
   * Makes the given span current until the result is closed. Use try-with-resources so the prior
   * span is restored even when an exception is raised.
   */
  public Scope withSpanInScope(@Nullable TraceSpan span) {
    return currentSpanContext.newScope(span);
  }

  public final class SpanBuilder {
    final String name;
    @Nullable TraceSpan parent;
    boolean parentSet;
    @Nullable Long startTime;
    final Map<String, Object> tags = new LinkedHashMap<>();
    final List<String> immediateDescendants = new ArrayList<>();

    SpanBuilder(String name) {
      this.name = name;
    }

    /** Sets the parent, or makes a root span when null. */
    public SpanBuilder parent(@Nullable TraceSpan parent) {
      this.parent = parent;
      this.parentSet = true;
      return this;
    }

    /** Epoch nanoseconds. Defaults to now. */
    public SpanBuilder startTime(long startTime) {
      this.startTime = startTime;
      return this;
    }

    /** Adds a tag. A root span restores these tags when {@link TraceSpan#reset() reset}. */
    public SpanBuilder tag(String key, Object value) {
      tags.put(key, value);
      return this;
    }

    /** Adds each tag. Null is ignored. */
    public SpanBuilder tags(@Nullable Map<String, ?> tags) {
      if (tags != null) this.tags.putAll(tags);
      return this;
    }

    /**
     * Child span names closed when this span closes. A name ending with {@code *} matches any
     * child name starting with what precedes it.
     */
    public SpanBuilder immediateDescendants(String... patterns) {
      for (String pattern : patterns) {
        if (pattern != null) immediateDescendants.add(pattern);
      }
      return this;
    }

    public TraceSpan start() {
      return newSpan(name, parentSet ? parent : currentSpan(),
        startTime != null ? startTime : clock.currentTimeNanoseconds(), tags,
        Collections.unmodifiableList(new ArrayList<>(immediateDescendants)));
    }
  }

  TraceSpan newSpan(@Nullable String name, @Nullable TraceSpan parent, long startTime,
    Map<String, ?> tags, List<String> immediateDescendants) {
    if (!Tags.isValidKey(name)) {
      capturedEvents.reportError(
        new IllegalArgumentException("Invalid span name: '" + name + "'"), ErrorType.USER);
      if (name == null) name = "";
    }
    TraceSpan result = new TraceSpan(this, name, parent, startTime, tags, immediateDescendants);
    if (parent != null) parent.addChild(result);
    spanHandler.begin(result);
    return result;
  }

  void end(TraceSpan span) {
    spanHandler.end(span);
  }

  String nextTraceId() {
    return toLowerHex(platform.nextTraceIdHigh(), nextId());
  }

  String nextSpanId() {
    return toLowerHex(nextId());
  }

  long nextId() {
    long nextId = platform.randomLong();
    while (nextId == 0L) nextId = platform.randomLong();
    return nextId;
  }

  @Override public String toString() {
    return "Tracer{spanHandler=" + spanHandler + ", currentSpanContext=" + currentSpanContext
      + "}";
  }
}
