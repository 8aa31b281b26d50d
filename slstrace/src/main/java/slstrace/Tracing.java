/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

import java.io.Closeable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import slstrace.handler.SpanHandler;
import slstrace.handler.StdoutEventReporter;
import slstrace.internal.Nullable;
import slstrace.internal.Platform;
import slstrace.internal.handler.SafeSpanHandler;
import slstrace.propagation.CurrentSpanContext;
import slstrace.propagation.ThreadLocalCurrentSpanContext;
import slstrace.resource.ResourceTagMappers;
import zipkin2.reporter.Reporter;

/**
 * This provides utilities needed for tracing a function invocation: a {@link #tracer() tracer} of
 * spans, the {@link #capturedEvents() event emitter} and helpers used by instrumentation.
 *
 * <p>This type can be extended so that the object graph can be built differently or overridden,
 * for example via dependency injection.
 */
public abstract class Tracing implements Closeable {
  static final AtomicReference<Tracing> CURRENT = new AtomicReference<>();

  public static Builder newBuilder() {
    return new Builder();
  }

  /** All tracing commands start with a {@link TraceSpan}. Use a tracer to create spans. */
  public abstract Tracer tracer();

  /** Emits errors, warnings and notices. */
  public abstract CapturedEvents capturedEvents();

  /** Records request and response bodies within the configured size limit. */
  public abstract PayloadCapturer payloadCapturer();

  /**
   * Tags describing the function as a whole, such as a tenant or feature flag, exported with each
   * root span. Keys and values are validated like span tags; invalid ones are reported as
   * {@link ErrorType#USER} errors.
   *
   * <p>Ex.
   * <pre>{@code
   * tracing.customTags().set("user.plan", "premium");
   * }</pre>
   */
  public abstract Tags customTags();

  /** Tags spans of calls to resources, such as DynamoDB tables, by resource type. */
  public abstract ResourceTagMappers resourceTagMappers();

  /** This supports in-process propagation, typically across thread boundaries. */
  public abstract CurrentSpanContext currentSpanContext();

  /** The clock of span and event timestamps. */
  public abstract Clock clock();

  /**
   * Returns the most recently created tracing component iff it hasn't been closed. null
   * otherwise.
   *
   * <p>This object should not be cached.
   */
  @Nullable public static Tracing current() {
    return CURRENT.get();
  }

  /**
   * Returns the most recently created tracer if its component hasn't been closed. null
   * otherwise.
   *
   * <p>This object should not be cached.
   */
  @Nullable public static Tracer currentTracer() {
    Tracing tracing = current();
    return tracing != null ? tracing.tracer() : null;
  }

  /** Ensures this no longer is the {@link #current() current tracing object}. */
  @Override public abstract void close();

  public static final class Builder {
    Clock clock;
    CurrentSpanContext currentSpanContext = ThreadLocalCurrentSpanContext.create();
    @Nullable Reporter<CapturedEvent> eventReporter;
    boolean capturedEventsStdout = true, captureRequestResponse = true;
    int maxBodyByteLength = PayloadCapturer.DEFAULT_MAX_BODY_BYTE_LENGTH;
    Set<SpanHandler> spanHandlers = new LinkedHashSet<>(); // dupes not ok

    Builder() {
    }

    /** Returns an immutable copy of the current {@linkplain #addSpanHandler(SpanHandler)}. */
    public Set<SpanHandler> spanHandlers() {
      return Collections.unmodifiableSet(new LinkedHashSet<>(spanHandlers));
    }

    /**
     * Assigns the epoch nanosecond clock. Defaults to a monotonic clock anchored to the epoch when
     * the tracing component is built.
     */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /** Responsible for implementing {@link Tracer#currentSpan()}. Defaults to thread-local. */
    public Builder currentSpanContext(CurrentSpanContext currentSpanContext) {
      if (currentSpanContext == null) {
        throw new NullPointerException("currentSpanContext == null");
      }
      this.currentSpanContext = currentSpanContext;
      return this;
    }

    /**
     * Receives captured events. Defaults to {@link StdoutEventReporter}, or dropping events when
     * {@linkplain #capturedEventsStdout(boolean) stdout} is disabled.
     */
    public Builder eventReporter(Reporter<CapturedEvent> eventReporter) {
      if (eventReporter == null) throw new NullPointerException("eventReporter == null");
      this.eventReporter = eventReporter;
      return this;
    }

    /** When false and no {@link #eventReporter} is set, events are dropped. Defaults to true. */
    public Builder capturedEventsStdout(boolean capturedEventsStdout) {
      this.capturedEventsStdout = capturedEventsStdout;
      return this;
    }

    /** When false, no request or response bodies are recorded. Defaults to true. */
    public Builder captureRequestResponse(boolean captureRequestResponse) {
      this.captureRequestResponse = captureRequestResponse;
      return this;
    }

    /** Bodies larger than this many UTF-8 bytes are not recorded. Defaults to 127 KiB. */
    public Builder maxBodyByteLength(int maxBodyByteLength) {
      if (maxBodyByteLength < 0) {
        throw new IllegalArgumentException("maxBodyByteLength < 0: " + maxBodyByteLength);
      }
      this.maxBodyByteLength = maxBodyByteLength;
      return this;
    }

    /**
     * Adds a handler of span lifecycle events, invoked in the order added.
     *
     * @see slstrace.handler.ZipkinSpanHandler
     */
    public Builder addSpanHandler(SpanHandler spanHandler) {
      if (spanHandler == null) throw new NullPointerException("spanHandler == null");

      // Some configuration can coerce to no-op, ignore in this case.
      if (spanHandler == SpanHandler.NOOP) return this;

      if (!spanHandlers.add(spanHandler)) {
        Platform.get().log("Please check configuration as {0} was added twice", spanHandler, null);
      }
      return this;
    }

    public Tracing build() {
      return new Default(this);
    }
  }

  static final class Default extends Tracing {
    final Clock clock;
    final CurrentSpanContext currentSpanContext;
    final CapturedEvents capturedEvents;
    final PayloadCapturer payloadCapturer;
    final ResourceTagMappers resourceTagMappers;
    final Tracer tracer;

    Default(Builder builder) {
      this.clock = builder.clock != null ? builder.clock : Platform.get().clock();
      this.currentSpanContext = builder.currentSpanContext;

      Reporter<CapturedEvent> eventReporter = builder.eventReporter;
      if (eventReporter == null) {
        eventReporter = builder.capturedEventsStdout
          ? StdoutEventReporter.create()
          : CapturedEvents.NOOP_REPORTER;
      }
      this.capturedEvents = new CapturedEvents(eventReporter, clock, currentSpanContext);
      this.payloadCapturer = new PayloadCapturer(capturedEvents, builder.maxBodyByteLength,
        builder.captureRequestResponse);
      this.resourceTagMappers = new ResourceTagMappers(capturedEvents);

      SpanHandler spanHandler = SafeSpanHandler.create(
        builder.spanHandlers.toArray(new SpanHandler[0]), capturedEvents);
      this.tracer = new Tracer(clock, capturedEvents, currentSpanContext, spanHandler);
      // assign current IFF there's no instance already current
      CURRENT.compareAndSet(null, this);
    }

    @Override public Tracer tracer() {
      return tracer;
    }

    @Override public Tags customTags() {
      return tracer.customTags;
    }

    @Override public CapturedEvents capturedEvents() {
      return capturedEvents;
    }

    @Override public PayloadCapturer payloadCapturer() {
      return payloadCapturer;
    }

    @Override public ResourceTagMappers resourceTagMappers() {
      return resourceTagMappers;
    }

    @Override public CurrentSpanContext currentSpanContext() {
      return currentSpanContext;
    }

    @Override public Clock clock() {
      return clock;
    }

    @Override public String toString() {
      return tracer.toString();
    }

    @Override public void close() {
      // only set null if we are the outer-most instance
      CURRENT.compareAndSet(this, null);
    }
  }

  Tracing() { // intentionally hidden constructor
  }
}
