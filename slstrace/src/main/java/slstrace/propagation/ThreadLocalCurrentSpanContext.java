/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.propagation;

import slstrace.TraceSpan;
import slstrace.internal.Nullable;

/**
 * In-process span context, one slot per thread. Spans are not carried to child threads unless a
 * task is {@link #wrap(Runnable) wrapped}.
 *
 * <p>Each instance has its own slot, so separate {@link slstrace.Tracing} instances do not see
 * each other's current span.
 */
public class ThreadLocalCurrentSpanContext extends CurrentSpanContext {
  public static CurrentSpanContext create() {
    return new ThreadLocalCurrentSpanContext();
  }

  @SuppressWarnings("ThreadLocalUsage") // intentional: to support multiple Tracing instances
  final ThreadLocal<TraceSpan> local = new ThreadLocal<>();
  final RevertToNullScope revertToNull = new RevertToNullScope(local);

  /** Clears the span in scope on this thread, for example between invocations. */
  public void clear() {
    local.remove();
  }

  @Override public TraceSpan get() {
    return local.get();
  }

  @Override public Scope newScope(@Nullable TraceSpan currentSpan) {
    final TraceSpan previous = local.get();
    local.set(currentSpan);
    return previous != null ? new RevertToPreviousScope(local, previous) : revertToNull;
  }

  static final class RevertToNullScope implements Scope {
    final ThreadLocal<TraceSpan> local;

    RevertToNullScope(ThreadLocal<TraceSpan> local) {
      this.local = local;
    }

    @Override public void close() {
      local.set(null);
    }
  }

  static final class RevertToPreviousScope implements Scope {
    final ThreadLocal<TraceSpan> local;
    final TraceSpan previous;

    RevertToPreviousScope(ThreadLocal<TraceSpan> local, TraceSpan previous) {
      this.local = local;
      this.previous = previous;
    }

    @Override public void close() {
      local.set(previous);
    }
  }
}
