/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.propagation;

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import slstrace.TraceSpan;
import slstrace.internal.Nullable;

/**
 * This makes a given span the current span, which is the default parent of new spans and the
 * attribution of reported errors and warnings.
 *
 * <p>Callers carry the current span to other threads explicitly, using {@link #wrap(Runnable)},
 * {@link #wrap(Callable)} or {@link #executor(Executor)}.
 *
 * <p>Ex.
 * <pre>{@code
 * try (Scope scope = currentSpanContext.newScope(span)) {
 *   return inWithNewSpan.get();
 * }
 * }</pre>
 *
 * @see ThreadLocalCurrentSpanContext
 */
public abstract class CurrentSpanContext {
  /** Returns the current span in scope or null if there isn't one. */
  public abstract @Nullable TraceSpan get();

  /**
   * Sets the current span in scope until the returned object is closed. It is a programming error
   * to drop or never close the result.
   *
   * @param currentSpan span to place into scope or null to clear the scope
   * @return an object that reverts to the prior span on {@link Scope#close()}
   */
  public abstract Scope newScope(@Nullable TraceSpan currentSpan);

  /**
   * Like {@link #newScope(TraceSpan)}, except returns {@link Scope#NOOP} if the given span is
   * already in scope.
   */
  public Scope maybeScope(@Nullable TraceSpan currentSpan) {
    TraceSpan currentScope = get();
    if (currentSpan == null) {
      if (currentScope == null) return Scope.NOOP;
      return newScope(null);
    }
    return currentSpan == currentScope ? Scope.NOOP : newScope(currentSpan);
  }

  /** A span remains in the scope it was bound to until close is called. */
  public interface Scope extends Closeable {
    /** A scope that does nothing on close. */
    Scope NOOP = new Scope() {
      @Override public void close() {
      }

      @Override public String toString() {
        return "NoopScope";
      }
    };

    /** No exceptions are thrown when unbinding a span scope. */
    @Override void close();
  }

  /** Wraps the input so that it executes with the same span as now. */
  public <C> Callable<C> wrap(final Callable<C> task) {
    final TraceSpan invocationSpan = get();
    class CurrentSpanContextCallable implements Callable<C> {
      @Override public C call() throws Exception {
        try (Scope scope = maybeScope(invocationSpan)) {
          return task.call();
        }
      }
    }
    return new CurrentSpanContextCallable();
  }

  /** Wraps the input so that it executes with the same span as now. */
  public Runnable wrap(final Runnable task) {
    final TraceSpan invocationSpan = get();
    class CurrentSpanContextRunnable implements Runnable {
      @Override public void run() {
        try (Scope scope = maybeScope(invocationSpan)) {
          task.run();
        }
      }
    }
    return new CurrentSpanContextRunnable();
  }

  /**
   * Decorates the input such that the {@link #get() current span} at the time a task is
   * scheduled is made current when the task is executed.
   */
  public Executor executor(final Executor delegate) {
    class CurrentSpanContextExecutor implements Executor {
      @Override public void execute(Runnable task) {
        delegate.execute(CurrentSpanContext.this.wrap(task));
      }
    }
    return new CurrentSpanContextExecutor();
  }
}
