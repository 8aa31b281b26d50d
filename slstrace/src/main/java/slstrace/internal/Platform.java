/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import slstrace.Clock;

/**
 * Access to platform-specific features.
 *
 * <p>Note: Logging is centralized here to avoid classloader problems.
 *
 * <p>Originally designed by OkHttp team, derived from {@code okhttp3.internal.platform.Platform}
 */
public class Platform {
  private static final Platform PLATFORM = new Platform();
  private static final Logger LOG = Logger.getLogger(slstrace.Tracer.class.getName());

  public static Platform get() {
    return PLATFORM;
  }

  /** Like {@link Logger#log(Level, String)} */
  public void log(String msg, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LOG.log(Level.FINE, msg, thrown);
  }

  /** Like {@link Logger#log(Level, String, Object)}, except with a throwable arg */
  public void log(String msg, Object param1, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LogRecord lr = new LogRecord(Level.FINE, msg);
    Object[] params = {param1};
    lr.setParameters(params);
    if (thrown != null) lr.setThrown(thrown);
    LOG.log(lr);
  }

  /**
   * Last resort for diagnostics that could not be reported as captured events, for example when
   * the event reporter itself failed. Logged at warning so the default console handler prints it.
   */
  public void warn(String msg, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.WARNING)) return;
    LOG.log(Level.WARNING, msg, thrown);
  }

  public AssertionError assertionError(String message, Throwable cause) {
    return new AssertionError(message, cause);
  }

  /**
   * This class uses pseudo-random number generators to provision IDs.
   *
   * <p>This optimizes speed over full coverage of 64-bits, which is why it doesn't share a
   * {@link java.security.SecureRandom}.
   */
  public long randomLong() {
    return ThreadLocalRandom.current().nextLong();
  }

  /**
   * Returns the high 8-bytes for 128-bit trace IDs.
   *
   * <p>The upper 4-bytes are epoch seconds and the lower 4-bytes are random. This makes it
   * convertible to <a href="https://docs.aws.amazon.com/xray/latest/devguide/xray-api-sendingdata.html#xray-api-traceids">Amazon
   * X-Ray trace ID format v1</a>.
   */
  public long nextTraceIdHigh() {
    return nextTraceIdHigh(currentTimeMillis(), ThreadLocalRandom.current().nextInt());
  }

  static long nextTraceIdHigh(long epochMillis, int random) {
    long epochSeconds = epochMillis / 1000;
    return (epochSeconds & 0xffffffffL) << 32 | (random & 0xffffffffL);
  }

  public long nanoTime() {
    return System.nanoTime();
  }

  public long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  /** Returns a monotonic clock whose readings are epoch nanoseconds at creation time. */
  public Clock clock() {
    return new TickClock(this, TimeUnit.MILLISECONDS.toNanos(currentTimeMillis()), nanoTime());
  }
}
