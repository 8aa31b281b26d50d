/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal;

import slstrace.Clock;

/**
 * Monotonic nanoseconds anchored to the epoch once, when this clock is created. Wall clock jumps
 * (NTP, manual changes) during an invocation do not affect span durations.
 */
final class TickClock implements Clock {
  final Platform platform;
  final long baseEpochNanos;
  final long baseTickNanos;

  TickClock(Platform platform, long baseEpochNanos, long baseTickNanos) {
    this.platform = platform;
    this.baseEpochNanos = baseEpochNanos;
    this.baseTickNanos = baseTickNanos;
  }

  @Override public long currentTimeNanoseconds() {
    return (platform.nanoTime() - baseTickNanos) + baseEpochNanos;
  }

  @Override public String toString() {
    return "TickClock{"
      + "baseEpochNanos=" + baseEpochNanos + ", "
      + "baseTickNanos=" + baseTickNanos
      + "}";
  }
}
