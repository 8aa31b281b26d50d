/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

/**
 * Epoch nanoseconds used for span start and end times and event timestamps.
 *
 * <p>Implementations should be monotonic within an invocation, so that durations computed from
 * two readings are never negative.
 *
 * @see Tracing.Builder#clock(Clock)
 */
public interface Clock {
  long currentTimeNanoseconds();
}
