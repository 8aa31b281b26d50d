/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.aws.sdk;

import slstrace.CapturedEvents;
import slstrace.internal.Nullable;
import slstrace.internal.codec.JsonValues;

import static slstrace.internal.Throwables.propagateIfFatal;

/** Writes call data as JSON, or warns and returns null when it holds unsupported values. */
final class SafeStringify {
  static final String NON_SERIALIZABLE_VALUE = "AWS_SDK_NON_SERIALIZABLE_VALUE";

  @Nullable static String stringify(@Nullable Object value, CapturedEvents capturedEvents) {
    try {
      return JsonValues.toJson(value);
    } catch (Throwable t) {
      propagateIfFatal(t);
      capturedEvents.reportWarning("Detected not serializable value in AWS SDK request:\n"
        + "\tvalue: " + describe(value) + "\n"
        + "\terror: " + describe(t), NON_SERIALIZABLE_VALUE);
      return null;
    }
  }

  /** Returns {@code toString()}, or the type name if that fails. */
  static String describe(@Nullable Object value) {
    if (value == null) return "null";
    try {
      return value.toString();
    } catch (Throwable t) {
      propagateIfFatal(t);
      return value.getClass().getName();
    }
  }

  SafeStringify() {
  }
}
