/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

/** Value of the {@code error.type} tag of an error event. */
public enum ErrorType {
  /** Misuse of the tracing API, such as an invalid tag or closing a span twice. */
  USER,
  /** A fault inside tracing code or one of its extensions. */
  INTERNAL,
  /** An error the function handled and chose to record with {@link CapturedEvents#captureError}. */
  HANDLED
}
