/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal;

public final class Throwables {
  // Taken from RxJava throwIfFatal, which was taken from scala
  public static void propagateIfFatal(Throwable t) {
    if (t instanceof VirtualMachineError) {
      throw (VirtualMachineError) t;
    } else if (t instanceof ThreadDeath) {
      throw (ThreadDeath) t;
    } else if (t instanceof LinkageError) {
      throw (LinkageError) t;
    }
  }

  /** Returns the stack trace as it would print, used for the {@code error.stacktrace} tag. */
  public static String stackTraceString(Throwable t) {
    java.io.StringWriter result = new java.io.StringWriter();
    t.printStackTrace(new java.io.PrintWriter(result));
    return result.toString();
  }

  Throwables() {
  }
}
