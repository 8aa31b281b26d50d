/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.handler;

import java.io.PrintStream;
import java.util.Arrays;
import slstrace.CapturedEvent;
import zipkin2.codec.BytesEncoder;
import zipkin2.reporter.Reporter;

/**
 * Writes each captured event as one JSON line, where a log collector can pick it up. This is the
 * default event reporter.
 */
public final class StdoutEventReporter implements Reporter<CapturedEvent> {
  public static StdoutEventReporter create() {
    return new StdoutEventReporter(System.out, CapturedEventBytesEncoder.JSON);
  }

  public static StdoutEventReporter create(PrintStream out) {
    if (out == null) throw new NullPointerException("out == null");
    return new StdoutEventReporter(out, CapturedEventBytesEncoder.JSON);
  }

  final PrintStream out;
  final BytesEncoder<CapturedEvent> encoder;

  StdoutEventReporter(PrintStream out, BytesEncoder<CapturedEvent> encoder) {
    this.out = out;
    this.encoder = encoder;
  }

  /** Writes the UTF-8 encoded record and a line feed, regardless of the stream's charset. */
  @Override public void report(CapturedEvent event) {
    byte[] json = encoder.encode(event);
    byte[] line = Arrays.copyOf(json, json.length + 1);
    line[json.length] = '\n';
    out.write(line, 0, line.length);
    out.flush();
  }

  @Override public String toString() {
    return "StdoutEventReporter{}";
  }
}
