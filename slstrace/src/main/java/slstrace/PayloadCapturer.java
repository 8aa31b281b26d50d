/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import slstrace.internal.Nullable;
import slstrace.internal.codec.JsonWriter;
import slstrace.internal.codec.WriteBuffer;

/**
 * Records request and response bodies on spans, up to {@link #maxBodyByteLength()} UTF-8 bytes.
 *
 * <p>A larger body is not recorded: the span is marked {@link TraceSpan#inputTooLarge() too large}
 * and a notice {@value #LARGE_BODY_MESSAGE} is emitted. Bytes that are not valid UTF-8 are
 * skipped without any event.
 *
 * <p>Every method returns true only if the body was recorded, and none of them throw.
 */
public final class PayloadCapturer {
  /** 127 KiB leaves room for the rest of a span record in a 128 KiB payload. */
  public static final int DEFAULT_MAX_BODY_BYTE_LENGTH = 127 * 1024;
  static final String LARGE_BODY_MESSAGE = "Large body excluded";

  final CapturedEvents capturedEvents;
  final int maxBodyByteLength;
  final boolean enabled;

  PayloadCapturer(CapturedEvents capturedEvents, int maxBodyByteLength, boolean enabled) {
    this.capturedEvents = capturedEvents;
    this.maxBodyByteLength = maxBodyByteLength;
    this.enabled = enabled;
  }

  public int maxBodyByteLength() {
    return maxBodyByteLength;
  }

  /** False when request and response capture is disabled. All captures are then no-ops. */
  public boolean isEnabled() {
    return enabled;
  }

  /** Returns true if a body of the declared byte length would not be recorded. */
  public boolean exceedsLimit(long declaredLength) {
    return declaredLength > maxBodyByteLength;
  }

  public boolean captureInput(TraceSpan span, @Nullable byte[] body) {
    return capture(span, body, true);
  }

  public boolean captureInput(TraceSpan span, @Nullable CharSequence body) {
    return capture(span, body, true);
  }

  public boolean captureOutput(TraceSpan span, @Nullable byte[] body) {
    return capture(span, body, false);
  }

  public boolean captureOutput(TraceSpan span, @Nullable CharSequence body) {
    return capture(span, body, false);
  }

  /**
   * Like {@link #captureOutput(TraceSpan, byte[])}, for responses whose length is known before
   * the body is read. When the declared length exceeds the limit the body is not inspected.
   */
  public boolean captureOutput(TraceSpan span, long declaredLength, @Nullable byte[] body) {
    if (!enabled || span == null) return false;
    if (exceedsLimit(declaredLength)) {
      tooLarge(span, false);
      return false;
    }
    return capture(span, body, false);
  }

  boolean capture(TraceSpan span, @Nullable byte[] body, boolean input) {
    if (!enabled || span == null || body == null || body.length == 0) return false;
    if (exceedsLimit(body.length)) {
      tooLarge(span, input);
      return false;
    }
    String decoded = decodeUtf8(body);
    if (decoded == null) return false;
    return store(span, decoded, input);
  }

  boolean capture(TraceSpan span, @Nullable CharSequence body, boolean input) {
    if (!enabled || span == null || body == null || body.length() == 0) return false;
    if (exceedsLimit(WriteBuffer.utf8SizeInBytes(body))) {
      tooLarge(span, input);
      return false;
    }
    return store(span, body.toString(), input);
  }

  boolean store(TraceSpan span, String body, boolean input) {
    if (span.isClosed()) {
      span.reportClosed(input ? "input" : "output");
      return false;
    }
    if (input) {
      span.input(body);
    } else {
      span.output(body);
    }
    return true;
  }

  void tooLarge(TraceSpan span, boolean input) {
    boolean marked = input ? span.markInputTooLarge() : span.markOutputTooLarge();
    if (!marked) return;
    capturedEvents.reportNotice(LARGE_BODY_MESSAGE,
      input ? "INPUT_BODY_TOO_LARGE" : "OUTPUT_BODY_TOO_LARGE", span);
  }

  /** Returns null unless the bytes are well-formed UTF-8. */
  @Nullable static String decodeUtf8(byte[] body) {
    try {
      return JsonWriter.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(body))
        .toString();
    } catch (CharacterCodingException e) {
      return null;
    }
  }

  @Override public String toString() {
    return "PayloadCapturer{maxBodyByteLength=" + maxBodyByteLength + ", enabled=" + enabled + "}";
  }
}
