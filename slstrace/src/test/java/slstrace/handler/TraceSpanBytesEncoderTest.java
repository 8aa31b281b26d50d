/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.handler;

import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.After;
import org.junit.Test;
import slstrace.TraceSpan;
import slstrace.Tracer;
import slstrace.Tracing;
import zipkin2.codec.Encoding;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

public class TraceSpanBytesEncoderTest {
  AtomicLong nanos = new AtomicLong(1_000L);
  Tracing tracing = Tracing.newBuilder()
    .clock(nanos::get)
    .capturedEventsStdout(false)
    .maxBodyByteLength(4)
    .build();
  Tracer tracer = tracing.tracer();

  @After public void close() {
    tracing.close();
  }

  @Test public void encoding() {
    assertThat(TraceSpanBytesEncoder.JSON.encoding()).isEqualTo(Encoding.JSON);
  }

  @Test public void openSpan_omitsAbsentFields() {
    TraceSpan span = tracer.startSpan("svc.request");

    assertThat(new String(TraceSpanBytesEncoder.JSON.encode(span), UTF_8)).isEqualTo(
      "{\"name\":\"svc.request\",\"traceId\":\"" + span.traceId() + "\",\"spanId\":\""
        + span.spanId() + "\",\"startTime\":1000,\"tags\":{},\"children\":[]}");
  }

  @Test public void tree() {
    TraceSpan root = tracer.spanBuilder("svc.request").tag("http.method", "GET").start();
    TraceSpan call = tracer.startSpan("svc.call", root);
    call.tags().set("ids", Arrays.asList("a", "b"));
    call.tags().set("at", Instant.ofEpochSecond(1));
    call.input("in");
    nanos.set(3_000L);
    call.close();
    root.close();

    String traceId = root.traceId();
    assertThat(new String(TraceSpanBytesEncoder.JSON.encode(root), UTF_8)).isEqualTo(
      "{\"name\":\"svc.request\",\"traceId\":\"" + traceId + "\",\"spanId\":\"" + root.spanId()
        + "\",\"startTime\":1000,\"endTime\":3000,\"tags\":{\"http.method\":\"GET\"},"
        + "\"children\":[{\"name\":\"svc.call\",\"traceId\":\"" + traceId + "\",\"spanId\":\""
        + call.spanId() + "\",\"parentId\":\"" + root.spanId() + "\",\"startTime\":1000,"
        + "\"endTime\":3000,\"input\":\"in\",\"tags\":{\"ids\":[\"a\",\"b\"],"
        + "\"at\":\"1970-01-01T00:00:01Z\"},\"children\":[]}]}");
  }

  @Test public void tooLargePayload_isFlagged() {
    TraceSpan span = tracer.startSpan("svc.request");
    tracing.payloadCapturer().captureOutput(span, "too large");

    assertThat(new String(TraceSpanBytesEncoder.JSON.encode(span), UTF_8))
      .contains("\"outputTooLarge\":true")
      .doesNotContain("\"output\":");
  }

  @Test public void sizeInBytes_matchesEncode() {
    TraceSpan span =
      tracer.spanBuilder("svc.request").tag("message", "caf\u00e9 \"quoted\"").start();
    tracer.startSpan("svc.call", span).tags().set("ratio", 0.5d);

    assertThat(TraceSpanBytesEncoder.JSON.sizeInBytes(span))
      .isEqualTo(TraceSpanBytesEncoder.JSON.encode(span).length);
  }

  @Test public void encodeList() {
    TraceSpan one = tracer.startSpan("one", null), two = tracer.startSpan("two", null);

    String json = new String(TraceSpanBytesEncoder.JSON.encodeList(Arrays.asList(one, two)), UTF_8);

    assertThat(json).startsWith("[{\"name\":\"one\"").contains("},{\"name\":\"two\"").endsWith("}]");
  }

  @Test public void customTags_writtenOnRootOnly() {
    tracing.customTags().set("user.plan", "premium");
    TraceSpan root = tracer.startSpan("svc.request");
    TraceSpan call = tracer.startSpan("svc.call", root);

    assertThat(new String(TraceSpanBytesEncoder.JSON.encode(root), UTF_8))
      .contains("\"tags\":{},\"customTags\":{\"user.plan\":\"premium\"},\"children\":[{");
    assertThat(new String(TraceSpanBytesEncoder.JSON.encode(call), UTF_8))
      .doesNotContain("customTags");
  }
}
