/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import slstrace.handler.SpanHandler;
import slstrace.handler.StdoutEventReporter;
import slstrace.propagation.ThreadLocalCurrentSpanContext;
import slstrace.test.TestSpanHandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TracingTest {
  List<CapturedEvent> events = new ArrayList<>();

  @Test public void current_isFirstUnclosedInstance() {
    try (Tracing tracing = Tracing.newBuilder().build()) {
      try (Tracing second = Tracing.newBuilder().build()) {
        assertThat(Tracing.current()).isSameAs(tracing);
        assertThat(Tracing.currentTracer()).isSameAs(tracing.tracer());
      }
    }
    assertThat(Tracing.current()).isNull();
    assertThat(Tracing.currentTracer()).isNull();
  }

  @Test public void defaults() {
    try (Tracing tracing = Tracing.newBuilder().build()) {
      assertThat(tracing.currentSpanContext()).isInstanceOf(ThreadLocalCurrentSpanContext.class);
      assertThat(tracing.capturedEvents().reporter).isInstanceOf(StdoutEventReporter.class);
      assertThat(tracing.payloadCapturer().maxBodyByteLength()).isEqualTo(127 * 1024);
      assertThat(tracing.payloadCapturer().isEnabled()).isTrue();
      assertThat(tracing.tracer().spanHandler).isSameAs(SpanHandler.NOOP);
    }
  }

  @Test public void capturedEventsStdout_false_dropsEvents() {
    try (Tracing tracing = Tracing.newBuilder().capturedEventsStdout(false).build()) {
      assertThat(tracing.capturedEvents().reporter).isSameAs(CapturedEvents.NOOP_REPORTER);
    }
  }

  @Test public void eventReporter_overridesStdout() {
    try (Tracing tracing = Tracing.newBuilder()
      .capturedEventsStdout(false)
      .eventReporter(events::add)
      .build()) {
      tracing.capturedEvents().reportWarning("hello", null);
    }

    assertThat(events).extracting(CapturedEvent::message).containsExactly("hello");
  }

  @Test public void builder_rejectsInvalidConfiguration() {
    Tracing.Builder builder = Tracing.newBuilder();

    assertThatThrownBy(() -> builder.clock(null)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> builder.eventReporter(null)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> builder.addSpanHandler(null))
      .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> builder.currentSpanContext(null))
      .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> builder.maxBodyByteLength(-1))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test public void addSpanHandler_ignoresNoopAndDuplicates() {
    TestSpanHandler spans = new TestSpanHandler();
    Tracing.Builder builder = Tracing.newBuilder()
      .addSpanHandler(SpanHandler.NOOP)
      .addSpanHandler(spans)
      .addSpanHandler(spans);

    assertThat(builder.spanHandlers()).containsExactly(spans);
  }

  @Test public void spanHandlerFailure_isReportedAndOthersStillRun() {
    TestSpanHandler spans = new TestSpanHandler();
    SpanHandler failing = new SpanHandler() {
      @Override public boolean end(TraceSpan span) {
        throw new IllegalStateException("handler failed");
      }
    };
    try (Tracing tracing = Tracing.newBuilder()
      .eventReporter(events::add)
      .addSpanHandler(failing)
      .addSpanHandler(spans)
      .build()) {
      TraceSpan span = tracing.tracer().startSpan("svc.request");
      span.close();

      assertThat(spans).containsExactly(span);
    }

    assertThat(events).hasSize(1);
    assertThat(events.get(0).message()).isEqualTo("handler failed");
    assertThat(events.get(0).tags()).containsEntry("error.type", "INTERNAL");
  }

  @Test public void spanHandler_returningFalse_skipsRemaining() {
    TestSpanHandler spans = new TestSpanHandler();
    SpanHandler dropping = new SpanHandler() {
      @Override public boolean end(TraceSpan span) {
        return false;
      }
    };
    try (Tracing tracing = Tracing.newBuilder()
      .addSpanHandler(dropping)
      .addSpanHandler(spans)
      .build()) {
      tracing.tracer().startSpan("svc.request").close();
    }

    assertThat(spans).isEmpty();
  }

  @Test public void customTags_validatedLikeSpanTags() {
    try (Tracing tracing = Tracing.newBuilder().eventReporter(events::add).build()) {
      assertThat(tracing.customTags().set("user.plan", "premium")).isTrue();
      assertThat(tracing.customTags().set("Bad Key", "x")).isFalse();

      assertThat(tracing.customTags().asMap()).containsOnlyKeys("user.plan");
      assertThat(tracing.tracer().startSpan("svc.request").customTags())
        .isSameAs(tracing.customTags());
    }

    assertThat(events).hasSize(1);
    assertThat(events.get(0).tags()).containsEntry("error.type", "USER");
  }

  @Test public void customTags_clear() {
    try (Tracing tracing = Tracing.newBuilder().eventReporter(events::add).build()) {
      tracing.customTags().set("user.plan", "premium");

      tracing.customTags().clear();

      assertThat(tracing.customTags().isEmpty()).isTrue();
    }
    assertThat(events).isEmpty();
  }
}
