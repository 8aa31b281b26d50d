/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.aws.sdk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.After;
import org.junit.Test;
import slstrace.CapturedEvent;
import slstrace.TraceSpan;
import slstrace.Tracing;
import slstrace.handler.SpanHandler;
import slstrace.propagation.CurrentSpanContext.Scope;
import slstrace.resource.ResourceTagMapper;

import static org.assertj.core.api.Assertions.assertThat;

public class AwsSdkTracingTest {
  List<CapturedEvent> events = new ArrayList<>();
  List<TraceSpan> started = new ArrayList<>(), finished = new ArrayList<>();
  Tracing tracing = Tracing.newBuilder()
    .eventReporter(events::add)
    .addSpanHandler(new SpanHandler() {
      @Override public boolean begin(TraceSpan span) {
        return started.add(span);
      }

      @Override public boolean end(TraceSpan span) {
        return finished.add(span);
      }
    })
    .build();
  AwsSdkTracing awsSdkTracing = AwsSdkTracing.create(tracing);

  @After public void close() {
    tracing.close();
  }

  @Test public void registersDefaultMappers() {
    assertThat(tracing.resourceTagMappers().get("dynamodb")).isInstanceOf(DynamoDbTagMapper.class);
    assertThat(tracing.resourceTagMappers().get("sqs")).isInstanceOf(SqsTagMapper.class);
    assertThat(tracing.resourceTagMappers().get("sns")).isInstanceOf(SnsTagMapper.class);
  }

  @Test public void keepsRegisteredMapper() {
    ResourceTagMapper custom = new ResourceTagMapper() {
      @Override public void params(TraceSpan span, Map<String, ?> input) {
      }

      @Override public void responseData(TraceSpan span, Map<String, ?> output) {
      }
    };
    tracing.resourceTagMappers().register("sqs", custom);

    AwsSdkTracing.create(tracing);

    assertThat(tracing.resourceTagMappers().get("sqs")).isSameAs(custom);
  }

  @Test public void registerDefaultMappers_false() {
    try (Tracing other = Tracing.newBuilder().capturedEventsStdout(false).build()) {
      AwsSdkTracing.newBuilder(other).registerDefaultMappers(false).build();

      assertThat(other.resourceTagMappers().get("dynamodb")).isNull();
    }
  }

  @Test public void startCall_nameAndTags() {
    TraceSpan span = awsSdkTracing.startCall("DynamoDB", "PutItem", "us-east-1",
      Collections.singletonMap("TableName", "Users"));

    assertThat(span.name()).isEqualTo("aws.sdk.dynamodb.putitem");
    assertThat(span.tags().asMap()).containsEntry("aws.sdk.region", "us-east-1")
      .containsEntry("aws.sdk.signature_version", "v4")
      .containsEntry("aws.sdk.service", "dynamodb")
      .containsEntry("aws.sdk.operation", "putitem")
      .containsEntry("aws.sdk.dynamodb.table_name", "Users");
    assertThat(span.input()).isEqualTo("{\"TableName\":\"Users\"}");
    assertThat(started).containsExactly(span);
  }

  @Test public void startCall_normalizesNames() {
    TraceSpan span = awsSdkTracing.startCall("Api Gateway", "Get-Rest-Apis", null,
      Collections.<String, Object>emptyMap());

    assertThat(span.name()).isEqualTo("aws.sdk.api_gateway.get_rest_apis");
    assertThat(span.tags().contains("aws.sdk.region")).isFalse();
  }

  @Test public void startCall_childOfCurrentSpan() {
    TraceSpan parent = tracing.tracer().startSpan("aws.lambda.invocation");
    TraceSpan span;
    try (Scope scope = tracing.tracer().withSpanInScope(parent)) {
      span = awsSdkTracing.startCall("SQS", "SendMessage", "us-east-1",
        Collections.<String, Object>emptyMap());
    }

    assertThat(span.parent()).isSameAs(parent);
    assertThat(span.traceId()).isEqualTo(parent.traceId());
    assertThat(parent.children()).containsExactly(span);
  }

  @Test public void finishCall_response() {
    TraceSpan span = awsSdkTracing.startCall("DynamoDB", "Query", "us-east-1",
      Collections.singletonMap("TableName", "Users"));

    awsSdkTracing.finishCall(span, "req-1", Collections.singletonMap("Count", 3));

    assertThat(span.isClosed()).isTrue();
    assertThat(span.tags().asMap()).containsEntry("aws.sdk.request_id", "req-1")
      .containsEntry("aws.sdk.dynamodb.count", 3);
    assertThat(span.output()).isEqualTo("{\"Count\":3}");
    assertThat(finished).containsExactly(span);
    assertThat(events).isEmpty();
  }

  @Test public void finishCall_error() {
    TraceSpan span = awsSdkTracing.startCall("SNS", "Publish", "us-east-1",
      Collections.<String, Object>emptyMap());

    awsSdkTracing.finishCall(span, "req-2", new IllegalStateException("Topic does not exist"));

    assertThat(span.isClosed()).isTrue();
    assertThat(span.tags().asMap()).containsEntry("aws.sdk.request_id", "req-2")
      .containsEntry("aws.sdk.error", "Topic does not exist");
    assertThat(span.output()).isNull();
  }

  @Test public void finishCall_errorWithoutMessage() {
    TraceSpan span = awsSdkTracing.startCall("SNS", "Publish", null,
      Collections.<String, Object>emptyMap());

    awsSdkTracing.finishCall(span, null, new IllegalStateException());

    assertThat(span.tags().get("aws.sdk.error"))
      .isEqualTo(IllegalStateException.class.getName());
  }

  @Test public void startCall_nonSerializableParams_warns() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("TableName", "Users");
    params.put("Item", new Object());

    TraceSpan span = awsSdkTracing.startCall("DynamoDB", "PutItem", "us-east-1", params);

    assertThat(span.input()).isNull();
    assertThat(span.tags().get("aws.sdk.dynamodb.table_name")).isEqualTo("Users");
    assertThat(events).hasSize(1);
    CapturedEvent event = events.get(0);
    assertThat(event.kind()).isEqualTo(CapturedEvent.Kind.WARNING);
    assertThat(event.code()).isEqualTo("AWS_SDK_NON_SERIALIZABLE_VALUE");
    assertThat(event.message()).startsWith("Detected not serializable value in AWS SDK request:");
  }

  static final class FailingToString {
    @Override public String toString() {
      throw new IllegalStateException("toString failed");
    }
  }

  @Test public void startCall_paramsFailingToString_warns() {
    TraceSpan span = awsSdkTracing.startCall("SQS", "SendMessage", "us-east-1",
      Collections.singletonMap("Body", new FailingToString()));

    assertThat(span.input()).isNull();
    assertThat(events).extracting(CapturedEvent::code)
      .containsExactly("AWS_SDK_NON_SERIALIZABLE_VALUE");
    assertThat(events.get(0).message())
      .contains("\tvalue: " + Collections.singletonMap("a", 1).getClass().getName());
  }

  @Test public void captureRequestResponse_false() {
    try (Tracing other = Tracing.newBuilder()
      .capturedEventsStdout(false)
      .captureRequestResponse(false)
      .build()) {
      AwsSdkTracing noCapture = AwsSdkTracing.create(other);
      TraceSpan span = noCapture.startCall("SQS", "SendMessage", "us-east-1",
        Collections.singletonMap("QueueName", "orders"));
      noCapture.finishCall(span, "req-3", Collections.singletonMap("MessageId", "m1"));

      assertThat(span.input()).isNull();
      assertThat(span.output()).isNull();
      assertThat(span.tags().get("aws.sdk.sqs.message_ids"))
        .isEqualTo(Collections.singletonList("m1"));
    }
  }

  @Test public void unmappedService_onlyGenericTags() {
    TraceSpan span = awsSdkTracing.startCall("S3", "GetObject", "us-east-1",
      Collections.singletonMap("Bucket", "assets"));
    awsSdkTracing.finishCall(span, "req-4", Collections.singletonMap("ContentLength", 12));

    assertThat(span.tags().asMap()).containsOnlyKeys("aws.sdk.region",
      "aws.sdk.signature_version", "aws.sdk.service", "aws.sdk.operation", "aws.sdk.request_id");
    assertThat(events).isEmpty();
  }
}
