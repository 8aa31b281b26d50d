/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.aws.sdk;

import java.util.Arrays;
import java.util.Collections;
import org.junit.After;
import org.junit.Test;
import slstrace.TraceSpan;
import slstrace.Tracing;

import static org.assertj.core.api.Assertions.assertThat;

public class SnsTagMapperTest {
  static final String TOPIC_ARN = "arn:aws:sns:us-east-1:123456789012:order-events";

  Tracing tracing = Tracing.newBuilder().capturedEventsStdout(false).build();
  TraceSpan span = tracing.tracer().startSpan("aws.sdk.sns.publish");
  SnsTagMapper mapper = new SnsTagMapper();

  @After public void close() {
    tracing.close();
  }

  @Test public void params_topicArn() {
    mapper.params(span, Collections.singletonMap("TopicArn", TOPIC_ARN));

    assertThat(span.tags().get("aws.sdk.sns.topic_name")).isEqualTo("order-events");
    assertThat(span.tags().get("aws.sdk.sns.message_ids")).isEqualTo(Collections.emptyList());
  }

  @Test public void response_messageId() {
    mapper.params(span, Collections.singletonMap("TopicArn", TOPIC_ARN));
    mapper.responseData(span, Collections.singletonMap("MessageId", "m1"));

    assertThat(span.tags().get("aws.sdk.sns.message_ids")).isEqualTo(Arrays.asList("m1"));
  }

  @Test public void response_publishBatch() {
    mapper.responseData(span, Collections.singletonMap("Successful", Arrays.asList(
      Collections.singletonMap("MessageId", "m1"),
      Collections.singletonMap("MessageId", "m2")
    )));

    assertThat(span.tags().get("aws.sdk.sns.message_ids")).isEqualTo(Arrays.asList("m1", "m2"));
  }

  @Test public void response_withoutMessages_leavesIdsUnset() {
    mapper.params(span, Collections.singletonMap("TopicArn", TOPIC_ARN));
    mapper.responseData(span, Collections.singletonMap("TopicArn", TOPIC_ARN));

    assertThat(span.tags().contains("aws.sdk.sns.message_ids")).isFalse();
    assertThat(span.tags().get("aws.sdk.sns.topic_name")).isEqualTo("order-events");
  }
}
