/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.aws.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import slstrace.TraceSpan;

/**
 * Tags SQS calls with the queue name and the IDs of sent or received messages, under
 * {@code aws.sdk.sqs}.
 *
 * <p>{@code message_ids} is empty until a response says otherwise.
 */
final class SqsTagMapper extends ServiceTagMapper {
  SqsTagMapper() {
    super("sqs");
  }

  @Override public void params(TraceSpan span, Map<String, ?> input) {
    Map<String, Object> tags = new LinkedHashMap<>();
    tags.put("message_ids", Collections.emptyList());
    if (input.get("QueueUrl") != null) {
      tags.put("queue_name", lastSegment(input.get("QueueUrl"), '/'));
    } else if (input.containsKey("QueueName")) {
      tags.put("queue_name", input.get("QueueName"));
    }
    span.tags().update(tags, tagPrefix);
  }

  @Override public void responseData(TraceSpan span, Map<String, ?> output) {
    span.tags().delete(tagPrefix + ".message_ids");
    Map<String, Object> tags = new LinkedHashMap<>();
    if (output.get("QueueUrl") != null) {
      tags.put("queue_name", lastSegment(output.get("QueueUrl"), '/'));
    }
    if (output.get("MessageId") != null) {
      tags.put("message_ids", Collections.singletonList(output.get("MessageId")));
    } else if (output.containsKey("Successful")) {
      tags.put("message_ids", messageIds(output.get("Successful")));
    } else if (output.containsKey("Messages")) {
      tags.put("message_ids", messageIds(output.get("Messages")));
    } else {
      tags.put("message_ids", Collections.emptyList());
    }
    span.tags().update(tags, tagPrefix);
  }
}
