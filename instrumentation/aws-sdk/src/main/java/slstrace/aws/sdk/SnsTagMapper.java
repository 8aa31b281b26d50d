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
 * Tags SNS calls with the topic name and the IDs of published messages, under
 * {@code aws.sdk.sns}.
 *
 * <p>Responses of calls that publish nothing, such as {@code CreateTopic}, leave
 * {@code message_ids} unset.
 */
final class SnsTagMapper extends ServiceTagMapper {
  SnsTagMapper() {
    super("sns");
  }

  @Override public void params(TraceSpan span, Map<String, ?> input) {
    Map<String, Object> tags = new LinkedHashMap<>();
    tags.put("message_ids", Collections.emptyList());
    if (input.get("TopicArn") != null) {
      tags.put("topic_name", lastSegment(input.get("TopicArn"), ':'));
    }
    span.tags().update(tags, tagPrefix);
  }

  @Override public void responseData(TraceSpan span, Map<String, ?> output) {
    span.tags().delete(tagPrefix + ".message_ids");
    Map<String, Object> tags = new LinkedHashMap<>();
    if (output.get("TopicArn") != null) {
      tags.put("topic_name", lastSegment(output.get("TopicArn"), ':'));
    }
    if (output.get("MessageId") != null) {
      tags.put("message_ids", Collections.singletonList(output.get("MessageId")));
    } else if (output.containsKey("Successful")) {
      tags.put("message_ids", messageIds(output.get("Successful")));
    }
    span.tags().update(tags, tagPrefix);
  }
}
