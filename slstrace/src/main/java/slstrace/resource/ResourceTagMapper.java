/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.resource;

import java.util.Map;
import slstrace.TraceSpan;

/**
 * Translates the request and response of a call to a resource type, such as a DynamoDB table or
 * an SQS queue, into span tags.
 *
 * <p>Call data is keyed by the service's field names, like {@code TableName} or {@code QueueUrl}.
 * Implementations are stateless and write only to {@link TraceSpan#tags()}.
 *
 * @see ResourceTagMappers
 */
public interface ResourceTagMapper {
  /** Tags the span from the parameters of the call. */
  void params(TraceSpan span, Map<String, ?> input);

  /** Tags the span from the successful response of the call. */
  void responseData(TraceSpan span, Map<String, ?> output);
}
