/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.aws.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import slstrace.TraceSpan;
import slstrace.internal.codec.JsonValues;
import slstrace.resource.Expressions;

/**
 * Tags DynamoDB calls with the table, query shape and result counts, under
 * {@code aws.sdk.dynamodb}.
 *
 * <p>{@code attributes_to_get} is always set, empty unless the call names attributes.
 */
final class DynamoDbTagMapper extends ServiceTagMapper {
  DynamoDbTagMapper() {
    super("dynamodb");
  }

  @Override public void params(TraceSpan span, Map<String, ?> input) {
    Map<String, Object> tags = new LinkedHashMap<>();
    if (input.containsKey("TableName")) {
      tags.put("table_name", input.get("TableName"));
    } else if (input.containsKey("GlobalTableName")) {
      tags.put("table_name", input.get("GlobalTableName"));
    }
    if (input.containsKey("ConsistentRead")) {
      tags.put("consistent_read", input.get("ConsistentRead"));
    }
    if (input.containsKey("Limit")) tags.put("limit", input.get("Limit"));
    Object attributesToGet = input.get("AttributesToGet");
    tags.put("attributes_to_get",
      attributesToGet != null ? attributesToGet : Collections.emptyList());
    if (input.containsKey("ProjectionExpression")) {
      tags.put("projection", Expressions.toExpressionString(input.get("ProjectionExpression")));
    }
    if (input.containsKey("IndexName")) tags.put("index_name", input.get("IndexName"));
    if (input.containsKey("ScanIndexForward")) {
      tags.put("scan_forward", input.get("ScanIndexForward"));
    }
    if (input.containsKey("Select")) {
      tags.put("select", Expressions.toExpressionString(input.get("Select")));
    }
    if (input.containsKey("KeyConditionExpression")) {
      tags.put("key_condition",
        Expressions.toExpressionString(input.get("KeyConditionExpression")));
    }
    if (input.containsKey("FilterExpression")) {
      tags.put("filter", Expressions.toExpressionString(input.get("FilterExpression")));
    }
    if (input.containsKey("Segment")) tags.put("segment", input.get("Segment"));
    if (input.containsKey("TotalSegments")) tags.put("total_segments", input.get("TotalSegments"));
    if (input.containsKey("ExclusiveStartKey")) {
      tags.put("exclusive_start_key", keyString(input.get("ExclusiveStartKey")));
    }
    span.tags().update(tags, tagPrefix);
  }

  @Override public void responseData(TraceSpan span, Map<String, ?> output) {
    Map<String, Object> tags = new LinkedHashMap<>();
    if (output.containsKey("Count")) tags.put("count", output.get("Count"));
    if (output.containsKey("ScannedCount")) tags.put("scanned_count", output.get("ScannedCount"));
    span.tags().update(tags, tagPrefix);
  }

  /** Keys are maps of attribute values, so they are tagged as JSON text. */
  static Object keyString(Object key) {
    if (key == null || key instanceof String) return key;
    return JsonValues.isSerializable(key) ? JsonValues.toJson(key) : key.toString();
  }
}
