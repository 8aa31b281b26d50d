/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.resource;

import java.util.List;

/**
 * A structured condition, such as a DynamoDB key condition built with a client's expression DSL
 * instead of a literal expression string.
 *
 * @see Expressions#toExpressionString(Object)
 */
public interface ConditionExpression {
  /** Template such as {@code {0} = {1}}. */
  String format();

  /** Operator such as {@code =} or {@code AND}. */
  String operator();

  /** Operands, which may be nested conditions. */
  List<?> values();
}
