/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.resource;

import java.util.Iterator;
import java.util.List;
import slstrace.internal.Nullable;

/** Renders expression parameters, such as filters and key conditions, as tag strings. */
public final class Expressions {
  /**
   * Returns strings as-is, a {@link ConditionExpression} as
   * {@code {format=..., operator=..., values=[...]}}, an enum as its name and anything else via
   * {@link Object#toString()}. Returns null for null.
   */
  @Nullable public static String toExpressionString(@Nullable Object expression) {
    if (expression == null) return null;
    if (expression instanceof CharSequence) return expression.toString();
    StringBuilder result = new StringBuilder();
    append(expression, result);
    return result.toString();
  }

  static void append(@Nullable Object value, StringBuilder result) {
    if (value instanceof ConditionExpression) {
      ConditionExpression condition = (ConditionExpression) value;
      result.append("{format=").append(condition.format())
        .append(", operator=").append(condition.operator())
        .append(", values=[");
      List<?> values = condition.values();
      if (values != null) {
        for (Iterator<?> i = values.iterator(); i.hasNext(); ) {
          append(i.next(), result);
          if (i.hasNext()) result.append(", ");
        }
      }
      result.append("]}");
    } else if (value instanceof Enum) {
      result.append(((Enum<?>) value).name());
    } else {
      result.append(value);
    }
  }

  Expressions() {
  }
}
