/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.resource;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ExpressionsTest {
  @Test public void string_isUnchanged() {
    assertThat(Expressions.toExpressionString("#id = :id")).isEqualTo("#id = :id");
  }

  @Test public void null_isNull() {
    assertThat(Expressions.toExpressionString(null)).isNull();
  }

  @Test public void enum_isName() {
    assertThat(Expressions.toExpressionString(TimeUnit.SECONDS)).isEqualTo("SECONDS");
  }

  @Test public void other_usesToString() {
    assertThat(Expressions.toExpressionString(42)).isEqualTo("42");
  }

  @Test public void condition_isRenderedRecursively() {
    ConditionExpression id = condition("{0} = {1}", "=", "id", 1);
    ConditionExpression status = condition("{0} = {1}", "=", "status", "ACTIVE");

    assertThat(Expressions.toExpressionString(condition("({0} {operator} {1})", "AND", id, status)))
      .isEqualTo("{format=({0} {operator} {1}), operator=AND, values=["
        + "{format={0} = {1}, operator==, values=[id, 1]}, "
        + "{format={0} = {1}, operator==, values=[status, ACTIVE]}]}");
  }

  static ConditionExpression condition(String format, String operator, Object... values) {
    List<Object> list = Arrays.asList(values);
    return new ConditionExpression() {
      @Override public String format() {
        return format;
      }

      @Override public String operator() {
        return operator;
      }

      @Override public List<?> values() {
        return list;
      }
    };
  }
}
