/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal.codec;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsonValuesTest {
  @Test public void scalars() {
    assertThat(JsonValues.toJson(null)).isEqualTo("null");
    assertThat(JsonValues.toJson("a\"b")).isEqualTo("\"a\\\"b\"");
    assertThat(JsonValues.toJson(true)).isEqualTo("true");
    assertThat(JsonValues.toJson(-12L)).isEqualTo("-12");
    assertThat(JsonValues.toJson(1.5d)).isEqualTo("1.5");
    assertThat(JsonValues.toJson(Double.NaN)).isEqualTo("null");
    assertThat(JsonValues.toJson(new BigInteger("12345678901234567890")))
      .isEqualTo("12345678901234567890");
    assertThat(JsonValues.toJson('x')).isEqualTo("\"x\"");
    assertThat(JsonValues.toJson(TimeUnit.SECONDS)).isEqualTo("\"SECONDS\"");
  }

  @Test public void dates_areIsoStrings() {
    assertThat(JsonValues.toJson(new Date(1000L))).isEqualTo("\"1970-01-01T00:00:01Z\"");
    assertThat(JsonValues.toJson(Instant.ofEpochMilli(1500L)))
      .isEqualTo("\"1970-01-01T00:00:01.500Z\"");
  }

  @Test public void structures() {
    Map<String, Object> key = new LinkedHashMap<>();
    key.put("id", Collections.singletonMap("S", "user-1"));
    key.put("tags", Arrays.asList("a", 1, null));
    key.put("array", new Object[] {true});

    assertThat(JsonValues.toJson(key))
      .isEqualTo("{\"id\":{\"S\":\"user-1\"},\"tags\":[\"a\",1,null],\"array\":[true]}");
  }

  @Test public void unsupportedValues() {
    assertThatThrownBy(() -> JsonValues.toJson(new Object()))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("java.lang.Object");
    assertThat(JsonValues.isSerializable(Arrays.asList("a", new Object()))).isFalse();
    assertThat(JsonValues.isSerializable(Arrays.asList("a", "b"))).isTrue();
  }

  @Test public void cycles_areUnsupported() {
    List<Object> cycle = new ArrayList<>();
    cycle.add(cycle);

    assertThat(JsonValues.isSerializable(cycle)).isFalse();
  }

  @Test public void sizeInBytes_matchesWrite() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("text", "caf\u00e9\u2028\t");
    value.put("emoji", "\ud83d\ude00");
    value.put("numbers", Arrays.asList(Long.MIN_VALUE, 0, 0.25f));

    assertThat(JsonValues.INSTANCE.sizeInBytes(value))
      .isEqualTo(JsonWriter.write(JsonValues.INSTANCE, value).length);
  }
}
