/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal.codec;

import org.junit.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

public class WriteBufferTest {
  @Test public void writeAscii_long() {
    for (long v : new long[] {0L, 7L, -7L, 10L, 1234567890123L, Long.MAX_VALUE, Long.MIN_VALUE}) {
      byte[] bytes = new byte[WriteBuffer.asciiSizeInBytes(v)];
      WriteBuffer.wrap(bytes).writeAscii(v);

      assertThat(new String(bytes, UTF_8)).isEqualTo(Long.toString(v));
    }
  }

  @Test public void writeUtf8_matchesJdk() {
    String string = "a\u00e9 \ud83d\ude00z";
    byte[] bytes = new byte[WriteBuffer.utf8SizeInBytes(string)];
    WriteBuffer.wrap(bytes).writeUtf8(string, 0, string.length());

    assertThat(bytes).isEqualTo(string.getBytes(UTF_8));
  }

  @Test public void writeUtf8_unpairedSurrogates() {
    String string = "\ude00a\ud83d";
    byte[] bytes = new byte[WriteBuffer.utf8SizeInBytes(string)];
    WriteBuffer.wrap(bytes).writeUtf8(string, 0, string.length());

    assertThat(new String(bytes, UTF_8)).isEqualTo("?a?");
  }

  @Test public void writeUtf8_range() {
    byte[] bytes = new byte[3];
    WriteBuffer.wrap(bytes).writeUtf8("xabcx", 1, 4);

    assertThat(new String(bytes, UTF_8)).isEqualTo("abc");
  }
}
