/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.aws.sdk;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import slstrace.internal.Nullable;
import slstrace.resource.ResourceTagMapper;

/** Base of AWS service mappers, whose tags share the prefix {@code aws.sdk.<service>}. */
abstract class ServiceTagMapper implements ResourceTagMapper {
  final String tagPrefix;

  ServiceTagMapper(String serviceName) {
    this.tagPrefix = "aws.sdk." + serviceName;
  }

  /** Returns the text after the last separator, such as a queue name from its URL. */
  static String lastSegment(Object value, char separator) {
    String string = value.toString();
    return string.substring(string.lastIndexOf(separator) + 1);
  }

  /** Returns non-null {@code MessageId} values of the entries, which are maps. */
  static List<Object> messageIds(@Nullable Object entries) {
    List<Object> result = new ArrayList<>();
    if (!(entries instanceof List)) return result;
    for (Object entry : (List<?>) entries) {
      if (!(entry instanceof Map)) continue;
      Object messageId = ((Map<?, ?>) entry).get("MessageId");
      if (messageId != null) result.add(messageId);
    }
    return result;
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "{" + tagPrefix + "}";
  }
}
