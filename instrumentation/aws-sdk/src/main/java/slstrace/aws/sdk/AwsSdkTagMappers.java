/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.aws.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import slstrace.internal.Nullable;
import slstrace.resource.ResourceTagMapper;
import slstrace.resource.ResourceTagMappers;

/** Tag mappers of the AWS services with dedicated tags: DynamoDB, SQS and SNS. */
public final class AwsSdkTagMappers {
  static final Map<String, ResourceTagMapper> MAPPERS;

  static {
    Map<String, ResourceTagMapper> mappers = new LinkedHashMap<>();
    mappers.put("dynamodb", new DynamoDbTagMapper());
    mappers.put("sqs", new SqsTagMapper());
    mappers.put("sns", new SnsTagMapper());
    MAPPERS = Collections.unmodifiableMap(mappers);
  }

  /** Returns the mapper for a lowercase service name, such as {@code sqs}, or null. */
  @Nullable public static ResourceTagMapper mapperForService(String serviceName) {
    return serviceName != null ? MAPPERS.get(serviceName) : null;
  }

  /** Registers each mapper under its service name. */
  public static ResourceTagMappers registerDefaults(ResourceTagMappers registry) {
    for (Map.Entry<String, ResourceTagMapper> entry : MAPPERS.entrySet()) {
      registry.register(entry.getKey(), entry.getValue());
    }
    return registry;
  }

  AwsSdkTagMappers() {
  }
}
