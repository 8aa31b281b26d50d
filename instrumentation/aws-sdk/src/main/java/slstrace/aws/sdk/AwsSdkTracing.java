/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.aws.sdk;

import java.util.Locale;
import java.util.Map;
import slstrace.CapturedEvents;
import slstrace.PayloadCapturer;
import slstrace.TraceSpan;
import slstrace.Tracer;
import slstrace.Tracing;
import slstrace.internal.Nullable;
import slstrace.resource.ResourceTagMappers;

/**
 * Traces calls made with an AWS SDK client, as spans named
 * {@code aws.sdk.<service>.<operation>}, for example {@code aws.sdk.dynamodb.putitem}.
 *
 * <p>Call data is passed as maps keyed by the service's field names, so this works with any client
 * generation. An interceptor of the client typically calls {@link #startCall} before sending the
 * request and one of the {@code finishCall} methods once the response or error is known.
 *
 * <p>Ex.
 * <pre>{@code
 * TraceSpan span = awsSdkTracing.startCall("SQS", "SendMessage", "us-east-1", params);
 * try {
 *   Map<String, Object> response = send(params);
 *   awsSdkTracing.finishCall(span, requestId, response);
 * } catch (RuntimeException e) {
 *   awsSdkTracing.finishCall(span, null, e);
 *   throw e;
 * }
 * }</pre>
 */
public final class AwsSdkTracing {
  static final String SIGNATURE_VERSION = "v4";

  public static AwsSdkTracing create(Tracing tracing) {
    return newBuilder(tracing).build();
  }

  public static Builder newBuilder(Tracing tracing) {
    return new Builder(tracing);
  }

  public static final class Builder {
    final Tracing tracing;
    boolean registerDefaultMappers = true;

    Builder(Tracing tracing) {
      if (tracing == null) throw new NullPointerException("tracing == null");
      this.tracing = tracing;
    }

    /**
     * When true, registers {@link AwsSdkTagMappers} with the tracing component's
     * {@link Tracing#resourceTagMappers() registry} unless already present. Defaults to true.
     */
    public Builder registerDefaultMappers(boolean registerDefaultMappers) {
      this.registerDefaultMappers = registerDefaultMappers;
      return this;
    }

    public AwsSdkTracing build() {
      return new AwsSdkTracing(this);
    }
  }

  final Tracer tracer;
  final CapturedEvents capturedEvents;
  final PayloadCapturer payloadCapturer;
  final ResourceTagMappers resourceTagMappers;

  AwsSdkTracing(Builder builder) {
    Tracing tracing = builder.tracing;
    this.tracer = tracing.tracer();
    this.capturedEvents = tracing.capturedEvents();
    this.payloadCapturer = tracing.payloadCapturer();
    this.resourceTagMappers = tracing.resourceTagMappers();
    if (builder.registerDefaultMappers) {
      for (String service : AwsSdkTagMappers.MAPPERS.keySet()) {
        if (resourceTagMappers.get(service) == null) {
          resourceTagMappers.register(service, AwsSdkTagMappers.mapperForService(service));
        }
      }
    }
  }

  /**
   * Starts a child of the current span for the call, tags it and records the parameters as its
   * input.
   *
   * @param service the service name, such as {@code DynamoDB}
   * @param operation the operation name, such as {@code PutItem}
   * @param region the region the client calls, if known
   * @param params the request fields
   */
  public TraceSpan startCall(String service, String operation, @Nullable String region,
    Map<String, ?> params) {
    String serviceName = normalize(service), operationName = normalize(operation);
    TraceSpan span = tracer.startSpan("aws.sdk." + serviceName + "." + operationName);
    if (region != null) span.tags().set("aws.sdk.region", region);
    span.tags().set("aws.sdk.signature_version", SIGNATURE_VERSION);
    span.tags().set("aws.sdk.service", serviceName);
    span.tags().set("aws.sdk.operation", operationName);
    if (params != null) {
      if (payloadCapturer.isEnabled()) {
        String input = SafeStringify.stringify(params, capturedEvents);
        if (input != null) payloadCapturer.captureInput(span, input);
      }
      resourceTagMappers.mapParams(serviceName, span, params);
    }
    return span;
  }

  /** Tags the span with the successful response, records it as output and closes the span. */
  public void finishCall(TraceSpan span, @Nullable String requestId,
    @Nullable Map<String, ?> response) {
    if (span == null) return;
    if (requestId != null) span.tags().set("aws.sdk.request_id", requestId);
    if (response != null) {
      if (payloadCapturer.isEnabled()) {
        String output = SafeStringify.stringify(response, capturedEvents);
        if (output != null) payloadCapturer.captureOutput(span, output);
      }
      Object serviceName = span.tags().get("aws.sdk.service");
      if (serviceName != null) {
        resourceTagMappers.mapResponseData(serviceName.toString(), span, response);
      }
    }
    span.close();
  }

  /** Tags the span with the error message and closes it. */
  public void finishCall(TraceSpan span, @Nullable String requestId, Throwable error) {
    if (span == null) return;
    if (requestId != null) span.tags().set("aws.sdk.request_id", requestId);
    if (error != null) {
      String message = error.getMessage();
      span.tags().set("aws.sdk.error", message != null ? message : error.getClass().getName());
    }
    span.close();
  }

  /** Service and operation names become lowercase span name segments. */
  static String normalize(@Nullable String name) {
    if (name == null) return "unknown";
    StringBuilder result = new StringBuilder(name.length());
    for (char c : name.toLowerCase(Locale.ROOT).toCharArray()) {
      boolean valid = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
      result.append(valid ? c : '_');
    }
    return result.toString();
  }

  @Override public String toString() {
    return "AwsSdkTracing{" + resourceTagMappers + "}";
  }
}
