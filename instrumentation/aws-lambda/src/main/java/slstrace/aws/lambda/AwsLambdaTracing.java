/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.aws.lambda;

import java.lang.management.ManagementFactory;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import slstrace.TraceSpan;
import slstrace.Tracer;
import slstrace.Tracing;
import slstrace.internal.Nullable;
import slstrace.internal.Platform;

/**
 * Owns the {@code aws.lambda} root span of a function's trace and the spans of its two phases,
 * {@code aws.lambda.initialization} and {@code aws.lambda.invocation}.
 *
 * <p>The root span starts when the process starts. It is reused across invocations of the same
 * process: after an invocation is reported, {@link #reset()} restores the function's tags and
 * drops the previous invocation's spans.
 *
 * <p>Ex.
 * <pre>{@code
 * TraceSpan invocation = awsLambdaTracing.startInvocation();
 * try {
 *   response = handler.handleRequest(event, context);
 *   awsLambdaTracing.resolveResponse(response);
 * } finally {
 *   invocation.close();
 *   awsLambdaTracing.rootSpan().close();
 *   export(awsLambdaTracing.rootSpan());
 *   awsLambdaTracing.reset();
 * }
 * }</pre>
 */
public final class AwsLambdaTracing {
  static final String ROOT = "aws.lambda";
  static final String INITIALIZATION = "aws.lambda.initialization";
  static final String INVOCATION = "aws.lambda.invocation";

  /** Event types of HTTP requests, whose responses carry a status code. */
  static final List<String> API_EVENT_TYPES = Collections.unmodifiableList(Arrays.asList(
    "aws.apigateway.rest",
    "aws.apigatewayv2.http.v1",
    "aws.apigatewayv2.http.v2",
    "aws.lambda.url",
    "aws.elasticloadbalancing.http"
  ));

  public static AwsLambdaTracing create(Tracing tracing) {
    return newBuilder(tracing).build();
  }

  public static Builder newBuilder(Tracing tracing) {
    return new Builder(tracing);
  }

  public static final class Builder {
    final Tracing tracing;
    @Nullable String functionName = System.getenv("AWS_LAMBDA_FUNCTION_NAME");
    @Nullable String functionVersion = System.getenv("AWS_LAMBDA_FUNCTION_VERSION");
    @Nullable String osArch = System.getProperty("os.arch");
    boolean coldStart = "on-demand".equals(System.getenv("AWS_LAMBDA_INITIALIZATION_TYPE"));
    @Nullable Long processStartTime;

    Builder(Tracing tracing) {
      if (tracing == null) throw new NullPointerException("tracing == null");
      this.tracing = tracing;
    }

    /** Defaults to the environment variable {@code AWS_LAMBDA_FUNCTION_NAME}. */
    public Builder functionName(String functionName) {
      this.functionName = functionName;
      return this;
    }

    /** Defaults to the environment variable {@code AWS_LAMBDA_FUNCTION_VERSION}. */
    public Builder functionVersion(String functionVersion) {
      this.functionVersion = functionVersion;
      return this;
    }

    /** Defaults to the system property {@code os.arch}. */
    public Builder osArch(String osArch) {
      this.osArch = osArch;
      return this;
    }

    /**
     * Whether the first invocation is a cold start. Defaults to true when the environment variable
     * {@code AWS_LAMBDA_INITIALIZATION_TYPE} is {@code on-demand}.
     */
    public Builder coldStart(boolean coldStart) {
      this.coldStart = coldStart;
      return this;
    }

    /** Start time of the root span in epoch nanoseconds. Defaults to the JVM start time. */
    public Builder processStartTime(long processStartTime) {
      this.processStartTime = processStartTime;
      return this;
    }

    public AwsLambdaTracing build() {
      return new AwsLambdaTracing(this);
    }
  }

  final Tracer tracer;
  final Tracing tracing;
  final TraceSpan rootSpan;

  AwsLambdaTracing(Builder builder) {
    this.tracing = builder.tracing;
    this.tracer = tracing.tracer();

    Map<String, Object> functionTags = new LinkedHashMap<>();
    if (builder.functionName != null) functionTags.put("aws.lambda.name", builder.functionName);
    if (builder.functionVersion != null) {
      functionTags.put("aws.lambda.version", builder.functionVersion);
    }
    String arch = arch(builder.osArch);
    if (arch != null) functionTags.put("aws.lambda.arch", arch);

    long startTime = builder.processStartTime != null
      ? builder.processStartTime
      : TimeUnit.MILLISECONDS.toNanos(ManagementFactory.getRuntimeMXBean().getStartTime());
    this.rootSpan = tracer.spanBuilder(ROOT)
      .parent(null)
      .startTime(startTime)
      .tags(functionTags)
      .immediateDescendants(INITIALIZATION)
      .start();
    if (builder.coldStart) rootSpan.tags().set("aws.lambda.is_coldstart", true);
  }

  /** The {@code aws.lambda} span, root of every span of the current invocation. */
  public TraceSpan rootSpan() {
    return rootSpan;
  }

  /** Starts the span of loading the handler. It is closed at the latest with the root span. */
  public TraceSpan startInitialization() {
    return tracer.startSpan(INITIALIZATION, rootSpan);
  }

  /** Starts the span of the handler call, closing an open initialization span first. */
  public TraceSpan startInvocation() {
    long startTime = tracing.clock().currentTimeNanoseconds();
    for (TraceSpan child : rootSpan.children()) {
      if (INITIALIZATION.equals(child.name()) && !child.isClosed()) child.close(startTime);
    }
    return tracer.spanBuilder(INVOCATION).parent(rootSpan).startTime(startTime).start();
  }

  /** Recycles the root span for the next invocation of this process and clears custom tags. */
  public void reset() {
    rootSpan.reset();
    tracing.customTags().clear();
  }

  /**
   * Records the HTTP status of the handler's response when the invocation was triggered by an
   * HTTP request, such as an API Gateway or function URL event.
   *
   * <p>A missing or out of range status code is tagged as {@code aws.lambda.http.error_code}.
   */
  public void resolveResponse(@Nullable Map<String, ?> response) {
    if (!isApiEvent()) return;

    Object statusCode = response != null ? response.get("statusCode") : null;
    if (statusCode == null) {
      rootSpan.tags().set("aws.lambda.http.error_code", "MISSING_STATUS_CODE");
      return;
    }

    Long parsed = parseStatusCode(statusCode);
    if (parsed != null && parsed >= 100 && parsed < 600) {
      rootSpan.tags().set("aws.lambda.http.status_code", parsed.intValue());
    } else {
      rootSpan.tags().set("aws.lambda.http.error_code", "INVALID_STATUS_CODE");
    }
  }

  boolean isApiEvent() {
    return API_EVENT_TYPES.contains(rootSpan.tags().get("aws.lambda.event_type"));
  }

  /** Returns the status code as a whole number, or null if it is not one. */
  @Nullable static Long parseStatusCode(Object statusCode) {
    if (statusCode instanceof Integer || statusCode instanceof Long
      || statusCode instanceof Short || statusCode instanceof Byte) {
      return ((Number) statusCode).longValue();
    }
    if (statusCode instanceof Number) {
      double value = ((Number) statusCode).doubleValue();
      return value == Math.rint(value) && !Double.isInfinite(value) ? (long) value : null;
    }
    if (!(statusCode instanceof CharSequence)) return null;
    try {
      return Long.valueOf(statusCode.toString().trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Returns the architecture name used by AWS Lambda, or null if unrecognized. */
  @Nullable static String arch(@Nullable String osArch) {
    if ("amd64".equals(osArch) || "x86_64".equals(osArch) || "x64".equals(osArch)) {
      return "x86_64";
    }
    if ("aarch64".equals(osArch) || "arm64".equals(osArch)) return "arm64";
    Platform.get().log("Unrecognized architecture: {0}", osArch, null);
    return null;
  }

  @Override public String toString() {
    return "AwsLambdaTracing{rootSpan=" + rootSpan + "}";
  }
}
