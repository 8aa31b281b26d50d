/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.resource;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import slstrace.CapturedEvents;
import slstrace.TraceSpan;
import slstrace.internal.Nullable;
import slstrace.internal.Platform;

import static slstrace.internal.Throwables.propagateIfFatal;

/**
 * Registry of {@link ResourceTagMapper}s keyed by resource type, such as {@code dynamodb}.
 *
 * <p>Dispatch through {@link #mapParams} and {@link #mapResponseData} never throws: a failing
 * mapper is reported as an internal error and the call continues untagged.
 */
public final class ResourceTagMappers {
  final Map<String, ResourceTagMapper> mappers = new ConcurrentHashMap<>();
  final CapturedEvents capturedEvents;

  public ResourceTagMappers(CapturedEvents capturedEvents) {
    if (capturedEvents == null) throw new NullPointerException("capturedEvents == null");
    this.capturedEvents = capturedEvents;
  }

  /** Registers the mapper, replacing any previous one for the type. */
  public ResourceTagMappers register(String type, ResourceTagMapper mapper) {
    if (type == null) throw new NullPointerException("type == null");
    if (mapper == null) throw new NullPointerException("mapper == null");
    ResourceTagMapper previous = mappers.put(type, mapper);
    if (previous != null && previous != mapper) {
      Platform.get().log("Replaced resource tag mapper for {0}", type, null);
    }
    return this;
  }

  @Nullable public ResourceTagMapper get(String type) {
    return type != null ? mappers.get(type) : null;
  }

  /** Returns false if no mapper is registered for the type or it failed. */
  public boolean mapParams(String type, TraceSpan span, Map<String, ?> input) {
    ResourceTagMapper mapper = get(type);
    if (mapper == null || input == null) return false;
    try {
      mapper.params(span, input);
      return true;
    } catch (Throwable t) {
      propagateIfFatal(t);
      capturedEvents.reportError(t);
      return false;
    }
  }

  /** Returns false if no mapper is registered for the type or it failed. */
  public boolean mapResponseData(String type, TraceSpan span, Map<String, ?> output) {
    ResourceTagMapper mapper = get(type);
    if (mapper == null || output == null) return false;
    try {
      mapper.responseData(span, output);
      return true;
    } catch (Throwable t) {
      propagateIfFatal(t);
      capturedEvents.reportError(t);
      return false;
    }
  }

  @Override public String toString() {
    return "ResourceTagMappers" + mappers.keySet();
  }
}
