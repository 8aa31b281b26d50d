/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace.internal;

import java.lang.annotation.RetentionPolicy;

/**
 * Marks a parameter, field or return value that may be null. This avoids a dependency on one of
 * the many jsr305 jars.
 */
@java.lang.annotation.Documented
@java.lang.annotation.Retention(RetentionPolicy.SOURCE)
public @interface Nullable {
}
