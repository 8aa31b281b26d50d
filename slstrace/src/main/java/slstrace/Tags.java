/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package slstrace;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import slstrace.internal.Nullable;

import static slstrace.internal.Throwables.propagateIfFatal;

/**
 * Validated tags of a span or captured event.
 *
 * <p>Keys are dot-delimited lowercase names, such as {@code aws.sdk.dynamodb.table_name}. Values
 * are a scalar (string, integral number, finite floating point number, boolean or date) or a list
 * of scalars of the same kind. Writes that break these rules are dropped and reported as
 * {@link ErrorType#USER} errors; nothing here throws.
 *
 * <p>Tags of a closed span are frozen: further writes are reported and dropped.
 */
public final class Tags {
  static final Pattern KEY = Pattern.compile("^[a-z][a-z0-9_]*(?:\\.[a-z][a-z0-9_]*)*$");

  enum ValueKind {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    DATE
  }

  @Nullable final CapturedEvents capturedEvents;
  final Map<String, Object> values = new LinkedHashMap<>();
  final Map<String, Object> view = Collections.unmodifiableMap(values);
  boolean frozen;

  /**
   * @param capturedEvents where invalid writes are reported, or null to drop them silently.
   */
  public Tags(@Nullable CapturedEvents capturedEvents) {
    this.capturedEvents = capturedEvents;
  }

  /** Returns true if the key is a valid tag key. */
  public static boolean isValidKey(@Nullable String key) {
    return key != null && KEY.matcher(key).matches();
  }

  /**
   * Stores the value under the key, replacing any previous value. Invalid keys or values leave
   * the store unchanged.
   *
   * @return true if the value was stored
   */
  public boolean set(String key, Object value) {
    String failure;
    Object copy = null;
    try {
      failure = validate(key, value);
      if (failure == null) failure = frozenFailure(key);
      if (failure == null) copy = copyOf(value);
    } catch (Throwable t) { // a list that fails while read
      propagateIfFatal(t);
      failure = "Invalid value of tag '" + key + "': unreadable " + typeOf(value);
    }
    if (failure != null) {
      reportInvalid(failure);
      return false;
    }
    synchronized (this) {
      values.put(key, copy);
    }
    return true;
  }

  /** Sets each entry. Valid entries are stored even if others are rejected. */
  public void update(Map<String, ?> tags) {
    update(tags, null);
  }

  /**
   * Sets each entry under {@code prefix + "." + key}, or the bare key when the prefix is null.
   * Valid entries are stored even if others are rejected.
   */
  public void update(Map<String, ?> tags, @Nullable String prefix) {
    if (tags == null) return;
    try {
      for (Map.Entry<String, ?> entry : tags.entrySet()) {
        String key = prefix != null ? prefix + "." + entry.getKey() : entry.getKey();
        set(key, entry.getValue());
      }
    } catch (Throwable t) {
      propagateIfFatal(t);
      reportInvalid("Invalid tags: unreadable " + typeOf(tags));
    }
  }

  /** Removes the fully-qualified key, if present. */
  public void delete(String key) {
    String failure = frozenFailure(key);
    if (failure != null) {
      reportInvalid(failure);
      return;
    }
    synchronized (this) {
      values.remove(key);
    }
  }

  @Nullable public synchronized Object get(String key) {
    return values.get(key);
  }

  public synchronized boolean contains(String key) {
    return values.containsKey(key);
  }

  /** Returns a read-only view in insertion order. */
  public Map<String, Object> asMap() {
    return view;
  }

  public synchronized int size() {
    return values.size();
  }

  public synchronized boolean isEmpty() {
    return values.isEmpty();
  }

  synchronized void freeze() {
    frozen = true;
  }

  /** Reopens the store with exactly the given, already validated, tags. */
  synchronized void reset(Map<String, Object> baseline) {
    values.clear();
    values.putAll(baseline);
    frozen = false;
  }

  /** Returns a copy in insertion order, unaffected by later or concurrent writes. */
  public synchronized Map<String, Object> snapshot() {
    return new LinkedHashMap<>(values);
  }

  /** Removes all tags. Frozen tags are reported and kept. */
  public void clear() {
    String failure;
    synchronized (this) {
      failure = frozen ? "Cannot clear tags of a closed span" : null;
      if (failure == null) values.clear();
    }
    if (failure != null) reportInvalid(failure);
  }

  @Nullable synchronized String frozenFailure(String key) {
    if (!frozen) return null;
    return "Cannot modify tag '" + key + "' of a closed span";
  }

  void reportInvalid(String failure) {
    if (capturedEvents == null) return;
    capturedEvents.reportError(new IllegalArgumentException(failure), ErrorType.USER);
  }

  /** Returns a description of what is wrong with this tag, or null if it is valid. */
  @Nullable static String validate(@Nullable String key, @Nullable Object value) {
    if (!isValidKey(key)) return "Invalid tag key: '" + key + "'";
    if (value == null) return "Invalid value of tag '" + key + "': null";
    if (value instanceof List) {
      ValueKind listKind = null;
      for (Object element : (List<?>) value) {
        ValueKind elementKind = element != null ? kindOf(element) : null;
        if (elementKind == null) {
          return "Invalid value of tag '" + key + "': list contains " + typeOf(element);
        }
        if (listKind == null) {
          listKind = elementKind;
        } else if (listKind != elementKind) {
          return "Invalid value of tag '" + key + "': list mixes " + listKind + " and "
            + elementKind;
        }
      }
      return null;
    }
    if (kindOf(value) == null) {
      return "Invalid value of tag '" + key + "': " + typeOf(value);
    }
    return null;
  }

  @Nullable static ValueKind kindOf(Object value) {
    if (value instanceof String) return ValueKind.STRING;
    if (value instanceof Integer || value instanceof Long
      || value instanceof Short || value instanceof Byte) {
      return ValueKind.INTEGER;
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      return Double.isNaN(d) || Double.isInfinite(d) ? null : ValueKind.FLOAT;
    }
    if (value instanceof Boolean) return ValueKind.BOOLEAN;
    if (value instanceof Date || value instanceof Instant) return ValueKind.DATE;
    return null;
  }

  /** Describes a rejected value without calling its {@code toString()}. */
  static String typeOf(@Nullable Object value) {
    return value != null ? value.getClass().getName() : "null";
  }

  static Object copyOf(Object value) {
    if (value instanceof List) return Collections.unmodifiableList(new ArrayList<>((List<?>) value));
    if (value instanceof Date) return new Date(((Date) value).getTime()); // Date is mutable
    return value;
  }

  @Override public String toString() {
    return "Tags" + snapshot();
  }
}
