// This file is part of STH.
// Copyright (C) 2024  The STH Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.sth.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;

import net.sth.utils.DateTime;

/**
 * One aggregation group: the group key (a truncated reception time or the
 * attribute name when unbucketed), the reception time of the first point
 * seen for the group and the reduced value. Immutable.
 */
public class Bucket implements HistoryDatum, Comparable<Bucket> {

  public static final String KEY = "_id";
  public static final String FIRST_DATE = "firstDate";
  public static final String VALUE = "attrValue";

  /** The rendered field layout of a bucket. */
  public static final List<String> FIELDS =
      ImmutableList.of(KEY, FIRST_DATE, VALUE);

  private final String key;
  private final long first_timestamp;
  private final double value;

  /**
   * Default ctor.
   * @param key The non-null group key.
   * @param first_timestamp The reception time of the first point in the
   * group, epoch milliseconds.
   * @param value The reduced value.
   */
  public Bucket(final String key, final long first_timestamp,
                final double value) {
    if (key == null) {
      throw new IllegalArgumentException("Key cannot be null.");
    }
    this.key = key;
    this.first_timestamp = first_timestamp;
    this.value = value;
  }

  /** @return The group key. */
  public String key() {
    return key;
  }

  /** @return The first reception time of the group in epoch millis. */
  public long firstTimestamp() {
    return first_timestamp;
  }

  /** @return The reduced value. */
  public double value() {
    return value;
  }

  @Override
  public List<String> fieldNames() {
    return FIELDS;
  }

  @Override
  public List<Object> fieldValues() {
    return Collections.unmodifiableList(Arrays.asList(
        (Object) key, DateTime.toIsoString(first_timestamp), value));
  }

  @Override
  public Map<String, Object> asMap() {
    final Map<String, Object> map = new LinkedHashMap<String, Object>(3);
    map.put(KEY, key);
    map.put(FIRST_DATE, DateTime.toIsoString(first_timestamp));
    map.put(VALUE, value);
    return map;
  }

  @Override
  public int compareTo(final Bucket o) {
    return ComparisonChain.start()
        .compare(key, o.key)
        .result();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Bucket other = (Bucket) o;
    return Objects.equal(key, other.key)
        && first_timestamp == other.first_timestamp
        && Double.compare(value, other.value) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(key, first_timestamp, value);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("key=").append(key)
        .append(", firstTimestamp=").append(first_timestamp)
        .append(", value=").append(value)
        .toString();
  }
}
