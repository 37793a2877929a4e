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
package net.sth.query;

import com.google.common.base.Strings;

/**
 * The bucketing period. A bucketed period maps to the number of leading
 * characters of the ISO-8601 reception time that identify the bucket, e.g.
 * {@code 2024-01-01T10} for an hour. {@link #NONE} groups everything under
 * the attribute name.
 */
public enum AggregationPeriod {
  SECOND("second", 19),
  MINUTE("minute", 16),
  HOUR("hour", 13),
  DAY("day", 10),
  MONTH("month", 7),
  NONE("none", -1);

  private final String query_name;
  private final int key_length;

  private AggregationPeriod(final String name, final int key_length) {
    this.query_name = name;
    this.key_length = key_length;
  }

  /** @return The lower case name used in queries. */
  public String periodName() {
    return query_name;
  }

  /** @return The prefix length of the ISO timestamp, -1 for none. */
  public int keyLength() {
    return key_length;
  }

  /** @return True if the period groups by truncated time. */
  public boolean isBucketed() {
    return key_length > 0;
  }

  /**
   * Parses the period from a query string value, case insensitive. A null
   * or empty value is {@link #NONE}.
   * @param period The period name.
   * @return The period.
   * @throws InvalidQueryException if the name was unknown.
   */
  public static AggregationPeriod fromString(final String period) {
    if (Strings.isNullOrEmpty(period)) {
      return NONE;
    }
    for (final AggregationPeriod p : values()) {
      if (p.query_name.equalsIgnoreCase(period.trim())) {
        return p;
      }
    }
    throw new InvalidQueryException("Unknown aggrPeriod: " + period);
  }
}
