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
 * The statistic applied to a bucket. Only {@link #MIN}, {@link #MAX} and
 * {@link #AVG} can be computed on demand; the others exist in precomputed
 * rollup collections.
 */
public enum AggregationMethod {
  MIN("min", true),
  MAX("max", true),
  AVG("avg", true),
  SUM("sum", false),
  SUM2("sum2", false),
  OCCUR("occur", false);

  private final String query_name;
  private final boolean on_demand;

  private AggregationMethod(final String name, final boolean on_demand) {
    this.query_name = name;
    this.on_demand = on_demand;
  }

  /** @return The lower case name used in queries. */
  public String methodName() {
    return query_name;
  }

  /** @return Whether or not the method can be computed from raw points. */
  public boolean onDemand() {
    return on_demand;
  }

  /**
   * Parses the method from a query string value, case insensitive.
   * @param method The non-null, non-empty method name.
   * @return The method.
   * @throws InvalidQueryException if the name was empty or unknown.
   */
  public static AggregationMethod fromString(final String method) {
    if (Strings.isNullOrEmpty(method)) {
      throw new InvalidQueryException("aggrMethod cannot be empty");
    }
    for (final AggregationMethod m : values()) {
      if (m.query_name.equalsIgnoreCase(method.trim())) {
        return m;
      }
    }
    throw new InvalidQueryException("Unknown aggrMethod: " + method);
  }
}
