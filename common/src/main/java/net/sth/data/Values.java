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

import com.google.common.base.CharMatcher;

/**
 * Helpers for attribute values, which arrive as whatever the context broker
 * notified: numbers, numeric strings, free text or structured values.
 */
public final class Values {

  /** Type suffixes and hex notation that only Java's parser accepts. */
  private static final CharMatcher JAVA_ONLY_NOTATION =
      CharMatcher.anyOf("dDfFxXpP");

  private Values() {
    // static helpers only
  }

  /**
   * Coerces an attribute value to a double for aggregation.
   * @param value The value, may be null.
   * @return The double value or null if the value is not numeric.
   */
  public static Double toDouble(final Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      final String trimmed = ((String) value).trim();
      if (trimmed.isEmpty() || JAVA_ONLY_NOTATION.matchesAnyOf(trimmed)) {
        return null;
      }
      try {
        final double parsed = Double.parseDouble(trimmed);
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
          return null;
        }
        return parsed;
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}
