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
package net.sth.storage;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import net.sth.data.RawPoint;

/**
 * The outcome of a raw retrieval. A store may hand back either a list it
 * already materialized or an iterator over a cursor that produces points
 * lazily; {@link #points()} drains the iterator exactly once and caches the
 * list.
 * <p>
 * The total count is the number of points matching the filter before any
 * paging was applied.
 */
public class RetrievalResult {

  private final long total_count;

  /** Set when the store returned a cursor, cleared once drained. */
  private Iterator<RawPoint> cursor;

  private List<RawPoint> points;

  private RetrievalResult(final List<RawPoint> points,
                          final Iterator<RawPoint> cursor,
                          final long total_count) {
    this.points = points;
    this.cursor = cursor;
    this.total_count = total_count;
  }

  /**
   * @param points A non-null, possibly empty list of points.
   * @param total_count The pre-paging match count.
   * @return A materialized result.
   */
  public static RetrievalResult of(final List<RawPoint> points,
                                   final long total_count) {
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    return new RetrievalResult(ImmutableList.copyOf(points), null,
        total_count);
  }

  /**
   * @param cursor A non-null iterator that will be drained on first access.
   * @param total_count The pre-paging match count.
   * @return A lazy result.
   */
  public static RetrievalResult ofCursor(final Iterator<RawPoint> cursor,
                                         final long total_count) {
    if (cursor == null) {
      throw new IllegalArgumentException("Cursor cannot be null.");
    }
    return new RetrievalResult(null, cursor, total_count);
  }

  /** @return An empty result with a zero count. */
  public static RetrievalResult empty() {
    return new RetrievalResult(Collections.<RawPoint>emptyList(), null, 0);
  }

  /** @return The points in ascending reception time order. */
  public synchronized List<RawPoint> points() {
    if (points == null) {
      points = ImmutableList.copyOf(cursor);
      cursor = null;
    }
    return points;
  }

  public long totalCount() {
    return total_count;
  }
}
