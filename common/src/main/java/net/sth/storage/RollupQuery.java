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

import com.google.common.base.Objects;

import net.sth.query.AggregationMethod;
import net.sth.query.AggregationPeriod;
import net.sth.query.RetrievalTarget;

/**
 * A read of an externally maintained rollup collection. Any method may be
 * asked for here, including those that cannot be computed on demand.
 */
public class RollupQuery {

  private final RetrievalTarget target;
  private final AggregationMethod method;
  private final AggregationPeriod period;
  private final long time_from;
  private final long time_to;
  private final boolean filter_out_empty;

  public RollupQuery(final RetrievalTarget target,
                     final AggregationMethod method,
                     final AggregationPeriod period,
                     final long time_from,
                     final long time_to,
                     final boolean filter_out_empty) {
    if (target == null) {
      throw new IllegalArgumentException("Target cannot be null.");
    }
    if (method == null) {
      throw new IllegalArgumentException("Method cannot be null.");
    }
    if (period == null || !period.isBucketed()) {
      throw new IllegalArgumentException("Rollups require a bucketed "
          + "period: " + period);
    }
    this.target = target;
    this.method = method;
    this.period = period;
    this.time_from = time_from;
    this.time_to = time_to;
    this.filter_out_empty = filter_out_empty;
  }

  public RetrievalTarget target() {
    return target;
  }

  public AggregationMethod method() {
    return method;
  }

  public AggregationPeriod period() {
    return period;
  }

  public long timeFrom() {
    return time_from;
  }

  public long timeTo() {
    return time_to;
  }

  /** @return Whether or not buckets without samples should be dropped. */
  public boolean filterOutEmpty() {
    return filter_out_empty;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final RollupQuery other = (RollupQuery) o;
    return Objects.equal(target, other.target)
        && method == other.method
        && period == other.period
        && time_from == other.time_from
        && time_to == other.time_to
        && filter_out_empty == other.filter_out_empty;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(target, method, period, time_from, time_to,
        filter_out_empty);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("target=").append(target)
        .append(", method=").append(method)
        .append(", period=").append(period)
        .append(", timeFrom=").append(time_from)
        .append(", timeTo=").append(time_to)
        .append(", filterOutEmpty=").append(filter_out_empty)
        .toString();
  }
}
