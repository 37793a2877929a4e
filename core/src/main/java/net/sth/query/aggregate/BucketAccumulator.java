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
package net.sth.query.aggregate;

import net.sth.data.Bucket;
import net.sth.query.AggregationMethod;

/**
 * Running state of one bucket: the first timestamp plus enough to compute
 * any on-demand statistic. Not thread safe.
 */
class BucketAccumulator {

  private final String key;
  private final long first_timestamp;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;
  private double sum;
  private long count;

  BucketAccumulator(final String key, final long first_timestamp) {
    this.key = key;
    this.first_timestamp = first_timestamp;
  }

  void add(final double value) {
    if (value < min) {
      min = value;
    }
    if (value > max) {
      max = value;
    }
    sum += value;
    count++;
  }

  long count() {
    return count;
  }

  Bucket toBucket(final AggregationMethod method) {
    switch (method) {
    case MIN:
      return new Bucket(key, first_timestamp, min);
    case MAX:
      return new Bucket(key, first_timestamp, max);
    case AVG:
      return new Bucket(key, first_timestamp, sum / count);
    default:
      throw new IllegalArgumentException("Method " + method.methodName()
          + " cannot be computed on demand.");
    }
  }
}
