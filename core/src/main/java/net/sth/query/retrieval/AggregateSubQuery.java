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
package net.sth.query.retrieval;

import java.util.List;

import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.sth.data.Bucket;
import net.sth.query.AggregationMethod;
import net.sth.query.AggregationPeriod;
import net.sth.query.AggregationPlan;
import net.sth.query.RetrievalTarget;
import net.sth.query.aggregate.BucketAggregationPlanner;
import net.sth.query.aggregate.BucketAggregator;
import net.sth.storage.CollectionHandle;

/**
 * Aggregates raw points on demand through one of the aggregator backends.
 * A plan is built per target attribute. The record count is the number of
 * buckets.
 */
public class AggregateSubQuery implements SubQuery {

  private final BucketAggregator aggregator;
  private final AggregationMethod method;
  private final AggregationPeriod period;
  private final Integer cap;
  private final long time_from;
  private final long time_to;

  public AggregateSubQuery(final BucketAggregator aggregator,
                           final AggregationMethod method,
                           final AggregationPeriod period,
                           final Integer cap,
                           final long time_from,
                           final long time_to) {
    if (aggregator == null) {
      throw new IllegalArgumentException("Aggregator cannot be null.");
    }
    this.aggregator = aggregator;
    this.method = method;
    this.period = period;
    this.cap = cap;
    this.time_from = time_from;
    this.time_to = time_to;
  }

  public BucketAggregator aggregator() {
    return aggregator;
  }

  @Override
  public boolean aggregatedCollection() {
    return false;
  }

  @Override
  public Deferred<SubQueryResult> execute(final CollectionHandle handle,
                                          final RetrievalTarget target) {
    final AggregationPlan plan;
    try {
      plan = BucketAggregationPlanner.plan(method, period, cap,
          target.attrName(), time_from, time_to);
    } catch (RuntimeException e) {
      return Deferred.fromError(e);
    }

    class ResultCB implements Callback<SubQueryResult, List<Bucket>> {
      @Override
      public SubQueryResult call(final List<Bucket> buckets) throws Exception {
        return new SubQueryResult(buckets, buckets.size());
      }
    }
    return aggregator.run(handle, target, plan).addCallback(new ResultCB());
  }
}
