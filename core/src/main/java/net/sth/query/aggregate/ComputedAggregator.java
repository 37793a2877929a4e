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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.sth.data.Bucket;
import net.sth.data.RawPoint;
import net.sth.data.Values;
import net.sth.query.AggregationPlan;
import net.sth.query.RetrievalTarget;
import net.sth.storage.CollectionHandle;
import net.sth.storage.HistoryDataStore;
import net.sth.storage.RawQueryOptions;
import net.sth.storage.RetrievalResult;

/**
 * Aggregates in process: reads the raw points of the range and reduces them
 * into buckets in memory.
 * <p>
 * When the plan is unbucketed the cap limits how many input points are
 * consumed, counted before values are coerced. Values that are not numeric
 * are skipped and a bucket without any numeric value is not emitted.
 */
public class ComputedAggregator implements BucketAggregator {
  private static final Logger LOG = LoggerFactory.getLogger(
      ComputedAggregator.class);

  private final HistoryDataStore store;

  public ComputedAggregator(final HistoryDataStore store) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.store = store;
  }

  @Override
  public Deferred<List<Bucket>> run(final CollectionHandle handle,
                                    final RetrievalTarget target,
                                    final AggregationPlan plan) {
    final RawQueryOptions options = RawQueryOptions.newBuilder()
        .setTimeFrom(plan.timeFrom())
        .setTimeTo(plan.timeTo())
        .build();

    class ReduceCB implements Callback<List<Bucket>, RetrievalResult> {
      @Override
      public List<Bucket> call(final RetrievalResult result) throws Exception {
        final List<Bucket> buckets = aggregate(plan, result.points());
        if (LOG.isDebugEnabled()) {
          LOG.debug("Reduced " + result.totalCount() + " points of " + target
              + " into " + buckets.size() + " buckets");
        }
        return buckets;
      }
    }

    return store.rawQuery(handle, target, options)
        .addCallback(new ReduceCB());
  }

  /**
   * Reduces the points into buckets.
   * @param plan The non-null plan.
   * @param points Points of the plan's attribute and range in ascending
   * reception time order.
   * @return The buckets sorted ascending by key.
   */
  public static List<Bucket> aggregate(final AggregationPlan plan,
                                       final Iterable<RawPoint> points) {
    final int limit = BucketAggregationPlanner.inputLimit(plan);
    final Map<String, BucketAccumulator> groups = Maps.newLinkedHashMap();
    int consumed = 0;
    for (final RawPoint point : points) {
      if (limit > 0 && consumed >= limit) {
        break;
      }
      consumed++;
      final Double value = Values.toDouble(point.attrValue());
      if (value == null) {
        continue;
      }
      final String key = plan.bucketKey(point.recvTime());
      BucketAccumulator accumulator = groups.get(key);
      if (accumulator == null) {
        accumulator = new BucketAccumulator(key, point.recvTime());
        groups.put(key, accumulator);
      }
      accumulator.add(value);
    }

    final List<Bucket> buckets = Lists.newArrayListWithCapacity(groups.size());
    for (final BucketAccumulator accumulator : groups.values()) {
      buckets.add(accumulator.toBucket(plan.method()));
    }
    Collections.sort(buckets);
    return buckets;
  }
}
