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

import net.sth.data.HistoryDatum;
import net.sth.query.AggregationMethod;
import net.sth.query.AggregationPeriod;
import net.sth.query.RetrievalTarget;
import net.sth.storage.CollectionHandle;
import net.sth.storage.HistoryDataStore;
import net.sth.storage.RollupQuery;

/**
 * Reads precomputed rollups from the aggregated collection.
 */
public class RollupSubQuery implements SubQuery {

  private final HistoryDataStore store;
  private final AggregationMethod method;
  private final AggregationPeriod period;
  private final long time_from;
  private final long time_to;
  private final boolean filter_out_empty;

  public RollupSubQuery(final HistoryDataStore store,
                        final AggregationMethod method,
                        final AggregationPeriod period,
                        final long time_from,
                        final long time_to,
                        final boolean filter_out_empty) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.store = store;
    this.method = method;
    this.period = period;
    this.time_from = time_from;
    this.time_to = time_to;
    this.filter_out_empty = filter_out_empty;
  }

  @Override
  public boolean aggregatedCollection() {
    return true;
  }

  @Override
  public Deferred<SubQueryResult> execute(final CollectionHandle handle,
                                          final RetrievalTarget target) {
    final RollupQuery query;
    try {
      query = new RollupQuery(target, method, period, time_from, time_to,
          filter_out_empty);
    } catch (IllegalArgumentException e) {
      return Deferred.fromError(e);
    }

    class ResultCB implements Callback<SubQueryResult, List<HistoryDatum>> {
      @Override
      public SubQueryResult call(final List<HistoryDatum> points)
          throws Exception {
        return new SubQueryResult(points, points.size());
      }
    }
    return store.aggregatedQuery(handle, query).addCallback(new ResultCB());
  }
}
