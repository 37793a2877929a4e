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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Deferred;

import net.sth.data.Bucket;
import net.sth.query.AggregationPlan;
import net.sth.query.RetrievalTarget;
import net.sth.storage.CollectionHandle;
import net.sth.storage.HistoryDataStore;
import net.sth.storage.pipeline.AggregationPipeline;

/**
 * Aggregates in the store by handing it the plan as a grouping pipeline.
 * Produces the same buckets as {@link ComputedAggregator}.
 */
public class PipelineAggregator implements BucketAggregator {
  private static final Logger LOG = LoggerFactory.getLogger(
      PipelineAggregator.class);

  private final HistoryDataStore store;

  public PipelineAggregator(final HistoryDataStore store) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.store = store;
  }

  @Override
  public Deferred<List<Bucket>> run(final CollectionHandle handle,
                                    final RetrievalTarget target,
                                    final AggregationPlan plan) {
    final AggregationPipeline pipeline =
        BucketAggregationPlanner.toPipeline(plan);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Running pipeline on " + handle + " for " + target + ": "
          + pipeline);
    }
    return store.aggregate(handle, pipeline);
  }
}
