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

import java.util.List;

import com.stumbleupon.async.Deferred;

import net.sth.data.Bucket;
import net.sth.data.HistoryDatum;
import net.sth.query.RetrievalTarget;
import net.sth.storage.pipeline.AggregationPipeline;

/**
 * The persistence backend holding the raw and rolled up history of entity
 * attributes. All calls are asynchronous; failures are reported through
 * the returned deferred's errback chain.
 */
public interface HistoryDataStore {

  /**
   * Resolves a logical key to a physical collection.
   * @param key A non-null key.
   * @return A deferred resolving to the handle or to null if the collection
   * does not exist.
   */
  public Deferred<CollectionHandle> resolveCollection(final CollectionKey key);

  /**
   * Reads raw points of the target attribute.
   * @param handle A non-null handle from {@link #resolveCollection}.
   * @param target The entity and attribute to read.
   * @param options The range and paging.
   * @return A deferred resolving to a non-null result.
   */
  public Deferred<RetrievalResult> rawQuery(final CollectionHandle handle,
                                            final RetrievalTarget target,
                                            final RawQueryOptions options);

  /**
   * Executes a grouping pipeline natively.
   * @param handle A non-null handle from {@link #resolveCollection}.
   * @param pipeline The pipeline to run.
   * @return A deferred resolving to the buckets in pipeline output order.
   */
  public Deferred<List<Bucket>> aggregate(final CollectionHandle handle,
                                          final AggregationPipeline pipeline);

  /**
   * Reads an externally maintained rollup collection.
   * @param handle A non-null handle resolved with the aggregated flag set.
   * @param query The rollup query.
   * @return A deferred resolving to the already bucketed points, possibly
   * empty.
   */
  public Deferred<List<HistoryDatum>> aggregatedQuery(
      final CollectionHandle handle,
      final RollupQuery query);

  /**
   * Releases resources held by the store.
   * @return A deferred resolving to null on completion.
   */
  public Deferred<Object> shutdown();
}
