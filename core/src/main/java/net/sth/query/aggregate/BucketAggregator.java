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

import com.stumbleupon.async.Deferred;

import net.sth.data.Bucket;
import net.sth.query.AggregationPlan;
import net.sth.query.RetrievalTarget;
import net.sth.storage.CollectionHandle;

/**
 * Executes an aggregation plan against a resolved collection. Every
 * implementation must produce the same buckets for the same data.
 */
public interface BucketAggregator {

  /**
   * @param handle The non-null collection handle.
   * @param target The entity and attribute being aggregated.
   * @param plan The plan to execute.
   * @return A deferred resolving to the buckets sorted ascending by key.
   */
  public Deferred<List<Bucket>> run(final CollectionHandle handle,
                                    final RetrievalTarget target,
                                    final AggregationPlan plan);
}
