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

import com.stumbleupon.async.Deferred;

import net.sth.query.RetrievalTarget;
import net.sth.storage.CollectionHandle;

/**
 * The work done for one (entity, attribute) cell once its collection is
 * resolved: a raw read, an on-demand aggregation or a rollup read.
 */
public interface SubQuery {

  /** @return Whether the collection to resolve is the rollup one. */
  public boolean aggregatedCollection();

  /**
   * @param handle The non-null resolved collection.
   * @param target The cell to fetch.
   * @return A deferred resolving to the cell's data.
   */
  public Deferred<SubQueryResult> execute(final CollectionHandle handle,
                                          final RetrievalTarget target);
}
