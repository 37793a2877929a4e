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

import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.sth.query.RetrievalTarget;
import net.sth.storage.CollectionHandle;
import net.sth.storage.HistoryDataStore;
import net.sth.storage.RawQueryOptions;
import net.sth.storage.RetrievalResult;

/**
 * Reads raw points. The record count is the store's pre-paging total.
 */
public class RawSubQuery implements SubQuery {

  private final HistoryDataStore store;
  private final RawQueryOptions options;

  public RawSubQuery(final HistoryDataStore store,
                     final RawQueryOptions options) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (options == null) {
      throw new IllegalArgumentException("Options cannot be null.");
    }
    this.store = store;
    this.options = options;
  }

  public RawQueryOptions options() {
    return options;
  }

  @Override
  public boolean aggregatedCollection() {
    return false;
  }

  @Override
  public Deferred<SubQueryResult> execute(final CollectionHandle handle,
                                          final RetrievalTarget target) {
    class ResultCB implements Callback<SubQueryResult, RetrievalResult> {
      @Override
      public SubQueryResult call(final RetrievalResult result)
          throws Exception {
        return new SubQueryResult(result.points(), result.totalCount());
      }
    }
    return store.rawQuery(handle, target, options).addCallback(new ResultCB());
  }
}
