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

import java.util.Collections;
import java.util.List;

import net.sth.data.HistoryDatum;

/**
 * The data of one cell and the number of records it accounts for in the
 * total count.
 */
public class SubQueryResult {

  private final List<? extends HistoryDatum> data;
  private final long record_count;

  public SubQueryResult(final List<? extends HistoryDatum> data,
                        final long record_count) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    this.data = data;
    this.record_count = record_count;
  }

  /** @return A result without data or records. */
  public static SubQueryResult empty() {
    return new SubQueryResult(Collections.<HistoryDatum>emptyList(), 0);
  }

  public List<? extends HistoryDatum> data() {
    return data;
  }

  public long recordCount() {
    return record_count;
  }

  public boolean isEmpty() {
    return data.isEmpty();
  }
}
