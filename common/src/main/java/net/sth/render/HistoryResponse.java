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
package net.sth.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Objects;

/**
 * The one payload emitted for a history request along with the total record
 * count when the caller asked for it.
 */
public class HistoryResponse {

  private final JsonNode payload;
  private final Long total_count;

  public HistoryResponse(final JsonNode payload, final Long total_count) {
    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null.");
    }
    this.payload = payload;
    this.total_count = total_count;
  }

  public JsonNode payload() {
    return payload;
  }

  /** @return The total record count, null if it was not requested. */
  public Long totalCount() {
    return total_count;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final HistoryResponse other = (HistoryResponse) o;
    return payload.equals(other.payload)
        && Objects.equal(total_count, other.total_count);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(payload, total_count);
  }

  @Override
  public String toString() {
    return "payload=" + payload + ", totalCount=" + total_count;
  }
}
