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

import com.google.common.base.Objects;

/**
 * The time range and paging of a raw retrieval. When {@link #lastN()} is
 * set the newest points win and the page settings are ignored. Zero means
 * "no limit" for both lastN and hLimit.
 */
public class RawQueryOptions {

  private final Integer last_n;
  private final int h_limit;
  private final int h_offset;
  private final long time_from;
  private final long time_to;
  private final boolean count;

  protected RawQueryOptions(final Builder builder) {
    if (builder.last_n != null && builder.last_n < 0) {
      throw new IllegalArgumentException("lastN cannot be negative: "
          + builder.last_n);
    }
    if (builder.h_limit < 0 || builder.h_offset < 0) {
      throw new IllegalArgumentException("Page settings cannot be negative.");
    }
    if (builder.time_to < builder.time_from) {
      throw new IllegalArgumentException("End of the range cannot be before "
          + "the start.");
    }
    last_n = builder.last_n;
    h_limit = builder.h_limit;
    h_offset = builder.h_offset;
    time_from = builder.time_from;
    time_to = builder.time_to;
    count = builder.count;
  }

  /** @return The number of newest points to return, null if paging. */
  public Integer lastN() {
    return last_n;
  }

  /** @return The page size, 0 for no limit. */
  public int hLimit() {
    return h_limit;
  }

  public int hOffset() {
    return h_offset;
  }

  public long timeFrom() {
    return time_from;
  }

  public long timeTo() {
    return time_to;
  }

  /** @return Whether or not the caller wants the total count. */
  public boolean count() {
    return count;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final RawQueryOptions other = (RawQueryOptions) o;
    return Objects.equal(last_n, other.last_n)
        && h_limit == other.h_limit
        && h_offset == other.h_offset
        && time_from == other.time_from
        && time_to == other.time_to
        && count == other.count;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(last_n, h_limit, h_offset, time_from, time_to,
        count);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("lastN=").append(last_n)
        .append(", hLimit=").append(h_limit)
        .append(", hOffset=").append(h_offset)
        .append(", timeFrom=").append(time_from)
        .append(", timeTo=").append(time_to)
        .append(", count=").append(count)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private Integer last_n;
    private int h_limit;
    private int h_offset;
    private long time_from = 0;
    private long time_to = Long.MAX_VALUE;
    private boolean count;

    public Builder setLastN(final Integer last_n) {
      this.last_n = last_n;
      return this;
    }

    public Builder setHLimit(final int h_limit) {
      this.h_limit = h_limit;
      return this;
    }

    public Builder setHOffset(final int h_offset) {
      this.h_offset = h_offset;
      return this;
    }

    public Builder setTimeFrom(final long time_from) {
      this.time_from = time_from;
      return this;
    }

    public Builder setTimeTo(final long time_to) {
      this.time_to = time_to;
      return this;
    }

    public Builder setCount(final boolean count) {
      this.count = count;
      return this;
    }

    public RawQueryOptions build() {
      return new RawQueryOptions(this);
    }
  }
}
