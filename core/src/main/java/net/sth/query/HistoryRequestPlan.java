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
package net.sth.query;

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.sth.storage.RawQueryOptions;

/**
 * The classification of a history query: what kind of retrieval to run,
 * over how many targets and, for on-demand aggregation, with which backend.
 */
public class HistoryRequestPlan {

  /** The retrieval mode. */
  public static enum RequestType {
    /** Raw points, possibly paged. */
    RAW,
    /** Buckets computed from raw points at request time. */
    ON_DEMAND_AGGREGATE,
    /** Buckets read from externally maintained rollups. */
    PRECOMPUTED_AGGREGATE
  }

  /** Where on-demand aggregation runs. */
  public static enum AggregatorBackend {
    /** In process reduction of the raw points. */
    COMPUTED,
    /** Native grouping in the store. */
    PIPELINE
  }

  private final HistoryQuery query;
  private final RequestType type;
  private final AggregatorBackend backend;
  private final List<String> entity_ids;
  private final List<String> attr_names;
  private final AggregationMethod method;
  private final AggregationPeriod period;
  private final Integer cap;
  private final long time_from;
  private final long time_to;
  private final RawQueryOptions raw_options;

  protected HistoryRequestPlan(final Builder builder) {
    if (builder.query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (builder.type == RequestType.ON_DEMAND_AGGREGATE
        && builder.backend == null) {
      throw new IllegalArgumentException("On demand aggregation requires "
          + "a backend.");
    }
    if (builder.type == RequestType.RAW && builder.raw_options == null) {
      throw new IllegalArgumentException("Raw retrieval requires options.");
    }
    query = builder.query;
    type = builder.type;
    backend = builder.backend;
    entity_ids = ImmutableList.copyOf(builder.entity_ids);
    attr_names = ImmutableList.copyOf(builder.attr_names);
    method = builder.method;
    period = builder.period;
    cap = builder.cap;
    time_from = builder.time_from;
    time_to = builder.time_to;
    raw_options = builder.raw_options;
  }

  public HistoryQuery query() {
    return query;
  }

  public RequestType type() {
    return type;
  }

  /** @return The aggregator backend, null unless aggregating on demand. */
  public AggregatorBackend backend() {
    return backend;
  }

  public List<String> entityIds() {
    return entity_ids;
  }

  public List<String> attrNames() {
    return attr_names;
  }

  /** @return True when more than one entity or attribute was requested. */
  public boolean multiTarget() {
    return entity_ids.size() > 1 || attr_names.size() > 1;
  }

  /** @return The aggregation method, null for raw retrieval. */
  public AggregationMethod method() {
    return method;
  }

  /** @return The aggregation period, null for raw retrieval. */
  public AggregationPeriod period() {
    return period;
  }

  /** @return The on-demand input cap, may be null. */
  public Integer cap() {
    return cap;
  }

  public long timeFrom() {
    return time_from;
  }

  public long timeTo() {
    return time_to;
  }

  /** @return The raw options, null unless raw. */
  public RawQueryOptions rawOptions() {
    return raw_options;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("type=").append(type)
        .append(", backend=").append(backend)
        .append(", entityIds=").append(entity_ids)
        .append(", attrNames=").append(attr_names)
        .append(", method=").append(method)
        .append(", period=").append(period)
        .append(", cap=").append(cap)
        .append(", timeFrom=").append(time_from)
        .append(", timeTo=").append(time_to)
        .append(", rawOptions=").append(raw_options)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private HistoryQuery query;
    private RequestType type;
    private AggregatorBackend backend;
    private List<String> entity_ids;
    private List<String> attr_names;
    private AggregationMethod method;
    private AggregationPeriod period;
    private Integer cap;
    private long time_from;
    private long time_to = Long.MAX_VALUE;
    private RawQueryOptions raw_options;

    public Builder setQuery(final HistoryQuery query) {
      this.query = query;
      return this;
    }

    public Builder setType(final RequestType type) {
      this.type = type;
      return this;
    }

    public Builder setBackend(final AggregatorBackend backend) {
      this.backend = backend;
      return this;
    }

    public Builder setEntityIds(final List<String> entity_ids) {
      this.entity_ids = entity_ids;
      return this;
    }

    public Builder setAttrNames(final List<String> attr_names) {
      this.attr_names = attr_names;
      return this;
    }

    public Builder setMethod(final AggregationMethod method) {
      this.method = method;
      return this;
    }

    public Builder setPeriod(final AggregationPeriod period) {
      this.period = period;
      return this;
    }

    public Builder setCap(final Integer cap) {
      this.cap = cap;
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

    public Builder setRawOptions(final RawQueryOptions raw_options) {
      this.raw_options = raw_options;
      return this;
    }

    public HistoryRequestPlan build() {
      return new HistoryRequestPlan(this);
    }
  }
}
