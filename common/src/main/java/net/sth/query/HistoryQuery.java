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

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.sth.data.Representation;

/**
 * The parameters of one history request as extracted by the HTTP layer:
 * the tenant headers, the route identifiers and the query string. Numeric
 * parameters are null when absent so that zero can be told apart from
 * "not given".
 * <p>
 * The entity ID and attribute name may be comma separated lists.
 */
public class HistoryQuery {

  private static final Splitter LIST_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  private final String service;
  private final String service_path;
  private final String entity_id;
  private final String entity_type;
  private final String attr_name;
  private final Integer last_n;
  private final Integer h_limit;
  private final Integer h_offset;
  private final Long date_from;
  private final Long date_to;
  private final String filetype;
  private final String aggr_method;
  private final String aggr_period;
  private final boolean count;
  private final boolean lightweight;

  protected HistoryQuery(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.entity_id)) {
      throw new IllegalArgumentException("Entity ID cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(builder.attr_name)) {
      throw new IllegalArgumentException("Attribute name cannot be null "
          + "or empty.");
    }
    service = builder.service;
    service_path = builder.service_path;
    entity_id = builder.entity_id;
    entity_type = builder.entity_type;
    attr_name = builder.attr_name;
    last_n = builder.last_n;
    h_limit = builder.h_limit;
    h_offset = builder.h_offset;
    date_from = builder.date_from;
    date_to = builder.date_to;
    filetype = builder.filetype;
    aggr_method = builder.aggr_method;
    aggr_period = builder.aggr_period;
    count = builder.count;
    lightweight = builder.lightweight;
  }

  public String service() {
    return service;
  }

  public String servicePath() {
    return service_path;
  }

  /** @return The raw entity ID route parameter, possibly a list. */
  public String entityId() {
    return entity_id;
  }

  public String entityType() {
    return entity_type;
  }

  /** @return The raw attribute name route parameter, possibly a list. */
  public String attrName() {
    return attr_name;
  }

  /** @return The entity IDs split on commas. */
  public List<String> entityIds() {
    return ImmutableList.copyOf(LIST_SPLITTER.split(entity_id));
  }

  /** @return The attribute names split on commas. */
  public List<String> attrNames() {
    return ImmutableList.copyOf(LIST_SPLITTER.split(attr_name));
  }

  /** @return The number of newest points to return, null if absent. */
  public Integer lastN() {
    return last_n;
  }

  /** @return The page size, null if absent. */
  public Integer hLimit() {
    return h_limit;
  }

  /** @return The page offset, null if absent. */
  public Integer hOffset() {
    return h_offset;
  }

  /** @return The inclusive range start in epoch millis, null if absent. */
  public Long dateFrom() {
    return date_from;
  }

  /** @return The inclusive range end in epoch millis, null if absent. */
  public Long dateTo() {
    return date_to;
  }

  public String filetype() {
    return filetype;
  }

  public String aggrMethod() {
    return aggr_method;
  }

  public String aggrPeriod() {
    return aggr_period;
  }

  /** @return Whether or not the total count should be reported. */
  public boolean count() {
    return count;
  }

  /** @return Whether or not the light-weight representation was asked for. */
  public boolean lightweight() {
    return lightweight;
  }

  /** @return The representation to render attributes with. */
  public Representation representation() {
    return lightweight ? Representation.LIGHTWEIGHT : Representation.CANONICAL;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("service=").append(service)
        .append(", servicePath=").append(service_path)
        .append(", entityId=").append(entity_id)
        .append(", entityType=").append(entity_type)
        .append(", attrName=").append(attr_name)
        .append(", lastN=").append(last_n)
        .append(", hLimit=").append(h_limit)
        .append(", hOffset=").append(h_offset)
        .append(", dateFrom=").append(date_from)
        .append(", dateTo=").append(date_to)
        .append(", filetype=").append(filetype)
        .append(", aggrMethod=").append(aggr_method)
        .append(", aggrPeriod=").append(aggr_period)
        .append(", count=").append(count)
        .append(", lightweight=").append(lightweight)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String service;
    private String service_path;
    private String entity_id;
    private String entity_type;
    private String attr_name;
    private Integer last_n;
    private Integer h_limit;
    private Integer h_offset;
    private Long date_from;
    private Long date_to;
    private String filetype;
    private String aggr_method;
    private String aggr_period;
    private boolean count;
    private boolean lightweight;

    public Builder setService(final String service) {
      this.service = service;
      return this;
    }

    public Builder setServicePath(final String service_path) {
      this.service_path = service_path;
      return this;
    }

    public Builder setEntityId(final String entity_id) {
      this.entity_id = entity_id;
      return this;
    }

    public Builder setEntityType(final String entity_type) {
      this.entity_type = entity_type;
      return this;
    }

    public Builder setAttrName(final String attr_name) {
      this.attr_name = attr_name;
      return this;
    }

    public Builder setLastN(final Integer last_n) {
      this.last_n = last_n;
      return this;
    }

    public Builder setHLimit(final Integer h_limit) {
      this.h_limit = h_limit;
      return this;
    }

    public Builder setHOffset(final Integer h_offset) {
      this.h_offset = h_offset;
      return this;
    }

    public Builder setDateFrom(final Long date_from) {
      this.date_from = date_from;
      return this;
    }

    public Builder setDateTo(final Long date_to) {
      this.date_to = date_to;
      return this;
    }

    public Builder setFiletype(final String filetype) {
      this.filetype = filetype;
      return this;
    }

    public Builder setAggrMethod(final String aggr_method) {
      this.aggr_method = aggr_method;
      return this;
    }

    public Builder setAggrPeriod(final String aggr_period) {
      this.aggr_period = aggr_period;
      return this;
    }

    public Builder setCount(final boolean count) {
      this.count = count;
      return this;
    }

    public Builder setLightweight(final boolean lightweight) {
      this.lightweight = lightweight;
      return this;
    }

    public HistoryQuery build() {
      return new HistoryQuery(this);
    }
  }
}
