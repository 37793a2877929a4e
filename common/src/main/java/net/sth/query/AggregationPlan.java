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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.sth.utils.DateTime;

/**
 * An immutable description of one on-demand aggregation: which attribute
 * and time range to read, how to derive the bucket key, which statistic to
 * apply and how many input points to consider when unbucketed.
 * <p>
 * The cap only applies when the period is {@link AggregationPeriod#NONE};
 * bucketed plans ignore it.
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = AggregationPlan.Builder.class)
public class AggregationPlan {

  private final AggregationMethod method;
  private final AggregationPeriod period;
  private final Integer cap;
  private final String attribute;
  private final long time_from;
  private final long time_to;

  protected AggregationPlan(final Builder builder) {
    if (builder.method == null) {
      throw new InvalidPlanException("Method cannot be null.");
    }
    if (!builder.method.onDemand()) {
      throw new InvalidPlanException("Method " + builder.method.methodName()
          + " cannot be computed on demand.");
    }
    if (Strings.isNullOrEmpty(builder.attribute)) {
      throw new InvalidPlanException("Attribute cannot be null or empty.");
    }
    final AggregationPeriod period = builder.period == null ?
        AggregationPeriod.NONE : builder.period;
    if (period == AggregationPeriod.NONE && builder.cap != null
        && builder.cap < 0) {
      throw new InvalidPlanException("The cap must be positive when the "
          + "aggregation is not bucketed by period: " + builder.cap);
    }
    method = builder.method;
    this.period = period;
    cap = builder.cap;
    attribute = builder.attribute;
    time_from = builder.time_from;
    time_to = builder.time_to;
  }

  @JsonProperty("method")
  public AggregationMethod method() {
    return method;
  }

  @JsonProperty("period")
  public AggregationPeriod period() {
    return period;
  }

  /** @return The cap as given, may be null. */
  @JsonProperty("cap")
  public Integer cap() {
    return cap;
  }

  /** @return The cap to apply to input points, null if none applies. */
  public Integer effectiveCap() {
    return period == AggregationPeriod.NONE ? cap : null;
  }

  @JsonProperty("attribute")
  public String attribute() {
    return attribute;
  }

  /** @return The inclusive start of the range in epoch millis. */
  @JsonProperty("timeFrom")
  public long timeFrom() {
    return time_from;
  }

  /** @return The inclusive end of the range in epoch millis. */
  @JsonProperty("timeTo")
  public long timeTo() {
    return time_to;
  }

  /**
   * The bucket key of a point received at the given time.
   * @param recv_time The reception time in epoch millis.
   * @return The truncated ISO time or the attribute name when unbucketed.
   */
  public String bucketKey(final long recv_time) {
    if (!period.isBucketed()) {
      return attribute;
    }
    return DateTime.truncatedIsoString(recv_time,
        period.keyLength());
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final AggregationPlan other = (AggregationPlan) o;
    return method == other.method
        && period == other.period
        && Objects.equal(cap, other.cap)
        && Objects.equal(attribute, other.attribute)
        && time_from == other.time_from
        && time_to == other.time_to;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(method, period, cap, attribute, time_from, time_to);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("method=").append(method)
        .append(", period=").append(period)
        .append(", cap=").append(cap)
        .append(", attribute=").append(attribute)
        .append(", timeFrom=").append(time_from)
        .append(", timeTo=").append(time_to)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    private AggregationMethod method;
    private AggregationPeriod period;
    private Integer cap;
    private String attribute;
    private long time_from = 0;
    private long time_to = Long.MAX_VALUE;

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

    public Builder setAttribute(final String attribute) {
      this.attribute = attribute;
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

    /**
     * @return The plan.
     * @throws InvalidPlanException if the settings were invalid.
     */
    public AggregationPlan build() {
      return new AggregationPlan(this);
    }
  }
}
