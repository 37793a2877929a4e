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

import net.sth.query.AggregationMethod;
import net.sth.query.AggregationPeriod;
import net.sth.query.AggregationPlan;
import net.sth.storage.pipeline.AggregationPipeline;
import net.sth.storage.pipeline.GroupStage;
import net.sth.storage.pipeline.LimitStage;
import net.sth.storage.pipeline.MatchStage;
import net.sth.storage.pipeline.NumericFilterStage;
import net.sth.storage.pipeline.ProjectStage;
import net.sth.storage.pipeline.SortStage;

/**
 * Builds aggregation plans and translates them into store pipelines. No
 * I/O happens here so both aggregators agree on what a plan means.
 */
public final class BucketAggregationPlanner {

  private BucketAggregationPlanner() {
    // static helpers only
  }

  /**
   * Builds a plan.
   * @param method The non-null, on demand method.
   * @param period The period, null for none.
   * @param cap The input cap, only honored when unbucketed. May be null.
   * @param attribute The non-null attribute name.
   * @param time_from The inclusive start in epoch millis.
   * @param time_to The inclusive end in epoch millis.
   * @return The plan.
   * @throws net.sth.query.InvalidPlanException if the combination is
   * invalid, e.g. a negative cap without a period.
   */
  public static AggregationPlan plan(final AggregationMethod method,
                                     final AggregationPeriod period,
                                     final Integer cap,
                                     final String attribute,
                                     final long time_from,
                                     final long time_to) {
    return AggregationPlan.newBuilder()
        .setMethod(method)
        .setPeriod(period)
        .setCap(cap)
        .setAttribute(attribute)
        .setTimeFrom(time_from)
        .setTimeTo(time_to)
        .build();
  }

  /**
   * The number of input points an aggregator may consume.
   * @param plan A non-null plan.
   * @return A positive limit or 0 if the input is unbounded.
   */
  public static int inputLimit(final AggregationPlan plan) {
    final Integer cap = plan.effectiveCap();
    return cap == null || cap <= 0 ? 0 : cap;
  }

  /**
   * Translates the plan into match, optional limit, project, numeric filter,
   * group and sort stages.
   * @param plan A non-null plan.
   * @return The pipeline.
   */
  public static AggregationPipeline toPipeline(final AggregationPlan plan) {
    final AggregationPipeline.Builder builder = AggregationPipeline.newBuilder()
        .addStage(new MatchStage(plan.attribute(), plan.timeFrom(),
            plan.timeTo()));
    final int limit = inputLimit(plan);
    if (limit > 0) {
      builder.addStage(new LimitStage(limit));
    }
    return builder
        .addStage(new ProjectStage(plan.period().keyLength(),
            plan.attribute()))
        .addStage(new NumericFilterStage())
        .addStage(new GroupStage(plan.method()))
        .addStage(new SortStage())
        .build();
  }
}
