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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.sth.query.AggregationMethod;
import net.sth.query.AggregationPeriod;
import net.sth.query.AggregationPlan;
import net.sth.query.InvalidPlanException;
import net.sth.storage.pipeline.AggregationPipeline;
import net.sth.storage.pipeline.GroupStage;
import net.sth.storage.pipeline.LimitStage;
import net.sth.storage.pipeline.MatchStage;
import net.sth.storage.pipeline.NumericFilterStage;
import net.sth.storage.pipeline.ProjectStage;
import net.sth.storage.pipeline.SortStage;

public class TestBucketAggregationPlanner {

  @Test
  public void plan() throws Exception {
    final AggregationPlan plan = BucketAggregationPlanner.plan(
        AggregationMethod.AVG, AggregationPeriod.HOUR, null, "temperature",
        1000, 2000);
    assertEquals(AggregationMethod.AVG, plan.method());
    assertEquals(AggregationPeriod.HOUR, plan.period());
    assertEquals("temperature", plan.attribute());
    assertEquals(1000, plan.timeFrom());
    assertEquals(2000, plan.timeTo());
  }

  @Test(expected = InvalidPlanException.class)
  public void planNegativeCap() throws Exception {
    BucketAggregationPlanner.plan(AggregationMethod.AVG,
        AggregationPeriod.NONE, -1, "temperature", 0, Long.MAX_VALUE);
  }

  @Test
  public void inputLimit() throws Exception {
    assertEquals(5, BucketAggregationPlanner.inputLimit(
        BucketAggregationPlanner.plan(AggregationMethod.MIN, null, 5,
            "temperature", 0, Long.MAX_VALUE)));
    assertEquals(0, BucketAggregationPlanner.inputLimit(
        BucketAggregationPlanner.plan(AggregationMethod.MIN, null, 0,
            "temperature", 0, Long.MAX_VALUE)));
    assertEquals(0, BucketAggregationPlanner.inputLimit(
        BucketAggregationPlanner.plan(AggregationMethod.MIN, null, null,
            "temperature", 0, Long.MAX_VALUE)));
    assertEquals(0, BucketAggregationPlanner.inputLimit(
        BucketAggregationPlanner.plan(AggregationMethod.MIN,
            AggregationPeriod.DAY, 5, "temperature", 0, Long.MAX_VALUE)));
  }

  @Test
  public void toPipelineBucketed() throws Exception {
    final AggregationPipeline pipeline = BucketAggregationPlanner.toPipeline(
        BucketAggregationPlanner.plan(AggregationMethod.MAX,
            AggregationPeriod.DAY, 5, "temperature", 1000, 2000));
    assertEquals(5, pipeline.stages().size());
    assertEquals(new MatchStage("temperature", 1000, 2000),
        pipeline.stages().get(0));
    assertEquals(new ProjectStage(10, "temperature"),
        pipeline.stages().get(1));
    assertTrue(pipeline.stages().get(2) instanceof NumericFilterStage);
    assertEquals(new GroupStage(AggregationMethod.MAX),
        pipeline.stages().get(3));
    assertTrue(pipeline.stages().get(4) instanceof SortStage);
    assertNull(pipeline.stage(LimitStage.class));
  }

  @Test
  public void toPipelineCapped() throws Exception {
    final AggregationPipeline pipeline = BucketAggregationPlanner.toPipeline(
        BucketAggregationPlanner.plan(AggregationMethod.MIN,
            AggregationPeriod.NONE, 3, "temperature", 0, Long.MAX_VALUE));
    assertEquals(6, pipeline.stages().size());
    assertEquals(new LimitStage(3), pipeline.stages().get(1));
    assertEquals(new ProjectStage(-1, "temperature"),
        pipeline.stages().get(2));
  }
}
