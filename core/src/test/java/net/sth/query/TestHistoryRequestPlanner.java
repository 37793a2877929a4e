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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.sth.query.HistoryRequestPlan.AggregatorBackend;
import net.sth.query.HistoryRequestPlan.RequestType;
import net.sth.utils.Config;

public class TestHistoryRequestPlanner {

  private HistoryRequestPlanner planner;

  @Before
  public void before() throws Exception {
    final Config config = new Config(false);
    config.overrideConfig(Config.MAX_PAGE_SIZE_KEY, "10");
    planner = new HistoryRequestPlanner(config);
  }

  @Test
  public void rawLastN() throws Exception {
    final HistoryRequestPlan plan = planner.plan(query()
        .setLastN(2)
        .setDateFrom(1000L)
        .setDateTo(2000L)
        .setCount(true)
        .build());
    assertEquals(RequestType.RAW, plan.type());
    assertNull(plan.backend());
    assertFalse(plan.multiTarget());
    assertEquals(2, (int) plan.rawOptions().lastN());
    assertEquals(1000, plan.rawOptions().timeFrom());
    assertEquals(2000, plan.rawOptions().timeTo());
    assertTrue(plan.rawOptions().count());
  }

  @Test
  public void rawLastNZero() throws Exception {
    final HistoryRequestPlan plan = planner.plan(query()
        .setLastN(0)
        .build());
    assertEquals(RequestType.RAW, plan.type());
    assertEquals(0, (int) plan.rawOptions().lastN());
  }

  @Test
  public void rawPaged() throws Exception {
    final HistoryRequestPlan plan = planner.plan(query()
        .setHLimit(0)
        .setHOffset(0)
        .build());
    assertEquals(RequestType.RAW, plan.type());
    assertNull(plan.rawOptions().lastN());

    final HistoryRequestPlan paged = planner.plan(query()
        .setHLimit(5)
        .setHOffset(20)
        .build());
    assertEquals(5, paged.rawOptions().hLimit());
    assertEquals(20, paged.rawOptions().hOffset());
  }

  @Test
  public void rawCsv() throws Exception {
    final HistoryRequestPlan plan = planner.plan(query()
        .setFiletype("CSV")
        .build());
    assertEquals(RequestType.RAW, plan.type());
  }

  @Test
  public void rawTakesPrecedence() throws Exception {
    final HistoryRequestPlan plan = planner.plan(query()
        .setLastN(3)
        .setAggrMethod("avg")
        .setAggrPeriod("hour")
        .build());
    assertEquals(RequestType.RAW, plan.type());
  }

  @Test
  public void pagingBounds() throws Exception {
    // hLimit <= lastN <= max page size
    for (int last_n = 0; last_n <= 10; last_n++) {
      for (int h_limit = 0; h_limit <= last_n; h_limit++) {
        assertEquals(RequestType.RAW, planner.plan(query()
            .setLastN(last_n)
            .setHLimit(h_limit)
            .setHOffset(0)
            .build()).type());
      }
    }
    // lastN of 0 returns everything and doesn't bound hLimit
    assertEquals(RequestType.RAW, planner.plan(query()
        .setLastN(0)
        .setHLimit(5)
        .setHOffset(0)
        .build()).type());
    assertInvalid(query().setLastN(11), "lastN");
    assertInvalid(query().setHLimit(11).setHOffset(0), "hLimit");
    assertInvalid(query().setLastN(3).setHLimit(4).setHOffset(0), "hLimit",
        "lastN");
    assertInvalid(query().setLastN(-1), "lastN");
    assertInvalid(query().setHLimit(-1).setHOffset(0), "hLimit");
    assertInvalid(query().setHLimit(1).setHOffset(-1), "hOffset");
  }

  @Test
  public void multiTarget() throws Exception {
    HistoryRequestPlan plan = planner.plan(HistoryQuery.newBuilder()
        .setEntityId("room1,room2")
        .setAttrName("temperature")
        .setLastN(2)
        .build());
    assertTrue(plan.multiTarget());
    assertEquals(ImmutableList.of("room1", "room2"), plan.entityIds());

    plan = planner.plan(HistoryQuery.newBuilder()
        .setEntityId("room1")
        .setAttrName("temperature,humidity")
        .setAggrMethod("max")
        .setAggrPeriod("day")
        .build());
    assertTrue(plan.multiTarget());
    assertEquals(RequestType.ON_DEMAND_AGGREGATE, plan.type());
  }

  @Test
  public void multiTargetRawGuard() throws Exception {
    try {
      planner.plan(HistoryQuery.newBuilder()
          .setEntityId("room1,room2")
          .setAttrName("temperature")
          .setFiletype("csv")
          .build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) {
      assertTrue(e.keys().contains("filetype"));
    }

    try {
      planner.plan(HistoryQuery.newBuilder()
          .setEntityId("room1,room2")
          .setAttrName("temperature")
          .setLastN(1)
          .setAggrMethod("avg")
          .setAggrPeriod("hour")
          .build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }

    // a single target export is fine
    assertEquals(RequestType.RAW, planner.plan(query()
        .setFiletype("csv")
        .build()).type());
  }

  @Test
  public void onDemandPipeline() throws Exception {
    final HistoryRequestPlan plan = planner.plan(query()
        .setAggrMethod("avg")
        .setAggrPeriod("hour")
        .setDateFrom(1000L)
        .build());
    assertEquals(RequestType.ON_DEMAND_AGGREGATE, plan.type());
    assertEquals(AggregatorBackend.PIPELINE, plan.backend());
    assertEquals(AggregationMethod.AVG, plan.method());
    assertEquals(AggregationPeriod.HOUR, plan.period());
    assertNull(plan.cap());
    assertEquals(1000, plan.timeFrom());
    assertEquals(Long.MAX_VALUE, plan.timeTo());
  }

  @Test
  public void onDemandComputed() throws Exception {
    final HistoryRequestPlan plan = planner.plan(query()
        .setAggrMethod("min")
        .setHLimit(50)
        .build());
    assertEquals(RequestType.ON_DEMAND_AGGREGATE, plan.type());
    assertEquals(AggregatorBackend.COMPUTED, plan.backend());
    assertEquals(AggregationPeriod.NONE, plan.period());
    // the max page size doesn't bound the aggregation cap
    assertEquals(50, (int) plan.cap());
  }

  @Test
  public void onDemandZeroLimit() throws Exception {
    // a zero hLimit counts as absent when choosing the aggregation mode
    HistoryRequestPlan plan = planner.plan(query()
        .setAggrMethod("avg")
        .setAggrPeriod("hour")
        .setHLimit(0)
        .build());
    assertEquals(RequestType.ON_DEMAND_AGGREGATE, plan.type());
    assertEquals(AggregatorBackend.PIPELINE, plan.backend());
    assertEquals(AggregationPeriod.HOUR, plan.period());

    plan = planner.plan(HistoryQuery.newBuilder()
        .setEntityId("room1,room2")
        .setAttrName("temperature")
        .setAggrMethod("avg")
        .setAggrPeriod("hour")
        .setHLimit(0)
        .build());
    assertTrue(plan.multiTarget());
    assertEquals(RequestType.ON_DEMAND_AGGREGATE, plan.type());

    try {
      planner.plan(query().setAggrMethod("avg").setHLimit(0).build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) {
      assertEquals(HistoryRequestPlanner.MISSING_COMBINATION, e.getMessage());
    }
  }

  @Test
  public void onDemandNotComputable() throws Exception {
    assertInvalid(query().setAggrMethod("sum").setAggrPeriod("hour"),
        "aggrMethod");
  }

  @Test
  public void onDemandUnknownNames() throws Exception {
    try {
      planner.plan(query().setAggrMethod("median").setAggrPeriod("hour")
          .build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
    try {
      planner.plan(query().setAggrMethod("avg").setAggrPeriod("week")
          .build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
  }

  @Test
  public void precomputed() throws Exception {
    final HistoryRequestPlan plan = planner.plan(query()
        .setAggrMethod("sum")
        .setAggrPeriod("day")
        .setHLimit(5)
        .build());
    assertEquals(RequestType.PRECOMPUTED_AGGREGATE, plan.type());
    assertEquals(AggregationMethod.SUM, plan.method());
    assertEquals(AggregationPeriod.DAY, plan.period());
    assertNull(plan.backend());
  }

  @Test
  public void precomputedGuards() throws Exception {
    assertInvalid(HistoryQuery.newBuilder()
        .setEntityId("room1,room2")
        .setAttrName("temperature")
        .setAggrMethod("sum")
        .setAggrPeriod("day")
        .setHLimit(5), "aggrMethod", "aggrPeriod");
    assertInvalid(query()
        .setAggrMethod("sum")
        .setAggrPeriod("none")
        .setHLimit(5), "aggrPeriod");
  }

  @Test
  public void invalidCombination() throws Exception {
    try {
      planner.plan(query().build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) {
      assertEquals(HistoryRequestPlanner.MISSING_COMBINATION, e.getMessage());
      assertEquals(InvalidQueryException.QUERY_KEYS, e.keys());
    }

    // offset alone or period alone don't select anything
    try {
      planner.plan(query().setHOffset(3).build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
    try {
      planner.plan(query().setAggrPeriod("hour").build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
  }

  @Test
  public void invalidRange() throws Exception {
    assertInvalid(query().setLastN(1).setDateFrom(2000L).setDateTo(1000L),
        "dateFrom", "dateTo");
  }

  @Test
  public void emptyLists() throws Exception {
    try {
      planner.plan(HistoryQuery.newBuilder()
          .setEntityId(" , ")
          .setAttrName("temperature")
          .setLastN(1)
          .build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }
  }

  private void assertInvalid(final HistoryQuery.Builder builder,
                             final String... keys) {
    try {
      planner.plan(builder.build());
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) {
      assertEquals(ImmutableList.copyOf(keys), e.keys());
    }
  }

  private static HistoryQuery.Builder query() {
    return HistoryQuery.newBuilder()
        .setService("smartcity")
        .setServicePath("/rooms")
        .setEntityId("room1")
        .setEntityType("Room")
        .setAttrName("temperature");
  }
}
