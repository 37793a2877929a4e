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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.sth.data.Bucket;
import net.sth.data.HistoryDatum;
import net.sth.data.RawPoint;
import net.sth.query.AggregationMethod;
import net.sth.query.AggregationPeriod;
import net.sth.query.RetrievalTarget;
import net.sth.storage.pipeline.AggregationPipeline;
import net.sth.storage.pipeline.GroupStage;
import net.sth.storage.pipeline.MatchStage;
import net.sth.storage.pipeline.NumericFilterStage;
import net.sth.storage.pipeline.ProjectStage;
import net.sth.storage.pipeline.SortStage;
import net.sth.utils.Config;
import net.sth.utils.DateTime;

public class TestMemoryHistoryDataStore {
  private static final CollectionKey KEY = new CollectionKey("smartcity",
      "/rooms", "room1", "Room", null, false);
  private static final RetrievalTarget TARGET = new RetrievalTarget("room1",
      "Room", "temperature");

  private Config config;
  private MemoryHistoryDataStore store;
  private CollectionHandle handle;

  @Before
  public void before() throws Exception {
    config = new Config(false);
    store = new MemoryHistoryDataStore(config);
    // written out of order on purpose
    write("2024-01-01T11:10Z", 30);
    write("2024-01-01T10:05Z", 10);
    write("2024-01-01T11:40Z", 40);
    write("2024-01-01T10:50Z", 20);
    write("2024-01-02T09:00Z", "off");
    store.write(KEY, RawPoint.newBuilder()
        .setRecvTime("2024-01-01T10:00Z")
        .setAttrName("humidity")
        .setAttrValue(50)
        .build());
    handle = store.resolveCollection(KEY).join();
  }

  @After
  public void after() throws Exception {
    store.shutdown().join();
  }

  @Test
  public void collectionName() throws Exception {
    assertEquals("sth_smartcity_/rooms_room1_Room",
        MemoryHistoryDataStore.collectionName(KEY));
    assertEquals("sth_smartcity__room1_",
        MemoryHistoryDataStore.collectionName(new CollectionKey("smartcity",
            null, "room1", null, "temperature", true)));
  }

  @Test
  public void resolveCollection() throws Exception {
    assertEquals("sth_smartcity_/rooms_room1_Room", handle.name());
    assertEquals(KEY, handle.key());
    assertNull(store.resolveCollection(new CollectionKey("smartcity",
        "/rooms", "room2", "Room", null, false)).join());

    // attribute and aggregated flag share the entity collection
    assertEquals(handle.name(), store.resolveCollection(new CollectionKey(
        "smartcity", "/rooms", "room1", "Room", "temperature", true)).join()
        .name());
  }

  @Test
  public void drop() throws Exception {
    assertTrue(store.drop(KEY));
    assertFalse(store.drop(KEY));
    assertNull(store.resolveCollection(KEY).join());
  }

  @Test
  public void rawQueryAll() throws Exception {
    final RetrievalResult result = store.rawQuery(handle, TARGET,
        RawQueryOptions.newBuilder().build()).join();
    assertEquals(5, result.totalCount());
    final List<RawPoint> points = result.points();
    assertEquals(5, points.size());
    assertEquals(10, points.get(0).attrValue());
    assertEquals(20, points.get(1).attrValue());
    assertEquals("off", points.get(4).attrValue());
  }

  @Test
  public void rawQueryLastN() throws Exception {
    final RetrievalResult result = store.rawQuery(handle, TARGET,
        RawQueryOptions.newBuilder()
          .setLastN(2)
          .setHLimit(1)
          .build()).join();
    assertEquals(5, result.totalCount());
    assertEquals(2, result.points().size());
    assertEquals(40, result.points().get(0).attrValue());
    assertEquals("off", result.points().get(1).attrValue());

    assertEquals(5, store.rawQuery(handle, TARGET, RawQueryOptions.newBuilder()
        .setLastN(0)
        .build()).join().points().size());
    assertEquals(5, store.rawQuery(handle, TARGET, RawQueryOptions.newBuilder()
        .setLastN(10)
        .build()).join().points().size());
  }

  @Test
  public void rawQueryPaging() throws Exception {
    RetrievalResult result = store.rawQuery(handle, TARGET,
        RawQueryOptions.newBuilder()
          .setHLimit(2)
          .setHOffset(3)
          .build()).join();
    assertEquals(5, result.totalCount());
    assertEquals(2, result.points().size());
    assertEquals(40, result.points().get(0).attrValue());

    result = store.rawQuery(handle, TARGET, RawQueryOptions.newBuilder()
        .setHLimit(2)
        .setHOffset(10)
        .build()).join();
    assertEquals(5, result.totalCount());
    assertTrue(result.points().isEmpty());

    result = store.rawQuery(handle, TARGET, RawQueryOptions.newBuilder()
        .setHOffset(4)
        .build()).join();
    assertEquals(1, result.points().size());
  }

  @Test
  public void rawQueryRange() throws Exception {
    final RetrievalResult result = store.rawQuery(handle, TARGET,
        RawQueryOptions.newBuilder()
          .setTimeFrom(DateTime.parseIsoString("2024-01-01T10:50Z"))
          .setTimeTo(DateTime.parseIsoString("2024-01-01T11:10Z"))
          .build()).join();
    assertEquals(2, result.totalCount());
    assertEquals(20, result.points().get(0).attrValue());
    assertEquals(30, result.points().get(1).attrValue());
  }

  @Test
  public void aggregate() throws Exception {
    final List<Bucket> buckets = store.aggregate(handle,
        AggregationPipeline.newBuilder()
          .addStage(new MatchStage("temperature", 0, Long.MAX_VALUE))
          .addStage(new ProjectStage(
              AggregationPeriod.HOUR.keyLength(), "temperature"))
          .addStage(new NumericFilterStage())
          .addStage(new GroupStage(AggregationMethod.MAX))
          .addStage(new SortStage())
          .build()).join();
    assertEquals(2, buckets.size());
    assertEquals("2024-01-01T10", buckets.get(0).key());
    assertEquals(20, buckets.get(0).value(), 0.0001);
    assertEquals("2024-01-01T11", buckets.get(1).key());
    assertEquals(40, buckets.get(1).value(), 0.0001);
  }

  @Test
  public void aggregateWithoutGroup() throws Exception {
    try {
      store.aggregate(handle, AggregationPipeline.newBuilder()
          .addStage(new MatchStage("temperature", 0, Long.MAX_VALUE))
          .build()).join();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }

  @Test
  public void aggregatedQuery() throws Exception {
    List<HistoryDatum> points = store.aggregatedQuery(handle,
        new RollupQuery(TARGET, AggregationMethod.OCCUR,
            AggregationPeriod.DAY, 0, Long.MAX_VALUE, true)).join();
    // the non-numeric day is empty and filtered out
    assertEquals(1, points.size());
    assertEquals("2024-01-01", ((Bucket) points.get(0)).key());
    assertEquals(4, ((Bucket) points.get(0)).value(), 0.0001);

    points = store.aggregatedQuery(handle, new RollupQuery(TARGET,
        AggregationMethod.SUM2, AggregationPeriod.DAY, 0, Long.MAX_VALUE,
        false)).join();
    assertEquals(2, points.size());
    assertEquals(3000, ((Bucket) points.get(0)).value(), 0.0001);
    assertEquals("2024-01-02", ((Bucket) points.get(1)).key());
    assertEquals(0, ((Bucket) points.get(1)).value(), 0.0001);

    points = store.aggregatedQuery(handle, new RollupQuery(TARGET,
        AggregationMethod.AVG, AggregationPeriod.HOUR,
        DateTime.parseIsoString("2024-01-01T11:00Z"), Long.MAX_VALUE,
        true)).join();
    assertEquals(1, points.size());
    assertEquals(35, ((Bucket) points.get(0)).value(), 0.0001);
  }

  @Test
  public void threadPool() throws Exception {
    final Config pooled = new Config(config);
    pooled.overrideConfig(Config.MEMORY_STORE_THREADPOOL_KEY, "true");
    final MemoryHistoryDataStore async = new MemoryHistoryDataStore(pooled);
    try {
      async.write(KEY, RawPoint.newBuilder()
          .setRecvTime("2024-01-01T10:05Z")
          .setAttrName("temperature")
          .setAttrValue(10)
          .build());
      final CollectionHandle async_handle =
          async.resolveCollection(KEY).join(1000);
      assertEquals(handle.name(), async_handle.name());
      assertEquals(1, async.rawQuery(async_handle, TARGET,
          RawQueryOptions.newBuilder().build()).join(1000).totalCount());
      try {
        async.aggregate(async_handle, AggregationPipeline.newBuilder()
            .addStage(new SortStage())
            .build()).join(1000);
        fail("Expected IllegalStateException");
      } catch (IllegalStateException e) { }
    } finally {
      async.shutdown().join();
    }
  }

  private void write(final String time, final Object value) {
    store.write(KEY, RawPoint.newBuilder()
        .setRecvTime(time)
        .setAttrName("temperature")
        .setAttrType("Number")
        .setAttrValue(value)
        .build());
  }
}
