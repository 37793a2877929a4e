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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Deferred;

import net.sth.data.Bucket;
import net.sth.data.HistoryDatum;
import net.sth.data.RawPoint;
import net.sth.data.Values;
import net.sth.query.RetrievalTarget;
import net.sth.storage.pipeline.AggregationPipeline;
import net.sth.storage.pipeline.GroupStage;
import net.sth.storage.pipeline.LimitStage;
import net.sth.storage.pipeline.MatchStage;
import net.sth.storage.pipeline.NumericFilterStage;
import net.sth.storage.pipeline.PipelineStage;
import net.sth.storage.pipeline.ProjectStage;
import net.sth.storage.pipeline.SortStage;
import net.sth.utils.Config;
import net.sth.utils.DateTime;

/**
 * A simple store keeping raw points in memory, one collection per entity.
 * It's meant for testing the query paths and for local runs. Rollups are
 * computed from the raw points when read.
 * <p>
 * When {@link Config#MEMORY_STORE_THREADPOOL_KEY} is enabled, deferreds are
 * completed on a cached thread pool instead of the caller's thread.
 */
public class MemoryHistoryDataStore implements HistoryDataStore {
  private static final Logger LOG = LoggerFactory.getLogger(
      MemoryHistoryDataStore.class);

  public static final String COLLECTION_PREFIX = "sth_";

  private static final Joiner NAME_JOINER = Joiner.on('_').useForNull("");

  private static final Comparator<RawPoint> RECV_TIME_ORDER =
      new Comparator<RawPoint>() {
        @Override
        public int compare(final RawPoint a, final RawPoint b) {
          return Long.compare(a.recvTime(), b.recvTime());
        }
      };

  /** Collection name to points in write order. */
  private final ConcurrentMap<String, List<RawPoint>> database;

  /** Thread pool used to complete calls, null to complete inline. */
  private final ExecutorService thread_pool;

  public MemoryHistoryDataStore(final Config config) {
    database = Maps.newConcurrentMap();
    if (config.hasProperty(Config.MEMORY_STORE_THREADPOOL_KEY)
        && config.getBoolean(Config.MEMORY_STORE_THREADPOOL_KEY)) {
      thread_pool = Executors.newCachedThreadPool();
    } else {
      thread_pool = null;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Instantiated memory store, thread pool: "
          + (thread_pool != null));
    }
  }

  /**
   * The collection name for the key. The attribute and aggregated flag do
   * not take part: all attributes of an entity share one collection and
   * rollups derive from the raw points.
   * @param key A non-null key.
   * @return The collection name.
   */
  public static String collectionName(final CollectionKey key) {
    return COLLECTION_PREFIX + NAME_JOINER.join(key.service(),
        key.servicePath(), key.entityId(), key.entityType());
  }

  /**
   * Stores a point.
   * @param key The key of the entity collection, attribute ignored.
   * @param point The non-null point.
   */
  public void write(final CollectionKey key, final RawPoint point) {
    if (point == null) {
      throw new IllegalArgumentException("Point cannot be null.");
    }
    final String name = collectionName(key);
    List<RawPoint> points = database.get(name);
    if (points == null) {
      final List<RawPoint> fresh =
          Collections.synchronizedList(Lists.<RawPoint>newArrayList());
      points = database.putIfAbsent(name, fresh);
      if (points == null) {
        points = fresh;
      }
    }
    points.add(point);
  }

  /**
   * Drops a collection.
   * @param key The key of the entity collection.
   * @return True if the collection existed.
   */
  public boolean drop(final CollectionKey key) {
    return database.remove(collectionName(key)) != null;
  }

  @Override
  public Deferred<CollectionHandle> resolveCollection(final CollectionKey key) {
    final String name = collectionName(key);
    if (!database.containsKey(name)) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("No such collection: " + name);
      }
      return complete(null);
    }
    return complete(new CollectionHandle(name, key));
  }

  @Override
  public Deferred<RetrievalResult> rawQuery(final CollectionHandle handle,
                                            final RetrievalTarget target,
                                            final RawQueryOptions options) {
    final List<RawPoint> matched = Lists.newArrayList();
    for (final RawPoint point : snapshot(handle)) {
      if (point.attrName().equals(target.attrName())
          && point.recvTime() >= options.timeFrom()
          && point.recvTime() <= options.timeTo()) {
        matched.add(point);
      }
    }
    final int total = matched.size();
    final List<RawPoint> page;
    if (options.lastN() != null) {
      final int last_n = options.lastN();
      page = last_n > 0 && total > last_n ?
          matched.subList(total - last_n, total) : matched;
    } else {
      final int from = Math.min(options.hOffset(), total);
      final int to = options.hLimit() > 0 ?
          (int) Math.min((long) from + options.hLimit(), total) : total;
      page = matched.subList(from, to);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Raw query on " + handle + " for " + target + " with "
          + options + " returned " + page.size() + " of " + total);
    }
    return complete(RetrievalResult.ofCursor(
        Lists.newArrayList(page).iterator(), total));
  }

  @Override
  public Deferred<List<Bucket>> aggregate(final CollectionHandle handle,
                                          final AggregationPipeline pipeline) {
    final List<Bucket> buckets;
    try {
      buckets = runPipeline(snapshot(handle), pipeline);
    } catch (RuntimeException e) {
      return fail(e);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Pipeline " + pipeline + " on " + handle + " returned "
          + buckets.size() + " buckets");
    }
    return complete(buckets);
  }

  @Override
  public Deferred<List<HistoryDatum>> aggregatedQuery(
      final CollectionHandle handle,
      final RollupQuery query) {
    final Map<String, Rollup> rollups = Maps.newTreeMap();
    for (final RawPoint point : snapshot(handle)) {
      if (!point.attrName().equals(query.target().attrName())
          || point.recvTime() < query.timeFrom()
          || point.recvTime() > query.timeTo()) {
        continue;
      }
      final String key = DateTime.truncatedIsoString(point.recvTime(),
          query.period().keyLength());
      Rollup rollup = rollups.get(key);
      if (rollup == null) {
        rollup = new Rollup(key, point.recvTime());
        rollups.put(key, rollup);
      }
      rollup.add(Values.toDouble(point.attrValue()));
    }
    final List<HistoryDatum> points = Lists.newArrayList();
    for (final Rollup rollup : rollups.values()) {
      if (rollup.samples == 0 && query.filterOutEmpty()) {
        continue;
      }
      points.add(rollup.toBucket(query));
    }
    return complete(points);
  }

  @Override
  public Deferred<Object> shutdown() {
    if (thread_pool != null) {
      thread_pool.shutdown();
    }
    return Deferred.fromResult(null);
  }

  /** @return A copy of the collection's points ascending by reception time. */
  private List<RawPoint> snapshot(final CollectionHandle handle) {
    final List<RawPoint> points = database.get(handle.name());
    if (points == null) {
      return Collections.emptyList();
    }
    final List<RawPoint> copy;
    synchronized (points) {
      copy = Lists.newArrayList(points);
    }
    Collections.sort(copy, RECV_TIME_ORDER);
    return copy;
  }

  /**
   * Evaluates the stages in order. Match and limit work on raw points until
   * the projection turns them into documents.
   */
  static List<Bucket> runPipeline(final List<RawPoint> input,
                                  final AggregationPipeline pipeline) {
    List<RawPoint> points = input;
    List<Map<String, Object>> documents = null;
    List<Bucket> buckets = null;
    for (final PipelineStage stage : pipeline.stages()) {
      if (stage instanceof MatchStage) {
        final MatchStage match = (MatchStage) stage;
        final List<RawPoint> matched = Lists.newArrayList();
        for (final RawPoint point : points) {
          if (match.matches(point)) {
            matched.add(point);
          }
        }
        points = matched;
      } else if (stage instanceof LimitStage) {
        final int limit = ((LimitStage) stage).limit();
        if (documents == null) {
          points = points.subList(0, Math.min(limit, points.size()));
        } else {
          documents = documents.subList(0, Math.min(limit, documents.size()));
        }
      } else if (stage instanceof ProjectStage) {
        documents = project(points, (ProjectStage) stage);
      } else if (stage instanceof NumericFilterStage) {
        final List<Map<String, Object>> numeric = Lists.newArrayList();
        for (final Map<String, Object> document : requireDocuments(documents,
            stage)) {
          if (document.get(ProjectStage.VALUE) != null) {
            numeric.add(document);
          }
        }
        documents = numeric;
      } else if (stage instanceof GroupStage) {
        buckets = group(requireDocuments(documents, stage),
            (GroupStage) stage);
      } else if (stage instanceof SortStage) {
        if (buckets == null) {
          throw new IllegalStateException("Sort must follow a group stage.");
        }
        Collections.sort(buckets);
      } else {
        throw new UnsupportedOperationException("Unsupported stage: "
            + stage.operator());
      }
    }
    if (buckets == null) {
      throw new IllegalStateException("Pipeline has no group stage: "
          + pipeline);
    }
    return buckets;
  }

  private static List<Map<String, Object>> requireDocuments(
      final List<Map<String, Object>> documents,
      final PipelineStage stage) {
    if (documents == null) {
      throw new IllegalStateException(stage.operator()
          + " must follow a projection.");
    }
    return documents;
  }

  private static List<Map<String, Object>> project(
      final List<RawPoint> points,
      final ProjectStage stage) {
    final List<Map<String, Object>> documents =
        Lists.newArrayListWithCapacity(points.size());
    for (final RawPoint point : points) {
      final Map<String, Object> document = Maps.newHashMap();
      document.put(Bucket.KEY, stage.bucketed() ?
          DateTime.truncatedIsoString(point.recvTime(), stage.keyLength()) :
          stage.attrName());
      document.put(RawPoint.RECV_TIME, point.recvTime());
      document.put(ProjectStage.VALUE, Values.toDouble(point.attrValue()));
      documents.add(document);
    }
    return documents;
  }

  private static List<Bucket> group(final List<Map<String, Object>> documents,
                                    final GroupStage stage) {
    final Map<String, Group> groups = Maps.newLinkedHashMap();
    for (final Map<String, Object> document : documents) {
      final String key = (String) document.get(Bucket.KEY);
      final Double value = (Double) document.get(ProjectStage.VALUE);
      if (value == null) {
        continue;
      }
      Group group = groups.get(key);
      if (group == null) {
        group = new Group((Long) document.get(RawPoint.RECV_TIME));
        groups.put(key, group);
      }
      group.add(value);
    }
    final List<Bucket> buckets = Lists.newArrayListWithCapacity(groups.size());
    for (final Map.Entry<String, Group> entry : groups.entrySet()) {
      final Group group = entry.getValue();
      final double value;
      switch (stage.method()) {
      case MIN:
        value = group.min;
        break;
      case MAX:
        value = group.max;
        break;
      case AVG:
        value = group.sum / group.count;
        break;
      default:
        throw new UnsupportedOperationException("Unsupported group method: "
            + stage.method());
      }
      buckets.add(new Bucket(entry.getKey(), group.first_date, value));
    }
    return buckets;
  }

  /** The $first, $min, $max and $avg accumulators of one group. */
  private static class Group {
    private final long first_date;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double sum;
    private long count;

    Group(final long first_date) {
      this.first_date = first_date;
    }

    void add(final double value) {
      if (value < min) {
        min = value;
      }
      if (value > max) {
        max = value;
      }
      sum += value;
      count++;
    }
  }

  /** One rollup slot as an ingestion pipeline would have maintained it. */
  private static class Rollup {
    private final String key;
    private final long first_timestamp;
    private long samples;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double sum;
    private double sum2;

    Rollup(final String key, final long first_timestamp) {
      this.key = key;
      this.first_timestamp = first_timestamp;
    }

    void add(final Double value) {
      if (value == null) {
        return;
      }
      samples++;
      min = Math.min(min, value);
      max = Math.max(max, value);
      sum += value;
      sum2 += value * value;
    }

    Bucket toBucket(final RollupQuery query) {
      final double value;
      switch (query.method()) {
      case MIN:
        value = samples == 0 ? 0 : min;
        break;
      case MAX:
        value = samples == 0 ? 0 : max;
        break;
      case AVG:
        value = samples == 0 ? 0 : sum / samples;
        break;
      case SUM:
        value = sum;
        break;
      case SUM2:
        value = sum2;
        break;
      case OCCUR:
        value = samples;
        break;
      default:
        throw new UnsupportedOperationException("Unsupported rollup method: "
            + query.method());
      }
      return new Bucket(key, first_timestamp, value);
    }
  }

  private <T> Deferred<T> complete(final T result) {
    if (thread_pool == null) {
      return Deferred.fromResult(result);
    }
    final Deferred<T> deferred = new Deferred<T>();
    thread_pool.submit(new Runnable() {
      @Override
      public void run() {
        deferred.callback(result);
      }
    });
    return deferred;
  }

  private <T> Deferred<T> fail(final Exception e) {
    LOG.error("Memory store call failed", e);
    if (thread_pool == null) {
      return Deferred.fromError(e);
    }
    final Deferred<T> deferred = new Deferred<T>();
    thread_pool.submit(new Runnable() {
      @Override
      public void run() {
        deferred.callback(e);
      }
    });
    return deferred;
  }
}
