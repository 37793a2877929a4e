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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.sth.data.AttributePayload;
import net.sth.data.Representation;
import net.sth.query.aggregate.BucketAggregator;
import net.sth.query.aggregate.ComputedAggregator;
import net.sth.query.aggregate.PipelineAggregator;
import net.sth.query.fanout.FanOutCoordinator;
import net.sth.query.fanout.ResultMerger;
import net.sth.query.retrieval.AggregateSubQuery;
import net.sth.query.retrieval.RawSubQuery;
import net.sth.query.retrieval.RollupSubQuery;
import net.sth.query.retrieval.SubQuery;
import net.sth.query.retrieval.SubQueryResult;
import net.sth.render.EnvelopeRenderer;
import net.sth.render.HistoryResponse;
import net.sth.render.LightweightEnvelopeRenderer;
import net.sth.render.NgsiEnvelopeRenderer;
import net.sth.storage.CollectionHandle;
import net.sth.storage.CollectionKey;
import net.sth.storage.HistoryDataStore;
import net.sth.utils.Config;
import net.sth.utils.Exceptions;

/**
 * Entry point for history queries. Plans the query, then either runs the
 * single target directly or hands the grid to the {@link FanOutCoordinator}.
 * <p>
 * Every outcome, including a rejected query, is delivered through the
 * returned deferred: a {@link HistoryResponse} on success, an
 * {@link InvalidQueryException}, {@link InvalidPlanException} or
 * {@link RetrievalException} otherwise.
 */
public class HistoryQueryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      HistoryQueryExecutor.class);

  private final Config config;
  private final HistoryDataStore store;
  private final HistoryRequestPlanner planner;
  private final FanOutCoordinator coordinator;
  private final BucketAggregator computed_aggregator;
  private final BucketAggregator pipeline_aggregator;
  private final Map<Representation, EnvelopeRenderer> renderers;

  public HistoryQueryExecutor(final Config config,
                              final HistoryDataStore store) {
    this(config, store, new NgsiEnvelopeRenderer(),
        new LightweightEnvelopeRenderer());
  }

  public HistoryQueryExecutor(final Config config,
                              final HistoryDataStore store,
                              final EnvelopeRenderer canonical,
                              final EnvelopeRenderer lightweight) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.config = config;
    this.store = store;
    planner = new HistoryRequestPlanner(config);
    coordinator = new FanOutCoordinator(store);
    computed_aggregator = new ComputedAggregator(store);
    pipeline_aggregator = new PipelineAggregator(store);
    renderers = Maps.newEnumMap(Representation.class);
    renderers.put(Representation.CANONICAL, canonical);
    renderers.put(Representation.LIGHTWEIGHT, lightweight);
  }

  public HistoryRequestPlanner planner() {
    return planner;
  }

  /**
   * Executes the query.
   * @param query A non-null query.
   * @return A deferred resolving to the response or to the failure.
   */
  public Deferred<HistoryResponse> execute(final HistoryQuery query) {
    final HistoryRequestPlan plan;
    try {
      plan = planner.plan(query);
    } catch (InvalidQueryException e) {
      LOG.warn("Rejected query [" + query + "]: " + e.getMessage());
      return Deferred.fromError(e);
    }

    final SubQuery sub_query = newSubQuery(plan);
    final EnvelopeRenderer renderer = renderers.get(query.representation());
    if (plan.multiTarget()) {
      return coordinator.run(plan, sub_query, renderer);
    }
    return runSingle(plan, sub_query, renderer);
  }

  /**
   * @param plan A non-null plan.
   * @return The per-cell work for the plan's mode and backend.
   */
  SubQuery newSubQuery(final HistoryRequestPlan plan) {
    switch (plan.type()) {
    case RAW:
      return new RawSubQuery(store, plan.rawOptions());
    case ON_DEMAND_AGGREGATE:
      return new AggregateSubQuery(
          plan.backend() == HistoryRequestPlan.AggregatorBackend.PIPELINE ?
              pipeline_aggregator : computed_aggregator,
          plan.method(), plan.period(), plan.cap(), plan.timeFrom(),
          plan.timeTo());
    case PRECOMPUTED_AGGREGATE:
      return new RollupSubQuery(store, plan.method(), plan.period(),
          plan.timeFrom(), plan.timeTo(), config.filterOutEmpty());
    default:
      throw new IllegalStateException("Unhandled request type: "
          + plan.type());
    }
  }

  /**
   * Resolves the collection of the one target and runs the sub query on it.
   * A missing collection yields an empty attribute.
   */
  private Deferred<HistoryResponse> runSingle(final HistoryRequestPlan plan,
                                              final SubQuery sub_query,
                                              final EnvelopeRenderer renderer) {
    final HistoryQuery query = plan.query();
    final String entity_id = plan.entityIds().get(0);
    final String attr_name = plan.attrNames().get(0);
    final RetrievalTarget target = new RetrievalTarget(entity_id,
        query.entityType(), attr_name);
    final CollectionKey key = new CollectionKey(query.service(),
        query.servicePath(), entity_id, query.entityType(), attr_name,
        sub_query.aggregatedCollection());
    final ResultMerger merger = new ResultMerger(
        ImmutableList.of(entity_id), query.entityType(),
        ImmutableList.of(attr_name), renderer, query.count());

    class ResolveCB implements Callback<Deferred<SubQueryResult>,
        CollectionHandle> {
      @Override
      public Deferred<SubQueryResult> call(final CollectionHandle handle)
          throws Exception {
        if (handle == null) {
          LOG.warn("No collection found for " + key);
          return Deferred.fromResult(SubQueryResult.empty());
        }
        if (LOG.isDebugEnabled()) {
          LOG.debug("Resolved collection " + handle + " for " + target);
        }
        return sub_query.execute(handle, target);
      }
    }

    class RenderCB implements Callback<HistoryResponse, SubQueryResult> {
      @Override
      public HistoryResponse call(final SubQueryResult result)
          throws Exception {
        merger.add(0, 0, AttributePayload.of(attr_name, result.data(),
            renderer.representation()), result.recordCount());
        if (LOG.isDebugEnabled()) {
          LOG.debug("Returning " + result.data().size() + " values for "
              + target);
        }
        return merger.merge();
      }
    }

    class ErrorCB implements Callback<Exception, Exception> {
      @Override
      public Exception call(final Exception e) throws Exception {
        final Throwable ex = Exceptions.unwrap(e);
        LOG.error("Query failed for " + target, ex);
        if (ex instanceof InvalidPlanException
            || ex instanceof RetrievalException) {
          return (Exception) ex;
        }
        return new RetrievalException("Failed to retrieve " + target, target,
            ex);
      }
    }

    try {
      return store.resolveCollection(key)
          .addCallbackDeferring(new ResolveCB())
          .addCallback(new RenderCB())
          .addErrback(new ErrorCB());
    } catch (Exception e) {
      return Deferred.fromError(new RetrievalException("Failed to retrieve "
          + target, target, e));
    }
  }
}
