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
package net.sth.query.fanout;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.sth.data.AttributePayload;
import net.sth.query.HistoryQuery;
import net.sth.query.HistoryRequestPlan;
import net.sth.query.InvalidPlanException;
import net.sth.query.RetrievalException;
import net.sth.query.RetrievalTarget;
import net.sth.query.retrieval.SubQuery;
import net.sth.query.retrieval.SubQueryResult;
import net.sth.render.EnvelopeRenderer;
import net.sth.render.HistoryResponse;
import net.sth.storage.CollectionHandle;
import net.sth.storage.CollectionKey;
import net.sth.storage.HistoryDataStore;
import net.sth.utils.Exceptions;

/**
 * Runs a multi-target request: resolves each entity's collection, issues one
 * sub query per attribute against it and merges the completions into one
 * response.
 * <p>
 * Cells run independently and may complete in any order, on any thread.
 * There is no cancellation: after a failure has been emitted the remaining
 * cells still run and count down, their results are discarded.
 */
public class FanOutCoordinator {
  private static final Logger LOG = LoggerFactory.getLogger(
      FanOutCoordinator.class);

  private final HistoryDataStore store;

  public FanOutCoordinator(final HistoryDataStore store) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.store = store;
  }

  /**
   * Starts the fan out.
   * @param plan The non-null plan with the entity and attribute lists.
   * @param sub_query The work to run per cell.
   * @param renderer The renderer for the envelope and representation.
   * @return A deferred called back exactly once with the merged response or
   * the first failure.
   */
  public Deferred<HistoryResponse> run(final HistoryRequestPlan plan,
                                       final SubQuery sub_query,
                                       final EnvelopeRenderer renderer) {
    final HistoryQuery query = plan.query();
    final ResultMerger merger = new ResultMerger(plan.entityIds(),
        query.entityType(), plan.attrNames(), renderer, query.count());
    final FanOutSession session = new FanOutSession(merger);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fanning out " + plan.entityIds().size() + " entities and "
          + plan.attrNames().size() + " attributes");
    }

    final List<String> entity_ids = plan.entityIds();
    for (int i = 0; i < entity_ids.size(); i++) {
      final CollectionKey key = new CollectionKey(query.service(),
          query.servicePath(), entity_ids.get(i), query.entityType(), null,
          sub_query.aggregatedCollection());
      try {
        store.resolveCollection(key).addCallbacks(
            new ResolveCB(session, sub_query, i),
            new ResolveErrorCB(session, key));
      } catch (Exception e) {
        new ResolveErrorCB(session, key).call(e);
      }
    }
    return session.deferred();
  }

  /**
   * Wraps a failure for the response. Query and plan failures pass as is.
   */
  static Exception toFailure(final Throwable ex, final RetrievalTarget target) {
    if (ex instanceof InvalidPlanException || ex instanceof RetrievalException) {
      return (Exception) ex;
    }
    return new RetrievalException("Failed to retrieve " + target, target, ex);
  }

  /** Issues the cells of one entity once its collection is known. */
  class ResolveCB implements Callback<Object, CollectionHandle> {
    private final FanOutSession session;
    private final SubQuery sub_query;
    private final int entity_index;

    ResolveCB(final FanOutSession session,
              final SubQuery sub_query,
              final int entity_index) {
      this.session = session;
      this.sub_query = sub_query;
      this.entity_index = entity_index;
    }

    @Override
    public Object call(final CollectionHandle handle) {
      final ResultMerger merger = session.merger();
      final String entity_id = merger.entityIds().get(entity_index);
      final List<String> attr_names = merger.attrNames();
      if (handle == null) {
        LOG.warn("No collection found for entity " + entity_id);
        session.countDown(attr_names.size());
        return null;
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Resolved collection " + handle + " for entity "
            + entity_id);
      }
      for (int x = 0; x < attr_names.size(); x++) {
        final RetrievalTarget target = new RetrievalTarget(entity_id,
            handle.key().entityType(), attr_names.get(x));
        final SubQueryErrorCB error_cb = new SubQueryErrorCB(session, target);
        try {
          sub_query.execute(handle, target).addCallbacks(
              new SubQueryCB(session, entity_index, x), error_cb);
        } catch (Exception e) {
          error_cb.call(e);
        }
      }
      return null;
    }
  }

  /** Fails the session and accounts for all cells of the entity. */
  class ResolveErrorCB implements Callback<Object, Exception> {
    private final FanOutSession session;
    private final CollectionKey key;

    ResolveErrorCB(final FanOutSession session, final CollectionKey key) {
      this.session = session;
      this.key = key;
    }

    @Override
    public Object call(final Exception e) {
      final Throwable ex = Exceptions.unwrap(e);
      LOG.error("Failed to resolve collection for " + key, ex);
      if (ex instanceof InvalidPlanException
          || ex instanceof RetrievalException) {
        session.fail((Exception) ex);
      } else {
        session.fail(new RetrievalException("Failed to resolve collection "
            + "for entity " + key.entityId(), null, ex));
      }
      session.countDown(session.merger().attrNames().size());
      return null;
    }
  }

  /** Stores a cell's payload and counts it down. */
  class SubQueryCB implements Callback<Object, SubQueryResult> {
    private final FanOutSession session;
    private final int entity_index;
    private final int attr_index;

    SubQueryCB(final FanOutSession session,
               final int entity_index,
               final int attr_index) {
      this.session = session;
      this.entity_index = entity_index;
      this.attr_index = attr_index;
    }

    @Override
    public Object call(final SubQueryResult result) {
      final ResultMerger merger = session.merger();
      final String attr_name = merger.attrNames().get(attr_index);
      try {
        final AttributePayload payload = AttributePayload.of(attr_name,
            result.data(), merger.representation());
        merger.add(entity_index, attr_index, payload, result.recordCount());
      } catch (Exception e) {
        LOG.error("Failed to store the result for " + attr_name, e);
        session.fail(e);
      }
      session.countDown(1);
      return null;
    }
  }

  /** Fails the session and counts the cell down. */
  class SubQueryErrorCB implements Callback<Object, Exception> {
    private final FanOutSession session;
    private final RetrievalTarget target;

    SubQueryErrorCB(final FanOutSession session, final RetrievalTarget target) {
      this.session = session;
      this.target = target;
    }

    @Override
    public Object call(final Exception e) {
      final Throwable ex = Exceptions.unwrap(e);
      LOG.error("Sub query failed for " + target, ex);
      session.fail(toFailure(ex, target));
      session.countDown(1);
      return null;
    }
  }
}
