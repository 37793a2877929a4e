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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Deferred;

import net.sth.render.HistoryResponse;

/**
 * The state of one multi-target request. The latch starts at the number of
 * cells and every completion counts down. Emission, either the merged
 * response when the latch reaches zero or the first failure, is gated by a
 * single flag so the deferred is called back exactly once.
 */
public class FanOutSession {
  private static final Logger LOG = LoggerFactory.getLogger(
      FanOutSession.class);

  private final ResultMerger merger;
  private final AtomicInteger latch;
  private final AtomicBoolean emitted;
  private final Deferred<HistoryResponse> deferred;

  public FanOutSession(final ResultMerger merger) {
    if (merger == null) {
      throw new IllegalArgumentException("Merger cannot be null.");
    }
    this.merger = merger;
    latch = new AtomicInteger(merger.entityIds().size()
        * merger.attrNames().size());
    emitted = new AtomicBoolean();
    deferred = new Deferred<HistoryResponse>();
  }

  public ResultMerger merger() {
    return merger;
  }

  /** @return The deferred called back with the one emission. */
  public Deferred<HistoryResponse> deferred() {
    return deferred;
  }

  /** @return The cells still outstanding. */
  public int outstanding() {
    return latch.get();
  }

  /** @return Whether or not the session has emitted. */
  public boolean emitted() {
    return emitted.get();
  }

  /**
   * Records completed cells and emits the merged response if they were the
   * last ones.
   * @param cells How many cells completed, at least 1.
   */
  public void countDown(final int cells) {
    final int remaining = latch.addAndGet(-cells);
    if (remaining == 0) {
      complete();
    } else if (remaining < 0) {
      LOG.error("Latch went negative: " + remaining);
    }
  }

  /**
   * Emits the failure unless something was emitted already.
   * @param e The non-null failure.
   */
  public void fail(final Exception e) {
    if (emitted.compareAndSet(false, true)) {
      deferred.callback(e);
    } else if (LOG.isDebugEnabled()) {
      LOG.debug("Failure in sub query after the session emitted", e);
    }
  }

  private void complete() {
    if (!emitted.compareAndSet(false, true)) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("All sub queries completed after the session emitted");
      }
      return;
    }
    final HistoryResponse response;
    try {
      response = merger.merge();
    } catch (Exception e) {
      LOG.error("Failed to merge results", e);
      deferred.callback(e);
      return;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Emitting merged response for " + merger.entityIds().size()
          + " entities");
    }
    deferred.callback(response);
  }
}
