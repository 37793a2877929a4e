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
package net.sth.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.DeferredGroupException;

/**
 * Helpers for exceptions travelling through deferred errback chains.
 */
public final class Exceptions {
  private static final Logger LOG = LoggerFactory.getLogger(Exceptions.class);

  private Exceptions() {
    // static helpers only
  }

  /**
   * Walks nested {@link DeferredGroupException}s down to the first cause
   * that isn't one.
   * @param e The exception, may be null.
   * @return The root cause or the original exception if the chain ended on
   * a group exception without a cause.
   */
  public static Throwable unwrap(final Throwable e) {
    if (e == null) {
      return null;
    }
    Throwable ex = e;
    while (ex instanceof DeferredGroupException) {
      if (ex.getCause() == null) {
        LOG.warn("Unable to get to the root cause of the DGE");
        return ex;
      }
      ex = ex.getCause();
    }
    return ex;
  }

  /**
   * Unwraps like {@link #unwrap(Throwable)} but guarantees an
   * {@link Exception} so it can be handed to a deferred's callback.
   * @param e The exception, may not be null.
   * @return The root cause as an exception.
   */
  public static Exception unwrapException(final Exception e) {
    final Throwable ex = unwrap(e);
    if (ex instanceof Exception) {
      return (Exception) ex;
    }
    return new RuntimeException(ex);
  }
}
