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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Thrown when the combination of query parameters is rejected before any
 * I/O takes place. Carries the names of the parameters that drive the
 * classification so callers can report them.
 */
public class InvalidQueryException extends RuntimeException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = -2410853096633214711L;

  /** The query parameters that select what is retrieved. */
  public static final List<String> QUERY_KEYS = ImmutableList.of(
      "lastN", "hLimit", "hOffset", "filetype", "aggrMethod", "aggrPeriod",
      "count");

  private final List<String> keys;

  public InvalidQueryException(final String msg) {
    this(msg, QUERY_KEYS);
  }

  public InvalidQueryException(final String msg, final List<String> keys) {
    super(msg);
    this.keys = keys == null ? QUERY_KEYS : ImmutableList.copyOf(keys);
  }

  /** @return The offending or accepted parameter names. */
  public List<String> keys() {
    return keys;
  }

  /** @return The source of the offending parameters. */
  public String source() {
    return "query";
  }
}
