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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.sth.query.HistoryRequestPlan.AggregatorBackend;
import net.sth.query.HistoryRequestPlan.RequestType;
import net.sth.storage.RawQueryOptions;
import net.sth.utils.Config;

/**
 * Classifies and validates history queries. The first matching mode wins:
 * <ol>
 * <li>Raw retrieval when lastN is given (zero included), when both hLimit
 * and hOffset are given or when the file type is csv.</li>
 * <li>On-demand aggregation when the method comes with exactly one of
 * hLimit or aggrPeriod. A period routes to the store pipeline, a limit to
 * the in-process reduction. A zero hLimit counts as absent here.</li>
 * <li>Precomputed rollups when the method comes with both.</li>
 * <li>Anything else is rejected.</li>
 * </ol>
 * Multiple comma separated entities or attributes fan out, except for a
 * raw request that also asks for a file export or for rollups.
 */
public class HistoryRequestPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(
      HistoryRequestPlanner.class);

  public static final String CSV = "csv";

  static final String MISSING_COMBINATION = "A combination of the following "
      + "query params is required: lastN, hLimit and hOffset, filetype, or "
      + "aggrMethod and aggrPeriod";

  private final int max_page_size;

  public HistoryRequestPlanner(final Config config) {
    this(config.maxPageSize());
  }

  public HistoryRequestPlanner(final int max_page_size) {
    if (max_page_size < 0) {
      throw new IllegalArgumentException("Max page size cannot be negative: "
          + max_page_size);
    }
    this.max_page_size = max_page_size;
  }

  public int maxPageSize() {
    return max_page_size;
  }

  /**
   * Classifies the query.
   * @param query A non-null query.
   * @return The plan.
   * @throws InvalidQueryException if the parameters can't be served.
   */
  public HistoryRequestPlan plan(final HistoryQuery query) {
    final List<String> entity_ids = query.entityIds();
    final List<String> attr_names = query.attrNames();
    if (entity_ids.isEmpty() || attr_names.isEmpty()) {
      throw new InvalidQueryException("At least one entity ID and one "
          + "attribute name are required");
    }
    final long time_from = query.dateFrom() == null ? 0 : query.dateFrom();
    final long time_to = query.dateTo() == null ?
        Long.MAX_VALUE : query.dateTo();
    if (time_from > time_to) {
      throw new InvalidQueryException("dateFrom cannot be after dateTo",
          ImmutableList.of("dateFrom", "dateTo"));
    }
    final boolean multi = entity_ids.size() > 1 || attr_names.size() > 1;

    final HistoryRequestPlan.Builder builder = HistoryRequestPlan.newBuilder()
        .setQuery(query)
        .setEntityIds(entity_ids)
        .setAttrNames(attr_names)
        .setTimeFrom(time_from)
        .setTimeTo(time_to);

    if (isRaw(query)) {
      validatePaging(query);
      if (multi && (query.filetype() != null
          || (query.aggrMethod() != null && query.aggrPeriod() != null))) {
        throw new InvalidQueryException("Multiple entities or attributes "
            + "cannot be combined with a file export or rollups",
            ImmutableList.of("filetype", "aggrMethod", "aggrPeriod"));
      }
      final RawQueryOptions.Builder options = RawQueryOptions.newBuilder()
          .setLastN(query.lastN())
          .setTimeFrom(time_from)
          .setTimeTo(time_to)
          .setCount(query.count());
      if (query.lastN() == null) {
        options.setHLimit(query.hLimit() == null ? 0 : query.hLimit())
               .setHOffset(query.hOffset() == null ? 0 : query.hOffset());
      }
      return log(builder
          .setType(RequestType.RAW)
          .setRawOptions(options.build())
          .build());
    }

    final boolean has_method = query.aggrMethod() != null;
    // a zero limit doesn't select an aggregation mode
    final boolean has_limit = query.hLimit() != null && query.hLimit() != 0;
    final boolean has_period = query.aggrPeriod() != null;
    if (has_method && (has_limit ^ has_period)) {
      final AggregationMethod method =
          AggregationMethod.fromString(query.aggrMethod());
      if (!method.onDemand()) {
        throw new InvalidQueryException("aggrMethod " + method.methodName()
            + " can only be read from rollups",
            ImmutableList.of("aggrMethod"));
      }
      final AggregationPeriod period =
          AggregationPeriod.fromString(query.aggrPeriod());
      return log(builder
          .setType(RequestType.ON_DEMAND_AGGREGATE)
          .setBackend(has_period ?
              AggregatorBackend.PIPELINE : AggregatorBackend.COMPUTED)
          .setMethod(method)
          .setPeriod(period)
          .setCap(query.hLimit())
          .build());
    }

    if (has_method && has_period) {
      if (multi) {
        throw new InvalidQueryException("Rollups can only be read for a "
            + "single entity and attribute",
            ImmutableList.of("aggrMethod", "aggrPeriod"));
      }
      final AggregationMethod method =
          AggregationMethod.fromString(query.aggrMethod());
      final AggregationPeriod period =
          AggregationPeriod.fromString(query.aggrPeriod());
      if (!period.isBucketed()) {
        throw new InvalidQueryException("Rollups require a bucketed "
            + "aggrPeriod", ImmutableList.of("aggrPeriod"));
      }
      return log(builder
          .setType(RequestType.PRECOMPUTED_AGGREGATE)
          .setMethod(method)
          .setPeriod(period)
          .build());
    }

    throw new InvalidQueryException(MISSING_COMBINATION);
  }

  /**
   * @param query A non-null query.
   * @return True if the parameters select raw retrieval.
   */
  public static boolean isRaw(final HistoryQuery query) {
    return query.lastN() != null
        || (query.hLimit() != null && query.hOffset() != null)
        || CSV.equalsIgnoreCase(query.filetype());
  }

  /**
   * Checks lastN and hLimit against each other and the max page size, i.e.
   * hLimit &lt;= lastN &lt;= max page size, each bound only applying when
   * the parameters are present and lastN is positive.
   * @param query A non-null query.
   * @throws InvalidQueryException if a bound was violated.
   */
  void validatePaging(final HistoryQuery query) {
    final Integer last_n = query.lastN();
    final Integer h_limit = query.hLimit();
    final Integer h_offset = query.hOffset();
    if (last_n != null && last_n < 0) {
      throw new InvalidQueryException("lastN cannot be negative: " + last_n,
          ImmutableList.of("lastN"));
    }
    if (h_limit != null && h_limit < 0) {
      throw new InvalidQueryException("hLimit cannot be negative: " + h_limit,
          ImmutableList.of("hLimit"));
    }
    if (h_offset != null && h_offset < 0) {
      throw new InvalidQueryException("hOffset cannot be negative: "
          + h_offset, ImmutableList.of("hOffset"));
    }
    if (last_n != null && last_n > max_page_size) {
      throw new InvalidQueryException("lastN cannot be greater than "
          + max_page_size, ImmutableList.of("lastN"));
    }
    if (h_limit != null && h_limit > max_page_size) {
      throw new InvalidQueryException("hLimit cannot be greater than "
          + max_page_size, ImmutableList.of("hLimit"));
    }
    // lastN of 0 returns everything so it doesn't bound the page
    if (h_limit != null && last_n != null && last_n > 0 && h_limit > last_n) {
      throw new InvalidQueryException("hLimit cannot be greater than lastN",
          ImmutableList.of("hLimit", "lastN"));
    }
  }

  private HistoryRequestPlan log(final HistoryRequestPlan plan) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Planned query: " + plan);
    }
    return plan;
  }
}
