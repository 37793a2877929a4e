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
package net.sth.storage.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.sth.data.RawPoint;
import net.sth.utils.DateTime;
import net.sth.utils.JSON;

/**
 * Keeps raw points of one attribute received within an inclusive range.
 */
public class MatchStage implements PipelineStage {

  public static final String ATTR_NAME = "attrName";

  private final String attr_name;
  private final long time_from;
  private final long time_to;

  public MatchStage(final String attr_name,
                    final long time_from,
                    final long time_to) {
    if (Strings.isNullOrEmpty(attr_name)) {
      throw new IllegalArgumentException("Attribute name cannot be null "
          + "or empty.");
    }
    this.attr_name = attr_name;
    this.time_from = time_from;
    this.time_to = time_to;
  }

  public String attrName() {
    return attr_name;
  }

  public long timeFrom() {
    return time_from;
  }

  public long timeTo() {
    return time_to;
  }

  /**
   * @param point A non-null point.
   * @return True if the point passes the filter.
   */
  public boolean matches(final RawPoint point) {
    return attr_name.equals(point.attrName())
        && point.recvTime() >= time_from
        && point.recvTime() <= time_to;
  }

  @Override
  public String operator() {
    return "$match";
  }

  @Override
  public ObjectNode toJson() {
    final ObjectNode range = JSON.newObject();
    range.put("$gte", DateTime.toIsoString(time_from));
    if (time_to != Long.MAX_VALUE) {
      range.put("$lte", DateTime.toIsoString(time_to));
    }
    final ObjectNode filter = JSON.newObject();
    filter.put(ATTR_NAME, attr_name);
    filter.set(RawPoint.RECV_TIME, range);
    final ObjectNode stage = JSON.newObject();
    stage.set(operator(), filter);
    return stage;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final MatchStage other = (MatchStage) o;
    return attr_name.equals(other.attr_name)
        && time_from == other.time_from
        && time_to == other.time_to;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(attr_name, time_from, time_to);
  }

  @Override
  public String toString() {
    return toJson().toString();
  }
}
