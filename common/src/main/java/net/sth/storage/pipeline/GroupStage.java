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

import net.sth.data.Bucket;
import net.sth.data.RawPoint;
import net.sth.query.AggregationMethod;
import net.sth.utils.JSON;

/**
 * Groups projected documents by key, keeping the first reception time and
 * reducing the values with the method's statistic.
 */
public class GroupStage implements PipelineStage {

  private final AggregationMethod method;

  public GroupStage(final AggregationMethod method) {
    if (method == null) {
      throw new IllegalArgumentException("Method cannot be null.");
    }
    if (!method.onDemand()) {
      throw new IllegalArgumentException("Method " + method.methodName()
          + " cannot be grouped on demand.");
    }
    this.method = method;
  }

  public AggregationMethod method() {
    return method;
  }

  @Override
  public String operator() {
    return "$group";
  }

  @Override
  public ObjectNode toJson() {
    final ObjectNode group = JSON.newObject();
    group.put(Bucket.KEY, "$" + Bucket.KEY);
    group.putObject(Bucket.FIRST_DATE).put("$first", "$" + RawPoint.RECV_TIME);
    group.putObject(Bucket.VALUE).put("$" + method.methodName(),
        "$" + ProjectStage.VALUE);
    final ObjectNode stage = JSON.newObject();
    stage.set(operator(), group);
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
    return method == ((GroupStage) o).method;
  }

  @Override
  public int hashCode() {
    return method.hashCode();
  }

  @Override
  public String toString() {
    return toJson().toString();
  }
}
