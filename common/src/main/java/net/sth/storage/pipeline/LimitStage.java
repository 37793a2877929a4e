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

import net.sth.utils.JSON;

/**
 * Caps the number of documents flowing to the next stage.
 */
public class LimitStage implements PipelineStage {

  private final int limit;

  public LimitStage(final int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Limit must be greater than zero: "
          + limit);
    }
    this.limit = limit;
  }

  public int limit() {
    return limit;
  }

  @Override
  public String operator() {
    return "$limit";
  }

  @Override
  public ObjectNode toJson() {
    final ObjectNode stage = JSON.newObject();
    stage.put(operator(), limit);
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
    return limit == ((LimitStage) o).limit;
  }

  @Override
  public int hashCode() {
    return limit;
  }

  @Override
  public String toString() {
    return toJson().toString();
  }
}
