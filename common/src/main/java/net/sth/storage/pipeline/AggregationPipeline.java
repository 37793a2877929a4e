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

import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.sth.utils.JSON;

/**
 * An ordered, immutable list of stages handed to a store that can group
 * documents natively.
 */
public class AggregationPipeline {

  private final List<PipelineStage> stages;

  protected AggregationPipeline(final Builder builder) {
    if (builder.stages.isEmpty()) {
      throw new IllegalArgumentException("A pipeline needs at least one "
          + "stage.");
    }
    stages = ImmutableList.copyOf(builder.stages);
  }

  public List<PipelineStage> stages() {
    return stages;
  }

  /**
   * @param type The stage class to look for.
   * @return The first stage of the given type or null if not present.
   */
  public <T extends PipelineStage> T stage(final Class<T> type) {
    for (final PipelineStage stage : stages) {
      if (type.isInstance(stage)) {
        return type.cast(stage);
      }
    }
    return null;
  }

  /** @return The pipeline in document store JSON form. */
  public ArrayNode toJson() {
    final ArrayNode array = JSON.newArray();
    for (final PipelineStage stage : stages) {
      array.add(stage.toJson());
    }
    return array;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return stages.equals(((AggregationPipeline) o).stages);
  }

  @Override
  public int hashCode() {
    return stages.hashCode();
  }

  @Override
  public String toString() {
    return toJson().toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private final List<PipelineStage> stages = Lists.newArrayList();

    public Builder addStage(final PipelineStage stage) {
      if (stage == null) {
        throw new IllegalArgumentException("Stage cannot be null.");
      }
      stages.add(stage);
      return this;
    }

    public AggregationPipeline build() {
      return new AggregationPipeline(this);
    }
  }
}
