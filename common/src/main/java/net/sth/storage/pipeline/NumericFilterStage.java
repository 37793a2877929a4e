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
 * Drops projected documents whose value could not be coerced to a number.
 */
public class NumericFilterStage implements PipelineStage {

  @Override
  public String operator() {
    return "$match";
  }

  @Override
  public ObjectNode toJson() {
    final ObjectNode stage = JSON.newObject();
    stage.putObject(operator()).putObject(ProjectStage.VALUE).putNull("$ne");
    return stage;
  }

  @Override
  public boolean equals(final Object o) {
    return o != null && getClass() == o.getClass();
  }

  @Override
  public int hashCode() {
    return NumericFilterStage.class.hashCode();
  }

  @Override
  public String toString() {
    return toJson().toString();
  }
}
