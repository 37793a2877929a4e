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

/**
 * One stage of a store-side aggregation pipeline. Stages are immutable
 * descriptions; executing them is up to the store.
 */
public interface PipelineStage {

  /** @return The document store operator this stage maps to. */
  public String operator();

  /** @return The stage in document store JSON form, for logging. */
  public ObjectNode toJson();
}
