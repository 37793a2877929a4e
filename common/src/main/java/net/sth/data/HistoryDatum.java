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
package net.sth.data;

import java.util.List;
import java.util.Map;

/**
 * A single document returned for an attribute, either a raw point or an
 * aggregated bucket. The field names and values are parallel lists in a
 * fixed order so that the light-weight representation can emit them as
 * columns and rows.
 */
public interface HistoryDatum {

  /** @return The field names in rendering order. */
  public List<String> fieldNames();

  /** @return The field values, parallel to {@link #fieldNames()}. */
  public List<Object> fieldValues();

  /** @return An ordered map of field names to values. */
  public Map<String, Object> asMap();

}
