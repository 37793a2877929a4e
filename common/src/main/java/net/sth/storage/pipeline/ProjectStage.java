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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.sth.data.Bucket;
import net.sth.data.RawPoint;
import net.sth.utils.JSON;

/**
 * Derives the group key of each point and coerces its value to a double.
 * The key is the ISO-8601 reception time truncated to {@link #keyLength()}
 * characters, or the constant attribute name when the key length is not
 * positive. Values that cannot be coerced project to null.
 * <p>
 * Projected documents carry {@link Bucket#KEY}, {@link RawPoint#RECV_TIME}
 * and {@link #VALUE}.
 */
public class ProjectStage implements PipelineStage {

  public static final String VALUE = "value";

  private final int key_length;
  private final String attr_name;

  public ProjectStage(final int key_length, final String attr_name) {
    if (Strings.isNullOrEmpty(attr_name)) {
      throw new IllegalArgumentException("Attribute name cannot be null "
          + "or empty.");
    }
    this.key_length = key_length;
    this.attr_name = attr_name;
  }

  /** @return The truncation length, zero or negative when unbucketed. */
  public int keyLength() {
    return key_length;
  }

  public String attrName() {
    return attr_name;
  }

  /** @return True when the key is a truncated timestamp. */
  public boolean bucketed() {
    return key_length > 0;
  }

  @Override
  public String operator() {
    return "$project";
  }

  @Override
  public ObjectNode toJson() {
    final ObjectNode projection = JSON.newObject();
    if (bucketed()) {
      final ObjectNode date_string = JSON.newObject();
      final ObjectNode format = date_string.putObject("$dateToString");
      format.put("format", "%Y-%m-%dT%H:%M:%S.%LZ");
      format.put("date", "$" + RawPoint.RECV_TIME);
      final ArrayNode substr = JSON.newArray();
      substr.add(date_string);
      substr.add(0);
      substr.add(key_length);
      projection.putObject(Bucket.KEY).set("$substr", substr);
    } else {
      projection.put(Bucket.KEY, attr_name);
    }
    projection.put(RawPoint.RECV_TIME, 1);
    final ObjectNode convert = projection.putObject(VALUE)
        .putObject("$convert");
    convert.put("input", "$" + RawPoint.ATTR_VALUE);
    convert.put("to", "double");
    convert.putNull("onError");
    convert.putNull("onNull");
    final ObjectNode stage = JSON.newObject();
    stage.set(operator(), projection);
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
    final ProjectStage other = (ProjectStage) o;
    return key_length == other.key_length
        && attr_name.equals(other.attr_name);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(key_length, attr_name);
  }

  @Override
  public String toString() {
    return toJson().toString();
  }
}
