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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.sth.utils.DateTime;

/**
 * A raw attribute reading as stored in a history collection. Immutable.
 * <p>
 * The value is kept as received so it may be a number, a numeric string or
 * anything else the producer sent. Aggregation coerces it when needed.
 */
public class RawPoint implements HistoryDatum {

  public static final String RECV_TIME = "recvTime";
  public static final String ATTR_TYPE = "attrType";
  public static final String ATTR_VALUE = "attrValue";

  /** The rendered field layout of a raw point. */
  public static final List<String> FIELDS =
      ImmutableList.of(RECV_TIME, ATTR_TYPE, ATTR_VALUE);

  /** Reception time in Unix epoch milliseconds. */
  private final long recv_time;

  /** The name of the attribute this reading belongs to. */
  private final String attr_name;

  /** The declared type of the attribute, may be null. */
  private final String attr_type;

  /** The raw value. */
  private final Object attr_value;

  protected RawPoint(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.attr_name)) {
      throw new IllegalArgumentException("Attribute name cannot be null "
          + "or empty.");
    }
    recv_time = builder.recv_time;
    attr_name = builder.attr_name;
    attr_type = builder.attr_type;
    attr_value = builder.attr_value;
  }

  /** @return The reception time in epoch milliseconds. */
  public long recvTime() {
    return recv_time;
  }

  /** @return The attribute name. */
  public String attrName() {
    return attr_name;
  }

  /** @return The declared attribute type, may be null. */
  public String attrType() {
    return attr_type;
  }

  /** @return The raw value, may be null. */
  public Object attrValue() {
    return attr_value;
  }

  @Override
  public List<String> fieldNames() {
    return FIELDS;
  }

  @Override
  public List<Object> fieldValues() {
    return Collections.unmodifiableList(Arrays.asList(
        (Object) DateTime.toIsoString(recv_time), attr_type, attr_value));
  }

  @Override
  public Map<String, Object> asMap() {
    final Map<String, Object> map = new LinkedHashMap<String, Object>(3);
    map.put(RECV_TIME, DateTime.toIsoString(recv_time));
    map.put(ATTR_TYPE, attr_type);
    map.put(ATTR_VALUE, attr_value);
    return map;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final RawPoint other = (RawPoint) o;
    return recv_time == other.recv_time
        && Objects.equal(attr_name, other.attr_name)
        && Objects.equal(attr_type, other.attr_type)
        && Objects.equal(attr_value, other.attr_value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(recv_time, attr_name, attr_type, attr_value);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("recvTime=").append(DateTime.toIsoString(recv_time))
        .append(", attrName=").append(attr_name)
        .append(", attrType=").append(attr_type)
        .append(", attrValue=").append(attr_value)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private long recv_time;
    private String attr_name;
    private String attr_type;
    private Object attr_value;

    public Builder setRecvTime(final long recv_time) {
      this.recv_time = recv_time;
      return this;
    }

    public Builder setRecvTime(final String recv_time) {
      this.recv_time = DateTime.parseIsoString(recv_time);
      return this;
    }

    public Builder setAttrName(final String attr_name) {
      this.attr_name = attr_name;
      return this;
    }

    public Builder setAttrType(final String attr_type) {
      this.attr_type = attr_type;
      return this;
    }

    public Builder setAttrValue(final Object attr_value) {
      this.attr_value = attr_value;
      return this;
    }

    public RawPoint build() {
      return new RawPoint(this);
    }
  }
}
