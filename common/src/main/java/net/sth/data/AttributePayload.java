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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * The data of one attribute of one entity, ready for an envelope.
 * <p>
 * The canonical form is {@code {name, values: [document...]}}. The
 * light-weight form is {@code {name, fields: [field...], values: [row...]}}
 * where each row lists the values in field order.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "name", "fields", "values" })
public class AttributePayload {

  private final String name;
  private final List<String> fields;
  private final List<Object> values;

  private AttributePayload(final String name,
                           final List<String> fields,
                           final List<Object> values) {
    if (name == null) {
      throw new IllegalArgumentException("Name cannot be null.");
    }
    this.name = name;
    this.fields = fields;
    this.values = values;
  }

  /**
   * Renders the data in the given representation.
   * @param name The attribute name.
   * @param data The non-null, possibly empty, data.
   * @param representation The representation to use.
   * @return The payload.
   */
  public static AttributePayload of(final String name,
                                    final List<? extends HistoryDatum> data,
                                    final Representation representation) {
    if (data.isEmpty()) {
      return empty(name, representation);
    }
    if (representation == Representation.LIGHTWEIGHT) {
      final List<Object> rows = Lists.newArrayListWithCapacity(data.size());
      for (final HistoryDatum datum : data) {
        rows.add(datum.fieldValues());
      }
      return new AttributePayload(name,
          ImmutableList.copyOf(data.get(0).fieldNames()),
          Collections.unmodifiableList(rows));
    }
    final List<Object> documents = Lists.newArrayListWithCapacity(data.size());
    for (final HistoryDatum datum : data) {
      documents.add(datum.asMap());
    }
    return new AttributePayload(name, null,
        Collections.unmodifiableList(documents));
  }

  /**
   * The placeholder for an attribute without data.
   * @param name The attribute name.
   * @param representation The representation to use.
   * @return An empty payload.
   */
  public static AttributePayload empty(final String name,
                                       final Representation representation) {
    return new AttributePayload(name,
        representation == Representation.LIGHTWEIGHT ?
            Collections.<String>emptyList() : null,
        Collections.emptyList());
  }

  @JsonProperty("name")
  public String name() {
    return name;
  }

  /** @return The column names for the light-weight form, null otherwise. */
  @JsonProperty("fields")
  public List<String> fields() {
    return fields;
  }

  /** @return The documents or rows. */
  @JsonProperty("values")
  public List<Object> values() {
    return values;
  }

  /** @return True if there were no values. */
  @JsonIgnore
  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final AttributePayload other = (AttributePayload) o;
    return Objects.equal(name, other.name)
        && Objects.equal(fields, other.fields)
        && Objects.equal(values, other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, fields, values);
  }

  @Override
  public String toString() {
    return "name=" + name + ", fields=" + fields + ", values=" + values;
  }
}
