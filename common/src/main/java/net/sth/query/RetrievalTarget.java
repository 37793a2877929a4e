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
package net.sth.query;

import com.google.common.base.Objects;
import com.google.common.base.Strings;

/**
 * One (entity, attribute) cell of a query. Immutable.
 */
public class RetrievalTarget {

  private final String entity_id;
  private final String entity_type;
  private final String attr_name;

  public RetrievalTarget(final String entity_id,
                         final String entity_type,
                         final String attr_name) {
    if (Strings.isNullOrEmpty(entity_id)) {
      throw new IllegalArgumentException("Entity ID cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(attr_name)) {
      throw new IllegalArgumentException("Attribute name cannot be null "
          + "or empty.");
    }
    this.entity_id = entity_id;
    this.entity_type = entity_type;
    this.attr_name = attr_name;
  }

  public String entityId() {
    return entity_id;
  }

  /** @return The entity type, may be null. */
  public String entityType() {
    return entity_type;
  }

  public String attrName() {
    return attr_name;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final RetrievalTarget other = (RetrievalTarget) o;
    return Objects.equal(entity_id, other.entity_id)
        && Objects.equal(entity_type, other.entity_type)
        && Objects.equal(attr_name, other.attr_name);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(entity_id, entity_type, attr_name);
  }

  @Override
  public String toString() {
    return entity_id + ":" + entity_type + ":" + attr_name;
  }
}
