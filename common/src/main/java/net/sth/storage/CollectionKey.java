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
package net.sth.storage;

import com.google.common.base.Objects;
import com.google.common.base.Strings;

/**
 * The logical identity of a storage collection: the tenant, the entity and
 * optionally the attribute. Whether the attribute narrows the collection
 * depends on the store's data model. The aggregated flag selects the
 * precomputed rollup collection instead of the raw one.
 */
public class CollectionKey {

  private final String service;
  private final String service_path;
  private final String entity_id;
  private final String entity_type;
  private final String attr_name;
  private final boolean aggregated;

  public CollectionKey(final String service,
                       final String service_path,
                       final String entity_id,
                       final String entity_type,
                       final String attr_name,
                       final boolean aggregated) {
    if (Strings.isNullOrEmpty(entity_id)) {
      throw new IllegalArgumentException("Entity ID cannot be null or empty.");
    }
    this.service = service;
    this.service_path = service_path;
    this.entity_id = entity_id;
    this.entity_type = entity_type;
    this.attr_name = attr_name;
    this.aggregated = aggregated;
  }

  public String service() {
    return service;
  }

  public String servicePath() {
    return service_path;
  }

  public String entityId() {
    return entity_id;
  }

  public String entityType() {
    return entity_type;
  }

  /** @return The attribute name, null when resolving the whole entity. */
  public String attrName() {
    return attr_name;
  }

  public boolean aggregated() {
    return aggregated;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final CollectionKey other = (CollectionKey) o;
    return Objects.equal(service, other.service)
        && Objects.equal(service_path, other.service_path)
        && Objects.equal(entity_id, other.entity_id)
        && Objects.equal(entity_type, other.entity_type)
        && Objects.equal(attr_name, other.attr_name)
        && aggregated == other.aggregated;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(service, service_path, entity_id, entity_type,
        attr_name, aggregated);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("service=").append(service)
        .append(", servicePath=").append(service_path)
        .append(", entityId=").append(entity_id)
        .append(", entityType=").append(entity_type)
        .append(", attrName=").append(attr_name)
        .append(", aggregated=").append(aggregated)
        .toString();
  }
}
