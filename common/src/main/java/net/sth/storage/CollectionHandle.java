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
 * An opaque reference to a resolved collection. Only the store that issued
 * it knows what the name means.
 */
public class CollectionHandle {

  private final String name;
  private final CollectionKey key;

  public CollectionHandle(final String name, final CollectionKey key) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    if (key == null) {
      throw new IllegalArgumentException("Key cannot be null.");
    }
    this.name = name;
    this.key = key;
  }

  /** @return The store specific collection name. */
  public String name() {
    return name;
  }

  /** @return The key this handle was resolved from. */
  public CollectionKey key() {
    return key;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final CollectionHandle other = (CollectionHandle) o;
    return Objects.equal(name, other.name) && Objects.equal(key, other.key);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, key);
  }

  @Override
  public String toString() {
    return name;
  }
}
