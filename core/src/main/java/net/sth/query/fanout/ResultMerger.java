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
package net.sth.query.fanout;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.sth.data.AttributePayload;
import net.sth.data.Representation;
import net.sth.render.EnvelopeRenderer;
import net.sth.render.HistoryResponse;

/**
 * Collects the attribute payloads of a request in a grid of slots indexed
 * by entity and attribute position so the merged output follows the
 * requested order no matter in which order the cells complete. Slots of
 * entities whose collection wasn't found stay empty and the entity is
 * rendered without attributes.
 * <p>
 * Writers may run concurrently. {@link #merge()} must only be called once
 * every writer is done.
 */
public class ResultMerger {

  private final List<String> entity_ids;
  private final String entity_type;
  private final List<String> attr_names;
  private final EnvelopeRenderer renderer;
  private final boolean count;
  private final List<AtomicReferenceArray<AttributePayload>> slots;
  private final AtomicLong total_count;

  public ResultMerger(final List<String> entity_ids,
                      final String entity_type,
                      final List<String> attr_names,
                      final EnvelopeRenderer renderer,
                      final boolean count) {
    if (entity_ids == null || entity_ids.isEmpty()) {
      throw new IllegalArgumentException("Entity IDs cannot be null or "
          + "empty.");
    }
    if (attr_names == null || attr_names.isEmpty()) {
      throw new IllegalArgumentException("Attribute names cannot be null or "
          + "empty.");
    }
    if (renderer == null) {
      throw new IllegalArgumentException("Renderer cannot be null.");
    }
    this.entity_ids = ImmutableList.copyOf(entity_ids);
    this.entity_type = entity_type;
    this.attr_names = ImmutableList.copyOf(attr_names);
    this.renderer = renderer;
    this.count = count;
    slots = Lists.newArrayListWithCapacity(entity_ids.size());
    for (int i = 0; i < entity_ids.size(); i++) {
      slots.add(new AtomicReferenceArray<AttributePayload>(attr_names.size()));
    }
    total_count = new AtomicLong();
  }

  public List<String> entityIds() {
    return entity_ids;
  }

  public List<String> attrNames() {
    return attr_names;
  }

  public Representation representation() {
    return renderer.representation();
  }

  /**
   * Stores the payload of one cell.
   * @param entity_index The position of the entity in the request.
   * @param attr_index The position of the attribute in the request.
   * @param payload The non-null payload.
   * @param records The records to add to the total when counting.
   * @throws IllegalStateException if the slot was already filled.
   */
  public void add(final int entity_index,
                  final int attr_index,
                  final AttributePayload payload,
                  final long records) {
    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null.");
    }
    if (!slots.get(entity_index).compareAndSet(attr_index, null, payload)) {
      throw new IllegalStateException("Slot [" + entity_index + ", "
          + attr_index + "] was already filled.");
    }
    if (count && !payload.isEmpty()) {
      total_count.addAndGet(records);
    }
  }

  /** @return The running total record count. */
  public long totalCount() {
    return total_count.get();
  }

  /** @return The merged response, with the total when counting. */
  public HistoryResponse merge() {
    final List<ObjectNode> entities =
        Lists.newArrayListWithCapacity(entity_ids.size());
    for (int i = 0; i < entity_ids.size(); i++) {
      final AtomicReferenceArray<AttributePayload> row = slots.get(i);
      final List<AttributePayload> attributes =
          Lists.newArrayListWithCapacity(row.length());
      for (int x = 0; x < row.length(); x++) {
        final AttributePayload payload = row.get(x);
        if (payload != null) {
          attributes.add(payload);
        }
      }
      entities.add(renderer.renderEntity(entity_ids.get(i), entity_type,
          attributes));
    }
    return new HistoryResponse(renderer.renderMulti(entities),
        count ? total_count.get() : null);
  }
}
