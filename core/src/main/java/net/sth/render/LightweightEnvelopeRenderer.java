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
package net.sth.render;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import net.sth.data.AttributePayload;
import net.sth.data.Representation;
import net.sth.utils.JSON;

/**
 * Renders the columnar envelope:
 * <pre>
 * {"results":[{"entityId":"room1","entityType":"Room","attributes":[
 *   {"name":"temperature","fields":[...],"values":[[...],...]}]}]}
 * </pre>
 */
public class LightweightEnvelopeRenderer implements EnvelopeRenderer {

  @Override
  public Representation representation() {
    return Representation.LIGHTWEIGHT;
  }

  @Override
  public ObjectNode renderEntity(final String entity_id,
                                 final String entity_type,
                                 final List<AttributePayload> attributes) {
    final ObjectNode entity = JSON.newObject();
    entity.put("entityId", entity_id);
    if (entity_type != null) {
      entity.put("entityType", entity_type);
    }
    final ArrayNode array = entity.putArray("attributes");
    for (final AttributePayload attribute : attributes) {
      array.add(JSON.toTree(attribute));
    }
    return entity;
  }

  @Override
  public JsonNode renderMulti(final List<ObjectNode> entities) {
    final ObjectNode payload = JSON.newObject();
    payload.putArray("results").addAll(entities);
    return payload;
  }
}
