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
import com.fasterxml.jackson.databind.node.ObjectNode;

import net.sth.data.AttributePayload;
import net.sth.data.Representation;

/**
 * Wraps computed attribute payloads into the envelope the HTTP layer
 * writes out. Implementations are pure formatting functions.
 */
public interface EnvelopeRenderer {

  /** @return The attribute representation this renderer pairs with. */
  public Representation representation();

  /**
   * Renders the fragment for one entity.
   * @param entity_id The entity ID.
   * @param entity_type The entity type, may be null.
   * @param attributes The non-null, possibly empty, attribute payloads.
   * @return The entity fragment.
   */
  public ObjectNode renderEntity(final String entity_id,
                                 final String entity_type,
                                 final List<AttributePayload> attributes);

  /**
   * Combines entity fragments into the final payload.
   * @param entities The fragments in output order.
   * @return The final payload.
   */
  public JsonNode renderMulti(final List<ObjectNode> entities);
}
