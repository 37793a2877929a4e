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
 * Renders the canonical NGSI context response:
 * <pre>
 * {"contextResponses":[{"contextElement":{"attributes":[...],"id":"room1",
 *   "isPattern":false,"type":"Room"},
 *   "statusCode":{"code":"200","reasonPhrase":"OK"}}]}
 * </pre>
 */
public class NgsiEnvelopeRenderer implements EnvelopeRenderer {

  @Override
  public Representation representation() {
    return Representation.CANONICAL;
  }

  @Override
  public ObjectNode renderEntity(final String entity_id,
                                 final String entity_type,
                                 final List<AttributePayload> attributes) {
    final ObjectNode response = JSON.newObject();
    final ObjectNode element = response.putObject("contextElement");
    final ArrayNode array = element.putArray("attributes");
    for (final AttributePayload attribute : attributes) {
      array.add(JSON.toTree(attribute));
    }
    element.put("id", entity_id);
    element.put("isPattern", false);
    if (entity_type != null) {
      element.put("type", entity_type);
    }
    final ObjectNode status = response.putObject("statusCode");
    status.put("code", "200");
    status.put("reasonPhrase", "OK");
    return response;
  }

  @Override
  public JsonNode renderMulti(final List<ObjectNode> entities) {
    final ObjectNode payload = JSON.newObject();
    payload.putArray("contextResponses").addAll(entities);
    return payload;
  }
}
