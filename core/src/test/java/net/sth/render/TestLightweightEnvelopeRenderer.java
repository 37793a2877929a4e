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

import static org.junit.Assert.assertEquals;

import java.util.Collections;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import net.sth.data.AttributePayload;
import net.sth.data.RawPoint;
import net.sth.data.Representation;
import net.sth.utils.JSON;

public class TestLightweightEnvelopeRenderer {

  @Test
  public void renderEntity() throws Exception {
    final LightweightEnvelopeRenderer renderer =
        new LightweightEnvelopeRenderer();
    assertEquals(Representation.LIGHTWEIGHT, renderer.representation());

    final AttributePayload payload = AttributePayload.of("temperature",
        ImmutableList.of(RawPoint.newBuilder()
            .setRecvTime("2024-01-01T10:05Z")
            .setAttrName("temperature")
            .setAttrType("Number")
            .setAttrValue(21.5)
            .build()),
        Representation.LIGHTWEIGHT);
    final JsonNode entity = renderer.renderEntity("room1", "Room",
        ImmutableList.of(payload));
    assertEquals("room1", entity.get("entityId").asText());
    assertEquals("Room", entity.get("entityType").asText());
    final JsonNode attribute = entity.get("attributes").get(0);
    assertEquals("temperature", attribute.get("name").asText());
    assertEquals(RawPoint.FIELDS.size(), attribute.get("fields").size());
    assertEquals(RawPoint.ATTR_TYPE, attribute.get("fields").get(1).asText());
    final JsonNode row = attribute.get("values").get(0);
    assertEquals("Number", row.get(1).asText());
    assertEquals(21.5, row.get(2).asDouble(), 0.0001);
  }

  @Test
  public void renderMultiEmpty() throws Exception {
    final LightweightEnvelopeRenderer renderer =
        new LightweightEnvelopeRenderer();
    final JsonNode payload = renderer.renderMulti(ImmutableList.of(
        renderer.renderEntity("room1", null,
            Collections.<AttributePayload>emptyList())));
    assertEquals("{\"results\":[{\"entityId\":\"room1\",\"attributes\":[]}]}",
        JSON.serializeToString(payload));
  }
}
