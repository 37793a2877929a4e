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
import static org.junit.Assert.assertFalse;

import java.util.Collections;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import net.sth.data.AttributePayload;
import net.sth.data.Bucket;
import net.sth.data.Representation;
import net.sth.utils.JSON;

public class TestNgsiEnvelopeRenderer {

  @Test
  public void renderEntity() throws Exception {
    final NgsiEnvelopeRenderer renderer = new NgsiEnvelopeRenderer();
    assertEquals(Representation.CANONICAL, renderer.representation());

    final AttributePayload payload = AttributePayload.of("temperature",
        ImmutableList.of(new Bucket("2024-01-01T10", 1704103500000L, 15)),
        Representation.CANONICAL);
    final ObjectNode entity = renderer.renderEntity("room1", "Room",
        ImmutableList.of(payload));
    final JsonNode element = entity.get("contextElement");
    assertEquals("room1", element.get("id").asText());
    assertEquals("Room", element.get("type").asText());
    assertFalse(element.get("isPattern").asBoolean());
    final JsonNode attribute = element.get("attributes").get(0);
    assertEquals("temperature", attribute.get("name").asText());
    assertEquals(null, attribute.get("fields"));
    assertEquals("2024-01-01T10", attribute.get("values").get(0).get("_id")
        .asText());
    assertEquals(15, attribute.get("values").get(0).get("attrValue")
        .asDouble(), 0.0001);
    assertEquals("200", entity.get("statusCode").get("code").asText());
    assertEquals("OK", entity.get("statusCode").get("reasonPhrase").asText());
  }

  @Test
  public void renderEntityNoType() throws Exception {
    final ObjectNode entity = new NgsiEnvelopeRenderer().renderEntity(
        "room1", null, Collections.<AttributePayload>emptyList());
    assertEquals("{\"contextElement\":{\"attributes\":[],\"id\":\"room1\","
        + "\"isPattern\":false},\"statusCode\":{\"code\":\"200\","
        + "\"reasonPhrase\":\"OK\"}}", JSON.serializeToString(entity));
  }

  @Test
  public void renderMulti() throws Exception {
    final NgsiEnvelopeRenderer renderer = new NgsiEnvelopeRenderer();
    final JsonNode payload = renderer.renderMulti(ImmutableList.of(
        renderer.renderEntity("room1", "Room",
            Collections.<AttributePayload>emptyList()),
        renderer.renderEntity("room2", "Room",
            Collections.<AttributePayload>emptyList())));
    final JsonNode responses = payload.get("contextResponses");
    assertEquals(2, responses.size());
    assertEquals("room2", responses.get(1).get("contextElement").get("id")
        .asText());
  }
}
