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
package net.sth.utils;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TestDateTime {

  @Test
  public void toIsoString() throws Exception {
    assertEquals("1970-01-01T00:00:00.000Z", DateTime.toIsoString(0));
    assertEquals("2024-01-01T10:05:00.000Z",
        DateTime.toIsoString(1704103500000L));
    assertEquals("2024-01-01T10:05:00.001Z",
        DateTime.toIsoString(1704103500001L));
  }

  @Test
  public void parseIsoString() throws Exception {
    assertEquals(1704103500000L,
        DateTime.parseIsoString("2024-01-01T10:05:00.000Z"));
    assertEquals(1704103500000L, DateTime.parseIsoString("2024-01-01T10:05Z"));
    assertEquals(1704103500000L,
        DateTime.parseIsoString("2024-01-01T10:05:00Z"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void parseIsoStringNull() throws Exception {
    DateTime.parseIsoString(null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void parseIsoStringInvalid() throws Exception {
    DateTime.parseIsoString("yesterday");
  }

  @Test
  public void truncatedIsoString() throws Exception {
    final long ts = 1704103500000L;
    assertEquals("2024-01-01T10", DateTime.truncatedIsoString(ts, 13));
    assertEquals("2024-01-01", DateTime.truncatedIsoString(ts, 10));
    assertEquals("2024-01", DateTime.truncatedIsoString(ts, 7));
    assertEquals("2024-01-01T10:05:00.000Z",
        DateTime.truncatedIsoString(ts, 64));
  }
}
