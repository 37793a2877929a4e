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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestAggregationMethod {

  @Test
  public void fromString() throws Exception {
    assertEquals(AggregationMethod.MIN, AggregationMethod.fromString("min"));
    assertEquals(AggregationMethod.MAX, AggregationMethod.fromString("MAX"));
    assertEquals(AggregationMethod.AVG, AggregationMethod.fromString("avg"));
    assertEquals(AggregationMethod.SUM2, AggregationMethod.fromString("sum2"));
    assertEquals(AggregationMethod.OCCUR,
        AggregationMethod.fromString("occur"));
  }

  @Test
  public void fromStringInvalid() throws Exception {
    try {
      AggregationMethod.fromString(null);
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }

    try {
      AggregationMethod.fromString("");
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) { }

    try {
      AggregationMethod.fromString("median");
      fail("Expected InvalidQueryException");
    } catch (InvalidQueryException e) {
      assertEquals(InvalidQueryException.QUERY_KEYS, e.keys());
    }
  }

  @Test
  public void onDemand() throws Exception {
    assertTrue(AggregationMethod.MIN.onDemand());
    assertTrue(AggregationMethod.MAX.onDemand());
    assertTrue(AggregationMethod.AVG.onDemand());
    assertFalse(AggregationMethod.SUM.onDemand());
    assertFalse(AggregationMethod.SUM2.onDemand());
    assertFalse(AggregationMethod.OCCUR.onDemand());
  }
}
