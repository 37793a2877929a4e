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

import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.DeferredGroupException;

public class TestExceptions {

  @Test
  public void unwrapPlain() throws Exception {
    final IllegalStateException e = new IllegalStateException("Boo!");
    assertSame(e, Exceptions.unwrap(e));
    assertSame(e, Exceptions.unwrapException(e));
    assertNull(Exceptions.unwrap(null));
  }

  @Test
  public void unwrapGroup() throws Exception {
    final IllegalStateException e = new IllegalStateException("Boo!");
    final List<Deferred<Object>> deferreds = Lists.newArrayList();
    deferreds.add(Deferred.fromResult(null));
    deferreds.add(Deferred.<Object>fromError(e));
    try {
      Deferred.group(deferreds).join();
    } catch (DeferredGroupException dge) {
      assertSame(e, Exceptions.unwrap(dge));
      assertSame(e, Exceptions.unwrapException(dge));
      return;
    }
    throw new AssertionError("Expected a DeferredGroupException");
  }

  @Test
  public void unwrapError() throws Exception {
    final Exception e = new RuntimeException(new OutOfMemoryError());
    assertTrue(Exceptions.unwrapException(e) instanceof RuntimeException);
  }
}
