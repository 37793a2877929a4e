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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.io.Files;

public class TestConfig {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void defaults() throws Exception {
    final Config config = new Config(false);
    assertEquals(100, config.maxPageSize());
    assertTrue(config.filterOutEmpty());
    assertFalse(config.getBoolean(Config.MEMORY_STORE_THREADPOOL_KEY));
    assertNull(config.configLocation());
  }

  @Test
  public void overrideConfig() throws Exception {
    final Config config = new Config(false);
    config.overrideConfig(Config.MAX_PAGE_SIZE_KEY, "50");
    config.overrideConfig(Config.FILTER_OUT_EMPTY_KEY, "no");
    config.overrideConfig(Config.MEMORY_STORE_THREADPOOL_KEY, "yes");
    assertEquals(50, config.maxPageSize());
    assertFalse(config.filterOutEmpty());
    assertTrue(config.getBoolean(Config.MEMORY_STORE_THREADPOOL_KEY));
  }

  @Test
  public void copy() throws Exception {
    final Config parent = new Config(false);
    parent.overrideConfig(Config.MAX_PAGE_SIZE_KEY, "10");
    final Config child = new Config(parent);
    child.overrideConfig(Config.MAX_PAGE_SIZE_KEY, "20");
    assertEquals(10, parent.maxPageSize());
    assertEquals(20, child.maxPageSize());
  }

  @Test
  public void loadFile() throws Exception {
    final File file = folder.newFile("sth.conf");
    Files.asCharSink(file, StandardCharsets.UTF_8).write(
        "sth.query.max_page_size = 25\n");
    final Config config = new Config(file.getAbsolutePath());
    assertEquals(25, config.maxPageSize());
    assertTrue(config.filterOutEmpty());
    assertEquals(file.getAbsolutePath(), config.configLocation());
  }

  @Test(expected = FileNotFoundException.class)
  public void loadFileMissing() throws Exception {
    new Config(new File(folder.getRoot(), "nosuch.conf").getAbsolutePath());
  }

  @Test(expected = NullPointerException.class)
  public void getBooleanMissing() throws Exception {
    new Config(false).getBoolean("sth.nosuch");
  }

  @Test(expected = NumberFormatException.class)
  public void getIntInvalid() throws Exception {
    final Config config = new Config(false);
    config.overrideConfig(Config.MAX_PAGE_SIZE_KEY, "lots");
    config.maxPageSize();
  }

  @Test
  public void dumpConfiguration() throws Exception {
    final String dump = new Config(false).dumpConfiguration();
    assertTrue(dump.contains(Config.MAX_PAGE_SIZE_KEY));
  }
}
