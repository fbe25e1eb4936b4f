/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.jsci.test;

import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.StringWriter;
import java.util.function.Consumer;

import org.jsci.exec.stream.TextWriteStream;
import org.junit.Rule;
import org.junit.rules.TestRule;
import org.junit.rules.TestWatcher;
import org.junit.rules.Timeout;
import org.junit.runner.Description;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Common base for the stream and parser tests. Adds a per-test timeout
 * and failure logging, and helpers to produce text output and to check it
 * with an independent JSON reader.
 */
public class BaseTest {
  private static final Logger logger = LoggerFactory.getLogger(BaseTest.class);

  protected static final ObjectMapper MAPPER = new ObjectMapper();

  @Rule
  public final Timeout timeout = Timeout.seconds(30);

  @Rule
  public final TestRule watcher = new TestWatcher() {
    @Override
    protected void failed(Throwable e, Description description) {
      logger.error("Test failed: {}", description.getDisplayName(), e);
    }
  };

  /**
   * Run a sequence of calls against a text stream and return the text.
   */
  protected static String textOf(int indent, Consumer<TextWriteStream> calls) {
    StringWriter out = new StringWriter();
    TextWriteStream stream = new TextWriteStream(out, indent);
    calls.accept(stream);
    stream.flush();
    return out.toString();
  }

  /**
   * Parse the text with Jackson's own tree reader, failing the test if it
   * is not a single well-formed JSON document.
   */
  protected static JsonNode readTree(String json) {
    try {
      return MAPPER.readTree(json);
    } catch (IOException e) {
      fail("Not valid JSON: " + e.getMessage() + "\n" + json);
      return null;
    }
  }
}
