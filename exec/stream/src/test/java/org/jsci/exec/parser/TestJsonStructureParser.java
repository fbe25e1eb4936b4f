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
package org.jsci.exec.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.jsci.categories.ParserTest;
import org.jsci.common.config.JsciConfig;
import org.jsci.common.exceptions.JsonStructureException;
import org.jsci.common.value.ArrayValue;
import org.jsci.common.value.JsonValue;
import org.jsci.common.value.ObjectValue;
import org.jsci.test.BaseTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonToken;
import com.typesafe.config.ConfigFactory;

@Category(ParserTest.class)
public class TestJsonStructureParser extends BaseTest {

  /**
   * Retain the error type and error message so they can be verified in a
   * test.
   */
  @SuppressWarnings("serial")
  protected static class JsonErrorFixture extends RuntimeException {
    String errorType;

    public JsonErrorFixture(String errorType, String msg, Exception e) {
      super(msg, e);
      this.errorType = errorType;
    }

    public JsonErrorFixture(String errorType, String msg) {
      super(msg);
      this.errorType = errorType;
    }
  }

  /**
   * Convert JSON errors to a simple form for use in tests.
   */
  protected static class ErrorFactoryFixture implements ErrorFactory {

    @Override
    public RuntimeException parseError(String msg, JsonParseException e) {
      return new JsonErrorFixture("parseError", msg, e);
    }

    @Override
    public RuntimeException ioException(IOException e) {
      return new JsonErrorFixture("ioException", "", e);
    }

    @Override
    public RuntimeException ioException(String msg, IOException e) {
      return new JsonErrorFixture("ioException", msg, e);
    }

    @Override
    public RuntimeException syntaxError(JsonParseException e) {
      return new JsonErrorFixture("syntaxError", "", e);
    }

    @Override
    public RuntimeException syntaxError(JsonToken token) {
      return new JsonErrorFixture("syntaxError", token.toString());
    }

    @Override
    public RuntimeException structureError(String msg) {
      return new JsonErrorFixture("structureError", msg);
    }
  }

  private static JsonOptions fixtureOptions() {
    JsonOptions options = new JsonOptions();
    options.errorFactory = new ErrorFactoryFixture();
    return options;
  }

  private static void expectError(String json, JsonOptions options, String errorType) {
    try {
      new DefaultTransformer(options, null).parse(json);
      fail("Should have failed: " + json);
    } catch (JsonErrorFixture e) {
      assertEquals(json, errorType, e.errorType);
    }
  }

  @Test
  public void testScalars() {
    DefaultTransformer reader = new DefaultTransformer();
    assertEquals(JsonValue.of(10), reader.parse("10"));
    assertEquals(JsonValue.of(-2.5e3), reader.parse(" -2.5e3 "));
    assertEquals(JsonValue.of("a\"b"), reader.parse("\"a\\\"b\""));
    assertEquals(JsonValue.of(true), reader.parse("true"));
    assertEquals(JsonValue.nullValue(), reader.parse("null"));
  }

  /**
   * A document with every kind, empty containers, escapes and several
   * number formats.
   */
  @Test
  public void testDocument() {
    String json =
        "{\n" +
        "  \"empty_object\" : {},\n" +
        "  \"empty_array\"  : [],\n" +
        "  \"booleans\"     : { \"YES\" : true, \"NO\" : false },\n" +
        "  \"numbers\"      : [ 0, 1, -2, 3.3, 4.4e5, 6.6e-7 ],\n" +
        "  \"strings\"      : [ \"This\", [ \"And\" , \"That\", \"And a \\\"b\" ] ],\n" +
        "  \"nothing\"      : null\n" +
        "}";
    JsonValue expected = new ObjectValue()
        .put("empty_object", new ObjectValue())
        .put("empty_array", new ArrayValue())
        .put("booleans", new ObjectValue().put("YES", true).put("NO", false))
        .put("numbers", ArrayValue.ofDoubles(0, 1, -2, 3.3, 4.4e5, 6.6e-7))
        .put("strings", ArrayValue.of(JsonValue.of("This"),
            ArrayValue.of(JsonValue.of("And"), JsonValue.of("That"), JsonValue.of("And a \"b"))))
        .put("nothing", JsonValue.nullValue());
    assertEquals(expected, new DefaultTransformer().parse(json));
  }

  @Test
  public void testKeyOrderAndDuplicates() {
    ObjectValue obj = new DefaultTransformer()
        .parse("{\"z\": 1, \"a\": 2, \"m\": 3, \"a\": 4}")
        .asObject();
    assertEquals(Arrays.asList("z", "a", "m"), obj.keys());
    assertEquals(JsonValue.of(4), obj.get("a"));
  }

  @Test
  public void testInputStream() {
    byte[] bytes = "[\"héllo\"]".getBytes(StandardCharsets.UTF_8);
    JsonValue value = new DefaultTransformer().parse(new ByteArrayInputStream(bytes));
    assertEquals(ArrayValue.of(JsonValue.of("héllo")), value);
  }

  @Test
  public void testSyntaxErrors() {
    JsonOptions options = fixtureOptions();
    expectError("{\"a\": }", options, "syntaxError");
    expectError("[1, 2", options, "syntaxError");
    expectError("[1,]", options, "syntaxError");
    expectError("{\"a\" 1}", options, "syntaxError");
    expectError("tru", options, "syntaxError");
  }

  @Test
  public void testEmptyInput() {
    expectError("", fixtureOptions(), "structureError");
    expectError("   \n", fixtureOptions(), "structureError");
  }

  /**
   * Exactly one document: a second value is an error.
   */
  @Test
  public void testTrailingContent() {
    try {
      new DefaultTransformer(fixtureOptions(), null).parse("{} []");
      fail();
    } catch (JsonErrorFixture e) {
      assertEquals("syntaxError", e.errorType);
      assertEquals(JsonToken.START_ARRAY.toString(), e.getMessage());
    }
    expectError("1 x", fixtureOptions(), "syntaxError");
  }

  @Test
  public void testIoError() {
    Reader failing = new Reader() {
      @Override
      public int read(char[] cbuf, int off, int len) throws IOException {
        throw new IOException("network down");
      }

      @Override
      public void close() { }
    };
    try {
      new DefaultTransformer(fixtureOptions(), null).parse(failing);
      fail();
    } catch (JsonErrorFixture e) {
      assertEquals("ioException", e.errorType);
      assertEquals("network down", e.getCause().getMessage());
    }
  }

  @Test
  public void testDefaultErrorFactory() {
    try {
      new DefaultTransformer().parse("[1, 2");
      fail();
    } catch (JsonStructureException e) {
      assertTrue(e.getCause() instanceof JsonParseException);
    }
    try {
      new DefaultTransformer().parse("");
      fail();
    } catch (JsonStructureException e) {
      assertTrue(e.getMessage().contains("empty"));
    }
  }

  @Test
  public void testComments() {
    String json = "// leading\n[1, /* inline */ 2]";
    expectError(json, fixtureOptions(), "syntaxError");

    JsonOptions options = fixtureOptions();
    options.allowComments = true;
    assertEquals(ArrayValue.ofDoubles(1, 2), new DefaultTransformer(options, null).parse(json));
  }

  @Test
  public void testNanInf() {
    String json = "[NaN, Infinity, -Infinity]";
    JsonValue value = new DefaultTransformer().parse(json);
    assertEquals(ArrayValue.ofDoubles(Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY), value);

    JsonOptions options = fixtureOptions();
    options.allowNanInf = false;
    expectError(json, options, "syntaxError");
  }

  @Test(timeout = 10_000)
  public void testLargeObject() {
    int count = 100_000;
    StringBuilder buf = new StringBuilder("{");
    for (int i = 0; i < count; i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append("\"key-number-").append(i).append("\": ").append(i);
    }
    buf.append("}");
    ObjectValue obj = new DefaultTransformer().parse(buf.toString()).asObject();
    assertEquals(count, obj.size());
    assertEquals("key-number-0", obj.key(0));
    assertEquals(JsonValue.of(count - 1), obj.get("key-number-" + (count - 1)));
  }

  @Test
  public void testOptionsFromConfig() {
    JsciConfig config = JsciConfig.create(ConfigFactory.parseString(
        "jsci.parser.allow-comments: true, jsci.parser.allow-nan-inf: false"));
    JsonOptions options = new JsonOptions(config);
    assertTrue(options.allowComments);
    assertFalse(options.allowNanInf);
    assertTrue(options.errorFactory instanceof JsonErrorFactory);
  }
}
