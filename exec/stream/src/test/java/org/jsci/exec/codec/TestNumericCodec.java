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
package org.jsci.exec.codec;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.jsci.categories.CodecTest;
import org.jsci.common.exceptions.UnsupportedDTypeException;
import org.jsci.common.exceptions.ValueEncodingException;
import org.jsci.common.value.ArrayValue;
import org.jsci.common.value.ComplexValue;
import org.jsci.common.value.DType;
import org.jsci.common.value.JsonValue;
import org.jsci.common.value.NdArrayValue;
import org.jsci.common.value.ObjectValue;
import org.jsci.exec.parser.DefaultTransformer;
import org.jsci.exec.stream.WriteStreams;
import org.jsci.test.BaseTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.fasterxml.jackson.databind.JsonNode;

@Category(CodecTest.class)
public class TestNumericCodec extends BaseTest {

  private final NumericCodec codec = NumericCodec.INSTANCE;

  private static ObjectValue obj(String json) {
    return new DefaultTransformer().parse(json).asObject();
  }

  /**
   * Write with the codec, read back with it.
   */
  private JsonValue roundTrip(JsonValue value) {
    String text = WriteStreams.toText(value, codec, 2);
    return new DefaultTransformer(codec).parse(text);
  }

  @Test
  public void testComplex() {
    ComplexValue z = new ComplexValue(3, 4);
    JsonValue encoded = codec.encode(z);
    assertEquals(obj("{\"real\": 3.0, \"imag\": 4.0}"), encoded);
    assertEquals(z, codec.decode(encoded.asObject()));

    String text = WriteStreams.toText(z, codec, 0);
    assertEquals("{\"real\":3.0,\"imag\":4.0}", text);
  }

  @Test
  public void testRealArray() {
    NdArrayValue array = NdArrayValue.ofReal(new int[] {2, 2}, 1, 2, 3, 4);
    JsonValue encoded = codec.encode(array);
    assertEquals(obj("{\"dtype\": \"float64\", \"array\": [[1, 2], [3, 4]]}"), encoded);

    NdArrayValue decoded = codec.decode(encoded.asObject()).asNdArray();
    assertEquals(DType.FLOAT64, decoded.dtype());
    assertArrayEquals(new int[] {2, 2}, decoded.shape());
    assertEquals(array, decoded);
  }

  @Test
  public void testComplexArray() {
    NdArrayValue array = NdArrayValue.ofComplex(new int[] {2, 2},
        0.1, -0.2, 1e-300, 7.0 / 3, -0.0, 1e300, Math.PI, -Math.E);
    JsonNode tree = readTree(WriteStreams.toText(array, codec, 2));
    assertEquals("complex128", tree.get("dtype").asText());

    // Last axis holds the interleaved components

    assertEquals(2, tree.get("array").size());
    assertEquals(4, tree.get("array").get(0).size());

    NdArrayValue back = roundTrip(array).asNdArray();
    assertEquals(DType.COMPLEX128, back.dtype());
    assertArrayEquals(array.shape(), back.shape());
    assertArrayEquals(array.data(), back.data(), 0.0);
    assertEquals(array, back);
  }

  @Test
  public void testEdgeShapes() {
    NdArrayValue scalar = NdArrayValue.ofReal(new int[0], 42);
    assertEquals(JsonValue.of(42), codec.encode(scalar).asObject().get(NumericCodec.ARRAY_KEY));
    assertEquals(scalar, roundTrip(scalar));

    NdArrayValue empty = NdArrayValue.ofReal(new int[] {0});
    assertEquals(empty, roundTrip(empty));

    NdArrayValue hollow = NdArrayValue.ofReal(new int[] {2, 0});
    assertEquals(hollow, roundTrip(hollow));

    NdArrayValue special = NdArrayValue.ofReal(new int[] {3}, Double.NaN,
        Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);
    assertEquals(special, roundTrip(special));

    try {
      codec.encode(NdArrayValue.ofComplex(new int[0], 1, 2));
      fail();
    } catch (ValueEncodingException e) {
      // Expected
    }
  }

  @Test
  public void testNested() {
    ObjectValue doc = new ObjectValue()
        .put("z", new ComplexValue(1, -1))
        .put("list", ArrayValue.of(
            NdArrayValue.ofReal(new int[] {3}, 1, 2, 3),
            JsonValue.of("plain")));
    JsonValue back = roundTrip(doc);
    assertEquals(doc, back);
  }

  @Test
  public void testEncodeUnchanged() {
    JsonValue text = JsonValue.of("x");
    assertSame(text, codec.encode(text));
    ObjectValue plain = new ObjectValue().put("a", ArrayValue.ofDoubles(1, 2));
    assertSame(plain, codec.encode(plain));

    // A container with extension values is copied, not modified

    ArrayValue mixed = ArrayValue.of(new ComplexValue(1, 2));
    JsonValue encoded = codec.encode(mixed);
    assertNotSame(mixed, encoded);
    assertTrue(mixed.get(0).isExtension());
    assertEquals(JsonValue.Kind.OBJECT, encoded.asArray().get(0).kind());
  }

  @Test
  public void testUnsupportedDType() {
    try {
      codec.decode(obj("{\"dtype\": \"int8\", \"array\": [1, 2]}"));
      fail();
    } catch (UnsupportedDTypeException e) {
      assertEquals("int8", e.dtype());
    }
    try {
      codec.decode(obj("{\"dtype\": 3, \"array\": [1, 2]}"));
      fail();
    } catch (UnsupportedDTypeException e) {
      // Expected
    }
  }

  @Test
  public void testMalformedArrays() {
    String[] bad = {
        "{\"dtype\": \"float64\", \"array\": [[1, 2], [3]]}",
        "{\"dtype\": \"float64\", \"array\": [[1, 2], 3]}",
        "{\"dtype\": \"float64\", \"array\": [\"a\"]}",
        "{\"dtype\": \"complex128\", \"array\": [1, 2, 3]}",
    };
    for (String json : bad) {
      try {
        codec.decode(obj(json));
        fail(json);
      } catch (ValueEncodingException e) {
        // Expected
      }
    }
  }

  /**
   * The decoder cannot tell an encoded complex number from an ordinary
   * object that happens to have numeric "real" and "imag" members.
   */
  @Test
  public void testAmbiguousComplex() {
    assertEquals(new ComplexValue(1, 2), codec.decode(obj("{\"real\": 1, \"imag\": 2}")));

    // Anything else passes through

    ObjectValue text = obj("{\"real\": 1, \"imag\": \"2\"}");
    assertSame(text, codec.decode(text));
    ObjectValue extra = obj("{\"real\": 1, \"imag\": 2, \"unit\": \"m\"}");
    assertSame(extra, codec.decode(extra));
    ObjectValue partial = obj("{\"real\": 1, \"other\": 2}");
    assertSame(partial, codec.decode(partial));
  }
}
