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
package org.jsci.exec.stream;

import static org.junit.Assert.assertEquals;

import java.util.Random;

import org.jsci.categories.CodecTest;
import org.jsci.categories.WriterTest;
import org.jsci.common.value.ArrayValue;
import org.jsci.common.value.ComplexValue;
import org.jsci.common.value.JsonValue;
import org.jsci.common.value.NdArrayValue;
import org.jsci.common.value.ObjectValue;
import org.jsci.exec.codec.NumericCodec;
import org.jsci.exec.parser.DefaultTransformer;
import org.jsci.test.BaseTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

/**
 * Values written as text with the numeric codec and read back with it
 * come back equal, member order included.
 */
@Category({WriterTest.class, CodecTest.class})
public class TestRoundTrip extends BaseTest {

  private final DefaultTransformer reader = new DefaultTransformer(NumericCodec.INSTANCE);

  /**
   * Write the value event by event, descending into containers, so that
   * the stream rather than the leaf formatter produces the structure.
   */
  private static void writeEvents(WriteStream stream, JsonValue value) {
    switch (value.kind()) {
      case ARRAY:
        try (Scope scope = stream.wrapArray()) {
          for (JsonValue element : value.asArray().elements()) {
            writeEvents(stream, element);
          }
        }
        break;
      case OBJECT:
        try (Scope scope = stream.wrapObject()) {
          ObjectValue obj = value.asObject();
          for (int i = 0; i < obj.size(); i++) {
            stream.writeKey(obj.key(i));
            writeEvents(stream, obj.value(i));
          }
        }
        break;
      default:
        stream.writeValue(value, NumericCodec.INSTANCE);
    }
  }

  private void verify(JsonValue value, int indent) {
    String asLeaf = WriteStreams.toText(value, NumericCodec.INSTANCE, indent);
    assertEquals(asLeaf, value, reader.parse(asLeaf));

    String asEvents = textOf(indent, s -> writeEvents(s, value));
    assertEquals(asEvents, value, reader.parse(asEvents));
  }

  @Test
  public void testSample() {
    JsonValue doc = new ObjectValue()
        .put("title", "run 7")
        .put("z", new ComplexValue(3, 4))
        .put("samples", NdArrayValue.ofComplex(new int[] {1, 2}, 0.5, -1.5, 2.25, 1e-9))
        .put("grid", NdArrayValue.ofReal(new int[] {2, 2}, 1, 2, 3, 4))
        .put("tags", ArrayValue.of(JsonValue.of("a"), JsonValue.nullValue(), JsonValue.of(false)))
        .put("nested", new ObjectValue()
            .put("empty", new ObjectValue())
            .put("list", new ArrayValue())
            .put("b", 2));
    for (int indent : new int[] {0, 1, 2, 4}) {
      verify(doc, indent);
    }
  }

  @Test
  public void testRandomTrees() {
    Random random = new Random(20240611L);
    for (int i = 0; i < 50; i++) {
      verify(randomValue(random, 0), i % 3 * 2);
    }
  }

  private static JsonValue randomValue(Random random, int depth) {
    int choice = random.nextInt(depth > 3 ? 6 : 8);
    switch (choice) {
      case 0:
        return JsonValue.nullValue();
      case 1:
        return JsonValue.of(random.nextBoolean());
      case 2:
        return JsonValue.of(random.nextGaussian() * 1000);
      case 3:
        return JsonValue.of("s" + random.nextInt(100) + (random.nextBoolean() ? "\"\n\t" : ""));
      case 4:
        return new ComplexValue(random.nextDouble(), -random.nextDouble());
      case 5:
        int rows = random.nextInt(3) + 1;
        double[] data = new double[rows * 2];
        for (int j = 0; j < data.length; j++) {
          data[j] = random.nextDouble();
        }
        return random.nextBoolean()
            ? NdArrayValue.ofReal(new int[] {rows, 2}, data)
            : NdArrayValue.ofComplex(new int[] {rows}, data);
      case 6:
        ArrayValue array = new ArrayValue();
        for (int j = random.nextInt(4); j > 0; j--) {
          array.add(randomValue(random, depth + 1));
        }
        return array;
      default:
        ObjectValue obj = new ObjectValue();
        for (int j = random.nextInt(4); j > 0; j--) {
          obj.put("k" + random.nextInt(10), randomValue(random, depth + 1));
        }
        return obj;
    }
  }
}
