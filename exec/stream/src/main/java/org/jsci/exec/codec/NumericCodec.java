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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.jsci.common.exceptions.UnsupportedDTypeException;
import org.jsci.common.exceptions.ValueEncodingException;
import org.jsci.common.value.ArrayValue;
import org.jsci.common.value.ComplexValue;
import org.jsci.common.value.DType;
import org.jsci.common.value.JsonValue;
import org.jsci.common.value.JsonValue.Kind;
import org.jsci.common.value.JsonValues;
import org.jsci.common.value.NdArrayValue;
import org.jsci.common.value.NumberValue;
import org.jsci.common.value.ObjectValue;

import com.google.common.primitives.Doubles;

/**
 * Maps the numeric extension values to and from plain JSON objects.
 * <ul>
 * <li>A complex number is written as <code>{"real": re, "imag": im}</code>.</li>
 * <li>A numeric array is written as
 * <code>{"dtype": tag, "array": nested-lists}</code>, where the nested
 * lists follow the shape in row-major order. A complex array is written
 * as its interleaved real and imaginary components, so the last axis of
 * the nested lists is twice as long as the last axis of the array; the
 * {@code complex128} tag tells the decoder to pair them up again.</li>
 * </ul>
 *
 * <h4>Known limitation</h4>
 *
 * On the wire an encoded complex number is an ordinary object. Any object
 * with exactly the two members {@code real} and {@code imag}, both numbers,
 * decodes as a complex number, whether or not it was produced by this
 * codec. Likewise for objects with exactly {@code dtype} and {@code array}.
 * Only use the decoder on documents whose producer used the encoder.
 * <p>
 * Encoding a container returns a copy with every extension value encoded,
 * or the container itself if it holds none. Other values are returned
 * unchanged.
 * <p>
 * Stateless and thread-safe.
 */
public class NumericCodec implements ValueEncoder, ValueDecoder {

  public static final String REAL_KEY = "real";
  public static final String IMAG_KEY = "imag";
  public static final String DTYPE_KEY = "dtype";
  public static final String ARRAY_KEY = "array";

  public static final NumericCodec INSTANCE = new NumericCodec();

  @Override
  public JsonValue encode(JsonValue value) {
    switch (value.kind()) {
      case COMPLEX:
        return encodeComplex(value.asComplex());
      case NDARRAY:
        return encodeArray(value.asNdArray());
      case ARRAY:
      case OBJECT:
        return containsExtension(value) ? encodeCopy(value) : value;
      default:
        return value;
    }
  }

  private boolean containsExtension(JsonValue value) {
    for (JsonValue node : JsonValues.depthFirst(value)) {
      if (node.isExtension()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Copy a container tree, encoding the extension leaves. The original is
   * left untouched; its containers keep their owners.
   */
  private JsonValue encodeCopy(JsonValue value) {
    switch (value.kind()) {
      case ARRAY:
        ArrayValue array = new ArrayValue();
        for (JsonValue element : value.asArray().elements()) {
          array.add(encodeCopy(element));
        }
        return array;
      case OBJECT:
        ObjectValue source = value.asObject();
        ObjectValue obj = new ObjectValue();
        for (int i = 0; i < source.size(); i++) {
          obj.add(source.key(i), encodeCopy(source.value(i)));
        }
        return obj;
      default:
        return encode(value);
    }
  }

  public ObjectValue encodeComplex(ComplexValue value) {
    return new ObjectValue()
        .put(REAL_KEY, value.real())
        .put(IMAG_KEY, value.imag());
  }

  public ObjectValue encodeArray(NdArrayValue value) {
    int[] wireShape = value.shape();
    if (value.dtype() == DType.COMPLEX128) {
      if (wireShape.length == 0) {
        throw new ValueEncodingException(
            "A zero-dimensional complex array has no interleaved form");
      }
      wireShape[wireShape.length - 1] *= 2;
    }
    return new ObjectValue()
        .put(DTYPE_KEY, value.dtype().tag())
        .put(ARRAY_KEY, nest(value.data(), wireShape, 0, 0));
  }

  private JsonValue nest(double[] data, int[] shape, int axis, int offset) {
    if (axis == shape.length) {
      return new NumberValue(data[offset]);
    }
    int stride = 1;
    for (int i = axis + 1; i < shape.length; i++) {
      stride *= shape[i];
    }
    ArrayValue array = new ArrayValue();
    for (int i = 0; i < shape[axis]; i++) {
      array.add(nest(data, shape, axis + 1, offset + i * stride));
    }
    return array;
  }

  @Override
  public JsonValue decode(ObjectValue value) {
    if (value.size() != 2) {
      return value;
    }
    if (value.containsKey(REAL_KEY) && value.containsKey(IMAG_KEY)) {
      JsonValue real = value.get(REAL_KEY);
      JsonValue imag = value.get(IMAG_KEY);
      if (real.kind() == Kind.NUMBER && imag.kind() == Kind.NUMBER) {
        return new ComplexValue(real.asDouble(), imag.asDouble());
      }
      return value;
    }
    if (value.containsKey(DTYPE_KEY) && value.containsKey(ARRAY_KEY)) {
      return decodeArray(value.get(DTYPE_KEY), value.get(ARRAY_KEY));
    }
    return value;
  }

  private NdArrayValue decodeArray(JsonValue tag, JsonValue array) {
    if (tag.kind() != Kind.STRING) {
      throw new UnsupportedDTypeException(tag.toString());
    }
    DType dtype = DType.forTag(tag.asString());
    List<Integer> dims = new ArrayList<>();
    for (JsonValue probe = array; probe.kind() == Kind.ARRAY; ) {
      ArrayValue level = probe.asArray();
      dims.add(level.size());
      if (level.isEmpty()) {
        break;
      }
      probe = level.get(0);
    }
    int[] shape = dims.stream().mapToInt(Integer::intValue).toArray();
    List<Double> data = new ArrayList<>();
    flatten(array, shape, 0, data);
    if (dtype == DType.COMPLEX128) {
      if (shape.length == 0 || shape[shape.length - 1] % 2 != 0) {
        throw new ValueEncodingException(
            "Complex array data must have an even-length last axis, got shape " +
            Arrays.toString(shape));
      }
      shape[shape.length - 1] /= 2;
    }
    return new NdArrayValue(dtype, shape, Doubles.toArray(data));
  }

  private void flatten(JsonValue value, int[] shape, int axis, List<Double> out) {
    if (axis == shape.length) {
      if (value.kind() != Kind.NUMBER) {
        throw new ValueEncodingException("Array data must be numeric, found " + value.kind());
      }
      out.add(value.asDouble());
      return;
    }
    if (value.kind() != Kind.ARRAY || value.asArray().size() != shape[axis]) {
      throw new ValueEncodingException(
          "Ragged array data: expected " + shape[axis] + " elements on axis " + axis);
    }
    for (JsonValue element : value.asArray().elements()) {
      flatten(element, shape, axis + 1, out);
    }
  }
}
