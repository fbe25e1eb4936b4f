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
package org.jsci.common.value;

import java.util.Arrays;

import org.jsci.common.exceptions.ValueEncodingException;

import com.google.common.base.Preconditions;

/**
 * A dense, row-major, multi-dimensional numeric array. Data is kept as a
 * flat array of 64-bit floats; for {@link DType#COMPLEX128} the real and
 * imaginary components are interleaved, so the flat array is twice the
 * element count.
 * <p>
 * Immutable: the constructor and accessors copy their arrays.
 */
public final class NdArrayValue extends JsonValue {

  private final DType dtype;
  private final int[] shape;
  private final double[] data;

  public NdArrayValue(DType dtype, int[] shape, double[] data) {
    this.dtype = Preconditions.checkNotNull(dtype);
    this.shape = shape.clone();
    this.data = data.clone();
    long count = 1;
    for (int dim : shape) {
      if (dim < 0) {
        throw new ValueEncodingException("Negative dimension in shape " + Arrays.toString(shape));
      }
      count *= dim;
    }
    if (count * dtype.width() != data.length) {
      throw new ValueEncodingException(String.format(
          "Shape %s of %s needs %d components, but %d were given",
          Arrays.toString(shape), dtype.tag(), count * dtype.width(), data.length));
    }
  }

  public static NdArrayValue ofReal(int[] shape, double... data) {
    return new NdArrayValue(DType.FLOAT64, shape, data);
  }

  /**
   * @param interleaved real and imaginary components, alternating
   */
  public static NdArrayValue ofComplex(int[] shape, double... interleaved) {
    return new NdArrayValue(DType.COMPLEX128, shape, interleaved);
  }

  @Override
  public Kind kind() { return Kind.NDARRAY; }

  public DType dtype() { return dtype; }

  public int[] shape() { return shape.clone(); }

  public int rank() { return shape.length; }

  public int dim(int axis) { return shape[axis]; }

  /**
   * @return number of elements (not components)
   */
  public int size() { return data.length / dtype.width(); }

  /**
   * @return a copy of the flat component data
   */
  public double[] data() { return data.clone(); }

  public double component(int index) { return data[index]; }

  /**
   * @return the element at the given flat (row-major) index of a real array
   */
  public double real(int index) {
    Preconditions.checkState(dtype == DType.FLOAT64, "Not a real array");
    return data[index];
  }

  /**
   * @return the element at the given flat (row-major) index of a complex array
   */
  public ComplexValue complex(int index) {
    Preconditions.checkState(dtype == DType.COMPLEX128, "Not a complex array");
    return new ComplexValue(data[2 * index], data[2 * index + 1]);
  }

  @Override
  public NdArrayValue asNdArray() { return this; }

  @Override
  public <R> R accept(JsonValueVisitor<R> visitor) {
    return visitor.visitNdArray(this);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof NdArrayValue)) {
      return false;
    }
    NdArrayValue other = (NdArrayValue) o;
    return other.dtype == dtype &&
        Arrays.equals(other.shape, shape) &&
        Arrays.equals(other.data, data);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * dtype.hashCode() + Arrays.hashCode(shape)) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "ndarray(" + dtype.tag() + ", " + Arrays.toString(shape) + ")";
  }
}
