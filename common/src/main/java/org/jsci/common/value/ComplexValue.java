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

/**
 * A complex number with 64-bit float components. Has no JSON form of its
 * own: write it through a codec.
 */
public final class ComplexValue extends JsonValue {

  private final double real;
  private final double imag;

  public ComplexValue(double real, double imag) {
    this.real = real;
    this.imag = imag;
  }

  @Override
  public Kind kind() { return Kind.COMPLEX; }

  public double real() { return real; }

  public double imag() { return imag; }

  @Override
  public ComplexValue asComplex() { return this; }

  @Override
  public <R> R accept(JsonValueVisitor<R> visitor) {
    return visitor.visitComplex(this);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ComplexValue)) {
      return false;
    }
    ComplexValue other = (ComplexValue) o;
    return Double.compare(other.real, real) == 0 &&
        Double.compare(other.imag, imag) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(real) + Double.hashCode(imag);
  }

  @Override
  public String toString() {
    return "(" + real + (Math.copySign(1.0, imag) < 0 ? "" : "+") + imag + "j)";
  }
}
