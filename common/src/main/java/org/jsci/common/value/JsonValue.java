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
 * A node in a JSON-like document tree. The set of value kinds is closed:
 * the six JSON kinds plus two numeric extension leaves (complex numbers
 * and multi-dimensional numeric arrays) which have no native JSON form
 * and must pass through a codec on the wire.
 * <p>
 * Trees only: a container exclusively owns its children. Attempting to add
 * a container that already has a parent, or that would create a cycle, is
 * rejected. Leaves are immutable and may be shared freely.
 * <p>
 * Equality is deep and structural; object member order is significant.
 */
public abstract class JsonValue {

  public enum Kind {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT,
    COMPLEX,
    NDARRAY;

    public boolean isContainer() {
      return this == ARRAY || this == OBJECT;
    }

    /**
     * @return true if values of this kind have no native JSON form
     * and need a codec to be written
     */
    public boolean isExtension() {
      return this == COMPLEX || this == NDARRAY;
    }
  }

  JsonValue() { }

  public abstract Kind kind();

  public abstract <R> R accept(JsonValueVisitor<R> visitor);

  public boolean isNull() { return kind() == Kind.NULL; }

  public boolean isContainer() { return kind().isContainer(); }

  public boolean isExtension() { return kind().isExtension(); }

  public boolean asBoolean() {
    throw notA(Kind.BOOLEAN);
  }

  public double asDouble() {
    throw notA(Kind.NUMBER);
  }

  public String asString() {
    throw notA(Kind.STRING);
  }

  public ArrayValue asArray() {
    throw notA(Kind.ARRAY);
  }

  public ObjectValue asObject() {
    throw notA(Kind.OBJECT);
  }

  public ComplexValue asComplex() {
    throw notA(Kind.COMPLEX);
  }

  public NdArrayValue asNdArray() {
    throw notA(Kind.NDARRAY);
  }

  private IllegalStateException notA(Kind expected) {
    return new IllegalStateException(
        String.format("Expected a %s value, but found %s", expected, kind()));
  }

  public static StringValue of(String value) {
    return new StringValue(value);
  }

  public static NumberValue of(double value) {
    return new NumberValue(value);
  }

  public static BooleanValue of(boolean value) {
    return BooleanValue.of(value);
  }

  public static NullValue nullValue() {
    return NullValue.INSTANCE;
  }
}
