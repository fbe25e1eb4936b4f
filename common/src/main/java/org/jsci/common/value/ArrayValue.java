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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered sequence of values.
 */
public final class ArrayValue extends ContainerValue {

  private final List<JsonValue> elements = new ArrayList<>();

  public ArrayValue() { }

  public static ArrayValue of(JsonValue... values) {
    ArrayValue array = new ArrayValue();
    for (JsonValue value : values) {
      array.add(value);
    }
    return array;
  }

  /**
   * Build an array of numbers. Named apart from {@link #of(JsonValue...)}
   * so that a single argument never resolves to {@link JsonValue#of(double)}.
   */
  public static ArrayValue ofDoubles(double... values) {
    ArrayValue array = new ArrayValue();
    for (double value : values) {
      array.add(new NumberValue(value));
    }
    return array;
  }

  @Override
  public Kind kind() { return Kind.ARRAY; }

  @Override
  public ArrayValue asArray() { return this; }

  public ArrayValue add(JsonValue value) {
    elements.add(adopt(value));
    return this;
  }

  public JsonValue get(int index) { return elements.get(index); }

  @Override
  public int size() { return elements.size(); }

  /**
   * @return an unmodifiable view of the elements
   */
  public List<JsonValue> elements() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public <R> R accept(JsonValueVisitor<R> visitor) {
    return visitor.visitArray(this);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ArrayValue && ((ArrayValue) o).elements.equals(elements);
  }

  @Override
  public int hashCode() { return elements.hashCode(); }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder().append("[");
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(elements.get(i));
    }
    return buf.append("]").toString();
  }
}
