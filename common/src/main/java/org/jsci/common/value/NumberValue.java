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
 * A JSON number. All numbers are carried as 64-bit floats, the way the
 * reducer produces them; integral values are not distinguished.
 */
public final class NumberValue extends JsonValue {

  private final double value;

  public NumberValue(double value) {
    this.value = value;
  }

  @Override
  public Kind kind() { return Kind.NUMBER; }

  @Override
  public double asDouble() { return value; }

  @Override
  public <R> R accept(JsonValueVisitor<R> visitor) {
    return visitor.visitNumber(this);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof NumberValue &&
        Double.compare(((NumberValue) o).value, value) == 0;
  }

  @Override
  public int hashCode() { return Double.hashCode(value); }

  @Override
  public String toString() { return Double.toString(value); }
}
