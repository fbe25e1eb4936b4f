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

import com.google.common.base.Preconditions;

public final class StringValue extends JsonValue {

  private final String value;

  public StringValue(String value) {
    this.value = Preconditions.checkNotNull(value);
  }

  @Override
  public Kind kind() { return Kind.STRING; }

  @Override
  public String asString() { return value; }

  @Override
  public <R> R accept(JsonValueVisitor<R> visitor) {
    return visitor.visitString(this);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof StringValue && ((StringValue) o).value.equals(value);
  }

  @Override
  public int hashCode() { return value.hashCode(); }

  @Override
  public String toString() { return JsonValues.quote(value); }
}
