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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * An ordered sequence of key/value members. Member order is insertion
 * order and is significant for equality and for output.
 * <p>
 * Keys need not be unique. {@link #add} appends unconditionally, while
 * {@link #put} implements "last write wins": it replaces the value of an
 * existing member in place and appends otherwise.
 */
public final class ObjectValue extends ContainerValue {

  private final List<String> keys = new ArrayList<>();
  private final List<JsonValue> values = new ArrayList<>();
  // Index of the last member for each key
  private final Map<String, Integer> lastIndex = new HashMap<>();

  public ObjectValue() { }

  @Override
  public Kind kind() { return Kind.OBJECT; }

  @Override
  public ObjectValue asObject() { return this; }

  /**
   * Append a member, even if the key is already present.
   */
  public ObjectValue add(String key, JsonValue value) {
    Preconditions.checkNotNull(key);
    values.add(adopt(value));
    lastIndex.put(key, keys.size());
    keys.add(key);
    return this;
  }

  /**
   * Set a member, replacing the value of the last member with the same key
   * while keeping its position.
   */
  public ObjectValue put(String key, JsonValue value) {
    int index = indexOf(key);
    if (index == -1) {
      return add(key, value);
    }
    JsonValue replacement = adopt(value);
    release(values.set(index, replacement));
    return this;
  }

  public ObjectValue put(String key, String value) {
    return put(key, JsonValue.of(value));
  }

  public ObjectValue put(String key, double value) {
    return put(key, JsonValue.of(value));
  }

  public ObjectValue put(String key, boolean value) {
    return put(key, JsonValue.of(value));
  }

  private int indexOf(String key) {
    Integer index = lastIndex.get(key);
    return index == null ? -1 : index;
  }

  public boolean containsKey(String key) {
    return indexOf(key) != -1;
  }

  /**
   * @return the value of the last member with the given key, or
   * {@code null} if there is no such member
   */
  public JsonValue get(String key) {
    int index = indexOf(key);
    return index == -1 ? null : values.get(index);
  }

  public String key(int index) { return keys.get(index); }

  public JsonValue value(int index) { return values.get(index); }

  @Override
  public int size() { return keys.size(); }

  public List<String> keys() {
    return Collections.unmodifiableList(keys);
  }

  public List<Map.Entry<String, JsonValue>> entries() {
    ImmutableList.Builder<Map.Entry<String, JsonValue>> builder = ImmutableList.builder();
    for (int i = 0; i < keys.size(); i++) {
      builder.add(Maps.immutableEntry(keys.get(i), values.get(i)));
    }
    return builder.build();
  }

  @Override
  public <R> R accept(JsonValueVisitor<R> visitor) {
    return visitor.visitObject(this);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ObjectValue)) {
      return false;
    }
    ObjectValue other = (ObjectValue) o;
    return other.keys.equals(keys) && other.values.equals(values);
  }

  @Override
  public int hashCode() {
    return 31 * keys.hashCode() + values.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder().append("{");
    for (int i = 0; i < keys.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(JsonValues.quote(keys.get(i)))
         .append(": ")
         .append(values.get(i));
    }
    return buf.append("}").toString();
  }
}
