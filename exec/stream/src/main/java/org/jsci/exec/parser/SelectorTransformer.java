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
package org.jsci.exec.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.jsci.common.value.JsonValue;
import org.jsci.exec.codec.ValueDecoder;

/**
 * Pushdown automaton on top of the bottom-up reduction that tracks the
 * path to the value being reduced, and lets {@link #transform} replace
 * each value. Children are transformed before their parents; the root is
 * transformed last, with the empty path.
 * <p>
 * The path stack holds a key for each enclosing pair and a position for
 * each enclosing array:
 * <ul>
 * <li>array start pushes position 0, each completed element increments
 * it, array end pops it;</li>
 * <li>a key pushes the key, the completed pair pops it.</li>
 * </ul>
 * An exception thrown by {@code transform} ends the parse and propagates
 * unchanged.
 */
public abstract class SelectorTransformer extends DefaultTransformer implements ValueTransform {

  private final List<Object> stack = new ArrayList<>();

  public SelectorTransformer() { }

  public SelectorTransformer(JsonOptions options, ValueDecoder decoder) {
    super(options, decoder);
  }

  @Override
  public void onStartDocument() {
    stack.clear();
  }

  @Override
  public void onStartArray() {
    stack.add(0);
  }

  @Override
  public JsonValue onElement(JsonValue value) {
    int top = stack.size() - 1;
    stack.set(top, (Integer) stack.get(top) + 1);
    return value;
  }

  @Override
  public void onEndArray() {
    pop();
  }

  @Override
  public String onKey(String key) {
    stack.add(key);
    return key;
  }

  @Override
  public Map.Entry<String, JsonValue> onPair(String key, JsonValue value) {
    pop();
    return super.onPair(key, value);
  }

  @Override
  public JsonValue onValue(JsonValue value) {
    JsonValue result = transform(JsonPath.of(stack), value);
    return result == null ? JsonValue.nullValue() : result;
  }

  private void pop() {
    stack.remove(stack.size() - 1);
  }
}
