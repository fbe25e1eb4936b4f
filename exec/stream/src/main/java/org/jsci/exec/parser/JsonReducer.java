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

import java.util.List;
import java.util.Map;

import org.jsci.common.value.JsonValue;

/**
 * Receives the reductions of a JSON document bottom-up and left to right,
 * as a parser for the grammar
 * <pre>
 * value   : object | array | string | number | true | false | null
 * array   : start-array [element ("," element)*] end-array
 * object  : "{" [pair ("," pair)*] "}"
 * pair    : key ":" value
 * element : value</pre>
 * would complete the rules. Every rule has one event; each event returns
 * the value that replaces the rule in its parent. In particular
 * {@link #onValue} sees every value of the document, children before
 * their parents, and may substitute it.
 */
public interface JsonReducer {

  /**
   * Called once before the first token of a document.
   */
  default void onStartDocument() { }

  JsonValue onString(String value);

  JsonValue onNumber(double value);

  JsonValue onBoolean(boolean value);

  JsonValue onNull();

  /**
   * The opening bracket of an array, before any of its elements.
   */
  void onStartArray();

  /**
   * An array element, after its value has been reduced.
   */
  JsonValue onElement(JsonValue value);

  /**
   * The closing bracket of an array, before {@link #onArray}.
   */
  void onEndArray();

  JsonValue onArray(List<JsonValue> elements);

  /**
   * A member key, before the member value.
   */
  String onKey(String key);

  Map.Entry<String, JsonValue> onPair(String key, JsonValue value);

  JsonValue onObject(List<Map.Entry<String, JsonValue>> pairs);

  /**
   * Any value, after the rule that produced it.
   */
  JsonValue onValue(JsonValue value);
}
