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

import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import java.util.Map;

import org.jsci.common.value.ArrayValue;
import org.jsci.common.value.JsonValue;
import org.jsci.common.value.ObjectValue;
import org.jsci.exec.codec.ValueDecoder;

import com.google.common.collect.Maps;

/**
 * Reduces a document to the canonical value model. All numbers become
 * float64 values. A repeated key keeps its first position and its last
 * value.
 * <p>
 * If a decoder is given, every object is passed through it once its
 * members are reduced, which is how extension values are recovered from
 * their encoded form.
 */
public class DefaultTransformer implements JsonReducer {

  private final JsonOptions options;
  private final ValueDecoder decoder;

  public DefaultTransformer() {
    this(new JsonOptions(), null);
  }

  public DefaultTransformer(ValueDecoder decoder) {
    this(new JsonOptions(), decoder);
  }

  public DefaultTransformer(JsonOptions options, ValueDecoder decoder) {
    this.options = options;
    this.decoder = decoder;
  }

  public JsonOptions options() { return options; }

  public JsonValue parse(String json) {
    return parse(new StringReader(json));
  }

  public JsonValue parse(Reader reader) {
    return parse(new JsonStructureParser(reader, options));
  }

  public JsonValue parse(InputStream stream) {
    return parse(new JsonStructureParser(stream, options));
  }

  private JsonValue parse(JsonStructureParser parser) {
    try {
      return parser.parse(this);
    } finally {
      parser.close();
    }
  }

  @Override
  public JsonValue onString(String value) { return JsonValue.of(value); }

  @Override
  public JsonValue onNumber(double value) { return JsonValue.of(value); }

  @Override
  public JsonValue onBoolean(boolean value) { return JsonValue.of(value); }

  @Override
  public JsonValue onNull() { return JsonValue.nullValue(); }

  @Override
  public void onStartArray() { }

  @Override
  public JsonValue onElement(JsonValue value) { return value; }

  @Override
  public void onEndArray() { }

  @Override
  public JsonValue onArray(List<JsonValue> elements) {
    ArrayValue array = new ArrayValue();
    for (JsonValue element : elements) {
      array.add(element);
    }
    return array;
  }

  @Override
  public String onKey(String key) { return key; }

  @Override
  public Map.Entry<String, JsonValue> onPair(String key, JsonValue value) {
    return Maps.immutableEntry(key, value);
  }

  @Override
  public JsonValue onObject(List<Map.Entry<String, JsonValue>> pairs) {
    ObjectValue obj = new ObjectValue();
    for (Map.Entry<String, JsonValue> pair : pairs) {
      obj.put(pair.getKey(), pair.getValue());
    }
    return decoder == null ? obj : decoder.decode(obj);
  }

  @Override
  public JsonValue onValue(JsonValue value) { return value; }
}
