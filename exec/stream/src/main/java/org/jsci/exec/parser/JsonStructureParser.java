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

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.jsci.common.value.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;

/**
 * Parses one JSON document with the Jackson streaming parser and delivers
 * it to a {@link JsonReducer} as a sequence of bottom-up reductions.
 * <p>
 * The input must hold exactly one value; anything after it other than
 * whitespace is a syntax error. Exceptions thrown by the reducer pass
 * through unchanged.
 */
public class JsonStructureParser {
  protected static final Logger logger = LoggerFactory.getLogger(JsonStructureParser.class);

  private final JsonParser parser;
  private final JsonOptions options;
  private final TokenIterator tokenizer;

  public JsonStructureParser(Reader reader, JsonOptions options) {
    this.options = checkOptions(options);
    try {
      parser = parserFactory(options).createParser(reader);
    } catch (JsonParseException e) {
      throw errorFactory().parseError("Failed to create the JSON parser", e);
    } catch (IOException e) {
      throw errorFactory().ioException("Failed to open the JSON parser", e);
    }
    tokenizer = new TokenIterator(parser, errorFactory());
  }

  public JsonStructureParser(InputStream stream, JsonOptions options) {
    this.options = checkOptions(options);
    try {
      parser = parserFactory(options).createParser(stream);
    } catch (JsonParseException e) {
      throw errorFactory().parseError("Failed to create the JSON parser", e);
    } catch (IOException e) {
      throw errorFactory().ioException("Failed to open the JSON parser", e);
    }
    tokenizer = new TokenIterator(parser, errorFactory());
  }

  private static JsonOptions checkOptions(JsonOptions options) {
    Preconditions.checkNotNull(options);
    Preconditions.checkNotNull(options.errorFactory);
    return options;
  }

  private static JsonFactory parserFactory(JsonOptions options) {
    ObjectMapper mapper = new ObjectMapper()
        .configure(JsonParser.Feature.ALLOW_COMMENTS, options.allowComments)
        .configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, options.allowNanInf);
    return mapper.getFactory();
  }

  public ErrorFactory errorFactory() { return options.errorFactory; }

  public JsonOptions options() { return options; }

  /**
   * Parse the document, reducing it with the given reducer.
   *
   * @return the value the reducer produced for the root
   */
  public JsonValue parse(JsonReducer reducer) {
    reducer.onStartDocument();
    JsonToken token = tokenizer.next();
    if (token == null) {
      throw errorFactory().structureError("JSON input is empty");
    }
    tokenizer.unget(token);
    JsonValue root = parseValue(reducer);
    token = tokenizer.next();
    if (token != null) {
      logger.debug("Trailing token {} after the JSON document. {}", token, tokenizer.context());
      throw errorFactory().syntaxError(token);
    }
    return root;
  }

  private JsonValue parseValue(JsonReducer reducer) {
    JsonToken token = tokenizer.requireNext();
    JsonValue value;
    switch (token) {
      case START_ARRAY:
        value = parseArray(reducer);
        break;
      case START_OBJECT:
        value = parseObject(reducer);
        break;
      case VALUE_STRING:
        value = reducer.onString(tokenizer.textValue());
        break;
      case VALUE_NUMBER_INT:
      case VALUE_NUMBER_FLOAT:
        value = reducer.onNumber(tokenizer.doubleValue());
        break;
      case VALUE_TRUE:
        value = reducer.onBoolean(true);
        break;
      case VALUE_FALSE:
        value = reducer.onBoolean(false);
        break;
      case VALUE_NULL:
        value = reducer.onNull();
        break;
      default:
        throw errorFactory().syntaxError(token);
    }
    return reducer.onValue(value);
  }

  private JsonValue parseArray(JsonReducer reducer) {

    // Position: [ ^ value, value ... ]

    reducer.onStartArray();
    List<JsonValue> elements = new ArrayList<>();
    for (;;) {
      JsonToken token = tokenizer.requireNext();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      tokenizer.unget(token);
      elements.add(reducer.onElement(parseValue(reducer)));
    }

    // Position: [ ... ] ^

    reducer.onEndArray();
    return reducer.onArray(elements);
  }

  private JsonValue parseObject(JsonReducer reducer) {

    // Position: { ^ key: value, ... }

    List<Map.Entry<String, JsonValue>> pairs = new ArrayList<>();
    for (;;) {
      JsonToken token = tokenizer.requireNext();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw errorFactory().syntaxError(token);
      }
      String key = reducer.onKey(tokenizer.textValue());

      // Position: { ... key: ^ value ... }

      JsonValue value = parseValue(reducer);
      pairs.add(reducer.onPair(key, value));
    }
    return reducer.onObject(pairs);
  }

  public void close() {
    try {
      parser.close();
    } catch (IOException e) {
      logger.warn("Ignored failure when closing JSON source", e);
    }
  }
}
