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

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

/**
 * Wraps the Jackson parser with one token of push-back, and converts
 * Jackson's checked exceptions through the error factory.
 */
public class TokenIterator {

  private final JsonParser parser;
  private final ErrorFactory errorFactory;
  private JsonToken pushedBack;

  public TokenIterator(JsonParser parser, ErrorFactory errorFactory) {
    this.parser = parser;
    this.errorFactory = errorFactory;
  }

  /**
   * @return the next token, or {@code null} at the end of the input
   */
  public JsonToken next() {
    if (pushedBack != null) {
      JsonToken token = pushedBack;
      pushedBack = null;
      return token;
    }
    try {
      return parser.nextToken();
    } catch (JsonParseException e) {
      throw errorFactory.syntaxError(e);
    } catch (IOException e) {
      throw errorFactory.ioException(e);
    }
  }

  public JsonToken requireNext() {
    JsonToken token = next();
    if (token == null) {
      throw errorFactory.structureError("Premature EOF of JSON input. " + context());
    }
    return token;
  }

  public void unget(JsonToken token) {
    if (pushedBack != null) {
      throw new IllegalStateException("Only one token can be pushed back");
    }
    pushedBack = token;
  }

  public String textValue() {
    try {
      return parser.getText();
    } catch (JsonParseException e) {
      throw errorFactory.syntaxError(e);
    } catch (IOException e) {
      throw errorFactory.ioException(e);
    }
  }

  public double doubleValue() {
    try {
      return parser.getDoubleValue();
    } catch (JsonParseException e) {
      throw errorFactory.syntaxError(e);
    } catch (IOException e) {
      throw errorFactory.ioException(e);
    }
  }

  public String context() {
    JsonLocation location = parser.getCurrentLocation();
    if (location == null) {
      return "Location unknown";
    }
    return new StringBuilder()
        .append("Line ")
        .append(location.getLineNr())
        .append(", column ")
        .append(location.getColumnNr())
        .toString();
  }
}
