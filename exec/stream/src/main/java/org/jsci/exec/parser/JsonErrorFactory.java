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

import org.jsci.common.exceptions.JsonStructureException;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonToken;

/**
 * Default error factory: every problem becomes a
 * {@link JsonStructureException}.
 */
public class JsonErrorFactory implements ErrorFactory {

  public static final JsonErrorFactory INSTANCE = new JsonErrorFactory();

  @Override
  public RuntimeException parseError(String msg, JsonParseException e) {
    return new JsonStructureException(msg + ": " + e.getOriginalMessage(), e);
  }

  @Override
  public RuntimeException ioException(IOException e) {
    return ioException("I/O error reading JSON", e);
  }

  @Override
  public RuntimeException ioException(String msg, IOException e) {
    return new JsonStructureException(msg, e);
  }

  @Override
  public RuntimeException syntaxError(JsonParseException e) {
    return new JsonStructureException("Syntax error in JSON input: " + e.getMessage(), e);
  }

  @Override
  public RuntimeException syntaxError(JsonToken token) {
    return new JsonStructureException("Syntax error in JSON input, unexpected token " + token);
  }

  @Override
  public RuntimeException structureError(String msg) {
    return new JsonStructureException(msg);
  }
}
