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

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonToken;

/**
 * Creates the exceptions thrown for problems in the JSON input. Lets
 * tests, or an embedding application, substitute their own error types.
 */
public interface ErrorFactory {

  RuntimeException parseError(String msg, JsonParseException e);

  RuntimeException ioException(IOException e);

  RuntimeException ioException(String msg, IOException e);

  RuntimeException syntaxError(JsonParseException e);

  RuntimeException syntaxError(JsonToken token);

  RuntimeException structureError(String msg);
}
