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

import org.jsci.common.value.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each value with its path, as {@code .a.1.b = value}, and leaves
 * the document unchanged. A debugging aid.
 */
public class LoggingTransformer extends SelectorTransformer {
  private static final Logger logger = LoggerFactory.getLogger(LoggingTransformer.class);

  @Override
  public JsonValue transform(JsonPath path, JsonValue value) {
    logger.info("{} = {}", path, value);
    return value;
  }
}
