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
package org.jsci.exec.stream;

import org.jsci.common.value.JsonValue;
import org.jsci.exec.codec.ValueEncoder;

/**
 * Write stream that ignores every event, without checking the event
 * order. For output that is intentionally discarded.
 */
public class NullWriteStream implements WriteStream {

  @Override
  public void flush() { }

  @Override
  public void enterArray() { }

  @Override
  public void exitArray() { }

  @Override
  public void enterObject() { }

  @Override
  public void exitObject() { }

  @Override
  public void writeKey(String key) { }

  @Override
  public void writeValue(JsonValue value, ValueEncoder encoder) { }

  @Override
  public void unwind() { }
}
