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
import org.jsci.exec.codec.ValueDecoder;

import com.google.common.base.Preconditions;

/**
 * Selector transformer that delegates to a callback, typically a lambda.
 */
public class CallbackSelectorTransformer extends SelectorTransformer {

  private final ValueTransform callback;

  public CallbackSelectorTransformer(ValueTransform callback) {
    this.callback = Preconditions.checkNotNull(callback);
  }

  public CallbackSelectorTransformer(ValueTransform callback, JsonOptions options,
      ValueDecoder decoder) {
    super(options, decoder);
    this.callback = Preconditions.checkNotNull(callback);
  }

  @Override
  public JsonValue transform(JsonPath path, JsonValue value) {
    return callback.transform(path, value);
  }
}
