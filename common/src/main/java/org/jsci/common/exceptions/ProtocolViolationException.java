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
package org.jsci.common.exceptions;

/**
 * A write stream was driven outside its legal set of transitions, such
 * as writing a value where a key is required or closing an array while
 * inside an object. Always a defect in the calling code: the stream never
 * recovers from it, and emits nothing for the offending call.
 */
public class ProtocolViolationException extends JsciRuntimeException {
  private static final long serialVersionUID = 2217313367013528040L;

  private final String operation;
  private final String state;

  public ProtocolViolationException(String operation, Object state) {
    super(String.format("Cannot %s in stream state %s", operation, state));
    this.operation = operation;
    this.state = String.valueOf(state);
  }

  /**
   * @return the name of the rejected operation, such as {@code writeKey}
   */
  public String operation() { return operation; }

  /**
   * @return the name of the stream state in which the operation was
   * attempted
   */
  public String state() { return state; }
}
