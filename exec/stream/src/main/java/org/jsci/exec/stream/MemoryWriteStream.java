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

import java.util.ArrayDeque;
import java.util.Deque;

import org.jsci.common.exceptions.ValueEncodingException;
import org.jsci.common.value.ArrayValue;
import org.jsci.common.value.ContainerValue;
import org.jsci.common.value.JsonValue;
import org.jsci.common.value.ObjectValue;
import org.jsci.exec.codec.ValueEncoder;

import com.google.common.base.Preconditions;

/**
 * Write stream that builds the document as a {@link JsonValue} tree.
 * <p>
 * Driven by the same automaton as {@link TextWriteStream}, so a call
 * sequence is legal here exactly when it is legal there, and the tree
 * built here equals the tree parsed back from the text written there.
 * Pairs use last-write-wins: writing a key twice in one object keeps the
 * first position and the last value.
 * <p>
 * Extension values are encoded before insertion when an encoder is
 * given, and stored as they are otherwise.
 */
public class MemoryWriteStream extends AbstractWriteStream {

  private final Deque<ContainerValue> containers = new ArrayDeque<>();
  private JsonValue root;
  private String pendingKey;

  @Override
  public void flush() { }

  @Override
  public void enterArray() {
    enter("enterArray", new ArrayValue(), StreamState.IN_ARRAY);
  }

  @Override
  public void exitArray() {
    exit("exitArray", StreamState.IN_ARRAY);
  }

  @Override
  public void enterObject() {
    enter("enterObject", new ObjectValue(), StreamState.IN_OBJECT);
  }

  @Override
  public void exitObject() {
    exit("exitObject", StreamState.IN_OBJECT);
  }

  @Override
  public void writeKey(String key) {
    Preconditions.checkNotNull(key);
    automaton.acceptKey("writeKey");
    pendingKey = key;
  }

  @Override
  public void writeValue(JsonValue value, ValueEncoder encoder) {
    Preconditions.checkNotNull(value, "Use writeNull() to write null");
    StreamState state = automaton.checkValue("writeValue");
    JsonValue encoded = encoder == null ? value : encoder.encode(value);
    if (encoded instanceof ContainerValue && ((ContainerValue) encoded).isAttached()) {
      throw new ValueEncodingException(
          "Cannot write a " + encoded.kind() + " that already belongs to another container");
    }
    attach(state, encoded);
    automaton.acceptValue("writeValue");
  }

  /**
   * @return the document built so far, or {@code null} if nothing has
   * been written. Containers still open are included as far as written.
   */
  public JsonValue root() { return root; }

  private void enter(String operation, ContainerValue container, StreamState scope) {
    StreamState state = automaton.checkValue(operation);
    attach(state, container);
    automaton.enter(operation, scope);
    containers.push(container);
  }

  private void exit(String operation, StreamState scope) {
    automaton.exit(operation, scope);
    containers.pop();
  }

  /**
   * Insert a value at the position the state calls for: the root, the
   * end of the current array or the pending key of the current object.
   */
  private void attach(StreamState state, JsonValue value) {
    switch (state) {
      case PRE_DOC:
        root = value;
        break;
      case IN_ARRAY:
      case POST_ELEM:
        containers.peek().asArray().add(value);
        break;
      case IN_PAIR:
        containers.peek().asObject().put(pendingKey, value);
        pendingKey = null;
        break;
      default:
        throw new IllegalStateException("Unexpected state: " + state);
    }
  }
}
