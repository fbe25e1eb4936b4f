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

/**
 * States of the write stream automaton. The automaton keeps a stack of
 * these: the top is the current state, each open array or object scope
 * adds one entry, and the bottom entry tracks the document as a whole.
 */
public enum StreamState {

  /** Initial state: nothing written yet. */
  PRE_DOC,

  /** The root value is complete. Terminal for a single document. */
  POST_DOC,

  /** After {@code [} or after a separator: an element may follow. */
  IN_ARRAY,

  /** After <code>{</code>: a key may follow. */
  IN_OBJECT,

  /** After a key: the value of the pair is pending. */
  IN_PAIR,

  /** After the value of a pair: a separator or <code>}</code> may follow. */
  POST_PAIR,

  /** After an array element: a separator or {@code ]} may follow. */
  POST_ELEM;

  public boolean acceptsValue() {
    switch (this) {
      case PRE_DOC:
      case IN_ARRAY:
      case POST_ELEM:
      case IN_PAIR:
        return true;
      default:
        return false;
    }
  }

  public boolean acceptsKey() {
    return this == IN_OBJECT || this == POST_PAIR;
  }

  /**
   * @return true if the scope with this state at its top can be closed
   * by the exit operation for the given scope kind
   */
  public boolean closes(StreamState scope) {
    switch (scope) {
      case IN_ARRAY:
        return this == IN_ARRAY || this == POST_ELEM;
      case IN_OBJECT:
        return this == IN_OBJECT || this == POST_PAIR;
      default:
        return false;
    }
  }

  /**
   * @return the state that replaces this one once a complete value
   * has been written in it
   */
  public StreamState afterValue() {
    switch (this) {
      case PRE_DOC:
        return POST_DOC;
      case IN_ARRAY:
      case POST_ELEM:
        return POST_ELEM;
      case IN_PAIR:
        return POST_PAIR;
      default:
        throw new IllegalStateException("No value is legal in state " + this);
    }
  }

  public boolean isTerminal() {
    return this == PRE_DOC || this == POST_DOC;
  }
}
