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

import org.jsci.common.exceptions.ProtocolViolationException;

/**
 * Finite-state machine shared by the write stream back-ends. Validates
 * every event against the current state and performs the transition,
 * leaving formatting to the back-end. Each transition method returns the
 * state that was current before the event, which is exactly what a
 * back-end needs to decide on separators.
 * <p>
 * An illegal event throws {@link ProtocolViolationException} and leaves
 * the automaton unchanged.
 */
public class StreamAutomaton {

  private final Deque<StreamState> stack = new ArrayDeque<>();

  public StreamAutomaton() {
    stack.push(StreamState.PRE_DOC);
  }

  public StreamState state() { return stack.peek(); }

  /**
   * @return the number of open scopes
   */
  public int depth() { return stack.size() - 1; }

  public boolean isTerminal() { return state().isTerminal(); }

  /**
   * Verify that a value may be written, without changing state.
   * Back-ends call this before doing work that may fail, so that a
   * failure leaves the automaton where it was.
   */
  public StreamState checkValue(String operation) {
    StreamState state = state();
    if (!state.acceptsValue()) {
      throw new ProtocolViolationException(operation, state);
    }
    return state;
  }

  /**
   * Record a complete value.
   */
  public StreamState acceptValue(String operation) {
    StreamState prior = checkValue(operation);
    stack.pop();
    stack.push(prior.afterValue());
    return prior;
  }

  /**
   * Open an array or object scope. The enclosing state moves past the
   * value immediately; the new scope starts in the given state.
   */
  public StreamState enter(String operation, StreamState scope) {
    StreamState prior = acceptValue(operation);
    stack.push(scope);
    return prior;
  }

  /**
   * Close an array or object scope. Closing from {@code POST_ELEM} or
   * {@code POST_PAIR} implicitly finishes the last element or pair.
   *
   * @return the state of the scope at the moment it was closed
   */
  public StreamState exit(String operation, StreamState scope) {
    checkExit(operation, scope);
    return stack.pop();
  }

  /**
   * Verify that the current scope may be closed, without changing state.
   *
   * @return the state the scope would close from
   */
  public StreamState checkExit(String operation, StreamState scope) {
    StreamState state = state();
    if (!state.closes(scope)) {
      throw new ProtocolViolationException(operation, state);
    }
    return state;
  }

  public StreamState acceptKey(String operation) {
    StreamState state = checkKey(operation);
    stack.pop();
    stack.push(StreamState.IN_PAIR);
    return state;
  }

  public StreamState checkKey(String operation) {
    StreamState state = state();
    if (!state.acceptsKey()) {
      throw new ProtocolViolationException(operation, state);
    }
    return state;
  }

  @Override
  public String toString() {
    return "[StreamAutomaton state=" + state() + ", depth=" + depth() + "]";
  }
}
