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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for write streams that track the document structure with a
 * {@link StreamAutomaton}.
 */
public abstract class AbstractWriteStream implements WriteStream {
  private static final Logger logger = LoggerFactory.getLogger(AbstractWriteStream.class);

  protected final StreamAutomaton automaton = new StreamAutomaton();

  public StreamState state() { return automaton.state(); }

  public int depth() { return automaton.depth(); }

  @Override
  public void unwind() {
    if (!automaton.isTerminal()) {
      logger.debug("Unwinding {} from state {} at depth {}",
          getClass().getSimpleName(), state(), depth());
    }
    for (;;) {
      switch (state()) {
        case IN_ARRAY:
        case POST_ELEM:
          exitArray();
          break;
        case IN_OBJECT:
        case POST_PAIR:
          exitObject();
          break;
        case IN_PAIR:
          writeNull();
          break;
        default:
          return;
      }
    }
  }

  @Override
  public String toString() {
    return "[" + getClass().getSimpleName() + " state=" + state() +
        ", depth=" + depth() + "]";
  }
}
