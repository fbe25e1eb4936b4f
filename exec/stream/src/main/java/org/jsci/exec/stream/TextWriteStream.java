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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.jsci.common.exceptions.JsciRuntimeException;
import org.jsci.common.value.JsonValue;
import org.jsci.exec.codec.ValueEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Write stream that serializes events directly to JSON text.
 * <p>
 * Layout: each array element and each object member starts on its own
 * line, indented by the nesting depth. An object's opening brace stays on
 * the line of its key. Leaf values are formatted as a unit by
 * {@link ValueFormatter} and shifted right to the current depth. For
 * example:
 * <pre><code>
 * {
 *   "a": [
 *     1.0,
 *     {
 *       "b": 2.0
 *     }
 *   ]
 * }</code></pre>
 * The same sequence of calls always produces the same text.
 */
public class TextWriteStream extends AbstractWriteStream implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(TextWriteStream.class);

  private final Writer out;
  private final int indent;
  private final ValueFormatter formatter;

  public TextWriteStream(Writer out, int indent) {
    Preconditions.checkArgument(indent >= 0, "Indent must be non-negative: %s", indent);
    this.out = Preconditions.checkNotNull(out);
    this.indent = indent;
    this.formatter = new ValueFormatter(indent);
  }

  /**
   * Write UTF-8 encoded text to the given stream.
   */
  public TextWriteStream(OutputStream out, int indent) {
    this(new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)), indent);
  }

  public int indent() { return indent; }

  @Override
  public void flush() {
    try {
      out.flush();
    } catch (IOException e) {
      throw ioError("flush", e);
    }
  }

  // Structural events check the automaton, emit, and only then transition,
  // so a failed write leaves the state matching the output.

  @Override
  public void enterArray() {
    int level = depth();
    StreamState prior = automaton.checkValue("enterArray");
    emit(separator(prior, level) + "[");
    automaton.enter("enterArray", StreamState.IN_ARRAY);
  }

  @Override
  public void exitArray() {
    StreamState closing = automaton.checkExit("exitArray", StreamState.IN_ARRAY);
    if (closing == StreamState.POST_ELEM) {
      emit("\n" + padding(depth() - 1) + "]");
    } else {
      emit("]");
    }
    automaton.exit("exitArray", StreamState.IN_ARRAY);
  }

  @Override
  public void enterObject() {
    int level = depth();
    StreamState prior = automaton.checkValue("enterObject");
    emit(separator(prior, level) + "{\n");
    automaton.enter("enterObject", StreamState.IN_OBJECT);
  }

  @Override
  public void exitObject() {
    StreamState closing = automaton.checkExit("exitObject", StreamState.IN_OBJECT);
    StringBuilder buf = new StringBuilder();
    if (closing == StreamState.POST_PAIR) {
      buf.append("\n");
    }
    emit(buf.append(padding(depth() - 1)).append("}").toString());
    automaton.exit("exitObject", StreamState.IN_OBJECT);
  }

  @Override
  public void writeKey(String key) {
    Preconditions.checkNotNull(key);
    StreamState prior = automaton.checkKey("writeKey");
    StringBuilder buf = new StringBuilder();
    if (prior == StreamState.POST_PAIR) {
      buf.append(",\n");
    }
    buf.append(padding(depth()))
       .append('"')
       .append(JsonStringEncoder.getInstance().quoteAsString(key))
       .append("\": ");
    emit(buf.toString());
    automaton.acceptKey("writeKey");
  }

  @Override
  public void writeValue(JsonValue value, ValueEncoder encoder) {
    Preconditions.checkNotNull(value, "Use writeNull() to write null");
    StreamState prior = automaton.checkValue("writeValue");

    // Format first: a value that cannot be formatted emits nothing.
    int level = depth();
    String text = formatter.format(value, encoder);
    emit(separator(prior, level) + reindent(text, level));
    automaton.acceptValue("writeValue");
  }

  /**
   * Close the stream and the underlying writer. Does not complete the
   * document: call {@link #unwind()} first if it may be unfinished.
   */
  @Override
  public void close() {
    if (!automaton.isTerminal()) {
      logger.warn("Closing a text stream with an unfinished document, state {}", state());
    }
    try {
      out.close();
    } catch (IOException e) {
      throw ioError("close", e);
    }
  }

  /**
   * Text that goes in front of a value, given the state it was written
   * in and the depth of its enclosing scope.
   */
  private String separator(StreamState prior, int level) {
    switch (prior) {
      case IN_ARRAY:
        return "\n" + padding(level);
      case POST_ELEM:
        return ",\n" + padding(level);
      default:
        return "";
    }
  }

  private String reindent(String text, int level) {
    if (level == 0 || indent == 0) {
      return text;
    }
    return text.replace("\n", "\n" + padding(level));
  }

  private String padding(int level) {
    return Strings.repeat(" ", level * indent);
  }

  private void emit(String text) {
    try {
      out.write(text);
    } catch (IOException e) {
      throw ioError("write", e);
    }
  }

  private JsciRuntimeException ioError(String operation, IOException e) {
    logger.error("Text stream {} failed", operation, e);
    return new JsciRuntimeException("Failed to " + operation + " JSON output", e);
  }
}
