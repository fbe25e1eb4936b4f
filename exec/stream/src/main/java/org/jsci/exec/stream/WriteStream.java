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
 * Accepts a JSON document as a stream of events delivered as method calls,
 * so that a document can be produced without first building it in memory.
 * <p>
 * Events must respect the nesting of the document: keys only directly
 * inside objects, values only where an array element, a pair value or the
 * root is expected. Implementations that track the nesting reject an event
 * in the wrong place with a
 * {@link org.jsci.common.exceptions.ProtocolViolationException}.
 * <p>
 * Prefer {@link #wrapArray()} and {@link #wrapObject()} to the bare
 * enter/exit calls. A stream is good for one document and is not thread-safe.
 */
public interface WriteStream {

  /**
   * Push buffered output to the underlying sink. For streams without a sink,
   * a hint to process buffered data eagerly.
   */
  void flush();

  /**
   * Start an array. Use {@link #wrapArray()} instead.
   */
  void enterArray();

  /**
   * End an array. Legal right after the array start or after an element.
   */
  void exitArray();

  /**
   * Start an object. Use {@link #wrapObject()} instead.
   */
  void enterObject();

  /**
   * End an object. Legal right after the object start or after a pair.
   */
  void exitObject();

  /**
   * Write the key of a key/value pair in the current object.
   */
  void writeKey(String key);

  /**
   * Write a value as an array element, as the value of the pending pair,
   * or as the root of the document.
   *
   * @param value the value; any extension values it contains need the
   * encoder
   * @param encoder converts extension values, may be {@code null}
   */
  void writeValue(JsonValue value, ValueEncoder encoder);

  /**
   * Finish all open pairs, arrays and objects so that the output forms a
   * complete document. Writes {@code null} for a pending pair value. Used
   * to clean up after a failure. Does nothing on a stream already at the
   * start or end of its document.
   */
  void unwind();

  default void writeValue(JsonValue value) {
    writeValue(value, null);
  }

  default void writeValue(String value) {
    writeValue(JsonValue.of(value));
  }

  default void writeValue(double value) {
    writeValue(JsonValue.of(value));
  }

  default void writeValue(boolean value) {
    writeValue(JsonValue.of(value));
  }

  default void writeNull() {
    writeValue(JsonValue.nullValue());
  }

  default void writePair(String key, JsonValue value) {
    writePair(key, value, null);
  }

  default void writePair(String key, String value) {
    writePair(key, JsonValue.of(value));
  }

  default void writePair(String key, double value) {
    writePair(key, JsonValue.of(value));
  }

  default void writePair(String key, boolean value) {
    writePair(key, JsonValue.of(value));
  }

  /**
   * Write a key/value pair into the current object. If writing the value
   * fails, {@code null} is written as the value so the document stays well
   * formed, then the original failure is rethrown.
   */
  default void writePair(String key, JsonValue value, ValueEncoder encoder) {
    writeKey(key);
    try {
      writeValue(value, encoder);
    } catch (RuntimeException e) {
      try {
        writeNull();
      } catch (RuntimeException nested) {
        e.addSuppressed(nested);
      }
      throw e;
    }
  }

  /**
   * Open an array scope that is closed when the returned scope is closed.
   */
  default Scope wrapArray() {
    enterArray();
    return this::exitArray;
  }

  /**
   * Open an object scope that is closed when the returned scope is closed.
   */
  default Scope wrapObject() {
    enterObject();
    return this::exitObject;
  }
}
