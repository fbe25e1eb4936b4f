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

import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;

import org.jsci.common.config.JsciConfig;
import org.jsci.common.value.JsonValue;
import org.jsci.exec.codec.ValueEncoder;

/**
 * Factory methods for the write stream back-ends.
 */
public final class WriteStreams {

  private WriteStreams() { }

  public static TextWriteStream text(Writer out, JsciConfig config) {
    return new TextWriteStream(out, config.writerIndent());
  }

  public static TextWriteStream text(OutputStream out, JsciConfig config) {
    return new TextWriteStream(out, config.writerIndent());
  }

  public static MemoryWriteStream memory() {
    return new MemoryWriteStream();
  }

  public static WriteStream discard() {
    return new NullWriteStream();
  }

  /**
   * Format a complete value as text with the given indentation.
   */
  public static String toText(JsonValue value, ValueEncoder encoder, int indent) {
    StringWriter out = new StringWriter();
    TextWriteStream stream = new TextWriteStream(out, indent);
    stream.writeValue(value, encoder);
    stream.flush();
    return out.toString();
  }
}
