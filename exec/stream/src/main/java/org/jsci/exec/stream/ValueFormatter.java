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

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

import org.jsci.common.exceptions.JsciRuntimeException;
import org.jsci.common.exceptions.ValueEncodingException;
import org.jsci.common.value.ArrayValue;
import org.jsci.common.value.BooleanValue;
import org.jsci.common.value.ComplexValue;
import org.jsci.common.value.JsonValue;
import org.jsci.common.value.JsonValueVisitor;
import org.jsci.common.value.NdArrayValue;
import org.jsci.common.value.NullValue;
import org.jsci.common.value.NumberValue;
import org.jsci.common.value.ObjectValue;
import org.jsci.common.value.StringValue;
import org.jsci.exec.codec.ValueEncoder;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.json.JsonWriteFeature;

/**
 * Formats a single value, with all its children, as JSON text using a
 * Jackson generator. Extension values are passed through the encoder at
 * any depth.
 * <p>
 * Non-finite numbers are written as the bare tokens {@code NaN},
 * {@code Infinity} and {@code -Infinity}, which the structure parser
 * accepts when non-numeric numbers are allowed.
 */
public class ValueFormatter {

  private static final JsonFactory FACTORY = new JsonFactoryBuilder()
      .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
      .build();

  private final int indent;

  /**
   * @param indent spaces per nesting level; 0 formats compactly
   */
  public ValueFormatter(int indent) {
    this.indent = indent;
  }

  public String format(JsonValue value, ValueEncoder encoder) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      if (indent > 0) {
        gen.setPrettyPrinter(new IndentingPrettyPrinter(indent));
      }
      value.accept(new GeneratorVisitor(gen, encoder));
    } catch (IOException e) {
      throw new JsciRuntimeException("Failed to format value of kind " + value.kind(), e);
    } catch (UncheckedIOException e) {
      throw new JsciRuntimeException("Failed to format value of kind " + value.kind(), e.getCause());
    }
    return out.toString();
  }

  /**
   * Replays a value tree as generator calls. Visitor methods cannot throw
   * the checked {@code IOException}, so it is tunneled out as
   * {@link UncheckedIOException} and unwrapped by the caller.
   */
  private static class GeneratorVisitor implements JsonValueVisitor<Void> {

    private final JsonGenerator gen;
    private final ValueEncoder encoder;

    GeneratorVisitor(JsonGenerator gen, ValueEncoder encoder) {
      this.gen = gen;
      this.encoder = encoder;
    }

    @Override
    public Void visitNull(NullValue value) {
      try {
        gen.writeNull();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    @Override
    public Void visitBoolean(BooleanValue value) {
      try {
        gen.writeBoolean(value.asBoolean());
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    @Override
    public Void visitNumber(NumberValue value) {
      try {
        gen.writeNumber(value.asDouble());
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    @Override
    public Void visitString(StringValue value) {
      try {
        gen.writeString(value.asString());
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    @Override
    public Void visitArray(ArrayValue value) {
      try {
        gen.writeStartArray();
        for (JsonValue element : value.elements()) {
          element.accept(this);
        }
        gen.writeEndArray();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    @Override
    public Void visitObject(ObjectValue value) {
      try {
        gen.writeStartObject();
        for (int i = 0; i < value.size(); i++) {
          gen.writeFieldName(value.key(i));
          value.value(i).accept(this);
        }
        gen.writeEndObject();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return null;
    }

    @Override
    public Void visitComplex(ComplexValue value) {
      return visitExtension(value);
    }

    @Override
    public Void visitNdArray(NdArrayValue value) {
      return visitExtension(value);
    }

    private Void visitExtension(JsonValue value) {
      if (encoder == null) {
        throw new ValueEncodingException(
            "No encoder given for a value of kind " + value.kind());
      }
      JsonValue encoded = encoder.encode(value);
      if (encoded.isExtension()) {
        throw new ValueEncodingException(
            "Encoder returned an extension value for kind " + value.kind());
      }
      return encoded.accept(this);
    }
  }
}
