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
package org.jsci.common.value;

import java.util.ArrayList;
import java.util.List;

/**
 * Traversal helpers for value trees.
 */
public final class JsonValues {

  private JsonValues() { }

  /**
   * Canonical depth-first traversal: each value precedes its children,
   * children appear in member order. Extension leaves are not descended.
   */
  public static List<JsonValue> depthFirst(JsonValue root) {
    List<JsonValue> out = new ArrayList<>();
    walk(root, out, true);
    return out;
  }

  /**
   * Depth-first traversal with children before their parent: the order in
   * which a bottom-up reduction completes each value.
   */
  public static List<JsonValue> postOrder(JsonValue root) {
    List<JsonValue> out = new ArrayList<>();
    walk(root, out, false);
    return out;
  }

  private static void walk(JsonValue value, List<JsonValue> out, boolean preOrder) {
    if (preOrder) {
      out.add(value);
    }
    switch (value.kind()) {
      case ARRAY:
        for (JsonValue element : value.asArray().elements()) {
          walk(element, out, preOrder);
        }
        break;
      case OBJECT:
        ObjectValue obj = value.asObject();
        for (int i = 0; i < obj.size(); i++) {
          walk(obj.value(i), out, preOrder);
        }
        break;
      default:
        break;
    }
    if (!preOrder) {
      out.add(value);
    }
  }

  /**
   * Quote a string for display. Not a full JSON encoder: only quotes,
   * backslashes and control characters are escaped.
   */
  static String quote(String text) {
    StringBuilder buf = new StringBuilder(text.length() + 2).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '"':
          buf.append("\\\"");
          break;
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        default:
          if (c < 0x20) {
            buf.append(String.format("\\u%04x", (int) c));
          } else {
            buf.append(c);
          }
      }
    }
    return buf.append('"').toString();
  }
}
