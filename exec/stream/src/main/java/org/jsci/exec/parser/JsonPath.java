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
package org.jsci.exec.parser;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Location of a value within a document: the object keys and array
 * positions leading from the root to the value. The root has the empty
 * path. Immutable.
 * <p>
 * Renders as {@code .a.1.b} for the path {@code ["a", 1, "b"]} and as
 * {@code .} for the root.
 */
public final class JsonPath {

  private static final JsonPath ROOT = new JsonPath(ImmutableList.of());

  private final ImmutableList<Object> segments;

  private JsonPath(ImmutableList<Object> segments) {
    this.segments = segments;
  }

  public static JsonPath root() { return ROOT; }

  /**
   * @param segments {@code String} keys and {@code Integer} positions
   */
  public static JsonPath of(Object... segments) {
    return of(Arrays.asList(segments));
  }

  public static JsonPath of(List<?> segments) {
    for (Object segment : segments) {
      Preconditions.checkArgument(segment instanceof String || segment instanceof Integer,
          "Path segments must be keys or array positions: %s", segment);
    }
    return segments.isEmpty() ? ROOT : new JsonPath(ImmutableList.<Object>copyOf(segments));
  }

  public int size() { return segments.size(); }

  public boolean isRoot() { return segments.isEmpty(); }

  public Object segment(int i) { return segments.get(i); }

  public boolean isKey(int i) { return segments.get(i) instanceof String; }

  public String key(int i) { return (String) segments.get(i); }

  public int index(int i) { return (Integer) segments.get(i); }

  public Object last() {
    Preconditions.checkState(!isRoot(), "The root path has no segments");
    return segments.get(segments.size() - 1);
  }

  public JsonPath parent() {
    Preconditions.checkState(!isRoot(), "The root path has no parent");
    return of(segments.subList(0, segments.size() - 1));
  }

  public List<Object> segments() { return segments; }

  @Override
  public boolean equals(Object o) {
    return o instanceof JsonPath && ((JsonPath) o).segments.equals(segments);
  }

  @Override
  public int hashCode() { return segments.hashCode(); }

  @Override
  public String toString() {
    if (isRoot()) {
      return ".";
    }
    StringBuilder buf = new StringBuilder();
    for (Object segment : segments) {
      buf.append('.').append(segment);
    }
    return buf.toString();
  }
}
