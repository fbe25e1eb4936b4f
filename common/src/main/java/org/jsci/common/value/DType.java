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

import org.jsci.common.exceptions.UnsupportedDTypeException;

/**
 * Element type of a numeric array. Complex elements are stored as two
 * consecutive 64-bit floats (real, then imaginary).
 */
public enum DType {
  FLOAT64("float64", 1),
  COMPLEX128("complex128", 2);

  private final String tag;
  private final int width;

  DType(String tag, int width) {
    this.tag = tag;
    this.width = width;
  }

  /**
   * @return the type tag used on the wire
   */
  public String tag() { return tag; }

  /**
   * @return number of float64 components per element
   */
  public int width() { return width; }

  /**
   * @throws UnsupportedDTypeException if the tag names no known type
   */
  public static DType forTag(String tag) {
    for (DType type : values()) {
      if (type.tag.equals(tag)) {
        return type;
      }
    }
    throw new UnsupportedDTypeException(tag);
  }
}
