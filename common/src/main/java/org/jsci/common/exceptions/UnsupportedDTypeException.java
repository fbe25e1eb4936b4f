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
package org.jsci.common.exceptions;

/**
 * The numeric codec was asked to decode an array whose element type tag
 * it does not recognize.
 */
public class UnsupportedDTypeException extends JsciRuntimeException {
  private static final long serialVersionUID = 6009542406931263413L;

  private final String dtype;

  public UnsupportedDTypeException(String dtype) {
    super("Unsupported array dtype: " + dtype);
    this.dtype = dtype;
  }

  public String dtype() { return dtype; }
}
