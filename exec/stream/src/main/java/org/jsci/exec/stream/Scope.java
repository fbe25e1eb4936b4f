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

/**
 * An open array or object scope. Closing the scope writes the matching
 * exit event. Use with try-with-resources so that the scope is closed on
 * every path out of the block:
 * <pre><code>
 * try (Scope array = stream.wrapArray()) {
 *   stream.writeValue(1);
 * }
 * </code></pre>
 */
@FunctionalInterface
public interface Scope extends AutoCloseable {
  @Override
  void close();
}
