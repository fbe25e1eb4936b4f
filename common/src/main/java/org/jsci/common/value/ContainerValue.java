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

import com.google.common.base.Preconditions;

/**
 * Base for the two container kinds. Tracks the owning container so that
 * a subtree can be attached to at most one parent, which keeps every
 * document a tree.
 */
public abstract class ContainerValue extends JsonValue {

  private ContainerValue owner;

  ContainerValue() { }

  public abstract int size();

  public boolean isEmpty() { return size() == 0; }

  /**
   * @return true if this container has been added to another container
   */
  public boolean isAttached() { return owner != null; }

  /**
   * Take ownership of a value about to become a child of this container.
   */
  protected JsonValue adopt(JsonValue child) {
    Preconditions.checkNotNull(child, "Use NullValue.INSTANCE rather than null");
    if (!(child instanceof ContainerValue)) {
      return child;
    }
    ContainerValue container = (ContainerValue) child;
    if (container.owner != null) {
      throw new IllegalArgumentException(
          "Value already belongs to another container: " + container.kind());
    }
    for (ContainerValue ancestor = this; ancestor != null; ancestor = ancestor.owner) {
      if (ancestor == container) {
        throw new IllegalArgumentException("Adding this value would create a cycle");
      }
    }
    container.owner = this;
    return child;
  }

  protected void release(JsonValue child) {
    if (child instanceof ContainerValue) {
      ((ContainerValue) child).owner = null;
    }
  }
}
