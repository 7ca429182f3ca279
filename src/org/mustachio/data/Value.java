// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.mustachio.data;

/**
 * A read-only view over a value that a template is rendered against.
 *
 * Every value has exactly one {@link Type}, and the {@code as*} accessors are only valid for
 * that type; anything else throws {@link UnsupportedOperationException}.
 */
public interface Value {

  interface ListVisitor {
    void visit(Value value, int index);
  }

  interface MapVisitor {
    void visit(String key, Value value);
  }

  enum Type {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    LIST,
    MAP,
    LAMBDA
  }

  Type getType();

  // Cast operations to non-collections.
  boolean isNull();
  boolean asBoolean();
  Number asNumber();
  String asString();
  Lambda asLambda();

  // Operations over lists.
  int asListSize();
  void asListForeach(ListVisitor visitor);

  /**
   * Returns the element at |index|, or null if |index| is out of range.
   */
  Value asListGet(int index);

  // Operations over maps.
  boolean asMapIsEmpty();
  void asMapForeach(MapVisitor visitor);

  /**
   * Returns the value of |key|, or null if there is no such key. A key which is present but
   * holds nothing resolves to a {@link Type#NULL} value, not null.
   */
  Value asMapGet(String key);
}
