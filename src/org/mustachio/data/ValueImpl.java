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
 * Base for {@link Value}s which only support some of the operations.
 */
public abstract class ValueImpl implements Value {

  @Override
  public boolean isNull() {
    return false;
  }

  @Override
  public boolean asBoolean() {
    throw unsupported("asBoolean");
  }

  @Override
  public Number asNumber() {
    throw unsupported("asNumber");
  }

  @Override
  public String asString() {
    throw unsupported("asString");
  }

  @Override
  public Lambda asLambda() {
    throw unsupported("asLambda");
  }

  @Override
  public int asListSize() {
    throw unsupported("asListSize");
  }

  @Override
  public void asListForeach(ListVisitor visitor) {
    throw unsupported("asListForeach");
  }

  @Override
  public Value asListGet(int index) {
    throw unsupported("asListGet");
  }

  @Override
  public boolean asMapIsEmpty() {
    throw unsupported("asMapIsEmpty");
  }

  @Override
  public void asMapForeach(MapVisitor visitor) {
    throw unsupported("asMapForeach");
  }

  @Override
  public Value asMapGet(String key) {
    throw unsupported("asMapGet");
  }

  private UnsupportedOperationException unsupported(String operation) {
    return new UnsupportedOperationException(operation + " on a " + getType() + " value");
  }

  @Override
  public String toString() {
    return Values.toText(this);
  }
}
