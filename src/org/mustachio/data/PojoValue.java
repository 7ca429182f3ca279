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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A {@link Value} view over a plain Java object.
 *
 * Maps and objects with public fields are {@link Value.Type#MAP}s, collections and arrays are
 * {@link Value.Type#LIST}s, and implementations of the lambda interfaces are
 * {@link Value.Type#LAMBDA}s. Any other object is a {@link Value.Type#STRING} of its
 * toString(). Map keys are their String.valueOf() text. The type is fixed on construction, so a
 * value may be shared between threads; children are wrapped as they are looked up.
 */
public class PojoValue implements Value {

  private final Object pojo;

  private final Type type;

  // Non-null if type is LAMBDA.
  private final Lambda lambda;

  public PojoValue(Object pojo) {
    this.pojo = pojo;
    this.lambda = isScalar(pojo) ? null : Lambda.forObject(pojo);
    this.type = typeOf(pojo, lambda);
  }

  private static boolean isScalar(Object pojo) {
    return pojo == null ||
        pojo instanceof Boolean ||
        pojo instanceof Number ||
        pojo instanceof CharSequence ||
        pojo instanceof Character ||
        pojo instanceof Enum;
  }

  private static Type typeOf(Object pojo, Lambda lambda) {
    if (pojo == null)
      return Type.NULL;
    if (pojo instanceof Boolean)
      return Type.BOOLEAN;
    if (pojo instanceof Number)
      return Type.NUMBER;
    if (isScalar(pojo))
      return Type.STRING;
    if (lambda != null)
      return Type.LAMBDA;
    if (pojo.getClass().isArray() || pojo instanceof Collection)
      return Type.LIST;
    if (pojo instanceof Map || hasPublicFields(pojo.getClass()))
      return Type.MAP;
    // UUIDs, dates, URIs and the like.
    return Type.STRING;
  }

  private static boolean hasPublicFields(Class<?> clazz) {
    for (Field field : clazz.getFields()) {
      if (!Modifier.isStatic(field.getModifiers()))
        return true;
    }
    return false;
  }

  @Override
  public Type getType() {
    return type;
  }

  @Override
  public boolean isNull() {
    return getType() == Type.NULL;
  }

  @Override
  public boolean asBoolean() {
    checkIsType(Type.BOOLEAN);
    return ((Boolean) pojo).booleanValue();
  }

  @Override
  public Number asNumber() {
    checkIsType(Type.NUMBER);
    return (Number) pojo;
  }

  @Override
  public String asString() {
    checkIsType(Type.STRING);
    if (pojo instanceof Enum)
      return ((Enum<?>) pojo).name();
    return pojo.toString();
  }

  @Override
  public Lambda asLambda() {
    checkIsType(Type.LAMBDA);
    return lambda;
  }

  @Override
  public int asListSize() {
    checkIsType(Type.LIST);
    if (pojo.getClass().isArray())
      return Array.getLength(pojo);
    return ((Collection<?>) pojo).size();
  }

  @Override
  public void asListForeach(ListVisitor visitor) {
    checkIsType(Type.LIST);
    if (pojo.getClass().isArray()) {
      for (int i = 0, length = Array.getLength(pojo); i < length; i++)
        visitor.visit(Values.wrap(Array.get(pojo, i)), i);
    } else {
      int i = 0;
      for (Object item : (Collection<?>) pojo)
        visitor.visit(Values.wrap(item), i++);
    }
  }

  @Override
  public Value asListGet(int index) {
    if (index < 0 || index >= asListSize())
      return null;
    if (pojo.getClass().isArray())
      return Values.wrap(Array.get(pojo, index));
    if (pojo instanceof List)
      return Values.wrap(((List<?>) pojo).get(index));
    int i = 0;
    for (Object item : (Collection<?>) pojo) {
      if (i++ == index)
        return Values.wrap(item);
    }
    throw new AssertionError();
  }

  @Override
  public boolean asMapIsEmpty() {
    checkIsType(Type.MAP);
    if (pojo instanceof Map)
      return ((Map<?, ?>) pojo).isEmpty();
    return false;
  }

  @Override
  public void asMapForeach(MapVisitor visitor) {
    checkIsType(Type.MAP);
    if (pojo instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) pojo).entrySet()) {
        visitor.visit(String.valueOf(entry.getKey()), Values.wrap(entry.getValue()));
      }
    } else {
      for (Field field : pojo.getClass().getFields()) {
        if (Modifier.isStatic(field.getModifiers()))
          continue;
        visitor.visit(field.getName(), Values.wrap(getField(field)));
      }
    }
  }

  @Override
  public Value asMapGet(String key) {
    checkIsType(Type.MAP);
    if (pojo instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) pojo;
      if (map.containsKey(key))
        return Values.wrap(map.get(key));
      // Keys which aren't strings are matched by their text.
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String) && key.equals(String.valueOf(entry.getKey())))
          return Values.wrap(entry.getValue());
      }
      return null;
    }
    Field field;
    try {
      field = pojo.getClass().getField(key);
    } catch (NoSuchFieldException e) {
      return null;
    }
    if (Modifier.isStatic(field.getModifiers()))
      return null;
    return Values.wrap(getField(field));
  }

  private Object getField(Field field) {
    try {
      return field.get(pojo);
    } catch (IllegalAccessException e) {
      throw new UnsupportedOperationException(e);
    }
  }

  private void checkIsType(Type t) {
    if (getType() != t)
      throw new UnsupportedOperationException("Unexpected type " + t + ", expected " + getType());
  }

  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (o == null || o.getClass() != getClass())
      return false;
    PojoValue other = (PojoValue) o;
    if (pojo == null)
      return other.pojo == null;
    else
      return pojo.equals(other.pojo);
  }

  @Override
  public int hashCode() {
    return pojo == null ? 0 : pojo.hashCode();
  }

  @Override
  public String toString() {
    return Values.toText(this);
  }
}
