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
 * A callable value together with its arity, which is fixed when the host object is adapted.
 */
public final class Lambda {

  public enum Arity {
    /** {@link VariableLambda}. */
    NONE,
    /** {@link SectionLambda}. */
    TEXT,
    /** {@link RenderingSectionLambda}. */
    TEXT_AND_RENDER
  }

  private final Arity arity;
  private final Object function;

  private Lambda(Arity arity, Object function) {
    this.arity = arity;
    this.function = function;
  }

  public static Lambda of(VariableLambda function) {
    return new Lambda(Arity.NONE, function);
  }

  public static Lambda of(SectionLambda function) {
    return new Lambda(Arity.TEXT, function);
  }

  public static Lambda of(RenderingSectionLambda function) {
    return new Lambda(Arity.TEXT_AND_RENDER, function);
  }

  /**
   * Returns |object| as a {@link Lambda}, or null if it implements none of the lambda
   * interfaces. An object implementing several is taken as the first of variable, section,
   * rendering section.
   */
  public static Lambda forObject(Object object) {
    if (object instanceof Lambda)
      return (Lambda) object;
    if (object instanceof VariableLambda)
      return of((VariableLambda) object);
    if (object instanceof SectionLambda)
      return of((SectionLambda) object);
    if (object instanceof RenderingSectionLambda)
      return of((RenderingSectionLambda) object);
    return null;
  }

  public Arity getArity() {
    return arity;
  }

  public String call() {
    checkArity(Arity.NONE);
    return ((VariableLambda) function).call();
  }

  public String call(String text) {
    checkArity(Arity.TEXT);
    return ((SectionLambda) function).call(text);
  }

  public String call(String text, RenderFunction render) {
    checkArity(Arity.TEXT_AND_RENDER);
    return ((RenderingSectionLambda) function).call(text, render);
  }

  private void checkArity(Arity expected) {
    if (arity != expected)
      throw new UnsupportedOperationException("Lambda takes " + arity + ", not " + expected);
  }

  @Override
  public String toString() {
    return "LAMBDA:" + arity;
  }
}
