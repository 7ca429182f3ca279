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

package org.mustachio.template;

import org.mustachio.data.Value;

/**
 * The stack of contexts names are resolved against, innermost first.
 *
 * Chains are immutable: {@link #push} returns a new chain sharing this one as its tail, so
 * sibling sections never see each other's contexts.
 */
public final class ScopeChain {

  public static final ScopeChain EMPTY = new ScopeChain(null, null);

  /** The identifier referring to the innermost context. */
  public static final String IMPLICIT_ITERATOR = ".";

  private final Value head;
  private final ScopeChain tail;

  private ScopeChain(Value head, ScopeChain tail) {
    this.head = head;
    this.tail = tail;
  }

  public static ScopeChain of(Value root) {
    return EMPTY.push(root);
  }

  public ScopeChain push(Value value) {
    if (value == null)
      throw new IllegalArgumentException("Can't push null, use Values.NULL");
    return new ScopeChain(value, this);
  }

  public boolean isEmpty() {
    return this == EMPTY;
  }

  /** The innermost context, or null if the chain is empty. */
  public Value innermost() {
    return head;
  }

  /**
   * Resolves |name|, returning null if it can't be found.
   *
   * The first segment of a dotted name is looked up from the innermost context outwards. The
   * remaining segments are resolved only against the value the first one found: a.b does not
   * fall back to an outer a when the inner a has no b.
   */
  public Value lookup(String name) {
    if (name.equals(IMPLICIT_ITERATOR))
      return head;

    String[] segments = name.split("\\.", -1);
    for (ScopeChain chain = this; chain != EMPTY; chain = chain.tail) {
      Value resolved = resolveSegment(chain.head, segments[0]);
      if (resolved == null)
        continue;
      for (int i = 1; i < segments.length && resolved != null; i++)
        resolved = resolveSegment(resolved, segments[i]);
      return resolved;
    }
    return null;
  }

  /**
   * Resolves a single segment of a name against |value|: a key of a map, or a decimal index into
   * a list.
   */
  static Value resolveSegment(Value value, String segment) {
    switch (value.getType()) {
      case MAP:
        return value.asMapGet(segment);
      case LIST:
        int index = parseIndex(segment);
        return index < 0 ? null : value.asListGet(index);
      default:
        return null;
    }
  }

  /** Returns |segment| as a list index, or -1 if it isn't a string of digits. */
  private static int parseIndex(String segment) {
    if (segment.isEmpty() || segment.length() > 9)
      return -1;
    int index = 0;
    for (int i = 0; i < segment.length(); i++) {
      char c = segment.charAt(i);
      if (c < '0' || c > '9')
        return -1;
      index = index * 10 + (c - '0');
    }
    return index;
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder("[");
    for (ScopeChain chain = this; chain != EMPTY; chain = chain.tail) {
      if (chain != this)
        buf.append(", ");
      buf.append(chain.head.getType());
    }
    return buf.append("]").toString();
  }
}
