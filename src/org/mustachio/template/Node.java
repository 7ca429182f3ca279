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

import java.util.Collections;
import java.util.List;

/**
 * A node within the parsed content of a template. Nodes are immutable once the {@link Parser}
 * has built them.
 */
abstract class Node {

  enum Type {
    TEXT,
    VARIABLE,
    SECTION,
    PARTIAL
  }

  private Node() {}

  abstract Type getType();

  /**
   * Just a string.
   */
  static final class Text extends Node {
    final String text;

    Text(String text) {
      this.text = text;
    }

    @Override
    Type getType() {
      return Type.TEXT;
    }

    @Override
    public String toString() {
      return "TEXT(" + text + ")";
    }
  }

  /**
   * {{foo}}, or {{{foo}}} and {{&foo}} if not escaped.
   */
  static final class Variable extends Node {
    final String name;
    final boolean escaped;

    Variable(String name, boolean escaped) {
      this.name = name;
      this.escaped = escaped;
    }

    @Override
    Type getType() {
      return Type.VARIABLE;
    }

    @Override
    public String toString() {
      return escaped ? "{{" + name + "}}" : "{{{" + name + "}}}";
    }
  }

  /**
   * {{#foo}} {{/foo}}, or {{^foo}} {{/foo}} if inverted.
   */
  static final class Section extends Node {
    final String name;
    final boolean inverted;
    final List<Node> children;

    /** The source between the start and end tags, exactly as written. */
    final String raw;

    /** The delimiters in effect at the start tag; lambda output is parsed with these. */
    final Delimiters delimiters;

    Section(String name, boolean inverted, List<Node> children, String raw,
        Delimiters delimiters) {
      this.name = name;
      this.inverted = inverted;
      this.children = Collections.unmodifiableList(children);
      this.raw = raw;
      this.delimiters = delimiters;
    }

    @Override
    Type getType() {
      return Type.SECTION;
    }

    @Override
    public String toString() {
      StringBuilder buf = new StringBuilder();
      buf.append(inverted ? "{{^" : "{{#").append(name).append("}}");
      for (Node child : children)
        buf.append(child);
      return buf.append("{{/").append(name).append("}}").toString();
    }
  }

  /**
   * {{> foo}}
   */
  static final class Partial extends Node {
    final String name;

    /** Whitespace every line of the partial is prefixed with; empty unless standalone. */
    final String indent;

    Partial(String name, String indent) {
      this.name = name;
      this.indent = indent;
    }

    @Override
    Type getType() {
      return Type.PARTIAL;
    }

    @Override
    public String toString() {
      return "{{>" + name + "}}";
    }
  }
}
