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

/**
 * A piece of a template as produced by the {@link Lexer}, spanning [start, end) of the source.
 */
final class Token {

  enum Type {
    TEXT,
    VARIABLE,
    UNESCAPED_VARIABLE,
    SECTION_START,
    INVERTED_SECTION_START,
    SECTION_END,
    PARTIAL,
    COMMENT,
    SET_DELIMITERS
  }

  final Type type;

  /** The text for TEXT, the tag name for everything else except COMMENT. */
  final String value;

  final int start;
  final int end;

  /** The delimiters in effect once this token has been lexed. */
  final Delimiters delimiters;

  Token(Type type, String value, int start, int end, Delimiters delimiters) {
    this.type = type;
    this.value = value;
    this.start = start;
    this.end = end;
    this.delimiters = delimiters;
  }

  /** Whether this is a tag that can stand alone on a line. */
  boolean isStandaloneCandidate() {
    switch (type) {
      case SECTION_START:
      case INVERTED_SECTION_START:
      case SECTION_END:
      case PARTIAL:
      case COMMENT:
      case SET_DELIMITERS:
        return true;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    return type + "(" + value + ")@" + start + ".." + end;
  }
}
