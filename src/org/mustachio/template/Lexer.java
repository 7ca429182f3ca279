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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits template source into a flat list of {@link Token}s.
 *
 * The delimiters are state of a single lexing pass: a {{=<% %>=}} tag changes them for the rest
 * of the template only.
 */
final class Lexer {

  private static final String TRIPLE_OPEN = "{{{";
  private static final String TRIPLE_CLOSE = "}}}";

  private final String template;
  private final List<Token> tokens = new ArrayList<Token>();

  private Delimiters delimiters;
  private int position = 0;

  private Lexer(String template, Delimiters delimiters) {
    this.template = template;
    this.delimiters = delimiters;
  }

  static List<Token> lex(String template, Delimiters delimiters) throws LexException {
    return new Lexer(template, delimiters).lexAll();
  }

  private List<Token> lexAll() {
    while (position < template.length()) {
      int open = template.indexOf(delimiters.open, position);
      if (open < 0) {
        addText(template.length());
        break;
      }
      addText(open);
      if (delimiters.open.equals("{{") && template.startsWith(TRIPLE_OPEN, position))
        lexTripleMustache();
      else
        lexTag();
    }
    return tokens;
  }

  /** Adds the text from the current position up to |end|, if there is any. */
  private void addText(int end) {
    if (end > position)
      add(Token.Type.TEXT, template.substring(position, end), position, end);
    position = end;
  }

  /** {{{foo}}} */
  private void lexTripleMustache() {
    int start = position;
    int close = template.indexOf(TRIPLE_CLOSE, start + TRIPLE_OPEN.length());
    if (close < 0)
      throw new LexException("Unclosed triple mustache", template, start);
    String name = template.substring(start + TRIPLE_OPEN.length(), close).trim();
    position = close + TRIPLE_CLOSE.length();
    if (!name.isEmpty())
      add(Token.Type.UNESCAPED_VARIABLE, name, start, position);
  }

  private void lexTag() {
    int start = position;
    int bodyStart = start + delimiters.open.length();
    int close = template.indexOf(delimiters.close, bodyStart);
    if (close < 0)
      throw new LexException("Unclosed tag " + delimiters.open, template, start);
    String body = template.substring(bodyStart, close).trim();
    position = close + delimiters.close.length();

    if (body.isEmpty())
      return;

    switch (body.charAt(0)) {
      case '!':
        add(Token.Type.COMMENT, body.substring(1).trim(), start, position);
        return;
      case '=':
        if (body.endsWith("=")) {
          setDelimiters(body, start);
          return;
        }
        break;
      case '#':
        add(Token.Type.SECTION_START, body.substring(1).trim(), start, position);
        return;
      case '^':
        add(Token.Type.INVERTED_SECTION_START, body.substring(1).trim(), start, position);
        return;
      case '/':
        add(Token.Type.SECTION_END, body.substring(1).trim(), start, position);
        return;
      case '>':
        add(Token.Type.PARTIAL, body.substring(1).trim(), start, position);
        return;
      case '{':
        if (body.endsWith("}") && body.length() > 1) {
          add(Token.Type.UNESCAPED_VARIABLE,
              body.substring(1, body.length() - 1).trim(), start, position);
          return;
        }
        break;
      case '&':
        add(Token.Type.UNESCAPED_VARIABLE, body.substring(1).trim(), start, position);
        return;
    }

    add(Token.Type.VARIABLE, body, start, position);
  }

  /** {{=<% %>=}} */
  private void setDelimiters(String body, int start) {
    String inner = body.length() > 1 ? body.substring(1, body.length() - 1).trim() : "";
    String[] parts = inner.isEmpty() ? new String[0] : inner.split("\\s+");
    if (parts.length != 2) {
      throw new LexException(
          "Set delimiters needs exactly two delimiters but got '" + inner + "'", template, start);
    }
    delimiters = new Delimiters(parts[0], parts[1]);
    add(Token.Type.SET_DELIMITERS, delimiters.toString(), start, position);
  }

  private void add(Token.Type type, String value, int start, int end) {
    tokens.add(new Token(type, value, start, end, delimiters));
  }
}
