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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the tree of {@link Node}s for a template from its {@link Token}s.
 *
 * Tags other than variables which sit alone on their line (aside from whitespace) are
 * "standalone": the whole line, including its newline, is dropped from the output. This is
 * decided here, from the template source, and never revisited while rendering.
 */
final class Parser {

  /** A section whose end tag hasn't been seen yet. */
  private static class OpenSection {
    final Token start;
    final List<Node> children = new ArrayList<Node>();

    OpenSection(Token start) {
      this.start = start;
    }
  }

  private final String template;
  private final List<Node> root = new ArrayList<Node>();
  private final Deque<OpenSection> openSections = new ArrayDeque<OpenSection>();

  // Text before this offset belongs to the line of a standalone tag and is dropped.
  private int suppressedUntil = -1;

  private Parser(String template) {
    this.template = template;
  }

  static List<Node> parse(String template, List<Token> tokens) throws ParseException {
    return new Parser(template).parseAll(tokens);
  }

  private List<Node> parseAll(List<Token> tokens) {
    for (Token token : tokens) {
      switch (token.type) {
        case TEXT:
          addText(token);
          break;
        case VARIABLE:
          currentNodes().add(new Node.Variable(token.value, true));
          break;
        case UNESCAPED_VARIABLE:
          currentNodes().add(new Node.Variable(token.value, false));
          break;
        default:
          addTag(token);
      }
    }

    if (!openSections.isEmpty()) {
      Token start = openSections.peek().start;
      throw new ParseException("Unclosed section " + start.value, template, start.start);
    }
    return root;
  }

  private List<Node> currentNodes() {
    return openSections.isEmpty() ? root : openSections.peek().children;
  }

  private void addText(Token token) {
    int start = token.start;
    if (start < suppressedUntil) {
      if (token.end <= suppressedUntil)
        return;
      start = suppressedUntil;
    }
    currentNodes().add(new Node.Text(template.substring(start, token.end)));
  }

  private void addTag(Token token) {
    String indent = standaloneIndent(token);
    if (indent != null) {
      trimLastLine();
      suppressedUntil = endOfLine(token.end);
    }

    switch (token.type) {
      case COMMENT:
      case SET_DELIMITERS:
        // Delimiters were already switched by the lexer.
        break;

      case PARTIAL:
        currentNodes().add(new Node.Partial(token.value, indent == null ? "" : indent));
        break;

      case SECTION_START:
      case INVERTED_SECTION_START:
        openSections.push(new OpenSection(token));
        break;

      case SECTION_END:
        closeSection(token);
        break;

      default:
        throw new AssertionError(token);
    }
  }

  private void closeSection(Token end) {
    if (openSections.isEmpty()) {
      throw new ParseException(
          "End section " + end.value + " without a start section", template, end.start);
    }
    OpenSection section = openSections.pop();
    Token start = section.start;
    if (!start.value.equals(end.value)) {
      throw new ParseException(
          "Start section " + start.value + " doesn't match end section " + end.value,
          template,
          end.start);
    }
    currentNodes().add(new Node.Section(
        start.value,
        start.type == Token.Type.INVERTED_SECTION_START,
        section.children,
        template.substring(start.end, end.start),
        start.delimiters));
  }

  /**
   * Returns the whitespace preceding |token| on its line if it is standalone, otherwise null.
   */
  private String standaloneIndent(Token token) {
    if (!token.isStandaloneCandidate())
      return null;
    int lineStart = template.lastIndexOf('\n', token.start - 1) + 1;
    int lineEnd = template.indexOf('\n', token.end);
    if (lineEnd < 0)
      lineEnd = template.length();
    if (!isBlank(lineStart, token.start) || !isBlank(token.end, lineEnd))
      return null;
    return template.substring(lineStart, token.start);
  }

  private boolean isBlank(int start, int end) {
    for (int i = start; i < end; i++) {
      char c = template.charAt(i);
      if (c != ' ' && c != '\t' && c != '\r')
        return false;
    }
    return true;
  }

  /** The offset just past the newline ending the line |offset| is on, or the template end. */
  private int endOfLine(int offset) {
    int newline = template.indexOf('\n', offset);
    return newline < 0 ? template.length() : newline + 1;
  }

  /**
   * Cuts the last text node back to its last newline, dropping the indentation of a standalone
   * tag.
   */
  private void trimLastLine() {
    List<Node> nodes = currentNodes();
    if (nodes.isEmpty())
      return;
    Node last = nodes.get(nodes.size() - 1);
    if (last.getType() != Node.Type.TEXT)
      return;
    String text = ((Node.Text) last).text;
    String trimmed = text.substring(0, text.lastIndexOf('\n') + 1);
    if (trimmed.isEmpty())
      nodes.remove(nodes.size() - 1);
    else
      nodes.set(nodes.size() - 1, new Node.Text(trimmed));
  }
}
