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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

public class ParserTest {

  @Test
  public void sectionsNest() {
    List<Node> nodes = parse("a{{#outer}}b{{^inner}}c{{/inner}}{{/outer}}d");
    assertEquals(3, nodes.size());
    Node.Section outer = (Node.Section) nodes.get(1);
    assertEquals("outer", outer.name);
    assertFalse(outer.inverted);
    assertEquals(2, outer.children.size());
    Node.Section inner = (Node.Section) outer.children.get(1);
    assertEquals("inner", inner.name);
    assertTrue(inner.inverted);
    assertEquals("TEXT(c)", inner.children.get(0).toString());
  }

  @Test
  public void rawSectionText() {
    List<Node> nodes = parse("{{#wrap}}Hi {{name}}, {{#x}}{{{y}}}{{/x}}!{{/wrap}}");
    assertEquals("Hi {{name}}, {{#x}}{{{y}}}{{/x}}!", ((Node.Section) nodes.get(0)).raw);
  }

  @Test
  public void rawSectionTextKeepsStandaloneLines() {
    List<Node> nodes = parse("{{#wrap}}\n  text\n{{/wrap}}\n");
    Node.Section section = (Node.Section) nodes.get(0);
    assertEquals("\n  text\n", section.raw);
    assertEquals(1, section.children.size());
    assertEquals("TEXT(  text\n)", section.children.get(0).toString());
  }

  @Test
  public void standaloneLinesAreRemoved() {
    assertEquals("TEXT(|\n)TEXT(content\n)TEXT(|)",
        flatten(parse("|\n  {{#sec}}\ncontent\n  {{/sec}}\n{{! comment}}\n|")));
  }

  @Test
  public void tagsSharingALineAreNotStandalone() {
    assertEquals("TEXT(  x )TEXT(\n)", flatten(parse("  x {{! comment}}\n")));
    assertEquals("TEXT(  )TEXT( y\n)", flatten(parse("  {{! comment}} y\n")));
  }

  @Test
  public void variablesAreNeverStandalone() {
    assertEquals("TEXT(  ){{name}}TEXT(\n)", flatten(parse("  {{name}}\n")));
  }

  @Test
  public void standaloneAtEndOfTemplate() {
    assertEquals("TEXT(a\n)", flatten(parse("a\n  {{! last line without newline }}  ")));
  }

  @Test
  public void standalonePartialCapturesIndent() {
    List<Node> nodes = parse("a\n \t{{> p}}\r\nb");
    assertEquals(3, nodes.size());
    assertEquals(" \t", ((Node.Partial) nodes.get(1)).indent);
    assertEquals("TEXT(b)", nodes.get(2).toString());
  }

  @Test
  public void inlinePartialHasNoIndent() {
    List<Node> nodes = parse("  x{{> p}}\n");
    assertEquals("", ((Node.Partial) nodes.get(1)).indent);
  }

  @Test
  public void sectionRemembersItsDelimiters() {
    List<Node> nodes = parse("{{=| |=}}|#lambda|x|/lambda|");
    assertEquals(new Delimiters("|", "|"), ((Node.Section) nodes.get(0)).delimiters);
  }

  private static List<Node> parse(String template) {
    return Parser.parse(template, Lexer.lex(template, Delimiters.DEFAULT));
  }

  /** Prints nodes, descending into sections. */
  private static String flatten(List<Node> nodes) {
    StringBuilder buf = new StringBuilder();
    for (Node node : nodes) {
      if (node.getType() == Node.Type.SECTION)
        buf.append(flatten(((Node.Section) node).children));
      else
        buf.append(node);
    }
    return buf.toString();
  }
}
