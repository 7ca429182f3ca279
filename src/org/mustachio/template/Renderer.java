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

import java.util.List;

import org.mustachio.data.Lambda;
import org.mustachio.data.RenderFunction;
import org.mustachio.data.Value;
import org.mustachio.data.Value.ListVisitor;
import org.mustachio.data.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a tree of {@link Node}s against a {@link ScopeChain}.
 *
 * A renderer is the state of one render call. Partials and the text produced by lambdas are
 * lexed, parsed and rendered recursively by the same renderer, up to {@link Options#maxDepth}
 * levels deep.
 */
final class Renderer {

  private static final Logger logger = LoggerFactory.getLogger(Renderer.class);

  private final PartialResolver partials;
  private final Options options;

  // Current nesting of partials and lambda output.
  private int depth = 0;

  Renderer(PartialResolver partials, Options options) {
    this.partials = partials;
    this.options = options;
  }

  void render(List<Node> nodes, ScopeChain context, StringBuilder out) {
    for (Node node : nodes)
      render(node, context, out);
  }

  private void render(Node node, ScopeChain context, StringBuilder out) {
    switch (node.getType()) {
      case TEXT:
        out.append(((Node.Text) node).text);
        break;

      case VARIABLE:
        renderVariable((Node.Variable) node, context, out);
        break;

      case SECTION:
        Node.Section section = (Node.Section) node;
        if (section.inverted)
          renderInvertedSection(section, context, out);
        else
          renderSection(section, context, out);
        break;

      case PARTIAL:
        renderPartial((Node.Partial) node, context, out);
        break;
    }
  }

  private void renderVariable(Node.Variable variable, ScopeChain context, StringBuilder out) {
    Value value = context.lookup(variable.name);
    if (value == null || value.isNull())
      return;

    String text;
    if (value.getType() == Value.Type.LAMBDA &&
        value.asLambda().getArity() == Lambda.Arity.NONE) {
      String template = callLambda(variable.name, value.asLambda(), null, null);
      text = renderTemplate(template, Delimiters.DEFAULT, context);
    } else {
      text = Values.toText(value);
    }

    if (variable.escaped)
      appendEscapedHtml(out, text);
    else
      out.append(text);
  }

  private void renderSection(
      final Node.Section section,
      final ScopeChain context,
      final StringBuilder out) {
    Value value = context.lookup(section.name);
    if (value == null)
      return;

    switch (value.getType()) {
      case NULL:
        break;

      case BOOLEAN:
        if (value.asBoolean())
          render(section.children, context, out);
        break;

      case STRING:
        if (!value.asString().isEmpty())
          render(section.children, context.push(value), out);
        break;

      case LIST:
        value.asListForeach(new ListVisitor() {
          @Override
          public void visit(Value item, int index) {
            render(section.children, context.push(item), out);
          }
        });
        break;

      case LAMBDA:
        Lambda lambda = value.asLambda();
        switch (lambda.getArity()) {
          case TEXT:
            String template = callLambda(section.name, lambda, section.raw, null);
            renderTemplate(template, section.delimiters, context, out);
            break;
          case TEXT_AND_RENDER:
            out.append(callLambda(
                section.name, lambda, section.raw, renderFunction(section, context)));
            break;
          case NONE:
            render(section.children, context.push(value), out);
            break;
        }
        break;

      case NUMBER:
      case MAP:
        render(section.children, context.push(value), out);
        break;
    }
  }

  private void renderInvertedSection(Node.Section section, ScopeChain context, StringBuilder out) {
    if (Values.isFalsey(context.lookup(section.name)))
      render(section.children, context, out);
  }

  private void renderPartial(Node.Partial partial, ScopeChain context, StringBuilder out) {
    String template = (partials == null) ? null : partials.load(partial.name);
    if (template == null || template.isEmpty()) {
      logger.debug("Partial {} not found or empty", partial.name);
      return;
    }
    if (!partial.indent.isEmpty())
      template = indent(template, partial.indent);
    renderTemplate(template, options.delimiters, context, out);
  }

  /**
   * The callback handed to a {@link org.mustachio.data.RenderingSectionLambda}: renders against
   * the section's context, and yields the empty string if that fails.
   */
  private RenderFunction renderFunction(final Node.Section section, final ScopeChain context) {
    return new RenderFunction() {
      @Override
      public String render(String template) {
        try {
          return renderTemplate(template, section.delimiters, context);
        } catch (TemplateException e) {
          logger.warn("Couldn't render text for lambda " + section.name + ", using empty text", e);
          return "";
        }
      }
    };
  }

  private String renderTemplate(String template, Delimiters delimiters, ScopeChain context) {
    StringBuilder buf = new StringBuilder();
    renderTemplate(template, delimiters, context, buf);
    return buf.toString();
  }

  private void renderTemplate(
      String template,
      Delimiters delimiters,
      ScopeChain context,
      StringBuilder out) {
    if (depth >= options.maxDepth) {
      throw new RenderException(
          "Partials and lambdas nested more than " + options.maxDepth + " levels deep");
    }
    depth++;
    try {
      render(Parser.parse(template, Lexer.lex(template, delimiters)), context, out);
    } finally {
      depth--;
    }
  }

  /**
   * Invokes |lambda| with as many of |text| and |render| as its arity takes. A null result is
   * the empty string.
   */
  private static String callLambda(
      String name,
      Lambda lambda,
      String text,
      RenderFunction render) {
    String result;
    try {
      switch (lambda.getArity()) {
        case NONE:
          result = lambda.call();
          break;
        case TEXT:
          result = lambda.call(text);
          break;
        case TEXT_AND_RENDER:
          result = lambda.call(text, render);
          break;
        default:
          throw new AssertionError(lambda.getArity());
      }
    } catch (TemplateException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new RenderException("Lambda " + name + " failed", e);
    }
    return result == null ? "" : result;
  }

  /**
   * Prefixes every line of |template| with |indent|. A trailing newline doesn't start a new line.
   */
  static String indent(String template, String indent) {
    StringBuilder buf = new StringBuilder(template.length() + indent.length());
    int lineStart = 0;
    while (lineStart < template.length()) {
      int newline = template.indexOf('\n', lineStart);
      int lineEnd = (newline < 0) ? template.length() : newline + 1;
      buf.append(indent).append(template, lineStart, lineEnd);
      lineStart = lineEnd;
    }
    return buf.toString();
  }

  static void appendEscapedHtml(StringBuilder escaped, String unescaped) {
    for (int i = 0; i < unescaped.length(); i++) {
      char c = unescaped.charAt(i);
      switch (c) {
        case '<': escaped.append("&lt;"); break;
        case '>': escaped.append("&gt;"); break;
        case '&': escaped.append("&amp;"); break;
        case '"': escaped.append("&quot;"); break;
        default: escaped.append(c);
      }
    }
  }
}
