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

import org.mustachio.data.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled mustache template.
 *
 * Supported tags:
 *   * {{foo}} and {{foo.bar.0}}, HTML escaped; {{{foo}}} and {{&foo}} unescaped.
 *   * {{.}} for the current context, e.g. the item of a list being iterated.
 *   * {{#foo}} {{/foo}} sections, which iterate lists, push maps and other truthy values as the
 *     current context, and are skipped for missing values, false, "" and [].
 *   * {{^foo}} {{/foo}} inverted sections, rendered only when foo is one of those.
 *   * {{> foo}} partials, loaded through a {@link PartialResolver} and indented to match a
 *     standalone tag.
 *   * {{! comments }} and {{=<% %>=}} to change delimiters.
 *
 * Lambdas are values implementing {@link org.mustachio.data.VariableLambda},
 * {@link org.mustachio.data.SectionLambda} or
 * {@link org.mustachio.data.RenderingSectionLambda}.
 *
 * Names that can't be resolved render as nothing; only malformed templates and failing lambdas
 * are errors. A compiled template is immutable and may be rendered concurrently.
 */
public class Mustache {

  private static final Logger logger = LoggerFactory.getLogger(Mustache.class);

  /** Source of the template. */
  public final String source;

  private final Options options;

  /** Top-level nodes. */
  private final List<Node> nodes;

  /**
   * Creates a new {@link Mustache} parsed from a string.
   */
  public Mustache(String template) throws TemplateException {
    this(template, Options.DEFAULT);
  }

  public Mustache(String template, Options options) throws TemplateException {
    if (template == null)
      throw new IllegalArgumentException("template");
    this.source = template;
    this.options = options;
    this.nodes = Parser.parse(template, Lexer.lex(template, options.delimiters));
    if (logger.isDebugEnabled())
      logger.debug("Compiled {} chars into {} nodes", template.length(), nodes.size());
  }

  /**
   * Renders |template| against |data|, loading partials from |partials|.
   */
  public static String render(String template, Object data, PartialResolver partials)
      throws TemplateException {
    return new Mustache(template).render(data, partials);
  }

  public String render(Object data) throws TemplateException {
    return render(data, null);
  }

  /**
   * Renders the template with |data| as the only context. |data| may be a
   * {@link org.mustachio.data.Value}, an org.json object, or any Java object; see
   * {@link Values#wrap}. |partials| may be null if the template has no partials.
   */
  public String render(Object data, PartialResolver partials) throws TemplateException {
    StringBuilder buf = new StringBuilder();
    renderInto(buf, data, partials);
    return buf.toString();
  }

  public void renderInto(StringBuilder buf, Object data, PartialResolver partials)
      throws TemplateException {
    new Renderer(partials, options).render(nodes, ScopeChain.of(Values.wrap(data)), buf);
  }

  /**
   * Renders the template against an existing context stack.
   */
  public void renderInContext(StringBuilder buf, ScopeChain context, PartialResolver partials)
      throws TemplateException {
    new Renderer(partials, options).render(nodes, context, buf);
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    for (Node node : nodes)
      buf.append(node);
    return buf.toString();
  }
}
