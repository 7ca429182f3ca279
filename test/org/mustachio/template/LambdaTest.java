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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.mustachio.data.RenderFunction;
import org.mustachio.data.RenderingSectionLambda;
import org.mustachio.data.SectionLambda;
import org.mustachio.data.VariableLambda;

public class LambdaTest {

  private Map<String, Object> context;

  // Every text a section lambda was called with.
  private List<String> calls;

  @Before
  public void setUp() {
    context = new HashMap<String, Object>();
    calls = new ArrayList<String>();
  }

  private VariableLambda returning(final String text) {
    return new VariableLambda() {
      @Override
      public String call() {
        calls.add("");
        return text;
      }
    };
  }

  private SectionLambda wrapping(final String before, final String after) {
    return new SectionLambda() {
      @Override
      public String call(String text) {
        calls.add(text);
        return before + text + after;
      }
    };
  }

  private String render(String template) {
    return new Mustache(template).render(context);
  }

  @Test
  public void variableLambdaOutputIsRendered() {
    context.put("year", 1970);
    context.put("month", 1);
    context.put("day", 1);
    context.put("title", returning("{{year}}-{{month}}-{{day}}"));
    assertEquals("* 1970-1-1", render("* {{title}}"));
  }

  @Test
  public void variableLambdaOutputIsEscaped() {
    context.put("x", "&");
    context.put("lambda", returning("<{{x}}>"));
    assertEquals("&lt;&amp;amp;&gt;", render("{{lambda}}"));
    assertEquals("<&amp;>", render("{{{lambda}}}"));
    assertEquals("<&amp;>", render("{{&lambda}}"));
  }

  @Test
  public void unescapedInsideVariableLambdaIsEscapedOnce() {
    context.put("x", "&");
    context.put("lambda", returning("<{{&x}}>"));
    assertEquals("&lt;&amp;&gt;", render("{{lambda}}"));
    assertEquals("<&>", render("{{{lambda}}}"));
  }

  @Test
  public void variableLambdaOutputUsesDefaultDelimiters() {
    context.put("x", "X");
    context.put("lambda", returning("{{x}}<%x%>"));
    assertEquals("X<%x%>", render("{{=<% %>=}}<%& lambda %>"));
  }

  @Test
  public void sectionLambdaWraps() {
    context.put("name", "Willy");
    context.put("wrapped", wrapping("<b>", "</b>"));
    assertEquals("<b>Willy is awesome.</b>",
        render("{{#wrapped}}{{name}} is awesome.{{/wrapped}}"));
  }

  @Test
  public void sectionLambdaGetsRawText() {
    context.put("lambda", new SectionLambda() {
      @Override
      public String call(String text) {
        calls.add(text);
        return "";
      }
    });
    assertEquals("", render("{{#lambda}}a {{b}} {{#c}}{{/c}}\n{{/lambda}}"));
    assertEquals(Arrays.asList("a {{b}} {{#c}}{{/c}}\n"), calls);
  }

  @Test
  public void sectionLambdaOutputUsesSectionDelimiters() {
    context.put("planet", "Earth");
    context.put("lambda", wrapping("-", "|planet|-"));
    assertEquals("--Earth-", render("{{=| |=}}|#lambda|-|/lambda|"));
  }

  @Test
  public void sectionLambdaSeesCurrentContext() {
    context.put("list", Arrays.asList("a", "b"));
    context.put("wrap", wrapping("(", ")"));
    assertEquals("(a)(b)", render("{{#list}}{{#wrap}}{{.}}{{/wrap}}{{/list}}"));
  }

  @Test
  public void renderCallback() {
    context.put("name", "WilLy");
    context.put("upper", new RenderingSectionLambda() {
      @Override
      public String call(String text, RenderFunction render) {
        return render.render(text).toUpperCase();
      }
    });
    assertEquals("WILLY", render("{{#upper}}{{name}}{{/upper}}"));
  }

  @Test
  public void renderCallbackResultIsNotRendered() {
    context.put("name", "Willy");
    context.put("literal", new RenderingSectionLambda() {
      @Override
      public String call(String text, RenderFunction render) {
        return "<" + text + ">";
      }
    });
    assertEquals("<{{name}}>", render("{{#literal}}{{name}}{{/literal}}"));
  }

  @Test
  public void renderCallbackSwallowsErrors() {
    context.put("lambda", new RenderingSectionLambda() {
      @Override
      public String call(String text, RenderFunction render) {
        return "[" + render.render("{{#unclosed}}") + "]" + render.render(text);
      }
    });
    context.put("x", "ok");
    assertEquals("[]ok", render("{{#lambda}}{{x}}{{/lambda}}"));
  }

  @Test
  public void sectionLambdaErrorsAreFatal() {
    context.put("lambda", wrapping("{{#unclosed}}", ""));
    try {
      render("{{#lambda}}x{{/lambda}}");
      fail();
    } catch (ParseException expected) {}
  }

  @Test
  public void throwingLambdaIsARenderError() {
    final IllegalStateException cause = new IllegalStateException("boom");
    context.put("lambda", new VariableLambda() {
      @Override
      public String call() {
        throw cause;
      }
    });
    try {
      render("{{lambda}}");
      fail();
    } catch (RenderException expected) {
      assertTrue(expected.getMessage().contains("lambda"));
      assertEquals(cause, expected.getCause());
    }
  }

  @Test
  public void nullResultIsEmpty() {
    context.put("lambda", returning(null));
    assertEquals("[]", render("[{{lambda}}]"));
  }

  @Test
  public void invertedSectionsDontCallLambdas() {
    context.put("lambda", wrapping("", ""));
    assertEquals("", render("{{^lambda}}no{{/lambda}}"));
    assertTrue(calls.isEmpty());
  }

  @Test
  public void variableLambdaInSectionIsJustTruthy() {
    context.put("lambda", returning("unused"));
    assertEquals("yes", render("{{#lambda}}yes{{/lambda}}"));
    assertTrue(calls.isEmpty());
  }

  @Test
  public void sectionLambdaAsVariableIsEmpty() {
    context.put("lambda", wrapping("<", ">"));
    assertEquals("[]", render("[{{lambda}}]"));
    assertTrue(calls.isEmpty());
  }
}
