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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.mustachio.data.JSONObjectValue;
import org.mustachio.data.Value;
import org.mustachio.data.Values;

public class ScopeChainTest {

  @Test
  public void implicitIteratorIsInnermost() {
    Value outer = JSONObjectValue.parse("{\"a\": 1}");
    Value inner = Values.wrap("inner");
    assertSame(inner, ScopeChain.of(outer).push(inner).lookup("."));
    assertNull(ScopeChain.EMPTY.lookup("."));
    assertSame(inner, ScopeChain.of(outer).push(inner).innermost());
  }

  @Test
  public void empty() {
    assertTrue(ScopeChain.EMPTY.isEmpty());
    assertNull(ScopeChain.EMPTY.innermost());
    assertNull(ScopeChain.EMPTY.lookup("a"));
    assertFalse(ScopeChain.of(Values.NULL).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void pushNull() {
    ScopeChain.EMPTY.push(null);
  }

  @Test
  public void innermostWins() {
    ScopeChain chain = ScopeChain.of(JSONObjectValue.parse("{\"a\": \"outer\", \"b\": \"only outer\"}"))
        .push(JSONObjectValue.parse("{\"a\": \"inner\"}"));
    assertEquals("inner", chain.lookup("a").asString());
    assertEquals("only outer", chain.lookup("b").asString());
    assertNull(chain.lookup("c"));
  }

  @Test
  public void dottedNamesDontFallBack() {
    ScopeChain chain = ScopeChain.of(JSONObjectValue.parse("{\"a\": {\"b\": 1}}"))
        .push(JSONObjectValue.parse("{\"a\": {}}"));
    assertNull(chain.lookup("a.b"));
  }

  @Test
  public void dottedNamesSkipFramesWithoutTheFirstSegment() {
    ScopeChain chain = ScopeChain.of(JSONObjectValue.parse("{\"a\": {\"b\": 1}}"))
        .push(JSONObjectValue.parse("{\"x\": {}}"))
        .push(Values.wrap("a string frame"));
    assertEquals(1, chain.lookup("a.b").asNumber().intValue());
  }

  @Test
  public void listIndexes() {
    ScopeChain chain = ScopeChain.of(
        JSONObjectValue.parse("{\"list\": [\"zero\", {\"name\": \"one\"}], \"n\": 5}"));
    assertEquals("zero", chain.lookup("list.0").asString());
    assertEquals("one", chain.lookup("list.1.name").asString());
    assertNull(chain.lookup("list.2"));
    assertNull(chain.lookup("list.-1"));
    assertNull(chain.lookup("list.first"));
    assertNull(chain.lookup("list."));
    assertNull(chain.lookup("n.0"));
  }

  @Test
  public void listFrames() {
    ScopeChain chain = ScopeChain.of(Values.wrap(new String[] {"a", "b"}));
    assertEquals("b", chain.lookup("1").asString());
    assertNull(chain.lookup("name"));
  }

  @Test
  public void nullsAreFound() {
    ScopeChain chain = ScopeChain.of(JSONObjectValue.parse("{\"a\": \"outer\"}"))
        .push(JSONObjectValue.parse("{\"a\": null}"));
    assertTrue(chain.lookup("a").isNull());
  }

  @Test
  public void pushDoesNotModify() {
    ScopeChain parent = ScopeChain.of(JSONObjectValue.parse("{\"a\": \"parent\"}"));
    ScopeChain first = parent.push(JSONObjectValue.parse("{\"a\": \"first\"}"));
    ScopeChain second = parent.push(JSONObjectValue.parse("{\"b\": \"second\"}"));
    assertEquals("parent", parent.lookup("a").asString());
    assertEquals("first", first.lookup("a").asString());
    assertEquals("parent", second.lookup("a").asString());
    assertNull(first.lookup("b"));
    assertEquals("[MAP, MAP]", first.toString());
  }
}
