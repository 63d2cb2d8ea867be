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

package org.lman.star.script;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.lman.star.literal.Literal;

public class JavaScriptLiteralsTest {

  @Test
  public void plain() throws ScriptException {
    assertEquals("'a'", JavaScriptLiterals.toExpression(Literal.of("a")));
    assertEquals("\"it's\\n\"", JavaScriptLiterals.toExpression(new Literal("u", '"', "it's\\n")));
    assertEquals("'x'", JavaScriptLiterals.toExpression(new Literal("b", '\'', "x")));
  }

  @Test
  public void raw() throws ScriptException {
    assertEquals("\"\\\\d\"", JavaScriptLiterals.toExpression(new Literal("r", '\'', "\\d")));
    assertEquals("\"a\\\"b\"", JavaScriptLiterals.toExpression(new Literal("R", '\'', "a\"b")));
  }

  @Test
  public void formatted() throws ScriptException {
    assertEquals(
        "('a' + String(i) + 'b')",
        JavaScriptLiterals.toExpression(new Literal("f", '\'', "a{i}b")));
    assertEquals(
        "('' + String(i + 1) + '' + String(s[0]) + '')",
        JavaScriptLiterals.toExpression(new Literal("f", '\'', "{i + 1}{s[0]}")));
    assertEquals(
        "('{x}')",
        JavaScriptLiterals.toExpression(new Literal("f", '\'', "{{x}}")));
    assertEquals(
        "('' + String( {a: 1}['a']) + '!')",
        JavaScriptLiterals.toExpression(new Literal("f", '\'', "{ {a: 1}['a']}!")));
  }

  @Test
  public void rawFormatted() throws ScriptException {
    assertEquals(
        "(\"\\\\\" + String(i) + \"\")",
        JavaScriptLiterals.toExpression(new Literal("rf", '\'', "\\{i}")));
  }

  @Test
  public void badFormatted() {
    expectSyntaxError(new Literal("f", '\'', "{"), 1);
    expectSyntaxError(new Literal("f", '\'', "a}"), 2);
    expectSyntaxError(new Literal("f", '\'', "{}"), 1);
    expectSyntaxError(new Literal("f", '\'', "x{ }"), 2);
  }

  private static void expectSyntaxError(Literal literal, int column) {
    try {
      JavaScriptLiterals.toExpression(literal);
      fail("Expected " + literal.text() + " to be rejected");
    } catch (ScriptException e) {
      assertEquals("SyntaxError", e.getKind());
      assertEquals(column, e.getColumn());
    }
  }
}
