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

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.lman.star.literal.Literal;
import org.lman.star.program.Instruction;
import org.lman.star.program.Program;

public class RhinoScriptHostTest {

  private final RhinoScriptHost host = new RhinoScriptHost();

  @Test
  public void validate() throws ScriptException {
    host.validate("i = 0");
    host.validate("var a = [1, 2]; a.push(3)");
    host.validate("x++ // comment");
    expectSyntaxError(new Validation() {
      @Override
      public void run() throws ScriptException {
        host.validate("i = = 0");
      }
    });
  }

  @Test
  public void validGuards() throws ScriptException {
    host.validateGuard("i < 3");
    host.validateGuard("(i < 3)");
    host.validateGuard("i < 3 && s.length > 0");
    host.validateGuard("i < 3 // comment");
    host.validateGuard("f()");
  }

  @Test
  public void invalidGuards() {
    for (final String guard : asList(
        "", "  ", "i = 1", "(i = 1)", "i += 1", "i < 3; i = 4", "var j = 0", "{}", "i <")) {
      expectSyntaxError(new Validation() {
        @Override
        public void run() throws ScriptException {
          host.validateGuard(guard);
        }
      });
    }
  }

  @Test
  public void validateLiteral() throws ScriptException {
    host.validateLiteral(new Literal("f", '\'', "{i + 1}"));
    host.validateLiteral(new Literal("r", '"', "\\d"));
    expectSyntaxError(new Validation() {
      @Override
      public void run() throws ScriptException {
        host.validateLiteral(new Literal("f", '\'', "{i +}"));
      }
    });
  }

  @Test
  public void validateProgram() throws ScriptException {
    host.validateProgram(new Program(asList(
        new Instruction.Declare("a"),
        new Instruction.Run("i = 0"),
        new Instruction.While("i < 1", asList((Instruction) new Instruction.Run("i++"))),
        new Instruction.Emit("a"))));
    expectSyntaxError(new Validation() {
      @Override
      public void run() throws ScriptException {
        host.validateProgram(new Program(asList(
            new Instruction.Declare("a"),
            new Instruction.Run("}"),
            new Instruction.Emit("a"))));
      }
    });
  }

  @Test
  public void scope() throws ScriptException {
    ScriptHost.Scope scope = host.openScope();
    try {
      scope.run("x = 'a'; n = 2");
      assertTrue(scope.guardHolds("x == 'a'"));
      assertFalse(scope.guardHolds("n > 2"));
      assertFalse(scope.guardHolds("''"));
      assertEquals("a!", scope.evaluate(new Literal("f", '\'', "{x}!")));
      assertEquals("2", scope.evaluate(new Literal("F", '"', "{n}")));
      assertEquals("it's", scope.evaluate(Literal.of("it's")));
      assertEquals("a\tb", scope.evaluate(new Literal("", '\'', "a\\tb")));
      assertEquals("A", scope.evaluate(new Literal("u", '\'', "\\u0041")));
      assertEquals("a\\tb", scope.evaluate(new Literal("r", '\'', "a\\tb")));
      assertEquals("x", scope.evaluate(new Literal("b", '\'', "x")));
    } finally {
      scope.close();
    }
  }

  @Test
  public void scopesAreIsolated() throws ScriptException {
    ScriptHost.Scope first = host.openScope();
    try {
      first.run("leaked = 1");
    } finally {
      first.close();
    }
    ScriptHost.Scope second = host.openScope();
    try {
      assertTrue(second.guardHolds("typeof leaked == 'undefined'"));
    } finally {
      second.close();
    }
  }

  @Test
  public void runtimeErrors() {
    ScriptHost.Scope scope = host.openScope();
    try {
      try {
        scope.run("missing + 1");
        fail();
      } catch (ScriptException e) {
        assertEquals("ReferenceError", e.getKind());
      }
      try {
        scope.run("null.x");
        fail();
      } catch (ScriptException e) {
        assertEquals("TypeError", e.getKind());
      }
      try {
        scope.run("throw 'boom'");
        fail();
      } catch (ScriptException e) {
        assertEquals("Uncaught exception", e.getKind());
        assertTrue(e.getDetails(), e.getDetails().contains("boom"));
      }
    } finally {
      scope.close();
    }
  }

  @Test
  public void closedScope() throws ScriptException {
    ScriptHost.Scope scope = host.openScope();
    scope.close();
    scope.close();
    try {
      scope.run("1");
      fail();
    } catch (IllegalStateException expected) {
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void badLanguageVersion() {
    new RhinoScriptHost(12345);
  }

  private interface Validation {
    void run() throws ScriptException;
  }

  private static void expectSyntaxError(Validation validation) {
    try {
      validation.run();
      fail("Expected a syntax error");
    } catch (ScriptException e) {
      assertEquals("SyntaxError", e.getKind());
    }
  }
}
