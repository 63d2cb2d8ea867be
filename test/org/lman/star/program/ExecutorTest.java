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

package org.lman.star.program;

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.lman.star.GeneratedProgramException;
import org.lman.star.RuntimeExecutionException;
import org.lman.star.literal.Literal;
import org.lman.star.script.RhinoScriptHost;
import org.lman.star.script.ScriptException;

public class ExecutorTest {

  private final Executor executor = new Executor(new RhinoScriptHost());

  @Test
  public void appendsNewline() {
    assertEquals("hi\n", execute(
        new Instruction.Declare("a"),
        new Instruction.AppendText("a", "hi"),
        new Instruction.Emit("a")));
    assertEquals("hi\n", execute(
        new Instruction.Declare("a"),
        new Instruction.AppendText("a", "hi\n"),
        new Instruction.Emit("a")));
    assertEquals("\n", execute(
        new Instruction.Declare("a"),
        new Instruction.Emit("a")));
  }

  @Test
  public void replace() {
    assertEquals("bANANa\n", execute(
        new Instruction.Declare("a"),
        new Instruction.AppendText("a", "banana"),
        new Instruction.Replace("a", Literal.of("an"), Literal.of("AN")),
        new Instruction.Emit("a")));
  }

  @Test
  public void appendToSelf() {
    assertEquals("abab\n", execute(
        new Instruction.Declare("a"),
        new Instruction.AppendText("a", "ab"),
        new Instruction.AppendAccumulator("a", "a"),
        new Instruction.Emit("a")));
  }

  @Test
  public void loopSharesScope() {
    assertEquals("2,1\n", execute(
        new Instruction.Declare("a"),
        new Instruction.SetFlag("started", false),
        new Instruction.Run("n = 2"),
        new Instruction.While("n > 0", asList(
            new Instruction.IfFlag("started", asList(
                (Instruction) new Instruction.AppendText("a", ","))),
            new Instruction.AppendLiteral("a", new Literal("f", '\'', "{n}")),
            new Instruction.Run("n--"),
            new Instruction.SetFlag("started", true))),
        new Instruction.Emit("a")));
  }

  @Test
  public void checkStructure() {
    assertEquals("the program is empty",
        Executor.checkStructure(Collections.<Instruction>emptyList()));
    assertEquals("the program doesn't end by emitting its output",
        Executor.checkStructure(instructions(new Instruction.Declare("a"))));
    assertEquals("accumulator a is used before being declared",
        Executor.checkStructure(instructions(new Instruction.Emit("a"))));
    assertEquals("accumulator b is used before being declared",
        Executor.checkStructure(instructions(
            new Instruction.Declare("a"),
            new Instruction.AppendAccumulator("a", "b"),
            new Instruction.Emit("a"))));
    assertEquals("flag f is tested before being set",
        Executor.checkStructure(instructions(
            new Instruction.Declare("a"),
            new Instruction.IfFlag("f", Collections.<Instruction>emptyList()),
            new Instruction.Emit("a"))));
    assertEquals("the program emits more than once",
        Executor.checkStructure(instructions(
            new Instruction.Declare("a"),
            new Instruction.Emit("a"),
            new Instruction.Emit("a"))));
    assertNull(Executor.checkStructure(instructions(
        new Instruction.Declare("a"),
        new Instruction.SetFlag("f", false),
        new Instruction.IfFlag("f", instructions(new Instruction.AppendText("a", "x"))),
        new Instruction.Emit("a"))));
  }

  @Test
  public void malformedProgram() {
    try {
      executor.execute(new Program(instructions(new Instruction.Declare("a"))));
      fail();
    } catch (GeneratedProgramException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("doesn't end by emitting"));
      assertEquals("1\t|a = \"\"", e.getListing());
    }
  }

  @Test
  public void programRejectedByScriptHost() {
    try {
      executor.execute(new Program(instructions(
          new Instruction.Declare("a"),
          new Instruction.Run("("),
          new Instruction.Emit("a"))));
      fail();
    } catch (GeneratedProgramException e) {
      assertTrue(e.getCause() instanceof ScriptException);
    }
  }

  @Test
  public void runtimeError() {
    try {
      execute(
          new Instruction.Declare("a"),
          new Instruction.Run("undefinedThing()"),
          new Instruction.Emit("a"));
      fail();
    } catch (RuntimeExecutionException e) {
      assertEquals("ReferenceError", e.getKind());
      assertEquals(2, e.getLine());
      assertTrue(e.getDetails(), e.getDetails().contains("undefinedThing"));
      assertTrue(e.getCause() instanceof ScriptException);
    }
  }

  private String execute(Instruction... instructions) {
    return executor.execute(new Program(asList(instructions)));
  }

  private static List<Instruction> instructions(Instruction... instructions) {
    return asList(instructions);
  }
}
