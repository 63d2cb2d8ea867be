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
import static org.junit.Assert.fail;

import org.junit.Test;
import org.lman.star.literal.Literal;
import org.lman.star.program.Instruction;
import org.lman.star.program.Program;

public class JavaScriptWriterTest {

  @Test
  public void write() throws ScriptException {
    Program program = new Program(asList(
        new Instruction.Declare("a"),
        new Instruction.SetFlag("f", false),
        new Instruction.Run("x = 1 // one"),
        new Instruction.While("x < 2", asList(
            new Instruction.IfFlag("f", asList(
                (Instruction) new Instruction.AppendLiteral("a", Literal.of(",")))),
            new Instruction.AppendText("a", "q'\n"),
            new Instruction.Replace("a", Literal.of("q"), Literal.of("Q")),
            new Instruction.Run("x++"))),
        new Instruction.Emit("a")));
    assertEquals(
        "var _STAR_a = '';\n" +
        "var _STAR_f = false;\n" +
        "{\n" +
        "  x = 1 // one\n" +
        "}\n" +
        "while (x < 2\n" +
        ") {\n" +
        "  if (_STAR_f) {\n" +
        "    _STAR_a += ',';\n" +
        "  }\n" +
        "  _STAR_a += \"q'\\n\";\n" +
        "  _STAR_a = _STAR_a.split('q').join('Q');\n" +
        "  {\n" +
        "    x++\n" +
        "  }\n" +
        "}\n" +
        "_STAR_emitted = _STAR_a;\n",
        JavaScriptWriter.write(program));
  }

  @Test
  public void badLiteral() {
    Program program = new Program(asList(
        new Instruction.Declare("a"),
        new Instruction.While("false", asList(
            (Instruction) new Instruction.AppendLiteral("a", new Literal("f", '\'', "{")))),
        new Instruction.Emit("a")));
    try {
      JavaScriptWriter.write(program);
      fail();
    } catch (ScriptException expected) {
    }
  }
}
