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

import java.util.List;

import org.json.JSONObject;
import org.lman.star.program.Instruction;
import org.lman.star.program.Program;

/**
 * Writes a {@link Program} out as an equivalent JavaScript script, so that a JavaScript engine can
 * check it as a whole. Accumulators and flags are prefixed so they can't be mistaken for the
 * document's own variables.
 */
public class JavaScriptWriter {

  static final String PREFIX = "_STAR_";

  private static final String INDENT = "  ";

  private final StringBuilder buf = new StringBuilder();

  private JavaScriptWriter() {}

  public static String write(Program program) throws ScriptException {
    JavaScriptWriter writer = new JavaScriptWriter();
    writer.write(program.instructions, 0);
    return writer.buf.toString();
  }

  private void write(List<Instruction> instructions, int depth) throws ScriptException {
    for (Instruction instruction : instructions)
      write(instruction, depth);
  }

  private void write(Instruction instruction, final int depth) throws ScriptException {
    final ScriptException[] error = { null };
    instruction.accept(new Instruction.Visitor<Void>() {
      @Override
      public Void visitDeclare(Instruction.Declare declare) {
        line(depth, "var " + PREFIX + declare.accumulator + " = '';");
        return null;
      }

      @Override
      public Void visitAppendText(Instruction.AppendText appendText) {
        line(depth, PREFIX + appendText.accumulator + " += " +
            JSONObject.quote(appendText.text) + ";");
        return null;
      }

      @Override
      public Void visitAppendAccumulator(Instruction.AppendAccumulator appendAccumulator) {
        line(depth, PREFIX + appendAccumulator.accumulator + " += " +
            PREFIX + appendAccumulator.from + ";");
        return null;
      }

      @Override
      public Void visitAppendLiteral(Instruction.AppendLiteral appendLiteral) {
        try {
          line(depth, PREFIX + appendLiteral.accumulator + " += " +
              JavaScriptLiterals.toExpression(appendLiteral.literal) + ";");
        } catch (ScriptException e) {
          error[0] = e;
        }
        return null;
      }

      @Override
      public Void visitReplace(Instruction.Replace replace) {
        String accumulator = PREFIX + replace.accumulator;
        try {
          line(depth, accumulator + " = " + accumulator +
              ".split(" + JavaScriptLiterals.toExpression(replace.pattern) + ")" +
              ".join(" + JavaScriptLiterals.toExpression(replace.replacement) + ");");
        } catch (ScriptException e) {
          error[0] = e;
        }
        return null;
      }

      @Override
      public Void visitRun(Instruction.Run run) {
        // The snippet gets lines of its own, so a trailing comment can't swallow anything.
        line(depth, "{");
        line(depth + 1, run.snippet);
        line(depth, "}");
        return null;
      }

      @Override
      public Void visitWhile(Instruction.While loop) {
        line(depth, "while (" + loop.cond);
        line(depth, ") {");
        try {
          write(loop.body, depth + 1);
        } catch (ScriptException e) {
          error[0] = e;
        }
        line(depth, "}");
        return null;
      }

      @Override
      public Void visitSetFlag(Instruction.SetFlag setFlag) {
        line(depth, "var " + PREFIX + setFlag.flag + " = " + setFlag.value + ";");
        return null;
      }

      @Override
      public Void visitIfFlag(Instruction.IfFlag ifFlag) {
        line(depth, "if (" + PREFIX + ifFlag.flag + ") {");
        try {
          write(ifFlag.body, depth + 1);
        } catch (ScriptException e) {
          error[0] = e;
        }
        line(depth, "}");
        return null;
      }

      @Override
      public Void visitEmit(Instruction.Emit emit) {
        line(depth, PREFIX + "emitted = " + PREFIX + emit.accumulator + ";");
        return null;
      }
    });
    if (error[0] != null)
      throw error[0];
  }

  private void line(int depth, String text) {
    for (int i = 0; i < depth; i++)
      buf.append(INDENT);
    buf.append(text).append('\n');
  }
}
