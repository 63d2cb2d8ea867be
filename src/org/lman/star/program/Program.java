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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;

/**
 * A generated program: the instructions that render one document.
 *
 * {@link #toString} gives a readable listing, one instruction per line with loop and conditional
 * bodies indented. Error reports refer to lines of that listing.
 */
public class Program {

  private static final String INDENT = "    ";

  public final List<Instruction> instructions;

  private final List<String> lines = new ArrayList<String>();
  private final Map<Instruction, Integer> lineNumbers = new IdentityHashMap<Instruction, Integer>();

  public Program(List<Instruction> instructions) {
    this.instructions = Collections.unmodifiableList(new ArrayList<Instruction>(instructions));
    list(this.instructions, 0);
  }

  /**
   * The listing line (1-based) that |instruction| appears on, or 0 if it isn't part of this
   * program.
   */
  public int lineOf(Instruction instruction) {
    Integer line = lineNumbers.get(instruction);
    return line == null ? 0 : line;
  }

  /**
   * The listing with each line prefixed by its number.
   */
  public String numberedListing() {
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < lines.size(); i++) {
      if (i > 0)
        buf.append('\n');
      buf.append(i + 1).append("\t|").append(lines.get(i));
    }
    return buf.toString();
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < lines.size(); i++) {
      if (i > 0)
        buf.append('\n');
      buf.append(lines.get(i));
    }
    return buf.toString();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Program && instructions.equals(((Program) other).instructions);
  }

  @Override
  public int hashCode() {
    return instructions.hashCode();
  }

  private void list(List<Instruction> instructions, final int depth) {
    for (final Instruction instruction : instructions) {
      lineNumbers.put(instruction, lines.size() + 1);
      instruction.accept(new Instruction.Visitor<Void>() {
        @Override
        public Void visitDeclare(Instruction.Declare declare) {
          line(depth, declare.accumulator + " = \"\"");
          return null;
        }

        @Override
        public Void visitAppendText(Instruction.AppendText appendText) {
          line(depth, appendText.accumulator + " += " + JSONObject.quote(appendText.text));
          return null;
        }

        @Override
        public Void visitAppendAccumulator(Instruction.AppendAccumulator appendAccumulator) {
          line(depth, appendAccumulator.accumulator + " += " + appendAccumulator.from);
          return null;
        }

        @Override
        public Void visitAppendLiteral(Instruction.AppendLiteral appendLiteral) {
          line(depth, appendLiteral.accumulator + " += eval " + appendLiteral.literal.text());
          return null;
        }

        @Override
        public Void visitReplace(Instruction.Replace replace) {
          line(depth, replace.accumulator + " = replace(" + replace.accumulator + ", " +
              replace.pattern.text() + ", " + replace.replacement.text() + ")");
          return null;
        }

        @Override
        public Void visitRun(Instruction.Run run) {
          line(depth, "run `" + run.snippet + "`");
          return null;
        }

        @Override
        public Void visitWhile(Instruction.While loop) {
          line(depth, "while `" + loop.cond + "`:");
          list(loop.body, depth + 1);
          line(depth, "end while");
          return null;
        }

        @Override
        public Void visitSetFlag(Instruction.SetFlag setFlag) {
          line(depth, setFlag.flag + " = " + setFlag.value);
          return null;
        }

        @Override
        public Void visitIfFlag(Instruction.IfFlag ifFlag) {
          line(depth, "if " + ifFlag.flag + ":");
          list(ifFlag.body, depth + 1);
          line(depth, "end if");
          return null;
        }

        @Override
        public Void visitEmit(Instruction.Emit emit) {
          line(depth, "emit " + emit.accumulator);
          return null;
        }
      });
    }
  }

  private void line(int depth, String text) {
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < depth; i++)
      buf.append(INDENT);
    lines.add(buf.append(text).toString());
  }
}
