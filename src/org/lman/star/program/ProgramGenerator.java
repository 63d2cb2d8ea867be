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
import java.util.List;

import org.lman.star.tree.Node;
import org.lman.star.tree.Repetition;
import org.lman.star.tree.Source;
import org.lman.star.tree.Substitution;
import org.lman.star.tree.Text;

/**
 * Lowers a document tree into a {@link Program}.
 *
 * Each {@link Source} at nesting depth d renders into accumulator source_d, with a newline between
 * consecutive children. A block at depth d renders its body into source_(d+1) and then folds the
 * result into source_d, so blocks never share accumulators with their siblings or ancestors.
 * Generation is purely structural: no snippet is run here.
 */
public class ProgramGenerator {

  static final String SOURCE = "source_";
  static final String SUB = "sub_";
  static final String RPT = "rpt_";
  static final String RPT_STARTED = "rpt_started_";

  public Program generate(Source tree) {
    List<Instruction> instructions = compileSource(tree, 0);
    instructions.add(new Instruction.Emit(SOURCE + 0));
    return new Program(instructions);
  }

  private List<Instruction> compileSource(Source source, int depth) {
    List<Instruction> instructions = new ArrayList<Instruction>();
    String accumulator = SOURCE + depth;
    instructions.add(new Instruction.Declare(accumulator));
    ChildCompiler childCompiler = new ChildCompiler(depth);
    boolean first = true;
    for (Node child : source.children) {
      if (first)
        first = false;
      else
        instructions.add(new Instruction.AppendText(accumulator, "\n"));
      instructions.addAll(child.accept(childCompiler));
    }
    return instructions;
  }

  /**
   * Compiles the children of a source at a given depth.
   */
  private class ChildCompiler implements Node.Visitor<List<Instruction>> {
    private final int depth;
    private final String accumulator;

    public ChildCompiler(int depth) {
      this.depth = depth;
      this.accumulator = SOURCE + depth;
    }

    @Override
    public List<Instruction> visitSource(Source source) {
      throw new IllegalArgumentException("A source can't be nested directly in another source");
    }

    @Override
    public List<Instruction> visitText(Text text) {
      List<Instruction> instructions = new ArrayList<Instruction>();
      instructions.add(new Instruction.AppendText(accumulator, text.line));
      return instructions;
    }

    @Override
    public List<Instruction> visitSubstitution(Substitution substitution) {
      List<Instruction> instructions = compileSource(substitution.body, depth + 1);
      String scratch = SUB + depth;
      instructions.add(new Instruction.Declare(scratch));
      instructions.add(new Instruction.AppendAccumulator(scratch, SOURCE + (depth + 1)));
      for (Substitution.Rule rule : substitution.rules)
        instructions.add(new Instruction.Replace(scratch, rule.pattern, rule.replacement));
      instructions.add(new Instruction.AppendAccumulator(accumulator, scratch));
      return instructions;
    }

    @Override
    public List<Instruction> visitRepetition(Repetition repetition) {
      String loopAccumulator = RPT + depth;
      String started = RPT_STARTED + depth;

      List<Instruction> body = compileSource(repetition.body, depth + 1);
      List<Instruction> delimit = new ArrayList<Instruction>();
      delimit.add(new Instruction.AppendLiteral(loopAccumulator, repetition.delimiter));
      body.add(new Instruction.IfFlag(started, delimit));
      body.add(new Instruction.AppendAccumulator(loopAccumulator, SOURCE + (depth + 1)));
      if (!repetition.update.isEmpty())
        body.add(new Instruction.Run(repetition.update));
      body.add(new Instruction.SetFlag(started, true));

      List<Instruction> instructions = new ArrayList<Instruction>();
      instructions.add(new Instruction.Declare(loopAccumulator));
      instructions.add(new Instruction.SetFlag(started, false));
      if (!repetition.init.isEmpty())
        instructions.add(new Instruction.Run(repetition.init));
      instructions.add(new Instruction.While(repetition.cond, body));
      instructions.add(new Instruction.AppendAccumulator(accumulator, loopAccumulator));
      return instructions;
    }
  }
}
