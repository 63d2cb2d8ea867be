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
import java.util.List;

import org.lman.common.Struct;
import org.lman.star.literal.Literal;

/**
 * A step of a generated {@link Program}.
 *
 * Programs build their output in named string accumulators, one per kind of block and nesting
 * depth, and keep loop bookkeeping in named boolean flags. Snippets from the document are carried
 * through untouched for the script host to run.
 */
public abstract class Instruction extends Struct {

  public interface Visitor<R> {
    R visitDeclare(Declare declare);
    R visitAppendText(AppendText appendText);
    R visitAppendAccumulator(AppendAccumulator appendAccumulator);
    R visitAppendLiteral(AppendLiteral appendLiteral);
    R visitReplace(Replace replace);
    R visitRun(Run run);
    R visitWhile(While loop);
    R visitSetFlag(SetFlag setFlag);
    R visitIfFlag(IfFlag ifFlag);
    R visitEmit(Emit emit);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  /**
   * Sets an accumulator to the empty string.
   */
  public static class Declare extends Instruction {
    public final String accumulator;

    public Declare(String accumulator) {
      this.accumulator = accumulator;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDeclare(this);
    }
  }

  public static class AppendText extends Instruction {
    public final String accumulator;
    public final String text;

    public AppendText(String accumulator, String text) {
      this.accumulator = accumulator;
      this.text = text;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAppendText(this);
    }
  }

  public static class AppendAccumulator extends Instruction {
    public final String accumulator;
    public final String from;

    public AppendAccumulator(String accumulator, String from) {
      this.accumulator = accumulator;
      this.from = from;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAppendAccumulator(this);
    }
  }

  /**
   * Appends the value of a literal, as evaluated by the script host.
   */
  public static class AppendLiteral extends Instruction {
    public final String accumulator;
    public final Literal literal;

    public AppendLiteral(String accumulator, Literal literal) {
      this.accumulator = accumulator;
      this.literal = literal;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAppendLiteral(this);
    }
  }

  /**
   * Replaces every occurrence of the evaluated pattern in an accumulator with the evaluated
   * replacement, scanning left to right without overlaps.
   */
  public static class Replace extends Instruction {
    public final String accumulator;
    public final Literal pattern;
    public final Literal replacement;

    public Replace(String accumulator, Literal pattern, Literal replacement) {
      this.accumulator = accumulator;
      this.pattern = pattern;
      this.replacement = replacement;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReplace(this);
    }
  }

  /**
   * Runs a snippet once, for its side effects.
   */
  public static class Run extends Instruction {
    public final String snippet;

    public Run(String snippet) {
      this.snippet = snippet;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRun(this);
    }
  }

  public static class While extends Instruction {
    public final String cond;
    public final List<Instruction> body;

    public While(String cond, List<Instruction> body) {
      this.cond = cond;
      this.body = Collections.unmodifiableList(new ArrayList<Instruction>(body));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWhile(this);
    }
  }

  public static class SetFlag extends Instruction {
    public final String flag;
    public final Boolean value;

    public SetFlag(String flag, boolean value) {
      this.flag = flag;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSetFlag(this);
    }
  }

  public static class IfFlag extends Instruction {
    public final String flag;
    public final List<Instruction> body;

    public IfFlag(String flag, List<Instruction> body) {
      this.flag = flag;
      this.body = Collections.unmodifiableList(new ArrayList<Instruction>(body));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIfFlag(this);
    }
  }

  /**
   * Hands an accumulator's value over as the program's output. Always the last instruction.
   */
  public static class Emit extends Instruction {
    public final String accumulator;

    public Emit(String accumulator) {
      this.accumulator = accumulator;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEmit(this);
    }
  }
}
