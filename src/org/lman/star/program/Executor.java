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

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.lman.star.GeneratedProgramException;
import org.lman.star.RuntimeExecutionException;
import org.lman.star.script.ScriptException;
import org.lman.star.script.ScriptHost;

/**
 * Runs a {@link Program} against a {@link ScriptHost}.
 *
 * Before anything runs the program is checked: every accumulator and flag must be set before it's
 * read, the last instruction must be the only {@link Instruction.Emit}, and the script host must
 * accept the program as a whole. A program failing those checks is a bug in the generator, and is
 * reported as a {@link GeneratedProgramException}.
 */
public class Executor {

  private static final Logger logger = Logger.getLogger(Executor.class.getName());

  /**
   * Carries a script failure out of an {@link Instruction.Visitor}.
   */
  private static class Failure extends RuntimeException {
    private static final long serialVersionUID = 1L;

    final Instruction instruction;
    final ScriptException scriptException;

    Failure(Instruction instruction, ScriptException scriptException) {
      super(scriptException);
      this.instruction = instruction;
      this.scriptException = scriptException;
    }
  }

  private final ScriptHost scriptHost;

  public Executor(ScriptHost scriptHost) {
    this.scriptHost = scriptHost;
  }

  /**
   * Runs |program| and returns the text it emits, with a newline added unless it already ends in
   * one.
   */
  public String execute(Program program)
      throws GeneratedProgramException, RuntimeExecutionException {
    validate(program);

    ScriptHost.Scope scope = scriptHost.openScope();
    try {
      Run run = new Run(scope);
      run.execute(program.instructions);
      if (logger.isLoggable(Level.FINE))
        logger.fine("Program emitted " + run.emitted.length() + " characters");
      return run.emitted.endsWith("\n") ? run.emitted : run.emitted + "\n";
    } catch (Failure e) {
      ScriptException cause = e.scriptException;
      throw new RuntimeExecutionException(
          program.numberedListing(),
          program.lineOf(e.instruction),
          cause.getKind(),
          cause.getDetails(),
          cause);
    } finally {
      scope.close();
    }
  }

  private void validate(Program program) throws GeneratedProgramException {
    String problem = checkStructure(program.instructions);
    if (problem != null)
      throw new GeneratedProgramException(problem, program.numberedListing(), null);
    try {
      scriptHost.validateProgram(program);
    } catch (ScriptException e) {
      throw new GeneratedProgramException(e.getMessage(), program.numberedListing(), e);
    }
  }

  /**
   * Returns what is wrong with the structure of |instructions|, or null if nothing is.
   */
  static String checkStructure(List<Instruction> instructions) {
    if (instructions.isEmpty())
      return "the program is empty";
    Instruction last = instructions.get(instructions.size() - 1);
    if (!(last instanceof Instruction.Emit))
      return "the program doesn't end by emitting its output";
    StructureChecker checker = new StructureChecker();
    checker.check(instructions.subList(0, instructions.size() - 1));
    if (checker.problem == null)
      last.accept(checker);
    return checker.problem;
  }

  /**
   * Finds the first read of an accumulator or flag that hasn't been set yet, and any emit before
   * the end.
   */
  private static class StructureChecker implements Instruction.Visitor<Void> {
    private final Set<String> accumulators = new HashSet<String>();
    private final Set<String> flags = new HashSet<String>();
    private boolean emitted = false;
    private String problem = null;

    void check(List<Instruction> instructions) {
      for (Instruction instruction : instructions) {
        if (problem != null)
          return;
        instruction.accept(this);
      }
    }

    private void read(String accumulator) {
      if (problem == null && !accumulators.contains(accumulator))
        problem = "accumulator " + accumulator + " is used before being declared";
    }

    @Override
    public Void visitDeclare(Instruction.Declare declare) {
      accumulators.add(declare.accumulator);
      return null;
    }

    @Override
    public Void visitAppendText(Instruction.AppendText appendText) {
      read(appendText.accumulator);
      return null;
    }

    @Override
    public Void visitAppendAccumulator(Instruction.AppendAccumulator appendAccumulator) {
      read(appendAccumulator.accumulator);
      read(appendAccumulator.from);
      return null;
    }

    @Override
    public Void visitAppendLiteral(Instruction.AppendLiteral appendLiteral) {
      read(appendLiteral.accumulator);
      return null;
    }

    @Override
    public Void visitReplace(Instruction.Replace replace) {
      read(replace.accumulator);
      return null;
    }

    @Override
    public Void visitRun(Instruction.Run run) {
      return null;
    }

    @Override
    public Void visitWhile(Instruction.While loop) {
      check(loop.body);
      return null;
    }

    @Override
    public Void visitSetFlag(Instruction.SetFlag setFlag) {
      flags.add(setFlag.flag);
      return null;
    }

    @Override
    public Void visitIfFlag(Instruction.IfFlag ifFlag) {
      if (problem == null && !flags.contains(ifFlag.flag))
        problem = "flag " + ifFlag.flag + " is tested before being set";
      check(ifFlag.body);
      return null;
    }

    @Override
    public Void visitEmit(Instruction.Emit emit) {
      if (problem != null)
        return null;
      if (emitted)
        problem = "the program emits more than once";
      emitted = true;
      read(emit.accumulator);
      return null;
    }
  }

  /**
   * The state of one run of a program.
   */
  private static class Run implements Instruction.Visitor<Void> {
    private final ScriptHost.Scope scope;
    private final Map<String, StringBuilder> accumulators = new HashMap<String, StringBuilder>();
    private final Map<String, Boolean> flags = new HashMap<String, Boolean>();
    private String emitted = null;

    Run(ScriptHost.Scope scope) {
      this.scope = scope;
    }

    void execute(List<Instruction> instructions) {
      for (Instruction instruction : instructions)
        instruction.accept(this);
    }

    private StringBuilder accumulator(String name) {
      StringBuilder accumulator = accumulators.get(name);
      if (accumulator == null)
        throw new IllegalStateException("Accumulator " + name + " was never declared");
      return accumulator;
    }

    @Override
    public Void visitDeclare(Instruction.Declare declare) {
      accumulators.put(declare.accumulator, new StringBuilder());
      return null;
    }

    @Override
    public Void visitAppendText(Instruction.AppendText appendText) {
      accumulator(appendText.accumulator).append(appendText.text);
      return null;
    }

    @Override
    public Void visitAppendAccumulator(Instruction.AppendAccumulator appendAccumulator) {
      // Read first: appending an accumulator to itself doubles it.
      String from = accumulator(appendAccumulator.from).toString();
      accumulator(appendAccumulator.accumulator).append(from);
      return null;
    }

    @Override
    public Void visitAppendLiteral(Instruction.AppendLiteral appendLiteral) {
      try {
        accumulator(appendLiteral.accumulator).append(scope.evaluate(appendLiteral.literal));
      } catch (ScriptException e) {
        throw new Failure(appendLiteral, e);
      }
      return null;
    }

    @Override
    public Void visitReplace(Instruction.Replace replace) {
      String pattern;
      String replacement;
      try {
        pattern = scope.evaluate(replace.pattern);
        replacement = scope.evaluate(replace.replacement);
      } catch (ScriptException e) {
        throw new Failure(replace, e);
      }
      String replaced = accumulator(replace.accumulator).toString().replace(pattern, replacement);
      accumulators.put(replace.accumulator, new StringBuilder(replaced));
      return null;
    }

    @Override
    public Void visitRun(Instruction.Run run) {
      try {
        scope.run(run.snippet);
      } catch (ScriptException e) {
        throw new Failure(run, e);
      }
      return null;
    }

    @Override
    public Void visitWhile(Instruction.While loop) {
      while (guardHolds(loop))
        execute(loop.body);
      return null;
    }

    private boolean guardHolds(Instruction.While loop) {
      try {
        return scope.guardHolds(loop.cond);
      } catch (ScriptException e) {
        throw new Failure(loop, e);
      }
    }

    @Override
    public Void visitSetFlag(Instruction.SetFlag setFlag) {
      flags.put(setFlag.flag, setFlag.value);
      return null;
    }

    @Override
    public Void visitIfFlag(Instruction.IfFlag ifFlag) {
      if (Boolean.TRUE.equals(flags.get(ifFlag.flag)))
        execute(ifFlag.body);
      return null;
    }

    @Override
    public Void visitEmit(Instruction.Emit emit) {
      emitted = accumulator(emit.accumulator).toString();
      return null;
    }
  }
}
