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

import org.lman.star.literal.Literal;
import org.lman.star.program.Program;

/**
 * Checks and runs the code embedded in a document: the init/cond/update snippets of repetitions,
 * and the quoted literals of substitution rules and repetition delimiters.
 *
 * The validate methods only parse, they never run anything. Running happens in a {@link Scope},
 * which holds the variables snippets set up; every render gets a fresh one.
 */
public interface ScriptHost {

  /**
   * A set of variables that snippets run against. Must be closed when done, and only used from
   * the thread that opened it.
   */
  interface Scope {
    /**
     * Runs |snippet| once, for its side effects.
     */
    void run(String snippet) throws ScriptException;

    /**
     * Evaluates the loop guard |cond| and returns whether it holds.
     */
    boolean guardHolds(String cond) throws ScriptException;

    /**
     * Evaluates |literal| to its string value.
     */
    String evaluate(Literal literal) throws ScriptException;

    void close();
  }

  /**
   * Checks that |snippet| is valid on its own.
   */
  void validate(String snippet) throws ScriptException;

  /**
   * Checks that |snippet| is valid as the guard of a loop.
   */
  void validateGuard(String snippet) throws ScriptException;

  /**
   * Checks that |literal| can be evaluated.
   */
  void validateLiteral(Literal literal) throws ScriptException;

  /**
   * Checks that a whole generated program is well formed, without running it.
   */
  void validateProgram(Program program) throws ScriptException;

  Scope openScope();
}
