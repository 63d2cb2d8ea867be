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

import java.util.logging.Level;
import java.util.logging.Logger;

import org.lman.star.literal.Literal;
import org.lman.star.program.Program;
import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;
import org.mozilla.javascript.EcmaError;
import org.mozilla.javascript.JavaScriptException;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.Assignment;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.ParenthesizedExpression;

/**
 * A {@link ScriptHost} that runs snippets as JavaScript, with Mozilla Rhino in interpreted mode.
 *
 * Each scope is a fresh set of standard objects, so nothing leaks from one render into another.
 * Snippets share the scope's global variables: {@code i = 0} in an init snippet is visible to the
 * guard and the update.
 */
public class RhinoScriptHost implements ScriptHost {

  private static final Logger logger = Logger.getLogger(RhinoScriptHost.class.getName());

  private final int languageVersion;

  public RhinoScriptHost() {
    this(Context.VERSION_ES6);
  }

  /**
   * @param languageVersion one of the {@code Context.VERSION_*} constants
   */
  public RhinoScriptHost(int languageVersion) {
    if (!Context.isValidLanguageVersion(languageVersion))
      throw new IllegalArgumentException("Bad JavaScript language version: " + languageVersion);
    this.languageVersion = languageVersion;
  }

  private class RhinoScope implements Scope {
    private final Context context;
    private final Scriptable scope;
    private boolean closed = false;

    public RhinoScope(Context context, Scriptable scope) {
      this.context = context;
      this.scope = scope;
    }

    @Override
    public void run(String snippet) throws ScriptException {
      evaluate(snippet, "snippet");
    }

    @Override
    public boolean guardHolds(String cond) throws ScriptException {
      return Context.toBoolean(evaluate(cond, "guard"));
    }

    @Override
    public String evaluate(Literal literal) throws ScriptException {
      return Context.toString(evaluate(JavaScriptLiterals.toExpression(literal), "literal"));
    }

    private Object evaluate(String source, String sourceName) throws ScriptException {
      if (closed)
        throw new IllegalStateException("Scope is closed");
      try {
        return context.evaluateString(scope, source, sourceName, 1, null);
      } catch (RhinoException e) {
        throw runtimeError(e);
      }
    }

    @Override
    public void close() {
      if (closed)
        return;
      closed = true;
      Context.exit();
    }
  }

  @Override
  public void validate(String snippet) throws ScriptException {
    compile(snippet, "snippet");
  }

  @Override
  public void validateGuard(String snippet) throws ScriptException {
    if (snippet.trim().isEmpty())
      throw new ScriptException("SyntaxError", "the loop guard is empty", 0, 0, null);

    AstRoot root = parse(snippet, "guard");
    Node statement = root.getFirstChild();
    if (!(statement instanceof ExpressionStatement) || statement.getNext() != null) {
      throw new ScriptException(
          "SyntaxError", "the loop guard must be a single expression", 0, 0, null);
    }
    AstNode expression = ((ExpressionStatement) statement).getExpression();
    while (expression instanceof ParenthesizedExpression)
      expression = ((ParenthesizedExpression) expression).getExpression();
    if (expression instanceof Assignment) {
      throw new ScriptException(
          "SyntaxError",
          "the loop guard is an assignment, not a condition",
          expression.getLineno(),
          0,
          null);
    }

    // Also has to fit where it's going to be used.
    compile("while (" + snippet + "\n) {}", "guard");
  }

  @Override
  public void validateLiteral(Literal literal) throws ScriptException {
    compile(JavaScriptLiterals.toExpression(literal), "literal");
  }

  @Override
  public void validateProgram(Program program) throws ScriptException {
    String script = JavaScriptWriter.write(program);
    if (logger.isLoggable(Level.FINEST))
      logger.finest("Checking generated script:\n" + script);
    compile(script, "program");
  }

  @Override
  public Scope openScope() {
    Context context = enter();
    try {
      return new RhinoScope(context, context.initStandardObjects());
    } catch (RuntimeException e) {
      Context.exit();
      throw e;
    }
  }

  private Context enter() {
    Context context = ContextFactory.getGlobal().enterContext();
    context.setLanguageVersion(languageVersion);
    context.setOptimizationLevel(-1);
    return context;
  }

  private void compile(String source, String sourceName) throws ScriptException {
    Context context = enter();
    try {
      context.compileString(source, sourceName, 1, null);
    } catch (RhinoException e) {
      throw syntaxError(e);
    } finally {
      Context.exit();
    }
  }

  private AstRoot parse(String source, String sourceName) throws ScriptException {
    CompilerEnvirons environment = new CompilerEnvirons();
    environment.setLanguageVersion(languageVersion);
    try {
      return new Parser(environment).parse(source, sourceName, 1);
    } catch (RhinoException e) {
      throw syntaxError(e);
    }
  }

  private static ScriptException syntaxError(RhinoException e) {
    return new ScriptException("SyntaxError", e.details(), e.lineNumber(), e.columnNumber(), e);
  }

  private static ScriptException runtimeError(RhinoException e) {
    String kind;
    String details;
    if (e instanceof EcmaError) {
      kind = ((EcmaError) e).getName();
      details = ((EcmaError) e).getErrorMessage();
    } else if (e instanceof JavaScriptException) {
      kind = "Uncaught exception";
      details = e.details();
    } else {
      kind = e.getClass().getSimpleName();
      details = e.details();
    }
    return new ScriptException(kind, details, e.lineNumber(), e.columnNumber(), e);
  }
}
