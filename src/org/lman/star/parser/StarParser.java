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

package org.lman.star.parser;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.lman.star.ParseException;
import org.lman.star.Position;
import org.lman.star.SnippetSyntaxException;
import org.lman.star.literal.Literal;
import org.lman.star.literal.LiteralGrammar;
import org.lman.star.script.ScriptException;
import org.lman.star.script.ScriptHost;
import org.lman.star.tree.Node;
import org.lman.star.tree.Repetition;
import org.lman.star.tree.Source;
import org.lman.star.tree.Substitution;
import org.lman.star.tree.Text;

/**
 * Parses a STAR document into a {@link Source} tree.
 *
 * A document is a sequence of lines. A line is either text, or starts a block:
 * <pre>
 * &lt;SUB* 'a' => 'b', "c" => "d"&gt;
 * ...
 * &lt;*SUB&gt;
 *
 * &lt;RPT* `i = 0` | `i &lt; 3` | `i++` | ', '&gt;
 * ...
 * &lt;*RPT&gt;
 * </pre>
 * Block markers may only be preceded by whitespace on their line. A backslash in front of a marker
 * at the start of a line makes the line plain text, and the backslash is dropped.
 *
 * Snippets and literals are checked with the {@link ScriptHost} as soon as they're parsed; a bad
 * one fails the whole parse with a {@link SnippetSyntaxException}.
 */
public class StarParser {

  private static final Logger logger = Logger.getLogger(StarParser.class.getName());

  private static final String OPEN_SUB = "<SUB*";
  private static final String CLOSE_SUB = "<*SUB>";
  private static final String OPEN_RPT = "<RPT*";
  private static final String CLOSE_RPT = "<*RPT>";

  private static final Parser<String> WS = Parser.regex("[^\\S\n]*+", "whitespace");
  private static final Parser<String> NEWLINE = Parser.string("\n").desc("newline");
  private static final Parser<String> REST_OF_LINE = Parser.regex("[^\n]*+", "text");

  private static final Parser<String> OPENING_TAG =
      Parser.stringFrom("opening tag", OPEN_SUB, OPEN_RPT);
  private static final Parser<String> CLOSING_TAG =
      Parser.stringFrom("closing tag", CLOSE_SUB, CLOSE_RPT);

  private static final Parser<Void> NOT_TAG = Parser.peek(WS
      .then(Parser.notAt(OPENING_TAG, "text line"))
      .then(Parser.notAt(CLOSING_TAG, "text line")));

  private static final Parser<String> ESCAPED_TAG =
      Parser.string("\\").then(OPENING_TAG.or(CLOSING_TAG)).optional("");

  private static final Parser<String> SNIPPET = LiteralGrammar.CODE.optional("");

  private final ScriptHost scriptHost;
  private final Parser<Source> source;

  public StarParser(ScriptHost scriptHost) {
    this.scriptHost = scriptHost;

    Parser.Reference<Source> sourceRef = new Parser.Reference<Source>();
    final Parser<List<Node>> elements =
        textLine().or(subBlock(sourceRef)).or(rptBlock(sourceRef)).sepBy(NEWLINE);
    sourceRef.set(new Parser<Source>() {
      @Override
      protected Result<Source> apply(Cursor cursor) {
        Result<List<Node>> result = elements.parse(cursor);
        if (!result.isSuccess())
          return result.asFailure();
        return Result.success(new Source(result.getValue(), cursor.position()), result.getNext())
            .aggregate(result);
      }
    });
    this.source = sourceRef;
  }

  /**
   * Parses the whole of |document|.
   */
  public Source parse(String document) throws ParseException, SnippetSyntaxException {
    Source tree = source.parseFully(document);
    if (logger.isLoggable(Level.FINE))
      logger.fine("Parsed " + tree.children.size() + " top-level nodes");
    return tree;
  }

  private static Parser<Node> textLine() {
    return new Parser<Node>() {
      @Override
      protected Result<Node> apply(Cursor cursor) {
        Parser.Sequence seq = new Parser.Sequence(cursor);
        seq.next(NOT_TAG);
        String indent = seq.next(WS);
        String escapedTag = seq.next(ESCAPED_TAG);
        String rest = seq.next(REST_OF_LINE);
        if (seq.failed())
          return seq.failure();
        return seq.success((Node) new Text(indent + escapedTag + rest, cursor.position()));
      }
    };
  }

  private Parser<Node> subBlock(final Parser<Source> body) {
    final Parser<Substitution.Rule> rule = new Parser<Substitution.Rule>() {
      @Override
      protected Result<Substitution.Rule> apply(Cursor cursor) {
        Parser.Sequence seq = new Parser.Sequence(cursor);
        seq.next(WS);
        Cursor patternAt = seq.cursor();
        Literal pattern = seq.next(LiteralGrammar.QUOTED);
        seq.next(WS.then(Parser.string("=>")).then(WS));
        Cursor replacementAt = seq.cursor();
        Literal replacement = seq.next(LiteralGrammar.QUOTED);
        if (seq.failed())
          return seq.failure();
        validateLiteral(pattern, patternAt);
        validateLiteral(replacement, replacementAt);
        return seq.success(new Substitution.Rule(pattern, replacement));
      }
    }.desc("substitution rule");
    final Parser<List<Substitution.Rule>> rules = rule.sepBy(Parser.string(","));

    return new Parser<Node>() {
      @Override
      protected Result<Node> apply(Cursor cursor) {
        Parser.Sequence seq = new Parser.Sequence(cursor);
        seq.next(WS.then(Parser.string(OPEN_SUB)));
        List<Substitution.Rule> parsedRules = seq.next(rules);
        seq.next(WS.then(Parser.string(">")).then(NEWLINE));
        Source parsedBody = seq.next(body);
        if (seq.failed())
          return seq.failure();
        closeBlock(seq, CLOSE_SUB, cursor);
        if (seq.failed())
          return seq.failure();
        return seq.success((Node) new Substitution(parsedRules, parsedBody, cursor.position()));
      }
    };
  }

  private Parser<Node> rptBlock(final Parser<Source> body) {
    final Parser<String> bar = WS.then(Parser.string("|")).then(WS);

    return new Parser<Node>() {
      @Override
      protected Result<Node> apply(Cursor cursor) {
        Parser.Sequence seq = new Parser.Sequence(cursor);
        seq.next(WS.then(Parser.string(OPEN_RPT)).then(WS));
        if (seq.failed())
          return seq.failure();

        Cursor initAt = seq.cursor();
        String init = seq.next(SNIPPET);
        if (seq.failed())
          return seq.failure();
        if (!init.isEmpty())
          validateSnippet(init, initAt);

        seq.next(bar);
        Cursor condAt = seq.cursor();
        String cond = seq.next(SNIPPET);
        if (seq.failed())
          return seq.failure();
        validateGuard(cond, condAt);

        seq.next(bar);
        Cursor updateAt = seq.cursor();
        String update = seq.next(SNIPPET);
        if (seq.failed())
          return seq.failure();
        if (!update.isEmpty())
          validateSnippet(update, updateAt);

        seq.next(bar);
        Cursor delimiterAt = seq.cursor();
        Literal delimiter = seq.next(LiteralGrammar.QUOTED);
        if (seq.failed())
          return seq.failure();
        validateLiteral(delimiter, delimiterAt);

        seq.next(WS.then(Parser.string(">")).then(NEWLINE));
        Source parsedBody = seq.next(body);
        if (seq.failed())
          return seq.failure();
        closeBlock(seq, CLOSE_RPT, cursor);
        if (seq.failed())
          return seq.failure();
        return seq.success((Node) new Repetition(
            init, cond, update, delimiter, parsedBody, cursor.position()));
      }
    };
  }

  /**
   * Parses the line that closes a block opened at |openedAt|.
   */
  private static void closeBlock(Parser.Sequence seq, String closingTag, Cursor openedAt) {
    seq.next(NEWLINE.then(WS).then(Parser.string(closingTag)).desc(
        "'" + closingTag + "' closing the block opened at line " + openedAt.position().line));
  }

  private void validateSnippet(String snippet, Cursor at) {
    try {
      scriptHost.validate(snippet);
    } catch (ScriptException e) {
      throw snippetSyntaxException(snippet, e, at);
    }
  }

  private void validateGuard(String snippet, Cursor at) {
    try {
      scriptHost.validateGuard(snippet);
    } catch (ScriptException e) {
      throw snippetSyntaxException(snippet, e, at);
    }
  }

  private void validateLiteral(Literal literal, Cursor at) {
    try {
      scriptHost.validateLiteral(literal);
    } catch (ScriptException e) {
      throw snippetSyntaxException(literal.text(), e, at);
    }
  }

  private static SnippetSyntaxException snippetSyntaxException(
      String snippet, ScriptException e, Cursor at) {
    Position position = at.position();
    logger.log(Level.FINE, "Rejected snippet at " + position.describe(), e);
    SnippetSyntaxException exception =
        new SnippetSyntaxException(snippet, e.getDetails(), position, e.getColumn());
    exception.initCause(e);
    return exception;
  }
}
