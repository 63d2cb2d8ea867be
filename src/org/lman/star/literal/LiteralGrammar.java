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

package org.lman.star.literal;

import org.lman.star.parser.Cursor;
import org.lman.star.parser.Parser;
import org.lman.star.parser.Result;

/**
 * The two kinds of token found inside block markers: quoted string literals and backtick-delimited
 * code. Neither may span a line.
 */
public class LiteralGrammar {

  private LiteralGrammar() {}

  // Two-letter prefixes first, so that rb'x' isn't read as r followed by junk.
  private static final Parser<String> PREFIX = Parser.stringFrom(
      "string literal prefix",
      "fr", "Fr", "fR", "FR", "rf", "rF", "Rf", "RF",
      "br", "Br", "bR", "BR", "rb", "rB", "Rb", "RB",
      "r", "u", "R", "U", "f", "F", "b", "B").optional("");

  private static final Parser<String> SINGLE_QUOTED = Parser.regex(
      "'((?:\\\\'|\\\\\\\\|[^'\n])*+)'", "single-quoted string literal");

  private static final Parser<String> DOUBLE_QUOTED = Parser.regex(
      "\"((?:\\\\\"|\\\\\\\\|[^\"\n])*+)\"", "double-quoted string literal");

  /**
   * A quoted string literal with an optional prefix.
   */
  public static final Parser<Literal> QUOTED = new Parser<Literal>() {
    @Override
    protected Result<Literal> apply(Cursor cursor) {
      Parser.Sequence seq = new Parser.Sequence(cursor);
      String prefix = seq.next(PREFIX);
      String quoted = seq.next(SINGLE_QUOTED.or(DOUBLE_QUOTED));
      if (seq.failed())
        return seq.failure();
      return seq.success(
          new Literal(prefix, quoted.charAt(0), quoted.substring(1, quoted.length() - 1)));
    }
  }.desc("string literal");

  private static final Parser<String> DOUBLE_TICKED = Parser.regex(
      "``((?:[^`\n]|`(?!`(?!`)))*+)``", "double-backticked code");

  private static final Parser<String> SINGLE_TICKED = Parser.regex(
      "`([^`\n]*+)`", "backticked code");

  /**
   * A code literal, yielding the code between the backticks. The double-backtick form is tried
   * first so that {@code ``a`b``} isn't read as an empty single-backtick literal.
   */
  public static final Parser<String> CODE = DOUBLE_TICKED
      .map(new Parser.Mapper<String, String>() {
        @Override
        public String map(String value) {
          return value.substring(2, value.length() - 2);
        }
      })
      .or(SINGLE_TICKED.map(new Parser.Mapper<String, String>() {
        @Override
        public String map(String value) {
          return value.substring(1, value.length() - 1);
        }
      }))
      .desc("code literal");
}
