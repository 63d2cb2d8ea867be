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

import org.lman.common.Struct;

/**
 * A quoted string literal as written in a document, e.g. {@code 'a'}, {@code r"\d"} or
 * {@code f'{i}'}. The literal is kept uninterpreted: its value is only worked out when the script
 * host evaluates it.
 */
public class Literal extends Struct {
  /** The prefix letters, possibly empty, e.g. "rb". */
  public final String prefix;
  /** The quote character, ' or ". */
  public final char quote;
  /** Everything between the quotes, escapes untouched. */
  public final String body;

  public Literal(String prefix, char quote, String body) {
    if (quote != '\'' && quote != '"')
      throw new IllegalArgumentException("Not a quote: " + quote);
    this.prefix = prefix;
    this.quote = quote;
    this.body = body;
  }

  /**
   * A plain single-quoted literal whose value is |value|.
   */
  public static Literal of(String value) {
    return new Literal("", '\'', value.replace("\\", "\\\\").replace("'", "\\'"));
  }

  public boolean isRaw() {
    return hasPrefix('r');
  }

  public boolean isFormatted() {
    return hasPrefix('f');
  }

  public boolean isBytes() {
    return hasPrefix('b');
  }

  private boolean hasPrefix(char letter) {
    return prefix.toLowerCase().indexOf(letter) >= 0;
  }

  /**
   * The literal exactly as it appeared in the document.
   */
  public String text() {
    return prefix + quote + body + quote;
  }
}
