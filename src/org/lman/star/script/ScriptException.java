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

/**
 * Thrown by a {@link ScriptHost} when a snippet doesn't parse, or fails while running.
 */
public class ScriptException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String kind;
  private final String details;
  private final int line;
  private final int column;

  /**
   * @param kind the kind of error, e.g. "SyntaxError"
   * @param details what went wrong
   * @param line 1-based line within the snippet, or 0 if unknown
   * @param column 1-based column within the snippet, or 0 if unknown
   */
  public ScriptException(String kind, String details, int line, int column, Throwable cause) {
    super(kind + ": " + details, cause);
    this.kind = kind;
    this.details = details;
    this.line = line;
    this.column = column;
  }

  public String getKind() {
    return kind;
  }

  public String getDetails() {
    return details;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
