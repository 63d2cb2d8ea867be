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

package org.lman.star;

/**
 * Thrown at parse time when an embedded snippet or literal is rejected by the script host's syntax
 * check.
 */
public class SnippetSyntaxException extends StarException {
  private static final long serialVersionUID = 1L;

  private final String snippet;
  private final String problem;
  private final Position position;
  private final int snippetColumn;

  /**
   * @param snippet the rejected snippet, as written in the document
   * @param problem the script host's description of what is wrong with it
   * @param position where the snippet starts in the document
   * @param snippetColumn 1-based column of the problem inside the snippet, or 0 if unknown
   */
  public SnippetSyntaxException(
      String snippet, String problem, Position position, int snippetColumn) {
    super("Invalid snippet `" + snippet + "` at " + position.describe() + ": " + problem +
        (snippetColumn > 0 ? " (column " + snippetColumn + " of the snippet)" : ""));
    this.snippet = snippet;
    this.problem = problem;
    this.position = position;
    this.snippetColumn = snippetColumn;
  }

  public String getSnippet() {
    return snippet;
  }

  public String getProblem() {
    return problem;
  }

  public Position getPosition() {
    return position;
  }

  public int getSnippetColumn() {
    return snippetColumn;
  }
}
