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

package org.lman.star.tree;

import org.lman.star.Position;
import org.lman.star.literal.Literal;

/**
 * <pre>
 * &lt;RPT* `init` | `cond` | `update` | 'delimiter' &gt;
 * body
 * &lt;*RPT&gt;
 * </pre>
 * Runs {@link #init}, then renders the body for as long as {@link #cond} holds, running
 * {@link #update} after each rendering. Renderings are joined by the delimiter.
 *
 * The snippets are kept as written, without the backticks. {@link #init} and {@link #update} may
 * be empty.
 */
public class Repetition extends Node {
  public final String init;
  public final String cond;
  public final String update;
  public final Literal delimiter;
  public final Source body;

  public Repetition(
      String init,
      String cond,
      String update,
      Literal delimiter,
      Source body,
      Position position) {
    super(position);
    this.init = init;
    this.cond = cond;
    this.update = update;
    this.delimiter = delimiter;
    this.body = body;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitRepetition(this);
  }
}
