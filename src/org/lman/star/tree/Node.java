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

import org.lman.common.Struct;
import org.lman.common.Transient;
import org.lman.star.Position;

/**
 * A node of a parsed document. The set of node types is closed: {@link Source}, {@link Text},
 * {@link Substitution} and {@link Repetition}. Code that needs to handle each of them goes through
 * a {@link Visitor}.
 *
 * Nodes are immutable. Their position is informational and doesn't take part in equality.
 */
public abstract class Node extends Struct {

  public interface Visitor<R> {
    R visitSource(Source source);
    R visitText(Text text);
    R visitSubstitution(Substitution substitution);
    R visitRepetition(Repetition repetition);
  }

  @Transient public final Position position;

  protected Node(Position position) {
    this.position = position;
  }

  public abstract <R> R accept(Visitor<R> visitor);
}
