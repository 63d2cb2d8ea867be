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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lman.common.Struct;
import org.lman.star.Position;
import org.lman.star.literal.Literal;

/**
 * <pre>
 * &lt;SUB* 'pattern' => 'replacement', ... &gt;
 * body
 * &lt;*SUB&gt;
 * </pre>
 * Renders the body, then applies each rule in turn to the result of the previous one.
 */
public class Substitution extends Node {

  public static class Rule extends Struct {
    public final Literal pattern;
    public final Literal replacement;

    public Rule(Literal pattern, Literal replacement) {
      this.pattern = pattern;
      this.replacement = replacement;
    }
  }

  public final List<Rule> rules;
  public final Source body;

  public Substitution(List<Rule> rules, Source body, Position position) {
    super(position);
    this.rules = Collections.unmodifiableList(new ArrayList<Rule>(rules));
    this.body = body;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitSubstitution(this);
  }
}
