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

import org.lman.star.Position;

/**
 * A sequence of text lines and blocks. Children are rendered in order, joined by newlines.
 */
public class Source extends Node {
  public final List<Node> children;

  public Source(List<? extends Node> children, Position position) {
    super(position);
    this.children = Collections.unmodifiableList(new ArrayList<Node>(children));
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitSource(this);
  }
}
