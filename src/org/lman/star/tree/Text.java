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

/**
 * A single line of literal text, without its newline.
 */
public class Text extends Node {
  public final String line;

  public Text(String line, Position position) {
    super(position);
    this.line = line;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitText(this);
  }
}
