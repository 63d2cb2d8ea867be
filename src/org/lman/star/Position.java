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

import org.lman.common.Struct;

/**
 * A location within a document: a 0-based character offset plus the 1-based line and column it
 * falls on.
 */
public class Position extends Struct {
  public final int offset;
  public final int line;
  public final int column;

  public Position(int offset, int line, int column) {
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  public String describe() {
    return "line " + line + ", column " + column;
  }
}
