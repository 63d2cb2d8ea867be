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

package org.lman.star.parser;

import org.lman.star.Position;

/**
 * An immutable position within the input being parsed.
 */
public final class Cursor {
  public final String input;
  public final int offset;
  private final int line;
  private final int column;

  private Cursor(String input, int offset, int line, int column) {
    this.input = input;
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  public static Cursor start(String input) {
    return new Cursor(input, 0, 1, 1);
  }

  public boolean atEnd() {
    return offset == input.length();
  }

  public boolean startsWith(String prefix) {
    return input.startsWith(prefix, offset);
  }

  public Cursor advance(int length) {
    if (length == 0)
      return this;
    int end = offset + length;
    if (length < 0 || end > input.length())
      throw new IndexOutOfBoundsException("Can't advance " + length + " from " + offset);
    int newLine = line;
    int newColumn = column;
    for (int i = offset; i < end; i++) {
      if (input.charAt(i) == '\n') {
        newLine++;
        newColumn = 1;
      } else {
        newColumn++;
      }
    }
    return new Cursor(input, end, newLine, newColumn);
  }

  public Position position() {
    return new Position(offset, line, column);
  }

  @Override
  public String toString() {
    return "Cursor(" + offset + ")";
  }
}
