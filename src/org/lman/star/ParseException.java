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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Thrown if the markup of a document is malformed, e.g. a block that is never closed.
 */
public class ParseException extends StarException {
  private static final long serialVersionUID = 1L;

  private final List<String> expected;
  private final Position position;

  public ParseException(Collection<String> expected, Position position) {
    super("Expected " + join(expected) + " at " + position.describe());
    this.expected = Collections.unmodifiableList(new ArrayList<String>(expected));
    this.position = position;
  }

  /**
   * Descriptions of the constructs that would have been accepted at {@link #getPosition}.
   */
  public List<String> getExpected() {
    return expected;
  }

  public Position getPosition() {
    return position;
  }

  private static String join(Collection<String> expected) {
    if (expected.isEmpty())
      return "nothing";
    if (expected.size() == 1)
      return expected.iterator().next();
    StringBuilder buf = new StringBuilder("one of ");
    boolean needsComma = false;
    for (String description : expected) {
      if (needsComma)
        buf.append(", ");
      else
        needsComma = true;
      buf.append(description);
    }
    return buf.toString();
  }
}
