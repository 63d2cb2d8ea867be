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
 * Thrown when an embedded snippet fails while the generated program runs. Nothing is rendered.
 */
public class RuntimeExecutionException extends StarException {
  private static final long serialVersionUID = 1L;

  private final String listing;
  private final int line;
  private final String kind;
  private final String details;

  /**
   * @param listing the generated program with line numbers
   * @param line the listing line of the instruction that failed
   * @param kind the kind of failure, e.g. "ReferenceError"
   * @param details the failure message
   */
  public RuntimeExecutionException(
      String listing, int line, String kind, String details, Throwable cause) {
    super("Encountered an error while executing the generated program at line " + line + ": " +
        kind + ": " + details + "\n" + listing, cause);
    this.listing = listing;
    this.line = line;
    this.kind = kind;
    this.details = details;
  }

  public String getListing() {
    return listing;
  }

  public int getLine() {
    return line;
  }

  public String getKind() {
    return kind;
  }

  public String getDetails() {
    return details;
  }
}
