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
 * Thrown when a generated program fails its structural check before running. This always points at
 * a bug in the parser or the generator, never at the document.
 */
public class GeneratedProgramException extends StarException {
  private static final long serialVersionUID = 1L;

  private final String listing;

  public GeneratedProgramException(String problem, String listing, Throwable cause) {
    super("Internal error, the generated program is invalid: " + problem + "\n" + listing, cause);
    this.listing = listing;
  }

  /**
   * The generated program with line numbers.
   */
  public String getListing() {
    return listing;
  }
}
