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
 * Base class of every error raised while rendering a document. Each invocation reports at most
 * one of these: the first stage to fail ends it.
 */
public abstract class StarException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  protected StarException(String message) {
    super(message);
  }

  protected StarException(String message, Throwable cause) {
    super(message, cause);
  }
}
