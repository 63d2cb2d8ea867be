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

import static org.junit.Assert.assertEquals;

import java.io.File;

import org.lman.star.program.Program;
import org.lman.star.tree.Source;

/**
 * Renders every document twice through the separate stages of one {@link Star}; both renders must
 * agree with each other, and with the expected output.
 */
public class StagedStarTest extends AbstractStarTest {

  private final Star star = new Star();

  @Override
  protected String render(File document) throws Exception {
    String contents = Star.read(document);

    Source tree = star.parse(contents);
    assertEquals(tree, star.parse(contents));

    Program program = star.generate(tree);
    assertEquals(program, star.generate(star.parse(contents)));

    String first = star.execute(program);
    assertEquals(first, star.execute(program));
    return first;
  }
}
