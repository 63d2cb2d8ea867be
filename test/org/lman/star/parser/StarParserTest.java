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

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;

import java.util.Collections;

import org.junit.Test;
import org.lman.star.Position;
import org.lman.star.literal.Literal;
import org.lman.star.script.RhinoScriptHost;
import org.lman.star.tree.Node;
import org.lman.star.tree.Repetition;
import org.lman.star.tree.Source;
import org.lman.star.tree.Substitution;
import org.lman.star.tree.Text;

public class StarParserTest {

  private final StarParser parser = new StarParser(new RhinoScriptHost());

  @Test
  public void textLines() {
    assertEquals(source(text("a"), text("  b")), parser.parse("a\n  b"));
    assertEquals(source(text("a"), text(""), text("b")), parser.parse("a\n\nb"));
    assertEquals(source(text("a"), text("")), parser.parse("a\n"));
    assertEquals(source(text("")), parser.parse(""));
  }

  @Test
  public void escapedMarkers() {
    assertEquals(source(text("<SUB* x")), parser.parse("\\<SUB* x"));
    assertEquals(source(text("  <*RPT>")), parser.parse("  \\<*RPT>"));
    // Only a marker can be escaped.
    assertEquals(source(text("\\n")), parser.parse("\\n"));
    assertEquals(source(text("a <SUB*")), parser.parse("a <SUB*"));
  }

  @Test
  public void substitution() {
    Source tree = parser.parse("<SUB* 'a' => 'b', r\"c\" => f'{d}'>\nx\n<*SUB>");
    Substitution expected = new Substitution(
        asList(
            new Substitution.Rule(Literal.of("a"), Literal.of("b")),
            new Substitution.Rule(new Literal("r", '"', "c"), new Literal("f", '\'', "{d}"))),
        source(text("x")),
        null);
    assertEquals(source(expected), tree);
  }

  @Test
  public void substitutionWithoutRules() {
    Source tree = parser.parse("  <SUB*  >\nx\n  <*SUB>");
    Substitution expected =
        new Substitution(Collections.<Substitution.Rule>emptyList(), source(text("x")), null);
    assertEquals(source(expected), tree);
  }

  @Test
  public void repetition() {
    Source tree = parser.parse("<RPT* `i = 0` | `i < 2` | | ', '>\n  y\n  <*RPT>");
    Repetition expected =
        new Repetition("i = 0", "i < 2", "", Literal.of(", "), source(text("  y")), null);
    assertEquals(source(expected), tree);
  }

  @Test
  public void nesting() {
    Source tree = parser.parse(
        "<SUB* 'x' => 'y'>\n" +
        "  <RPT* ``s = '`'`` | `false` | `` | ''>\n" +
        "  x\n" +
        "  <*RPT>\n" +
        "<*SUB>");
    Repetition inner = new Repetition(
        "s = '`'", "false", "", Literal.of(""), source(text("  x")), null);
    Substitution outer = new Substitution(
        asList(new Substitution.Rule(Literal.of("x"), Literal.of("y"))), source(inner), null);
    assertEquals(source(outer), tree);
  }

  @Test
  public void positions() {
    Source tree = parser.parse("a\n  <RPT* | `false` | | ''>\n  b\n  <*RPT>\nc");
    assertEquals(new Position(0, 1, 1), tree.position);
    assertEquals(new Position(0, 1, 1), tree.children.get(0).position);

    Repetition repetition = (Repetition) tree.children.get(1);
    assertEquals(new Position(2, 2, 1), repetition.position);
    assertEquals(3, repetition.body.children.get(0).position.line);
    assertEquals(5, tree.children.get(2).position.line);
  }

  private static Source source(Node... children) {
    return new Source(asList(children), null);
  }

  private static Text text(String line) {
    return new Text(line, null);
  }
}
