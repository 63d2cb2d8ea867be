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

import org.json.JSONStringer;
import org.lman.star.literal.Literal;

/**
 * Writes a document tree as JSON, for inspecting what the parser made of a document. Each node is
 * an object with an "id" of SOURCE, TEXT, SUB or RPT; literals are written as they appear in the
 * document.
 */
public class TreeJson {

  private TreeJson() {}

  public static String toJson(Node node) {
    JSONStringer out = new JSONStringer();
    writeJson(node, out);
    return out.toString();
  }

  private static void writeJson(Node node, final JSONStringer out) {
    node.accept(new Node.Visitor<Void>() {
      @Override
      public Void visitSource(Source source) {
        out.object().key("id").value("SOURCE").key("body").array();
        for (Node child : source.children)
          writeJson(child, out);
        out.endArray().endObject();
        return null;
      }

      @Override
      public Void visitText(Text text) {
        out.object().key("id").value("TEXT").key("body").value(text.line).endObject();
        return null;
      }

      @Override
      public Void visitSubstitution(Substitution substitution) {
        out.object().key("id").value("SUB").key("rules").array();
        for (Substitution.Rule rule : substitution.rules) {
          out.array()
              .value(literal(rule.pattern))
              .value(literal(rule.replacement))
              .endArray();
        }
        out.endArray().key("body");
        writeJson(substitution.body, out);
        out.endObject();
        return null;
      }

      @Override
      public Void visitRepetition(Repetition repetition) {
        out.object()
            .key("id").value("RPT")
            .key("init").value(repetition.init)
            .key("cond").value(repetition.cond)
            .key("update").value(repetition.update)
            .key("delimiter").value(literal(repetition.delimiter))
            .key("body");
        writeJson(repetition.body, out);
        out.endObject();
        return null;
      }
    });
  }

  private static String literal(Literal literal) {
    return literal.text();
  }
}
