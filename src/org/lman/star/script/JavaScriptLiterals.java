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

package org.lman.star.script;

import org.json.JSONObject;
import org.lman.star.literal.Literal;

/**
 * Turns quoted literals into JavaScript expressions that evaluate to their value.
 *
 * Plain, unicode and byte literals keep their body and quote, since JavaScript understands the
 * same backslash escapes. Raw literals are re-quoted so that backslashes stay as they are.
 * Formatted literals have each {expression} field spliced in as String(expression); {{ and }}
 * stand for literal braces.
 */
public class JavaScriptLiterals {

  private JavaScriptLiterals() {}

  public static String toExpression(Literal literal) throws ScriptException {
    if (!literal.isFormatted())
      return quote(literal, literal.body);

    StringBuilder expression = new StringBuilder("(");
    StringBuilder text = new StringBuilder();
    String body = literal.body;
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c == '{' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
        text.append('{');
        i += 2;
      } else if (c == '}' && i + 1 < body.length() && body.charAt(i + 1) == '}') {
        text.append('}');
        i += 2;
      } else if (c == '}') {
        throw syntaxError("single '}' is not allowed in a formatted literal", i);
      } else if (c == '{') {
        int end = closingBrace(body, i);
        String field = body.substring(i + 1, end);
        if (field.trim().isEmpty())
          throw syntaxError("empty expression in a formatted literal", i);
        expression.append(quote(literal, text.toString())).append(" + String(").append(field)
            .append(") + ");
        text.setLength(0);
        i = end + 1;
      } else {
        text.append(c);
        i++;
      }
    }
    return expression.append(quote(literal, text.toString())).append(')').toString();
  }

  private static int closingBrace(String body, int open) throws ScriptException {
    int depth = 0;
    for (int i = open; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0)
          return i;
      }
    }
    throw syntaxError("expecting '}' in a formatted literal", open);
  }

  private static String quote(Literal literal, String text) {
    if (literal.isRaw())
      return JSONObject.quote(text);
    return literal.quote + text + literal.quote;
  }

  private static ScriptException syntaxError(String details, int index) {
    return new ScriptException("SyntaxError", details, 1, index + 1, null);
  }
}
