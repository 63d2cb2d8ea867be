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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.lman.common.Struct;
import org.lman.star.parser.StarParser;
import org.lman.star.program.Executor;
import org.lman.star.program.Program;
import org.lman.star.program.ProgramGenerator;
import org.lman.star.script.RhinoScriptHost;
import org.lman.star.script.ScriptHost;
import org.lman.star.tree.Source;

/**
 * Substitute Text And Repeat: renders documents marked up with substitution and repetition blocks.
 *
 * Rendering a document goes through three stages, each of which is exposed on its own so that the
 * intermediate results can be inspected:
 *   * {@link #parse} turns the document into a tree of text lines and blocks.
 *   * {@link #generate} lowers the tree into a program.
 *   * {@link #execute} runs the program and returns the rendered text.
 *
 * Each stage completes before the next starts, and the first error ends the render. A {@code Star}
 * holds no per-document state and may render any number of documents, one at a time.
 */
public class Star {

  private static final Logger logger = Logger.getLogger(Star.class.getName());

  /**
   * Return value from {@link Star#render}.
   */
  public static class RenderResult extends Struct {
    public final String text;

    public RenderResult(String text) {
      this.text = text;
    }
  }

  private final StarParser parser;
  private final ProgramGenerator generator;
  private final Executor executor;

  /**
   * Creates a {@code Star} running embedded snippets as JavaScript.
   */
  public Star() {
    this(new RhinoScriptHost());
  }

  public Star(ScriptHost scriptHost) {
    this.parser = new StarParser(scriptHost);
    this.generator = new ProgramGenerator();
    this.executor = new Executor(scriptHost);
  }

  public Source parse(String document) throws ParseException, SnippetSyntaxException {
    return parser.parse(document);
  }

  public Program generate(Source tree) {
    return generator.generate(tree);
  }

  public String execute(Program program)
      throws GeneratedProgramException, RuntimeExecutionException {
    return executor.execute(program);
  }

  /**
   * Renders |document|.
   */
  public RenderResult render(String document) throws StarException {
    long start = System.currentTimeMillis();
    Source tree = parse(document);
    Program program = generate(tree);
    String text = execute(program);
    if (logger.isLoggable(Level.FINE))
      logger.fine("Rendered document in " + (System.currentTimeMillis() - start) + "ms");
    return new RenderResult(text);
  }

  /**
   * Renders the UTF-8 document in |file|. Throws an {@link IOException} if it isn't valid UTF-8.
   */
  public RenderResult render(File file) throws IOException, StarException {
    return render(read(file));
  }

  /**
   * Reads the whole of |file| as UTF-8. Malformed input is an error rather than being replaced.
   */
  public static String read(File file) throws IOException {
    StringBuilder contents = new StringBuilder();
    InputStream in = new FileInputStream(file);
    try {
      CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT);
      Reader reader = new InputStreamReader(in, decoder);
      char[] buf = new char[4096];
      int read;
      while ((read = reader.read(buf)) != -1)
        contents.append(buf, 0, read);
    } finally {
      in.close();
    }
    return contents.toString();
  }
}
