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
import static org.junit.Assert.fail;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.CharacterCodingException;

import org.junit.Test;

public class StarReadTest {

  @Test
  public void readsUtf8() throws IOException {
    File file = write(new byte[] { 'c', 'a', 'f', (byte) 0xC3, (byte) 0xA9, '\n' });
    assertEquals("café\n", Star.read(file));
    assertEquals("café\n", new Star().render(file).text);
  }

  @Test
  public void rejectsMalformedUtf8() throws IOException {
    File file = write(new byte[] { 'a', (byte) 0xC3, '(', '\n' });
    try {
      new Star().render(file);
      fail("Expected malformed input to be rejected");
    } catch (CharacterCodingException expected) {
    }
  }

  private static File write(byte[] contents) throws IOException {
    File file = File.createTempFile("star", ".star");
    file.deleteOnExit();
    OutputStream out = new FileOutputStream(file);
    try {
      out.write(contents);
    } finally {
      out.close();
    }
    return file;
  }
}
