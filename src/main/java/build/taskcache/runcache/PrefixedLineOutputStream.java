// Copyright 2026 The TaskCache Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package build.taskcache.runcache;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;

/**
 * Writes each complete line to a console with a prefix. A trailing partial line is written when
 * the stream is flushed by {@link #close}.
 */
class PrefixedLineOutputStream extends OutputStream {
  private final String prefix;
  private final PrintStream console;
  private final ByteArrayOutputStream line = new ByteArrayOutputStream();

  PrefixedLineOutputStream(String prefix, PrintStream console) {
    this.prefix = prefix;
    this.console = console;
  }

  @Override
  public synchronized void write(int b) {
    if (b == '\n') {
      emitLine();
    } else {
      line.write(b);
    }
  }

  @Override
  public synchronized void write(byte[] b, int off, int len) {
    int start = off;
    int end = off + len;
    for (int i = off; i < end; i++) {
      if (b[i] == '\n') {
        line.write(b, start, i - start);
        emitLine();
        start = i + 1;
      }
    }
    line.write(b, start, end - start);
  }

  private void emitLine() {
    String text = new String(line.toByteArray(), UTF_8);
    if (text.endsWith("\r")) {
      text = text.substring(0, text.length() - 1);
    }
    console.println(prefix + text);
    line.reset();
  }

  @Override
  public synchronized void flush() {
    console.flush();
  }

  @Override
  public synchronized void close() {
    if (line.size() > 0) {
      emitLine();
    }
    console.flush();
  }
}
