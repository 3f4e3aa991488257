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

import java.io.IOException;
import java.io.OutputStream;
import javax.annotation.Nullable;

/** Writes task output to its log file and, when the output mode shows it, to the console. */
class TaskOutputWriter extends OutputStream {
  private final OutputStream logFile;
  @Nullable private final OutputStream console;

  TaskOutputWriter(OutputStream logFile, @Nullable OutputStream console) {
    this.logFile = logFile;
    this.console = console;
  }

  @Override
  public void write(int b) throws IOException {
    logFile.write(b);
    if (console != null) {
      console.write(b);
    }
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    logFile.write(b, off, len);
    if (console != null) {
      console.write(b, off, len);
    }
  }

  @Override
  public void flush() throws IOException {
    logFile.flush();
    if (console != null) {
      console.flush();
    }
  }

  @Override
  public void close() throws IOException {
    try {
      logFile.close();
    } finally {
      if (console != null) {
        console.close();
      }
    }
  }
}
