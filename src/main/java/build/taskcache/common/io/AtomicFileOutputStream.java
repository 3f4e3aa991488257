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

package build.taskcache.common.io;

import static com.google.common.base.Preconditions.checkState;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * An output stream that presents its target file only on successful close.
 *
 * <p>Writes are performed to a hidden temporary sibling with a unique suffix. On close(), if
 * {@link #onSuccess()} was called, the temporary file is renamed over the target. Otherwise the
 * temporary file is deleted and the target is untouched, so readers never observe a partially
 * written file.
 *
 * <pre>{@code
 * try (AtomicFileOutputStream out = new AtomicFileOutputStream(target)) {
 *   out.write(bytes);
 *   out.onSuccess();
 * }
 * }</pre>
 *
 * <p>No thread safety of onSuccess() and close() is guaranteed.
 */
public class AtomicFileOutputStream extends BufferedOutputStream {
  public static final int DEFAULT_BUFFER_SIZE = 1 << 20;

  private final Path target;
  private final Path temp;
  private boolean closed = false;
  private boolean success = false;

  private static Path createSiblingRandomUUIDTemp(Path target) {
    String suffix = UUID.randomUUID().toString();
    String filename = target.getFileName().toString();
    return target.resolveSibling("." + filename + "." + suffix + ".tmp");
  }

  public AtomicFileOutputStream(Path target) throws IOException {
    this(target, DEFAULT_BUFFER_SIZE);
  }

  public AtomicFileOutputStream(Path target, int bufferSize) throws IOException {
    this(target, createSiblingRandomUUIDTemp(target), bufferSize);
  }

  private AtomicFileOutputStream(Path target, Path temp, int bufferSize) throws IOException {
    super(Files.newOutputStream(temp), bufferSize);
    checkState(!target.equals(temp));
    this.target = target;
    this.temp = temp;
  }

  public Path getTarget() {
    return target;
  }

  public void onSuccess() {
    success = true;
  }

  /**
   * Flushes and closes the stream, then renames the temporary file over the target if the write
   * was marked successful. The temporary file never survives this call.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;

    try {
      super.close();
      if (success) {
        replace();
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private void replace() throws IOException {
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
