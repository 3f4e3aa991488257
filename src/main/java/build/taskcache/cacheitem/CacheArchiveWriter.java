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

package build.taskcache.cacheitem;

import static com.google.common.base.Preconditions.checkState;

import build.taskcache.common.UnixPaths;
import build.taskcache.common.io.AtomicFileOutputStream;
import com.github.luben.zstd.ZstdOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributes;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;

/**
 * Writes a cache artifact: a GNU tar stream, zstd compressed when the target name ends in {@code
 * .zst}.
 *
 * <p>Entry metadata is normalized so that the same file contents always produce the same bytes:
 * owner and group are 0 with empty names and every timestamp is the epoch. Only regular files,
 * directories and symlinks are accepted. Entry names use forward slashes and directories carry a
 * trailing slash.
 *
 * <p>Output goes to a hidden temporary sibling of the target and is renamed into place by {@link
 * #finish()}. Closing a writer that was not finished discards it.
 */
@Log
public class CacheArchiveWriter implements Closeable {
  public static final String COMPRESSED_EXTENSION = ".zst";

  private static final FileTime EPOCH = FileTime.fromMillis(0);

  @Nullable private final Path target;
  // null when writing to a caller supplied stream
  @Nullable private final AtomicFileOutputStream fileOut;
  private final TarArchiveOutputStream tar;
  private boolean finished = false;
  private boolean closed = false;

  private CacheArchiveWriter(
      @Nullable Path target, @Nullable AtomicFileOutputStream fileOut, OutputStream out) {
    this.target = target;
    this.fileOut = fileOut;
    this.tar = new TarArchiveOutputStream(out, "UTF-8");
    tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_GNU);
    tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_STAR);
  }

  public static CacheArchiveWriter create(Path target) throws IOException {
    AtomicFileOutputStream fileOut = new AtomicFileOutputStream(target);
    OutputStream out = fileOut;
    if (isCompressed(target)) {
      try {
        out = new ZstdOutputStream(fileOut);
      } catch (IOException e) {
        fileOut.close();
        throw e;
      }
    }
    return new CacheArchiveWriter(target, fileOut, out);
  }

  /** Writes an archive to {@code out}, which is closed with the writer. */
  public static CacheArchiveWriter create(OutputStream out, boolean compressed)
      throws IOException {
    return new CacheArchiveWriter(null, null, compressed ? new ZstdOutputStream(out) : out);
  }

  static boolean isCompressed(Path path) {
    return path.getFileName().toString().endsWith(COMPRESSED_EXTENSION);
  }

  @Nullable
  public Path getTarget() {
    return target;
  }

  /** Adds the file at {@code anchor/path} under the entry name {@code path}. */
  public void add(Path anchor, String path) throws IOException {
    addFile(path, anchor.resolve(path));
  }

  /**
   * Adds {@code source} to the archive under {@code name}.
   *
   * @throws UnsupportedFileTypeException if {@code source} is not a regular file, directory or
   *     symlink
   */
  public void addFile(String name, Path source) throws IOException {
    checkState(!finished && !closed, "archive is no longer writable");
    String entryName = UnixPaths.toUnixPath(name);
    BasicFileAttributes attributes =
        Files.readAttributes(source, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);

    TarArchiveEntry entry;
    if (attributes.isDirectory()) {
      entry = new TarArchiveEntry(entryName + "/", TarConstants.LF_DIR);
      entry.setMode(modeOf(source, FileModes.DEFAULT_DIRECTORY_MODE));
    } else if (attributes.isSymbolicLink()) {
      entry = new TarArchiveEntry(entryName, TarConstants.LF_SYMLINK);
      entry.setLinkName(UnixPaths.toUnixPath(Files.readSymbolicLink(source)));
      entry.setMode(FileModes.SYMLINK_MODE);
    } else if (attributes.isRegularFile()) {
      entry = new TarArchiveEntry(entryName, TarConstants.LF_NORMAL);
      entry.setMode(
          modeOf(
              source,
              Files.isExecutable(source)
                  ? FileModes.DEFAULT_EXECUTABLE_MODE
                  : FileModes.DEFAULT_FILE_MODE));
      entry.setSize(attributes.size());
    } else {
      throw new UnsupportedFileTypeException(entryName, attributes.isOther() ? "other" : "unknown");
    }
    normalize(entry);

    tar.putArchiveEntry(entry);
    if (attributes.isRegularFile()) {
      try (InputStream in = Files.newInputStream(source)) {
        long copied = in.transferTo(tar);
        if (copied != attributes.size()) {
          throw new IOException(
              String.format(
                  "%s changed while being archived: expected %d bytes, read %d",
                  source, attributes.size(), copied));
        }
      }
    }
    tar.closeArchiveEntry();
  }

  private static void normalize(TarArchiveEntry entry) {
    entry.setUserId(0);
    entry.setGroupId(0);
    entry.setUserName("");
    entry.setGroupName("");
    entry.setModTime(EPOCH);
  }

  private static int modeOf(Path source, int defaultMode) throws IOException {
    if (!Files.getFileStore(source).supportsFileAttributeView("posix")) {
      return defaultMode;
    }
    PosixFileAttributes attributes =
        Files.readAttributes(source, PosixFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
    return FileModes.toMode(attributes.permissions());
  }

  /** Completes the archive and atomically presents it at the target path. */
  public void finish() throws IOException {
    checkState(!closed, "archive is closed");
    tar.finish();
    if (fileOut != null) {
      fileOut.onSuccess();
    }
    finished = true;
    close();
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    if (finished) {
      tar.close();
      return;
    }
    try {
      tar.close();
    } catch (IOException e) {
      log.log(Level.FINE, "discarding incomplete archive " + target, e);
    } finally {
      if (fileOut != null) {
        fileOut.close();
      }
    }
  }
}
