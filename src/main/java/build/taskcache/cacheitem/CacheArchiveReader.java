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

import build.taskcache.common.UnixPaths;
import build.taskcache.common.io.Directories;
import com.github.luben.zstd.ZstdInputStream;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.java.Log;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;

/**
 * Restores a cache artifact written by {@link CacheArchiveWriter}.
 *
 * <p>Archives may come from a remote cache and are treated as untrusted. Entries are refused if
 * their name is absolute or contains {@code ..}, if a parent directory resolves outside the anchor,
 * or if a symlink would point outside the anchor. Symlinks whose target has not been restored yet
 * are deferred until the end and created in dependency order.
 */
@Log
public class CacheArchiveReader implements Closeable {
  private static final Splitter SEGMENTS = Splitter.on('/');
  private static final int BUFFER_SIZE = 1 << 20;

  private final TarArchiveInputStream tar;

  public CacheArchiveReader(InputStream in, boolean compressed) throws IOException {
    InputStream buffered = new BufferedInputStream(in, BUFFER_SIZE);
    this.tar =
        new TarArchiveInputStream(compressed ? new ZstdInputStream(buffered) : buffered, "UTF-8");
  }

  public static CacheArchiveReader open(Path archive) throws IOException {
    InputStream in = Files.newInputStream(archive);
    try {
      return new CacheArchiveReader(in, CacheArchiveWriter.isCompressed(archive));
    } catch (IOException e) {
      in.close();
      throw e;
    }
  }

  /**
   * Restores every entry beneath {@code anchor}.
   *
   * @return the restored entry names, in archive order
   */
  public ImmutableList<String> restore(Path anchor) throws IOException {
    Directories.createDirectories(anchor);
    Path realAnchor = anchor.toRealPath();
    ImmutableList.Builder<String> restored = ImmutableList.builder();
    Map<String, String> deferredSymlinks = new LinkedHashMap<>();

    TarArchiveEntry entry;
    while ((entry = tar.getNextEntry()) != null) {
      String name = validateName(entry.getName());
      Path target = realAnchor.resolve(name);
      if (entry.isDirectory()) {
        restoreDirectory(realAnchor, name, target, entry.getMode());
      } else if (entry.isSymbolicLink()) {
        String linkName = validateLink(realAnchor, name, entry.getLinkName());
        if (Files.exists(target.resolveSibling(linkName))) {
          restoreSymlink(realAnchor, name, target, linkName);
        } else {
          deferredSymlinks.put(name, linkName);
          continue;
        }
      } else if (entry.isFile()) {
        restoreFile(realAnchor, name, target, entry.getMode());
      } else {
        throw new UnsupportedFileTypeException(name, "tar type " + (char) entry.getLinkFlag());
      }
      restored.add(name);
    }

    for (String name : orderSymlinks(deferredSymlinks)) {
      restoreSymlink(realAnchor, name, realAnchor.resolve(name), deferredSymlinks.get(name));
      restored.add(name);
    }
    return restored.build();
  }

  private static String validateName(String entryName) throws IOException {
    String name = UnixPaths.toUnixPath(entryName);
    while (name.endsWith("/")) {
      name = name.substring(0, name.length() - 1);
    }
    if (name.isEmpty() || UnixPaths.isAbsolute(name)) {
      throw new ArchiveEscapeException(entryName, "absolute or empty path");
    }
    for (String segment : SEGMENTS.split(name)) {
      if (segment.equals("..")) {
        throw new ArchiveEscapeException(entryName, "path contains '..'");
      }
    }
    String normalized = UnixPaths.normalize(name);
    if (normalized == null || normalized.isEmpty()) {
      throw new ArchiveEscapeException(entryName, "path does not name an entry");
    }
    return normalized;
  }

  private static String validateLink(Path anchor, String name, String linkName)
      throws IOException {
    String link = UnixPaths.toUnixPath(linkName);
    if (UnixPaths.isAbsolute(link)) {
      throw new ArchiveEscapeException(name, "symlink target " + linkName + " is absolute");
    }
    Path parent = anchor.resolve(name).getParent();
    Path resolved = parent.resolve(link).normalize();
    if (!resolved.startsWith(anchor)) {
      throw new ArchiveEscapeException(name, "symlink target " + linkName + " escapes anchor");
    }
    return link;
  }

  // parents that already exist may be symlinks placed by earlier entries
  private static void createParents(Path anchor, String name, Path target) throws IOException {
    Path parent = target.getParent();
    Directories.createDirectories(parent);
    if (!parent.toRealPath().startsWith(anchor)) {
      throw new ArchiveEscapeException(name, "parent directory resolves outside anchor");
    }
  }

  private static void restoreDirectory(Path anchor, String name, Path target, int mode)
      throws IOException {
    createParents(anchor, name, target);
    if (Files.isSymbolicLink(target)) {
      Files.delete(target);
    }
    Directories.createDirectories(target);
    setMode(target, mode);
  }

  private void restoreFile(Path anchor, String name, Path target, int mode) throws IOException {
    createParents(anchor, name, target);
    // replaces a symlink rather than writing through it
    Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
    setMode(target, mode);
  }

  private static void restoreSymlink(Path anchor, String name, Path target, String linkName)
      throws IOException {
    createParents(anchor, name, target);
    Files.deleteIfExists(target);
    Files.createSymbolicLink(target, target.getFileSystem().getPath(linkName));
  }

  private static void setMode(Path target, int mode) throws IOException {
    if (Files.getFileStore(target).supportsFileAttributeView("posix")) {
      Files.setPosixFilePermissions(target, FileModes.toPermissions(mode));
    }
  }

  /**
   * Orders deferred symlinks so that a link is created after any deferred link its target passes
   * through.
   */
  private static List<String> orderSymlinks(Map<String, String> links) throws IOException {
    Map<String, List<String>> dependents = new HashMap<>();
    Map<String, Integer> pending = new HashMap<>();
    for (Map.Entry<String, String> link : links.entrySet()) {
      String name = link.getKey();
      String parent = name.contains("/") ? name.substring(0, name.lastIndexOf('/')) : "";
      String resolved = UnixPaths.normalize(UnixPaths.join(parent, link.getValue()));
      int count = 0;
      for (String other : links.keySet()) {
        if (resolved != null
            && (resolved.equals(other) || resolved.startsWith(other + "/"))) {
          dependents.computeIfAbsent(other, k -> new ArrayList<>()).add(name);
          count++;
        }
      }
      pending.put(name, count);
    }

    Deque<String> ready = new ArrayDeque<>();
    for (String name : links.keySet()) {
      if (pending.get(name) == 0) {
        ready.add(name);
      }
    }
    List<String> ordered = new ArrayList<>(links.size());
    while (!ready.isEmpty()) {
      String name = ready.poll();
      ordered.add(name);
      for (String dependent : dependents.getOrDefault(name, ImmutableList.of())) {
        if (pending.merge(dependent, -1, Integer::sum) == 0) {
          ready.add(dependent);
        }
      }
    }
    if (ordered.size() != links.size()) {
      List<String> cycle = new ArrayList<>();
      for (String name : links.keySet()) {
        if (pending.get(name) > 0) {
          cycle.add(name);
        }
      }
      throw new SymlinkCycleException(cycle);
    }
    log.finer(String.format("restoring %d deferred symlinks", ordered.size()));
    return ordered;
  }

  @Override
  public void close() throws IOException {
    tar.close();
  }
}
