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

package build.taskcache.glob;

import build.taskcache.common.UnixPaths;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.extern.java.Log;

/**
 * Resolves include and exclude glob lists, anchored at a directory inside a repository, into a
 * sorted, deduplicated list of repo-relative paths.
 *
 * <p>Patterns are relative to the base directory and are normalized before matching. A pattern
 * that climbs above the repository root is rejected with {@link GlobEscapeException}. Exclusions
 * are checked first and always win. Walks never follow symlinks.
 */
@Log
public class Globber {
  private static final String EVERYTHING = "**";

  private final Path repoRoot;

  public Globber(Path repoRoot) {
    this.repoRoot = repoRoot.toAbsolutePath().normalize();
  }

  public Path getRepoRoot() {
    return repoRoot;
  }

  /** Resolves files, symlinks and directories. An empty include list means everything. */
  public ImmutableList<String> resolve(
      Path baseDir, Iterable<String> includes, Iterable<String> excludes) throws IOException {
    return resolve(baseDir, includes, excludes, WalkType.ALL);
  }

  public ImmutableList<String> resolve(
      Path baseDir, Iterable<String> includes, Iterable<String> excludes, WalkType walkType)
      throws IOException {
    String anchor = anchorOf(baseDir);
    List<GlobPattern> inclusions = compileAll(anchor, includes);
    if (Iterables.isEmpty(includes)) {
      inclusions.add(compile(anchor, EVERYTHING));
    }
    List<GlobPattern> exclusions = compileAll(anchor, excludes);

    SortedSet<String> results = new TreeSet<>();
    for (GlobPattern inclusion : inclusions) {
      collect(inclusion, exclusions, walkType, results);
    }
    return ImmutableList.copyOf(results);
  }

  /**
   * Normalizes a single literal path, relative to {@code baseDir}, into a repo-relative path.
   *
   * @throws GlobEscapeException if the path resolves outside the repository root
   */
  public String toRepoRelative(Path baseDir, String path) throws GlobEscapeException {
    return normalize(anchorOf(baseDir), UnixPaths.toUnixPath(path), path);
  }

  private String anchorOf(Path baseDir) throws GlobEscapeException {
    Path absolute = repoRoot.resolve(baseDir).normalize();
    if (!absolute.startsWith(repoRoot)) {
      throw new GlobEscapeException(baseDir.toString());
    }
    return UnixPaths.relativize(repoRoot, absolute);
  }

  private List<GlobPattern> compileAll(String anchor, Iterable<String> patterns)
      throws GlobEscapeException {
    List<GlobPattern> compiled = new ArrayList<>();
    for (String pattern : patterns) {
      compiled.add(compile(anchor, pattern));
    }
    return compiled;
  }

  /**
   * Expands braces before normalizing, so a {@code ..} inside an alternative is checked against
   * the repository root like any other.
   */
  private GlobPattern compile(String anchor, String pattern) throws GlobEscapeException {
    List<String> alternatives = GlobPattern.expandBraces(UnixPaths.toUnixPath(pattern));
    List<String> normalized = new ArrayList<>(alternatives.size());
    for (String alternative : alternatives) {
      normalized.add(normalize(anchor, alternative, pattern));
    }
    return GlobPattern.compileExpanded(pattern, normalized);
  }

  private String normalize(String anchor, String alternative, String pattern)
      throws GlobEscapeException {
    String joined;
    if (UnixPaths.isAbsolute(alternative)) {
      Path absolute = repoRoot.getFileSystem().getPath(alternative).normalize();
      if (!absolute.startsWith(repoRoot)) {
        throw new GlobEscapeException(pattern);
      }
      joined = UnixPaths.relativize(repoRoot, absolute);
    } else {
      joined = UnixPaths.join(anchor, alternative);
    }
    String normalized = UnixPaths.normalize(joined);
    if (normalized == null) {
      throw new GlobEscapeException(pattern);
    }
    return normalized;
  }

  private static boolean isExcluded(List<GlobPattern> exclusions, String path) {
    for (GlobPattern exclusion : exclusions) {
      if (exclusion.matches(path)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isSubtreeExcluded(List<GlobPattern> exclusions, String directory) {
    for (GlobPattern exclusion : exclusions) {
      if (exclusion.matchesAllDescendantsOf(directory)) {
        return true;
      }
    }
    return false;
  }

  private void collect(
      GlobPattern inclusion,
      List<GlobPattern> exclusions,
      WalkType walkType,
      SortedSet<String> results)
      throws IOException {
    String prefix = inclusion.literalPrefix();
    Path start = repoRoot.resolve(prefix);
    BasicFileAttributes startAttributes;
    try {
      startAttributes =
          Files.readAttributes(start, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
    } catch (NoSuchFileException e) {
      log.finer("no matches for " + inclusion + ": " + prefix + " does not exist");
      return;
    }

    if (inclusion.isLiteral() || !startAttributes.isDirectory()) {
      if (!prefix.isEmpty()
          && inclusion.matches(prefix)
          && includesType(walkType, startAttributes)
          && !isExcluded(exclusions, prefix)) {
        results.add(prefix);
      }
      return;
    }

    Files.walkFileTree(
        start,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            String path = UnixPaths.relativize(repoRoot, dir);
            if (path.isEmpty()) {
              return FileVisitResult.CONTINUE;
            }
            if (isExcluded(exclusions, path)) {
              return isSubtreeExcluded(exclusions, path)
                  ? FileVisitResult.SKIP_SUBTREE
                  : FileVisitResult.CONTINUE;
            }
            if (walkType == WalkType.ALL && inclusion.matches(path)) {
              results.add(path);
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            String path = UnixPaths.relativize(repoRoot, file);
            if (!isExcluded(exclusions, path)
                && includesType(walkType, attrs)
                && inclusion.matches(path)) {
              results.add(path);
            }
            return FileVisitResult.CONTINUE;
          }
        });
  }

  private static boolean includesType(WalkType walkType, BasicFileAttributes attributes) {
    if (attributes.isDirectory()) {
      return walkType == WalkType.ALL;
    }
    return attributes.isRegularFile() || attributes.isSymbolicLink() || walkType == WalkType.ALL;
  }
}
