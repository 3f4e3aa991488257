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

import build.taskcache.cas.CacheHitMetadata;
import build.taskcache.cas.CacheResult;
import build.taskcache.common.TaskOutputMode;
import build.taskcache.common.UnixPaths;
import build.taskcache.common.io.Directories;
import build.taskcache.task.PackageTask;
import build.taskcache.task.TaskOutputs;
import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * The cache for a single task execution, identified by its task hash.
 *
 * <p>The scheduler calls {@link #restoreOutputs} first. On a miss it runs the task writing to
 * {@link #outputWriter}, then calls {@link #saveOutputs}. Failures to read or write the cache are
 * reported as warnings and never fail the task.
 */
@Log
public class TaskCache {
  private final RunCache runCache;
  private final PackageTask packageTask;
  private final String hash;
  private final TaskOutputs repoRelativeOutputs;
  private final TaskOutputMode outputMode;
  private final boolean cachingDisabled;
  private final Path logFile;
  private final String prefix;
  private volatile ImmutableList<String> expandedOutputs = ImmutableList.of();

  TaskCache(RunCache runCache, PackageTask packageTask, String hash) {
    this.runCache = runCache;
    this.packageTask = packageTask;
    this.hash = hash;
    repoRelativeOutputs = packageTask.getRepoRelativeOutputs();
    TaskOutputMode override = runCache.getOpts().getTaskOutputModeOverride();
    outputMode = override != null ? override : packageTask.getTaskDefinition().getOutputMode();
    cachingDisabled = !packageTask.getTaskDefinition().isCacheable();
    logFile = runCache.getRepoRoot().resolve(packageTask.getRepoRelativeLogFile());
    prefix = packageTask.getPackageName() + ":" + packageTask.getTaskName() + ": ";
  }

  public String getHash() {
    return hash;
  }

  public TaskOutputMode getOutputMode() {
    return outputMode;
  }

  public boolean isCachingDisabled() {
    return cachingDisabled;
  }

  public Path getLogFile() {
    return logFile;
  }

  /** Repo-relative files restored or saved by this cache. */
  public ImmutableList<String> getExpandedOutputs() {
    return expandedOutputs;
  }

  /**
   * Restores the outputs for this hash, replaying the task log per the output mode.
   *
   * @return whether the outputs were restored and the task need not run
   */
  public boolean restoreOutputs(PrintStream out) throws InterruptedException {
    if (cachingDisabled || runCache.getOpts().isSkipReads()) {
      if (showsStatus()) {
        printPrefixed(out, "cache bypass, force executing " + hash);
      }
      return false;
    }

    String context = "";
    List<String> changed = changedOutputs();
    if (changed.isEmpty()) {
      log.fine(String.format("%s: outputs already on disk for %s", packageTask.getTaskId(), hash));
      context = " (outputs already on disk)";
    } else {
      CacheResult result = runCache.getCache().fetch(runCache.getRepoRoot(), hash);
      if (!result.isHit()) {
        if (showsStatus()) {
          printPrefixed(out, "cache miss, executing " + hash);
        }
        return false;
      }
      expandedOutputs = result.getFiles();
      notifyOutputsWritten();
    }

    switch (outputMode) {
      case FULL:
        printPrefixed(out, String.format("cache hit%s, replaying logs %s", context, hash));
        replayLog(out);
        break;
      case HASH_ONLY:
      case NEW_ONLY:
        printPrefixed(out, String.format("cache hit%s, suppressing logs %s", context, hash));
        break;
      default:
        break;
    }
    return true;
  }

  private boolean showsStatus() {
    return outputMode != TaskOutputMode.NONE && outputMode != TaskOutputMode.ERRORS_ONLY;
  }

  private List<String> changedOutputs() {
    try {
      return runCache.getOutputWatcher().getChangedOutputs(hash, repoRelativeOutputs);
    } catch (IOException e) {
      log.log(
          Level.FINE,
          String.format("could not check outputs of %s, assuming changed", packageTask.getTaskId()),
          e);
      return repoRelativeOutputs.getInclusions();
    }
  }

  /** Checks whether either store has this hash, without restoring it. */
  @Nullable
  public CacheHitMetadata exists() throws InterruptedException {
    if (cachingDisabled || runCache.getOpts().isSkipReads()) {
      return null;
    }
    return runCache.getCache().exists(hash);
  }

  /**
   * Opens the sink for a live execution. The log file is truncated immediately, so a task that
   * dies mid-run leaves a partial log.
   */
  public OutputStream outputWriter(PrintStream out) throws IOException {
    Directories.createDirectories(logFile.getParent());
    OutputStream logOut = Files.newOutputStream(logFile);
    OutputStream console = null;
    if (outputMode == TaskOutputMode.FULL || outputMode == TaskOutputMode.NEW_ONLY) {
      console = new PrefixedLineOutputStream(prefix, out);
    }
    return new TaskOutputWriter(logOut, console);
  }

  /** Shows the output of a failed execution that the output mode held back. */
  public void onError(PrintStream out) {
    if (outputMode == TaskOutputMode.ERRORS_ONLY) {
      printPrefixed(out, "cache miss, executing " + hash);
      replayLog(out);
    }
  }

  /** Archives the task outputs and its log under this hash. */
  public void saveOutputs(PrintStream out, long durationMs) throws InterruptedException {
    if (cachingDisabled || runCache.getOpts().isSkipWrites()) {
      return;
    }
    log.fine(
        String.format("caching outputs of %s: %s", packageTask.getTaskId(), repoRelativeOutputs));

    Path repoRoot = runCache.getRepoRoot();
    ImmutableList<String> files;
    try {
      files =
          runCache
              .getGlobber()
              .resolve(
                  repoRoot,
                  repoRelativeOutputs.getInclusions(),
                  repoRelativeOutputs.getExclusions());
    } catch (IOException e) {
      warn(out, String.format("failed to resolve outputs for %s: %s", hash, e.getMessage()));
      return;
    }

    String repoRelativeLog = packageTask.getRepoRelativeLogFile();
    ImmutableList.Builder<String> cacheable = ImmutableList.builder();
    boolean foundOutput = false;
    for (String file : files) {
      if (isSupported(repoRoot.resolve(file), out)) {
        cacheable.add(file);
        foundOutput |= !file.equals(repoRelativeLog);
      }
    }
    if (!foundOutput && !packageTask.getTaskDefinition().getOutputs().isEmpty()) {
      warn(out, "no output files found for task " + packageTask.getTaskId());
    }

    ImmutableList<String> toCache = cacheable.build();
    try {
      runCache.getCache().put(repoRoot, hash, toCache, durationMs);
    } catch (IOException e) {
      warn(out, String.format("error caching output for %s: %s", hash, e.getMessage()));
      return;
    }
    expandedOutputs = toCache;
    notifyOutputsWritten();
  }

  // archives carry only regular files, directories and symlinks, anything else is left behind
  private boolean isSupported(Path path, PrintStream out) {
    BasicFileAttributes attributes;
    try {
      attributes = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
    } catch (IOException e) {
      warn(out, String.format("skipping output %s: %s", path, e.getMessage()));
      return false;
    }
    if (attributes.isOther()) {
      warn(
          out,
          String.format(
              "skipping output %s: unsupported file type",
              UnixPaths.relativize(runCache.getRepoRoot(), path)));
      return false;
    }
    return true;
  }

  private void notifyOutputsWritten() {
    try {
      runCache.getOutputWatcher().notifyOutputsWritten(hash, repoRelativeOutputs);
    } catch (IOException e) {
      log.warning(
          String.format(
              "failed to record outputs of %s for %s: %s",
              packageTask.getTaskId(), hash, e.getMessage()));
    }
  }

  private void replayLog(PrintStream out) {
    try (BufferedReader reader = Files.newBufferedReader(logFile, UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        printPrefixed(out, line);
      }
    } catch (NoSuchFileException e) {
      log.fine("no log file to replay at " + logFile);
    } catch (IOException e) {
      warn(out, String.format("error replaying logs for %s: %s", hash, e.getMessage()));
    }
  }

  private void printPrefixed(PrintStream out, String line) {
    out.println(prefix + line);
  }

  private void warn(PrintStream out, String message) {
    log.warning(prefix + message);
    printPrefixed(out, "WARNING " + message);
  }
}
