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

import build.taskcache.common.FileFingerprinter;
import build.taskcache.glob.Globber;
import build.taskcache.glob.WalkType;
import build.taskcache.hash.HashEngine;
import build.taskcache.task.TaskOutputs;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.java.Log;

/**
 * Remembers a fingerprint of the paths matched by each output glob when outputs are written, and
 * reports a glob as changed when its current matches no longer fingerprint the same.
 *
 * <p>State lives only as long as this instance, typically a single process serving several runs.
 */
@Log
public class InMemoryOutputWatcher implements OutputWatcher {
  // never a valid blob id, so types cannot collide with content
  private static final String DIRECTORY = "directory";
  private static final String OTHER = "other";

  private final Globber globber;

  // hash -> inclusion glob -> fingerprint of its matches
  private final Map<String, Map<String, String>> written = new ConcurrentHashMap<>();

  public InMemoryOutputWatcher(Globber globber) {
    this.globber = globber;
  }

  @Override
  public ImmutableList<String> getChangedOutputs(String hash, TaskOutputs outputs)
      throws IOException {
    Map<String, String> known = written.get(hash);
    if (known == null) {
      return outputs.getInclusions();
    }
    ImmutableList.Builder<String> changed = ImmutableList.builder();
    for (String inclusion : outputs.getInclusions()) {
      String fingerprint = known.get(inclusion);
      if (fingerprint == null || !fingerprint.equals(fingerprint(inclusion, outputs))) {
        changed.add(inclusion);
      }
    }
    return changed.build();
  }

  @Override
  public void notifyOutputsWritten(String hash, TaskOutputs outputs) throws IOException {
    ImmutableMap.Builder<String, String> fingerprints = ImmutableMap.builder();
    for (String inclusion : outputs.getInclusions()) {
      fingerprints.put(inclusion, fingerprint(inclusion, outputs));
    }
    written.put(hash, fingerprints.build());
    log.finer(
        String.format("recorded %d output globs for %s", outputs.getInclusions().size(), hash));
  }

  /**
   * Fingerprints every match of the glob, directories included, so that a glob naming a bare
   * directory changes when the directory is removed.
   */
  private String fingerprint(String inclusion, TaskOutputs outputs) throws IOException {
    Path repoRoot = globber.getRepoRoot();
    ImmutableList<String> matches =
        globber.resolve(
            repoRoot, ImmutableList.of(inclusion), outputs.getExclusions(), WalkType.ALL);
    SortedMap<String, String> entries = new TreeMap<>();
    for (String match : matches) {
      Path path = repoRoot.resolve(match);
      BasicFileAttributes attributes;
      try {
        attributes =
            Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
      } catch (NoSuchFileException e) {
        continue;
      }
      if (attributes.isDirectory()) {
        entries.put(match, DIRECTORY);
      } else if (attributes.isRegularFile() || attributes.isSymbolicLink()) {
        entries.put(match, FileFingerprinter.hash(path));
      } else {
        entries.put(match, OTHER);
      }
    }
    return HashEngine.hashFileHashes(entries);
  }
}
