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

package build.taskcache.hash;

import build.taskcache.common.FileFingerprinter;
import build.taskcache.common.UnixPaths;
import build.taskcache.glob.Globber;
import build.taskcache.glob.WalkType;
import build.taskcache.task.PackageTask;
import build.taskcache.task.TaskDefinition;
import build.taskcache.task.TaskOutputs;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.TreeMap;
import lombok.extern.java.Log;

/**
 * Fingerprints the input files of a package task.
 *
 * <p>Declared inputs are resolved with the {@link Globber}. Without declared inputs every file in
 * the package is an input, except version control metadata, installed dependencies, task logs and
 * the task's own declared outputs. Keys of the returned map are package-relative.
 */
@Log
public class PackageFileHasher {
  static final ImmutableList<String> DEFAULT_EXCLUSIONS =
      ImmutableList.of("**/.git/**", "**/node_modules/**", PackageTask.LOG_DIR + "/**");

  private final Globber globber;

  public PackageFileHasher(Globber globber) {
    this.globber = globber;
  }

  public ImmutableSortedMap<String, String> hashInputs(PackageTask packageTask)
      throws IOException {
    Path repoRoot = globber.getRepoRoot();
    Path packageDir = repoRoot.resolve(packageTask.getPackageDir());
    TaskDefinition definition = packageTask.getTaskDefinition();

    List<String> files;
    if (definition.getInputs().isEmpty()) {
      TaskOutputs outputs = TaskOutputs.fromGlobs(definition.getOutputs());
      ImmutableList<String> exclusions =
          ImmutableList.<String>builder()
              .addAll(DEFAULT_EXCLUSIONS)
              .addAll(outputs.getInclusions())
              .build();
      files = globber.resolve(packageDir, ImmutableList.of(), exclusions, WalkType.FILES);
    } else {
      TaskOutputs inputs = TaskOutputs.fromGlobs(definition.getInputs());
      files =
          globber.resolve(
              packageDir, inputs.getInclusions(), inputs.getExclusions(), WalkType.FILES);
    }

    TreeMap<String, String> hashes = new TreeMap<>();
    for (String file : files) {
      Path path = repoRoot.resolve(file);
      hashes.put(UnixPaths.relativize(packageDir, path), FileFingerprinter.hash(path));
    }
    for (String dotEnv : definition.getDotEnv()) {
      String file = globber.toRepoRelative(packageDir, dotEnv);
      String hash = FileFingerprinter.hashIfExists(repoRoot.resolve(file));
      if (hash != null) {
        hashes.put(dotEnv, hash);
      }
    }
    ImmutableSortedMap<String, String> result = ImmutableSortedMap.copyOfSorted(hashes);
    log.finer(
        String.format("%s: hashed %d input files", packageTask.getTaskId(), result.size()));
    return result;
  }
}
