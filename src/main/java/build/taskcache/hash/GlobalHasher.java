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

import build.taskcache.common.EnvMode;
import build.taskcache.common.FileFingerprinter;
import build.taskcache.glob.Globber;
import build.taskcache.glob.WalkType;
import build.taskcache.task.TaskOutputs;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.List;
import java.util.TreeMap;
import javax.annotation.Nullable;
import lombok.Data;
import lombok.extern.java.Log;

/** Gathers the run-wide inputs from the repository into a {@link GlobalHashable}. */
@Log
public class GlobalHasher {
  /** Global configuration, as declared at the root of the workspace. */
  @Data
  public static class GlobalInputs {
    private List<String> globalDependencies = ImmutableList.of();
    private List<String> globalEnv = ImmutableList.of();
    @Nullable private List<String> globalPassThroughEnv = null;
    private List<String> globalDotEnv = ImmutableList.of();
    private String rootExternalDepsHash = "";
    private EnvMode envMode = EnvMode.INFER;
    private boolean frameworkInference = true;
  }

  private final Globber globber;

  public GlobalHasher(Globber globber) {
    this.globber = globber;
  }

  public GlobalHashable calculate(GlobalInputs inputs, EnvironmentVariableMap environment)
      throws IOException {
    TreeMap<String, String> fileHashes = new TreeMap<>();
    if (!inputs.getGlobalDependencies().isEmpty()) {
      TaskOutputs globs = TaskOutputs.fromGlobs(inputs.getGlobalDependencies());
      List<String> files =
          globber.resolve(
              globber.getRepoRoot(),
              globs.getInclusions(),
              globs.getExclusions(),
              WalkType.FILES);
      fileHashes.putAll(FileFingerprinter.hashFiles(globber.getRepoRoot(), files));
    }
    // dotenv files are optional, later files override earlier ones at load time
    for (String dotEnv : inputs.getGlobalDotEnv()) {
      String file = globber.toRepoRelative(globber.getRepoRoot(), dotEnv);
      String hash = FileFingerprinter.hashIfExists(globber.getRepoRoot().resolve(file));
      if (hash != null) {
        fileHashes.put(dotEnv, hash);
      }
    }

    GlobalHashable hashable = new GlobalHashable();
    hashable.setGlobalFileHashMap(fileHashes);
    hashable.setRootExternalDepsHash(inputs.getRootExternalDepsHash());
    hashable.setEnv(ImmutableList.copyOf(inputs.getGlobalEnv()));
    hashable.setResolvedEnvVars(environment.fromWildcards(inputs.getGlobalEnv()).toHashable());
    hashable.setPassThroughEnv(inputs.getGlobalPassThroughEnv());
    hashable.setEnvMode(inputs.getEnvMode());
    hashable.setFrameworkInference(inputs.isFrameworkInference());
    hashable.setDotEnv(ImmutableList.copyOf(inputs.getGlobalDotEnv()));
    log.fine(String.format("global hash inputs: %d files", fileHashes.size()));
    return hashable;
  }
}
