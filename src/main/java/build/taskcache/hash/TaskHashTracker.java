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
import build.taskcache.task.PackageTask;
import build.taskcache.task.TaskDefinition;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * Run-scoped record of computed hashes, shared by the scheduler's workers.
 *
 * <p>A task may only be hashed once every task it depends on has been hashed here. Asking for a
 * task hash before that is a {@link MissingTaskHashException}.
 */
@Log
public class TaskHashTracker {
  private final String globalHash;
  private final EnvMode envMode;
  private final EnvironmentVariableMap environment;
  private final PackageFileHasher fileHasher;

  private final ConcurrentMap<String, String> packageInputsHashes = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, String> taskHashes = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, EnvironmentVariableMap> taskEnvVars =
      new ConcurrentHashMap<>();

  public TaskHashTracker(
      String globalHash,
      EnvMode envMode,
      EnvironmentVariableMap environment,
      PackageFileHasher fileHasher) {
    this.globalHash = globalHash;
    this.envMode = envMode;
    this.environment = environment;
    this.fileHasher = fileHasher;
  }

  public String getGlobalHash() {
    return globalHash;
  }

  /** Fingerprints and records the input files of {@code packageTask}. */
  public String calculateFileHashes(PackageTask packageTask) throws IOException {
    ImmutableSortedMap<String, String> files = fileHasher.hashInputs(packageTask);
    String hashOfFiles = HashEngine.hashFileHashes(files);
    packageInputsHashes.put(packageTask.getTaskId(), hashOfFiles);
    return hashOfFiles;
  }

  /**
   * Computes and records the hash of {@code packageTask}.
   *
   * @param dependencyTaskIds ids of every task this task depends on
   * @throws MissingTaskHashException if a dependency has not been hashed yet
   */
  public String calculateTaskHash(
      PackageTask packageTask, Collection<String> dependencyTaskIds, List<String> passThruArgs)
      throws IOException {
    String taskId = packageTask.getTaskId();
    String hashOfFiles = packageInputsHashes.get(taskId);
    if (hashOfFiles == null) {
      hashOfFiles = calculateFileHashes(packageTask);
    }

    List<String> dependencyHashes = new ArrayList<>(dependencyTaskIds.size());
    for (String dependencyTaskId : dependencyTaskIds) {
      String dependencyHash = taskHashes.get(dependencyTaskId);
      if (dependencyHash == null) {
        throw new MissingTaskHashException(taskId, dependencyTaskId);
      }
      dependencyHashes.add(dependencyHash);
    }

    TaskDefinition definition = packageTask.getTaskDefinition();
    EnvironmentVariableMap envVars = environment.fromWildcards(definition.getEnv());

    TaskHashable hashable = new TaskHashable();
    hashable.setGlobalHash(globalHash);
    hashable.setTaskDependencyHashes(dependencyHashes);
    hashable.setPackageDir(packageTask.getPackageDir());
    hashable.setHashOfFiles(hashOfFiles);
    hashable.setExternalDepsHash(packageTask.getExternalDepsHash());
    hashable.setTask(packageTask.getTaskName());
    hashable.setOutputs(packageTask.getOutputsWithLog());
    hashable.setPassThruArgs(ImmutableList.copyOf(passThruArgs));
    hashable.setEnv(ImmutableList.copyOf(definition.getEnv()));
    hashable.setResolvedEnvVars(envVars.toHashable());
    hashable.setPassThroughEnv(definition.getPassThroughEnv());
    hashable.setEnvMode(resolveEnvMode(definition));
    hashable.setDotEnv(ImmutableList.copyOf(definition.getDotEnv()));

    String hash = HashEngine.computeTaskHash(hashable);
    taskEnvVars.put(taskId, envVars);
    taskHashes.put(taskId, hash);
    log.fine(String.format("%s: hash %s", taskId, hash));
    return hash;
  }

  // a run in INFER mode is strict for tasks that declare pass-through env, loose otherwise
  private EnvMode resolveEnvMode(TaskDefinition definition) {
    if (envMode != EnvMode.INFER) {
      return envMode;
    }
    return definition.getPassThroughEnv() != null ? EnvMode.STRICT : EnvMode.LOOSE;
  }

  @Nullable
  public String getTaskHash(String taskId) {
    return taskHashes.get(taskId);
  }

  @Nullable
  public String getPackageInputsHash(String taskId) {
    return packageInputsHashes.get(taskId);
  }

  @Nullable
  public EnvironmentVariableMap getTaskEnvVars(String taskId) {
    return taskEnvVars.get(taskId);
  }
}
