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

package build.taskcache.task;

import build.taskcache.common.UnixPaths;
import lombok.Data;

/** A task bound to the package it runs in. */
@Data
public class PackageTask {
  public static final String TASK_DELIMITER = "#";
  public static final String LOG_DIR = ".turbo";

  private final String packageName;

  // repo-relative, forward slashes
  private final String packageDir;

  private final String taskName;

  private final TaskDefinition taskDefinition;

  private String externalDepsHash = "";

  public static String taskId(String packageName, String taskName) {
    return packageName + TASK_DELIMITER + taskName;
  }

  public String getTaskId() {
    return taskId(packageName, taskName);
  }

  /** The package-relative location of this task's execution log. */
  public String getLogFile() {
    return LOG_DIR + "/turbo-" + taskName.replace(':', '$') + ".log";
  }

  /** The repo-relative location of this task's execution log. */
  public String getRepoRelativeLogFile() {
    return UnixPaths.join(packageDir, getLogFile());
  }

  /** Package-relative output globs, with the execution log always included. */
  public TaskOutputs getOutputsWithLog() {
    return TaskOutputs.fromGlobs(taskDefinition.getOutputs()).withInclusion(getLogFile());
  }

  /** Repo-relative output globs, with the execution log always included. */
  public TaskOutputs getRepoRelativeOutputs() {
    return getOutputsWithLog().anchoredAt(packageDir);
  }
}
