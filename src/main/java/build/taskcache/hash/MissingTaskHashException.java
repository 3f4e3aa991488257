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

/**
 * A task hash was requested before the hash of one of its dependencies was known. The scheduler
 * must not hash a task until all of its dependencies have been hashed.
 */
public class MissingTaskHashException extends IllegalStateException {
  private static final long serialVersionUID = 1;

  private final String taskId;
  private final String dependencyTaskId;

  public MissingTaskHashException(String taskId, String dependencyTaskId) {
    super(
        String.format(
            "missing hash for dependent task %s of %s", dependencyTaskId, taskId));
    this.taskId = taskId;
    this.dependencyTaskId = dependencyTaskId;
  }

  public String getTaskId() {
    return taskId;
  }

  public String getDependencyTaskId() {
    return dependencyTaskId;
  }
}
