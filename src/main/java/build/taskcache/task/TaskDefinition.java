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

import build.taskcache.common.TaskOutputMode;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import lombok.Data;

/**
 * Per package task configuration, as supplied by the workspace collaborator.
 *
 * <p>Glob lists use a leading {@code !} to mark an exclusion. An empty {@code inputs} list means
 * every file in the package.
 */
@Data
public class TaskDefinition {
  private List<String> dependsOn = new ArrayList<>();

  private List<String> outputs = new ArrayList<>();

  private List<String> inputs = new ArrayList<>();

  private List<String> env = new ArrayList<>();

  // null when not declared; LOOSE and STRICT treat this differently when hashing
  @Nullable private List<String> passThroughEnv = null;

  private List<String> dotEnv = new ArrayList<>();

  private boolean cache = true;

  // long running tasks such as dev servers are never cached
  private boolean persistent = false;

  private TaskOutputMode outputMode = TaskOutputMode.FULL;

  public boolean isCacheable() {
    return cache && !persistent;
  }
}
