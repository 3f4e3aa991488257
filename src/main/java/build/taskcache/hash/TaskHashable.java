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
import build.taskcache.task.TaskOutputs;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import lombok.Data;

/** Everything that contributes to a single task's hash. */
@Data
public class TaskHashable {
  private String globalHash;

  private List<String> taskDependencyHashes = new ArrayList<>();

  private String packageDir = "";

  private String hashOfFiles = "";

  private String externalDepsHash = "";

  private String task;

  private TaskOutputs outputs = new TaskOutputs(ImmutableList.of(), ImmutableList.of());

  private List<String> passThruArgs = new ArrayList<>();

  private List<String> env = new ArrayList<>();

  private List<String> resolvedEnvVars = new ArrayList<>();

  @Nullable private List<String> passThroughEnv = null;

  private EnvMode envMode = EnvMode.LOOSE;

  private List<String> dotEnv = new ArrayList<>();
}
