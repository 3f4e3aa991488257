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

import build.taskcache.common.TaskOutputMode;
import build.taskcache.common.config.TaskCacheConfigs;
import javax.annotation.Nullable;
import lombok.Data;

/** Run-wide switches that apply to every task cache. */
@Data
public class RunCacheOpts {
  // --force: execute every task, but still save its outputs
  private boolean skipReads = false;

  // --no-cache: never save outputs
  private boolean skipWrites = false;

  @Nullable private TaskOutputMode taskOutputModeOverride;

  public static RunCacheOpts fromConfigs(TaskCacheConfigs configs) {
    RunCacheOpts opts = new RunCacheOpts();
    opts.setSkipReads(configs.getRun().isForce());
    opts.setSkipWrites(configs.getRun().isNoCache());
    opts.setTaskOutputModeOverride(configs.getOutputLogsOverride());
    return opts;
  }
}
