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

import build.taskcache.task.TaskOutputs;
import com.google.common.collect.ImmutableList;
import java.io.IOException;

/**
 * Tracks whether the outputs of a task are known to be on disk, unchanged since they were last
 * written or restored for a hash. Implementations may always report every output as changed.
 */
public interface OutputWatcher {
  /**
   * Returns the repo-relative inclusion globs of {@code outputs} whose matches may have changed
   * since {@link #notifyOutputsWritten} was last called for {@code hash}.
   */
  ImmutableList<String> getChangedOutputs(String hash, TaskOutputs outputs) throws IOException;

  /** Records that the files matching {@code outputs} are now the outputs for {@code hash}. */
  void notifyOutputsWritten(String hash, TaskOutputs outputs) throws IOException;
}
