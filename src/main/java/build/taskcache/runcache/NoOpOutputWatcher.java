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

/** Knows nothing, so every output is reported as changed and the cache is always consulted. */
public class NoOpOutputWatcher implements OutputWatcher {
  public static final NoOpOutputWatcher INSTANCE = new NoOpOutputWatcher();

  @Override
  public ImmutableList<String> getChangedOutputs(String hash, TaskOutputs outputs) {
    return outputs.getInclusions();
  }

  @Override
  public void notifyOutputsWritten(String hash, TaskOutputs outputs) {}
}
