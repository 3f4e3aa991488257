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

package build.taskcache.common;

import java.util.Locale;

/** Controls which task output is shown to the user when a task executes or hits the cache. */
public enum TaskOutputMode {
  FULL("full"),
  NONE("none"),
  HASH_ONLY("hash-only"),
  NEW_ONLY("new-only"),
  ERRORS_ONLY("errors-only");

  private final String flag;

  TaskOutputMode(String flag) {
    this.flag = flag;
  }

  public String getFlag() {
    return flag;
  }

  /** Parses the command line spelling, such as {@code hash-only}. */
  public static TaskOutputMode fromFlag(String flag) {
    String normalized = flag.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (TaskOutputMode mode : values()) {
      if (mode.flag.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("unknown output logs mode: " + flag);
  }
}
