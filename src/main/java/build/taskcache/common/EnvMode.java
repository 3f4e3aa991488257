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

/** How a task's environment is exposed to it, and therefore how it contributes to its hash. */
public enum EnvMode {
  /** Not yet resolved. Must be resolved to LOOSE or STRICT before a task is hashed. */
  INFER,
  /** The whole environment is visible; pass-through names do not join the hash. */
  LOOSE,
  /** Only declared and pass-through variables are visible. */
  STRICT;

  public static EnvMode fromString(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
