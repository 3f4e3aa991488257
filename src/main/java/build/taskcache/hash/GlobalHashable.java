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
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import javax.annotation.Nullable;
import lombok.Data;

/** Run-wide inputs shared by every task hash. */
@Data
public class GlobalHashable {
  // bump to invalidate every cache entry produced by earlier releases
  private String globalCacheKey = HashEngine.GLOBAL_CACHE_KEY;

  // repo-relative path to file fingerprint of every global dependency
  private SortedMap<String, String> globalFileHashMap = new TreeMap<>();

  private String rootExternalDepsHash = "";

  private List<String> env = new ArrayList<>();

  // sorted NAME=value pairs of the declared global env
  private List<String> resolvedEnvVars = new ArrayList<>();

  // names only, values never join a hash
  @Nullable private List<String> passThroughEnv = null;

  private EnvMode envMode = EnvMode.INFER;

  private boolean frameworkInference = true;

  // load order matters: later files win on key collision
  private List<String> dotEnv = new ArrayList<>();
}
