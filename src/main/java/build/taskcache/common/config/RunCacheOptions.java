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

package build.taskcache.common.config;

import com.google.devtools.common.options.Option;
import com.google.devtools.common.options.OptionsBase;

/** Command-line options definition for a cached run. */
public class RunCacheOptions extends OptionsBase {
  @Option(
      name = "config",
      abbrev = 'c',
      help = "Path to a YAML configuration file.",
      defaultValue = "")
  public String config;

  @Option(
      name = "force",
      help = "Ignore existing cache entries and execute every task.",
      defaultValue = "false")
  public boolean force;

  @Option(
      name = "no_cache",
      help = "Do not write task outputs to the cache.",
      defaultValue = "false")
  public boolean noCache;

  @Option(
      name = "remote_only",
      help = "Ignore the local cache and use only the remote cache.",
      defaultValue = "false")
  public boolean remoteOnly;

  @Option(
      name = "remote_cache_read_only",
      help = "Read from the remote cache but never upload to it.",
      defaultValue = "false")
  public boolean remoteCacheReadOnly;

  @Option(
      name = "cache_dir",
      help = "Local cache directory, relative to the repository root.",
      defaultValue = "")
  public String cacheDir;

  @Option(
      name = "cache",
      help = "Cache actions, for example local:rw,remote:r.",
      defaultValue = "")
  public String cache;

  @Option(
      name = "output_logs",
      help = "Task output mode: full, none, hash-only, new-only or errors-only.",
      defaultValue = "")
  public String outputLogs;

  @Option(
      name = "remote_cache_timeout",
      help = "Timeout in seconds of each remote cache request.",
      defaultValue = "-1")
  public int remoteCacheTimeout;
}
