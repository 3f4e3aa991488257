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

import build.taskcache.cas.Cache;
import build.taskcache.cas.CacheFactory;
import build.taskcache.common.RunState;
import build.taskcache.common.config.TaskCacheConfigs;
import build.taskcache.glob.Globber;
import build.taskcache.task.PackageTask;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.naming.ConfigurationException;

/**
 * Hands out a {@link TaskCache} per task for one run and collects the cache warnings raised while
 * the run executes.
 */
public class RunCache {
  private final Cache cache;
  private final Path repoRoot;
  private final RunCacheOpts opts;
  private final Globber globber;
  private final OutputWatcher outputWatcher;
  private final Collection<String> warnings;

  /**
   * @param warnings the collection that {@code cache} reports its warnings to
   */
  public RunCache(
      Cache cache,
      Path repoRoot,
      RunCacheOpts opts,
      OutputWatcher outputWatcher,
      Collection<String> warnings) {
    this.cache = cache;
    this.globber = new Globber(repoRoot);
    this.repoRoot = globber.getRepoRoot();
    this.opts = opts;
    this.outputWatcher = outputWatcher;
    this.warnings = warnings;
  }

  /** Creates the run cache for {@code configs}, with a fresh {@link RunState}. */
  public static RunCache create(
      TaskCacheConfigs configs, Path repoRoot, OutputWatcher outputWatcher)
      throws ConfigurationException {
    RunState runState = new RunState(configs.getRemote().getMaxRemoteFailures());
    Set<String> warnings = Collections.synchronizedSet(new LinkedHashSet<>());
    Cache cache = CacheFactory.create(configs, repoRoot, runState, warnings::add);
    return new RunCache(
        cache, repoRoot, RunCacheOpts.fromConfigs(configs), outputWatcher, warnings);
  }

  public TaskCache taskCache(PackageTask packageTask, String hash) {
    return new TaskCache(this, packageTask, hash);
  }

  /** Prints the distinct warnings collected during the run. */
  public void shutdown(PrintStream out) {
    synchronized (warnings) {
      for (String warning : new LinkedHashSet<>(warnings)) {
        out.println("WARNING " + warning);
      }
    }
  }

  /**
   * Aborts in-flight remote cache requests, for use when the run is interrupted. Tasks that are
   * still running fall back to the local cache.
   */
  public void cancel() {
    cache.cancel();
  }

  public boolean isRemoteDisabledByFailures() {
    return cache.isRemoteDisabledByFailures();
  }

  Cache getCache() {
    return cache;
  }

  Path getRepoRoot() {
    return repoRoot;
  }

  RunCacheOpts getOpts() {
    return opts;
  }

  Globber getGlobber() {
    return globber;
  }

  OutputWatcher getOutputWatcher() {
    return outputWatcher;
  }
}
