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

import build.taskcache.common.TaskOutputMode;
import com.google.common.base.Strings;
import com.google.devtools.common.options.OptionsParser;
import com.google.devtools.common.options.OptionsParsingException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import javax.annotation.Nullable;
import javax.naming.ConfigurationException;
import lombok.Data;
import lombok.extern.java.Log;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Cache configuration for one run, layered from a YAML file, then environment variables, then
 * command-line options.
 */
@Data
@Log
public final class TaskCacheConfigs {
  public static final String DEFAULT_CACHE_ACTIONS = "local:rw,remote:rw";

  private String cache = DEFAULT_CACHE_ACTIONS;
  private LocalCache local = new LocalCache();
  private RemoteCache remote = new RemoteCache();
  private Run run = new Run();

  public static TaskCacheConfigs loadConfigs(Path configLocation) throws IOException {
    try (InputStream inputStream = Files.newInputStream(configLocation)) {
      Yaml yaml = new Yaml(new Constructor(TaskCacheConfigs.class, new LoaderOptions()));
      TaskCacheConfigs configs = yaml.load(inputStream);
      if (configs == null) {
        // an empty document
        configs = new TaskCacheConfigs();
      }
      log.fine("loaded configs from " + configLocation + ": " + configs);
      return configs;
    }
  }

  /** Loads configs for a run from the process environment and {@code args}. */
  public static TaskCacheConfigs loadRunConfigs(String[] args) throws ConfigurationException {
    return loadRunConfigs(args, System.getenv());
  }

  public static TaskCacheConfigs loadRunConfigs(String[] args, Map<String, String> env)
      throws ConfigurationException {
    OptionsParser parser = OptionsParser.newOptionsParser(RunCacheOptions.class);
    try {
      parser.parse(args);
    } catch (OptionsParsingException e) {
      throw new ConfigurationException("Could not parse options provided: " + e.getMessage());
    }
    RunCacheOptions options = parser.getOptions(RunCacheOptions.class);

    TaskCacheConfigs configs;
    if (Strings.isNullOrEmpty(options.config)) {
      configs = new TaskCacheConfigs();
    } else {
      try {
        configs = loadConfigs(Path.of(options.config));
      } catch (IOException e) {
        log.severe("Could not parse yml configuration file." + e);
        throw new ConfigurationException("Could not load " + options.config + ": " + e);
      }
    }
    configs.applyEnvironment(env);
    configs.applyOptions(options);
    return configs;
  }

  /** Applies {@code TURBO_*} environment overrides. */
  public void applyEnvironment(Map<String, String> env) {
    String token = env.get("TURBO_TOKEN");
    if (!Strings.isNullOrEmpty(token)) {
      remote.setToken(token);
    }
    String teamId = env.get("TURBO_TEAMID");
    if (!Strings.isNullOrEmpty(teamId)) {
      remote.setTeamId(teamId);
    }
    String team = env.get("TURBO_TEAM");
    if (!Strings.isNullOrEmpty(team)) {
      remote.setTeamSlug(team);
    }
    String api = env.get("TURBO_API");
    if (!Strings.isNullOrEmpty(api)) {
      remote.setApiUrl(api);
      log.info(String.format("remote cache api overwritten to %s", api));
    }
    String signatureKey = env.get("TURBO_REMOTE_CACHE_SIGNATURE_KEY");
    if (!Strings.isNullOrEmpty(signatureKey)) {
      remote.setSignatureKey(signatureKey);
    }
    String timeout = env.get("TURBO_REMOTE_CACHE_TIMEOUT");
    if (!Strings.isNullOrEmpty(timeout)) {
      try {
        remote.setTimeoutSeconds(Integer.parseInt(timeout.trim()));
      } catch (NumberFormatException e) {
        log.warning("ignoring invalid TURBO_REMOTE_CACHE_TIMEOUT " + timeout);
      }
    }
    String cacheActions = env.get("TURBO_CACHE");
    if (!Strings.isNullOrEmpty(cacheActions)) {
      cache = cacheActions;
    }
  }

  public void applyOptions(RunCacheOptions options) {
    if (options.force) {
      run.setForce(true);
    }
    if (options.noCache) {
      run.setNoCache(true);
    }
    if (options.remoteOnly) {
      run.setRemoteOnly(true);
    }
    if (options.remoteCacheReadOnly) {
      remote.setReadOnly(true);
    }
    if (!Strings.isNullOrEmpty(options.cacheDir)) {
      local.setDir(options.cacheDir);
    }
    if (!Strings.isNullOrEmpty(options.cache)) {
      cache = options.cache;
    }
    if (!Strings.isNullOrEmpty(options.outputLogs)) {
      run.setOutputLogs(options.outputLogs);
    }
    if (options.remoteCacheTimeout >= 0) {
      remote.setTimeoutSeconds(options.remoteCacheTimeout);
    }
  }

  /**
   * Resolves the effective cache actions. Remote-only disables the local cache, a read-only remote
   * is never written, and an unconfigured remote is disabled entirely.
   *
   * @throws InvalidCacheConfigException if the cache actions string is malformed
   */
  public CacheActions getCacheActions() {
    CacheActions actions = CacheActions.parse(Strings.nullToEmpty(cache));
    if (run.isRemoteOnly()) {
      actions.setLocal(new CacheActions.Actions(false, false));
    }
    if (remote.isReadOnly()) {
      actions.getRemote().setWrite(false);
    }
    if (!remote.isConfigured()) {
      actions.setRemote(new CacheActions.Actions(false, false));
    }
    return actions;
  }

  @Nullable
  public TaskOutputMode getOutputLogsOverride() {
    String outputLogs = run.getOutputLogs();
    return Strings.isNullOrEmpty(outputLogs) ? null : TaskOutputMode.fromFlag(outputLogs);
  }
}
