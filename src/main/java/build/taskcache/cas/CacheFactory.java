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

package build.taskcache.cas;

import build.taskcache.common.RunState;
import build.taskcache.common.config.CacheActions;
import build.taskcache.common.config.InvalidCacheConfigException;
import build.taskcache.common.config.RemoteCache;
import build.taskcache.common.config.TaskCacheConfigs;
import com.google.common.base.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Consumer;
import javax.naming.ConfigurationException;
import lombok.extern.java.Log;
import okhttp3.OkHttpClient;

/** Assembles a {@link Cache} for a run from its configuration. */
@Log
public final class CacheFactory {
  private static final OkHttpClient HTTP_CLIENT = new OkHttpClient();

  private CacheFactory() {}

  public static Cache create(
      TaskCacheConfigs configs, Path repoRoot, RunState runState, Consumer<String> warnings)
      throws ConfigurationException {
    return create(configs, repoRoot, runState, warnings, HTTP_CLIENT);
  }

  public static Cache create(
      TaskCacheConfigs configs,
      Path repoRoot,
      RunState runState,
      Consumer<String> warnings,
      OkHttpClient httpClient)
      throws ConfigurationException {
    CacheActions actions;
    try {
      actions = configs.getCacheActions();
    } catch (InvalidCacheConfigException e) {
      throw new ConfigurationException(e.getMessage());
    }

    LocalStore local = null;
    if (actions.getLocal().isEnabled()) {
      local = new LocalStore(configs.getLocal().getValidDir(repoRoot));
    }

    RemoteStore remote = null;
    if (actions.getRemote().isEnabled()) {
      remote = newRemoteStore(configs.getRemote(), runState, httpClient);
    }
    log.fine(String.format("cache actions for run: %s", actions));
    return new Cache(local, remote, actions, runState, warnings);
  }

  private static RemoteStore newRemoteStore(
      RemoteCache remote, RunState runState, OkHttpClient httpClient)
      throws ConfigurationException {
    if (remote.getTimeoutSeconds() <= 0) {
      throw new ConfigurationException(
          "remote cache timeout must be positive: " + remote.getTimeoutSeconds());
    }
    ArtifactSignatureAuthenticator signer = null;
    if (remote.isSignature()) {
      if (Strings.isNullOrEmpty(remote.getSignatureKey())) {
        throw new ConfigurationException(
            "remote cache signature is enabled but no signature key is configured");
      }
      signer = new ArtifactSignatureAuthenticator(remote.getTeamId(), remote.getSignatureKey());
    }
    HttpArtifactClient client =
        new HttpArtifactClient(
            httpClient,
            remote.getApiUrl(),
            remote.getToken(),
            Strings.emptyToNull(remote.getTeamId()),
            Strings.emptyToNull(remote.getTeamSlug()),
            Duration.ofSeconds(remote.getTimeoutSeconds()),
            runState);
    return new RemoteStore(client, signer);
  }
}
