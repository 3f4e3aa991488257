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

import build.taskcache.common.RunState;
import com.google.common.base.Strings;
import lombok.Data;
import lombok.ToString;

@Data
public class RemoteCache {
  private String apiUrl = "https://vercel.com/api";

  @ToString.Exclude private String token = "";

  private String teamId = "";
  private String teamSlug = "";
  private int timeoutSeconds = 20;
  private int maxRemoteFailures = RunState.DEFAULT_MAX_REMOTE_FAILURES;

  // sign uploads and verify downloads with signatureKey
  private boolean signature = false;

  @ToString.Exclude private String signatureKey = "";

  private boolean readOnly = false;

  /** Remote caching needs credentials and a team. */
  public boolean isConfigured() {
    return !Strings.isNullOrEmpty(token)
        && (!Strings.isNullOrEmpty(teamId) || !Strings.isNullOrEmpty(teamSlug));
  }
}
