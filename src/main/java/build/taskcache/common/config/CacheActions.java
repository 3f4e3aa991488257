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

import com.google.common.base.Splitter;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Data;

/**
 * Which caches may be read and written, parsed from strings such as {@code local:rw,remote:r}.
 *
 * <p>The local cache may also be spelled {@code fs}. A cache that is not listed is disabled, and an
 * empty string disables all caching.
 */
@Data
public class CacheActions {
  private static final Splitter ENTRIES = Splitter.on(',').trimResults().omitEmptyStrings();

  /** Read and write flags for one cache. */
  @Data
  public static class Actions {
    private boolean read = false;
    private boolean write = false;

    public Actions() {}

    public Actions(boolean read, boolean write) {
      this.read = read;
      this.write = write;
    }

    public boolean isEnabled() {
      return read || write;
    }
  }

  private Actions local = new Actions(true, true);
  private Actions remote = new Actions(true, true);

  public static CacheActions parse(String config) {
    CacheActions actions = new CacheActions();
    actions.setLocal(new Actions());
    actions.setRemote(new Actions());
    Set<String> seen = new HashSet<>();
    for (String entry : ENTRIES.split(config)) {
      List<String> parts = Splitter.on(':').trimResults().splitToList(entry);
      if (parts.size() != 2) {
        throw new InvalidCacheConfigException(config, "expected type:actions, got " + entry);
      }
      String type = parts.get(0).toLowerCase(Locale.ROOT);
      if (type.equals("fs")) {
        type = "local";
      }
      if (!type.equals("local") && !type.equals("remote")) {
        throw new InvalidCacheConfigException(config, "unknown cache type " + parts.get(0));
      }
      if (!seen.add(type)) {
        throw new InvalidCacheConfigException(config, "duplicate cache type " + parts.get(0));
      }
      Actions parsed = parseActions(config, parts.get(1));
      if (type.equals("local")) {
        actions.setLocal(parsed);
      } else {
        actions.setRemote(parsed);
      }
    }
    return actions;
  }

  private static Actions parseActions(String config, String value) {
    if (value.isEmpty()) {
      throw new InvalidCacheConfigException(config, "no actions given");
    }
    Actions actions = new Actions();
    for (char c : value.toCharArray()) {
      switch (c) {
        case 'r':
          if (actions.isRead()) {
            throw new InvalidCacheConfigException(config, "duplicate action r");
          }
          actions.setRead(true);
          break;
        case 'w':
          if (actions.isWrite()) {
            throw new InvalidCacheConfigException(config, "duplicate action w");
          }
          actions.setWrite(true);
          break;
        default:
          throw new InvalidCacheConfigException(config, "unknown action " + c);
      }
    }
    return actions;
  }
}
