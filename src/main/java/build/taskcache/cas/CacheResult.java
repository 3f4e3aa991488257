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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/** The outcome of a cache fetch: a miss, or a hit with the repo-relative files it restored. */
public final class CacheResult {
  private static final CacheResult MISS = new CacheResult(null, ImmutableList.of());

  @Nullable private final CacheHitMetadata metadata;
  private final ImmutableList<String> files;

  private CacheResult(@Nullable CacheHitMetadata metadata, ImmutableList<String> files) {
    this.metadata = metadata;
    this.files = files;
  }

  public static CacheResult miss() {
    return MISS;
  }

  public static CacheResult hit(CacheSource source, long timeSavedMs, List<String> files) {
    return new CacheResult(
        new CacheHitMetadata(source, timeSavedMs), ImmutableList.copyOf(files));
  }

  public boolean isHit() {
    return metadata != null;
  }

  public CacheHitMetadata getMetadata() {
    checkState(metadata != null, "cache miss has no metadata");
    return metadata;
  }

  public ImmutableList<String> getFiles() {
    return files;
  }

  @Override
  public String toString() {
    return isHit() ? "CacheResult{hit " + metadata + "}" : "CacheResult{miss}";
  }
}
