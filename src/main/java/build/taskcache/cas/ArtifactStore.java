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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A store of task output artifacts keyed by task hash.
 *
 * <p>Implementations are safe for concurrent use with different hashes. Concurrent puts of the same
 * hash are not coordinated and the last writer wins.
 */
public interface ArtifactStore {
  /**
   * Restores the artifact for {@code hash} beneath {@code anchor}.
   *
   * @return a hit listing the restored anchor-relative paths, or a miss
   */
  CacheResult fetch(Path anchor, String hash) throws IOException, InterruptedException;

  /** Returns hit metadata without restoring anything, or null if the artifact is absent. */
  @Nullable
  CacheHitMetadata exists(String hash) throws IOException, InterruptedException;

  /** Stores the anchor-relative {@code files} as the artifact for {@code hash}. */
  void put(Path anchor, String hash, List<String> files, long durationMs)
      throws IOException, InterruptedException;

  /** Aborts in-flight operations and refuses new ones. Stores that never block need not. */
  default void cancel() {}
}
