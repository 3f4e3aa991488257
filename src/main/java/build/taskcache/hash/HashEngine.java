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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import build.taskcache.common.EnvMode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.SortedMap;
import javax.annotation.Nullable;
import net.openhft.hashing.LongHashFunction;

/**
 * Computes global and task hashes with xxHash64 over a hand-written canonical serialization of each
 * hashable record.
 *
 * <p>The field order below is a versioned contract. Any change to which fields are written, or in
 * which order, must bump {@link #FORMAT_VERSION}, which invalidates every existing cache entry.
 */
public final class HashEngine {
  public static final String FORMAT_VERSION = "1";

  /** Written into every {@link GlobalHashable}, identifies the cache format of this release. */
  public static final String GLOBAL_CACHE_KEY = "taskcache-global-" + FORMAT_VERSION;

  private static final LongHashFunction XX = LongHashFunction.xx();

  private HashEngine() {}

  public static String computeGlobalHash(GlobalHashable hashable) {
    CanonicalWriter writer = new CanonicalWriter("GlobalHashable", FORMAT_VERSION);
    writer.field("globalCacheKey").string(hashable.getGlobalCacheKey());
    writer.field("globalFileHashMap").map(hashable.getGlobalFileHashMap());
    writer.field("rootExternalDepsHash").string(hashable.getRootExternalDepsHash());
    writer.field("env").list(hashable.getEnv());
    writer.field("resolvedEnvVars").list(sorted(hashable.getResolvedEnvVars()));
    writer.field("passThroughEnv").list(sortedOrNull(hashable.getPassThroughEnv()));
    writer.field("envMode").string(hashable.getEnvMode().name());
    writer.field("frameworkInference").bool(hashable.isFrameworkInference());
    writer.field("dotEnv").list(hashable.getDotEnv());
    return hash(writer.toByteArray());
  }

  /**
   * Computes the hash of one task.
   *
   * @throws IllegalArgumentException if the env mode has not been resolved to LOOSE or STRICT
   */
  public static String computeTaskHash(TaskHashable hashable) {
    checkNotNull(hashable.getGlobalHash(), "task hash requires a global hash");
    checkNotNull(hashable.getTask(), "task hash requires a task name");
    EnvMode envMode = hashable.getEnvMode();
    checkArgument(
        envMode == EnvMode.LOOSE || envMode == EnvMode.STRICT,
        "env mode must be resolved before hashing, got %s",
        envMode);

    List<String> passThroughEnv;
    if (envMode == EnvMode.LOOSE) {
      passThroughEnv = null;
    } else {
      passThroughEnv = sorted(hashable.getPassThroughEnv());
    }

    CanonicalWriter writer = new CanonicalWriter("TaskHashable", FORMAT_VERSION);
    writer.field("globalHash").string(hashable.getGlobalHash());
    writer.field("taskDependencyHashes").list(sorted(hashable.getTaskDependencyHashes()));
    writer.field("packageDir").string(hashable.getPackageDir());
    writer.field("hashOfFiles").string(hashable.getHashOfFiles());
    writer.field("externalDepsHash").string(hashable.getExternalDepsHash());
    writer.field("task").string(hashable.getTask());
    writer.field("outputs.inclusions").list(hashable.getOutputs().getInclusions());
    writer.field("outputs.exclusions").list(hashable.getOutputs().getExclusions());
    writer.field("passThruArgs").list(hashable.getPassThruArgs());
    writer.field("env").list(hashable.getEnv());
    writer.field("resolvedEnvVars").list(sorted(hashable.getResolvedEnvVars()));
    writer.field("passThroughEnv").list(passThroughEnv);
    writer.field("envMode").string(envMode.name());
    writer.field("dotEnv").list(hashable.getDotEnv());
    return hash(writer.toByteArray());
  }

  /** Hashes a path to fingerprint map, such as the inputs of a package. */
  public static String hashFileHashes(SortedMap<String, String> fileHashes) {
    CanonicalWriter writer = new CanonicalWriter("FileHashes", FORMAT_VERSION);
    writer.field("files").map(fileHashes);
    return hash(writer.toByteArray());
  }

  static String hash(byte[] canonical) {
    return String.format("%016x", XX.hashBytes(canonical));
  }

  private static ImmutableList<String> sorted(@Nullable List<String> values) {
    if (values == null) {
      return ImmutableList.of();
    }
    return ImmutableSortedSet.copyOf(values).asList();
  }

  @Nullable
  private static ImmutableList<String> sortedOrNull(@Nullable List<String> values) {
    return values == null ? null : sorted(values);
  }
}
