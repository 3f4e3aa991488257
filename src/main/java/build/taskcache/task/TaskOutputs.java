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

package build.taskcache.task;

import build.taskcache.common.UnixPaths;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Output globs of a task, split into sorted inclusions and exclusions. */
@Getter
@EqualsAndHashCode
@ToString
public final class TaskOutputs {
  private static final String EXCLUSION_PREFIX = "!";

  private final ImmutableList<String> inclusions;
  private final ImmutableList<String> exclusions;

  public TaskOutputs(Iterable<String> inclusions, Iterable<String> exclusions) {
    this.inclusions = ImmutableSortedSet.copyOf(inclusions).asList();
    this.exclusions = ImmutableSortedSet.copyOf(exclusions).asList();
  }

  /** Splits a glob list in which exclusions carry a leading {@code !}. */
  public static TaskOutputs fromGlobs(List<String> globs) {
    ImmutableList.Builder<String> inclusions = ImmutableList.builder();
    ImmutableList.Builder<String> exclusions = ImmutableList.builder();
    for (String glob : globs) {
      if (glob.startsWith(EXCLUSION_PREFIX)) {
        exclusions.add(glob.substring(EXCLUSION_PREFIX.length()));
      } else {
        inclusions.add(glob);
      }
    }
    return new TaskOutputs(inclusions.build(), exclusions.build());
  }

  public TaskOutputs withInclusion(String glob) {
    return new TaskOutputs(
        ImmutableList.<String>builder().addAll(inclusions).add(glob).build(), exclusions);
  }

  /** Prefixes every glob with {@code directory}. */
  public TaskOutputs anchoredAt(String directory) {
    return new TaskOutputs(anchor(directory, inclusions), anchor(directory, exclusions));
  }

  private static ImmutableList<String> anchor(String directory, List<String> globs) {
    ImmutableList.Builder<String> anchored = ImmutableList.builder();
    for (String glob : globs) {
      anchored.add(UnixPaths.join(directory, UnixPaths.toUnixPath(glob)));
    }
    return anchored.build();
  }

  public boolean isEmpty() {
    return inclusions.isEmpty();
  }
}
