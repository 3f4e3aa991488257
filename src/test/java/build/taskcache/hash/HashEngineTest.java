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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import build.taskcache.common.EnvMode;
import build.taskcache.task.TaskOutputs;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.TreeMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HashEngineTest {
  private static TaskHashable newTaskHashable() {
    TaskHashable hashable = new TaskHashable();
    hashable.setGlobalHash("0123456789abcdef");
    hashable.setTaskDependencyHashes(ImmutableList.of("bbbb", "aaaa"));
    hashable.setPackageDir("packages/a");
    hashable.setHashOfFiles("feedfacecafebeef");
    hashable.setTask("build");
    hashable.setOutputs(TaskOutputs.fromGlobs(ImmutableList.of("dist/**", "!dist/**/*.map")));
    hashable.setEnv(ImmutableList.of("NODE_ENV"));
    hashable.setResolvedEnvVars(ImmutableList.of("NODE_ENV=production"));
    hashable.setPassThroughEnv(ImmutableList.of("AWS_SECRET_ACCESS_KEY"));
    hashable.setEnvMode(EnvMode.STRICT);
    return hashable;
  }

  private static GlobalHashable newGlobalHashable() {
    GlobalHashable hashable = new GlobalHashable();
    hashable.setGlobalFileHashMap(new TreeMap<>(ImmutableMap.of("tsconfig.json", "abc123")));
    hashable.setEnv(ImmutableList.of("CI"));
    hashable.setResolvedEnvVars(ImmutableList.of("CI=true"));
    return hashable;
  }

  @Test
  public void taskHashIsDeterministic() {
    String first = HashEngine.computeTaskHash(newTaskHashable());
    String second = HashEngine.computeTaskHash(newTaskHashable());

    assertThat(first).isEqualTo(second);
    assertThat(first).matches("[0-9a-f]{16}");
  }

  @Test
  public void globalHashIsDeterministic() {
    assertThat(HashEngine.computeGlobalHash(newGlobalHashable()))
        .isEqualTo(HashEngine.computeGlobalHash(newGlobalHashable()));
  }

  @Test
  public void dependencyOrderDoesNotMatter() {
    TaskHashable reordered = newTaskHashable();
    reordered.setTaskDependencyHashes(ImmutableList.of("aaaa", "bbbb"));

    assertThat(HashEngine.computeTaskHash(reordered))
        .isEqualTo(HashEngine.computeTaskHash(newTaskHashable()));
  }

  @Test
  public void inputFileChangesTheHash() {
    TaskHashable changed = newTaskHashable();
    changed.setHashOfFiles("0000000000000000");

    assertThat(HashEngine.computeTaskHash(changed))
        .isNotEqualTo(HashEngine.computeTaskHash(newTaskHashable()));
  }

  @Test
  public void declaredEnvValueChangesTheHash() {
    TaskHashable changed = newTaskHashable();
    changed.setResolvedEnvVars(ImmutableList.of("NODE_ENV=development"));

    assertThat(HashEngine.computeTaskHash(changed))
        .isNotEqualTo(HashEngine.computeTaskHash(newTaskHashable()));
  }

  @Test
  public void passThroughNamesCountButOnlyInStrictMode() {
    TaskHashable renamed = newTaskHashable();
    renamed.setPassThroughEnv(ImmutableList.of("GITHUB_TOKEN"));
    assertThat(HashEngine.computeTaskHash(renamed))
        .isNotEqualTo(HashEngine.computeTaskHash(newTaskHashable()));

    TaskHashable loose = newTaskHashable();
    loose.setEnvMode(EnvMode.LOOSE);
    TaskHashable looseRenamed = newTaskHashable();
    looseRenamed.setEnvMode(EnvMode.LOOSE);
    looseRenamed.setPassThroughEnv(ImmutableList.of("GITHUB_TOKEN"));
    assertThat(HashEngine.computeTaskHash(looseRenamed))
        .isEqualTo(HashEngine.computeTaskHash(loose));
  }

  @Test
  public void strictModeTreatsUndeclaredPassThroughAsEmpty() {
    TaskHashable undeclared = newTaskHashable();
    undeclared.setPassThroughEnv(null);
    TaskHashable empty = newTaskHashable();
    empty.setPassThroughEnv(ImmutableList.of());

    assertThat(HashEngine.computeTaskHash(undeclared))
        .isEqualTo(HashEngine.computeTaskHash(empty));
  }

  @Test
  public void adjacentFieldsDoNotRunTogether() {
    TaskHashable first = newTaskHashable();
    first.setPackageDir("packages/ab");
    first.setTask("uild");
    TaskHashable second = newTaskHashable();
    second.setPackageDir("packages/a");
    second.setTask("build");

    assertThat(HashEngine.computeTaskHash(first))
        .isNotEqualTo(HashEngine.computeTaskHash(second));
  }

  @Test
  public void globalHashDistinguishesAbsentFromEmptyPassThrough() {
    GlobalHashable absent = newGlobalHashable();
    GlobalHashable empty = newGlobalHashable();
    empty.setPassThroughEnv(ImmutableList.of());

    assertThat(HashEngine.computeGlobalHash(absent))
        .isNotEqualTo(HashEngine.computeGlobalHash(empty));
  }

  @Test
  public void unresolvedEnvModeIsRejected() {
    TaskHashable infer = newTaskHashable();
    infer.setEnvMode(EnvMode.INFER);

    assertThrows(IllegalArgumentException.class, () -> HashEngine.computeTaskHash(infer));
  }

  @Test
  public void missingGlobalHashIsRejected() {
    TaskHashable hashable = newTaskHashable();
    hashable.setGlobalHash(null);

    assertThrows(NullPointerException.class, () -> HashEngine.computeTaskHash(hashable));
  }

  @Test
  public void fileHashesAreOrderInsensitive() {
    ImmutableSortedMap<String, String> files =
        ImmutableSortedMap.of("b.js", "2222", "a.js", "1111");
    TreeMap<String, String> same = new TreeMap<>();
    same.put("a.js", "1111");
    same.put("b.js", "2222");

    assertThat(HashEngine.hashFileHashes(files)).isEqualTo(HashEngine.hashFileHashes(same));
    same.put("b.js", "3333");
    assertThat(HashEngine.hashFileHashes(files)).isNotEqualTo(HashEngine.hashFileHashes(same));
  }
}
