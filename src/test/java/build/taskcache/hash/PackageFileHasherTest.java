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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import build.taskcache.common.FileFingerprinter;
import build.taskcache.common.io.Directories;
import build.taskcache.glob.GlobEscapeException;
import build.taskcache.glob.Globber;
import build.taskcache.task.PackageTask;
import build.taskcache.task.TaskDefinition;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PackageFileHasherTest {
  private Path repo;
  private Path packageDir;
  private PackageFileHasher hasher;

  @Before
  public void setUp() throws IOException {
    repo = Files.createTempDirectory("package-file-hasher-test");
    packageDir = repo.resolve("packages/a");
    write("packages/a/package.json", "{}");
    write("packages/a/src/index.js", "console.log('a');\n");
    write("packages/a/dist/index.js", "built");
    write("packages/a/node_modules/dep/index.js", "dep");
    write("packages/a/.turbo/turbo-build.log", "log");
    write("packages/a/.git/HEAD", "ref");
    hasher = new PackageFileHasher(new Globber(repo));
  }

  @After
  public void tearDown() throws IOException {
    Directories.remove(repo);
  }

  private void write(String path, String content) throws IOException {
    Path file = repo.resolve(path);
    Files.createDirectories(file.getParent());
    Files.write(file, content.getBytes(UTF_8));
  }

  private static PackageTask buildTask(TaskDefinition definition) {
    return new PackageTask("a", "packages/a", "build", definition);
  }

  @Test
  public void defaultInputsSkipOutputsLogsAndDependencies() throws IOException {
    TaskDefinition definition = new TaskDefinition();
    definition.setOutputs(ImmutableList.of("dist/**"));

    ImmutableSortedMap<String, String> files = hasher.hashInputs(buildTask(definition));

    assertThat(files.keySet()).containsExactly("package.json", "src/index.js").inOrder();
    assertThat(files.get("src/index.js"))
        .isEqualTo(FileFingerprinter.hash(packageDir.resolve("src/index.js")));
  }

  @Test
  public void declaredInputsAreResolvedAgainstPackage() throws IOException {
    TaskDefinition definition = new TaskDefinition();
    definition.setInputs(ImmutableList.of("src/**", "package.json", "!src/**/*.test.js"));
    write("packages/a/src/index.test.js", "test");

    assertThat(hasher.hashInputs(buildTask(definition)).keySet())
        .containsExactly("package.json", "src/index.js");
  }

  @Test
  public void dotEnvFilesAreOptionalInputs() throws IOException {
    TaskDefinition definition = new TaskDefinition();
    definition.setInputs(ImmutableList.of("src/**"));
    definition.setDotEnv(ImmutableList.of(".env", ".env.local"));
    write("packages/a/.env", "A=1");

    assertThat(hasher.hashInputs(buildTask(definition)).keySet())
        .containsExactly(".env", "src/index.js");
  }

  @Test(expected = GlobEscapeException.class)
  public void escapingInputIsAnError() throws IOException {
    TaskDefinition definition = new TaskDefinition();
    definition.setInputs(ImmutableList.of("../../../**"));

    hasher.hashInputs(buildTask(definition));
  }

  @Test
  public void escapingDotEnvIsAnError() throws IOException {
    Path outside = repo.resolveSibling(repo.getFileName() + ".env");
    Files.write(outside, "SECRET=1".getBytes(UTF_8));
    TaskDefinition definition = new TaskDefinition();
    definition.setInputs(ImmutableList.of("src/**"));
    definition.setDotEnv(ImmutableList.of("../../../" + outside.getFileName()));
    try {
      GlobEscapeException e =
          assertThrows(GlobEscapeException.class, () -> hasher.hashInputs(buildTask(definition)));
      assertThat(e.getPattern()).isEqualTo("../../../" + outside.getFileName());
    } finally {
      Files.delete(outside);
    }
  }

  @Test
  public void dotEnvAboveThePackageWithinRepoIsAllowed() throws IOException {
    write(".env", "SHARED=1");
    TaskDefinition definition = new TaskDefinition();
    definition.setInputs(ImmutableList.of("src/**"));
    definition.setDotEnv(ImmutableList.of("../../.env"));

    assertThat(hasher.hashInputs(buildTask(definition)))
        .containsEntry("../../.env", FileFingerprinter.hash(repo.resolve(".env")));
  }
}
