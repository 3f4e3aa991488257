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

package build.taskcache.runcache;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import build.taskcache.common.io.Directories;
import build.taskcache.glob.Globber;
import build.taskcache.task.TaskOutputs;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InMemoryOutputWatcherTest {
  private static final String HASH = "feedfacecafebeef";

  private Path repo;
  private InMemoryOutputWatcher watcher;
  private TaskOutputs outputs;

  @Before
  public void setUp() throws IOException {
    repo = Files.createTempDirectory("output-watcher-test");
    write("packages/a/dist/index.js", "built");
    write("packages/a/dist/index.js.map", "map");
    write("packages/a/.turbo/turbo-build.log", "log");
    watcher = new InMemoryOutputWatcher(new Globber(repo));
    outputs =
        new TaskOutputs(
            ImmutableList.of("packages/a/.turbo/turbo-build.log", "packages/a/dist/**"),
            ImmutableList.of("packages/a/dist/**/*.map"));
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

  @Test
  public void unknownHashHasEverythingChanged() throws IOException {
    assertThat(watcher.getChangedOutputs(HASH, outputs)).isEqualTo(outputs.getInclusions());
  }

  @Test
  public void writtenOutputsAreUnchanged() throws IOException {
    watcher.notifyOutputsWritten(HASH, outputs);

    assertThat(watcher.getChangedOutputs(HASH, outputs)).isEmpty();
    assertThat(watcher.getChangedOutputs("another", outputs)).hasSize(2);
  }

  @Test
  public void editedFileChangesItsGlob() throws IOException {
    watcher.notifyOutputsWritten(HASH, outputs);

    write("packages/a/dist/index.js", "rebuilt");

    assertThat(watcher.getChangedOutputs(HASH, outputs)).containsExactly("packages/a/dist/**");
  }

  @Test
  public void deletedFileChangesItsGlob() throws IOException {
    watcher.notifyOutputsWritten(HASH, outputs);

    Files.delete(repo.resolve("packages/a/.turbo/turbo-build.log"));

    assertThat(watcher.getChangedOutputs(HASH, outputs))
        .containsExactly("packages/a/.turbo/turbo-build.log");
  }

  @Test
  public void excludedFilesAreIgnored() throws IOException {
    watcher.notifyOutputsWritten(HASH, outputs);

    write("packages/a/dist/index.js.map", "new map");

    assertThat(watcher.getChangedOutputs(HASH, outputs)).isEmpty();
  }

  @Test
  public void newGlobIsChanged() throws IOException {
    watcher.notifyOutputsWritten(HASH, outputs);
    TaskOutputs wider = outputs.withInclusion("packages/a/types/**");

    assertThat(watcher.getChangedOutputs(HASH, wider)).containsExactly("packages/a/types/**");
  }

  @Test
  public void deletedBareDirectoryChangesItsGlob() throws IOException {
    TaskOutputs directory =
        new TaskOutputs(ImmutableList.of("packages/a/dist"), ImmutableList.of());
    watcher.notifyOutputsWritten(HASH, directory);
    assertThat(watcher.getChangedOutputs(HASH, directory)).isEmpty();

    Directories.remove(repo.resolve("packages/a/dist"));

    assertThat(watcher.getChangedOutputs(HASH, directory)).containsExactly("packages/a/dist");
  }

  @Test
  public void newEmptyDirectoryChangesItsGlob() throws IOException {
    watcher.notifyOutputsWritten(HASH, outputs);

    Files.createDirectories(repo.resolve("packages/a/dist/chunks"));

    assertThat(watcher.getChangedOutputs(HASH, outputs)).containsExactly("packages/a/dist/**");
  }
}
