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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PackageTaskTest {
  private static PackageTask task(String taskName, String... outputs) {
    TaskDefinition definition = new TaskDefinition();
    definition.setOutputs(ImmutableList.copyOf(outputs));
    return new PackageTask("web", "apps/web", taskName, definition);
  }

  @Test
  public void taskIdJoinsPackageAndTask() {
    assertThat(task("build").getTaskId()).isEqualTo("web#build");
  }

  @Test
  public void logFileLivesUnderPackage() {
    PackageTask task = task("build");

    assertThat(task.getLogFile()).isEqualTo(".turbo/turbo-build.log");
    assertThat(task.getRepoRelativeLogFile()).isEqualTo("apps/web/.turbo/turbo-build.log");
  }

  @Test
  public void colonsInTaskNamesAreEscapedInLogName() {
    assertThat(task("test:unit").getLogFile()).isEqualTo(".turbo/turbo-test$unit.log");
  }

  @Test
  public void outputsAlwaysIncludeLog() {
    TaskOutputs outputs = task("build", "dist/**", "!dist/**/*.map").getRepoRelativeOutputs();

    assertThat(outputs.getInclusions())
        .containsExactly("apps/web/.turbo/turbo-build.log", "apps/web/dist/**")
        .inOrder();
    assertThat(outputs.getExclusions()).containsExactly("apps/web/dist/**/*.map");
  }

  @Test
  public void outputsAreSortedAndDeduplicated() {
    TaskOutputs outputs = TaskOutputs.fromGlobs(ImmutableList.of("b/**", "a/**", "b/**"));

    assertThat(outputs.getInclusions()).containsExactly("a/**", "b/**").inOrder();
    assertThat(outputs.isEmpty()).isFalse();
  }

  @Test
  public void uncacheableDefinitions() {
    TaskDefinition definition = new TaskDefinition();
    assertThat(definition.isCacheable()).isTrue();

    definition.setPersistent(true);
    assertThat(definition.isCacheable()).isFalse();
  }
}
