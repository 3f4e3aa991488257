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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import build.taskcache.common.RunState;
import build.taskcache.common.config.TaskCacheConfigs;
import build.taskcache.common.io.Directories;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.naming.ConfigurationException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CacheFactoryTest {
  private static final String HASH = "1122334455667788";

  private Path repo;
  private TaskCacheConfigs configs;
  private final List<String> warnings = new ArrayList<>();

  @Before
  public void setUp() throws IOException {
    repo = Files.createTempDirectory("cache-factory-test");
    configs = new TaskCacheConfigs();
  }

  @After
  public void tearDown() throws IOException {
    Directories.remove(repo);
  }

  private void configureRemote(String apiUrl) {
    configs.getRemote().setApiUrl(apiUrl);
    configs.getRemote().setToken("token");
    configs.getRemote().setTeamId("team_abc");
  }

  private Cache create() throws ConfigurationException {
    return CacheFactory.create(configs, repo, new RunState(), warnings::add);
  }

  @Test
  public void localCacheLivesUnderRepo() throws Exception {
    Files.write(repo.resolve("out.txt"), "out".getBytes(UTF_8));
    Cache cache = create();

    cache.put(repo, HASH, ImmutableList.of("out.txt"), 3);

    assertThat(Files.exists(repo.resolve(".turbo/cache/" + HASH + ".tar.zst"))).isTrue();
    assertThat(cache.exists(HASH)).isEqualTo(new CacheHitMetadata(CacheSource.LOCAL, 3));
  }

  @Test
  public void unconfiguredRemoteIsDisabled() throws Exception {
    configs.setCache("remote:rw");

    Cache cache = create();

    assertThat(cache.isEnabled()).isFalse();
    assertThat(cache.fetch(repo, HASH).isHit()).isFalse();
    assertThat(warnings).isEmpty();
  }

  @Test
  public void configuredRemoteIsQueried() throws Exception {
    MockWebServer server = new MockWebServer();
    server.enqueue(new MockResponse().setResponseCode(404));
    server.start();
    try {
      configs.setCache("remote:r");
      configureRemote(server.url("/api").toString());

      assertThat(create().fetch(repo, HASH).isHit()).isFalse();

      RecordedRequest request = server.takeRequest();
      assertThat(request.getPath()).isEqualTo("/api/v8/artifacts/" + HASH + "?teamId=team_abc");
      assertThat(request.getHeader("Authorization")).isEqualTo("Bearer token");
    } finally {
      server.shutdown();
    }
  }

  @Test
  public void malformedCacheActionsAreRejected() {
    configs.setCache("local:rwx");

    assertThrows(ConfigurationException.class, this::create);
  }

  @Test
  public void signatureRequiresKey() {
    configs.setCache("remote:rw");
    configureRemote("https://cache.example.com");
    configs.getRemote().setSignature(true);

    assertThrows(ConfigurationException.class, this::create);
  }

  @Test
  public void timeoutMustBePositive() {
    configs.setCache("remote:rw");
    configureRemote("https://cache.example.com");
    configs.getRemote().setTimeoutSeconds(0);

    assertThrows(ConfigurationException.class, this::create);
  }

  @Test
  public void emptyLocalDirIsRejected() {
    configs.setCache("local:rw");
    configs.getLocal().setDir("");

    assertThrows(ConfigurationException.class, this::create);
  }
}
