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

import build.taskcache.common.HttpStatusException;
import build.taskcache.common.Retrier.Backoff;
import build.taskcache.common.RunState;
import build.taskcache.common.io.Directories;
import com.google.common.base.Supplier;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.tls.HandshakeCertificates;
import okhttp3.tls.HeldCertificate;
import okio.Buffer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HttpArtifactClientTest {
  private static final String HASH = "0123456789abcdef";

  @SuppressWarnings("Guava")
  private static final Supplier<Backoff> IMMEDIATE_RETRIES =
      Backoff.exponential(Duration.ZERO, Duration.ZERO, 2, 0, 2);

  private static final HttpArtifactClient.ArtifactBodyHandler<String> READ_BODY =
      (body, response) -> new String(ByteStreams.toByteArray(body), UTF_8);

  private MockWebServer server;
  private RunState runState;
  private Path root;

  @Before
  public void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    runState = new RunState();
    root = Files.createTempDirectory("http-artifact-client-test");
  }

  @After
  public void tearDown() throws IOException {
    server.shutdown();
    Directories.remove(root);
  }

  private Path archive(String content) throws IOException {
    Path archive = Files.createTempFile(root, "artifact", ".tar.zst");
    Files.write(archive, content.getBytes(UTF_8));
    return archive;
  }

  @SuppressWarnings("Guava")
  private HttpArtifactClient newClient(Supplier<Backoff> backoff) {
    return newClient(new OkHttpClient(), "team_123", null, backoff);
  }

  @SuppressWarnings("Guava")
  private HttpArtifactClient newClient(
      OkHttpClient okHttpClient, String teamId, String teamSlug, Supplier<Backoff> backoff) {
    return new HttpArtifactClient(
        okHttpClient,
        server.url("/api").toString(),
        "secret-token",
        teamId,
        teamSlug,
        Duration.ofSeconds(5),
        runState,
        backoff);
  }

  private static MockResponse artifact(String body, long durationMs) {
    return new MockResponse()
        .setResponseCode(200)
        .setHeader(HttpArtifactClient.DURATION_HEADER, Long.toString(durationMs))
        .setBody(new Buffer().writeUtf8(body));
  }

  @Test
  public void putSendsArtifactWithHeaders() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(202));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    client.putArtifact(HASH, archive("archive"), 1500, "tag==");

    RecordedRequest request = server.takeRequest();
    assertThat(request.getMethod()).isEqualTo("PUT");
    assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/api/v8/artifacts/" + HASH);
    assertThat(request.getRequestUrl().queryParameter("teamId")).isEqualTo("team_123");
    assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret-token");
    assertThat(request.getHeader(HttpArtifactClient.DURATION_HEADER)).isEqualTo("1500");
    assertThat(request.getHeader(HttpArtifactClient.TAG_HEADER)).isEqualTo("tag==");
    assertThat(request.getHeader("Content-Type")).startsWith("application/octet-stream");
    assertThat(request.getBody().readUtf8()).isEqualTo("archive");
  }

  @Test
  public void slugScopesRequests() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(404));
    HttpArtifactClient client = newClient(new OkHttpClient(), null, "my-team", IMMEDIATE_RETRIES);

    client.fetchArtifact(HASH, READ_BODY);

    RecordedRequest request = server.takeRequest();
    assertThat(request.getRequestUrl().queryParameter("slug")).isEqualTo("my-team");
    assertThat(request.getRequestUrl().queryParameter("teamId")).isNull();
  }

  @Test
  public void fetchStreamsBodyWithMetadata() throws Exception {
    server.enqueue(artifact("archive", 900).setHeader(HttpArtifactClient.TAG_HEADER, "abc"));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);
    AtomicReference<HttpArtifactClient.ArtifactResponse> metadata = new AtomicReference<>();

    String body =
        client.fetchArtifact(
            HASH,
            (in, response) -> {
              metadata.set(response);
              return new String(ByteStreams.toByteArray(in), UTF_8);
            });

    assertThat(body).isEqualTo("archive");
    assertThat(metadata.get().getDurationMs()).isEqualTo(900);
    assertThat(metadata.get().getTag()).isEqualTo("abc");
  }

  @Test
  public void handlerFailureIsNotRetried() {
    server.enqueue(artifact("archive", 10));
    server.enqueue(artifact("archive", 10));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    IOException e =
        assertThrows(
            IOException.class,
            () ->
                client.fetchArtifact(
                    HASH,
                    (in, response) -> {
                      throw new IOException("disk full");
                    }));

    assertThat(e).hasMessageThat().isEqualTo("disk full");
    assertThat(server.getRequestCount()).isEqualTo(1);
    assertThat(runState.getRemoteFailures()).isEqualTo(0);
  }

  @Test
  public void notFoundIsAMiss() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(404));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    assertThat(client.fetchArtifact(HASH, READ_BODY)).isNull();
    assertThat(server.getRequestCount()).isEqualTo(1);
    assertThat(runState.getRemoteFailures()).isEqualTo(0);
  }

  @Test
  public void forbiddenIsAMissWithoutFailure() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(403));
    server.enqueue(new MockResponse().setResponseCode(403));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    assertThat(client.fetchArtifact(HASH, READ_BODY)).isNull();
    client.putArtifact(HASH, archive(""), 0, null);
    assertThat(runState.getRemoteFailures()).isEqualTo(0);
  }

  @Test
  public void existsUsesHead() throws Exception {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setHeader(HttpArtifactClient.DURATION_HEADER, "77"));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    HttpArtifactClient.ArtifactResponse response = client.artifactExists(HASH);

    assertThat(server.takeRequest().getMethod()).isEqualTo("HEAD");
    assertThat(response.getDurationMs()).isEqualTo(77);
  }

  @Test
  public void serviceUnavailableIsRetried() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(artifact("archive", 10));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    assertThat(client.fetchArtifact(HASH, READ_BODY)).isEqualTo("archive");
    assertThat(server.getRequestCount()).isEqualTo(3);
    assertThat(runState.getRemoteFailures()).isEqualTo(2);
  }

  @Test
  public void retriesAreBounded() {
    runState = new RunState(10);
    for (int i = 0; i < 4; i++) {
      server.enqueue(new MockResponse().setResponseCode(500));
    }
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    HttpStatusException e =
        assertThrows(HttpStatusException.class, () -> client.fetchArtifact(HASH, READ_BODY));

    assertThat(e.getCode()).isEqualTo(500);
    assertThat(server.getRequestCount()).isEqualTo(3);
  }

  @Test
  public void notImplementedIsNotRetried() {
    server.enqueue(new MockResponse().setResponseCode(501));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    assertThrows(HttpStatusException.class, () -> client.fetchArtifact(HASH, READ_BODY));

    assertThat(server.getRequestCount()).isEqualTo(1);
    assertThat(runState.getRemoteFailures()).isEqualTo(1);
  }

  @Test
  public void certificateFailureIsNotRetried() {
    HeldCertificate localhost =
        new HeldCertificate.Builder().addSubjectAlternativeName("localhost").build();
    HandshakeCertificates serverCertificates =
        new HandshakeCertificates.Builder().heldCertificate(localhost).build();
    server.useHttps(serverCertificates.sslSocketFactory(), false);
    // the client trusts only the platform roots
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    assertThrows(IOException.class, () -> client.fetchArtifact(HASH, READ_BODY));

    assertThat(runState.getRemoteFailures()).isEqualTo(1);
  }

  @Test
  public void invalidDurationIsNotRetried() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setHeader(HttpArtifactClient.DURATION_HEADER, "soon")
            .setBody("archive"));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    assertThrows(CacheException.class, () -> client.fetchArtifact(HASH, READ_BODY));

    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test
  public void trippedRunMakesNoRequests() throws Exception {
    Path empty = archive("");
    for (int i = 0; i < 3; i++) {
      server.enqueue(new MockResponse().setResponseCode(500));
    }
    HttpArtifactClient client = newClient(Backoff.NO_RETRIES);
    for (int i = 0; i < 3; i++) {
      assertThrows(HttpStatusException.class, () -> client.fetchArtifact(HASH, READ_BODY));
    }
    assertThat(runState.isTripped()).isTrue();

    assertThrows(TooManyFailuresException.class, () -> client.fetchArtifact(HASH, READ_BODY));
    assertThrows(
        TooManyFailuresException.class, () -> client.putArtifact(HASH, empty, 0, null));

    assertThat(server.getRequestCount()).isEqualTo(3);
  }

  @Test
  public void trippingStopsRetries() {
    for (int i = 0; i < 3; i++) {
      server.enqueue(new MockResponse().setResponseCode(503));
    }
    runState = new RunState(2);
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);

    assertThrows(HttpStatusException.class, () -> client.fetchArtifact(HASH, READ_BODY));

    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  public void cancelledClientRefusesRequests() {
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);
    client.cancel();

    assertThrows(IOException.class, () -> client.fetchArtifact(HASH, READ_BODY));

    assertThat(server.getRequestCount()).isEqualTo(0);
  }

  @Test
  public void cancelAbortsInFlightRequest() throws Exception {
    server.enqueue(artifact("archive", 10).setHeadersDelay(30, TimeUnit.SECONDS));
    HttpArtifactClient client = newClient(IMMEDIATE_RETRIES);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<String> fetch = executor.submit(() -> client.fetchArtifact(HASH, READ_BODY));
      assertThat(server.takeRequest(5, TimeUnit.SECONDS)).isNotNull();

      client.cancel();

      ExecutionException e =
          assertThrows(ExecutionException.class, () -> fetch.get(5, TimeUnit.SECONDS));
      assertThat(e).hasCauseThat().isInstanceOf(IOException.class);
      assertThat(server.getRequestCount()).isEqualTo(1);
      assertThat(runState.getRemoteFailures()).isEqualTo(0);
    } finally {
      executor.shutdownNow();
    }
  }
}
