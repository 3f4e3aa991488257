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

import build.taskcache.common.HttpStatusException;
import build.taskcache.common.Retrier;
import build.taskcache.common.Retrier.Backoff;
import build.taskcache.common.RunState;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import lombok.Data;
import lombok.extern.java.Log;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Client for the remote artifact API.
 *
 * <p>Artifacts are addressed as {@code <apiUrl>/v8/artifacts/<hash>}, scoped by a {@code teamId}
 * or {@code slug} query parameter and authorized with a bearer token. Each request is retried per
 * {@link Retrier#HTTP_IS_RETRIABLE}. Every failed attempt is recorded in the {@link RunState}, and
 * once it trips no further requests are made.
 */
@Log
public class HttpArtifactClient {
  public static final String DURATION_HEADER = "x-artifact-duration";
  public static final String TAG_HEADER = "x-artifact-tag";
  public static final String USER_AGENT =
      String.format(
          "taskcache %s java/%s",
          MoreObjects.firstNonNull(
              HttpArtifactClient.class.getPackage().getImplementationVersion(), "dev"),
          System.getProperty("java.specification.version"));

  private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
  private static final String ARTIFACTS_PATH = "v8/artifacts";

  /** Metadata of a successful response. */
  @Data
  public static class ArtifactResponse {
    private final long durationMs;
    @Nullable private final String tag;
  }

  /** Consumes a downloaded artifact body while the response is still open. */
  @FunctionalInterface
  public interface ArtifactBodyHandler<T> {
    T handle(InputStream body, ArtifactResponse response) throws IOException;
  }

  // failures while consuming a body are neither retried nor counted against the remote
  private static final class BodyHandlerException extends RuntimeException {
    private static final long serialVersionUID = 1;

    BodyHandlerException(IOException cause) {
      super(cause);
    }

    @Override
    public synchronized IOException getCause() {
      return (IOException) super.getCause();
    }
  }

  private final OkHttpClient client;
  private final HttpUrl apiUrl;
  private final String token;
  @Nullable private final String teamId;
  @Nullable private final String teamSlug;
  private final RunState runState;
  private final Retrier retrier;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicBoolean forbiddenLogged = new AtomicBoolean();

  public HttpArtifactClient(
      OkHttpClient client,
      String apiUrl,
      String token,
      @Nullable String teamId,
      @Nullable String teamSlug,
      Duration timeout,
      RunState runState) {
    this(
        client,
        apiUrl,
        token,
        teamId,
        teamSlug,
        timeout,
        runState,
        Retrier.REMOTE_CACHE_BACKOFF);
  }

  @SuppressWarnings("Guava")
  public HttpArtifactClient(
      OkHttpClient client,
      String apiUrl,
      String token,
      @Nullable String teamId,
      @Nullable String teamSlug,
      Duration timeout,
      RunState runState,
      Supplier<Backoff> backoff) {
    this.client = client.newBuilder().callTimeout(timeout).build();
    this.apiUrl = HttpUrl.get(apiUrl);
    this.token = token;
    this.teamId = teamId;
    this.teamSlug = teamSlug;
    this.runState = runState;
    this.retrier = new Retrier(backoff, this::isRetriable);
  }

  // malformed responses are not transient, and nothing is retried once the run gives up on remote
  private boolean isRetriable(Exception e) {
    return !cancelled.get()
        && !(e instanceof CacheException)
        && runState.okToRequest()
        && Retrier.HTTP_IS_RETRIABLE.apply(e);
  }

  @Nullable
  public String getTeamId() {
    return teamId;
  }

  HttpUrl artifactUrl(String hash) {
    HttpUrl.Builder url = apiUrl.newBuilder().addPathSegments(ARTIFACTS_PATH).addPathSegment(hash);
    if (!Strings.isNullOrEmpty(teamId)) {
      url.addQueryParameter("teamId", teamId);
    }
    if (!Strings.isNullOrEmpty(teamSlug)) {
      url.addQueryParameter("slug", teamSlug);
    }
    return url.build();
  }

  private Request.Builder newRequest(String hash) {
    return new Request.Builder()
        .url(artifactUrl(hash))
        .header("Authorization", "Bearer " + token)
        .header("User-Agent", USER_AGENT);
  }

  /** Uploads an artifact body, streamed from {@code body} on each attempt. */
  public void putArtifact(String hash, Path body, long durationMs, @Nullable String tag)
      throws IOException, InterruptedException {
    Request.Builder request =
        newRequest(hash)
            .header("Content-Type", OCTET_STREAM.toString())
            .header(DURATION_HEADER, Long.toString(durationMs))
            .put(RequestBody.create(body.toFile(), OCTET_STREAM));
    if (tag != null) {
      request.header(TAG_HEADER, tag);
    }
    Request built = request.build();
    execute(
        "PUT " + hash,
        () -> {
          try (Response response = client.newCall(built).execute()) {
            if (isForbidden(response)) {
              return null;
            }
            checkSuccess(response);
            return null;
          }
        });
  }

  /**
   * Downloads an artifact and hands its body stream to {@code handler}, or returns null if the
   * remote does not have it. The request is retried, but a failure inside the handler is not.
   */
  @Nullable
  public <T> T fetchArtifact(String hash, ArtifactBodyHandler<T> handler)
      throws IOException, InterruptedException {
    Request request = newRequest(hash).get().build();
    try {
      return execute(
          "GET " + hash,
          () -> {
            try (Response response = client.newCall(request).execute()) {
              if (response.code() == 404 || isForbidden(response)) {
                return null;
              }
              checkSuccess(response);
              ArtifactResponse metadata =
                  new ArtifactResponse(parseDuration(hash, response), tagOf(response));
              ResponseBody body = response.body();
              try (InputStream in =
                  body == null ? InputStream.nullInputStream() : body.byteStream()) {
                return handler.handle(in, metadata);
              } catch (IOException e) {
                throw new BodyHandlerException(e);
              }
            }
          });
    } catch (BodyHandlerException e) {
      throw e.getCause();
    }
  }

  /** Checks for an artifact without downloading it, or returns null if it is absent. */
  @Nullable
  public ArtifactResponse artifactExists(String hash) throws IOException, InterruptedException {
    Request request = newRequest(hash).head().build();
    return execute(
        "HEAD " + hash,
        () -> {
          try (Response response = client.newCall(request).execute()) {
            if (response.code() == 404 || isForbidden(response)) {
              return null;
            }
            checkSuccess(response);
            return new ArtifactResponse(parseDuration(hash, response), tagOf(response));
          }
        });
  }

  /** Aborts in-flight requests and refuses new ones. */
  public void cancel() {
    cancelled.set(true);
    client.dispatcher().cancelAll();
  }

  private <T> T execute(String description, Callable<T> attempt)
      throws IOException, InterruptedException {
    if (!runState.okToRequest()) {
      throw new TooManyFailuresException(runState.getRemoteFailures());
    }
    return retrier.execute(
        () -> {
          if (cancelled.get()) {
            throw new IOException(description + " cancelled");
          }
          if (!runState.okToRequest()) {
            throw new TooManyFailuresException(runState.getRemoteFailures());
          }
          try {
            return attempt.call();
          } catch (IOException e) {
            if (!cancelled.get()) {
              runState.recordRemoteFailure();
            }
            log.fine(String.format("%s failed: %s", description, e.getMessage()));
            throw e;
          }
        });
  }

  private boolean isForbidden(Response response) {
    if (response.code() != 403) {
      return false;
    }
    if (forbiddenLogged.compareAndSet(false, true)) {
      log.warning("remote caching is disabled for this team, the remote cache will be skipped");
    }
    return true;
  }

  private static void checkSuccess(Response response) throws HttpStatusException {
    if (!response.isSuccessful()) {
      throw new HttpStatusException(response.code(), response.message());
    }
  }

  private static long parseDuration(String hash, Response response) throws CacheException {
    String duration = response.header(DURATION_HEADER);
    if (Strings.isNullOrEmpty(duration)) {
      return 0;
    }
    try {
      return Long.parseLong(duration.trim());
    } catch (NumberFormatException e) {
      throw new CacheException(
          String.format("invalid %s header for %s: %s", DURATION_HEADER, hash, duration), e);
    }
  }

  @Nullable
  private static String tagOf(Response response) {
    return response.header(TAG_HEADER);
  }
}
