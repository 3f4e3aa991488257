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

package build.taskcache.common;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import build.taskcache.common.Retrier.Backoff;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.security.cert.CertificateException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import javax.net.ssl.SSLHandshakeException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RetrierTest {
  private static class RecordingRetrier extends Retrier {
    final List<Long> sleeps = new ArrayList<>();

    RecordingRetrier() {
      super(REMOTE_CACHE_BACKOFF, HTTP_IS_RETRIABLE);
    }

    @Override
    protected void sleep(long timeMillis) {
      sleeps.add(timeMillis);
    }
  }

  @Test
  public void remoteCacheBackoffIsBounded() {
    Backoff backoff = Retrier.REMOTE_CACHE_BACKOFF.get();

    assertThat(backoff.nextDelayMillis()).isEqualTo(2000L);
    assertThat(backoff.nextDelayMillis()).isEqualTo(4000L);
    assertThat(backoff.nextDelayMillis()).isEqualTo(Backoff.STOP);
    assertThat(backoff.getRetryAttempts()).isEqualTo(2);
  }

  @Test
  public void exponentialBackoffIsCappedAtMax() {
    Backoff backoff =
        Backoff.exponential(Duration.ofSeconds(6), Duration.ofSeconds(10), 2, 0, 3).get();

    assertThat(backoff.nextDelayMillis()).isEqualTo(6000L);
    assertThat(backoff.nextDelayMillis()).isEqualTo(10000L);
    assertThat(backoff.nextDelayMillis()).isEqualTo(10000L);
  }

  @Test
  public void statusCodesAreClassified() {
    assertThat(Retrier.HTTP_IS_RETRIABLE.apply(new HttpStatusException(429, "Too Many Requests")))
        .isTrue();
    assertThat(Retrier.HTTP_IS_RETRIABLE.apply(new HttpStatusException(500, "Internal"))).isTrue();
    assertThat(Retrier.HTTP_IS_RETRIABLE.apply(new HttpStatusException(503, "Unavailable")))
        .isTrue();
    assertThat(Retrier.HTTP_IS_RETRIABLE.apply(new HttpStatusException(501, "Not Implemented")))
        .isFalse();
    assertThat(Retrier.HTTP_IS_RETRIABLE.apply(new HttpStatusException(400, "Bad Request")))
        .isFalse();
    assertThat(Retrier.HTTP_IS_RETRIABLE.apply(new HttpStatusException(401, "Unauthorized")))
        .isFalse();
  }

  @Test
  public void transportErrorsRetryExceptCertificateFailures() {
    assertThat(Retrier.HTTP_IS_RETRIABLE.apply(new SocketTimeoutException("timeout"))).isTrue();

    SSLHandshakeException handshake = new SSLHandshakeException("PKIX path building failed");
    handshake.initCause(new CertificateException("unable to find valid certification path"));
    assertThat(Retrier.isCertificateFailure(handshake)).isTrue();
    assertThat(Retrier.HTTP_IS_RETRIABLE.apply(handshake)).isFalse();

    assertThat(Retrier.HTTP_IS_RETRIABLE.apply(new IllegalStateException("bug"))).isFalse();
  }

  @Test
  public void retriesUntilSuccess() throws Exception {
    RecordingRetrier retrier = new RecordingRetrier();
    AtomicInteger calls = new AtomicInteger();

    String result =
        retrier.execute(
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new HttpStatusException(503, "Service Unavailable");
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(calls.get()).isEqualTo(3);
    assertThat(retrier.sleeps).containsExactly(2000L, 4000L).inOrder();
  }

  @Test
  public void lastRetriableErrorIsRethrownWhenExhausted() {
    RecordingRetrier retrier = new RecordingRetrier();
    AtomicInteger calls = new AtomicInteger();

    HttpStatusException e =
        assertThrows(
            HttpStatusException.class,
            () ->
                retrier.execute(
                    () -> {
                      calls.incrementAndGet();
                      throw new HttpStatusException(502, "Bad Gateway");
                    }));

    assertThat(e.getCode()).isEqualTo(502);
    assertThat(calls.get()).isEqualTo(3);
  }

  @Test
  public void nonRetriableErrorIsNotRetried() {
    RecordingRetrier retrier = new RecordingRetrier();
    AtomicInteger calls = new AtomicInteger();

    assertThrows(
        HttpStatusException.class,
        () ->
            retrier.execute(
                () -> {
                  calls.incrementAndGet();
                  throw new HttpStatusException(501, "Not Implemented");
                }));

    assertThat(calls.get()).isEqualTo(1);
    assertThat(retrier.sleeps).isEmpty();
  }

  @Test
  public void checkedExceptionsAreWrapped() {
    Retrier retrier = new Retrier(Backoff.NO_RETRIES, e -> true);

    RetryException e =
        assertThrows(
            RetryException.class,
            () ->
                retrier.execute(
                    () -> {
                      throw new Exception("checked");
                    }));

    assertThat(e).hasCauseThat().hasMessageThat().isEqualTo("checked");
  }

  @Test
  public void noRetriesFailsImmediately() {
    AtomicInteger calls = new AtomicInteger();

    assertThrows(
        IOException.class,
        () ->
            Retrier.NO_RETRIES.execute(
                () -> {
                  calls.incrementAndGet();
                  throw new IOException("down");
                }));

    assertThat(calls.get()).isEqualTo(1);
  }
}
