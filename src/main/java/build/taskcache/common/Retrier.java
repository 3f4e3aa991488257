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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.base.Supplier;
import com.google.common.base.Throwables;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.security.cert.CertPathBuilderException;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLPeerUnverifiedException;
import lombok.extern.java.Log;

/**
 * Supports execution with retries on particular failures. The retrier is ThreadSafe.
 *
 * <p>Example usage:
 *
 * <pre>
 * byte[] body = retrier.execute(() -> fetchOnce(hash));
 * </pre>
 */
@Log
public class Retrier {
  /** A sequence of delays between attempts. Instances are single-use and not thread safe. */
  public interface Backoff {
    /** Returned by {@link #nextDelayMillis()} when no attempt remains. */
    long STOP = -1L;

    /** The delay before the next attempt, or {@link #STOP}. */
    long nextDelayMillis();

    /** Delays handed out so far, excluding {@link #STOP}. */
    int getRetryAttempts();

    @SuppressWarnings("Guava")
    Supplier<Backoff> NO_RETRIES = () -> new Exponential(0, 0, 2, 0, 0);

    /**
     * Delays start at {@code initial} and grow by {@code multiplier} up to {@code max}, each
     * randomized by up to {@code jitter} of itself in either direction.
     *
     * @param maxAttempts number of retries after the first attempt, 0 for none
     */
    @SuppressWarnings("Guava")
    static Supplier<Backoff> exponential(
        Duration initial, Duration max, double multiplier, double jitter, int maxAttempts) {
      Preconditions.checkArgument(multiplier > 1, "multiplier must be > 1");
      Preconditions.checkArgument(jitter >= 0 && jitter <= 1, "jitter must be within [0, 1]");
      Preconditions.checkArgument(maxAttempts >= 0, "maxAttempts must be >= 0");
      long initialMillis = initial.toMillis();
      long maxMillis = max.toMillis();
      return () -> new Exponential(initialMillis, maxMillis, multiplier, jitter, maxAttempts);
    }
  }

  private static final class Exponential implements Backoff {
    private final long maxMillis;
    private final double multiplier;
    private final double jitter;
    private final int maxAttempts;
    private long delayMillis;
    private int attempts = 0;

    Exponential(
        long initialMillis, long maxMillis, double multiplier, double jitter, int maxAttempts) {
      this.delayMillis = initialMillis;
      this.maxMillis = maxMillis;
      this.multiplier = multiplier;
      this.jitter = jitter;
      this.maxAttempts = maxAttempts;
    }

    @Override
    public long nextDelayMillis() {
      if (attempts >= maxAttempts) {
        return STOP;
      }
      attempts++;
      long delay = delayMillis;
      if (jitter > 0) {
        delay = (long) (delay * (1 + jitter * (ThreadLocalRandom.current().nextDouble(2.0) - 1)));
      }
      // the unjittered delay drives growth
      delayMillis = Math.min((long) (delayMillis * multiplier), maxMillis);
      return Math.min(delay, maxMillis);
    }

    @Override
    public int getRetryAttempts() {
      return attempts;
    }
  }

  /** Remote cache backoff: 2s floor, 10s ceiling, at most 2 retries. */
  @SuppressWarnings("Guava")
  public static final Supplier<Backoff> REMOTE_CACHE_BACKOFF =
      Backoff.exponential(
          /* initial= */ Duration.ofSeconds(2),
          /* max= */ Duration.ofSeconds(10),
          /* multiplier= */ 2,
          /* jitter= */ 0.0,
          /* maxAttempts= */ 2);

  /**
   * Retries throttling, server errors other than 501 Not Implemented, and transport failures that
   * are not certificate verification failures or interruptions.
   */
  @SuppressWarnings("Guava")
  public static final Predicate<Exception> HTTP_IS_RETRIABLE =
      e -> {
        if (e instanceof HttpStatusException) {
          int code = ((HttpStatusException) e).getCode();
          return code == 429 || (code >= 500 && code != 501);
        }
        if (isCertificateFailure(e)) {
          return false;
        }
        if (e instanceof InterruptedIOException && Thread.currentThread().isInterrupted()) {
          return false;
        }
        return e instanceof IOException;
      };

  @SuppressWarnings("Guava")
  public static final Predicate<Exception> RETRY_NONE = Predicates.alwaysFalse();

  public static final Retrier NO_RETRIES = new Retrier(Backoff.NO_RETRIES, RETRY_NONE);

  @SuppressWarnings("Guava")
  private final Supplier<Backoff> backoffSupplier;

  @SuppressWarnings("Guava")
  private final Predicate<Exception> isRetriable;

  @SuppressWarnings("Guava")
  public Retrier(Supplier<Backoff> backoffSupplier, Predicate<Exception> isRetriable) {
    this.backoffSupplier = backoffSupplier;
    this.isRetriable = isRetriable;
  }

  public static boolean isCertificateFailure(Throwable t) {
    for (Throwable cause : Throwables.getCausalChain(t)) {
      if (cause instanceof SSLPeerUnverifiedException
          || cause instanceof CertificateException
          || cause instanceof CertPathBuilderException
          || cause instanceof CertPathValidatorException) {
        return true;
      }
    }
    return false;
  }

  /** Returns {@code true} if the failure is retriable. */
  public boolean isRetriable(Exception e) {
    return isRetriable.apply(e);
  }

  /**
   * Calls {@code c} until it succeeds, fails with an error this retrier does not retry, or the
   * backoff runs out. The last failure is rethrown.
   */
  public <T> T execute(Callable<T> c) throws IOException, InterruptedException {
    Backoff backoff = backoffSupplier.get();
    while (true) {
      try {
        return c.call();
      } catch (RetryException e) {
        // an inner retrier already gave up
        throw e;
      } catch (Exception e) {
        if (Thread.currentThread().isInterrupted()) {
          throw new InterruptedException();
        }
        if (!isRetriable.apply(e)) {
          throw rethrow(e, backoff);
        }
        long delay = backoff.nextDelayMillis();
        if (delay < 0) {
          throw rethrow(e, backoff);
        }
        log.fine(
            String.format(
                "retrying after %dms (attempt %d): %s",
                delay, backoff.getRetryAttempts(), e.getMessage()));
        sleep(delay);
      }
    }
  }

  // Callable is declared to throw Exception, we rethrow any unchecked exception as well as any
  // exception we declared above.
  private static IOException rethrow(Exception e, Backoff backoff) throws InterruptedException {
    Throwables.throwIfUnchecked(e);
    Throwables.throwIfInstanceOf(e, InterruptedException.class);
    if (e instanceof IOException) {
      return (IOException) e;
    }
    return new RetryException(e, backoff.getRetryAttempts());
  }

  @VisibleForTesting
  protected void sleep(long timeMillis) throws InterruptedException {
    Preconditions.checkArgument(
        timeMillis >= 0L, "timeMillis must not be negative: %s", timeMillis);
    TimeUnit.MILLISECONDS.sleep(timeMillis);
  }

  public Backoff newBackoff() {
    return backoffSupplier.get();
  }
}
