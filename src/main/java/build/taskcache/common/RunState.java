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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.java.Log;

/**
 * State shared by every store created for a single run. Counts failed remote requests and acts as
 * the circuit breaker for remote caching once the configured maximum is reached.
 *
 * <p>Instances are thread safe. Each run owns its own instance.
 */
@Log
public class RunState {
  public static final int DEFAULT_MAX_REMOTE_FAILURES = 3;

  private final int maxRemoteFailures;
  private final AtomicInteger remoteFailures = new AtomicInteger();
  private final AtomicBoolean tripAnnounced = new AtomicBoolean();

  public RunState() {
    this(DEFAULT_MAX_REMOTE_FAILURES);
  }

  public RunState(int maxRemoteFailures) {
    checkArgument(maxRemoteFailures > 0, "maxRemoteFailures must be > 0");
    this.maxRemoteFailures = maxRemoteFailures;
  }

  /** Returns true while remote requests are still permitted. */
  public boolean okToRequest() {
    return remoteFailures.get() < maxRemoteFailures;
  }

  public boolean isTripped() {
    return !okToRequest();
  }

  /** Records one failed remote attempt and returns the new failure count. */
  public int recordRemoteFailure() {
    int failures = remoteFailures.incrementAndGet();
    if (failures >= maxRemoteFailures && tripAnnounced.compareAndSet(false, true)) {
      log.warning(
          String.format(
              "%d remote cache requests failed, skipping remote cache for the rest of the run",
              failures));
    }
    return failures;
  }

  public int getRemoteFailures() {
    return remoteFailures.get();
  }

  public int getMaxRemoteFailures() {
    return maxRemoteFailures;
  }
}
