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

import build.taskcache.common.RunState;
import build.taskcache.common.config.CacheActions;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * Combines a local and a remote store. Reads try the local store first, and a remote hit is written
 * back to the local store. Writes always go to the local store, and to the remote store unless
 * remote writes are disabled or the run has given up on the remote.
 *
 * <p>Remote failures never fail a fetch or put. They are reported to the warning sink and the
 * operation continues as if the remote had missed.
 */
@Log
public class Cache {
  public static final String TOO_MANY_FAILURES_WARNING =
      "Remote caching disabled: too many failures";

  @Nullable private final ArtifactStore local;
  @Nullable private final ArtifactStore remote;
  private final CacheActions actions;
  private final RunState runState;
  private final Consumer<String> warnings;
  private final AtomicBoolean tripReported = new AtomicBoolean();
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public Cache(
      @Nullable ArtifactStore local,
      @Nullable ArtifactStore remote,
      CacheActions actions,
      RunState runState,
      Consumer<String> warnings) {
    this.local = local;
    this.remote = remote;
    this.actions = actions;
    this.runState = runState;
    this.warnings = warnings;
  }

  public RunState getRunState() {
    return runState;
  }

  private boolean canReadLocal() {
    return local != null && actions.getLocal().isRead();
  }

  private boolean canWriteLocal() {
    return local != null && actions.getLocal().isWrite();
  }

  private boolean canReadRemote() {
    return remote != null && !cancelled.get() && actions.getRemote().isRead() && !remoteTripped();
  }

  private boolean canWriteRemote() {
    return remote != null && !cancelled.get() && actions.getRemote().isWrite() && !remoteTripped();
  }

  private boolean remoteTripped() {
    if (runState.isTripped()) {
      if (tripReported.compareAndSet(false, true)) {
        warn(TOO_MANY_FAILURES_WARNING);
      }
      return true;
    }
    return false;
  }

  /** Whether remote caching was abandoned during this run. */
  public boolean isRemoteDisabledByFailures() {
    return remote != null && runState.isTripped();
  }

  public boolean isEnabled() {
    return canReadLocal() || canWriteLocal() || remote != null;
  }

  /** Restores the artifact for {@code hash} beneath {@code anchor}, if either store has it. */
  public CacheResult fetch(Path anchor, String hash) throws InterruptedException {
    if (canReadLocal()) {
      try {
        CacheResult result = local.fetch(anchor, hash);
        if (result.isHit()) {
          return result;
        }
      } catch (IOException e) {
        warn(String.format("failed to fetch %s from local cache: %s", hash, e.getMessage()));
      }
    }

    if (canReadRemote()) {
      try {
        CacheResult result = remote.fetch(anchor, hash);
        if (result.isHit()) {
          if (canWriteLocal()) {
            writeBackLocal(anchor, hash, result);
          }
          return result;
        }
      } catch (TooManyFailuresException e) {
        remoteTripped();
      } catch (IOException e) {
        warnRemote(String.format("failed to fetch %s from remote cache: %s", hash, e.getMessage()));
        remoteTripped();
      }
    }
    return CacheResult.miss();
  }

  private void writeBackLocal(Path anchor, String hash, CacheResult result)
      throws InterruptedException {
    try {
      local.put(anchor, hash, result.getFiles(), result.getMetadata().getTimeSavedMs());
    } catch (IOException e) {
      warn(String.format("failed to copy %s to local cache: %s", hash, e.getMessage()));
    }
  }

  /** Returns hit metadata from the first store that has {@code hash}, without restoring it. */
  @Nullable
  public CacheHitMetadata exists(String hash) throws InterruptedException {
    if (canReadLocal()) {
      try {
        CacheHitMetadata metadata = local.exists(hash);
        if (metadata != null) {
          return metadata;
        }
      } catch (IOException e) {
        warn(String.format("failed to check local cache for %s: %s", hash, e.getMessage()));
      }
    }
    if (canReadRemote()) {
      try {
        return remote.exists(hash);
      } catch (TooManyFailuresException e) {
        remoteTripped();
      } catch (IOException e) {
        warnRemote(
            String.format("failed to check remote cache for %s: %s", hash, e.getMessage()));
        remoteTripped();
      }
    }
    return null;
  }

  /**
   * Stores the anchor-relative {@code files} for {@code hash}. The remote upload is attempted even
   * when the local store fails.
   *
   * @throws IOException if the local store fails, remote failures are only reported
   */
  public void put(Path anchor, String hash, List<String> files, long durationMs)
      throws IOException, InterruptedException {
    IOException localFailure = null;
    if (canWriteLocal()) {
      try {
        local.put(anchor, hash, files, durationMs);
      } catch (IOException e) {
        localFailure = e;
      }
    }
    if (canWriteRemote()) {
      try {
        remote.put(anchor, hash, files, durationMs);
      } catch (TooManyFailuresException e) {
        remoteTripped();
      } catch (IOException e) {
        warnRemote(
            String.format("failed to upload %s to remote cache: %s", hash, e.getMessage()));
        remoteTripped();
      }
    }
    if (localFailure != null) {
      throw localFailure;
    }
  }

  /**
   * Aborts in-flight remote requests and skips the remote store from now on. Local operations are
   * unaffected.
   */
  public void cancel() {
    if (cancelled.compareAndSet(false, true) && remote != null) {
      log.fine("cancelling remote cache requests");
      remote.cancel();
    }
  }

  // requests aborted by cancel() are expected and not worth a warning
  private void warnRemote(String message) {
    if (cancelled.get()) {
      log.fine(message);
    } else {
      warn(message);
    }
  }

  private void warn(String message) {
    log.warning(message);
    warnings.accept(message);
  }
}
