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

import build.taskcache.cacheitem.CacheArchiveReader;
import build.taskcache.cacheitem.CacheArchiveWriter;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * Stores artifacts through the remote artifact API. Artifacts are zstd compressed archives,
 * optionally signed so that a tampered download is rejected.
 *
 * <p>Unsigned downloads are extracted straight from the response stream. Signed downloads and all
 * uploads are spooled through a temporary file, since the signature covers the whole body.
 */
@Log
public class RemoteStore implements ArtifactStore {
  private static final String SPOOL_PREFIX = "taskcache-";
  private static final String SPOOL_SUFFIX = ".tar.zst";

  private final HttpArtifactClient client;
  @Nullable private final ArtifactSignatureAuthenticator signer;

  public RemoteStore(HttpArtifactClient client, @Nullable ArtifactSignatureAuthenticator signer) {
    this.client = client;
    this.signer = signer;
  }

  public HttpArtifactClient getClient() {
    return client;
  }

  @Override
  public CacheResult fetch(Path anchor, String hash) throws IOException, InterruptedException {
    CacheResult result =
        client.fetchArtifact(
            hash,
            (body, response) -> {
              List<String> files =
                  signer == null
                      ? restore(body, anchor)
                      : restoreSigned(hash, body, response, anchor);
              return CacheResult.hit(CacheSource.REMOTE, response.getDurationMs(), files);
            });
    return result == null ? CacheResult.miss() : result;
  }

  private static List<String> restore(InputStream body, Path anchor) throws IOException {
    try (CacheArchiveReader reader = new CacheArchiveReader(body, /* compressed= */ true)) {
      return reader.restore(anchor);
    }
  }

  // nothing is extracted until the whole body has been verified
  private List<String> restoreSigned(
      String hash, InputStream body, HttpArtifactClient.ArtifactResponse response, Path anchor)
      throws IOException {
    Path spool = Files.createTempFile(SPOOL_PREFIX, SPOOL_SUFFIX);
    try {
      Files.copy(body, spool, StandardCopyOption.REPLACE_EXISTING);
      signer.validate(hash, MoreFiles.asByteSource(spool), response.getTag());
      try (InputStream in = Files.newInputStream(spool)) {
        return restore(in, anchor);
      }
    } finally {
      Files.deleteIfExists(spool);
    }
  }

  @Override
  @Nullable
  public CacheHitMetadata exists(String hash) throws IOException, InterruptedException {
    HttpArtifactClient.ArtifactResponse response = client.artifactExists(hash);
    if (response == null) {
      return null;
    }
    return new CacheHitMetadata(CacheSource.REMOTE, response.getDurationMs());
  }

  @Override
  public void put(Path anchor, String hash, List<String> files, long durationMs)
      throws IOException, InterruptedException {
    Path spool = Files.createTempFile(SPOOL_PREFIX, SPOOL_SUFFIX);
    try {
      try (OutputStream out = Files.newOutputStream(spool);
          CacheArchiveWriter writer = CacheArchiveWriter.create(out, /* compressed= */ true)) {
        for (String file : files) {
          writer.add(anchor, file);
        }
        writer.finish();
      }
      String tag = signer == null ? null : signer.generateTag(hash, MoreFiles.asByteSource(spool));
      client.putArtifact(hash, spool, durationMs, tag);
      log.fine(String.format("uploaded %d bytes for %s", Files.size(spool), hash));
    } finally {
      Files.deleteIfExists(spool);
    }
  }

  @Override
  public void cancel() {
    client.cancel();
  }
}
