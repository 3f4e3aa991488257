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

import static java.nio.charset.StandardCharsets.UTF_8;

import build.taskcache.cacheitem.CacheArchiveReader;
import build.taskcache.cacheitem.CacheArchiveWriter;
import build.taskcache.common.io.AtomicFileOutputStream;
import build.taskcache.common.io.Directories;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import javax.annotation.Nullable;
import lombok.Data;
import lombok.extern.java.Log;

/**
 * Stores artifacts as files in a local cache directory.
 *
 * <p>The artifact for a hash lives at {@code <dir>/<hash>.tar.zst}, with its metadata at {@code
 * <dir>/<hash>-meta.json}. Uncompressed {@code <hash>.tar} artifacts are still read. Both files are
 * written under temporary names and renamed into place, so a reader never observes a partial
 * artifact.
 */
@Log
public class LocalStore implements ArtifactStore {
  static final String COMPRESSED_SUFFIX = ".tar.zst";
  static final String UNCOMPRESSED_SUFFIX = ".tar";
  static final String METADATA_SUFFIX = "-meta.json";

  private static final Gson GSON = new Gson();

  @Data
  static class CacheMetadata {
    private String hash;
    private long duration;
  }

  private final Path cacheDir;

  public LocalStore(Path cacheDir) {
    this.cacheDir = cacheDir;
  }

  public Path getCacheDir() {
    return cacheDir;
  }

  Path archivePath(String hash) {
    return cacheDir.resolve(hash + COMPRESSED_SUFFIX);
  }

  Path metadataPath(String hash) {
    return cacheDir.resolve(hash + METADATA_SUFFIX);
  }

  @Nullable
  private Path existingArchive(String hash) {
    Path compressed = archivePath(hash);
    if (Files.exists(compressed)) {
      return compressed;
    }
    Path uncompressed = cacheDir.resolve(hash + UNCOMPRESSED_SUFFIX);
    if (Files.exists(uncompressed)) {
      return uncompressed;
    }
    return null;
  }

  @Override
  public CacheResult fetch(Path anchor, String hash) throws IOException {
    Path archive = existingArchive(hash);
    if (archive == null) {
      return CacheResult.miss();
    }
    CacheMetadata metadata = readMetadata(hash);
    if (metadata == null) {
      return CacheResult.miss();
    }
    List<String> files;
    try (CacheArchiveReader reader = CacheArchiveReader.open(archive)) {
      files = reader.restore(anchor);
    } catch (NoSuchFileException e) {
      // evicted between the existence check and the read
      log.fine(String.format("local artifact %s disappeared: %s", hash, e.getMessage()));
      return CacheResult.miss();
    }
    return CacheResult.hit(CacheSource.LOCAL, metadata.getDuration(), files);
  }

  @Override
  @Nullable
  public CacheHitMetadata exists(String hash) throws IOException {
    if (existingArchive(hash) == null) {
      return null;
    }
    CacheMetadata metadata = readMetadata(hash);
    if (metadata == null) {
      return null;
    }
    return new CacheHitMetadata(CacheSource.LOCAL, metadata.getDuration());
  }

  @Override
  public void put(Path anchor, String hash, List<String> files, long durationMs)
      throws IOException {
    Directories.createDirectories(cacheDir);
    try (CacheArchiveWriter writer = CacheArchiveWriter.create(archivePath(hash))) {
      for (String file : files) {
        writer.add(anchor, file);
      }
      writer.finish();
    }

    CacheMetadata metadata = new CacheMetadata();
    metadata.setHash(hash);
    metadata.setDuration(durationMs);
    try (AtomicFileOutputStream out = new AtomicFileOutputStream(metadataPath(hash))) {
      out.write(GSON.toJson(metadata).getBytes(UTF_8));
      out.onSuccess();
    }
    log.fine(String.format("stored %d files for %s in %s", files.size(), hash, cacheDir));
  }

  @Nullable
  private CacheMetadata readMetadata(String hash) throws IOException {
    String json;
    try {
      json = Files.readString(metadataPath(hash), UTF_8);
    } catch (NoSuchFileException e) {
      return null;
    }
    try {
      CacheMetadata metadata = GSON.fromJson(json, CacheMetadata.class);
      if (metadata == null) {
        throw new CacheException("empty cache metadata for " + hash);
      }
      return metadata;
    } catch (JsonParseException e) {
      throw new CacheException("invalid cache metadata for " + hash, e);
    }
  }
}
