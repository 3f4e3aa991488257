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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Funnels;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteSource;
import com.google.common.io.ByteStreams;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * Computes content fingerprints for workspace files.
 *
 * <p>The fingerprint is the git blob object id: SHA-1 over {@code "blob <length>\0<contents>"}, so
 * an unmodified file hashes identically to the id in a git index. Symlinks are fingerprinted by
 * their target string and never followed.
 */
public final class FileFingerprinter {
  @SuppressWarnings("deprecation")
  private static final HashFunction BLOB_HASH_FUNCTION = Hashing.sha1();

  private FileFingerprinter() {}

  public static String hash(Path path) throws IOException {
    BasicFileAttributes attributes =
        Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
    if (attributes.isSymbolicLink()) {
      String target = UnixPaths.toUnixPath(Files.readSymbolicLink(path));
      return hashBlob(ByteSource.wrap(target.getBytes(UTF_8)));
    }
    if (!attributes.isRegularFile()) {
      throw new IOException("cannot fingerprint " + path + ": not a regular file");
    }
    return hashBlob(MoreFiles.asByteSource(path), attributes.size(), path);
  }

  public static String hashBlob(ByteSource source) throws IOException {
    return hashBlob(source, source.size(), null);
  }

  private static String hashBlob(ByteSource source, long size, Object name) throws IOException {
    Hasher hasher = BLOB_HASH_FUNCTION.newHasher();
    hasher.putBytes(("blob " + size + "\0").getBytes(US_ASCII));
    long copied;
    try (InputStream in = source.openStream();
        OutputStream out = Funnels.asOutputStream(hasher)) {
      copied = ByteStreams.copy(in, out);
    }
    if (copied != size) {
      throw new IOException(
          String.format(
              "%s changed while being fingerprinted: expected %d bytes, read %d",
              name == null ? "blob" : name, size, copied));
    }
    return hasher.hash().toString();
  }

  /**
   * Fingerprints each repo-relative path under {@code root}.
   *
   * @return the fingerprints keyed by path, in sorted order
   */
  public static ImmutableSortedMap<String, String> hashFiles(
      Path root, Iterable<String> repoRelativePaths) throws IOException {
    TreeMap<String, String> hashes = new TreeMap<>();
    for (String path : repoRelativePaths) {
      hashes.put(path, hash(root.resolve(path)));
    }
    return ImmutableSortedMap.copyOfSorted(hashes);
  }

  /** As {@link #hash(Path)}, but returns null for a path that does not exist. */
  @Nullable
  public static String hashIfExists(Path path) throws IOException {
    try {
      return hash(path);
    } catch (NoSuchFileException e) {
      // optional inputs, such as dotenv files
      return null;
    }
  }
}
