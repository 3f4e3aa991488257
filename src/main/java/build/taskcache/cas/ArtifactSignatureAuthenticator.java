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

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Strings;
import com.google.common.hash.Funnels;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.common.io.ByteSource;
import java.io.IOException;
import java.io.OutputStream;
import java.security.MessageDigest;
import javax.annotation.Nullable;

/**
 * Signs and verifies remote artifacts with HMAC-SHA256 over the task hash, the team id and the
 * artifact body. Tags are base64 encoded.
 */
public class ArtifactSignatureAuthenticator {
  private final String teamId;
  private final HashFunction hmac;

  public ArtifactSignatureAuthenticator(String teamId, String secretKey) {
    checkArgument(!Strings.isNullOrEmpty(secretKey), "signature secret key must not be empty");
    this.teamId = Strings.nullToEmpty(teamId);
    this.hmac = Hashing.hmacSha256(secretKey.getBytes(UTF_8));
  }

  /** Signs {@code body}, reading it once as a stream. */
  public String generateTag(String hash, ByteSource body) throws IOException {
    Hasher hasher = hmac.newHasher();
    hasher.putBytes(hash.getBytes(UTF_8)).putBytes(teamId.getBytes(UTF_8));
    try (OutputStream out = Funnels.asOutputStream(hasher)) {
      body.copyTo(out);
    }
    return BaseEncoding.base64().encode(hasher.hash().asBytes());
  }

  /**
   * Verifies {@code tag} against {@code body}.
   *
   * @throws CacheException if the tag is missing, malformed or does not match
   */
  public void validate(String hash, ByteSource body, @Nullable String tag) throws IOException {
    if (Strings.isNullOrEmpty(tag)) {
      throw new CacheException("artifact " + hash + " has no signature tag");
    }
    byte[] expected = BaseEncoding.base64().decode(generateTag(hash, body));
    byte[] actual;
    try {
      actual = BaseEncoding.base64().decode(tag);
    } catch (IllegalArgumentException e) {
      throw new CacheException("artifact " + hash + " has a malformed signature tag", e);
    }
    if (!MessageDigest.isEqual(expected, actual)) {
      throw new CacheException("artifact " + hash + " failed signature verification");
    }
  }
}
