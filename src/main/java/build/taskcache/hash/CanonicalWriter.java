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

package build.taskcache.hash;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import javax.annotation.Nullable;

/**
 * Builds the canonical byte form of a hashable record.
 *
 * <p>Every value is written with its field name and a length prefix, so no two distinct records
 * share a serialization. Callers write fields in a fixed order. Maps must be sorted. An absent list
 * is written differently from an empty one.
 */
final class CanonicalWriter {
  private static final String ABSENT = "~";

  private final StringBuilder out = new StringBuilder();

  CanonicalWriter(String recordType, String formatVersion) {
    field("record").string(recordType);
    field("version").string(formatVersion);
  }

  CanonicalWriter field(String name) {
    out.append(name).append('=');
    return this;
  }

  CanonicalWriter string(@Nullable String value) {
    if (value == null) {
      out.append(ABSENT).append(';');
    } else {
      out.append(value.length()).append(':').append(value).append(';');
    }
    return this;
  }

  CanonicalWriter bool(boolean value) {
    out.append(value ? 'T' : 'F').append(';');
    return this;
  }

  CanonicalWriter list(@Nullable List<String> values) {
    if (values == null) {
      out.append(ABSENT).append(';');
      return this;
    }
    out.append('[').append(values.size()).append(']');
    for (String value : values) {
      string(value);
    }
    return this;
  }

  CanonicalWriter map(SortedMap<String, String> values) {
    out.append('{').append(values.size()).append('}');
    for (Map.Entry<String, String> entry : values.entrySet()) {
      string(entry.getKey());
      string(entry.getValue());
    }
    return this;
  }

  byte[] toByteArray() {
    return out.toString().getBytes(UTF_8);
  }

  @Override
  public String toString() {
    return out.toString();
  }
}
