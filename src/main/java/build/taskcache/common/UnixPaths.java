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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import javax.annotation.Nullable;

/**
 * Forward-slash path helpers. Repo-relative paths are always stored and hashed in this form,
 * regardless of the host separator.
 */
public final class UnixPaths {
  private static final Splitter SEGMENTS = Splitter.on('/');
  private static final Joiner JOINER = Joiner.on('/');

  private UnixPaths() {}

  public static String toUnixPath(String path) {
    return path.replace('\\', '/');
  }

  public static String toUnixPath(Path path) {
    return toUnixPath(path.toString());
  }

  /** Returns the unix form of {@code path} relative to {@code root}. */
  public static String relativize(Path root, Path path) {
    return toUnixPath(root.relativize(path));
  }

  /** Joins two unix paths, ignoring an empty parent. */
  public static String join(String parent, String child) {
    if (parent.isEmpty() || parent.equals(".")) {
      return child;
    }
    if (child.isEmpty()) {
      return parent;
    }
    return parent.endsWith("/") ? parent + child : parent + "/" + child;
  }

  public static boolean isAbsolute(String path) {
    return path.startsWith("/")
        || (path.length() > 1 && path.charAt(1) == ':' && Character.isLetter(path.charAt(0)));
  }

  /**
   * Collapses {@code .} and {@code ..} segments of a relative unix path.
   *
   * @return the normalized path, or null if it would climb above its starting point
   */
  @Nullable
  public static String normalize(String path) {
    Deque<String> segments = new ArrayDeque<>();
    for (String segment : SEGMENTS.split(toUnixPath(path))) {
      if (segment.isEmpty() || segment.equals(".")) {
        continue;
      }
      if (segment.equals("..")) {
        if (segments.isEmpty()) {
          return null;
        }
        segments.removeLast();
      } else {
        segments.addLast(segment);
      }
    }
    return JOINER.join(segments);
  }
}
