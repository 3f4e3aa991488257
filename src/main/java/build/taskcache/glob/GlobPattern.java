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

package build.taskcache.glob;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled doublestar glob over forward-slash relative paths.
 *
 * <p>Within a segment, {@code *} matches any run of characters, {@code ?} a single character,
 * {@code [abc]}/{@code [!a-z]} a character class and {@code \} escapes the next character. Braces
 * {@code {a,b}} expand to alternatives before matching and may span segments. A {@code **} segment
 * matches any number of whole segments, except that a trailing {@code **} requires at least one,
 * so {@code dist/**} matches everything below {@code dist} but not {@code dist} itself.
 */
public final class GlobPattern {
  private static final Splitter SEGMENTS = Splitter.on('/');
  private static final String DOUBLE_STAR = "**";

  private final String pattern;
  private final ImmutableList<List<Segment>> alternatives;

  private GlobPattern(String pattern, ImmutableList<List<Segment>> alternatives) {
    this.pattern = pattern;
    this.alternatives = alternatives;
  }

  /**
   * Compiles a normalized relative pattern.
   *
   * @throws InvalidGlobException if the pattern has unbalanced braces or brackets
   */
  public static GlobPattern compile(String pattern) {
    return compileExpanded(pattern, expandBraces(pattern));
  }

  /** Compiles alternatives that have already been brace-expanded and normalized. */
  static GlobPattern compileExpanded(String pattern, List<String> expandedAlternatives) {
    ImmutableList.Builder<List<Segment>> alternatives = ImmutableList.builder();
    for (String expanded : expandedAlternatives) {
      List<Segment> segments = new ArrayList<>();
      for (String segment : SEGMENTS.split(expanded)) {
        if (segment.isEmpty()) {
          continue;
        }
        // consecutive ** segments are equivalent to one
        if (segment.equals(DOUBLE_STAR)
            && !segments.isEmpty()
            && segments.get(segments.size() - 1).isDoubleStar()) {
          continue;
        }
        segments.add(Segment.of(segment, pattern));
      }
      alternatives.add(segments);
    }
    return new GlobPattern(pattern, alternatives.build());
  }

  public String getPattern() {
    return pattern;
  }

  public boolean matches(String path) {
    String[] parts = splitPath(path);
    for (List<Segment> segments : alternatives) {
      if (matches(segments, 0, parts, 0)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true if every strict descendant of {@code directory} matches, which lets a walk prune
   * the directory when this pattern is an exclusion.
   */
  public boolean matchesAllDescendantsOf(String directory) {
    String[] parts = splitPath(directory);
    for (List<Segment> segments : alternatives) {
      int last = segments.size() - 1;
      if (last >= 0
          && segments.get(last).isDoubleStar()
          && matches(segments.subList(0, last), 0, parts, 0)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the longest leading run of literal segments shared by every alternative, the directory
   * from which a walk for this pattern can start.
   */
  public String literalPrefix() {
    List<String> common = null;
    for (List<Segment> segments : alternatives) {
      List<String> literals = new ArrayList<>();
      for (Segment segment : segments) {
        if (segment.literal == null) {
          break;
        }
        literals.add(segment.literal);
      }
      if (common == null) {
        common = literals;
      } else {
        int i = 0;
        while (i < common.size() && i < literals.size() && common.get(i).equals(literals.get(i))) {
          i++;
        }
        common = common.subList(0, i);
      }
    }
    return common == null ? "" : Joiner.on('/').join(common);
  }

  /** Returns true if the pattern contains no wildcards, so it names exactly one path. */
  public boolean isLiteral() {
    if (alternatives.size() != 1) {
      return false;
    }
    for (Segment segment : alternatives.get(0)) {
      if (segment.literal == null) {
        return false;
      }
    }
    return true;
  }

  private static String[] splitPath(String path) {
    if (path.isEmpty()) {
      return new String[0];
    }
    return path.split("/", -1);
  }

  private static boolean matches(List<Segment> segments, int si, String[] parts, int pi) {
    if (si == segments.size()) {
      return pi == parts.length;
    }
    Segment segment = segments.get(si);
    if (segment.isDoubleStar()) {
      if (si == segments.size() - 1) {
        return pi < parts.length;
      }
      for (int next = pi; next <= parts.length; next++) {
        if (matches(segments, si + 1, parts, next)) {
          return true;
        }
      }
      return false;
    }
    return pi < parts.length
        && segment.matches(parts[pi])
        && matches(segments, si + 1, parts, pi + 1);
  }

  static List<String> expandBraces(String pattern) {
    int open = -1;
    int depth = 0;
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == '{') {
        if (depth == 0) {
          open = i;
        }
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth < 0) {
          throw new InvalidGlobException(pattern, "unbalanced '}'");
        }
        if (depth == 0) {
          return expandGroup(pattern, open, i);
        }
      }
    }
    if (depth != 0) {
      throw new InvalidGlobException(pattern, "unbalanced '{'");
    }
    return ImmutableList.of(pattern);
  }

  private static List<String> expandGroup(String pattern, int open, int close) {
    String head = pattern.substring(0, open);
    String tail = pattern.substring(close + 1);
    List<String> options = new ArrayList<>();
    int depth = 0;
    int start = open + 1;
    for (int i = open + 1; i < close; i++) {
      char c = pattern.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
      } else if (c == ',' && depth == 0) {
        options.add(pattern.substring(start, i));
        start = i + 1;
      }
    }
    options.add(pattern.substring(start, close));
    List<String> expanded = new ArrayList<>();
    for (String option : options) {
      expanded.addAll(expandBraces(head + option + tail));
    }
    return expanded;
  }

  @Override
  public String toString() {
    return pattern;
  }

  private static final class Segment {
    private final String literal;
    private final Pattern regex;

    private Segment(String literal, Pattern regex) {
      this.literal = literal;
      this.regex = regex;
    }

    static Segment of(String segment, String pattern) {
      if (segment.equals(DOUBLE_STAR)) {
        return new Segment(null, null);
      }
      StringBuilder regex = new StringBuilder();
      StringBuilder literal = new StringBuilder();
      boolean isLiteral = true;
      for (int i = 0; i < segment.length(); i++) {
        char c = segment.charAt(i);
        switch (c) {
          case '\\':
            if (i + 1 < segment.length()) {
              i++;
              regex.append(Pattern.quote(String.valueOf(segment.charAt(i))));
              literal.append(segment.charAt(i));
            }
            break;
          case '*':
            isLiteral = false;
            regex.append("[^/]*");
            break;
          case '?':
            isLiteral = false;
            regex.append("[^/]");
            break;
          case '[':
            isLiteral = false;
            i = appendCharacterClass(segment, i, regex, pattern);
            break;
          default:
            regex.append(Pattern.quote(String.valueOf(c)));
            literal.append(c);
        }
      }
      if (isLiteral) {
        return new Segment(literal.toString(), null);
      }
      try {
        return new Segment(null, Pattern.compile(regex.toString()));
      } catch (PatternSyntaxException e) {
        throw new InvalidGlobException(pattern, e.getDescription());
      }
    }

    private static int appendCharacterClass(
        String segment, int open, StringBuilder regex, String pattern) {
      int i = open + 1;
      regex.append('[');
      if (i < segment.length() && (segment.charAt(i) == '!' || segment.charAt(i) == '^')) {
        regex.append('^');
        i++;
      }
      boolean first = true;
      for (; i < segment.length(); i++) {
        char c = segment.charAt(i);
        if (c == ']' && !first) {
          regex.append(']');
          return i;
        }
        first = false;
        if (c == '\\' && i + 1 < segment.length()) {
          i++;
          c = segment.charAt(i);
        }
        if (c == '-') {
          regex.append('-');
        } else {
          regex.append("\\x{").append(Integer.toHexString(c)).append('}');
        }
      }
      throw new InvalidGlobException(pattern, "unterminated character class");
    }

    boolean isDoubleStar() {
      return literal == null && regex == null;
    }

    boolean matches(String part) {
      if (literal != null) {
        return literal.equals(part);
      }
      return regex.matcher(part).matches();
    }
  }
}
