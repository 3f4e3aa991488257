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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * An immutable, sorted view of environment variables.
 *
 * <p>Name lists passed to {@link #fromWildcards(List)} may contain {@code *} wildcards, and a
 * leading {@code !} excludes the matching names from the result.
 */
public final class EnvironmentVariableMap {
  private static final String EXCLUSION_PREFIX = "!";
  private static final String WILDCARD = "*";

  private final ImmutableSortedMap<String, String> variables;

  private EnvironmentVariableMap(ImmutableSortedMap<String, String> variables) {
    this.variables = variables;
  }

  public static EnvironmentVariableMap of(Map<String, String> variables) {
    return new EnvironmentVariableMap(ImmutableSortedMap.copyOf(variables));
  }

  public static EnvironmentVariableMap fromSystem() {
    return of(System.getenv());
  }

  public ImmutableSortedMap<String, String> asMap() {
    return variables;
  }

  public ImmutableList<String> names() {
    return variables.keySet().asList();
  }

  /** Sorted {@code NAME=value} pairs for hashing. */
  public ImmutableList<String> toHashable() {
    ImmutableList.Builder<String> pairs = ImmutableList.builder();
    for (Map.Entry<String, String> entry : variables.entrySet()) {
      pairs.add(entry.getKey() + "=" + entry.getValue());
    }
    return pairs.build();
  }

  /** Selects the variables named by {@code patterns}, applying wildcards and exclusions. */
  public EnvironmentVariableMap fromWildcards(List<String> patterns) {
    List<Pattern> inclusions = new ArrayList<>();
    List<Pattern> exclusions = new ArrayList<>();
    for (String pattern : patterns) {
      if (pattern.startsWith(EXCLUSION_PREFIX)) {
        exclusions.add(wildcardToRegex(pattern.substring(EXCLUSION_PREFIX.length())));
      } else {
        inclusions.add(wildcardToRegex(pattern));
      }
    }
    TreeMap<String, String> selected = new TreeMap<>();
    for (Map.Entry<String, String> entry : variables.entrySet()) {
      String name = entry.getKey();
      if (anyMatch(inclusions, name) && !anyMatch(exclusions, name)) {
        selected.put(name, entry.getValue());
      }
    }
    return new EnvironmentVariableMap(ImmutableSortedMap.copyOfSorted(selected));
  }

  private static boolean anyMatch(List<Pattern> patterns, String name) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(name).matches()) {
        return true;
      }
    }
    return false;
  }

  private static Pattern wildcardToRegex(String wildcard) {
    StringBuilder regex = new StringBuilder();
    int start = 0;
    int star;
    while ((star = wildcard.indexOf(WILDCARD, start)) >= 0) {
      regex.append(Pattern.quote(wildcard.substring(start, star))).append(".*");
      start = star + WILDCARD.length();
    }
    regex.append(Pattern.quote(wildcard.substring(start)));
    return Pattern.compile(regex.toString());
  }

  public boolean isEmpty() {
    return variables.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EnvironmentVariableMap
        && variables.equals(((EnvironmentVariableMap) o).variables);
  }

  @Override
  public int hashCode() {
    return variables.hashCode();
  }

  @Override
  public String toString() {
    // values may be secrets
    return "EnvironmentVariableMap" + names();
  }
}
