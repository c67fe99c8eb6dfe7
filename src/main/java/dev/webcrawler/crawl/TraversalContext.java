package dev.webcrawler.crawl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of a single traversal call: the visited set and the accumulated results. Created
 * fresh for every call and confined to the traversal loop's thread.
 */
final class TraversalContext {

  private final Set<String> visited = new HashSet<>();
  private final List<PageResult> results = new ArrayList<>();

  /**
   * Select the URLs of a level that were not scheduled before and mark them visited in the same
   * step, before any of them is fetched.
   */
  List<String> claimUnvisited(Set<String> level) {
    List<String> toFetch = new ArrayList<>();
    for (String url : level) {
      if (visited.add(url)) {
        toFetch.add(url);
      }
    }
    return toFetch;
  }

  void markVisited(String normalizedUrl) {
    visited.add(normalizedUrl);
  }

  boolean isVisited(String normalizedUrl) {
    return visited.contains(normalizedUrl);
  }

  void addResult(PageResult result) {
    results.add(result);
  }

  int visitedCount() {
    return visited.size();
  }

  List<PageResult> results() {
    return Collections.unmodifiableList(results);
  }

  static Set<String> normalizedLevel(List<String> urls) {
    Set<String> level = new LinkedHashSet<>();
    for (String url : urls) {
      if (url != null && !url.isBlank()) {
        level.add(UrlNormalizer.normalize(url));
      }
    }
    return level;
  }
}
