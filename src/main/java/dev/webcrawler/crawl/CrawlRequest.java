package dev.webcrawler.crawl;

import java.util.List;

/**
 * Immutable parameters of one breadth-first traversal.
 *
 * @param seedUrls       URLs fetched as the first level, in caller order
 * @param maxDepth       number of levels to fetch; 0 fetches nothing
 * @param maxConcurrency ceiling on fetches in flight at once
 */
public record CrawlRequest(List<String> seedUrls, int maxDepth, int maxConcurrency) {

  public CrawlRequest {
    if (seedUrls == null || seedUrls.isEmpty()) {
      throw new IllegalArgumentException("At least one seed URL is required");
    }
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
    }
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1, got: " + maxConcurrency);
    }
    seedUrls = List.copyOf(seedUrls);
  }

  public static CrawlRequest of(String seedUrl, int maxDepth, int maxConcurrency) {
    return new CrawlRequest(List.of(seedUrl), maxDepth, maxConcurrency);
  }
}
