package dev.webcrawler.crawl;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges the pages of one crawl call into a single {@link CrawlOutcome}.
 */
public final class ResultAggregator {

  static final int PREVIEW_SIZE = 5;
  static final String TRUNCATION_MARKER = "...";
  static final String NO_CONTENT_ERROR = "No content found";

  private ResultAggregator() {
    // utility class
  }

  /**
   * Build the outcome for a completed crawl. An empty result list is a failed outcome with {@code
   * "No content found"}, not an exception.
   *
   * @param crawlType strategy that produced the results
   * @param url       entry URL of the call
   * @param results   pages in discovery order
   * @return the outcome envelope
   */
  public static CrawlOutcome aggregate(CrawlType crawlType, String url, List<PageResult> results) {
    if (results.isEmpty()) {
      return new CrawlOutcome(crawlType, false, url, 0, List.of(), List.of(), NO_CONTENT_ERROR);
    }
    return new CrawlOutcome(
        crawlType, true, url, results.size(), preview(results), results, null);
  }

  /** Outcome for a call aborted by an unexpected exception. */
  public static CrawlOutcome failure(String url, String message) {
    return new CrawlOutcome(null, false, url, 0, List.of(), List.of(), message);
  }

  static List<String> preview(List<PageResult> results) {
    List<String> preview = new ArrayList<>(PREVIEW_SIZE + 1);
    for (int i = 0; i < Math.min(PREVIEW_SIZE, results.size()); i++) {
      preview.add(results.get(i).url());
    }
    if (results.size() > PREVIEW_SIZE) {
      preview.add(TRUNCATION_MARKER);
    }
    return preview;
  }
}
