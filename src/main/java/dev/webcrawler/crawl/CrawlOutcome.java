package dev.webcrawler.crawl;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Result envelope of one {@code deep_crawl} call. Built by {@link ResultAggregator}; immutable.
 *
 * @param crawlType          strategy used, or null when the call failed before classification
 * @param success            true when at least one page was retrieved
 * @param url                entry URL as given by the caller
 * @param pagesCrawled       number of pages in {@code results}
 * @param urlsCrawledPreview first five result URLs, plus {@code "..."} when there are more
 * @param results            retrieved pages in discovery order
 * @param error              failure reason, null on success
 */
public record CrawlOutcome(
    @Nullable CrawlType crawlType,
    boolean success,
    String url,
    int pagesCrawled,
    List<String> urlsCrawledPreview,
    List<PageResult> results,
    @Nullable String error) {

  public CrawlOutcome {
    urlsCrawledPreview = urlsCrawledPreview == null ? List.of() : List.copyOf(urlsCrawledPreview);
    results = results == null ? List.of() : List.copyOf(results);
  }
}
