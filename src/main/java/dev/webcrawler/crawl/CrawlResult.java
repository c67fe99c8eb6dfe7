package dev.webcrawler.crawl;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of fetching a single URL through the Crawl4AI sidecar: Markdown content, internal links
 * and success status. One failed result never affects the others in a batch.
 */
public record CrawlResult(
    String url,
    @Nullable String markdown,
    List<String> internalLinks,
    boolean success,
    @Nullable String errorMessage) {
  public CrawlResult {
    internalLinks = internalLinks == null ? List.of() : List.copyOf(internalLinks);
  }

  public static CrawlResult failed(String url, @Nullable String errorMessage) {
    return new CrawlResult(url, null, List.of(), false, errorMessage);
  }

  /** True when the fetch succeeded and produced non-blank Markdown. */
  public boolean hasContent() {
    return success && markdown != null && !markdown.isBlank();
  }
}
