package dev.webcrawler.crawl;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Picks the retrieval strategy for an entry URL and wraps whatever it returns in a {@link
 * CrawlOutcome}:
 *
 * <ul>
 *   <li>{@link CrawlType#TEXT_FILE}: a single fetch of the listing itself
 *   <li>{@link CrawlType#SITEMAP}: flat batch over the sitemap's locations
 *   <li>{@link CrawlType#WEBPAGE}: breadth-first traversal of internal links
 * </ul>
 *
 * <p>Never throws: an unexpected collaborator failure becomes a failed outcome carrying its
 * message.
 */
@Service
public class DeepCrawlService {

  private static final Logger log = LoggerFactory.getLogger(DeepCrawlService.class);

  private final UrlClassifier urlClassifier;
  private final Crawl4AiClient crawl4AiClient;
  private final SitemapExpander sitemapExpander;
  private final CrawlService crawlService;

  public DeepCrawlService(
      UrlClassifier urlClassifier,
      Crawl4AiClient crawl4AiClient,
      SitemapExpander sitemapExpander,
      CrawlService crawlService) {
    this.urlClassifier = urlClassifier;
    this.crawl4AiClient = crawl4AiClient;
    this.sitemapExpander = sitemapExpander;
    this.crawlService = crawlService;
  }

  /**
   * Crawl an entry URL with the strategy its shape calls for.
   *
   * @param url            entry URL
   * @param maxDepth       levels followed for webpages; ignored by the other strategies
   * @param maxConcurrency ceiling on simultaneous fetches
   * @return the aggregated outcome, never null
   */
  public CrawlOutcome deepCrawl(String url, int maxDepth, int maxConcurrency) {
    try {
      CrawlType crawlType = urlClassifier.classify(url);
      log.info("Deep crawl of {} as {}", url, crawlType.wireName());
      List<PageResult> results =
          switch (crawlType) {
            case TEXT_FILE -> fetchTextFile(url);
            case SITEMAP -> sitemapExpander.expand(url, maxConcurrency);
            case WEBPAGE -> crawlService.traverse(CrawlRequest.of(url, maxDepth, maxConcurrency));
          };
      return ResultAggregator.aggregate(crawlType, url, results);
    } catch (Exception e) {
      log.error("Deep crawl failed for {}: {}", url, e.getMessage(), e);
      return ResultAggregator.failure(url, describe(e));
    }
  }

  /**
   * Fetch a single page without following links.
   *
   * @param url the page URL
   * @return the fetch outcome, never null
   */
  public CrawlResult crawlSinglePage(String url) {
    try {
      return crawl4AiClient.crawl(url);
    } catch (Exception e) {
      log.error("Single page crawl failed for {}: {}", url, e.getMessage(), e);
      return CrawlResult.failed(url, describe(e));
    }
  }

  private List<PageResult> fetchTextFile(String url) {
    CrawlResult result = crawl4AiClient.crawl(url);
    if (!result.hasContent()) {
      log.warn("Failed to crawl {}: {}", url, result.errorMessage());
      return List.of();
    }
    return List.of(PageResult.from(result));
  }

  static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
