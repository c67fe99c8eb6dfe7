package dev.webcrawler.crawl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Expands a sitemap into its pages: parses the {@code loc} entries and fetches them as one flat
 * batch without following links. An unreadable sitemap yields no pages rather than an error.
 */
@Service
public class SitemapExpander {

  private static final Logger log = LoggerFactory.getLogger(SitemapExpander.class);

  private final SitemapParser sitemapParser;
  private final CrawlService crawlService;

  public SitemapExpander(SitemapParser sitemapParser, CrawlService crawlService) {
    this.sitemapParser = sitemapParser;
    this.crawlService = crawlService;
  }

  /**
   * @param sitemapUrl     URL of the sitemap document
   * @param maxConcurrency ceiling on simultaneous page fetches
   * @return fetched pages with content, in sitemap order
   */
  public List<PageResult> expand(String sitemapUrl, int maxConcurrency) {
    List<String> urls = distinct(sitemapParser.parseUrls(sitemapUrl));
    if (urls.isEmpty()) {
      log.info("No URLs found in sitemap {}", sitemapUrl);
      return List.of();
    }
    log.info("Sitemap {} lists {} URLs", sitemapUrl, urls.size());
    return crawlService.crawlBatch(urls, maxConcurrency);
  }

  /** Drops entries that differ from an earlier one only by fragment; keeps first occurrence. */
  private static List<String> distinct(List<String> urls) {
    Map<String, String> byNormalized = new LinkedHashMap<>();
    for (String url : urls) {
      if (url != null && !url.isBlank()) {
        byNormalized.putIfAbsent(UrlNormalizer.normalize(url), url);
      }
    }
    return List.copyOf(byNormalized.values());
  }
}
