package dev.webcrawler.crawl;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised configuration for URL classification and crawl defaults.
 *
 * <p>Properties are bound from {@code webcrawler.crawl.*} in application.yml.
 *
 * <ul>
 *   <li>{@code default-max-depth} - levels followed by {@code deep_crawl} when the caller gives none
 *       (default 3)
 *   <li>{@code default-max-concurrency} - in-flight fetch ceiling when the caller gives none
 *       (default 10)
 *   <li>{@code text-file-suffixes} - path suffixes classified as plaintext listings (default
 *       {@code .txt})
 *   <li>{@code sitemap-pattern} - extra case-insensitive regex matched against the URL path and
 *       query to detect sitemaps
 *   <li>{@code expand-sitemap-index} - follow the nested sitemaps of a sitemap index one level
 *       (default false)
 * </ul>
 */
@ConfigurationProperties(prefix = "webcrawler.crawl")
public class CrawlProperties {

  private int defaultMaxDepth = 3;
  private int defaultMaxConcurrency = 10;
  private List<String> textFileSuffixes = new ArrayList<>(List.of(".txt"));
  private String sitemapPattern = "";
  private boolean expandSitemapIndex = false;

  @PostConstruct
  void validate() {
    if (defaultMaxDepth < 0) {
      throw new IllegalStateException(
          "webcrawler.crawl.default-max-depth must be >= 0, got: " + defaultMaxDepth);
    }
    if (defaultMaxConcurrency < 1) {
      throw new IllegalStateException(
          "webcrawler.crawl.default-max-concurrency must be >= 1, got: " + defaultMaxConcurrency);
    }
  }

  public int getDefaultMaxDepth() {
    return defaultMaxDepth;
  }

  public void setDefaultMaxDepth(int defaultMaxDepth) {
    this.defaultMaxDepth = defaultMaxDepth;
  }

  public int getDefaultMaxConcurrency() {
    return defaultMaxConcurrency;
  }

  public void setDefaultMaxConcurrency(int defaultMaxConcurrency) {
    this.defaultMaxConcurrency = defaultMaxConcurrency;
  }

  public List<String> getTextFileSuffixes() {
    return textFileSuffixes;
  }

  public void setTextFileSuffixes(List<String> textFileSuffixes) {
    this.textFileSuffixes = textFileSuffixes;
  }

  public String getSitemapPattern() {
    return sitemapPattern;
  }

  public void setSitemapPattern(String sitemapPattern) {
    this.sitemapPattern = sitemapPattern;
  }

  public boolean isExpandSitemapIndex() {
    return expandSitemapIndex;
  }

  public void setExpandSitemapIndex(boolean expandSitemapIndex) {
    this.expandSitemapIndex = expandSitemapIndex;
  }
}
