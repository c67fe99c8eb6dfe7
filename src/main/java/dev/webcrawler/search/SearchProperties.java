package dev.webcrawler.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised configuration for the web search and encyclopedia tools.
 *
 * <p>Properties are bound from {@code webcrawler.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code serper-base-url} - Serper API endpoint (default {@code https://google.serper.dev})
 *   <li>{@code serper-api-key} - API key; {@code web_search} reports an error while it is blank
 *   <li>{@code wikipedia-base-url} - MediaWiki host template, {@code {language}} is substituted
 *   <li>{@code user-agent} - sent to Wikipedia, which rejects anonymous clients
 *   <li>{@code timeout-ms} - connect and read timeout for both APIs (default 10000)
 * </ul>
 */
@ConfigurationProperties(prefix = "webcrawler.search")
public class SearchProperties {

  private String serperBaseUrl = "https://google.serper.dev";
  private String serperApiKey = "";
  private String wikipediaBaseUrl = "https://{language}.wikipedia.org";
  private String userAgent = "webcrawler-mcp/0.1";
  private int timeoutMs = 10_000;

  @PostConstruct
  void validate() {
    if (!wikipediaBaseUrl.contains("{language}")) {
      throw new IllegalStateException(
          "webcrawler.search.wikipedia-base-url must contain {language}, got: "
              + wikipediaBaseUrl);
    }
    if (timeoutMs < 1) {
      throw new IllegalStateException(
          "webcrawler.search.timeout-ms must be >= 1, got: " + timeoutMs);
    }
  }

  public boolean hasSerperApiKey() {
    return serperApiKey != null && !serperApiKey.isBlank();
  }

  public String getSerperBaseUrl() {
    return serperBaseUrl;
  }

  public void setSerperBaseUrl(String serperBaseUrl) {
    this.serperBaseUrl = serperBaseUrl;
  }

  public String getSerperApiKey() {
    return serperApiKey;
  }

  public void setSerperApiKey(String serperApiKey) {
    this.serperApiKey = serperApiKey;
  }

  public String getWikipediaBaseUrl() {
    return wikipediaBaseUrl;
  }

  public void setWikipediaBaseUrl(String wikipediaBaseUrl) {
    this.wikipediaBaseUrl = wikipediaBaseUrl;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public void setUserAgent(String userAgent) {
    this.userAgent = userAgent;
  }

  public int getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(int timeoutMs) {
    this.timeoutMs = timeoutMs;
  }
}
