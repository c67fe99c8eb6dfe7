package dev.webcrawler.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.webcrawler.crawl.CrawlOutcome;
import dev.webcrawler.crawl.CrawlProperties;
import dev.webcrawler.crawl.CrawlResult;
import dev.webcrawler.crawl.DeepCrawlService;
import dev.webcrawler.search.SearchResult;
import dev.webcrawler.search.WebSearchService;
import dev.webcrawler.search.WikipediaService;
import dev.webcrawler.search.WikipediaSummary;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing web retrieval as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig} as an MCP
 * tool callable through the stdio or SSE transport. Tool methods follow the structured error
 * pattern: all exceptions are caught and returned as JSON objects with {@code success: false} and
 * an {@code error} message, never thrown.
 *
 * <p>Tools: {@code crawl_single_page}, {@code deep_crawl}, {@code web_search}, {@code
 * wikipedia_search}. Spring AI publishes Java parameter names as tool argument names, so the
 * parameters are spelled in the snake_case that MCP clients send.
 *
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int DEFAULT_MAX_RESULTS = 5;
  static final int DEFAULT_SENTENCES = 3;
  static final String DEFAULT_LANGUAGE = "en";

  private final DeepCrawlService deepCrawlService;
  private final WebSearchService webSearchService;
  private final WikipediaService wikipediaService;
  private final CrawlProperties crawlProperties;
  private final ObjectMapper objectMapper;

  public McpToolService(
      DeepCrawlService deepCrawlService,
      WebSearchService webSearchService,
      WikipediaService wikipediaService,
      CrawlProperties crawlProperties,
      ObjectMapper objectMapper) {
    this.deepCrawlService = deepCrawlService;
    this.webSearchService = webSearchService;
    this.wikipediaService = wikipediaService;
    this.crawlProperties = crawlProperties;
    this.objectMapper = objectMapper;
  }

  /** Fetches one page and returns its Markdown. Does not follow links. */
  @Tool(
      name = "crawl_single_page",
      description =
          "Crawl a single web page and return its content as Markdown. "
              + "Use for quick retrieval of one page without following links.")
  public String crawlSinglePage(
      @ToolParam(description = "URL of the page to crawl") @Nullable String url) {
    try {
      if (url == null || url.isBlank()) {
        return errorJson(url, "URL must not be empty. Provide a page URL.");
      }
      CrawlResult result = deepCrawlService.crawlSinglePage(url);
      if (!result.success()) {
        String error = result.errorMessage() != null ? result.errorMessage() : "Crawl failed";
        return errorJson(url, error);
      }
      if (!result.hasContent()) {
        return errorJson(url, "No content found");
      }
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("url", result.url());
      body.put("content", result.markdown());
      return toJson(body);
    } catch (Exception e) {
      log.error("crawl_single_page failed for {}: {}", url, e.getMessage(), e);
      return errorJson(url, describe(e));
    }
  }

  /**
   * Crawls an entry URL with the strategy its shape calls for: a plaintext listing is fetched as
   * is, a sitemap is expanded into its pages, and any other page is crawled recursively through its
   * internal links.
   */
  @Tool(
      name = "deep_crawl",
      description =
          "Intelligently crawl a URL based on its type. "
              + "Sitemaps (*sitemap*.xml) are expanded and every listed page is crawled; "
              + "text files (*.txt) are retrieved directly; "
              + "regular webpages are crawled recursively through internal links up to max_depth.")
  public String deepCrawl(
      @ToolParam(description = "URL to crawl: a webpage, sitemap.xml or .txt file") @Nullable
          String url,
      @ToolParam(
              description = "Maximum link depth for recursive crawling (default 3)",
              required = false)
          @Nullable Integer max_depth,
      @ToolParam(
              description = "Maximum number of concurrent page fetches (default 10)",
              required = false)
          @Nullable Integer max_concurrency) {
    try {
      if (url == null || url.isBlank()) {
        return errorJson(url, "URL must not be empty. Provide a webpage, sitemap or text file URL.");
      }
      int depth = max_depth != null ? max_depth : crawlProperties.getDefaultMaxDepth();
      int concurrency =
          max_concurrency != null ? max_concurrency : crawlProperties.getDefaultMaxConcurrency();
      if (depth < 0) {
        return errorJson(url, "max_depth must be >= 0, got: " + depth);
      }
      if (concurrency < 1) {
        return errorJson(url, "max_concurrency must be >= 1, got: " + concurrency);
      }

      CrawlOutcome outcome = deepCrawlService.deepCrawl(url, depth, concurrency);
      return toJson(render(outcome));
    } catch (Exception e) {
      log.error("deep_crawl failed for {}: {}", url, e.getMessage(), e);
      return errorJson(url, describe(e));
    }
  }

  /** Searches the web through the configured search API. */
  @Tool(
      name = "web_search",
      description = "Search the web and return result titles, URLs and snippets.")
  public String webSearch(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Maximum number of results (1-20, default 5)", required = false)
          @Nullable Integer max_results) {
    try {
      if (query == null || query.isBlank()) {
        return searchErrorJson("Query must not be empty. Provide a search query string.");
      }
      int max = max_results != null ? max_results : DEFAULT_MAX_RESULTS;
      List<SearchResult> results = webSearchService.search(query, max);
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("query", query);
      body.put("results", results);
      return toJson(body);
    } catch (Exception e) {
      log.error("web_search failed for '{}': {}", query, e.getMessage(), e);
      return searchErrorJson(describe(e));
    }
  }

  /** Returns the intro of the Wikipedia article that best matches a query. */
  @Tool(
      name = "wikipedia_search",
      description =
          "Search Wikipedia and return a short summary of the best matching article with its URL.")
  public String wikipediaSearch(
      @ToolParam(description = "Topic to look up") @Nullable String query,
      @ToolParam(
              description = "Number of summary sentences (1-10, default 3)",
              required = false)
          @Nullable Integer sentences,
      @ToolParam(description = "Wikipedia language code (default 'en')", required = false)
          @Nullable String language) {
    try {
      if (query == null || query.isBlank()) {
        return wikipediaErrorJson(query, "Query must not be empty. Provide a topic to look up.");
      }
      int count = sentences != null ? sentences : DEFAULT_SENTENCES;
      String lang = language != null && !language.isBlank() ? language : DEFAULT_LANGUAGE;

      Optional<WikipediaSummary> summary = wikipediaService.summarize(query, count, lang);
      if (summary.isEmpty()) {
        return wikipediaErrorJson(query, "No Wikipedia article found for: " + query);
      }
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("query", query);
      body.put("title", summary.get().title());
      body.put("summary", summary.get().summary());
      body.put("url", summary.get().url());
      return toJson(body);
    } catch (Exception e) {
      log.error("wikipedia_search failed for '{}': {}", query, e.getMessage(), e);
      return wikipediaErrorJson(query, describe(e));
    }
  }

  private Map<String, Object> render(CrawlOutcome outcome) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", outcome.success());
    if (outcome.crawlType() != null) {
      body.put("crawl_type", outcome.crawlType().wireName());
    }
    body.put("url", outcome.url());
    if (outcome.success()) {
      body.put("results", outcome.results());
      body.put("pages_crawled", outcome.pagesCrawled());
      body.put("urls_crawled_preview", outcome.urlsCrawledPreview());
    } else {
      body.put("error", outcome.error());
    }
    return body;
  }

  private String errorJson(@Nullable String url, String error) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("url", url);
    body.put("error", error);
    return toJson(body);
  }

  private String searchErrorJson(String error) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("error", error);
    return toJson(body);
  }

  private String wikipediaErrorJson(@Nullable String query, String error) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("query", query);
    body.put("summary", null);
    body.put("url", null);
    body.put("error", error);
    return toJson(body);
  }

  private String toJson(Map<String, Object> body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      log.error("Could not serialize tool response: {}", e.getMessage(), e);
      return "{\"success\":false,\"error\":\"Could not serialize response\"}";
    }
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
