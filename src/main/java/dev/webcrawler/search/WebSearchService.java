package dev.webcrawler.search;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/** Web search delegated to the Serper Google search API. */
@Service
public class WebSearchService {

  private static final Logger log = LoggerFactory.getLogger(WebSearchService.class);

  static final int MAX_RESULTS_CAP = 20;

  private final RestClient restClient;
  private final SearchProperties props;

  public WebSearchService(
      @Qualifier("serperRestClient") RestClient restClient, SearchProperties props) {
    this.restClient = restClient;
    this.props = props;
  }

  /**
   * Search the web.
   *
   * @param query      search terms
   * @param maxResults number of hits wanted, clamped to {@code [1, 20]}
   * @return organic hits in ranking order; hits without a link are dropped
   * @throws IllegalStateException if no Serper API key is configured
   */
  public List<SearchResult> search(String query, int maxResults) {
    if (!props.hasSerperApiKey()) {
      throw new IllegalStateException("Serper API key is not configured (SERPER_API_KEY)");
    }
    int limit = Math.max(1, Math.min(maxResults, MAX_RESULTS_CAP));

    SerperResponse response =
        restClient
            .post()
            .uri("/search")
            .header("X-API-KEY", props.getSerperApiKey())
            .body(Map.of("q", query, "num", limit))
            .retrieve()
            .body(SerperResponse.class);

    if (response == null) {
      log.warn("Serper returned an empty body for query '{}'", query);
      return List.of();
    }
    List<SearchResult> results =
        response.organic().stream()
            .filter(hit -> hit.link() != null && !hit.link().isBlank())
            .limit(limit)
            .map(
                hit ->
                    new SearchResult(
                        Objects.requireNonNullElse(hit.title(), ""),
                        hit.link(),
                        Objects.requireNonNullElse(hit.snippet(), "")))
            .toList();
    log.debug("Web search '{}' returned {} results", query, results.size());
    return results;
  }
}
