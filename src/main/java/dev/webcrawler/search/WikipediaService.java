package dev.webcrawler.search;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Looks up article summaries through the MediaWiki action API. A single request searches for the
 * best matching article and returns its plain-text intro, limited to a number of sentences.
 */
@Service
public class WikipediaService {

  private static final Logger log = LoggerFactory.getLogger(WikipediaService.class);

  private static final Pattern LANGUAGE_CODE = Pattern.compile("[a-z]{2,3}(-[a-z]{2,8})*");

  /** MediaWiki caps {@code exsentences} at 10. */
  static final int MAX_SENTENCES = 10;

  private final RestClient restClient;
  private final SearchProperties props;

  public WikipediaService(
      @Qualifier("wikipediaRestClient") RestClient restClient, SearchProperties props) {
    this.restClient = restClient;
    this.props = props;
  }

  /**
   * Summarize the best matching article.
   *
   * @param query     search terms
   * @param sentences sentences of the intro to return, clamped to {@code [1, 10]}
   * @param language  Wikipedia language edition, e.g. {@code en}
   * @return the summary, or empty when no article matches
   * @throws IllegalArgumentException if the language code is malformed
   */
  public Optional<WikipediaSummary> summarize(String query, int sentences, String language) {
    String lang = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
    if (!LANGUAGE_CODE.matcher(lang).matches()) {
      throw new IllegalArgumentException("Invalid Wikipedia language code: " + language);
    }
    int limit = Math.max(1, Math.min(sentences, MAX_SENTENCES));

    JsonNode response =
        restClient.get().uri(buildUri(query, limit, lang)).retrieve().body(JsonNode.class);

    JsonNode pages = response == null ? null : response.path("query").path("pages");
    if (pages == null || !pages.isObject() || pages.isEmpty()) {
      log.debug("No Wikipedia article found for '{}' ({})", query, lang);
      return Optional.empty();
    }

    JsonNode best = null;
    for (Iterator<JsonNode> it = pages.elements(); it.hasNext(); ) {
      JsonNode page = it.next();
      if (best == null || page.path("index").asInt() < best.path("index").asInt()) {
        best = page;
      }
    }
    String title = best.path("title").asText("");
    String extract = best.path("extract").asText("").trim();
    String url = best.path("fullurl").asText("");
    if (extract.isEmpty()) {
      log.debug("Wikipedia article '{}' has no extract", title);
      return Optional.empty();
    }
    return Optional.of(new WikipediaSummary(query, title, extract, url));
  }

  URI buildUri(String query, int sentences, String language) {
    return UriComponentsBuilder.fromUriString(
            props.getWikipediaBaseUrl().replace("{language}", language))
        .path("/w/api.php")
        .queryParam("action", "query")
        .queryParam("format", "json")
        .queryParam("generator", "search")
        .queryParam("gsrsearch", "{query}")
        .queryParam("gsrlimit", 1)
        .queryParam("prop", "extracts|info")
        .queryParam("exintro", 1)
        .queryParam("explaintext", 1)
        .queryParam("exsentences", sentences)
        .queryParam("inprop", "url")
        .queryParam("redirects", 1)
        .encode()
        .buildAndExpand(Map.of("query", query))
        .toUri();
  }
}
