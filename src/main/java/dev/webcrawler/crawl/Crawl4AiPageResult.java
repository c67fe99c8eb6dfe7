package dev.webcrawler.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Per-page result within a {@link Crawl4AiResponse}: Markdown, classified links and the URL the
 * browser ended up on after redirects.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiPageResult(
    String url,
    boolean success,
    @Nullable String redirected_url,
    @Nullable Crawl4AiMarkdown markdown,
    @Nullable Map<String, List<Crawl4AiLink>> links,
    @Nullable String error_message) {
  public Crawl4AiPageResult {
    links =
        links == null
            ? Map.of()
            : links.entrySet().stream()
                .collect(
                    Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        e -> e.getValue() == null ? List.of() : List.copyOf(e.getValue())));
  }

  /** Hrefs of the links Crawl4AI classified as internal to the crawled site. */
  public List<String> internalLinkHrefs() {
    if (links == null) {
      return List.of();
    }
    return links.getOrDefault("internal", List.of()).stream()
        .map(Crawl4AiLink::href)
        .filter(Objects::nonNull)
        .toList();
  }

  /** The post-fetch URL: the redirect target when present, else the crawled URL. */
  public String resolvedUrl() {
    if (redirected_url != null && !redirected_url.isBlank()) {
      return redirected_url;
    }
    return url;
  }
}
