package dev.webcrawler.crawl;

import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Single-URL fetch port backed by the Crawl4AI sidecar. Rendering, Markdown extraction and
 * internal/external link classification all happen in the sidecar.
 */
@Service
public class Crawl4AiClient {

    private static final Logger log = LoggerFactory.getLogger(Crawl4AiClient.class);

    private final RestClient restClient;

    public Crawl4AiClient(@Qualifier("crawl4AiRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Crawl a single URL via the Crawl4AI sidecar with a headless browser and cache bypass.
     * Retries on transient RestClientException with exponential backoff.
     *
     * @param url the URL to fetch, sent as-is
     * @return the fetch outcome; never null
     */
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${webcrawler.crawl4ai.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${webcrawler.crawl4ai.retry.delay-ms}",
                    multiplierExpression = "${webcrawler.crawl4ai.retry.multiplier}"
            )
    )
    public CrawlResult crawl(String url) {
        Crawl4AiRequest request = buildRequest(url);

        Crawl4AiResponse response = restClient.post()
                .uri("/crawl")
                .body(request)
                .retrieve()
                .body(Crawl4AiResponse.class);

        if (response == null || !response.success() || response.results().isEmpty()) {
            return CrawlResult.failed(url, "Crawl4AI returned no results for " + url);
        }

        Crawl4AiPageResult page = response.results().get(0);
        if (!page.success()) {
            return CrawlResult.failed(url, page.error_message());
        }

        String resolvedUrl = page.resolvedUrl() != null ? page.resolvedUrl() : url;
        return new CrawlResult(resolvedUrl, extractMarkdown(page.markdown()),
                page.internalLinkHrefs(), true, null);
    }

    @Recover
    CrawlResult recoverCrawl(RestClientException e, String url) {
        log.warn("Crawl4AI request failed after retries for {}: {}", url, e.getMessage());
        return CrawlResult.failed(url, e.getMessage());
    }

    /**
     * Prefer fitMarkdown (boilerplate-removed) over rawMarkdown.
     */
    private @Nullable String extractMarkdown(@Nullable Crawl4AiMarkdown markdown) {
        if (markdown == null) {
            return null;
        }
        if (markdown.fitMarkdown() != null && !markdown.fitMarkdown().isBlank()) {
            return markdown.fitMarkdown();
        }
        return markdown.rawMarkdown();
    }

    private Crawl4AiRequest buildRequest(String url) {
        return new Crawl4AiRequest(
                List.of(url),
                Map.of("type", "BrowserConfig", "params", Map.of("headless", true, "verbose", false)),
                Map.of("type", "CrawlerRunConfig", "params", Map.of(
                        "cache_mode", "bypass",
                        "stream", false
                ))
        );
    }
}
