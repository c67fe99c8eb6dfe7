package dev.webcrawler.crawl;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the Crawl4AI sidecar, bound from {@code webcrawler.crawl4ai.*}.
 *
 * @param baseUrl             sidecar base URL (e.g. {@code http://localhost:11235})
 * @param connectTimeoutMs    TCP connection timeout in milliseconds
 * @param readTimeoutMs       response read timeout in milliseconds
 * @param maxSitemapSizeBytes sitemap documents larger than this are skipped
 * @param retry               backoff settings for transient sidecar failures
 */
@ConfigurationProperties(prefix = "webcrawler.crawl4ai")
public record Crawl4AiProperties(
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        long maxSitemapSizeBytes,
        Retry retry
) {
    public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
