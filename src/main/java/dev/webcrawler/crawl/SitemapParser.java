package dev.webcrawler.crawl;

import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.List;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;

/**
 * Fetches a sitemap document and extracts its {@code loc} entries using crawler-commons.
 *
 * <p>A sitemap index yields the locations of its nested sitemaps as-is. When
 * {@code webcrawler.crawl.expand-sitemap-index} is enabled, each nested sitemap is fetched
 * instead and its page locations are returned; nesting deeper than that is never followed.
 */
@Component
public class SitemapParser {

    private static final Logger log = LoggerFactory.getLogger(SitemapParser.class);

    private final RestClient httpClient;
    private final long maxSitemapSizeBytes;
    private final boolean expandIndex;

    public SitemapParser(RestClient.Builder restClientBuilder, Crawl4AiProperties crawl4AiProps,
                         CrawlProperties crawlProps) {
        this.httpClient = restClientBuilder.clone()
                .defaultHeader(HttpHeaders.ACCEPT, "*/*")
                .build();
        this.maxSitemapSizeBytes = crawl4AiProps.maxSitemapSizeBytes();
        this.expandIndex = crawlProps.isExpandSitemapIndex();
    }

    /**
     * Fetch and parse the sitemap at the given URL.
     * Returns an empty list if the sitemap cannot be fetched or parsed.
     *
     * @param sitemapUrl absolute URL of the sitemap document
     * @return location URLs in document order
     */
    public List<String> parseUrls(String sitemapUrl) {
        try {
            AbstractSiteMap result = fetchAndParse(sitemapUrl);
            if (result == null) {
                return List.of();
            }
            if (result instanceof SiteMapIndex index) {
                List<String> nested = index.getSitemaps().stream()
                        .map(AbstractSiteMap::getUrl)
                        .map(URL::toString)
                        .toList();
                if (!expandIndex) {
                    log.info("Sitemap index {} lists {} nested sitemaps", sitemapUrl, nested.size());
                    return nested;
                }
                return nested.stream()
                        .flatMap(url -> parseNestedSitemap(url).stream())
                        .toList();
            } else if (result instanceof SiteMap siteMap) {
                return extractUrls(siteMap);
            }
        } catch (Exception e) {
            log.warn("Could not parse sitemap {}: {}", sitemapUrl, e.getMessage());
        }
        return List.of();
    }

    /**
     * Fetch sitemap content with size limit to prevent OOM on giant sitemaps.
     */
    private @Nullable AbstractSiteMap fetchAndParse(String sitemapUrl)
            throws UnknownFormatException, IOException {
        byte[] content = httpClient.get()
                .uri(sitemapUrl)
                .retrieve()
                .body(byte[].class);
        if (content == null || content.length == 0) {
            log.warn("Sitemap at {} is empty", sitemapUrl);
            return null;
        }
        if (content.length > maxSitemapSizeBytes) {
            log.warn("Sitemap at {} exceeds size limit ({} bytes > {} bytes), skipping",
                    sitemapUrl, content.length, maxSitemapSizeBytes);
            return null;
        }
        crawlercommons.sitemaps.SiteMapParser parser =
                new crawlercommons.sitemaps.SiteMapParser(false);
        return parser.parseSiteMap(content, URI.create(sitemapUrl).toURL());
    }

    private List<String> parseNestedSitemap(String sitemapUrl) {
        try {
            AbstractSiteMap result = fetchAndParse(sitemapUrl);
            if (result instanceof SiteMap siteMap) {
                return extractUrls(siteMap);
            }
            if (result instanceof SiteMapIndex) {
                log.debug("Ignoring nested sitemap index {}", sitemapUrl);
            }
        } catch (Exception e) {
            log.debug("Could not parse nested sitemap {}: {}", sitemapUrl, e.getMessage());
        }
        return List.of();
    }

    private List<String> extractUrls(SiteMap siteMap) {
        return siteMap.getSiteMapUrls().stream()
                .map(SiteMapURL::getUrl)
                .map(URL::toString)
                .toList();
    }
}
