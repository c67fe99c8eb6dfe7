package dev.webcrawler.crawl;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of an entry URL, deciding which retrieval strategy a deep crawl uses.
 */
public enum CrawlType {
    /** Plaintext listing such as {@code llms.txt}; fetched as a single document. */
    TEXT_FILE("text_file"),
    /** Sitemap feed; its {@code loc} entries are fetched as one flat batch. */
    SITEMAP("sitemap"),
    /** Any other page; internal links are followed breadth-first. */
    WEBPAGE("webpage");

    private final String wireName;

    CrawlType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
