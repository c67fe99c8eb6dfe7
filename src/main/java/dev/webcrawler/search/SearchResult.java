package dev.webcrawler.search;

/**
 * One organic web search hit.
 *
 * @param title   page title
 * @param url     page URL
 * @param snippet excerpt shown by the search engine
 */
public record SearchResult(String title, String url, String snippet) {}
