package dev.webcrawler.search;

/**
 * Introductory summary of the Wikipedia article that best matches a query.
 *
 * @param query   the query as given
 * @param title   article title
 * @param summary plain-text extract of the first sentences
 * @param url     canonical article URL
 */
public record WikipediaSummary(String query, String title, String summary, String url) {}
