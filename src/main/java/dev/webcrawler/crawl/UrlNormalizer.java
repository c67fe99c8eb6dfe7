package dev.webcrawler.crawl;

/**
 * Utility class that canonicalizes URLs for visited-set membership during crawling.
 *
 * <p>Only the fragment is removed. Scheme, host, path, query and trailing slash are left exactly as
 * given, so two URLs compare equal only when they differ in the fragment alone. The normalized form
 * is bookkeeping; callers still fetch and report the URL they were given.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Remove the fragment ({@code #section}) from a URL.
     *
     * @param url the URL to normalize
     * @return the URL without its fragment, or the input unchanged if null or blank
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }
}
