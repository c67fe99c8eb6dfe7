package dev.webcrawler.crawl;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Decides the {@link CrawlType} of an entry URL by inspecting its path and query. No network
 * access; every input, including null and malformed strings, maps to exactly one type.
 */
@Component
public class UrlClassifier {

  private static final String SITEMAP_MARKER = "sitemap";
  private static final String XML_SUFFIX = ".xml";

  private final List<String> textFileSuffixes;
  private final @Nullable Pattern sitemapPattern;

  public UrlClassifier(CrawlProperties props) {
    this.textFileSuffixes =
        props.getTextFileSuffixes().stream()
            .filter(suffix -> suffix != null && !suffix.isBlank())
            .map(suffix -> suffix.toLowerCase(Locale.ROOT))
            .toList();
    String pattern = props.getSitemapPattern();
    this.sitemapPattern =
        pattern == null || pattern.isBlank()
            ? null
            : Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
  }

  /**
   * Classify a URL. Plaintext suffixes win over sitemap detection; anything else is a webpage.
   *
   * @param url the entry URL as given by the caller
   * @return the crawl type, never null
   */
  public CrawlType classify(@Nullable String url) {
    if (url == null || url.isBlank()) {
      return CrawlType.WEBPAGE;
    }
    String withoutFragment = UrlNormalizer.normalize(url.trim());
    int queryStart = withoutFragment.indexOf('?');
    String beforeQuery = queryStart < 0 ? withoutFragment : withoutFragment.substring(0, queryStart);
    String query = queryStart < 0 ? "" : withoutFragment.substring(queryStart + 1);
    String path = extractPath(beforeQuery).toLowerCase(Locale.ROOT);

    for (String suffix : textFileSuffixes) {
      if (path.endsWith(suffix)) {
        return CrawlType.TEXT_FILE;
      }
    }
    if (path.contains(SITEMAP_MARKER) && path.endsWith(XML_SUFFIX)) {
      return CrawlType.SITEMAP;
    }
    if (sitemapPattern != null
        && (sitemapPattern.matcher(path).find() || sitemapPattern.matcher(query).find())) {
      return CrawlType.SITEMAP;
    }
    return CrawlType.WEBPAGE;
  }

  /** Path component of an absolute or relative URL without query and fragment. */
  private static String extractPath(String url) {
    int schemeSeparator = url.indexOf("://");
    if (schemeSeparator < 0) {
      return url;
    }
    int pathStart = url.indexOf('/', schemeSeparator + 3);
    return pathStart < 0 ? "" : url.substring(pathStart);
  }
}
