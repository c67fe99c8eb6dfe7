package dev.webcrawler.crawl;

/**
 * A fetched page returned to the tool caller.
 *
 * @param url     post-fetch URL, possibly redirect-resolved
 * @param content Markdown extracted by the sidecar
 * @param success whether the fetch succeeded
 */
public record PageResult(String url, String content, boolean success) {

  static PageResult from(CrawlResult result) {
    return new PageResult(
        result.url(), result.markdown() == null ? "" : result.markdown(), result.success());
  }
}
