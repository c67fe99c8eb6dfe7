package dev.webcrawler.crawl;

import dev.webcrawler.crawl.dispatch.MemoryAdaptiveDispatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Frontier traversal engine. Expands seed URLs breadth-first, one level per batch fetch, guarded by
 * a per-call visited set so that no normalized URL is fetched twice in a traversal.
 *
 * <p>Levels are strictly sequential: level N+1 is derived only after level N's batch has fully
 * completed. Within a level, fetches run concurrently through the {@link
 * MemoryAdaptiveDispatcher}.
 */
@Service
public class CrawlService {

  private static final Logger log = LoggerFactory.getLogger(CrawlService.class);

  private final Crawl4AiClient crawl4AiClient;
  private final MemoryAdaptiveDispatcher dispatcher;

  public CrawlService(Crawl4AiClient crawl4AiClient, MemoryAdaptiveDispatcher dispatcher) {
    this.crawl4AiClient = crawl4AiClient;
    this.dispatcher = dispatcher;
  }

  /**
   * Recursively crawl internal links starting from the request's seeds.
   *
   * <p>Each URL of a level is marked visited before the level is fetched, so links discovered by
   * sibling pages that point back into the same level are not rescheduled. Only internal links of
   * successful pages with content feed the next level.
   *
   * @param request seeds, depth limit and concurrency ceiling
   * @return pages with content, level by level in discovery order
   */
  public List<PageResult> traverse(CrawlRequest request) {
    TraversalContext context = new TraversalContext();
    Set<String> currentLevel = TraversalContext.normalizedLevel(request.seedUrls());

    log.info(
        "Starting traversal of {} seed URLs (maxDepth={}, maxConcurrency={})",
        currentLevel.size(),
        request.maxDepth(),
        request.maxConcurrency());

    for (int depth = 0; depth < request.maxDepth(); depth++) {
      List<String> toFetch = context.claimUnvisited(currentLevel);
      if (toFetch.isEmpty()) {
        log.debug("Frontier exhausted at depth {}", depth);
        break;
      }

      log.info("Crawling level {} ({} URLs)", depth + 1, toFetch.size());
      List<CrawlResult> outcomes = fetchAll(toFetch, request.maxConcurrency());

      Set<String> nextLevel = new LinkedHashSet<>();
      for (CrawlResult outcome : outcomes) {
        if (!outcome.hasContent()) {
          log.debug("No content from {}: {}", outcome.url(), outcome.errorMessage());
          continue;
        }
        context.addResult(PageResult.from(outcome));
        // a redirect target counts as fetched too
        context.markVisited(UrlNormalizer.normalize(outcome.url()));
        for (String link : outcome.internalLinks()) {
          String normalized = UrlNormalizer.normalize(link);
          if (normalized != null && !normalized.isBlank() && !context.isVisited(normalized)) {
            nextLevel.add(normalized);
          }
        }
      }
      currentLevel = nextLevel;
    }

    log.info(
        "Traversal complete: {} pages with content, {} URLs scheduled",
        context.results().size(),
        context.visitedCount());
    return List.copyOf(context.results());
  }

  /**
   * Fetch a flat list of URLs without following links, keeping only pages with content.
   *
   * @param urls           URLs to fetch as given
   * @param maxConcurrency ceiling on simultaneous fetches
   * @return pages with content, in request order
   */
  public List<PageResult> crawlBatch(List<String> urls, int maxConcurrency) {
    List<PageResult> pages = new ArrayList<>();
    for (CrawlResult outcome : fetchAll(urls, maxConcurrency)) {
      if (outcome.hasContent()) {
        pages.add(PageResult.from(outcome));
      } else {
        log.debug("No content from {}: {}", outcome.url(), outcome.errorMessage());
      }
    }
    log.info("Batch crawl complete: {}/{} pages with content", pages.size(), urls.size());
    return List.copyOf(pages);
  }

  private List<CrawlResult> fetchAll(List<String> urls, int maxConcurrency) {
    return dispatcher.dispatch(
        urls,
        maxConcurrency,
        crawl4AiClient::crawl,
        (url, failure) -> CrawlResult.failed(url, failure.getMessage()));
  }
}
