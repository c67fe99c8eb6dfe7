package dev.webcrawler.crawl.dispatch;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Runs a batch of fetches concurrently under two admission rules: at most {@code maxConcurrency}
 * fetches in flight, and no new fetch while host memory utilization is at or above the configured
 * threshold. A waiting batch re-checks memory every {@code check-interval-ms}.
 *
 * <p>The dispatcher holds no crawl state. Admission runs on the calling thread; only the fetches
 * themselves run on the shared worker pool. Results come back in request order regardless of
 * completion order. A fetch that throws is turned into a failure result by the caller-supplied
 * mapper and never aborts the batch.
 */
@Component
public class MemoryAdaptiveDispatcher {

  private static final Logger log = LoggerFactory.getLogger(MemoryAdaptiveDispatcher.class);

  private final ExecutorService executor;
  private final MemoryMonitor memoryMonitor;
  private final double memoryThresholdPercent;
  private final long checkIntervalMs;

  @Autowired
  public MemoryAdaptiveDispatcher(DispatchProperties props, MemoryMonitor memoryMonitor) {
    this(
        Executors.newFixedThreadPool(
            props.getWorkerThreads(), new CustomizableThreadFactory("crawl-fetch-")),
        memoryMonitor,
        props.getMemoryThresholdPercent(),
        props.getCheckIntervalMs());
  }

  MemoryAdaptiveDispatcher(
      ExecutorService executor,
      MemoryMonitor memoryMonitor,
      double memoryThresholdPercent,
      long checkIntervalMs) {
    this.executor = executor;
    this.memoryMonitor = memoryMonitor;
    this.memoryThresholdPercent = memoryThresholdPercent;
    this.checkIntervalMs = checkIntervalMs;
  }

  /**
   * Fetch every URL once, honouring the concurrency ceiling and the memory threshold.
   *
   * @param urls           URLs to fetch; order determines result order
   * @param maxConcurrency ceiling on simultaneous fetches, at least 1
   * @param fetch          single-URL fetch operation
   * @param onFailure      maps a URL and the failure it raised to a result
   * @param <T>            result type
   * @return one result per URL, in request order
   */
  public <T> List<T> dispatch(
      List<String> urls,
      int maxConcurrency,
      Function<String, T> fetch,
      BiFunction<String, Throwable, T> onFailure) {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1, got: " + maxConcurrency);
    }
    if (urls.isEmpty()) {
      return List.of();
    }

    List<T> results = new ArrayList<>(Collections.nCopies(urls.size(), null));
    ExecutorCompletionService<Slot<T>> completion = new ExecutorCompletionService<>(executor);
    Map<Future<Slot<T>>, Integer> submitted = new HashMap<>();
    int next = 0;
    int inFlight = 0;

    log.debug("Dispatching {} URLs (maxConcurrency={})", urls.size(), maxConcurrency);
    try {
      while (next < urls.size() || inFlight > 0) {
        while (next < urls.size() && inFlight < maxConcurrency && admits(inFlight)) {
          int index = next++;
          String url = urls.get(index);
          submitted.put(completion.submit(() -> runFetch(index, url, fetch, onFailure)), index);
          inFlight++;
        }

        Future<Slot<T>> done = completion.poll(checkIntervalMs, TimeUnit.MILLISECONDS);
        while (done != null) {
          inFlight--;
          record(done, submitted.get(done), results, urls, onFailure);
          done = completion.poll();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Batch dispatch interrupted with {} fetches in flight", inFlight);
      submitted.keySet().forEach(future -> future.cancel(true));
      for (int i = 0; i < results.size(); i++) {
        if (results.get(i) == null) {
          results.set(i, onFailure.apply(urls.get(i), e));
        }
      }
    }

    return Collections.unmodifiableList(results);
  }

  /**
   * Admission check for one more fetch. An idle batch always admits so that a batch makes progress
   * even when memory stays above the threshold.
   */
  private boolean admits(int inFlight) {
    double used = memoryMonitor.usedMemoryPercent();
    if (used < memoryThresholdPercent) {
      return true;
    }
    if (inFlight == 0) {
      log.warn(
          "Memory at {}% (threshold {}%) with nothing in flight; admitting one fetch",
          String.format("%.1f", used),
          memoryThresholdPercent);
      return true;
    }
    log.debug("Memory at {}%, holding admission with {} in flight", used, inFlight);
    return false;
  }

  private static <T> Slot<T> runFetch(
      int index,
      String url,
      Function<String, T> fetch,
      BiFunction<String, Throwable, T> onFailure) {
    try {
      T result = fetch.apply(url);
      if (result == null) {
        return new Slot<>(index, onFailure.apply(url, new IllegalStateException("No result")));
      }
      return new Slot<>(index, result);
    } catch (RuntimeException e) {
      log.warn("Fetch failed for {}: {}", url, e.getMessage());
      return new Slot<>(index, onFailure.apply(url, e));
    }
  }

  private static <T> void record(
      Future<Slot<T>> done,
      int index,
      List<T> results,
      List<String> urls,
      BiFunction<String, Throwable, T> onFailure)
      throws InterruptedException {
    try {
      Slot<T> slot = done.get();
      results.set(slot.index(), slot.result());
    } catch (ExecutionException e) {
      // runFetch maps RuntimeExceptions itself; only Errors reach this point
      log.error("Fetch task crashed for {}", urls.get(index), e.getCause());
      results.set(index, onFailure.apply(urls.get(index), e.getCause()));
    }
  }

  @PreDestroy
  void shutdown() {
    executor.shutdownNow();
  }

  private record Slot<T>(int index, T result) {}
}
