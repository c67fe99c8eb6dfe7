package dev.webcrawler.crawl.dispatch;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised configuration for batch fetch admission control.
 *
 * <p>Properties are bound from {@code webcrawler.dispatch.*} in application.yml.
 *
 * <ul>
 *   <li>{@code memory-threshold-percent} - no new fetch is admitted while host memory utilization
 *       is at or above this value (default 70.0)
 *   <li>{@code check-interval-ms} - how often a waiting batch re-checks memory and completions
 *       (default 1000)
 *   <li>{@code worker-threads} - size of the shared fetch pool (default 32)
 * </ul>
 */
@ConfigurationProperties(prefix = "webcrawler.dispatch")
public class DispatchProperties {

  private double memoryThresholdPercent = 70.0;
  private long checkIntervalMs = 1000;
  private int workerThreads = 32;

  @PostConstruct
  void validate() {
    if (memoryThresholdPercent <= 0.0 || memoryThresholdPercent > 100.0) {
      throw new IllegalStateException(
          "webcrawler.dispatch.memory-threshold-percent must be in (0, 100], got: "
              + memoryThresholdPercent);
    }
    if (checkIntervalMs < 1) {
      throw new IllegalStateException(
          "webcrawler.dispatch.check-interval-ms must be >= 1, got: " + checkIntervalMs);
    }
    if (workerThreads < 1) {
      throw new IllegalStateException(
          "webcrawler.dispatch.worker-threads must be >= 1, got: " + workerThreads);
    }
  }

  public double getMemoryThresholdPercent() {
    return memoryThresholdPercent;
  }

  public void setMemoryThresholdPercent(double memoryThresholdPercent) {
    this.memoryThresholdPercent = memoryThresholdPercent;
  }

  public long getCheckIntervalMs() {
    return checkIntervalMs;
  }

  public void setCheckIntervalMs(long checkIntervalMs) {
    this.checkIntervalMs = checkIntervalMs;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }
}
