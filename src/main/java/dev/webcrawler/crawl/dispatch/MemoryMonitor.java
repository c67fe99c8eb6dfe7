package dev.webcrawler.crawl.dispatch;

/**
 * Source of the memory utilization figure the dispatcher consults before admitting a fetch.
 */
@FunctionalInterface
public interface MemoryMonitor {

  /**
   * @return used memory as a percentage in {@code [0, 100]}
   */
  double usedMemoryPercent();
}
