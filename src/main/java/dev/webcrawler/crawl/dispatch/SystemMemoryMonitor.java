package dev.webcrawler.crawl.dispatch;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads host memory utilization as {@code (total - available) / total}.
 *
 * <p>On Linux the figures come from {@code MemTotal} and {@code MemAvailable} in {@code
 * /proc/meminfo}, so reclaimable page cache counts as available. Elsewhere, or when that file
 * cannot be read, the platform {@link OperatingSystemMXBean} free memory is used, and JVM heap
 * utilization as a last resort.
 */
@Component
public class SystemMemoryMonitor implements MemoryMonitor {

  private static final Logger log = LoggerFactory.getLogger(SystemMemoryMonitor.class);

  static final Path PROC_MEMINFO = Path.of("/proc/meminfo");

  private final Path meminfo;
  private final OperatingSystemMXBean osBean;

  @Autowired
  public SystemMemoryMonitor() {
    this(PROC_MEMINFO, ManagementFactory.getOperatingSystemMXBean());
  }

  SystemMemoryMonitor(Path meminfo, OperatingSystemMXBean osBean) {
    this.meminfo = meminfo;
    this.osBean = osBean;
  }

  @Override
  public double usedMemoryPercent() {
    OptionalDouble fromMeminfo = readMeminfo();
    if (fromMeminfo.isPresent()) {
      return fromMeminfo.getAsDouble();
    }
    if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
      long total = sunBean.getTotalMemorySize();
      long free = sunBean.getFreeMemorySize();
      if (total > 0) {
        return percent(total - free, total);
      }
    }
    log.debug("Physical memory size unavailable, using JVM heap utilization");
    Runtime runtime = Runtime.getRuntime();
    return percent(runtime.totalMemory() - runtime.freeMemory(), runtime.maxMemory());
  }

  private OptionalDouble readMeminfo() {
    if (!Files.isReadable(meminfo)) {
      return OptionalDouble.empty();
    }
    try {
      return parseMeminfo(Files.readAllLines(meminfo));
    } catch (IOException e) {
      log.debug("Could not read {}: {}", meminfo, e.getMessage());
      return OptionalDouble.empty();
    }
  }

  /**
   * Utilization from {@code /proc/meminfo} lines; empty when {@code MemTotal} or {@code
   * MemAvailable} is missing or malformed.
   */
  static OptionalDouble parseMeminfo(List<String> lines) {
    long total = -1;
    long available = -1;
    for (String line : lines) {
      if (line.startsWith("MemTotal:")) {
        total = kilobytes(line);
      } else if (line.startsWith("MemAvailable:")) {
        available = kilobytes(line);
      }
    }
    if (total <= 0 || available < 0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(percent(total - available, total));
  }

  private static long kilobytes(String line) {
    String[] fields = line.substring(line.indexOf(':') + 1).trim().split("\\s+");
    try {
      return Long.parseLong(fields[0]);
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  static double percent(long used, long total) {
    return Math.max(0.0, Math.min(100.0, used * 100.0 / total));
  }
}
