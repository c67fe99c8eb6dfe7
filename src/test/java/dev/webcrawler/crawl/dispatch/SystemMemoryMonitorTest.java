package dev.webcrawler.crawl.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.sun.management.OperatingSystemMXBean;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SystemMemoryMonitorTest {

  @TempDir Path dir;

  @Test
  void usesAvailableRatherThanFreeMemory() throws IOException {
    Path meminfo =
        write(
            "MemTotal:       16000000 kB",
            "MemFree:          800000 kB",
            "MemAvailable:    8000000 kB",
            "Buffers:          400000 kB",
            "Cached:          6000000 kB");

    SystemMemoryMonitor monitor = new SystemMemoryMonitor(meminfo, osBean(1000, 1));

    assertThat(monitor.usedMemoryPercent()).isCloseTo(50.0, within(0.001));
  }

  @Test
  void fallsBackToOperatingSystemBeanWhenMeminfoIsMissing() {
    SystemMemoryMonitor monitor =
        new SystemMemoryMonitor(dir.resolve("absent"), osBean(1000, 250));

    assertThat(monitor.usedMemoryPercent()).isCloseTo(75.0, within(0.001));
  }

  @Test
  void fallsBackWhenMemAvailableLineIsAbsent() throws IOException {
    Path meminfo = write("MemTotal:       16000000 kB", "MemFree:         4000000 kB");

    SystemMemoryMonitor monitor = new SystemMemoryMonitor(meminfo, osBean(1000, 900));

    assertThat(monitor.usedMemoryPercent()).isCloseTo(10.0, within(0.001));
  }

  @Test
  void parsesUtilizationFromMeminfoLines() {
    assertThat(
            SystemMemoryMonitor.parseMeminfo(
                    List.of("MemTotal: 1000 kB", "MemAvailable: 300 kB"))
                .getAsDouble())
        .isCloseTo(70.0, within(0.001));
    assertThat(SystemMemoryMonitor.parseMeminfo(List.of("MemTotal: 0 kB", "MemAvailable: 0 kB")))
        .isEmpty();
    assertThat(SystemMemoryMonitor.parseMeminfo(List.of("MemTotal: n/a", "MemAvailable: 1 kB")))
        .isEmpty();
  }

  @Test
  void percentIsClampedToValidRange() {
    assertThat(SystemMemoryMonitor.percent(-10, 100)).isZero();
    assertThat(SystemMemoryMonitor.percent(150, 100)).isEqualTo(100.0);
  }

  private Path write(String... lines) throws IOException {
    return Files.write(dir.resolve("meminfo"), List.of(lines));
  }

  private static OperatingSystemMXBean osBean(long total, long free) {
    OperatingSystemMXBean bean = mock(OperatingSystemMXBean.class);
    when(bean.getTotalMemorySize()).thenReturn(total);
    when(bean.getFreeMemorySize()).thenReturn(free);
    return bean;
  }
}
