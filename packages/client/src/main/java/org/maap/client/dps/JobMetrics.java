package org.maap.client.dps;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Resource usage reported for a finished job.
 *
 * <p>Values are kept as the service sent them; the numeric accessors return empty for blank or
 * {@code None} values.
 */
public record JobMetrics(
    String machineType,
    String architecture,
    String machineMemorySize,
    String directorySize,
    String operatingSystem,
    String jobStartTime,
    String jobEndTime,
    String jobDurationSeconds,
    String cpuUsage,
    String cacheUsage,
    String memUsage,
    String maxMemUsage,
    String swapUsage,
    String readIoStats,
    String writeIoStats,
    String syncIoStats,
    String asyncIoStats,
    String totalIoStats) {

  public static final JobMetrics EMPTY =
      new JobMetrics(
          null, null, null, null, null, null, null, null, null, null, null, null, null, null, null,
          null, null, null);

  static JobMetrics fromMap(Map<String, String> m) {
    return new JobMetrics(
        m.get("machine_type"),
        m.get("architecture"),
        m.get("machine_memory_size"),
        m.get("directory_size"),
        m.get("operating_system"),
        m.get("job_start_time"),
        m.get("job_end_time"),
        m.get("job_duration_seconds"),
        m.get("cpu_usage"),
        m.get("cache_usage"),
        m.get("mem_usage"),
        m.get("max_mem_usage"),
        m.get("swap_usage"),
        m.get("read_io_stats"),
        m.get("write_io_stats"),
        m.get("sync_io_stats"),
        m.get("async_io_stats"),
        m.get("total_io_stats"));
  }

  public OptionalDouble durationSeconds() {
    return asDouble(jobDurationSeconds);
  }

  /** CPU time in nanoseconds. */
  public OptionalLong cpuNanos() {
    return asLong(cpuUsage);
  }

  public OptionalLong maxMemBytes() {
    return asLong(maxMemUsage);
  }

  public OptionalLong directorySizeBytes() {
    return asLong(directorySize);
  }

  static OptionalLong asLong(String value) {
    if (isMissing(value)) return OptionalLong.empty();
    try {
      return OptionalLong.of(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }

  static OptionalDouble asDouble(String value) {
    if (isMissing(value)) return OptionalDouble.empty();
    try {
      return OptionalDouble.of(Double.parseDouble(value.trim()));
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }

  private static boolean isMissing(String value) {
    return value == null || value.isBlank() || "None".equals(value.trim());
  }
}
