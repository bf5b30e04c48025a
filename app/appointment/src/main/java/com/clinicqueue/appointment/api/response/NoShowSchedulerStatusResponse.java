package com.clinicqueue.appointment.api.response;

import com.clinicqueue.appointment.service.NoShowSchedulerConfig;
import com.clinicqueue.appointment.service.NoShowSchedulerStats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NoShowSchedulerStatusResponse(Stats stats, Config config) {

  public static NoShowSchedulerStatusResponse of(
      NoShowSchedulerStats stats, NoShowSchedulerConfig config) {
    return new NoShowSchedulerStatusResponse(
        new Stats(
            stats.lastRun(),
            stats.nextRun(),
            stats.totalMarkedAsNoShow(),
            stats.totalErrors(),
            stats.averageExecutionMillis(),
            stats.running(),
            stats.processing()),
        new Config(config.intervalMinutes(), config.enabled(), config.graceTimeMinutes()));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Stats(
      Instant lastRun,
      Instant nextRun,
      long totalMarkedAsNoShow,
      long totalErrors,
      double averageExecutionMillis,
      boolean running,
      boolean processing) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Config(int intervalMinutes, boolean enabled, int graceTimeMinutes) {}
}
