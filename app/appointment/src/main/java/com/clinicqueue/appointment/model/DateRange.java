/*
 * Where: Reporting model
 * What: Inclusive instant window a report is computed over
 * Why: Every report query shares the same start <= end contract
 */
package com.clinicqueue.appointment.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public record DateRange(Instant start, Instant end) {

  private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

  public DateRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("start must not be after end");
    }
  }

  /** From the first instant of {@code startDate} to the last microsecond of {@code endDate}. */
  public static DateRange ofDays(LocalDate startDate, LocalDate endDate, ZoneId zone) {
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(endDate, "endDate");
    if (endDate.isBefore(startDate)) {
      throw new IllegalArgumentException("startDate must not be after endDate");
    }
    final Instant start = startDate.atStartOfDay(zone).toInstant();
    final Instant end = endDate.plusDays(1).atStartOfDay(zone).toInstant().minus(1, ChronoUnit.MICROS);
    return new DateRange(start, end);
  }

  /** Number of (partial) days covered, at least one. */
  public long dayCount() {
    final long millis = Duration.between(start, end).toMillis();
    return Math.max(1L, (long) Math.ceil(millis / (double) MILLIS_PER_DAY));
  }
}
