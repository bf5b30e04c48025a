/*
 * Where: Wait-time analytics
 * What: Turns a queue timing row into wait/service minutes or rejects it
 * Why: Waits over a day or services over eight hours are stale or corrupt data, not measurements
 */
package com.clinicqueue.appointment.analytics;

import com.clinicqueue.appointment.analytics.model.QueueTimingRow;
import com.clinicqueue.appointment.analytics.model.WaitTimeSample;
import com.clinicqueue.appointment.service.AppointmentMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WaitTimeSampleValidator {

  private static final Logger logger = LoggerFactory.getLogger(WaitTimeSampleValidator.class);

  static final int MAX_WAIT_MINUTES = 24 * 60;
  static final int MAX_SERVICE_MINUTES = 8 * 60;

  private final AppointmentMetrics metrics;

  public Optional<WaitTimeSample> validate(QueueTimingRow row) {
    final Instant createdAt = row.createdAt();
    final Instant calledAt = row.calledAt();
    final Instant completedAt = row.completedAt();
    final InvalidSampleReason reason = findRejection(createdAt, calledAt, completedAt);
    if (reason != null) {
      logger.warn(
          "queue timing sample rejected queue_entry_id={} reason={} created_at={} called_at={} completed_at={}",
          row.queueEntryId(),
          reason,
          createdAt,
          calledAt,
          completedAt);
      metrics.recordRejectedSample(reason);
      return Optional.empty();
    }
    return Optional.of(
        new WaitTimeSample(roundedMinutes(createdAt, calledAt), roundedMinutes(calledAt, completedAt)));
  }

  /** Returns null when the timestamps form a usable sample. */
  @VisibleForTesting
  static InvalidSampleReason findRejection(Instant createdAt, Instant calledAt, Instant completedAt) {
    if (createdAt == null || calledAt == null || completedAt == null) {
      return InvalidSampleReason.MISSING_TIMESTAMP;
    }
    if (!calledAt.isAfter(createdAt)) {
      return InvalidSampleReason.CALLED_NOT_AFTER_CREATED;
    }
    if (!completedAt.isAfter(calledAt)) {
      return InvalidSampleReason.COMPLETED_NOT_AFTER_CALLED;
    }
    final int waitMinutes = roundedMinutes(createdAt, calledAt);
    final int serviceMinutes = roundedMinutes(calledAt, completedAt);
    if (waitMinutes < 0 || serviceMinutes < 0) {
      return InvalidSampleReason.NEGATIVE_DURATION;
    }
    if (waitMinutes > MAX_WAIT_MINUTES) {
      return InvalidSampleReason.WAIT_TOO_LONG;
    }
    if (serviceMinutes > MAX_SERVICE_MINUTES) {
      return InvalidSampleReason.SERVICE_TOO_LONG;
    }
    return null;
  }

  @VisibleForTesting
  static int roundedMinutes(Instant from, Instant to) {
    final long millis = Duration.between(from, to).toMillis();
    return (int) Math.round(millis / 60_000.0);
  }
}
