package com.clinicqueue.appointment.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.clinicqueue.appointment.analytics.model.QueueTimingRow;
import com.clinicqueue.appointment.analytics.model.WaitTimeSample;
import com.clinicqueue.appointment.service.AppointmentMetrics;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

class WaitTimeSampleValidatorTest {

  private static final Instant CREATED = Instant.parse("2026-03-02T09:00:00Z");

  private AppointmentMetrics metrics;
  private WaitTimeSampleValidator validator;

  @BeforeEach
  void setUp() {
    metrics = Mockito.mock(AppointmentMetrics.class);
    validator = new WaitTimeSampleValidator(metrics);
  }

  @Test
  void acceptsOrderedTimestampsAndRoundsToMinutes() {
    final Optional<WaitTimeSample> sample =
        validator.validate(row(CREATED.plusSeconds(5 * 60 + 31), CREATED.plusSeconds(20 * 60)));

    assertThat(sample).contains(new WaitTimeSample(6, 14));
    verify(metrics, never()).recordRejectedSample(ArgumentMatchers.any());
  }

  @Test
  void rejectsCallBeforeCreation() {
    final Optional<WaitTimeSample> sample =
        validator.validate(row(CREATED.minusSeconds(60), CREATED.plusSeconds(600)));

    assertThat(sample).isEmpty();
    verify(metrics).recordRejectedSample(InvalidSampleReason.CALLED_NOT_AFTER_CREATED);
  }

  @Test
  void rejectsCompletionNotAfterCall() {
    assertThat(
            WaitTimeSampleValidator.findRejection(
                CREATED, CREATED.plusSeconds(60), CREATED.plusSeconds(60)))
        .isEqualTo(InvalidSampleReason.COMPLETED_NOT_AFTER_CALLED);
  }

  @Test
  void rejectsMissingTimestamp() {
    assertThat(WaitTimeSampleValidator.findRejection(CREATED, null, CREATED))
        .isEqualTo(InvalidSampleReason.MISSING_TIMESTAMP);
  }

  @Test
  void enforcesWaitAndServiceBounds() {
    final Instant dayLater = CREATED.plusSeconds(1440 * 60);
    assertThat(
            WaitTimeSampleValidator.findRejection(CREATED, dayLater, dayLater.plusSeconds(60)))
        .isNull();
    assertThat(
            WaitTimeSampleValidator.findRejection(
                CREATED, dayLater.plusSeconds(60), dayLater.plusSeconds(120)))
        .isEqualTo(InvalidSampleReason.WAIT_TOO_LONG);

    final Instant called = CREATED.plusSeconds(60);
    assertThat(WaitTimeSampleValidator.findRejection(CREATED, called, called.plusSeconds(480 * 60)))
        .isNull();
    assertThat(WaitTimeSampleValidator.findRejection(CREATED, called, called.plusSeconds(481 * 60)))
        .isEqualTo(InvalidSampleReason.SERVICE_TOO_LONG);
  }

  private static QueueTimingRow row(Instant calledAt, Instant completedAt) {
    return new QueueTimingRow(
        1L, 10L, "Centro", 20L, "Consulta", null, null, CREATED, calledAt, completedAt);
  }
}
