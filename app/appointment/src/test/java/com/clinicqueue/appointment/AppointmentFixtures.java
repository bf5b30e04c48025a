package com.clinicqueue.appointment;

import com.clinicqueue.appointment.model.AppointmentRecord;
import com.clinicqueue.appointment.model.AppointmentStatus;
import com.clinicqueue.appointment.model.AppointmentType;
import com.clinicqueue.appointment.model.QueueEntryRecord;
import com.clinicqueue.appointment.model.QueueStatus;
import java.time.Instant;
import java.time.LocalDate;

/** Builders for appointment and queue rows used across tests. */
public final class AppointmentFixtures {

  public static final long BRANCH_ID = 10L;
  public static final long SERVICE_ID = 20L;
  public static final Instant CREATED_AT = Instant.parse("2026-03-02T08:00:00Z");

  private AppointmentFixtures() {}

  public static AppointmentRecord scheduled(long id, Instant scheduledAt) {
    return appointment(id, AppointmentStatus.SCHEDULED, scheduledAt);
  }

  public static AppointmentRecord appointment(
      long id, AppointmentStatus status, Instant scheduledAt) {
    return new AppointmentRecord(
        id,
        100L,
        SERVICE_ID,
        BRANCH_ID,
        null,
        AppointmentType.APPOINTMENT,
        status,
        "CONF-" + id,
        "{}",
        null,
        null,
        null,
        null,
        scheduledAt,
        status == AppointmentStatus.CHECKED_IN ? scheduledAt : null,
        null,
        false,
        null,
        null,
        null,
        null,
        null,
        null,
        CREATED_AT,
        CREATED_AT);
  }

  public static AppointmentRecord superseded(long id, Instant scheduledAt, Instant rescheduledAt) {
    final AppointmentRecord base = scheduled(id, scheduledAt);
    return new AppointmentRecord(
        base.id(),
        base.userId(),
        base.serviceId(),
        base.branchId(),
        base.servicePointId(),
        base.type(),
        base.status(),
        base.confirmationCode(),
        base.formDataJson(),
        base.guestName(),
        base.guestEmail(),
        base.guestPhone(),
        base.guestNotes(),
        base.scheduledAt(),
        null,
        null,
        false,
        null,
        null,
        7L,
        rescheduledAt,
        "patient asked",
        base.scheduledAt(),
        base.createdAt(),
        rescheduledAt);
  }

  public static AppointmentRecord publicBooking(
      long id, Long userId, String guestName, String guestEmail, Instant scheduledAt) {
    return new AppointmentRecord(
        id,
        userId,
        SERVICE_ID,
        BRANCH_ID,
        null,
        AppointmentType.PUBLIC,
        AppointmentStatus.SCHEDULED,
        "CONF-" + id,
        "{}",
        guestName,
        guestEmail,
        null,
        null,
        scheduledAt,
        null,
        null,
        false,
        null,
        null,
        null,
        null,
        null,
        null,
        CREATED_AT,
        CREATED_AT);
  }

  public static AppointmentRecord withNoShow(AppointmentRecord record, Instant markedAt) {
    return new AppointmentRecord(
        record.id(),
        record.userId(),
        record.serviceId(),
        record.branchId(),
        record.servicePointId(),
        record.type(),
        AppointmentStatus.NO_SHOW,
        record.confirmationCode(),
        record.formDataJson(),
        record.guestName(),
        record.guestEmail(),
        record.guestPhone(),
        record.guestNotes(),
        record.scheduledAt(),
        null,
        markedAt,
        true,
        null,
        record.rescheduledFromId(),
        record.rescheduledById(),
        record.rescheduledAt(),
        record.rescheduledReason(),
        record.originalScheduledAt(),
        record.createdAt(),
        markedAt);
  }

  public static QueueEntryRecord queueEntry(
      long id, long appointmentId, QueueStatus status, int counter) {
    return new QueueEntryRecord(
        id,
        appointmentId,
        BRANCH_ID,
        SERVICE_ID,
        LocalDate.of(2026, 3, 2),
        counter,
        status,
        CREATED_AT,
        status == QueueStatus.WAITING ? null : CREATED_AT.plusSeconds(300),
        status == QueueStatus.COMPLETE ? CREATED_AT.plusSeconds(900) : null);
  }
}
