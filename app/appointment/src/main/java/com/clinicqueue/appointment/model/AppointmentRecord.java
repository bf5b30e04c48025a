/*
 * Where: Appointment domain model
 * What: Snapshot of one appointments row
 * Why: Shared by lifecycle transitions, the no-show scan and the API layer
 */
package com.clinicqueue.appointment.model;

import java.time.Instant;

public record AppointmentRecord(
    Long id,
    Long userId,
    long serviceId,
    long branchId,
    Long servicePointId,
    AppointmentType type,
    AppointmentStatus status,
    String confirmationCode,
    String formDataJson,
    String guestName,
    String guestEmail,
    String guestPhone,
    String guestNotes,
    Instant scheduledAt,
    Instant attendedAt,
    Instant noShowMarkedAt,
    boolean autoMarkedAsNoShow,
    String cancellationReason,
    Long rescheduledFromId,
    Long rescheduledById,
    Instant rescheduledAt,
    String rescheduledReason,
    Instant originalScheduledAt,
    Instant createdAt,
    Instant updatedAt) {

  /** A row replaced by a reschedule keeps SCHEDULED but is closed to every further transition. */
  public boolean isSuperseded() {
    return rescheduledAt != null;
  }

  public Instant firstScheduledAt() {
    return originalScheduledAt != null ? originalScheduledAt : scheduledAt;
  }

  /** PUBLIC bookings carry guest contact instead of a user; other types are tied to a user or a walk-in. */
  public boolean hasConsistentContact() {
    if (type != AppointmentType.PUBLIC) {
      return true;
    }
    return userId == null && hasText(guestName) && hasText(guestEmail);
  }

  /**
   * Builds the row that continues this appointment's chain at {@code newScheduledAt}. Booking data
   * is copied; attendance, no-show and cancellation state start empty.
   */
  public AppointmentRecord rescheduledTo(
      Instant newScheduledAt, long actorId, String reason, Instant now) {
    return new AppointmentRecord(
        null,
        userId,
        serviceId,
        branchId,
        servicePointId,
        type,
        AppointmentStatus.SCHEDULED,
        confirmationCode,
        formDataJson,
        guestName,
        guestEmail,
        guestPhone,
        guestNotes,
        newScheduledAt,
        null,
        null,
        false,
        null,
        id,
        actorId,
        null,
        reason,
        firstScheduledAt(),
        now,
        now);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
