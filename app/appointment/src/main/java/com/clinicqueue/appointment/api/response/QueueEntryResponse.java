package com.clinicqueue.appointment.api.response;

import com.clinicqueue.appointment.model.QueueAssignment;
import com.clinicqueue.appointment.model.QueueEntryRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;

/** Position and estimate are only present right after joining the queue. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueEntryResponse(
    long id,
    long appointmentId,
    long branchId,
    long serviceId,
    LocalDate businessDate,
    int counter,
    String status,
    Instant createdAt,
    Instant calledAt,
    Instant completedAt,
    Integer position,
    Long estimatedWaitMinutes) {

  public static QueueEntryResponse from(QueueEntryRecord entry) {
    return of(entry, null, null);
  }

  public static QueueEntryResponse from(QueueAssignment assignment) {
    return of(
        assignment.entry(), assignment.position(), assignment.estimatedWaitMinutes());
  }

  private static QueueEntryResponse of(
      QueueEntryRecord entry, Integer position, Long estimatedWaitMinutes) {
    return new QueueEntryResponse(
        entry.id(),
        entry.appointmentId(),
        entry.branchId(),
        entry.serviceId(),
        entry.businessDate(),
        entry.counter(),
        entry.status().name(),
        entry.createdAt(),
        entry.calledAt(),
        entry.completedAt(),
        position,
        estimatedWaitMinutes);
  }
}
