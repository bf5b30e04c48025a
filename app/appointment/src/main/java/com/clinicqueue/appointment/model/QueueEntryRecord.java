/*
 * Where: Queue domain model
 * What: Snapshot of one queue_entries row
 * Why: Carries the timestamps the wait-time analytics are computed from
 */
package com.clinicqueue.appointment.model;

import java.time.Instant;
import java.time.LocalDate;

public record QueueEntryRecord(
    Long id,
    long appointmentId,
    long branchId,
    long serviceId,
    LocalDate businessDate,
    int counter,
    QueueStatus status,
    Instant createdAt,
    Instant calledAt,
    Instant completedAt) {

  public QueueScope scope() {
    return new QueueScope(branchId, serviceId, businessDate);
  }
}
