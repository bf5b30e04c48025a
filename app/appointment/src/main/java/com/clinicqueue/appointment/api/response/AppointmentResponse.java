package com.clinicqueue.appointment.api.response;

import com.clinicqueue.appointment.model.AppointmentRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AppointmentResponse(
    long id,
    String status,
    String type,
    long branchId,
    long serviceId,
    Long servicePointId,
    String confirmationCode,
    Instant scheduledAt,
    Instant attendedAt,
    Instant noShowMarkedAt,
    boolean autoMarkedAsNoShow,
    String cancellationReason,
    Long rescheduledFromId,
    Instant rescheduledAt,
    Instant originalScheduledAt) {

  public static AppointmentResponse from(AppointmentRecord record) {
    return new AppointmentResponse(
        record.id(),
        record.status().name(),
        record.type().name(),
        record.branchId(),
        record.serviceId(),
        record.servicePointId(),
        record.confirmationCode(),
        record.scheduledAt(),
        record.attendedAt(),
        record.noShowMarkedAt(),
        record.autoMarkedAsNoShow(),
        record.cancellationReason(),
        record.rescheduledFromId(),
        record.rescheduledAt(),
        record.originalScheduledAt());
  }
}
