package com.clinicqueue.appointment.api.response;

import com.clinicqueue.appointment.model.RescheduleHistoryRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RescheduleHistoryResponse(long appointmentId, List<Entry> history) {

  public static RescheduleHistoryResponse of(
      long appointmentId, List<RescheduleHistoryRecord> records) {
    return new RescheduleHistoryResponse(
        appointmentId,
        records.stream()
            .map(
                record ->
                    new Entry(
                        record.fromAppointmentId(),
                        record.toAppointmentId(),
                        record.originalScheduledAt(),
                        record.newScheduledAt(),
                        record.rescheduledById(),
                        record.reason(),
                        record.createdAt()))
            .toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Entry(
      long fromAppointmentId,
      long toAppointmentId,
      Instant originalScheduledAt,
      Instant newScheduledAt,
      long rescheduledById,
      String reason,
      Instant createdAt) {}
}
