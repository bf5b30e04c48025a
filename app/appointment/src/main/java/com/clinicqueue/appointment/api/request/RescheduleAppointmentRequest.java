package com.clinicqueue.appointment.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RescheduleAppointmentRequest(
    @NotNull(message = "new_scheduled_at is required") Instant newScheduledAt,
    @Size(max = 500, message = "reason must be at most 500 characters") String reason) {}
