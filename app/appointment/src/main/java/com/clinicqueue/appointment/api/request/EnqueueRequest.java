package com.clinicqueue.appointment.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnqueueRequest(
    @NotNull(message = "appointment_id is required") @Positive Long appointmentId,
    @Positive Long servicePointId) {}
