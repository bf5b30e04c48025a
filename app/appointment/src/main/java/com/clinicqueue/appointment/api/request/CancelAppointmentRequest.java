package com.clinicqueue.appointment.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CancelAppointmentRequest(
    @Size(max = 500, message = "reason must be at most 500 characters") String reason) {}
