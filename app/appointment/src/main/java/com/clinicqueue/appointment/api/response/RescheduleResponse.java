package com.clinicqueue.appointment.api.response;

import com.clinicqueue.appointment.model.RescheduleResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RescheduleResponse(AppointmentResponse previous, AppointmentResponse appointment) {

  public static RescheduleResponse from(RescheduleResult result) {
    return new RescheduleResponse(
        AppointmentResponse.from(result.superseded()),
        AppointmentResponse.from(result.replacement()));
  }
}
