package com.clinicqueue.appointment.api.response;

import com.clinicqueue.appointment.service.NoShowRunResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NoShowRunResponse(
    boolean skipped, int found, int marked, int errors, long executionMillis) {

  public static NoShowRunResponse from(NoShowRunResult result) {
    return new NoShowRunResponse(
        result.skipped(),
        result.found(),
        result.marked(),
        result.errors(),
        result.executionMillis());
  }
}
