package com.clinicqueue.appointment.api.request;

import com.clinicqueue.appointment.service.NoShowSchedulerConfig;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Partial update; absent fields keep their current value. Ranges are checked by the scheduler. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NoShowConfigRequest(
    Integer intervalMinutes, Boolean enabled, Integer graceTimeMinutes) {

  public NoShowSchedulerConfig.Update toUpdate() {
    return new NoShowSchedulerConfig.Update(intervalMinutes, enabled, graceTimeMinutes);
  }
}
