/*
 * Where: Appointment service configuration binding
 * What: Zone used to turn report dates into instants and to bucket hours and days
 * Why: Reports are read in branch local time
 */
package com.clinicqueue.appointment.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "appointment.report")
public record ReportProperties(@NotBlank String zoneId) {

  @AssertTrue(message = "appointment.report.zone-id must be a valid zone")
  public boolean isZoneIdValid() {
    return QueueProperties.ZoneIds.isValid(zoneId);
  }

  public ZoneId zone() {
    return ZoneId.of(zoneId);
  }
}
