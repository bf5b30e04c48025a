/*
 * Where: Appointment service configuration binding
 * What: Queue estimate inputs and the zone that defines a business day
 * Why: Counters reset per local business day, not per UTC day
 */
package com.clinicqueue.appointment.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "appointment.queue")
public record QueueProperties(
    @Positive int defaultServiceMinutes,
    @NotNull Duration serviceTimeLookback,
    @NotBlank String zoneId) {

  @AssertTrue(message = "appointment.queue.service-time-lookback must be positive")
  public boolean isServiceTimeLookbackPositive() {
    return serviceTimeLookback != null
        && !serviceTimeLookback.isZero()
        && !serviceTimeLookback.isNegative();
  }

  @AssertTrue(message = "appointment.queue.zone-id must be a valid zone")
  public boolean isZoneIdValid() {
    return ZoneIds.isValid(zoneId);
  }

  public ZoneId zone() {
    return ZoneId.of(zoneId);
  }

  static final class ZoneIds {
    private ZoneIds() {}

    static boolean isValid(String zoneId) {
      if (zoneId == null || zoneId.isBlank()) {
        // blank is reported by @NotBlank
        return true;
      }
      try {
        ZoneId.of(zoneId);
        return true;
      } catch (DateTimeException ex) {
        return false;
      }
    }
  }
}
