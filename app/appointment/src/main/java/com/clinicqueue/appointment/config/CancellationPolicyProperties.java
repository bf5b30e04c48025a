package com.clinicqueue.appointment.config;

import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Minimum notice for cancelling an appointment that has not been attended yet. */
@Validated
@ConfigurationProperties(prefix = "appointment.cancellation")
public record CancellationPolicyProperties(@PositiveOrZero int minHours) {

  public Duration minNotice() {
    return Duration.ofHours(minHours);
  }
}
