/*
 * Where: Appointment service configuration binding
 * What: Notice period and chain length limits applied to reschedules
 */
package com.clinicqueue.appointment.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "appointment.reschedule")
public record ReschedulePolicyProperties(@PositiveOrZero int minHours, @Positive int maxPerChain) {

  public Duration minNotice() {
    return Duration.ofHours(minHours);
  }
}
