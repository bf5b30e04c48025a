/*
 * Where: Appointment configuration validation tests
 * What: Bean Validation of queue and report properties
 * Why: A bad zone or lookback must fail at startup, not on the first enqueue
 */
package com.clinicqueue.appointment.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueuePropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWhenAllFieldsValid() {
    assertThat(validator.validate(new QueueProperties(10, Duration.ofDays(30), "UTC"))).isEmpty();
    assertThat(validator.validate(new ReportProperties("America/Lima"))).isEmpty();
  }

  @Test
  void validationFailsWhenLookbackIsZero() {
    assertThat(validator.validate(new QueueProperties(10, Duration.ZERO, "UTC"))).isNotEmpty();
  }

  @Test
  void validationFailsWhenDefaultServiceMinutesIsZero() {
    assertThat(validator.validate(new QueueProperties(0, Duration.ofDays(30), "UTC")))
        .isNotEmpty();
  }

  @Test
  void validationFailsWhenZoneIsUnknown() {
    assertThat(validator.validate(new QueueProperties(10, Duration.ofDays(30), "Mars/Olympus")))
        .isNotEmpty();
    assertThat(validator.validate(new ReportProperties("Mars/Olympus"))).isNotEmpty();
    assertThat(validator.validate(new ReportProperties(" "))).isNotEmpty();
  }
}
