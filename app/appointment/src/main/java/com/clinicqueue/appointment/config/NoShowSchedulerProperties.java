/*
 * Where: Appointment service configuration binding
 * What: Startup configuration of the automatic no-show scan
 * Why: Interval and grace window differ per deployment; auto-start stays opt-in
 */
package com.clinicqueue.appointment.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "appointment.no-show")
public record NoShowSchedulerProperties(
    boolean enabled,
    boolean autoStart,
    @Min(5) @Max(1440) int intervalMinutes,
    @Min(0) @Max(1440) int graceTimeMinutes) {}
