package com.clinicqueue.appointment.service;

import com.clinicqueue.appointment.api.InvalidSchedulerConfigurationException;
import com.clinicqueue.appointment.config.NoShowSchedulerProperties;

/** Runtime configuration of the no-show scan; replaced as a whole on update. */
public record NoShowSchedulerConfig(int intervalMinutes, boolean enabled, int graceTimeMinutes) {

  public static final int MIN_INTERVAL_MINUTES = 5;
  public static final int MAX_INTERVAL_MINUTES = 1440;
  public static final int MAX_GRACE_TIME_MINUTES = 1440;

  public static NoShowSchedulerConfig from(NoShowSchedulerProperties properties) {
    return new NoShowSchedulerConfig(
        properties.intervalMinutes(), properties.enabled(), properties.graceTimeMinutes());
  }

  /** Applies the non-null fields of {@code update} and validates the result. */
  public NoShowSchedulerConfig merge(Update update) {
    final NoShowSchedulerConfig merged =
        new NoShowSchedulerConfig(
            update.intervalMinutes() != null ? update.intervalMinutes() : intervalMinutes,
            update.enabled() != null ? update.enabled() : enabled,
            update.graceTimeMinutes() != null ? update.graceTimeMinutes() : graceTimeMinutes);
    merged.validate();
    return merged;
  }

  public void validate() {
    if (intervalMinutes < MIN_INTERVAL_MINUTES || intervalMinutes > MAX_INTERVAL_MINUTES) {
      throw new InvalidSchedulerConfigurationException(
          "interval_minutes must be between "
              + MIN_INTERVAL_MINUTES
              + " and "
              + MAX_INTERVAL_MINUTES
              + ", was "
              + intervalMinutes);
    }
    if (graceTimeMinutes < 0 || graceTimeMinutes > MAX_GRACE_TIME_MINUTES) {
      throw new InvalidSchedulerConfigurationException(
          "grace_time_minutes must be between 0 and "
              + MAX_GRACE_TIME_MINUTES
              + ", was "
              + graceTimeMinutes);
    }
  }

  public record Update(Integer intervalMinutes, Boolean enabled, Integer graceTimeMinutes) {}
}
