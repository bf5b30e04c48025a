package com.clinicqueue.appointment.analytics;

/** Why a queue timing row was left out of wait-time statistics. */
public enum InvalidSampleReason {
  MISSING_TIMESTAMP,
  CALLED_NOT_AFTER_CREATED,
  COMPLETED_NOT_AFTER_CALLED,
  NEGATIVE_DURATION,
  WAIT_TOO_LONG,
  SERVICE_TOO_LONG
}
