/*
 * Where: Appointment API
 * What: Error codes carried in error responses
 * Why: Two 409s (state conflict vs. taken slot) must be distinguishable by clients
 */
package com.clinicqueue.appointment.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  INVALID_TRANSITION,
  SLOT_CONFLICT,
  POLICY_VIOLATION,
  INVALID_CONFIGURATION,
  PERSISTENCE_ERROR
}
