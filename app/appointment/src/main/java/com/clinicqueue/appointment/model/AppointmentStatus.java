/*
 * Where: Appointment domain model
 * What: Lifecycle states of an appointment
 * Why: Keep the persisted status and the transition rules on the same vocabulary
 */
package com.clinicqueue.appointment.model;

public enum AppointmentStatus {
  SCHEDULED,
  CHECKED_IN,
  COMPLETED,
  CANCELLED,
  NO_SHOW;

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == NO_SHOW;
  }
}
