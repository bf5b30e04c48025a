/*
 * Where: Appointment API
 * What: A lifecycle or queue operation was requested from a state that does not allow it
 * Why: Maps to 409 so staff clients can refresh and retry against the current state
 */
package com.clinicqueue.appointment.api;

public class InvalidTransitionException extends RuntimeException {

  public InvalidTransitionException(String message) {
    super(message);
  }
}
