/*
 * Where: Appointment API
 * What: A reschedule or cancellation that is a valid transition but breaks a notice or chain limit
 * Why: Clients get the rule that failed, separate from state conflicts
 */
package com.clinicqueue.appointment.api;

public class AppointmentPolicyViolationException extends RuntimeException {

  public enum Rule {
    PAST_APPOINTMENT,
    INSUFFICIENT_RESCHEDULE_TIME,
    TOO_LATE_TO_RESCHEDULE,
    MAX_RESCHEDULES_EXCEEDED,
    INSUFFICIENT_CANCELLATION_NOTICE
  }

  private final Rule rule;

  public AppointmentPolicyViolationException(Rule rule, String message) {
    super(message);
    this.rule = rule;
  }

  public Rule rule() {
    return rule;
  }
}
