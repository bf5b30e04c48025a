/*
 * Where: Appointment domain model
 * What: Staff and scheduler operations with the statuses each may start from
 * Why: One table of allowed transitions instead of status checks scattered over services
 */
package com.clinicqueue.appointment.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum AppointmentAction {
  CHECK_IN("check in", EnumSet.of(AppointmentStatus.SCHEDULED)),
  COMPLETE("complete", EnumSet.of(AppointmentStatus.CHECKED_IN)),
  CANCEL("cancel", EnumSet.of(AppointmentStatus.SCHEDULED, AppointmentStatus.CHECKED_IN)),
  RESCHEDULE("reschedule", EnumSet.of(AppointmentStatus.SCHEDULED)),
  MARK_NO_SHOW("mark as no-show", EnumSet.of(AppointmentStatus.SCHEDULED));

  private final String label;
  private final Set<AppointmentStatus> allowedFrom;

  AppointmentAction(String label, Set<AppointmentStatus> allowedFrom) {
    this.label = label;
    this.allowedFrom = allowedFrom;
  }

  public String label() {
    return label;
  }

  public boolean isAllowedFrom(AppointmentStatus status) {
    return allowedFrom.contains(status);
  }

  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
