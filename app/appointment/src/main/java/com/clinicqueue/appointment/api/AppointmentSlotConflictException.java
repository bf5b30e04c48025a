/*
 * Where: Appointment API
 * What: The requested slot already holds a non-cancelled appointment for the same service and branch
 * Why: Reschedule must not double-book a slot
 */
package com.clinicqueue.appointment.api;

import java.time.Instant;

public class AppointmentSlotConflictException extends RuntimeException {

  public AppointmentSlotConflictException(long serviceId, long branchId, Instant scheduledAt) {
    super(
        "slot already taken: service="
            + serviceId
            + " branch="
            + branchId
            + " scheduled_at="
            + scheduledAt);
  }
}
