package com.clinicqueue.appointment.api;

public class AppointmentNotFoundException extends RuntimeException {

  public AppointmentNotFoundException(long appointmentId) {
    super("appointment not found: " + appointmentId);
  }
}
