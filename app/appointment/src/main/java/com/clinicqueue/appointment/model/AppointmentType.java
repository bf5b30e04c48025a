package com.clinicqueue.appointment.model;

public enum AppointmentType {
  APPOINTMENT,
  TURN,
  PUBLIC
}
