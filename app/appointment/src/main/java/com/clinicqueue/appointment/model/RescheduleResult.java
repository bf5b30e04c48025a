package com.clinicqueue.appointment.model;

public record RescheduleResult(AppointmentRecord superseded, AppointmentRecord replacement) {}
