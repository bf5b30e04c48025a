package com.clinicqueue.appointment.analytics.model;

/** Outcome counts over a window; rates are percentages with two decimals. */
public record AppointmentSummary(
    long totalAppointments,
    long scheduledAppointments,
    long checkedInAppointments,
    long completedAppointments,
    long cancelledAppointments,
    long noShowAppointments,
    long rescheduledAppointments,
    double attendanceRate,
    double completionRate,
    double noShowRate) {}
