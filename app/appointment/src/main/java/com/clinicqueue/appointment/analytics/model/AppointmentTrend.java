package com.clinicqueue.appointment.analytics.model;

import java.time.LocalDate;

public record AppointmentTrend(
    LocalDate date,
    long totalAppointments,
    long completedAppointments,
    long cancelledAppointments,
    long noShowAppointments,
    double attendanceRate) {}
